package com.skillforge.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillEngineApplication.class, args);
    }
}
