package com.skillforge.engine.store;

import com.skillforge.engine.model.SkillMetadata;

/** A store hit with the engine's raw relevance score. */
public record ScoredSkill(SkillMetadata metadata, double score) {}
