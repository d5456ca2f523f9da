package com.skillforge.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillforge.engine.store.ElasticsearchSkillStore;
import com.skillforge.engine.store.InMemorySkillStore;
import com.skillforge.engine.store.SkillStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans: the wall clock and the skill store backend.
 *
 * {@code skillforge.store.type} selects the backend:
 * <ul>
 *   <li>{@code in-memory} (default): process-local maps, lost on restart</li>
 *   <li>{@code elasticsearch}: two indices on an Elasticsearch cluster with a
 *       semantic_text field for similarity search</li>
 * </ul>
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "skillforge.store.type", havingValue = "in-memory", matchIfMissing = true)
    public SkillStore inMemorySkillStore(
            @Value("${skillforge.store.metadata-index:agent_skills}") String metadataIndex,
            @Value("${skillforge.store.files-index:agent_skill_files}") String filesIndex) {
        log.info("Using in-memory skill store ({}, {})", metadataIndex, filesIndex);
        return new InMemorySkillStore(metadataIndex, filesIndex);
    }

    @Bean
    @ConditionalOnProperty(name = "skillforge.store.type", havingValue = "elasticsearch")
    public SkillStore elasticsearchSkillStore(
            @Value("${skillforge.elasticsearch.url:http://localhost:9200}") String url,
            @Value("${skillforge.elasticsearch.api-key:}") String apiKey,
            @Value("${skillforge.elasticsearch.inference-id:.elser-2-elasticsearch}") String inferenceId,
            @Value("${skillforge.store.metadata-index:agent_skills}") String metadataIndex,
            @Value("${skillforge.store.files-index:agent_skill_files}") String filesIndex,
            ObjectMapper objectMapper) {
        log.info("Using Elasticsearch skill store at {} ({}, {})", url, metadataIndex, filesIndex);
        return new ElasticsearchSkillStore(url, apiKey, metadataIndex, filesIndex, inferenceId, objectMapper);
    }
}
