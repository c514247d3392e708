package io.github.drompincen.restochat.persistence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStore;
import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStoreFactory;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.persistence.schema.SchemaInitializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class PersistenceConfig {

    @Bean
    SchemaInitializer schemaInitializer(JdbcTemplate jdbcTemplate) {
        return new SchemaInitializer(jdbcTemplate);
    }

    @Bean(destroyMethod = "close")
    CheckpointStore checkpointStore(SchemaInitializer schemaInitializer, JdbcTemplate jdbcTemplate,
                                    ObjectMapper objectMapper) {
        return CheckpointStoreFactory.open(schemaInitializer, jdbcTemplate, objectMapper);
    }

    @Bean
    @DependsOn("checkpointStore")
    MemoryRepository memoryRepository(JdbcTemplate jdbcTemplate) {
        return new MemoryRepository(jdbcTemplate);
    }
}
