package dev.matchengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.matchengine.repository.EntityDocument;
import dev.matchengine.repository.EntityRepository;
import dev.matchengine.repository.InMemoryEntityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Configuration for loading the entity store from the data file.
 */
@Slf4j
@Configuration
public class EntityDataConfig {

    @Bean
    public EntityRepository entityRepository(MatchingConfig matchingConfig, ResourceLoader resourceLoader,
                                             ObjectMapper objectMapper) {
        String location = matchingConfig.getDataFile();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Entity data file {} not found. Starting with an empty entity store.", location);
            return new InMemoryEntityRepository();
        }

        try (InputStream in = resource.getInputStream()) {
            EntityDocument document = objectMapper.readValue(in, EntityDocument.class);
            InMemoryEntityRepository repository = new InMemoryEntityRepository(document);
            log.info("Loaded {} entities from {}", repository.size(), location);
            return repository;
        } catch (IOException e) {
            log.error("Failed to load entity data from {}. Ensure it matches the required structure.", location, e);
            throw new IllegalStateException("Could not load entity data", e);
        }
    }
}
