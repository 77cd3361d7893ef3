package dev.matchengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.matchengine.model.EntityKind;
import dev.matchengine.repository.EntityRepository;
import dev.matchengine.repository.PoolFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityDataConfigTest {

    private EntityDataConfig entityDataConfig;
    private MatchingConfig matchingConfig;

    @BeforeEach
    void setUp() {
        entityDataConfig = new EntityDataConfig();
        matchingConfig = new MatchingConfig();
    }

    private EntityRepository load() {
        return entityDataConfig.entityRepository(matchingConfig, new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    @DisplayName("Should start empty when the data file is missing")
    void shouldStartEmptyWithoutFile() {
        matchingConfig.setDataFile("file:/nonexistent/entities.json");

        assertThat(load().queryPool("tenant-a", PoolFilter.of(EntityKind.JOB, 0))).isEmpty();
    }

    @Test
    @DisplayName("Should load the classpath fixture")
    void shouldLoadClasspathFile() {
        matchingConfig.setDataFile("classpath:fixtures/entities.json");

        assertThat(load().findById("tenant-a", EntityKind.JOB, "j1")).isPresent();
    }

    @Test
    @DisplayName("Should fail on a malformed data file")
    void shouldFailOnMalformedFile(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("entities.json"), "{\"candidates\": [");
        matchingConfig.setDataFile(broken.toUri().toString());

        assertThatThrownBy(this::load).isInstanceOf(IllegalStateException.class);
    }
}
