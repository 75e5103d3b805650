package com.policysonar;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SonarConfigTest {

    private static Dotenv env(Map<String, String> values) {
        return mock(Dotenv.class, invocation -> values.getOrDefault(
            invocation.getArgument(0), invocation.getArgument(1)));
    }

    @Test
    void shouldFallBackToDefaults() {
        SonarConfig config = new SonarConfig(env(Map.of()));

        assertThat(config.sonarApiKey).isEmpty();
        assertThat(config.embeddingCacheSize).isEqualTo(2048);
        assertThat(config.similarityThreshold).isEqualTo(0.5);
        assertThat(config.similarityBatchSize).isEqualTo(50);
        assertThat(config.monitorTimeout).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.corpusIndexPath).isEqualTo("target/policy-index");
        assertThat(config.rebuildIndexOnStart).isFalse();
    }

    @Test
    void shouldReadOverridesAndHideKeyInToString() {
        SonarConfig config = new SonarConfig(env(Map.of(
            "SONAR_API_KEY", "top-secret",
            "EMBED_CACHE_SIZE", "128",
            "MONITOR_TIMEOUT_MS", "2500",
            "REBUILD_INDEX_ON_START", "true")));

        assertThat(config.sonarApiKey).isEqualTo("top-secret");
        assertThat(config.embeddingCacheSize).isEqualTo(128);
        assertThat(config.monitorTimeout).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.rebuildIndexOnStart).isTrue();
        assertThat(config.toString()).doesNotContain("top-secret").contains("apiKey=present");
    }
}
