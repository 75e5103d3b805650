package com.policysonar;

import io.github.cdimascio.dotenv.Dotenv;

import java.time.Duration;

/**
 * SonarConfig - Runtime settings read from the environment or a local .env file.
 */
public class SonarConfig {
    public final String sonarApiKey;
    public final String sonarBaseUrl;
    public final String indicatorBaseUrl;
    public final int embeddingCacheSize;
    public final double similarityThreshold;
    public final int similarityBatchSize;
    public final Duration monitorTimeout;
    public final String corpusIndexPath;
    public final boolean rebuildIndexOnStart;

    public SonarConfig() {
        this(Dotenv.configure().ignoreIfMissing().load());
    }

    public SonarConfig(Dotenv d) {
        this.sonarApiKey = d.get("SONAR_API_KEY", "");
        this.sonarBaseUrl = d.get("SONAR_BASE_URL", "https://api.policysonar.com/v1");
        this.indicatorBaseUrl = d.get("INDICATOR_BASE_URL", "https://api.policysonar.com/v1");
        this.embeddingCacheSize = Integer.parseInt(d.get("EMBED_CACHE_SIZE", "2048"));
        this.similarityThreshold = Double.parseDouble(d.get("SIMILARITY_THRESHOLD", "0.5"));
        this.similarityBatchSize = Integer.parseInt(d.get("SIMILARITY_BATCH_SIZE", "50"));
        this.monitorTimeout = Duration.ofMillis(Long.parseLong(d.get("MONITOR_TIMEOUT_MS", "10000")));
        this.corpusIndexPath = d.get("CORPUS_INDEX_PATH", "target/policy-index");
        this.rebuildIndexOnStart = Boolean.parseBoolean(d.get("REBUILD_INDEX_ON_START", "false"));
    }

    @Override
    public String toString() {
        return String.format("SonarConfig{sonarUrl='%s', indicatorUrl='%s', apiKey=%s, cache=%d, threshold=%.2f, " +
                "batch=%d, timeout=%dms, index='%s', rebuild=%s}",
            sonarBaseUrl, indicatorBaseUrl, sonarApiKey.isEmpty() ? "missing" : "present", embeddingCacheSize,
            similarityThreshold, similarityBatchSize, monitorTimeout.toMillis(), corpusIndexPath, rebuildIndexOnStart);
    }
}
