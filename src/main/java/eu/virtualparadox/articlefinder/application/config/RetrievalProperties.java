package eu.virtualparadox.articlefinder.application.config;

import eu.virtualparadox.articlefinder.rag.fusion.FusionSettings;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Ranking and execution tunables, bound from {@code articlefinder.retrieval.*}.
 * <p>The fusion weights are deployment defaults, not tuned constants.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "articlefinder.retrieval")
@Getter @Setter
public class RetrievalProperties {

    private double alpha = 0.4;
    private double semanticThreshold = 0.0;
    private double overlapPenalty = 0.2;
    private double exactMatchBonus = 0.2;

    /** Candidates requested from the vector index per query. */
    private int semanticTopK = 50;
    private int defaultTopK = 5;

    /** Ranked chunks must score strictly above this to be returned. */
    private double minScore = 0.0;

    private int excerptLength = 500;
    private boolean highlightMatches = false;

    /** Upper bound for the lexical, embedding and vector calls of one query. */
    private Duration capabilityTimeout = Duration.ofSeconds(5);

    /** Threads of the capability pool; {@code 0} means one per available processor. */
    private int executorPoolSize = 0;

    @PostConstruct
    public void validate() {
        toFusionSettings();
        if (semanticTopK <= 0) {
            throw new IllegalArgumentException("semanticTopK must be > 0");
        }
        if (defaultTopK <= 0) {
            throw new IllegalArgumentException("defaultTopK must be > 0");
        }
        if (excerptLength <= 0) {
            throw new IllegalArgumentException("excerptLength must be > 0");
        }
        if (Double.isNaN(minScore)) {
            throw new IllegalArgumentException("minScore must be a number");
        }
        if (capabilityTimeout == null || capabilityTimeout.isZero() || capabilityTimeout.isNegative()) {
            throw new IllegalArgumentException("capabilityTimeout must be positive");
        }
        if (executorPoolSize < 0) {
            throw new IllegalArgumentException("executorPoolSize must be >= 0");
        }
    }

    public FusionSettings toFusionSettings() {
        return new FusionSettings(alpha, semanticThreshold, overlapPenalty, exactMatchBonus);
    }

    public int effectivePoolSize() {
        return executorPoolSize > 0 ? executorPoolSize : Runtime.getRuntime().availableProcessors();
    }
}
