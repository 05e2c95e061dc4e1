package com.phillippitts.tunemerge.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tunemerge.matcher")
public class MatcherProperties {

    /**
     * Minimum overall similarity (0..1) for two releases to be merged without an exact
     * fingerprint match. Raising it makes fuzzy merges rarer.
     */
    @Min(0)
    @Max(1)
    private final double similarityThreshold;

    @ConstructorBinding
    public MatcherProperties(Double similarityThreshold) {
        double t = similarityThreshold == null ? 0.85 : similarityThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("tunemerge.matcher.similarity-threshold must be in [0,1]");
        }
        this.similarityThreshold = t;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }
}
