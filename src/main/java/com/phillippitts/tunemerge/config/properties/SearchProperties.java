package com.phillippitts.tunemerge.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tunemerge.search")
public class SearchProperties {

    /** Releases requested from each metadata source by an aggregate search. */
    @Min(1)
    private final int metadataLimit;

    /** Releases requested from each metadata source when enriching a single album. */
    @Min(1)
    private final int enrichmentLimit;

    @ConstructorBinding
    public SearchProperties(Integer metadataLimit, Integer enrichmentLimit) {
        this.metadataLimit = requirePositive(metadataLimit == null ? 10 : metadataLimit,
                "tunemerge.search.metadata-limit");
        this.enrichmentLimit = requirePositive(enrichmentLimit == null ? 1 : enrichmentLimit,
                "tunemerge.search.enrichment-limit");
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1");
        }
        return value;
    }

    public int getMetadataLimit() {
        return metadataLimit;
    }

    public int getEnrichmentLimit() {
        return enrichmentLimit;
    }
}
