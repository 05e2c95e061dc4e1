package com.phillippitts.tunemerge.service.health;

import com.phillippitts.tunemerge.service.source.MetadataSource;
import com.phillippitts.tunemerge.service.source.Source;
import com.phillippitts.tunemerge.service.source.SourceCapabilities;
import com.phillippitts.tunemerge.service.source.SourceManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for registered sources.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: at least one search-capable source is registered</li>
 *   <li>DOWN: no source can answer a search</li>
 * </ul>
 *
 * <p>Details list every source key with its capabilities. Exposed via /actuator/health.
 */
@Component
public class SourceHealthIndicator implements HealthIndicator {

    private final SourceManager sourceManager;

    public SourceHealthIndicator(SourceManager sourceManager) {
        this.sourceManager = sourceManager;
    }

    @Override
    public Health health() {
        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        boolean searchable = false;
        for (Source source : sourceManager.getAllSources()) {
            capabilities.put(source.getType().key(), SourceCapabilities.describe(source));
            searchable |= SourceCapabilities.hasSearchCapability(source);
        }
        for (MetadataSource source : sourceManager.getAllMetadataSources()) {
            capabilities.put(source.getType().key(), SourceCapabilities.describe(source));
        }

        Health.Builder builder = searchable
                ? Health.up().withDetail("status", "Search available")
                : Health.down().withDetail("status", "No search-capable source registered");
        return builder
                .withDetail("sources", capabilities)
                .withDetail("metadataSources", sourceManager.getAllMetadataSources().size())
                .build();
    }
}
