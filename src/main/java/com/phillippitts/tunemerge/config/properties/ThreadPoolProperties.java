package com.phillippitts.tunemerge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Source calls are blocking network requests, so the pool is sized for I/O wait rather
 * than CPU count. Adjust {@code threadpool.source.*} to the number of registered sources.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private SourcePoolProperties source = new SourcePoolProperties();

    public SourcePoolProperties getSource() {
        return source;
    }

    public void setSource(SourcePoolProperties source) {
        this.source = source;
    }

    /**
     * Source executor pool configuration.
     */
    public static class SourcePoolProperties {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 50;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "source-pool-";

        @AssertTrue(message = "threadpool.source.max-pool-size must be >= core-pool-size")
        public boolean isMaxPoolSizeAtLeastCore() {
            return maxPoolSize >= corePoolSize;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
