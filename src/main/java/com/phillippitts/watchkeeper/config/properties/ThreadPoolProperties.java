package com.phillippitts.watchkeeper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The control loop is a single scheduler thread and is not tunable. The stream pool runs
 * one pump per bound output descriptor (two per live child process), so its maximum bounds
 * how many children can be streamed at once.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private StreamPoolProperties stream = new StreamPoolProperties();

    public StreamPoolProperties getStream() {
        return stream;
    }

    public void setStream(StreamPoolProperties stream) {
        this.stream = stream;
    }

    /**
     * Output pump pool configuration.
     */
    public static class StreamPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 512;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "stream-pump-";

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
