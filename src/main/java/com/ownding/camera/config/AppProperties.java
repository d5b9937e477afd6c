package com.ownding.camera.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Registry registry = new Registry();
    private final Feeds feeds = new Feeds();

    public Registry getRegistry() {
        return registry;
    }

    public Feeds getFeeds() {
        return feeds;
    }

    public static class Registry {
        /** A camera whose last heartbeat is older than this is offline. */
        @NotNull
        private Duration heartbeatTimeout = Duration.ofSeconds(60);
        @Min(1)
        private int defaultPageSize = 20;
        @Min(1)
        private int maxPageSize = 100;

        public Duration getHeartbeatTimeout() {
            return heartbeatTimeout;
        }

        public void setHeartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    public static class Feeds {
        @Min(1)
        @Max(65535)
        private int rtspPort = 554;
        @Min(1)
        @Max(65535)
        private int httpPort = 8080;

        public int getRtspPort() {
            return rtspPort;
        }

        public void setRtspPort(int rtspPort) {
            this.rtspPort = rtspPort;
        }

        public int getHttpPort() {
            return httpPort;
        }

        public void setHttpPort(int httpPort) {
            this.httpPort = httpPort;
        }
    }
}
