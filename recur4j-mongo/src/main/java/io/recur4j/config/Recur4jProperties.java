package io.recur4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for recur4j.
 */
@ConfigurationProperties(prefix = "recur4j")
public class Recur4jProperties {
    private boolean enabled = true;
    private String defaultTimezone = "UTC"; // used when a job names no zone
    private Duration onceFallbackDelay = Duration.ofMinutes(1);
    private int maxResponseBodyLength = 500;
    private int recentRunsLimit = 300;
    private boolean ensureIndexesOnStartup = false;
    private final Executor executor = new Executor();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public Duration getOnceFallbackDelay() {
        return onceFallbackDelay;
    }

    public void setOnceFallbackDelay(Duration onceFallbackDelay) {
        this.onceFallbackDelay = onceFallbackDelay;
    }

    public int getMaxResponseBodyLength() {
        return maxResponseBodyLength;
    }

    public void setMaxResponseBodyLength(int maxResponseBodyLength) {
        this.maxResponseBodyLength = maxResponseBodyLength;
    }

    public int getRecentRunsLimit() {
        return recentRunsLimit;
    }

    public void setRecentRunsLimit(int recentRunsLimit) {
        this.recentRunsLimit = recentRunsLimit;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * Control API of the executor process.
     */
    public static class Executor {
        private String controlUrl = "http://127.0.0.1:5055/run_immediate";
        private String token;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);

        public String getControlUrl() {
            return controlUrl;
        }

        public void setControlUrl(String controlUrl) {
            this.controlUrl = controlUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
