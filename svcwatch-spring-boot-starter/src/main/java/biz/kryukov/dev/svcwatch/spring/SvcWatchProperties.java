package biz.kryukov.dev.svcwatch.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for svcwatch via application.yml / application.properties.
 *
 * <pre>
 * svcwatch:
 *   interval: 30s
 *   probe-timeout: 5s
 *   targets:
 *     nas:
 *       url: https://nas.local
 *       api-type: qbittorrent
 *       username: admin
 *       password: ${NAS_PASSWORD}
 *     media:
 *       url: https://media.local
 *       api-key: ${MEDIA_KEY}
 * </pre>
 */
@ConfigurationProperties(prefix = "svcwatch")
public class SvcWatchProperties {

    private boolean enabled = true;
    private Duration interval;
    private Duration initialDelay;
    private Duration probeTimeout;
    private Duration scanTimeout;
    private Duration authTimeout;
    private Duration requestTimeout;
    private Integer historySize;
    private String userAgent;
    private Integer workers;
    private Map<String, TargetProperties> targets = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getScanTimeout() {
        return scanTimeout;
    }

    public void setScanTimeout(Duration scanTimeout) {
        this.scanTimeout = scanTimeout;
    }

    public Duration getAuthTimeout() {
        return authTimeout;
    }

    public void setAuthTimeout(Duration authTimeout) {
        this.authTimeout = authTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Integer getHistorySize() {
        return historySize;
    }

    public void setHistorySize(Integer historySize) {
        this.historySize = historySize;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Integer getWorkers() {
        return workers;
    }

    public void setWorkers(Integer workers) {
        this.workers = workers;
    }

    public Map<String, TargetProperties> getTargets() {
        return targets;
    }

    public void setTargets(Map<String, TargetProperties> targets) {
        this.targets = targets;
    }

    public static class TargetProperties {
        private String url;
        private String apiUrl;
        private String apiType;
        private String authEndpoint;
        private String username;
        private String password;
        private String apiKey;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiType() {
            return apiType;
        }

        public void setApiType(String apiType) {
            this.apiType = apiType;
        }

        public String getAuthEndpoint() {
            return authEndpoint;
        }

        public void setAuthEndpoint(String authEndpoint) {
            this.authEndpoint = authEndpoint;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
