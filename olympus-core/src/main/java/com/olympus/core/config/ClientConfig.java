package com.olympus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Client configuration: HTTP pipeline and real-time channel settings.
 * Loaded from YAML, with API_URL / WS_URL environment overrides.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientConfig {

    public static final String API_URL_ENV = "API_URL";
    public static final String WS_URL_ENV = "WS_URL";

    private ApiConfig api = new ApiConfig();
    private RealtimeConfig realtime = new RealtimeConfig();

    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public RealtimeConfig getRealtime() { return realtime; }
    public void setRealtime(RealtimeConfig realtime) { this.realtime = realtime; }

    /**
     * Load config from a YAML file. A missing file yields defaults.
     * Environment overrides are applied on top.
     */
    public static ClientConfig load(Path path) throws IOException {
        return load(path, System.getenv());
    }

    static ClientConfig load(Path path, Map<String, String> env) throws IOException {
        ClientConfig config;
        if (!Files.exists(path)) {
            config = new ClientConfig();
        } else {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(path.toFile(), ClientConfig.class);
        }
        config.applyOverrides(env);
        return config;
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".olympus", "client.yaml");
    }

    void applyOverrides(Map<String, String> env) {
        String apiUrl = env.get(API_URL_ENV);
        if (apiUrl != null && !apiUrl.isBlank()) {
            api.setBaseUrl(apiUrl);
        }
        String wsUrl = env.get(WS_URL_ENV);
        if (wsUrl != null && !wsUrl.isBlank()) {
            realtime.setUrl(wsUrl);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiConfig {
        private String baseUrl = "http://localhost:8081/api/v1";
        private String refreshPath = "/auth/refresh";
        private long connectTimeoutMillis = 30_000;
        private long readTimeoutMillis = 30_000;
        private long writeTimeoutMillis = 30_000;
        private boolean logBodies;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getRefreshPath() { return refreshPath; }
        public void setRefreshPath(String refreshPath) { this.refreshPath = refreshPath; }

        public long getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(long v) { this.connectTimeoutMillis = v; }

        public long getReadTimeoutMillis() { return readTimeoutMillis; }
        public void setReadTimeoutMillis(long v) { this.readTimeoutMillis = v; }

        public long getWriteTimeoutMillis() { return writeTimeoutMillis; }
        public void setWriteTimeoutMillis(long v) { this.writeTimeoutMillis = v; }

        public boolean isLogBodies() { return logBodies; }
        public void setLogBodies(boolean logBodies) { this.logBodies = logBodies; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RealtimeConfig {
        private String url = "ws://localhost:8081/ws";
        private long heartbeatIntervalMillis = 30_000;
        private long reconnectDelayMillis = 5_000;
        private int maxReconnectAttempts = 5;
        private int connectionLostTimeoutSeconds = 60;
        private long connectTimeoutMillis = 10_000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public long getHeartbeatIntervalMillis() { return heartbeatIntervalMillis; }
        public void setHeartbeatIntervalMillis(long v) { this.heartbeatIntervalMillis = v; }

        public long getReconnectDelayMillis() { return reconnectDelayMillis; }
        public void setReconnectDelayMillis(long v) { this.reconnectDelayMillis = v; }

        public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
        public void setMaxReconnectAttempts(int v) { this.maxReconnectAttempts = v; }

        public int getConnectionLostTimeoutSeconds() { return connectionLostTimeoutSeconds; }
        public void setConnectionLostTimeoutSeconds(int v) { this.connectionLostTimeoutSeconds = v; }

        public long getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(long v) { this.connectTimeoutMillis = v; }
    }
}
