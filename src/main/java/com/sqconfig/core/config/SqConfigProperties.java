package com.sqconfig.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "sqconfig")
public class SqConfigProperties {

    private Server server = new Server();
    private Runner runner = new Runner();
    private Audit audit = new Audit();

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }
    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    public static class Server {
        private String url = "http://localhost:9000";
        private String token = "";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 60;
        private int maxRetries = 0;
        private long retryBackoffMillis = 500;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryBackoffMillis() { return retryBackoffMillis; }
        public void setRetryBackoffMillis(long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }
    }

    public static class Runner {
        private int threads = 8;
        private int taskTimeoutSeconds = 60;
        private int queueCapacity = 1000;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Audit {
        /**
         * Overrides of the defaults in {@code sqconfig-audit.properties}.
         */
        private Map<String, String> settings = new LinkedHashMap<>();

        public Map<String, String> getSettings() { return settings; }
        public void setSettings(Map<String, String> settings) { this.settings = settings; }
    }
}
