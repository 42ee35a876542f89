package fr.lapetina.slack.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the Slack clients.
 * Designed to be populated from YAML.
 */
public class SlackClientConfig {

    private WebConfig web = new WebConfig();
    private RetryConfig retry = new RetryConfig();
    private WebhookConfig webhook = new WebhookConfig();
    private RealtimeConfig socketMode = new RealtimeConfig();
    private RealtimeConfig rtm = new RealtimeConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public WebConfig getWeb() { return web; }
    public void setWeb(WebConfig web) { this.web = web; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public WebhookConfig getWebhook() { return webhook; }
    public void setWebhook(WebhookConfig webhook) { this.webhook = webhook; }

    public RealtimeConfig getSocketMode() { return socketMode; }
    public void setSocketMode(RealtimeConfig socketMode) { this.socketMode = socketMode; }

    public RealtimeConfig getRtm() { return rtm; }
    public void setRtm(RealtimeConfig rtm) { this.rtm = rtm; }

    public ProxyConfig getProxy() { return proxy; }
    public void setProxy(ProxyConfig proxy) { this.proxy = proxy; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Web API client configuration.
     */
    public static class WebConfig {
        private String baseUrl = "https://slack.com/api/";
        private long timeoutMs = 30000;
        private long connectTimeoutMs = 10000;
        private String teamId;
        private String userAgentPrefix;
        private String userAgentSuffix;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public String getTeamId() { return teamId; }
        public void setTeamId(String teamId) { this.teamId = teamId; }

        public String getUserAgentPrefix() { return userAgentPrefix; }
        public void setUserAgentPrefix(String userAgentPrefix) { this.userAgentPrefix = userAgentPrefix; }

        public String getUserAgentSuffix() { return userAgentSuffix; }
        public void setUserAgentSuffix(String userAgentSuffix) { this.userAgentSuffix = userAgentSuffix; }
    }

    /**
     * Retry configuration shared by the HTTP clients.
     */
    public static class RetryConfig {
        private List<String> handlers = new ArrayList<>(List.of("connection-error"));
        private int maxRetryCount = 1;
        private long backoffFactorMs = 500;
        private long maxBackoffMs = 0;

        public List<String> getHandlers() { return handlers; }
        public void setHandlers(List<String> handlers) { this.handlers = handlers; }

        public int getMaxRetryCount() { return maxRetryCount; }
        public void setMaxRetryCount(int maxRetryCount) { this.maxRetryCount = maxRetryCount; }

        public long getBackoffFactorMs() { return backoffFactorMs; }
        public void setBackoffFactorMs(long backoffFactorMs) { this.backoffFactorMs = backoffFactorMs; }

        /** Zero means uncapped. */
        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }

    /**
     * Incoming webhook client configuration.
     */
    public static class WebhookConfig {
        private long timeoutMs = 30000;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * WebSocket client configuration, used for both Socket Mode and RTM.
     */
    public static class RealtimeConfig {
        private long pingIntervalMs = 5000;
        private int concurrency = 10;
        private boolean autoReconnect = true;
        private ReconnectConfig reconnect = new ReconnectConfig();

        public long getPingIntervalMs() { return pingIntervalMs; }
        public void setPingIntervalMs(long pingIntervalMs) { this.pingIntervalMs = pingIntervalMs; }

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public boolean isAutoReconnect() { return autoReconnect; }
        public void setAutoReconnect(boolean autoReconnect) { this.autoReconnect = autoReconnect; }

        public ReconnectConfig getReconnect() { return reconnect; }
        public void setReconnect(ReconnectConfig reconnect) { this.reconnect = reconnect; }
    }

    /**
     * Reconnect backoff configuration.
     */
    public static class ReconnectConfig {
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30000;
        private int maxAttempts = 10;

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    /**
     * HTTP proxy configuration. When unset, proxy environment variables apply.
     */
    public static class ProxyConfig {
        private String url;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "slack_client";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
