package com.civicdesk.query.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the query engine and its collaborators.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing critical
 * settings are caught at startup instead of failing during runtime calls.</p>
 */
@Validated
@ConfigurationProperties(prefix = "civicdesk")
public class EngineProperties {

    /**
     * Zone whose midnight delimits days for resolution dates and metric buckets.
     */
    @NotBlank
    private String zone = "Africa/Johannesburg";

    @NestedConfigurationProperty
    private final StoreProperties store = new StoreProperties();

    @NestedConfigurationProperty
    private final LifecycleProperties lifecycle = new LifecycleProperties();

    @NestedConfigurationProperty
    private final MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private final NotificationProperties notifications = new NotificationProperties();

    @NestedConfigurationProperty
    private final FrontendProperties frontend = new FrontendProperties();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public StoreProperties getStore() {
        return store;
    }

    public LifecycleProperties getLifecycle() {
        return lifecycle;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public NotificationProperties getNotifications() {
        return notifications;
    }

    public FrontendProperties getFrontend() {
        return frontend;
    }

    public static class StoreProperties {

        /**
         * Upper bound for a single store read or merge write.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * How often a subscription rescans the table for rows written by other processes.
         */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(2);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class LifecycleProperties {

        /**
         * How long an unconfirmed resolution proposal is kept before it is dropped.
         */
        @NotNull
        private Duration proposalTtl = Duration.ofMinutes(30);

        public Duration getProposalTtl() {
            return proposalTtl;
        }

        public void setProposalTtl(Duration proposalTtl) {
            this.proposalTtl = proposalTtl;
        }
    }

    public static class MetricsProperties {

        /**
         * Window selected before any client picks one: 7D, 30D, 3M, 6M or 12M.
         */
        @NotBlank
        private String defaultWindow = "30D";

        public String getDefaultWindow() {
            return defaultWindow;
        }

        public void setDefaultWindow(String defaultWindow) {
            this.defaultWindow = defaultWindow;
        }
    }

    public static class NotificationProperties {

        /**
         * {@code inbox} stores events for the in-app bell; {@code webhook} relays them over HTTP.
         */
        @NotBlank
        private String channel = "inbox";

        @NestedConfigurationProperty
        private final WebhookProperties webhook = new WebhookProperties();

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public WebhookProperties getWebhook() {
            return webhook;
        }
    }

    public static class WebhookProperties {

        private String url = "http://localhost:8090/hooks/query-assignments";

        private String token;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class FrontendProperties {

        @NotBlank
        private String baseUrl = "https://portal.civicdesk.local";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
