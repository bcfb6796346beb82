package com.williamcallahan.ratchet.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ratchet")
public class AppProperties {

    private Slack slack = new Slack();
    private Ingestion ingestion = new Ingestion();
    private Classifier classifier = new Classifier();
    private Embedding embedding = new Embedding();
    private Jobs jobs = new Jobs();

    public Slack getSlack() {
        return slack;
    }

    public void setSlack(Slack slack) {
        this.slack = slack;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public static class Slack {
        private String botToken = "";
        private String signingSecret = "";
        private String baseUrl = "https://slack.com/api";
        private int historyPageSize = 200;

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getSigningSecret() {
            return signingSecret;
        }

        public void setSigningSecret(String signingSecret) {
            this.signingSecret = signingSecret;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getHistoryPageSize() {
            return historyPageSize;
        }

        public void setHistoryPageSize(int historyPageSize) {
            this.historyPageSize = historyPageSize;
        }
    }

    public static class Ingestion {
        /** Channels registered at startup. */
        private List<String> channels = new ArrayList<>();
        private Duration emptyPollBackoff = Duration.ofSeconds(60);
        private Duration initialLookback = Duration.ofHours(1);
        private Duration retention = Duration.ofDays(730);
        private int onboardMessageLimit = 1000;
        private Duration retryBackoff = Duration.ofSeconds(30);

        public List<String> getChannels() {
            return channels;
        }

        public void setChannels(List<String> channels) {
            this.channels = channels;
        }

        public Duration getEmptyPollBackoff() {
            return emptyPollBackoff;
        }

        public void setEmptyPollBackoff(Duration emptyPollBackoff) {
            this.emptyPollBackoff = emptyPollBackoff;
        }

        public Duration getInitialLookback() {
            return initialLookback;
        }

        public void setInitialLookback(Duration initialLookback) {
            this.initialLookback = initialLookback;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getOnboardMessageLimit() {
            return onboardMessageLimit;
        }

        public void setOnboardMessageLimit(int onboardMessageLimit) {
            this.onboardMessageLimit = onboardMessageLimit;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }
    }

    public static class Classifier {
        /** {@code subprocess} runs {@link #binary}; {@code message-json} reads verdicts from message text. */
        private String mode = "subprocess";
        private String binary = "classifier";
        private Duration timeout = Duration.ofSeconds(10);
        private Duration retryBackoff = Duration.ofSeconds(30);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }
    }

    public static class Embedding {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "text-embedding-3-small";
        private int dimensions = 768;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class Jobs {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int defaultConcurrency = 4;
        /** Pool size per job kind, keyed by kind name. */
        private Map<String, Integer> concurrency = new LinkedHashMap<>();
        private int maxAttempts = 25;
        private Duration rescueAfter = Duration.ofMinutes(15);
        private Duration retainFinished = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getDefaultConcurrency() {
            return defaultConcurrency;
        }

        public void setDefaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = defaultConcurrency;
        }

        public Map<String, Integer> getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(Map<String, Integer> concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRescueAfter() {
            return rescueAfter;
        }

        public void setRescueAfter(Duration rescueAfter) {
            this.rescueAfter = rescueAfter;
        }

        public Duration getRetainFinished() {
            return retainFinished;
        }

        public void setRetainFinished(Duration retainFinished) {
            this.retainFinished = retainFinished;
        }
    }
}
