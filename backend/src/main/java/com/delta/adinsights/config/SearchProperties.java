package com.delta.adinsights.config;

import com.delta.adinsights.search.model.ClusteringMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private static final String DEFAULT_USER_AGENT = "delta-ad-insights/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 60;
    private int lookupTimeoutSeconds = 30;
    private int batchTimeoutSeconds = 0;
    private int httpThreads = 4;
    private int maxDomains = 50;
    private ClusteringMode clusteringMode = ClusteringMode.PER_DOMAIN;
    private Provider provider = new Provider();
    private Defaults defaults = new Defaults();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getLookupTimeoutSeconds() {
        return Math.max(1, lookupTimeoutSeconds);
    }

    public void setLookupTimeoutSeconds(int lookupTimeoutSeconds) {
        this.lookupTimeoutSeconds = Math.max(1, lookupTimeoutSeconds);
    }

    /**
     * Upper bound for a whole fan-out batch; {@code 0} waits until every call settles.
     */
    public int getBatchTimeoutSeconds() {
        return Math.max(0, batchTimeoutSeconds);
    }

    public void setBatchTimeoutSeconds(int batchTimeoutSeconds) {
        this.batchTimeoutSeconds = Math.max(0, batchTimeoutSeconds);
    }

    public int getHttpThreads() {
        return Math.max(1, httpThreads);
    }

    public void setHttpThreads(int httpThreads) {
        this.httpThreads = Math.max(1, httpThreads);
    }

    /**
     * Largest number of distinct domains one search may fan out to.
     */
    public int getMaxDomains() {
        return Math.max(1, maxDomains);
    }

    public void setMaxDomains(int maxDomains) {
        this.maxDomains = Math.max(1, maxDomains);
    }

    public ClusteringMode getClusteringMode() {
        return clusteringMode == null ? ClusteringMode.PER_DOMAIN : clusteringMode;
    }

    public void setClusteringMode(ClusteringMode clusteringMode) {
        this.clusteringMode = clusteringMode;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Provider {
        private String baseUrl = "http://localhost:8000";
        private String platform = "google_search";
        private int maxDepth = 120;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        /**
         * Base URL without trailing slashes, ready for path concatenation.
         */
        public String normalizedBaseUrl() {
            String value = baseUrl == null ? "" : baseUrl.trim();
            while (value.endsWith("/")) {
                value = value.substring(0, value.length() - 1);
            }
            return value;
        }

        public String getPlatform() {
            return platform == null || platform.isBlank() ? "google_search" : platform.trim().toLowerCase(Locale.ROOT);
        }

        public void setPlatform(String platform) {
            this.platform = platform;
        }

        public int getMaxDepth() {
            return Math.max(1, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(1, maxDepth);
        }
    }

    public static class Defaults {
        private int depth = 50;
        private int locationCode = 2840;
        private String language;

        public int getDepth() {
            return Math.max(1, depth);
        }

        public void setDepth(int depth) {
            this.depth = Math.max(1, depth);
        }

        public int getLocationCode() {
            return Math.max(1, locationCode);
        }

        public void setLocationCode(int locationCode) {
            this.locationCode = Math.max(1, locationCode);
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }
    }

    public static class Cli {
        private boolean run;
        private String domains = "";
        private Integer depth;
        private Integer locationCode;
        private String language;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getDomains() {
            return domains;
        }

        public void setDomains(String domains) {
            this.domains = domains;
        }

        public Integer getDepth() {
            return depth;
        }

        public void setDepth(Integer depth) {
            this.depth = depth;
        }

        public Integer getLocationCode() {
            return locationCode;
        }

        public void setLocationCode(Integer locationCode) {
            this.locationCode = locationCode;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
