package com.attorneyroster.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "roster")
public class RosterProperties {
    private static final String DEFAULT_USER_AGENT = "attorney-roster/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMinMs = 1000;
    private int perHostDelayMaxMs = 2000;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 20;
    private int requestMaxAttempts = 3;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private int rateLimitCooldownMs = 30000;
    private int workerPoolSize = 1;
    private int staleRunMinutes = 180;
    private Pagination pagination = new Pagination();
    private Api api = new Api();
    private Cli cli = new Cli();
    private Map<String, Jurisdiction> jurisdictions = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMinMs() {
        return Math.max(0, perHostDelayMinMs);
    }

    public void setPerHostDelayMinMs(int perHostDelayMinMs) {
        this.perHostDelayMinMs = Math.max(0, perHostDelayMinMs);
    }

    public int getPerHostDelayMaxMs() {
        return Math.max(getPerHostDelayMinMs(), perHostDelayMaxMs);
    }

    public void setPerHostDelayMaxMs(int perHostDelayMaxMs) {
        this.perHostDelayMaxMs = Math.max(0, perHostDelayMaxMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxAttempts() {
        return Math.max(1, requestMaxAttempts);
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getRateLimitCooldownMs() {
        return Math.max(0, rateLimitCooldownMs);
    }

    public void setRateLimitCooldownMs(int rateLimitCooldownMs) {
        this.rateLimitCooldownMs = Math.max(0, rateLimitCooldownMs);
    }

    public int getWorkerPoolSize() {
        return Math.max(1, workerPoolSize);
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = Math.max(1, workerPoolSize);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Jurisdiction> getJurisdictions() {
        return jurisdictions;
    }

    public void setJurisdictions(Map<String, Jurisdiction> jurisdictions) {
        this.jurisdictions = jurisdictions == null ? new LinkedHashMap<>() : jurisdictions;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Pagination {
        private int delayMinMs = 2000;
        private int delayMaxMs = 3000;
        private int maxPagesPerContext = 200;
        private int progressLogInterval = 50;

        public int getDelayMinMs() {
            return Math.max(0, delayMinMs);
        }

        public void setDelayMinMs(int delayMinMs) {
            this.delayMinMs = Math.max(0, delayMinMs);
        }

        public int getDelayMaxMs() {
            return Math.max(getDelayMinMs(), delayMaxMs);
        }

        public void setDelayMaxMs(int delayMaxMs) {
            this.delayMaxMs = Math.max(0, delayMaxMs);
        }

        public int getMaxPagesPerContext() {
            return Math.max(1, maxPagesPerContext);
        }

        public void setMaxPagesPerContext(int maxPagesPerContext) {
            this.maxPagesPerContext = Math.max(1, maxPagesPerContext);
        }

        public int getProgressLogInterval() {
            return Math.max(1, progressLogInterval);
        }

        public void setProgressLogInterval(int progressLogInterval) {
            this.progressLogInterval = Math.max(1, progressLogInterval);
        }
    }

    public static class Api {
        private int defaultSearchLimit = 50;
        private int maxSearchLimit = 1000;
        private int defaultRunsLimit = 20;
        private int maxExportRows = 100000;

        public int getDefaultSearchLimit() {
            return Math.max(1, defaultSearchLimit);
        }

        public void setDefaultSearchLimit(int defaultSearchLimit) {
            this.defaultSearchLimit = Math.max(1, defaultSearchLimit);
        }

        public int getMaxSearchLimit() {
            return Math.max(getDefaultSearchLimit(), maxSearchLimit);
        }

        public void setMaxSearchLimit(int maxSearchLimit) {
            this.maxSearchLimit = Math.max(1, maxSearchLimit);
        }

        public int getDefaultRunsLimit() {
            return Math.max(1, defaultRunsLimit);
        }

        public void setDefaultRunsLimit(int defaultRunsLimit) {
            this.defaultRunsLimit = Math.max(1, defaultRunsLimit);
        }

        public int getMaxExportRows() {
            return Math.max(1, maxExportRows);
        }

        public void setMaxExportRows(int maxExportRows) {
            this.maxExportRows = Math.max(1, maxExportRows);
        }
    }

    public static class Cli {
        private boolean run;
        private String jurisdictions = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getJurisdictions() {
            return jurisdictions;
        }

        public void setJurisdictions(String jurisdictions) {
            this.jurisdictions = jurisdictions == null ? "" : jurisdictions;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * Static search configuration for one bar directory. Seeds are submitted in order:
     * every city first, then every letter.
     */
    public static class Jurisdiction {
        private String name;
        private String baseUrl;
        private String searchUrl;
        private String searchMethod = "POST";
        private String cityParam = "City";
        private String letterParam = "LastName";
        private Map<String, String> fixedParams = new LinkedHashMap<>();
        private List<String> cities = new ArrayList<>();
        private String letters = "";
        private List<String> knownCities = new ArrayList<>();
        private int barNumberDigits = 8;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getSearchMethod() {
            return searchMethod;
        }

        public void setSearchMethod(String searchMethod) {
            this.searchMethod = searchMethod;
        }

        public String getCityParam() {
            return cityParam;
        }

        public void setCityParam(String cityParam) {
            this.cityParam = cityParam;
        }

        public String getLetterParam() {
            return letterParam;
        }

        public void setLetterParam(String letterParam) {
            this.letterParam = letterParam;
        }

        public Map<String, String> getFixedParams() {
            return fixedParams;
        }

        public void setFixedParams(Map<String, String> fixedParams) {
            this.fixedParams = fixedParams == null ? new LinkedHashMap<>() : fixedParams;
        }

        public List<String> getCities() {
            return cities;
        }

        public void setCities(List<String> cities) {
            this.cities = cities == null ? new ArrayList<>() : cities;
        }

        public String getLetters() {
            return letters;
        }

        public void setLetters(String letters) {
            this.letters = letters == null ? "" : letters;
        }

        public List<String> getKnownCities() {
            return knownCities;
        }

        public void setKnownCities(List<String> knownCities) {
            this.knownCities = knownCities == null ? new ArrayList<>() : knownCities;
        }

        public int getBarNumberDigits() {
            return Math.max(1, barNumberDigits);
        }

        public void setBarNumberDigits(int barNumberDigits) {
            this.barNumberDigits = Math.max(1, barNumberDigits);
        }
    }
}
