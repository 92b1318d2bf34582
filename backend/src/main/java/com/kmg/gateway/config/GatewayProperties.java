package com.kmg.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {
    @NotNull
    private State state = new State();
    @NotNull
    private Logs logs = new Logs();
    @NotNull
    private Ledger ledger = new Ledger();
    @NotNull
    private Pipeline pipeline = new Pipeline();
    @NotNull
    private Admin admin = new Admin();
    @Valid
    private Map<String, Provider> providers = new LinkedHashMap<>();
    @Valid
    private List<Service> services = new ArrayList<>();

    /**
     * Longest a request can hold a reservation: the HTTP deadline plus every provider timeout of the
     * longest configured fallback chain.
     */
    public Duration worstCaseRequestTime() {
        Duration longestChain = Duration.ZERO;
        for (Service service : services) {
            Duration chain = Duration.ZERO;
            for (String providerId : service.getFallbackChain()) {
                Provider provider = providers.get(providerId);
                if (provider != null && provider.getTimeout() != null) {
                    chain = chain.plus(provider.getTimeout());
                }
            }
            if (chain.compareTo(longestChain) > 0) {
                longestChain = chain;
            }
        }
        Duration requestTimeout = pipeline.getRequestTimeout() == null ? Duration.ZERO : pipeline.getRequestTimeout();
        return requestTimeout.plus(longestChain);
    }

    @AssertTrue(message = "gateway.ledger.orphan-after must exceed gateway.pipeline.request-timeout plus the provider timeouts of the longest fallback chain")
    public boolean isOrphanAfterBeyondRequestTime() {
        return ledger.getOrphanAfter() == null || ledger.getOrphanAfter().compareTo(worstCaseRequestTime()) > 0;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public void setLedger(Ledger ledger) {
        this.ledger = ledger;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Admin getAdmin() {
        return admin;
    }

    public void setAdmin(Admin admin) {
        this.admin = admin;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public List<Service> getServices() {
        return services;
    }

    public void setServices(List<Service> services) {
        this.services = services;
    }

    public static class State {
        @NotBlank
        private String dbPath = "./data/gateway.db";

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir = "./logs";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Ledger {
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration lockTimeout = Duration.ofSeconds(2);
        /**
         * Age after which a reservation still PENDING is considered orphaned and released.
         */
        @NotNull
        private Duration orphanAfter = Duration.ofMinutes(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public Duration getOrphanAfter() {
            return orphanAfter;
        }

        public void setOrphanAfter(Duration orphanAfter) {
            this.orphanAfter = orphanAfter;
        }
    }

    public static class Pipeline {
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int workerThreads = 16;
        @Min(1)
        private int providerThreads = 16;

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getProviderThreads() {
            return providerThreads;
        }

        public void setProviderThreads(int providerThreads) {
            this.providerThreads = providerThreads;
        }
    }

    public static class Admin {
        private String token;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    /**
     * One external data source. Base URL and credential are both optional; a provider
     * missing either one is skipped by every fallback chain that names it.
     */
    public static class Provider {
        private String baseUrl;
        private String credential;
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
        @Valid
        private Map<String, Endpoint> endpoints = new LinkedHashMap<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCredential() {
            return credential;
        }

        public void setCredential(String credential) {
            this.credential = credential;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Map<String, Endpoint> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(Map<String, Endpoint> endpoints) {
            this.endpoints = endpoints;
        }
    }

    public static class Endpoint {
        private String path;
        private String lookupField;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getLookupField() {
            return lookupField;
        }

        public void setLookupField(String lookupField) {
            this.lookupField = lookupField;
        }
    }

    public static class Service {
        @NotBlank
        private String id;
        private String name;
        private boolean active = true;
        @Min(0)
        private int cost = 1;
        private List<String> fallbackChain = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public int getCost() {
            return cost;
        }

        public void setCost(int cost) {
            this.cost = cost;
        }

        public List<String> getFallbackChain() {
            return fallbackChain;
        }

        public void setFallbackChain(List<String> fallbackChain) {
            this.fallbackChain = fallbackChain;
        }
    }
}
