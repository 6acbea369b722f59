package net.hearth.bootstrap.props;

import net.hearth.core.model.WarmingStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("hearth")
public class HearthProperties {
    private boolean enabled = true;
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private History history = new History();
    private Catalog catalog = new Catalog();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public enum CalculatorType { BUILTIN, CRON_UTILS }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 1000;
        private long maintenanceDelayMs = 60000;
        private int workerThreads = 4;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private CalculatorType calculator = CalculatorType.BUILTIN;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public CalculatorType getCalculator() {
            return calculator;
        }

        public void setCalculator(CalculatorType calculator) {
            this.calculator = calculator;
        }
    }

    public static class History {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(7);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<SourceDef> sources = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<SourceDef> getSources() {
            return sources;
        }

        public void setSources(List<SourceDef> sources) {
            this.sources = sources;
        }
    }

    public static class SourceDef {
        private String id;
        private String name;
        private String namespace;
        private Duration ttl = Duration.ZERO;
        private WarmingStrategy strategy;
        private String schedule;
        private TimezoneDef timezone;
        private JitterDef jitter;
        private BackoffDef backoff;
        private List<String> dependencies = new ArrayList<>();
        private String description;
        private String fetcher;

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

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        /** Defaults to SCHEDULED when a schedule is set, ON_DEMAND otherwise. */
        public WarmingStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(WarmingStrategy strategy) {
            this.strategy = strategy;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public TimezoneDef getTimezone() {
            return timezone;
        }

        public void setTimezone(TimezoneDef timezone) {
            this.timezone = timezone;
        }

        public JitterDef getJitter() {
            return jitter;
        }

        public void setJitter(JitterDef jitter) {
            this.jitter = jitter;
        }

        public BackoffDef getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffDef backoff) {
            this.backoff = backoff;
        }

        public List<String> getDependencies() {
            return dependencies;
        }

        public void setDependencies(List<String> dependencies) {
            this.dependencies = dependencies;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        /** Bean name of the {@code Fetcher}; defaults to the source id. */
        public String getFetcher() {
            return fetcher;
        }

        public void setFetcher(String fetcher) {
            this.fetcher = fetcher;
        }

        @Override
        public String toString() {
            return "SourceDef{" +
                    "id='" + id + '\'' +
                    ", strategy=" + strategy +
                    ", schedule='" + schedule + '\'' +
                    ", dependencies=" + dependencies +
                    ", fetcher='" + fetcher + '\'' +
                    '}';
        }
    }

    public static class TimezoneDef {
        private String name;
        private Integer offsetMinutes;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        /** When absent, the offset {@code name} has at registration time. */
        public Integer getOffsetMinutes() {
            return offsetMinutes;
        }

        public void setOffsetMinutes(Integer offsetMinutes) {
            this.offsetMinutes = offsetMinutes;
        }
    }

    public static class JitterDef {
        private boolean enabled = true;
        private double maxPercent = 0.1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMaxPercent() {
            return maxPercent;
        }

        public void setMaxPercent(double maxPercent) {
            this.maxPercent = maxPercent;
        }
    }

    public static class BackoffDef {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double factor = 2.0;
        private int maxRetries = 3;

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = factor;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }
}
