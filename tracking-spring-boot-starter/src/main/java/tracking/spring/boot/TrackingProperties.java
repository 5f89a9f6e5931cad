package tracking.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the tracking engine.
 *
 * @see TrackingAutoConfiguration
 */
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    /**
     * Whether the engine starts its poller, replayer and archival schedules on startup.
     */
    private boolean autoStart = true;

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Poller poller = new Poller();
    private final Replay replay = new Replay();
    private final Archive archive = new Archive();
    private final Timeline timeline = new Timeline();
    private final State state = new State();
    private final Metrics metrics = new Metrics();
    private final Jdbc jdbc = new Jdbc();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Poller getPoller() {
        return poller;
    }

    public Replay getReplay() {
        return replay;
    }

    public Archive getArchive() {
        return archive;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public State getState() {
        return state;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public enum TieBreaker {
        EVENT_ID,
        DEDUP_KEY
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private int hotQueueCapacity = 1000;
        private int coldQueueCapacity = 1000;
        private int maxAttempts = 10;
        private long drainTimeoutMs = 5000;
        private Duration actionTimeout = Duration.ofSeconds(10);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getHotQueueCapacity() {
            return hotQueueCapacity;
        }

        public void setHotQueueCapacity(int hotQueueCapacity) {
            this.hotQueueCapacity = hotQueueCapacity;
        }

        public int getColdQueueCapacity() {
            return coldQueueCapacity;
        }

        public void setColdQueueCapacity(int coldQueueCapacity) {
            this.coldQueueCapacity = coldQueueCapacity;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getActionTimeout() {
            return actionTimeout;
        }

        public void setActionTimeout(Duration actionTimeout) {
            this.actionTimeout = actionTimeout;
        }
    }

    /**
     * Backoff between attempts of a failed automation invocation.
     */
    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Poller {
        private long intervalMs = 5000;
        private int batchSize = 50;
        private long skipRecentMs = 1000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getSkipRecentMs() {
            return skipRecentMs;
        }

        public void setSkipRecentMs(long skipRecentMs) {
            this.skipRecentMs = skipRecentMs;
        }
    }

    /**
     * Replay of carrier events parked because their shipment was not yet registered.
     */
    public static class Replay {
        private Duration window = Duration.ofHours(24);
        private long intervalMs = 60000;
        private long baseDelayMs = 30000;
        private long maxDelayMs = 3600000;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Archive {
        private boolean enabled = true;
        private int capacity = 10000;
        private int maxRetries = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class Timeline {
        private TieBreaker tieBreaker = TieBreaker.EVENT_ID;
        private Duration gapThreshold = Duration.ofHours(72);

        public TieBreaker getTieBreaker() {
            return tieBreaker;
        }

        public void setTieBreaker(TieBreaker tieBreaker) {
            this.tieBreaker = tieBreaker;
        }

        public Duration getGapThreshold() {
            return gapThreshold;
        }

        public void setGapThreshold(Duration gapThreshold) {
            this.gapThreshold = gapThreshold;
        }
    }

    public static class State {
        /**
         * Attempts of an optimistic status write before the conflict is surfaced.
         */
        private int maxConflictRetries = 5;

        /**
         * Delay between sweeps over shipments whose status write failed after an event was stored.
         */
        private long reconcileIntervalMs = 30000;

        public int getMaxConflictRetries() {
            return maxConflictRetries;
        }

        public void setMaxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = maxConflictRetries;
        }

        public long getReconcileIntervalMs() {
            return reconcileIntervalMs;
        }

        public void setReconcileIntervalMs(long reconcileIntervalMs) {
            this.reconcileIntervalMs = reconcileIntervalMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "tracking";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Jdbc {
        /**
         * Create the tracking tables from the bundled dialect script on startup.
         */
        private boolean initializeSchema = false;

        /**
         * Insert the bundled occurrence codes into the database on startup, skipping existing ones.
         */
        private boolean seedOccurrenceCodes = false;

        /**
         * Load the taxonomy from the occurrence code table instead of the classpath.
         */
        private boolean occurrenceCodesFromDatabase = false;

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }

        public boolean isSeedOccurrenceCodes() {
            return seedOccurrenceCodes;
        }

        public void setSeedOccurrenceCodes(boolean seedOccurrenceCodes) {
            this.seedOccurrenceCodes = seedOccurrenceCodes;
        }

        public boolean isOccurrenceCodesFromDatabase() {
            return occurrenceCodesFromDatabase;
        }

        public void setOccurrenceCodesFromDatabase(boolean occurrenceCodesFromDatabase) {
            this.occurrenceCodesFromDatabase = occurrenceCodesFromDatabase;
        }
    }
}
