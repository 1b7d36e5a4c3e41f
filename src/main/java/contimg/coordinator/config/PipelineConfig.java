package contimg.coordinator.config;

import contimg.coordinator.grouping.LateMemberPolicy;
import contimg.coordinator.pipeline.CollaboratorKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration holder for the pipeline coordinator.
 * All settings have sensible defaults.
 */
public final class PipelineConfig {

    // Durable store
    private String storeUrl = "jdbc:h2:file:./data/contimg;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;WRITE_DELAY=0";
    private int storePoolSize = 10;
    private Duration storeWaitTimeout = Duration.ofSeconds(5);

    // Directories
    private Path inputDirectory = Path.of("incoming");
    private Path outputDirectory = Path.of("products");

    // Grouping
    private int expectedMemberCount = 16;
    private Duration groupingTolerance = Duration.ofSeconds(60);
    private Duration collectionTimeout = Duration.ofMinutes(5);
    private LateMemberPolicy lateMemberPolicy = LateMemberPolicy.DISCARD;

    // Tasks and retries
    private Duration leaseDuration = Duration.ofMinutes(2);
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(30);
    private Duration archiveRetention = Duration.ofDays(7);

    // Calibration
    private Duration validityHalfWindow = Duration.ofHours(12);
    private Duration freshWindow = Duration.ofHours(6);
    private boolean verifyCalibrationTables = true;

    // Workers and collaborators
    private int workerPoolSize = 2;
    private Duration claimPollInterval = Duration.ofSeconds(1);
    private Duration collaboratorTimeout = Duration.ofMinutes(30);
    private final Map<CollaboratorKind, List<String>> collaboratorCommands = new EnumMap<>(CollaboratorKind.class);
    private boolean mosaicEnabled = false;

    // Background sweeps
    private Duration sweepInterval = Duration.ofSeconds(15);

    private PipelineConfig() {
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    public static PipelineConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Build a config from a variable lookup; unset or blank variables keep the default.
     */
    static PipelineConfig fromEnv(Function<String, String> env) {
        PipelineConfig config = new PipelineConfig();

        String url = env.apply("CONTIMG_STORE_URL");
        if (isSet(url)) {
            config.storeUrl = url;
        }

        String poolSize = env.apply("CONTIMG_STORE_POOL_SIZE");
        if (isSet(poolSize)) {
            config.storePoolSize = Integer.parseInt(poolSize.trim());
        }

        String waitMs = env.apply("CONTIMG_STORE_WAIT_MS");
        if (isSet(waitMs)) {
            config.storeWaitTimeout = Duration.ofMillis(Long.parseLong(waitMs.trim()));
        }

        String input = env.apply("CONTIMG_INPUT_DIR");
        if (isSet(input)) {
            config.inputDirectory = Path.of(input);
        }

        String output = env.apply("CONTIMG_OUTPUT_DIR");
        if (isSet(output)) {
            config.outputDirectory = Path.of(output);
        }

        String members = env.apply("CONTIMG_EXPECTED_SUBBANDS");
        if (isSet(members)) {
            config.expectedMemberCount = Integer.parseInt(members.trim());
        }

        String tolerance = env.apply("CONTIMG_GROUPING_TOLERANCE_SECONDS");
        if (isSet(tolerance)) {
            config.groupingTolerance = Duration.ofSeconds(Long.parseLong(tolerance.trim()));
        }

        String collection = env.apply("CONTIMG_COLLECTION_TIMEOUT_SECONDS");
        if (isSet(collection)) {
            config.collectionTimeout = Duration.ofSeconds(Long.parseLong(collection.trim()));
        }

        String latePolicy = env.apply("CONTIMG_LATE_MEMBER_POLICY");
        if (isSet(latePolicy)) {
            config.lateMemberPolicy = LateMemberPolicy.valueOf(latePolicy.trim().toUpperCase(Locale.ROOT));
        }

        String lease = env.apply("CONTIMG_LEASE_SECONDS");
        if (isSet(lease)) {
            config.leaseDuration = Duration.ofSeconds(Long.parseLong(lease.trim()));
        }

        String retries = env.apply("CONTIMG_MAX_RETRIES");
        if (isSet(retries)) {
            config.maxRetries = Integer.parseInt(retries.trim());
        }

        String halfWindow = env.apply("CONTIMG_VALIDITY_HALF_WINDOW_HOURS");
        if (isSet(halfWindow)) {
            config.validityHalfWindow = Duration.ofMinutes(Math.round(Double.parseDouble(halfWindow.trim()) * 60));
        }

        String fresh = env.apply("CONTIMG_FRESH_WINDOW_HOURS");
        if (isSet(fresh)) {
            config.freshWindow = Duration.ofMinutes(Math.round(Double.parseDouble(fresh.trim()) * 60));
        }

        String workers = env.apply("CONTIMG_WORKERS");
        if (isSet(workers)) {
            config.workerPoolSize = Integer.parseInt(workers.trim());
        }

        String collaboratorTimeout = env.apply("CONTIMG_COLLABORATOR_TIMEOUT_SECONDS");
        if (isSet(collaboratorTimeout)) {
            config.collaboratorTimeout = Duration.ofSeconds(Long.parseLong(collaboratorTimeout.trim()));
        }

        for (CollaboratorKind kind : CollaboratorKind.values()) {
            String command = env.apply("CONTIMG_CMD_" + kind.name());
            if (isSet(command)) {
                config.collaboratorCommands.put(kind, Arrays.asList(command.trim().split("\\s+")));
            }
        }

        String mosaic = env.apply("CONTIMG_MOSAIC_ENABLED");
        if (isSet(mosaic)) {
            config.mosaicEnabled = Boolean.parseBoolean(mosaic.trim());
        }

        String sweep = env.apply("CONTIMG_SWEEP_INTERVAL_SECONDS");
        if (isSet(sweep)) {
            config.sweepInterval = Duration.ofSeconds(Long.parseLong(sweep.trim()));
        }

        return config;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // Getters
    public String storeUrl() {
        return storeUrl;
    }

    public int storePoolSize() {
        return storePoolSize;
    }

    public Duration storeWaitTimeout() {
        return storeWaitTimeout;
    }

    public Path inputDirectory() {
        return inputDirectory;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public int expectedMemberCount() {
        return expectedMemberCount;
    }

    public Duration groupingTolerance() {
        return groupingTolerance;
    }

    public Duration collectionTimeout() {
        return collectionTimeout;
    }

    public LateMemberPolicy lateMemberPolicy() {
        return lateMemberPolicy;
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public Duration archiveRetention() {
        return archiveRetention;
    }

    public Duration validityHalfWindow() {
        return validityHalfWindow;
    }

    public Duration freshWindow() {
        return freshWindow;
    }

    public boolean verifyCalibrationTables() {
        return verifyCalibrationTables;
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public Duration claimPollInterval() {
        return claimPollInterval;
    }

    public Duration collaboratorTimeout() {
        return collaboratorTimeout;
    }

    public Map<CollaboratorKind, List<String>> collaboratorCommands() {
        return Collections.unmodifiableMap(collaboratorCommands);
    }

    public boolean mosaicEnabled() {
        return mosaicEnabled;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    // Fluent setters for testing/customization
    public PipelineConfig withStoreUrl(String url) {
        this.storeUrl = url;
        return this;
    }

    public PipelineConfig withStoreWaitTimeout(Duration timeout) {
        this.storeWaitTimeout = timeout;
        return this;
    }

    public PipelineConfig withInputDirectory(Path dir) {
        this.inputDirectory = dir;
        return this;
    }

    public PipelineConfig withOutputDirectory(Path dir) {
        this.outputDirectory = dir;
        return this;
    }

    public PipelineConfig withExpectedMemberCount(int count) {
        this.expectedMemberCount = count;
        return this;
    }

    public PipelineConfig withGroupingTolerance(Duration tolerance) {
        this.groupingTolerance = tolerance;
        return this;
    }

    public PipelineConfig withCollectionTimeout(Duration timeout) {
        this.collectionTimeout = timeout;
        return this;
    }

    public PipelineConfig withLateMemberPolicy(LateMemberPolicy policy) {
        this.lateMemberPolicy = policy;
        return this;
    }

    public PipelineConfig withLeaseDuration(Duration lease) {
        this.leaseDuration = lease;
        return this;
    }

    public PipelineConfig withMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    public PipelineConfig withRetryDelay(Duration delay) {
        this.retryDelay = delay;
        return this;
    }

    public PipelineConfig withArchiveRetention(Duration retention) {
        this.archiveRetention = retention;
        return this;
    }

    public PipelineConfig withValidityHalfWindow(Duration halfWindow) {
        this.validityHalfWindow = halfWindow;
        return this;
    }

    public PipelineConfig withFreshWindow(Duration window) {
        this.freshWindow = window;
        return this;
    }

    public PipelineConfig withVerifyCalibrationTables(boolean verify) {
        this.verifyCalibrationTables = verify;
        return this;
    }

    public PipelineConfig withWorkerPoolSize(int size) {
        this.workerPoolSize = size;
        return this;
    }

    public PipelineConfig withClaimPollInterval(Duration interval) {
        this.claimPollInterval = interval;
        return this;
    }

    public PipelineConfig withCollaboratorTimeout(Duration timeout) {
        this.collaboratorTimeout = timeout;
        return this;
    }

    public PipelineConfig withCollaboratorCommand(CollaboratorKind kind, List<String> command) {
        this.collaboratorCommands.put(kind, List.copyOf(command));
        return this;
    }

    public PipelineConfig withMosaicEnabled(boolean enabled) {
        this.mosaicEnabled = enabled;
        return this;
    }

    public PipelineConfig withSweepInterval(Duration interval) {
        this.sweepInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "storeUrl='" + storeUrl + '\'' +
                ", inputDirectory=" + inputDirectory +
                ", expectedMemberCount=" + expectedMemberCount +
                ", groupingTolerance=" + groupingTolerance +
                ", collectionTimeout=" + collectionTimeout +
                ", lateMemberPolicy=" + lateMemberPolicy +
                ", leaseDuration=" + leaseDuration +
                ", maxRetries=" + maxRetries +
                ", validityHalfWindow=" + validityHalfWindow +
                ", workerPoolSize=" + workerPoolSize +
                ", mosaicEnabled=" + mosaicEnabled +
                '}';
    }
}
