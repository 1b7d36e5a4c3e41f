package contimg.coordinator.fixture;

import contimg.coordinator.config.PipelineConfig;

import java.time.Duration;

/**
 * Per-test H2 in-memory databases.
 */
public final class TestStores {

    private TestStores() {
    }

    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    /**
     * Defaults pointed at a fresh in-memory store with a short lock wait.
     */
    public static PipelineConfig config(String name) {
        return PipelineConfig.defaults()
                .withStoreUrl(memoryUrl(name))
                .withStoreWaitTimeout(Duration.ofSeconds(2));
    }
}
