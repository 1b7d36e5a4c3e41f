package contimg.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.grouping.DirectoryWatcher;
import contimg.coordinator.grouping.FileArrivalGrouper;
import contimg.coordinator.pipeline.CalibrationStage;
import contimg.coordinator.pipeline.Collaborator;
import contimg.coordinator.pipeline.CollaboratorInvoker;
import contimg.coordinator.pipeline.CollaboratorKind;
import contimg.coordinator.pipeline.LeaseKeeper;
import contimg.coordinator.pipeline.PipelineOrchestrator;
import contimg.coordinator.pipeline.ProcessCollaborator;
import contimg.coordinator.pipeline.ReferenceSourceResolver;
import contimg.coordinator.pipeline.WorkerPool;
import contimg.coordinator.repository.CalibrationRepository;
import contimg.coordinator.repository.GroupRepository;
import contimg.coordinator.repository.StatusEventRepository;
import contimg.coordinator.repository.TaskRepository;
import contimg.coordinator.scheduler.GroupSweeper;
import contimg.coordinator.scheduler.Scheduler;
import contimg.coordinator.scheduler.TaskReaper;
import contimg.coordinator.service.CalibrationRegistry;
import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.service.TaskService;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.JdbcDurableStore;
import contimg.coordinator.store.KeyspaceCalibrationRepository;
import contimg.coordinator.store.KeyspaceGroupRepository;
import contimg.coordinator.store.KeyspaceStatusEventRepository;
import contimg.coordinator.store.KeyspaceTaskRepository;
import contimg.coordinator.store.RecordCodec;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(PipelineConfig.fromEnv());
 * deps.startScheduler();
 * deps.startWorkers();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PipelineConfig config;
    private final Clock clock;
    private final DurableStore store;
    private final RecordCodec codec;
    private final TaskRepository taskRepository;
    private final GroupRepository groupRepository;
    private final CalibrationRepository calibrationRepository;
    private final StatusEventRepository statusEventRepository;
    private final StatusFeed statusFeed;
    private final TaskService taskService;
    private final IngestQueue ingestQueue;
    private final CalibrationRegistry calibrationRegistry;
    private final FileArrivalGrouper grouper;
    private final CollaboratorInvoker invoker;
    private final LeaseKeeper leaseKeeper;
    private final PipelineOrchestrator orchestrator;

    // Lazily created
    private Scheduler scheduler;
    private WorkerPool workerPool;
    private DirectoryWatcher watcher;

    private Dependencies(PipelineConfig config, Clock clock, Map<CollaboratorKind, Collaborator> collaborators,
            ReferenceSourceResolver resolver) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.store = new JdbcDurableStore(config, clock);
        this.codec = new RecordCodec();
        ObjectMapper mapper = codec.mapper();
        Backoff backoff = Backoff.defaults();

        // Repositories
        this.taskRepository = new KeyspaceTaskRepository(store, codec);
        this.groupRepository = new KeyspaceGroupRepository(store, codec);
        this.calibrationRepository = new KeyspaceCalibrationRepository(store, codec);
        this.statusEventRepository = new KeyspaceStatusEventRepository(store, codec);

        // Services
        this.statusFeed = new StatusFeed(statusEventRepository, store, clock);
        this.taskService = new TaskService(store, taskRepository, statusFeed, config, clock, backoff);
        this.ingestQueue = new IngestQueue(store, groupRepository, taskService, statusFeed, config, clock, backoff,
                mapper);
        this.calibrationRegistry = new CalibrationRegistry(store, calibrationRepository, statusFeed, config, clock,
                backoff);
        this.grouper = new FileArrivalGrouper(store, ingestQueue, statusFeed, config, clock, backoff);

        // Pipeline
        Map<CollaboratorKind, Collaborator> wired = new EnumMap<>(CollaboratorKind.class);
        config.collaboratorCommands().forEach((kind, command) -> wired.put(kind, new ProcessCollaborator(
                kind.name().toLowerCase(Locale.ROOT), command, config.collaboratorTimeout(), mapper)));
        wired.putAll(collaborators);
        this.invoker = new CollaboratorInvoker(wired, config.collaboratorTimeout());
        this.leaseKeeper = new LeaseKeeper(taskService, ingestQueue, clock, config.leaseDuration());
        CalibrationStage calibrationStage = new CalibrationStage(calibrationRegistry, invoker, resolver, statusFeed,
                config.verifyCalibrationTables());
        this.orchestrator = new PipelineOrchestrator(store, taskService, ingestQueue, leaseKeeper,
                PipelineOrchestrator.defaultHandlers(invoker, calibrationStage), config, clock, backoff, mapper);

        log.info("Dependencies initialized successfully ({} collaborators configured)", wired.size());
    }

    /**
     * Create dependencies with the given config, running collaborators as external commands.
     */
    public static Dependencies create(PipelineConfig config) {
        return new Dependencies(config, Clock.systemUTC(), Map.of(), ReferenceSourceResolver.none());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(PipelineConfig.fromEnv());
    }

    /**
     * Create dependencies with an explicit clock and in-process collaborators, which take
     * precedence over configured commands.
     */
    public static Dependencies create(PipelineConfig config, Clock clock,
            Map<CollaboratorKind, Collaborator> collaborators, ReferenceSourceResolver resolver) {
        return new Dependencies(config, clock, collaborators, resolver);
    }

    // Getters
    public PipelineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public DurableStore store() {
        return store;
    }

    public RecordCodec codec() {
        return codec;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public GroupRepository groupRepository() {
        return groupRepository;
    }

    public CalibrationRepository calibrationRepository() {
        return calibrationRepository;
    }

    public StatusFeed statusFeed() {
        return statusFeed;
    }

    public TaskService taskService() {
        return taskService;
    }

    public IngestQueue ingestQueue() {
        return ingestQueue;
    }

    public CalibrationRegistry calibrationRegistry() {
        return calibrationRegistry;
    }

    public FileArrivalGrouper grouper() {
        return grouper;
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new TaskReaper(taskService),
                    new GroupSweeper(ingestQueue, taskService, config.archiveRetention()),
                    config.sweepInterval());
        }
        return scheduler;
    }

    public WorkerPool workerPool() {
        if (workerPool == null) {
            workerPool = new WorkerPool(config.workerPoolSize(), hostId(), taskService, orchestrator,
                    config.claimPollInterval());
        }
        return workerPool;
    }

    public DirectoryWatcher watcher() {
        if (watcher == null) {
            watcher = new DirectoryWatcher(config.inputDirectory(), grouper);
        }
        return watcher;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void startWorkers() {
        workerPool().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        for (AutoCloseable closeable : List.<AutoCloseable>of(
                () -> {
                    if (watcher != null) {
                        watcher.close();
                    }
                },
                () -> {
                    if (workerPool != null) {
                        workerPool.stop();
                    }
                },
                () -> {
                    if (scheduler != null) {
                        scheduler.stop();
                    }
                },
                leaseKeeper,
                invoker,
                store)) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error during shutdown: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }

    private static String hostId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "contimg";
        }
    }
}
