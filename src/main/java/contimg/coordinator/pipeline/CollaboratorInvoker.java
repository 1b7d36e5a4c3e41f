package contimg.coordinator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls collaborators under a timeout and maps their outcome onto the failure taxonomy:
 * transport problems become {@link CollaboratorException}, reported failures become
 * {@link StageFailureException} carrying the collaborator's permanent flag.
 */
public class CollaboratorInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final Map<CollaboratorKind, Collaborator> collaborators;
    private final Duration timeout;
    private final ExecutorService executor;

    public CollaboratorInvoker(Map<CollaboratorKind, Collaborator> collaborators, Duration timeout) {
        this.collaborators = new EnumMap<>(CollaboratorKind.class);
        this.collaborators.putAll(collaborators);
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "contimg-collaborator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean has(CollaboratorKind kind) {
        return collaborators.containsKey(kind);
    }

    public CollaboratorResponse invoke(CollaboratorKind kind, PipelineStage stage, CollaboratorRequest request) {
        Collaborator collaborator = collaborators.get(kind);
        if (collaborator == null) {
            throw new StageFailureException(stage, "No " + kind + " collaborator configured", true);
        }

        log.debug("Invoking {} for stage {} with {} inputs", kind, stage, request.inputPaths().size());
        Future<CollaboratorResponse> future = executor.submit(() -> collaborator.invoke(request));
        CollaboratorResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException(kind + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorException(kind + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorException) {
                throw (CollaboratorException) cause;
            }
            if (cause instanceof StageFailureException) {
                throw (StageFailureException) cause;
            }
            throw new CollaboratorException(kind + " crashed: " + cause, cause);
        }

        if (response == null) {
            throw new CollaboratorException(kind + " returned no result");
        }
        if (!response.success()) {
            String message = response.message() == null ? kind + " reported failure" : response.message();
            throw new StageFailureException(stage, message, response.permanent());
        }
        return response;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
