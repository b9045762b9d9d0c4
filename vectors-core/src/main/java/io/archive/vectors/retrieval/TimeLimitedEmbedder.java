package io.archive.vectors.retrieval;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every embedding call by a timeout; a slow or failing embedder is
 * reported as unavailable.
 */
public class TimeLimitedEmbedder implements QueryEmbedder, AutoCloseable {

    private final QueryEmbedder delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedEmbedder(QueryEmbedder delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "query-embedder");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public float[] embed(String text) {
        Future<float[]> future = executor.submit(() -> delegate.embed(text));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbedderUnavailableException("Query embedding timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof EmbedderUnavailableException unavailable) {
                throw unavailable;
            }
            throw new EmbedderUnavailableException("Query embedding failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbedderUnavailableException("Interrupted while embedding query", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
