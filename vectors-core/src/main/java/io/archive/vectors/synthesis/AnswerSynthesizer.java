package io.archive.vectors.synthesis;

import io.archive.vectors.retrieval.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Replaces the extractive answer of a retrieval result with a synthesized one
 * when the backend delivers in time. Any failure leaves the result as it was.
 *
 * <p>Backend availability is probed once, at construction.</p>
 */
public class AnswerSynthesizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    private final Summarizer summarizer;
    private final Duration timeout;
    private final boolean available;
    private final ExecutorService executor;

    public AnswerSynthesizer(Summarizer summarizer, Duration timeout) {
        this.summarizer = summarizer;
        this.timeout = timeout;
        this.available = summarizer != null && probe(summarizer);
        this.executor = available
            ? Executors.newCachedThreadPool(r -> {
                Thread thread = new Thread(r, "answer-synthesizer");
                thread.setDaemon(true);
                return thread;
            })
            : null;
        if (summarizer != null) {
            log.info("Summarizer {}: {}", summarizer.name(), available ? "available" : "unavailable, using extractive answers");
        }
    }

    /**
     * A synthesizer with no backend; every result passes through unchanged.
     */
    public static AnswerSynthesizer disabled() {
        return new AnswerSynthesizer(null, Duration.ZERO);
    }

    public RetrievalResult apply(RetrievalResult result) {
        if (!available || result.outcome() != RetrievalResult.Outcome.FOUND) {
            return result;
        }

        SynthesisResult synthesis = call(result);
        return synthesis.text()
            .map(result::withSynthesizedAnswer)
            .orElseGet(() -> {
                log.warn("Summarizer {} failed, keeping extractive answer: {}", summarizer.name(), synthesis.failureReason());
                return result;
            });
    }

    public boolean isAvailable() {
        return available;
    }

    public String backendName() {
        return summarizer != null ? summarizer.name() : "none";
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private SynthesisResult call(RetrievalResult result) {
        Future<SynthesisResult> future = executor.submit(() -> summarizer.summarize(result.query(), result.passages()));
        try {
            SynthesisResult synthesis = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return synthesis != null ? synthesis : SynthesisResult.failure("no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return SynthesisResult.failure("timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return SynthesisResult.failure(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SynthesisResult.failure("interrupted");
        }
    }

    private static boolean probe(Summarizer summarizer) {
        try {
            return summarizer.probeAvailability();
        } catch (RuntimeException e) {
            log.warn("Availability probe for {} failed: {}", summarizer.name(), e.getMessage());
            return false;
        }
    }
}
