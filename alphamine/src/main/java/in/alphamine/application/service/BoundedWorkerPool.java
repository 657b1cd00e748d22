package in.alphamine.application.service;

import in.alphamine.domain.common.BatchEntry;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.common.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fan-out/fan-in over a fixed concurrency window.
 *
 * At most {@code maxConcurrency} tasks of one {@link #run} call are in flight; the
 * calling thread submits the next input whenever one completes. Exceptions from a task
 * become a failure Outcome for that input only. The result lists every input exactly
 * once, in input order. The optional listener sees entries in completion order, on the
 * calling thread.
 *
 * One pool can serve any number of sequential or concurrent {@code run} calls.
 */
public final class BoundedWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private final String name;
    private final ExecutorService executor;

    public BoundedWorkerPool(String name) {
        this.name = name;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <I, R> BatchResult<I, R> run(List<I> inputs, int maxConcurrency, Function<I, R> task) {
        return run(inputs, maxConcurrency, task, null);
    }

    /**
     * @param listener receives each entry as it completes, may be null
     */
    public <I, R> BatchResult<I, R> run(List<I> inputs, int maxConcurrency, Function<I, R> task,
                                        Consumer<BatchEntry<I, R>> listener) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
        }
        if (inputs.isEmpty()) {
            return new BatchResult<>(List.of());
        }

        log.info("[{}] Running {} tasks, max {} in flight", name, inputs.size(), maxConcurrency);

        CompletionService<BatchEntry<I, R>> completions = new ExecutorCompletionService<>(executor);
        @SuppressWarnings("unchecked")
        BatchEntry<I, R>[] entries = new BatchEntry[inputs.size()];

        int next = 0;
        int window = Math.min(maxConcurrency, inputs.size());
        for (; next < window; next++) {
            submit(completions, next, inputs.get(next), task);
        }

        for (int done = 0; done < inputs.size(); done++) {
            BatchEntry<I, R> entry = awaitNext(completions);
            entries[entry.index()] = entry;
            if (next < inputs.size()) {
                submit(completions, next, inputs.get(next), task);
                next++;
            }
            if (listener != null) {
                try {
                    listener.accept(entry);
                } catch (RuntimeException e) {
                    log.warn("[{}] Completion listener failed for entry {}: {}", name, entry.index(), e.getMessage());
                }
            }
        }

        BatchResult<I, R> result = new BatchResult<>(new ArrayList<>(Arrays.asList(entries)));
        log.info("[{}] Completed {} tasks: {} succeeded, {} failed",
            name, result.size(), result.successCount(), result.failures().size());
        return result;
    }

    private <I, R> void submit(CompletionService<BatchEntry<I, R>> completions, int index, I input,
                               Function<I, R> task) {
        completions.submit(() -> {
            try {
                R value = task.apply(input);
                if (value == null) {
                    return new BatchEntry<>(index, input,
                        Outcome.failure(ErrorKind.UNEXPECTED, "Task returned no result"));
                }
                return new BatchEntry<>(index, input, Outcome.success(value));
            } catch (RuntimeException e) {
                log.warn("[{}] Task {} failed: {}", name, index, e.getMessage());
                return new BatchEntry<>(index, input,
                    Outcome.failure(FailureClassifier.kindOf(e), FailureClassifier.messageOf(e)));
            } catch (Error e) {
                log.error("[{}] Task {} crashed", name, index, e);
                return new BatchEntry<>(index, input,
                    Outcome.failure(ErrorKind.UNEXPECTED, FailureClassifier.messageOf(e)));
            }
        });
    }

    private <I, R> BatchEntry<I, R> awaitNext(CompletionService<BatchEntry<I, R>> completions) {
        try {
            return completions.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + name + " tasks", e);
        } catch (ExecutionException e) {
            // tasks turn their own failures into entries
            throw new IllegalStateException(name + " task crashed", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
