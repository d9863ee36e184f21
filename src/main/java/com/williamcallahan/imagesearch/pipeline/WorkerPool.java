package com.williamcallahan.imagesearch.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of workers applying one {@link StageTask} to a stream of inputs.
 *
 * <p>At most {@code workers} inputs wait in the input channel and at most {@code workers} are
 * being processed, so {@link #submit} blocks once the stage is saturated. Outcomes are delivered
 * in completion order through {@link #next}, which returns empty once {@link #complete} was called
 * and every worker has drained. Exactly one thread should consume outcomes.</p>
 *
 * @param <I> input type
 * @param <O> output type
 */
public final class WorkerPool<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final StageTask<I, O> task;
    private final BlockingQueue<Slot<I>> inputs;
    private final BlockingQueue<Optional<StageOutcome<I, O>>> outcomes;
    private final ExecutorService executor;
    private final ThreadFactoryBuilder threadFactoryBuilder;
    private final AtomicInteger runningWorkers;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final int workers;
    private volatile Thread feeder;
    private boolean exhausted;

    /**
     * Starts {@code workers} threads named after the stage.
     *
     * @param name stage name used for thread names and log messages
     * @param workers number of concurrent workers, also the channel capacities
     * @param task work applied to every input
     */
    public WorkerPool(String name, int workers, StageTask<I, O> task) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.task = Objects.requireNonNull(task, "task");
        this.workers = workers;
        this.inputs = new ArrayBlockingQueue<>(workers);
        this.outcomes = new ArrayBlockingQueue<>(workers * 2);
        this.runningWorkers = new AtomicInteger(workers);
        this.threadFactoryBuilder = new ThreadFactoryBuilder().setDaemon(true);
        this.executor = Executors.newFixedThreadPool(
                workers, threadFactoryBuilder.setNameFormat(name + "-%d").build());
        for (int i = 0; i < workers; i++) {
            executor.execute(this::workLoop);
        }
    }

    /**
     * Hands one input to the stage, blocking while the input channel is full.
     */
    public void submit(I input) {
        Objects.requireNonNull(input, "input");
        if (completed.get()) {
            throw new IllegalStateException("Stage " + name + " no longer accepts input");
        }
        put(inputs, new Slot<>(input));
    }

    /**
     * Submits every item from a dedicated feeder thread, then calls {@link #complete}.
     *
     * <p>The caller stays free to drain {@link #next} while the feeder blocks on a full stage.</p>
     *
     * @param items inputs in submission order
     */
    public void feedAll(Collection<? extends I> items) {
        Objects.requireNonNull(items, "items");
        Thread feederThread = threadFactoryBuilder.setNameFormat(name + "-feeder").build().newThread(() -> {
            try {
                for (I item : items) {
                    submit(item);
                }
                complete();
            } catch (IllegalStateException stopped) {
                log.debug("[PIPELINE] Stage {} feeder stopped: {}", name, stopped.getMessage());
            }
        });
        this.feeder = feederThread;
        feederThread.start();
    }

    /**
     * Signals that no more input follows. Idempotent.
     */
    public void complete() {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < workers; i++) {
            put(inputs, Slot.endOfInput());
        }
    }

    /**
     * Waits for the next finished outcome.
     *
     * @return the outcome, or empty once the stage has completed and drained
     */
    public Optional<StageOutcome<I, O>> next() {
        if (exhausted) {
            return Optional.empty();
        }
        try {
            Optional<StageOutcome<I, O>> outcome = outcomes.take();
            if (outcome.isEmpty()) {
                exhausted = true;
            }
            return outcome;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for stage " + name, interrupted);
        }
    }

    /**
     * Stops all workers, abandoning queued input.
     */
    @Override
    public void close() {
        Thread feederThread = feeder;
        if (feederThread != null) {
            feederThread.interrupt();
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[PIPELINE] Stage {} workers did not stop within 5s", name);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void workLoop() {
        try {
            Slot<I> slot = inputs.take();
            while (!slot.isEndOfInput()) {
                outcomes.put(Optional.of(run(slot.item())));
                slot = inputs.take();
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        } finally {
            if (runningWorkers.decrementAndGet() == 0) {
                signalEndOfStream();
            }
        }
    }

    private void signalEndOfStream() {
        // Interrupted only by close(), whose caller no longer reads outcomes.
        if (!outcomes.offer(Optional.empty())) {
            try {
                outcomes.put(Optional.empty());
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private StageOutcome<I, O> run(I input) {
        try {
            O output = task.apply(input);
            if (output == null) {
                return StageOutcome.failure(input, new IllegalStateException("Stage " + name + " produced no output"));
            }
            return StageOutcome.success(input, output);
        } catch (Exception failure) {
            log.debug("[PIPELINE] Stage {} failed for {}: {}", name, input, failure.getMessage());
            return StageOutcome.failure(input, failure);
        } catch (Error error) {
            log.error("[PIPELINE] Stage {} hit {} for {}", name, error.getClass().getSimpleName(), input);
            return StageOutcome.failure(input, new IllegalStateException(
                    "Stage " + name + " aborted with " + error.getClass().getSimpleName() + ": " + error.getMessage(),
                    error));
        }
    }

    private <T> void put(BlockingQueue<T> queue, T element) {
        try {
            queue.put(element);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while feeding stage " + name, interrupted);
        }
    }

    private record Slot<I>(I item) {
        private static final Slot<?> END_OF_INPUT = new Slot<>(null);

        @SuppressWarnings("unchecked")
        static <I> Slot<I> endOfInput() {
            return (Slot<I>) END_OF_INPUT;
        }

        boolean isEndOfInput() {
            return this == END_OF_INPUT;
        }
    }
}
