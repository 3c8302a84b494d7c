package eu.virtualparadox.docalign.util.concurrent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Fixed-size worker pool whose {@link #map(Function, Iterator)} never runs more than
 * {@code processes * limitFactor} items ahead of the consumer.
 *
 * <h2>Backpressure</h2>
 * A dispatcher thread pulls items from the source only after acquiring a permit from a
 * semaphore sized to the look-ahead limit. The consumer releases one permit per result it
 * takes, so items that were dispatched but not yet consumed never exceed the limit. This
 * keeps memory bounded when inputs or results are large.
 *
 * <h2>Ordering &amp; errors</h2>
 * Results are returned in source order. A failing item rethrows its exception when the
 * consumer reaches it; runtime exceptions are rethrown as-is, anything else is wrapped in
 * an {@link IllegalStateException}.
 */
@Slf4j
public class LimitingPool implements AutoCloseable {

    private final ThreadPoolTaskExecutor workers;
    private final ThreadPoolTaskExecutor dispatchers;
    private final int processes;
    private final int maxAhead;

    /**
     * @param processes   worker count, {@code <= 0} selects the number of available processors
     * @param limitFactor look-ahead per worker, must be {@code >= 1}
     */
    public LimitingPool(final int processes, final int limitFactor) {
        if (limitFactor < 1) {
            throw new IllegalArgumentException("limitFactor must be at least 1");
        }
        this.processes = processes > 0 ? processes : Runtime.getRuntime().availableProcessors();
        this.maxAhead = this.processes * limitFactor;

        this.workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(this.processes);
        workers.setMaxPoolSize(this.processes);
        workers.setQueueCapacity(Integer.MAX_VALUE);
        workers.setThreadNamePrefix("align-");
        workers.setWaitForTasksToCompleteOnShutdown(false);
        workers.initialize();

        // one dispatcher per running map call, created on demand
        this.dispatchers = new ThreadPoolTaskExecutor();
        dispatchers.setCorePoolSize(0);
        dispatchers.setMaxPoolSize(Integer.MAX_VALUE);
        dispatchers.setQueueCapacity(0);
        dispatchers.setThreadNamePrefix("align-dispatch-");
        dispatchers.setDaemon(true);
        dispatchers.setWaitForTasksToCompleteOnShutdown(false);
        dispatchers.initialize();

        log.info("Started limiting pool with {} workers and at most {} items ahead", this.processes, maxAhead);
    }

    public int getProcesses() {
        return processes;
    }

    public int getMaxAhead() {
        return maxAhead;
    }

    /**
     * Applies {@code function} to every item of {@code items} on the worker pool.
     * The source iterator is consumed by a single dispatcher task.
     *
     * @param function work to run per item
     * @param items    source items, pulled lazily
     * @return iterator over the results, in source order
     */
    public <T, R> Iterator<R> map(final Function<? super T, ? extends R> function,
                                  final Iterator<? extends T> items) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(items, "items must not be null");

        final Semaphore permits = new Semaphore(maxAhead);
        final BlockingQueue<Slot<R>> results = new LinkedBlockingQueue<>();

        dispatchers.execute(() -> dispatch(function, items, permits, results));

        return new Iterator<>() {
            private Slot<R> head;

            @Override
            public boolean hasNext() {
                if (head == null) {
                    head = take(results);
                }
                return !head.isEnd();
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                final Slot<R> slot = head;
                head = null;
                try {
                    return slot.get();
                } finally {
                    permits.release();
                }
            }
        };
    }

    private <T, R> void dispatch(final Function<? super T, ? extends R> function,
                                 final Iterator<? extends T> items,
                                 final Semaphore permits,
                                 final BlockingQueue<Slot<R>> results) {
        try {
            while (true) {
                permits.acquire();
                if (!items.hasNext()) {
                    break;
                }
                final T item = items.next();
                final Callable<R> task = () -> function.apply(item);
                final Future<R> future = workers.submit(task);
                results.put(Slot.of(future));
            }
            results.put(Slot.end());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            results.offer(Slot.failed(e));
        } catch (RuntimeException e) {
            log.error("Reading work items failed", e);
            results.offer(Slot.failed(e));
        }
    }

    private static <R> Slot<R> take(final BlockingQueue<Slot<R>> results) {
        try {
            return results.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a result", e);
        }
    }

    @Override
    public void close() {
        // dispatchers of abandoned iterators are parked on the semaphore and get interrupted
        dispatchers.shutdown();
        workers.shutdown();
        log.info("Limiting pool shut down");
    }

    /**
     * Queue entry: a pending result, a dispatcher failure or the end marker.
     */
    private static final class Slot<R> {
        private final Future<R> future;
        private final Exception failure;

        private Slot(final Future<R> future, final Exception failure) {
            this.future = future;
            this.failure = failure;
        }

        static <R> Slot<R> of(final Future<R> future) {
            return new Slot<>(future, null);
        }

        static <R> Slot<R> failed(final Exception failure) {
            return new Slot<>(null, failure);
        }

        static <R> Slot<R> end() {
            return new Slot<>(null, null);
        }

        boolean isEnd() {
            return future == null && failure == null;
        }

        R get() {
            if (failure != null) {
                throw rethrow(failure);
            }
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for a result", e);
            } catch (ExecutionException e) {
                throw rethrow(e.getCause());
            }
        }

        private static RuntimeException rethrow(final Throwable cause) {
            if (cause instanceof RuntimeException) {
                return (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            return new IllegalStateException("Work item failed", cause);
        }
    }
}
