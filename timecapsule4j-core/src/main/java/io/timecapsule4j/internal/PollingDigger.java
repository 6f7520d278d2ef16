package io.timecapsule4j.internal;

import io.timecapsule4j.CapsuleStore;
import io.timecapsule4j.DigHandler;
import io.timecapsule4j.Digger;
import io.timecapsule4j.core.DiggerOptions;
import io.timecapsule4j.core.RetryExhaustedException;
import io.timecapsule4j.core.RetrySettings;
import io.timecapsule4j.core.TimeCapsule;
import io.timecapsule4j.utils.Attempts;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Digger} driven by a fixed-delay schedule.
 *
 * <p>Each tick runs to completion before the next one is scheduled, so a slow handler or a slow
 * store throttles this digger's poll rate instead of piling up ticks:
 * <ol>
 *   <li>{@code store.dig()} bounded by {@link DiggerOptions#operationTimeout()}; failures are logged</li>
 *   <li>the handler, synchronously, if one is set</li>
 *   <li>{@code store.destroy(capsule)}, re-attempted up to {@link DiggerOptions#retryLimit()} times
 *       within the operation timeout; a final failure is logged and the capsule may come back later</li>
 * </ol>
 *
 * <p>Typical usage:
 * <pre>{@code
 * Digger<String> digger = new PollingDigger<>(store, Duration.ofMillis(250));
 * digger.setHandler((d, capsule) -> send(capsule.payload()));
 * digger.start();
 *
 * digger.buryFor("hello", Duration.ofSeconds(1));
 * digger.stop();
 * }</pre>
 */
public class PollingDigger<P> implements Digger<P> {

    private final CapsuleStore<P> store;
    private final Duration digInterval;
    private final DiggerOptions options;
    private final Logger log;

    private final AtomicReference<DigHandler<P>> handler = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ExecutorService operations;
    private ScheduledFuture<?> digTask;
    private volatile Thread diggerThread;

    public PollingDigger(CapsuleStore<P> store, Duration digInterval) {
        this(store, digInterval, null);
    }

    public PollingDigger(CapsuleStore<P> store, Duration digInterval, DiggerOptions options) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.digInterval = Objects.requireNonNull(digInterval, "digInterval must not be null");
        if (digInterval.isZero() || digInterval.isNegative()) {
            throw new IllegalArgumentException("digInterval must be a positive duration");
        }
        this.options = DiggerOptions.defaults().merge(options);
        this.log = this.options.logger();
    }

    @Override
    public void setHandler(DigHandler<P> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        if (!this.handler.compareAndSet(null, handler)) {
            throw new IllegalStateException("Digger handler has already been set");
        }
    }

    @Override
    public CapsuleStore<P> store() {
        return store;
    }

    public DiggerOptions options() {
        return options;
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Digger has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("timecapsule.digger");
            t.setDaemon(true);
            diggerThread = t;
            return t;
        });
        operations = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("timecapsule.digger-io");
            t.setDaemon(true);
            return t;
        });

        long intervalMs = digInterval.toMillis();
        digTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("TimeCapsule digger started store={} digInterval={} retryLimit={} retryInterval={} operationTimeout={}",
                store.type(),
                digInterval,
                options.retryLimit(),
                options.retryInterval(),
                options.operationTimeout());
    }

    @Override
    public void stop() {
        // checked before taking the monitor: a handler calling stop() while another thread waits
        // for its tick must return at once
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            shutdown();
        }
    }

    private void shutdown() {
        boolean wasStarted = started.getAndSet(false);
        if (!wasStarted) {
            return;
        }

        log.info("TimeCapsule digger stopping store={}", store.type());

        if (digTask != null) {
            digTask.cancel(false);
            digTask = null;
        }

        scheduler.shutdown();
        if (Thread.currentThread() == diggerThread) {
            // called from a handler: the current tick finishes on its own
            operations.shutdown();
        } else {
            try {
                if (!scheduler.awaitTermination(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("TimeCapsule digger tick still running after {}, interrupting", options.shutdownTimeout());
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
            operations.shutdownNow();
        }

        log.info("TimeCapsule digger stopped store={}", store.type());
    }

    /**
     * One poll cycle. Anything escaping here would silently cancel the schedule, so only a
     * {@link VirtualMachineError} is rethrown, after being logged. An {@link Error} raised by the
     * handler is treated like a handler exception: logged, capsule not destroyed.
     */
    void tick() {
        if (!started.get()) {
            return;
        }
        try {
            dig().ifPresent(this::handle);
        } catch (RuntimeException e) {
            log.error("TimeCapsule digger tick failed store={} msg={}", store.type(), e.getMessage(), e);
        } catch (Error e) {
            log.error("TimeCapsule digger tick failed with error store={} msg={}", store.type(), e.getMessage(), e);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        }
    }

    private Optional<TimeCapsule<P>> dig() {
        AtomicBoolean abandoned = new AtomicBoolean(false);
        Callable<Optional<TimeCapsule<P>>> call = () -> {
            Optional<TimeCapsule<P>> dug = store.dig();
            if (abandoned.get()) {
                dug.ifPresent(c -> log.warn("TimeCapsule dropped capsule dug after its dig timed out store={} buriedAt={} payload={}",
                        store.type(), c.buriedAt(), c.payload()));
            }
            return dug;
        };
        try {
            return callWithTimeout(call, options.operationTimeout());
        } catch (TimeoutException e) {
            abandoned.set(true);
            log.error("TimeCapsule dig timed out after {} store={}; an entry it already popped is not requeued",
                    options.operationTimeout(), store.type());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("TimeCapsule failed to dig from store={} msg={}", store.type(), cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Optional.empty();
    }

    private void handle(TimeCapsule<P> capsule) {
        log.debug("TimeCapsule dug a capsule from store={} buriedAt={} dugOutAt={}",
                store.type(), capsule.buriedAt(), capsule.dugOutAt());

        DigHandler<P> h = handler.get();
        if (h != null) {
            try {
                h.handle(this, capsule);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("TimeCapsule handler interrupted store={} buriedAt={}", store.type(), capsule.buriedAt());
                return;
            } catch (Exception e) {
                log.error("TimeCapsule handler failed store={} buriedAt={} msg={}",
                        store.type(), capsule.buriedAt(), e.getMessage(), e);
                return;
            }
        }

        destroy(capsule);
    }

    private void destroy(TimeCapsule<P> capsule) {
        Instant deadline = Instant.now().plus(options.operationTimeout());
        RetrySettings retry = new RetrySettings(options.retryLimit(), options.retryInterval());
        try {
            int attempts = Attempts.withFixedDelay("destroy capsule", retry, deadline, attempt -> callWithTimeout(() -> {
                store.destroy(capsule);
                return null;
            }, Duration.between(Instant.now(), deadline)));
            log.debug("TimeCapsule burned a capsule from store={} attempts={}", store.type(), attempts);
        } catch (RetryExhaustedException e) {
            Throwable cause = e.getCause() instanceof ExecutionException ee && ee.getCause() != null
                    ? ee.getCause()
                    : e.getCause();
            log.error("TimeCapsule failed to burn capsule store={} attempts={} msg={}",
                    store.type(), e.attempts(), cause != null ? cause.getMessage() : e.getMessage(), e);
        }
    }

    private <T> T callWithTimeout(Callable<T> call, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new TimeoutException("no time left");
        }
        Future<T> future;
        try {
            future = operations.submit(call);
        } catch (RejectedExecutionException e) {
            // stopping: the in-flight tick completes its work on this thread
            try {
                return call.call();
            } catch (Exception callFailure) {
                throw new ExecutionException(callFailure);
            }
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
