package com.darinrandal.chromedata.api;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs lazily started requests with a bounded number in flight. A request is
 * only started once a slot is free, so the request source may be an unbounded
 * or generated sequence.
 *
 * <p>
 * The returned aggregate future completes once every request has settled and
 * its callback has returned. Callbacks are invoked one at a time, so they may
 * update unsynchronized state. A callback that throws fails the aggregate.
 * Completing or cancelling the aggregate from a callback stops further
 * requests from being started and suppresses the remaining callbacks.
 */
@NonNullByDefault
public final class RequestPool<T> {

    @FunctionalInterface
    public interface FulfilledCallback<T> {
        void onFulfilled(T value, int index, CompletableFuture<Void> aggregate) throws Exception;
    }

    @FunctionalInterface
    public interface RejectedCallback {
        void onRejected(Throwable reason, int index, CompletableFuture<Void> aggregate) throws Exception;
    }

    private static final Logger logger = LoggerFactory.getLogger(RequestPool.class);

    private final Iterator<? extends Supplier<? extends CompletableFuture<? extends T>>> requests;
    private final int concurrency;
    private final FulfilledCallback<? super T> fulfilled;
    private final RejectedCallback rejected;
    private final CompletableFuture<Void> aggregate = new CompletableFuture<>();
    private final Object lock = new Object();
    private final Object callbackLock = new Object();

    private int pending;
    private int nextIndex;
    private boolean exhausted;
    private boolean filling;

    private RequestPool(Iterator<? extends Supplier<? extends CompletableFuture<? extends T>>> requests,
            int concurrency, FulfilledCallback<? super T> fulfilled, RejectedCallback rejected) {
        this.requests = requests;
        this.concurrency = concurrency;
        this.fulfilled = fulfilled;
        this.rejected = rejected;
    }

    public static <T> CompletableFuture<Void> eachLimit(
            Iterable<? extends Supplier<? extends CompletableFuture<? extends T>>> requests, int concurrency,
            FulfilledCallback<? super T> fulfilled, RejectedCallback rejected) {
        Objects.requireNonNull(requests, "requests");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        RequestPool<T> pool = new RequestPool<>(Objects.requireNonNull(requests.iterator()), concurrency,
                Objects.requireNonNull(fulfilled, "fulfilled"), Objects.requireNonNull(rejected, "rejected"));
        pool.fill();
        return pool.aggregate;
    }

    private void fill() {
        synchronized (lock) {
            if (filling) {
                return;
            }
            filling = true;
        }
        while (true) {
            Supplier<? extends CompletableFuture<? extends T>> next;
            int index;
            synchronized (lock) {
                if (aggregate.isDone() || exhausted || pending >= concurrency) {
                    filling = false;
                    completeIfDrained();
                    return;
                }
                try {
                    if (!requests.hasNext()) {
                        exhausted = true;
                        filling = false;
                        completeIfDrained();
                        return;
                    }
                    next = Objects.requireNonNull(requests.next());
                } catch (RuntimeException e) {
                    filling = false;
                    aggregate.completeExceptionally(e);
                    return;
                }
                index = nextIndex++;
                pending++;
            }
            start(next, index);
        }
    }

    private void start(Supplier<? extends CompletableFuture<? extends T>> next, int index) {
        CompletableFuture<? extends T> future;
        try {
            future = Objects.requireNonNull(next.get());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        logger.trace("Started pooled request {}", index);
        future.whenComplete((value, error) -> settle(index, value, error));
    }

    private void settle(int index, @Nullable T value, @Nullable Throwable error) {
        synchronized (callbackLock) {
            if (!aggregate.isDone()) {
                try {
                    if (error != null) {
                        rejected.onRejected(SoapClient.unwrap(error), index, aggregate);
                    } else {
                        fulfilled.onFulfilled(Objects.requireNonNull(value), index, aggregate);
                    }
                } catch (Exception e) {
                    logger.debug("Callback for pooled request {} failed: {}", index, e.getMessage());
                    aggregate.completeExceptionally(e);
                }
            }
        }
        synchronized (lock) {
            pending--;
        }
        fill();
    }

    private void completeIfDrained() {
        if (exhausted && pending == 0 && !aggregate.isDone()) {
            aggregate.complete(null);
        }
    }
}
