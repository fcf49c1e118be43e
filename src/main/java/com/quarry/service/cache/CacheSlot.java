package com.quarry.service.cache;

import com.quarry.model.CacheSlotSnapshot;
import com.quarry.model.ResultFrame;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single-flight holder for one cache compartment.
 *
 * Holds at most one entry: a key and the shared future of the fetch started for it.
 * A lookup with the entry's key joins that future whether it is pending or resolved; any other key
 * replaces the entry. Callers already holding a replaced future still receive its value.
 * Each future is completed exactly once.
 */
@Slf4j
public class CacheSlot {

    public enum State {
        EMPTY,
        PENDING,
        RESOLVED
    }

    private final String name;
    private final Object lock = new Object();

    // guarded by lock
    private Entry entry;

    public CacheSlot(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Join the fetch for {@code key}, starting it if this slot does not hold that key.
     *
     * @param key cache key
     * @param fetch pipeline producing the frame; subscribed at most once per entry
     * @param onCancel result delivered to waiters if the slot is cleared while fetching
     * @return the shared result; cancelling it does not cancel the fetch
     */
    public Mono<ResultFrame> acquire(String key, Supplier<Mono<ResultFrame>> fetch, Supplier<Mono<ResultFrame>> onCancel) {
        Entry joined;
        boolean created = false;

        synchronized (lock) {
            if (entry != null && entry.key.equals(key)) {
                joined = entry;
            } else {
                if (entry != null) {
                    log.debug("Slot {} replacing key {} ({})", name, abbreviate(entry.key), entry.state());
                }
                joined = new Entry(key, onCancel);
                entry = joined;
                created = true;
            }
        }

        if (created) {
            log.debug("Slot {} fetching key {}", name, abbreviate(key));
            start(joined, fetch);
        } else {
            log.debug("Slot {} joined key {} ({})", name, abbreviate(key), joined.state());
        }
        return Mono.fromFuture(joined.future, true);
    }

    private void start(Entry started, Supplier<Mono<ResultFrame>> fetch) {
        if (started.subscription.isDisposed() || started.future.isDone()) {
            log.debug("Slot {} dropped key {} before its fetch started", name, abbreviate(started.key));
            return;
        }
        // a swap disposed by clear() cancels this subscription as soon as it is set
        started.subscription.update(Mono.defer(fetch)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Fetch completed without a result")))
                .subscribe(
                        frame -> {
                            started.fetching = false;
                            started.future.complete(frame);
                        },
                        error -> {
                            started.fetching = false;
                            evict(started);
                            started.future.completeExceptionally(error);
                        }));
    }

    /**
     * Drop the entry if it is still current, so the next lookup for its key fetches again.
     */
    private void evict(Entry failed) {
        synchronized (lock) {
            if (entry == failed) {
                entry = null;
            }
        }
    }

    /**
     * Empty the slot. A fetch still in flight is cancelled and its waiters get the entry's cancel result.
     */
    public void clear() {
        Entry cleared;
        synchronized (lock) {
            cleared = entry;
            entry = null;
        }
        if (cleared == null || cleared.future.isDone()) {
            return;
        }

        cleared.subscription.dispose();
        cleared.fetching = false;
        log.info("Slot {} cleared while fetching key {}", name, abbreviate(cleared.key));
        cleared.onCancel.get()
                .subscribe(cleared.future::complete, cleared.future::completeExceptionally);
    }

    public State state() {
        synchronized (lock) {
            return entry == null ? State.EMPTY : entry.state();
        }
    }

    public boolean isFetching() {
        synchronized (lock) {
            return entry != null && entry.fetching;
        }
    }

    public CacheSlotSnapshot snapshot() {
        synchronized (lock) {
            return CacheSlotSnapshot.builder()
                    .slot(name)
                    .state(entry == null ? State.EMPTY.name() : entry.state().name())
                    .key(entry == null ? null : entry.key)
                    .fetching(entry != null && entry.fetching)
                    .build();
        }
    }

    private static String abbreviate(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }

    private static final class Entry {
        final String key;
        final CompletableFuture<ResultFrame> future = new CompletableFuture<>();
        final Supplier<Mono<ResultFrame>> onCancel;
        volatile boolean fetching = true;
        final Disposable.Swap subscription = Disposables.swap();

        Entry(String key, Supplier<Mono<ResultFrame>> onCancel) {
            this.key = key;
            this.onCancel = onCancel;
        }

        State state() {
            return future.isDone() ? State.RESOLVED : State.PENDING;
        }
    }
}
