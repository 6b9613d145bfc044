package com.sqconfig.core.cache;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RemoteObject;
import com.sqconfig.core.runner.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Identity map guaranteeing at most one live instance per {@link CacheKey}.
 *
 * <p>Construction is single-flight: concurrent {@link #getOrCreate} calls for the
 * same key run the factory once and all receive the same instance. A factory
 * failure leaves no entry behind, so the next call retries. The cache never talks
 * to the platform itself.
 */
public class RemoteObjectCache {

    private static final Logger log = LoggerFactory.getLogger(RemoteObjectCache.class);

    private final ConcurrentHashMap<CacheKey, CompletableFuture<RemoteObject>> entries = new ConcurrentHashMap<>();

    /**
     * Returns the cached instance for {@code key}, building it with {@code factory} if absent.
     */
    @SuppressWarnings("unchecked")
    public <T extends RemoteObject> T getOrCreate(CacheKey key, Supplier<T> factory) {
        var pending = new CompletableFuture<RemoteObject>();
        var existing = entries.putIfAbsent(key, pending);
        if (existing != null) {
            return (T) await(existing);
        }
        try {
            T created = factory.get();
            pending.complete(created);
            log.debug("Cached {}", key);
            return created;
        } catch (RuntimeException | Error e) {
            entries.remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Registers an instance produced by a bulk listing. If an instance is already
     * cached for its key, that instance is kept and returned.
     */
    @SuppressWarnings("unchecked")
    public <T extends RemoteObject> T put(T object) {
        var candidate = CompletableFuture.<RemoteObject>completedFuture(object);
        while (true) {
            var existing = entries.putIfAbsent(object.cacheKey(), candidate);
            if (existing == null) {
                return object;
            }
            try {
                return (T) await(existing);
            } catch (RuntimeException e) {
                // in-flight construction failed and its entry is gone: try again
                entries.remove(object.cacheKey(), existing);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends RemoteObject> T get(CacheKey key) {
        var future = entries.get(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return null;
        }
        return (T) future.join();
    }

    /**
     * Removes the entry of an object confirmed gone on the platform. An entry that
     * already maps to another instance is left untouched.
     */
    public void invalidate(RemoteObject object) {
        entries.computeIfPresent(object.cacheKey(),
                (key, future) -> !future.isCompletedExceptionally() && future.getNow(null) == object ? null : future);
        log.debug("Invalidated {}", object.cacheKey());
    }

    /**
     * Invalidates the object of a task that failed because the object no longer
     * exists on the platform.
     */
    public void invalidateIfGone(TaskOutcome<? extends RemoteObject, ?> outcome) {
        if (outcome.errorCode() == ErrorCode.NO_SUCH_KEY) {
            log.info("{} no longer exists, removed from cache", outcome.item());
            invalidate(outcome.item());
        }
    }

    public List<RemoteObject> values(ObjectType type) {
        var result = new ArrayList<RemoteObject>();
        for (var entry : entries.entrySet()) {
            var future = entry.getValue();
            if (entry.getKey().type() == type && future.isDone() && !future.isCompletedExceptionally()) {
                result.add(future.join());
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private static RemoteObject await(CompletableFuture<RemoteObject> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            if (e.getCause() instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
