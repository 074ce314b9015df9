package com.coordinator.engine.store;

import com.coordinator.core.store.CoordinationStore;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decorator that retries reads and overwrite-style writes through a {@link StoreRetrier}.
 * 
 * Calls whose effect or answer changes when repeated (pushes, increments, removes,
 * conditional writes, the blocking move) pass straight through: a failure reported
 * after the write landed would otherwise be applied twice or answered wrongly.
 * Their errors reach the caller, and the stuck-inflight sweep and handoff
 * resumption repair any partial effect.
 */
public class RetryingCoordinationStore implements CoordinationStore {

    private final CoordinationStore delegate;
    private final StoreRetrier retrier;

    public RetryingCoordinationStore(CoordinationStore delegate, StoreRetrier retrier) {
        this.delegate = delegate;
        this.retrier = retrier;
    }

    @Override
    public void pushHead(String key, String value) {
        delegate.pushHead(key, value);
    }

    @Override
    public void pushTail(String key, String value) {
        delegate.pushTail(key, value);
    }

    @Override
    public Optional<String> moveBlocking(String source, String destination, Duration timeout) {
        return delegate.moveBlocking(source, destination, timeout);
    }

    @Override
    public long length(String key) {
        return retrier.call("length", () -> delegate.length(key));
    }

    @Override
    public List<String> range(String key) {
        return retrier.call("range", () -> delegate.range(key));
    }

    @Override
    public long remove(String key, String value, int count) {
        return delegate.remove(key, value, count);
    }

    @Override
    public Optional<String> hget(String key, String field) {
        return retrier.call("hget", () -> delegate.hget(key, field));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return retrier.call("hgetAll", () -> delegate.hgetAll(key));
    }

    @Override
    public void hset(String key, String field, String value) {
        retrier.run("hset", () -> delegate.hset(key, field, value));
    }

    @Override
    public void hsetAll(String key, Map<String, String> fields) {
        retrier.run("hsetAll", () -> delegate.hsetAll(key, fields));
    }

    @Override
    public boolean hsetIfAbsent(String key, String field, String value) {
        return delegate.hsetIfAbsent(key, field, value);
    }

    @Override
    public long hincrBy(String key, String field, long delta) {
        return delegate.hincrBy(key, field, delta);
    }

    @Override
    public boolean hdel(String key, String field) {
        return delegate.hdel(key, field);
    }

    @Override
    public boolean sadd(String key, String member) {
        return delegate.sadd(key, member);
    }

    @Override
    public boolean srem(String key, String member) {
        return delegate.srem(key, member);
    }

    @Override
    public boolean sismember(String key, String member) {
        return retrier.call("sismember", () -> delegate.sismember(key, member));
    }

    @Override
    public Set<String> smembers(String key) {
        return retrier.call("smembers", () -> delegate.smembers(key));
    }

    @Override
    public void delete(String key) {
        retrier.run("delete", () -> delegate.delete(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return delegate.expire(key, ttl);
    }

    @Override
    public boolean ping() {
        return delegate.ping();
    }
}
