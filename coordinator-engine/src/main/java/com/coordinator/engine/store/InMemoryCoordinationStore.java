package com.coordinator.engine.store;

import com.coordinator.core.store.CoordinationStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of CoordinationStore.
 * Single-process only; used for tests and for running the coordinator without a database.
 * 
 * One lock guards every key so each call is atomic with respect to all others,
 * matching the single-threaded command model of a real coordination store.
 */
public class InMemoryCoordinationStore implements CoordinationStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition listChanged = lock.newCondition();

    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private final Clock clock;

    public InMemoryCoordinationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void pushHead(String key, String value) {
        lock.lock();
        try {
            evictIfExpired(key);
            lists.computeIfAbsent(key, k -> new LinkedList<>()).addFirst(value);
            listChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void pushTail(String key, String value) {
        lock.lock();
        try {
            evictIfExpired(key);
            lists.computeIfAbsent(key, k -> new LinkedList<>()).addLast(value);
            listChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> moveBlocking(String source, String destination, Duration timeout) {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                evictIfExpired(source);
                Deque<String> from = lists.get(source);
                if (from != null && !from.isEmpty()) {
                    String value = from.pollFirst();
                    lists.computeIfAbsent(destination, k -> new LinkedList<>()).addLast(value);
                    return Optional.of(value);
                }
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = listChanged.awaitNanos(remainingNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long length(String key) {
        lock.lock();
        try {
            evictIfExpired(key);
            Deque<String> list = lists.get(key);
            return list == null ? 0 : list.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> range(String key) {
        lock.lock();
        try {
            evictIfExpired(key);
            Deque<String> list = lists.get(key);
            return list == null ? List.of() : List.copyOf(list);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long remove(String key, String value, int count) {
        lock.lock();
        try {
            evictIfExpired(key);
            Deque<String> list = lists.get(key);
            if (list == null) {
                return 0;
            }
            long removed = 0;
            Iterator<String> it = list.iterator();
            while (it.hasNext() && (count == 0 || removed < count)) {
                if (it.next().equals(value)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> hget(String key, String field) {
        lock.lock();
        try {
            evictIfExpired(key);
            Map<String, String> hash = hashes.get(key);
            return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        lock.lock();
        try {
            evictIfExpired(key);
            Map<String, String> hash = hashes.get(key);
            return hash == null ? Map.of() : Map.copyOf(hash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void hset(String key, String field, String value) {
        lock.lock();
        try {
            evictIfExpired(key);
            hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void hsetAll(String key, Map<String, String> fields) {
        lock.lock();
        try {
            evictIfExpired(key);
            hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(fields);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hsetIfAbsent(String key, String field, String value) {
        lock.lock();
        try {
            evictIfExpired(key);
            return hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putIfAbsent(field, value) == null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long hincrBy(String key, String field, long delta) {
        lock.lock();
        try {
            evictIfExpired(key);
            Map<String, String> hash = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
            long current;
            try {
                current = Long.parseLong(hash.getOrDefault(field, "0"));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Hash field " + key + "." + field + " is not an integer", e);
            }
            long updated = current + delta;
            hash.put(field, Long.toString(updated));
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hdel(String key, String field) {
        lock.lock();
        try {
            evictIfExpired(key);
            Map<String, String> hash = hashes.get(key);
            return hash != null && hash.remove(field) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean sadd(String key, String member) {
        lock.lock();
        try {
            evictIfExpired(key);
            return sets.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean srem(String key, String member) {
        lock.lock();
        try {
            evictIfExpired(key);
            Set<String> set = sets.get(key);
            return set != null && set.remove(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean sismember(String key, String member) {
        lock.lock();
        try {
            evictIfExpired(key);
            Set<String> set = sets.get(key);
            return set != null && set.contains(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> smembers(String key) {
        lock.lock();
        try {
            evictIfExpired(key);
            Set<String> set = sets.get(key);
            return set == null ? Set.of() : Set.copyOf(set);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            deleteLocked(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        lock.lock();
        try {
            evictIfExpired(key);
            if (!lists.containsKey(key) && !hashes.containsKey(key) && !sets.containsKey(key)) {
                return false;
            }
            expiries.put(key, clock.instant().plus(ttl));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ping() {
        return true;
    }

    /**
     * Snapshot every list at one instant. Lets tests check cross-list invariants
     * without racing concurrent writers.
     */
    public Map<String, List<String>> snapshotLists() {
        lock.lock();
        try {
            Map<String, List<String>> snapshot = new HashMap<>();
            lists.forEach((key, list) -> snapshot.put(key, new ArrayList<>(list)));
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    private void evictIfExpired(String key) {
        Instant expiresAt = expiries.get(key);
        if (expiresAt != null && !clock.instant().isBefore(expiresAt)) {
            deleteLocked(key);
        }
    }

    private void deleteLocked(String key) {
        lists.remove(key);
        hashes.remove(key);
        sets.remove(key);
        expiries.remove(key);
    }
}
