package com.coordinator.core.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared key-value store through which every coordinator process coordinates.
 * Each method is atomic on its own; nothing spans two calls.
 * Lists are read head first.
 *
 * Implementations signal recoverable outages with
 * {@link com.coordinator.core.exception.TransientStoreException}.
 */
public interface CoordinationStore {

    // ---- lists ----

    /**
     * Push a value onto the head of a list, creating it if absent.
     */
    void pushHead(String key, String value);

    /**
     * Push a value onto the tail of a list, creating it if absent.
     */
    void pushTail(String key, String value);

    /**
     * Atomically pop the head of {@code source} and push it onto the tail of {@code destination}.
     * Blocks until an element is available or the timeout elapses. This is the only blocking call.
     *
     * @param source List to take from
     * @param destination List to put into
     * @param timeout Maximum time to wait
     * @return The moved value, or empty on timeout
     */
    Optional<String> moveBlocking(String source, String destination, Duration timeout);

    /**
     * @return Number of elements in the list, 0 if absent
     */
    long length(String key);

    /**
     * @return A snapshot of the whole list, head first
     */
    List<String> range(String key);

    /**
     * Remove occurrences of a value from a list.
     *
     * @param count Maximum number to remove, 0 for all
     * @return Number removed
     */
    long remove(String key, String value, int count);

    // ---- hashes ----

    Optional<String> hget(String key, String field);

    /**
     * @return All fields of the hash, empty if absent
     */
    Map<String, String> hgetAll(String key);

    void hset(String key, String field, String value);

    void hsetAll(String key, Map<String, String> fields);

    /**
     * Set a field only if it does not exist yet.
     *
     * @return true if the field was written
     */
    boolean hsetIfAbsent(String key, String field, String value);

    /**
     * Atomically add to an integer field, treating an absent field as 0.
     *
     * @return The value after the increment
     */
    long hincrBy(String key, String field, long delta);

    /**
     * @return true if the field existed
     */
    boolean hdel(String key, String field);

    // ---- sets ----

    /**
     * @return true if the member was not present before
     */
    boolean sadd(String key, String member);

    /**
     * @return true if the member was present
     */
    boolean srem(String key, String member);

    boolean sismember(String key, String member);

    Set<String> smembers(String key);

    // ---- keys ----

    /**
     * Delete a key of any type.
     */
    void delete(String key);

    /**
     * Expire a key after the given time-to-live.
     *
     * @return false if the store does not support expiry or the key does not exist
     */
    default boolean expire(String key, Duration ttl) {
        return false;
    }

    /**
     * @return true if the store answers
     */
    boolean ping();
}
