package com.coordinator.engine.state;

import com.coordinator.core.exception.StableIdConflictException;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.store.PipelineKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Issues stable numeric ids and keeps the immutable legacy id mapping.
 * 
 * The sequence is a single atomic counter, so ids are unique and increase in issue order
 * across processes. A mapping, once written, is never overwritten.
 */
public class StableIdService {

    private static final Logger log = LoggerFactory.getLogger(StableIdService.class);

    private static final String SEQUENCE_FIELD = "sequence";

    private final CoordinationStore store;
    private final PipelineKeys keys;

    public StableIdService(CoordinationStore store, PipelineKeys keys) {
        this.store = store;
        this.keys = keys;
    }

    /**
     * @return The next id of the sequence; never returned again
     */
    public long nextStableId() {
        return store.hincrBy(keys.stableIds(), SEQUENCE_FIELD, 1);
    }

    public Optional<Long> stableIdFor(String legacyId) {
        return store.hget(keys.legacyIdMap(), legacyId).map(Long::parseLong);
    }

    public Optional<String> ownerOf(long stableId) {
        return store.hget(keys.stableIdOwners(), Long.toString(stableId));
    }

    /**
     * Return the stable id mapped to a legacy id, issuing and recording the next id if unmapped.
     * Concurrent callers for the same legacy id all get the id that was recorded first.
     */
    public long assign(String legacyId) {
        Optional<Long> existing = stableIdFor(legacyId);
        if (existing.isPresent()) {
            return existing.get();
        }
        long candidate = nextStableId();
        // A concurrent bind may hold an id the sequence has not moved past yet
        while (!claimOwner(candidate, legacyId)) {
            candidate = nextStableId();
        }
        if (store.hsetIfAbsent(keys.legacyIdMap(), legacyId, Long.toString(candidate))) {
            log.debug("Mapped {} to stable id {}", legacyId, candidate);
            return candidate;
        }
        // Lost the race; the candidate is simply skipped in the sequence
        store.hdel(keys.stableIdOwners(), Long.toString(candidate));
        return stableIdFor(legacyId).orElseThrow(
            () -> new IllegalStateException("Stable id mapping for " + legacyId + " vanished"));
    }

    /**
     * Record a known mapping, e.g. from an artifact that already carries a stable id.
     *
     * @throws StableIdConflictException if the legacy id is mapped to a different id,
     *     or the stable id already belongs to another legacy id
     */
    public void bind(String legacyId, long stableId) {
        Optional<Long> mapped = stableIdFor(legacyId);
        if (mapped.isPresent()) {
            requireSame(legacyId, mapped.get(), stableId);
            return;
        }
        String owner = store.hget(keys.stableIdOwners(), Long.toString(stableId)).orElse(null);
        if (owner != null && !owner.equals(legacyId)) {
            throw StableIdConflictException.alreadyIssued(stableId, owner, legacyId);
        }
        boolean claimed = owner == null && claimOwner(stableId, legacyId);
        if (owner == null && !claimed) {
            String winner = ownerOf(stableId).orElse(legacyId);
            if (!winner.equals(legacyId)) {
                throw StableIdConflictException.alreadyIssued(stableId, winner, legacyId);
            }
        }
        if (!store.hsetIfAbsent(keys.legacyIdMap(), legacyId, Long.toString(stableId))) {
            long existing = stableIdFor(legacyId).orElse(stableId);
            if (existing != stableId && claimed) {
                store.hdel(keys.stableIdOwners(), Long.toString(stableId));
            }
            requireSame(legacyId, existing, stableId);
            return;
        }
        // Keep the sequence ahead of every bound id
        long current = store.hget(keys.stableIds(), SEQUENCE_FIELD).map(Long::parseLong).orElse(0L);
        if (current < stableId) {
            store.hincrBy(keys.stableIds(), SEQUENCE_FIELD, stableId - current);
        }
    }

    private boolean claimOwner(long stableId, String legacyId) {
        return store.hsetIfAbsent(keys.stableIdOwners(), Long.toString(stableId), legacyId);
    }

    private static void requireSame(String legacyId, long existing, long requested) {
        if (existing != requested) {
            throw new StableIdConflictException(legacyId, existing, requested);
        }
    }
}
