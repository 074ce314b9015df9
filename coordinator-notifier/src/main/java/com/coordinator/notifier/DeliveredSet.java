package com.coordinator.notifier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ids of recently delivered notifications, bounded in size.
 * When full, the oldest id is forgotten first.
 */
public class DeliveredSet {

    private final int capacity;
    private final Map<String, Boolean> ids;

    public DeliveredSet(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ids = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > DeliveredSet.this.capacity;
            }
        };
    }

    /**
     * @return true if the id was not in the set
     */
    public synchronized boolean add(String id) {
        return ids.put(id, Boolean.TRUE) == null;
    }

    public synchronized boolean contains(String id) {
        return ids.containsKey(id);
    }

    public synchronized int size() {
        return ids.size();
    }

    public int capacity() {
        return capacity;
    }
}
