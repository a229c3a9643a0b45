package com.example.shield.store;

import com.example.shield.model.SecurityEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded in-memory ring of security events, oldest first. Appends beyond
 * capacity drop the oldest entry.
 */
public class SecurityEventLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<SecurityEvent> events = new ArrayDeque<>();
    private final int capacity;

    public SecurityEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void append(SecurityEvent event) {
        lock.lock();
        try {
            events.addLast(event);
            while (events.size() > capacity) {
                events.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    public List<SecurityEvent> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(events);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Newest-first scan returning at most {@code limit} events accepted by {@code filter}.
     */
    public List<SecurityEvent> lastMatching(Predicate<SecurityEvent> filter, int limit) {
        List<SecurityEvent> matches = new ArrayList<>(limit);
        lock.lock();
        try {
            Iterator<SecurityEvent> it = events.descendingIterator();
            while (it.hasNext() && matches.size() < limit) {
                SecurityEvent event = it.next();
                if (filter.test(event)) {
                    matches.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        return matches;
    }

    /**
     * Drops events older than {@code cutoff}, taking the lock once per batch
     * so appends interleave with a long sweep.
     *
     * @return number of events removed
     */
    public long removeOlderThan(Instant cutoff, int batchSize) {
        long removed = 0;
        int batch;
        do {
            batch = 0;
            lock.lock();
            try {
                while (batch < batchSize && !events.isEmpty()
                        && events.peekFirst().getTimestamp().isBefore(cutoff)) {
                    events.pollFirst();
                    batch++;
                }
            } finally {
                lock.unlock();
            }
            removed += batch;
        } while (batch == batchSize);
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
