package com.phillippitts.querybridge.service.queue;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage for jobs owned by a queue. Its lifetime is the queue's: created with it,
 * cleared when it closes.
 */
interface JobStore {

    void save(Job job);

    Optional<Job> find(String id);

    /** Weakly consistent view; safe to iterate while jobs are added or removed. */
    Collection<Job> all();

    boolean remove(String id);

    int size();

    void clear();
}
