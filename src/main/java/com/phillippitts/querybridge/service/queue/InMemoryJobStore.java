package com.phillippitts.querybridge.service.queue;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link JobStore} on a concurrent map keyed by job id.
 */
final class InMemoryJobStore implements JobStore {

    private final ConcurrentMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Collection<Job> all() {
        return jobs.values();
    }

    @Override
    public boolean remove(String id) {
        return jobs.remove(id) != null;
    }

    @Override
    public int size() {
        return jobs.size();
    }

    @Override
    public void clear() {
        jobs.clear();
    }
}
