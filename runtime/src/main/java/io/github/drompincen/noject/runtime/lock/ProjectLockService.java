package io.github.drompincen.noject.runtime.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes outline mutations per project. Work on different projects runs
 * concurrently; work on the same project runs one at a time in arrival order.
 */
@Service
public class ProjectLockService {

    private static final Logger log = LoggerFactory.getLogger(ProjectLockService.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String projectId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(projectId, k -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for outline lock of project {} ({} queued)", projectId, lock.getQueueLength());
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String projectId) {
        ReentrantLock lock = locks.get(projectId);
        return lock != null && lock.isLocked();
    }

    /** Drops the lock of a deleted project unless someone is holding or waiting on it. */
    public void evict(String projectId) {
        ReentrantLock lock = locks.get(projectId);
        if (lock != null && !lock.isLocked() && !lock.hasQueuedThreads()) {
            locks.remove(projectId, lock);
        }
    }

    int trackedProjects() {
        return locks.size();
    }
}
