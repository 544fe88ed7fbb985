package com.syncbridge.engine.persistence;

import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.TaskState;
import com.syncbridge.core.repository.ActivityTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of ActivityTaskQueue.
 * One lock guards every task, which makes claims atomic and lets enqueue wait for capacity.
 */
public class InMemoryActivityTaskQueue implements ActivityTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryActivityTaskQueue.class);

    private final Map<UUID, ActivityTask> tasks = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final int capacity;
    private final Duration dispatchWait;
    private int outstanding;

    public InMemoryActivityTaskQueue(int capacity, Duration dispatchWait) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.dispatchWait = dispatchWait;
    }

    @Override
    public void enqueue(ActivityTask task) {
        lock.lock();
        try {
            long remainingNanos = dispatchWait.toNanos();
            while (outstanding >= capacity) {
                if (remainingNanos <= 0) {
                    throw new TransientIOException("activity task queue",
                        String.format("full with %d outstanding tasks after waiting %s", outstanding, dispatchWait));
                }
                log.debug("Task queue full ({}), waiting to dispatch {}", outstanding, task.activityName());
                remainingNanos = notFull.awaitNanos(remainingNanos);
            }
            tasks.put(task.taskId(), task);
            outstanding++;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIOException("activity task queue", "interrupted while waiting for capacity");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ActivityTask> claimNext(
            Collection<String> activityNames, String workerId, Instant now, Duration leaseGrace) {
        lock.lock();
        try {
            Optional<ActivityTask> next = tasks.values().stream()
                .filter(t -> t.isDue(now))
                .filter(t -> activityNames.contains(t.activityName()))
                .min(Comparator.comparing(ActivityTask::availableAt)
                    .thenComparing(ActivityTask::enqueuedAt));
            return next.map(t -> {
                ActivityTask claimed = t.withClaimed(workerId, now, leaseGrace);
                tasks.put(claimed.taskId(), claimed);
                return claimed;
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean renewLease(UUID taskId, long fenceToken, Instant newExpiresAt) {
        lock.lock();
        try {
            ActivityTask task = tasks.get(taskId);
            if (!isHeld(task, fenceToken)) {
                return false;
            }
            tasks.put(taskId, task.withLeaseRenewed(newExpiresAt));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean complete(UUID taskId, long fenceToken) {
        lock.lock();
        try {
            ActivityTask task = tasks.get(taskId);
            if (!isHeld(task, fenceToken)) {
                return false;
            }
            tasks.put(taskId, task.withDone());
            release(1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean requeue(UUID taskId, long fenceToken, Instant availableAt) {
        lock.lock();
        try {
            ActivityTask task = tasks.get(taskId);
            if (!isHeld(task, fenceToken)) {
                return false;
            }
            tasks.put(taskId, task.withRequeued(availableAt));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int withdrawQueued(UUID workflowId) {
        lock.lock();
        try {
            List<ActivityTask> queued = tasks.values().stream()
                .filter(t -> t.workflowId().equals(workflowId) && t.state() == TaskState.QUEUED)
                .toList();
            queued.forEach(t -> tasks.put(t.taskId(), t.withDone()));
            release(queued.size());
            return queued.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ActivityTask> findById(UUID taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ActivityTask> findOutstanding(UUID workflowId) {
        lock.lock();
        try {
            return tasks.values().stream()
                .filter(t -> t.workflowId().equals(workflowId) && t.state() != TaskState.DONE)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ActivityTask> findExpiredLeases(Instant now, int limit) {
        lock.lock();
        try {
            return tasks.values().stream()
                .filter(t -> t.isLeaseExpired(now))
                .sorted(Comparator.comparing(ActivityTask::leaseExpiresAt))
                .limit(limit)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deleteDoneBefore(Instant enqueuedBefore) {
        lock.lock();
        try {
            int before = tasks.size();
            tasks.values().removeIf(t -> t.state() == TaskState.DONE && t.enqueuedAt().isBefore(enqueuedBefore));
            return before - tasks.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int outstandingCount() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private boolean isHeld(ActivityTask task, long fenceToken) {
        return task != null && task.state() == TaskState.RUNNING && task.fenceToken() == fenceToken;
    }

    private void release(int count) {
        if (count > 0) {
            outstanding -= count;
            notFull.signalAll();
        }
    }
}
