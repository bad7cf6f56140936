package com.phillippitts.callagent.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs tasks one at a time, in submission order, on a shared backing executor.
 *
 * <p>Each call gets its own lane so that session state is only touched by one thread at a time
 * without dedicating a thread per call. Tasks run with {@code callId} in the Log4j2 thread
 * context. A task that throws is logged and does not stop the lane.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Executor backing;
    private final String callId;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;

    public SerialExecutor(Executor backing, String callId) {
        this.backing = Objects.requireNonNull(backing, "backing executor must not be null");
        this.callId = Objects.requireNonNull(callId, "callId must not be null");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        synchronized (tasks) {
            tasks.offer(() -> runGuarded(task));
            if (active == null) {
                scheduleNext();
            }
        }
    }

    private void runGuarded(Runnable task) {
        String previous = ThreadContext.get("callId");
        ThreadContext.put("callId", callId);
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Task failed on lane for call {}", callId, e);
        } finally {
            if (previous == null) {
                ThreadContext.remove("callId");
            } else {
                ThreadContext.put("callId", previous);
            }
            synchronized (tasks) {
                scheduleNext();
            }
        }
    }

    // Caller holds the tasks monitor.
    private void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            backing.execute(active);
        }
    }

    public int pending() {
        synchronized (tasks) {
            return tasks.size();
        }
    }
}
