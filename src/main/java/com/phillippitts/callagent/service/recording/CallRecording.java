package com.phillippitts.callagent.service.recording;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-call capture buffers: one lock-free queue per direction.
 */
final class CallRecording {

    private final String callId;
    private final Instant startedAt;
    private final Queue<RecordedSegment> inbound = new ConcurrentLinkedQueue<>();
    private final Queue<RecordedSegment> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicLong inboundBytes = new AtomicLong();
    private final AtomicLong outboundBytes = new AtomicLong();
    private volatile boolean active = true;

    CallRecording(String callId, Instant startedAt) {
        this.callId = callId;
        this.startedAt = startedAt;
    }

    void add(RecordedSegment segment) {
        if (!active) {
            return;
        }
        if (segment.direction() == AudioDirection.INBOUND) {
            inbound.add(segment);
            inboundBytes.addAndGet(segment.audio().length);
        } else {
            outbound.add(segment);
            outboundBytes.addAndGet(segment.audio().length);
        }
    }

    void deactivate() {
        active = false;
    }

    /**
     * Empties a queue into a list, preserving insertion order.
     */
    static List<RecordedSegment> drain(Queue<RecordedSegment> queue) {
        List<RecordedSegment> out = new ArrayList<>(queue.size());
        RecordedSegment segment;
        while ((segment = queue.poll()) != null) {
            out.add(segment);
        }
        return out;
    }

    String callId() { return callId; }
    Instant startedAt() { return startedAt; }
    boolean isActive() { return active; }
    Queue<RecordedSegment> inbound() { return inbound; }
    Queue<RecordedSegment> outbound() { return outbound; }

    RecordingStatus status() {
        return new RecordingStatus(callId, active, startedAt, inboundBytes.get(), outboundBytes.get());
    }
}
