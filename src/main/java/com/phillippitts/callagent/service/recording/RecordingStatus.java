package com.phillippitts.callagent.service.recording;

import java.time.Instant;

/**
 * Snapshot of an active recording.
 */
public record RecordingStatus(String callId,
                              boolean active,
                              Instant startedAt,
                              long inboundBytes,
                              long outboundBytes) {
}
