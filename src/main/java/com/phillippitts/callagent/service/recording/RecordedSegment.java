package com.phillippitts.callagent.service.recording;

import java.time.Instant;
import java.util.Objects;

/**
 * One captured chunk of mu-law audio.
 *
 * @param timestamp arrival (inbound) or send (outbound) time
 * @param direction which side of the call produced it
 * @param audio mu-law bytes; owned by the segment
 */
public record RecordedSegment(Instant timestamp, AudioDirection direction, byte[] audio) {

    public RecordedSegment {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(audio, "audio must not be null");
    }
}
