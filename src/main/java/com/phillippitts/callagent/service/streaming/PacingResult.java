package com.phillippitts.callagent.service.streaming;

/**
 * Outcome of streaming one response.
 *
 * @param chunksSent frames written
 * @param bytesSent audio bytes written
 * @param interrupted whether streaming stopped early because of barge-in
 */
public record PacingResult(int chunksSent, long bytesSent, boolean interrupted) {

    public static PacingResult empty() {
        return new PacingResult(0, 0, false);
    }
}
