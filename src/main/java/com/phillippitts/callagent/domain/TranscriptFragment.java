package com.phillippitts.callagent.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A piece of recognized caller speech delivered by the streaming recognizer.
 *
 * @param text recognized text (may be blank for keep-alive results)
 * @param isFinal whether the recognizer will not revise this text any further
 * @param receivedAt arrival time
 */
public record TranscriptFragment(String text, boolean isFinal, Instant receivedAt) {

    public TranscriptFragment {
        text = text == null ? "" : text;
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
