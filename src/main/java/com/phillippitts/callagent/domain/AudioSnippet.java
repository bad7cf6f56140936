package com.phillippitts.callagent.domain;

import java.util.Objects;

/**
 * A pre-encoded mu-law audio clip loaded from the snippet library.
 *
 * <p>The byte array is never modified after construction; callers must not mutate what
 * {@link #audio()} returns.
 *
 * @param key manifest filename used to address the clip
 * @param audio 8 kHz mu-law payload
 * @param transcript what the clip says
 * @param category manifest category the clip belongs to
 */
public record AudioSnippet(String key, byte[] audio, String transcript, String category) {

    public AudioSnippet {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(audio, "audio must not be null");
        transcript = transcript == null ? "" : transcript;
        category = category == null ? "" : category;
    }

    public int size() {
        return audio.length;
    }
}
