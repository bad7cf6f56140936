package com.phillippitts.callagent.service.generation;

import java.util.Objects;

/**
 * What the assistant does next: play a cached snippet or speak synthesized text.
 */
public interface ResponseDirective {

    /**
     * Play the pre-encoded snippet stored under {@code key}.
     */
    record AudioKey(String key) implements ResponseDirective {
        public AudioKey {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
        }
    }

    /**
     * Synthesize and speak {@code text}; hang up afterwards when {@code disconnect} is set.
     */
    record SynthesizeText(String text, boolean disconnect) implements ResponseDirective {
        public SynthesizeText {
            Objects.requireNonNull(text, "text must not be null");
        }

        public static SynthesizeText say(String text) {
            return new SynthesizeText(text, false);
        }
    }
}
