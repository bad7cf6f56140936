package com.phillippitts.callagent.service.generation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one generation request.
 *
 * @param directive what to play or say
 * @param intent detected caller intent, or {@code null}
 * @param tags status tags reported alongside the response in reporting order, e.g. {@code PAYMENT_LINK_SENT=Yes}
 */
public record GenerationResult(ResponseDirective directive, String intent, Map<String, String> tags) {

    public GenerationResult {
        Objects.requireNonNull(directive, "directive must not be null");
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static GenerationResult of(ResponseDirective directive) {
        return new GenerationResult(directive, null, Map.of());
    }

    public Optional<String> intentOptional() {
        return Optional.ofNullable(intent);
    }
}
