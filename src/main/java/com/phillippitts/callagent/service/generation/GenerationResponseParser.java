package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.exception.GenerationException;
import com.phillippitts.callagent.service.library.AudioLibrary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts raw text-model output into a {@link GenerationResult}.
 *
 * <p>Recognized layout:
 * <pre>
 * INTENT: Emergency Service          (optional, first line)
 * blocked_drain.mp3                  (snippet filename)
 *   or
 * GENERATE: text to speak DISCONNECT_CALL
 * STATUS: PAYMENT_LINK_SENT=Yes      (any line, removed from the response)
 * SMS_FLAG: PHONE_CONFIRMED=0412...  (any line, removed from the response)
 * </pre>
 * Output that follows none of these conventions is spoken as-is.
 *
 * <p>Stateless and thread-safe.
 */
public final class GenerationResponseParser {

    static final String INTENT_PREFIX = "INTENT:";
    static final String GENERATE_PREFIX = "GENERATE:";
    static final String DISCONNECT_MARKER = "DISCONNECT_CALL";
    static final String STATUS_PREFIX = "STATUS:";
    static final String SMS_FLAG_PREFIX = "SMS_FLAG:";
    static final String INTENT_ONLY_FALLBACK = "GENERATE: I understand. How can I help you with that?";

    private static final Pattern SNIPPET_LINE =
            Pattern.compile("^[\\w\\-]+\\.(mp3|ulaw|wav)(\\s*\\+\\s*[\\w\\-]+\\.(mp3|ulaw|wav))*$",
                    Pattern.CASE_INSENSITIVE);

    /**
     * @throws GenerationException if the output is empty or contains nothing to say or play
     */
    public GenerationResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new GenerationException("Empty generation response");
        }

        Map<String, String> tags = new LinkedHashMap<>();
        List<String> lines = new ArrayList<>();
        for (String line : raw.strip().split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith(STATUS_PREFIX)) {
                putTag(tags, trimmed.substring(STATUS_PREFIX.length()));
            } else if (trimmed.startsWith(SMS_FLAG_PREFIX)) {
                putTag(tags, trimmed.substring(SMS_FLAG_PREFIX.length()));
            } else if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        if (lines.isEmpty()) {
            throw new GenerationException("Generation response contained only status lines");
        }

        String intent = null;
        if (lines.get(0).startsWith(INTENT_PREFIX)) {
            intent = lines.remove(0).substring(INTENT_PREFIX.length()).trim();
            if (intent.isEmpty()) {
                intent = null;
            }
            if (lines.isEmpty()) {
                lines.add(INTENT_ONLY_FALLBACK);
            }
        }

        String body = String.join("\n", lines);
        return new GenerationResult(directiveFor(body), intent, tags);
    }

    private ResponseDirective directiveFor(String body) {
        if (body.startsWith(GENERATE_PREFIX)) {
            return speech(body.substring(GENERATE_PREFIX.length()));
        }
        String firstLine = body.lines().findFirst().orElse("").trim();
        if (SNIPPET_LINE.matcher(firstLine).matches()) {
            return new ResponseDirective.AudioKey(AudioLibrary.normalizeKey(firstLine));
        }
        return speech(body);
    }

    private static ResponseDirective speech(String text) {
        boolean disconnect = text.contains(DISCONNECT_MARKER);
        String cleaned = text.replace(DISCONNECT_MARKER, "").replaceAll("[ \\t]{2,}", " ").trim();
        if (cleaned.isEmpty() && !disconnect) {
            throw new GenerationException("Generation response contained no text to speak");
        }
        return new ResponseDirective.SynthesizeText(cleaned, disconnect);
    }

    private static void putTag(Map<String, String> tags, String tag) {
        String trimmed = tag.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        int eq = trimmed.indexOf('=');
        if (eq < 0) {
            tags.put(trimmed.toUpperCase(Locale.ROOT), StatusTags.YES);
        } else {
            String key = trimmed.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            if (!key.isEmpty()) {
                tags.put(key, trimmed.substring(eq + 1).trim());
            }
        }
    }
}
