package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.AudioSnippet;
import com.phillippitts.callagent.service.library.AudioLibrary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic generator that routes caller speech to library snippets by keyword.
 *
 * <p>Used when no text-model collaborator is configured. Each snippet's filename doubles as its
 * trigger phrase ({@code blocked_drain.mp3} answers "blocked drain"); the longest matching phrase
 * wins and its manifest category becomes the intent. Goodbyes end the call, brush-offs get a
 * callback offer, anything else gets a follow-up question.
 */
public class KeywordResponseGenerator implements ResponseGenerator {

    private static final Logger LOG = LogManager.getLogger(KeywordResponseGenerator.class);

    static final String BUSY_REPLY = "I understand you're busy. Would you like me to call you at a better time?";
    static final String FOLLOW_UP = "Could you tell me a bit more about what's going on?";
    static final String QUICK_RESPONSE_CATEGORY = "quick_responses";

    private static final List<String> GOODBYE_PHRASES = List.of("goodbye", "bye", "hang up", "that's all");
    private static final List<String> NEGATIVE_PHRASES = List.of(
            "not interested", "busy", "later", "call back", "don't need", "not now");

    private final AudioLibrary library;

    public KeywordResponseGenerator(AudioLibrary library) {
        this.library = Objects.requireNonNull(library, "library must not be null");
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String lower = request.utterance().toLowerCase(Locale.ROOT);

        AudioSnippet best = null;
        int bestLength = 0;
        for (String key : library.keys()) {
            AudioSnippet snippet = library.snippet(key).orElse(null);
            if (snippet == null || QUICK_RESPONSE_CATEGORY.equals(snippet.category())) {
                continue;
            }
            String phrase = phraseFor(key);
            if (phrase.length() > bestLength && containsWord(lower, phrase)) {
                best = snippet;
                bestLength = phrase.length();
            }
        }
        if (best != null) {
            LOG.debug("Keyword match for call {}: {}", request.callId(), best.key());
            return new GenerationResult(new ResponseDirective.AudioKey(best.key()), best.category(), null);
        }

        if (containsAnyWord(lower, GOODBYE_PHRASES)) {
            String farewell = "Thanks for calling " + request.profile().businessName() + ". Have a great day!";
            return new GenerationResult(new ResponseDirective.SynthesizeText(farewell, true), "Goodbye", null);
        }
        if (containsAnyWord(lower, NEGATIVE_PHRASES)) {
            return new GenerationResult(ResponseDirective.SynthesizeText.say(BUSY_REPLY), "Not Interested", null);
        }
        return GenerationResult.of(ResponseDirective.SynthesizeText.say(FOLLOW_UP));
    }

    /** {@code blocked_drain.mp3} becomes {@code blocked drain}. */
    static String phraseFor(String key) {
        String name = key;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name.replace('_', ' ').replace('-', ' ').trim().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAnyWord(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (containsWord(text, phrase)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsWord(String text, String phrase) {
        if (phrase.isEmpty()) {
            return false;
        }
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b").matcher(text).find();
    }
}
