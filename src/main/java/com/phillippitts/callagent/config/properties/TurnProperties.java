package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for end-of-utterance detection.
 */
@Validated
@ConfigurationProperties(prefix = "call.turn")
public class TurnProperties {

    /** Silence that completes an utterance in normal conversation. */
    @Min(100)
    @Max(10_000)
    private final int baseSilenceMs;

    /** Silence that completes an utterance shortly after the assistant asked a question. */
    @Min(100)
    @Max(20_000)
    private final int questionSilenceMs;

    /** How long after a question the longer threshold applies. */
    @Min(0)
    @Max(120_000)
    private final int questionWindowMs;

    /** Minimum words before an utterance is dispatched. */
    @Min(1)
    @Max(20)
    private final int minWords;

    /** Interval of the per-call silence and timeout poll. */
    @Min(10)
    @Max(1_000)
    private final int pollIntervalMs;

    @ConstructorBinding
    public TurnProperties(Integer baseSilenceMs,
                          Integer questionSilenceMs,
                          Integer questionWindowMs,
                          Integer minWords,
                          Integer pollIntervalMs) {
        this.baseSilenceMs = baseSilenceMs == null ? 1_500 : baseSilenceMs;
        this.questionSilenceMs = questionSilenceMs == null ? 3_000 : questionSilenceMs;
        this.questionWindowMs = questionWindowMs == null ? 10_000 : questionWindowMs;
        this.minWords = minWords == null ? 2 : minWords;
        this.pollIntervalMs = pollIntervalMs == null ? 50 : pollIntervalMs;
    }

    public static TurnProperties defaults() {
        return new TurnProperties(null, null, null, null, null);
    }

    public int getBaseSilenceMs() { return baseSilenceMs; }
    public int getQuestionSilenceMs() { return questionSilenceMs; }
    public int getQuestionWindowMs() { return questionWindowMs; }
    public int getMinWords() { return minWords; }
    public int getPollIntervalMs() { return pollIntervalMs; }
}
