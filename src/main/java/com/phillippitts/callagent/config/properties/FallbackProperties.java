package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * What the assistant says when a response cannot be produced.
 */
@Validated
@ConfigurationProperties(prefix = "call.fallback")
public class FallbackProperties {

    static final String DEFAULT_APOLOGY =
            "Sorry, I'm having a little trouble right now. Could you say that again?";

    /** Text synthesized when generation, synthesis or snippet lookup fails. */
    @NotBlank
    private final String apologyText;

    /** Snippet played when the apology itself cannot be synthesized; optional. */
    private final String apologySnippet;

    @ConstructorBinding
    public FallbackProperties(String apologyText, String apologySnippet) {
        this.apologyText = (apologyText == null || apologyText.isBlank()) ? DEFAULT_APOLOGY : apologyText;
        this.apologySnippet = (apologySnippet == null || apologySnippet.isBlank()) ? null : apologySnippet;
    }

    public static FallbackProperties defaults() {
        return new FallbackProperties(null, null);
    }

    public String getApologyText() { return apologyText; }
    public String getApologySnippet() { return apologySnippet; }
}
