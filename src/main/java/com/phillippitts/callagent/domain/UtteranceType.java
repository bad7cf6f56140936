package com.phillippitts.callagent.domain;

/**
 * Classification of the assistant's last spoken utterance; drives the silence threshold.
 */
public enum UtteranceType {
    QUESTION,
    STATEMENT;

    /**
     * Classifies spoken text: a trailing question mark makes it a question.
     */
    public static UtteranceType of(String spokenText) {
        return spokenText != null && spokenText.trim().endsWith("?") ? QUESTION : STATEMENT;
    }
}
