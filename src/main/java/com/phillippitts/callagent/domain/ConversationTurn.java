package com.phillippitts.callagent.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry in a call's conversation history.
 *
 * @param speaker who spoke
 * @param kind transcript, snippet, synthesized speech or system event
 * @param text spoken or displayed text
 * @param audioKey snippet key when {@code kind} is AUDIO, otherwise {@code null}
 * @param responseTimeMs time from utterance completion to response start, or {@code null}
 * @param timestamp when the turn happened
 */
public record ConversationTurn(Speaker speaker,
                               TurnKind kind,
                               String text,
                               String audioKey,
                               Long responseTimeMs,
                               Instant timestamp) {

    public ConversationTurn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        text = text == null ? "" : text;
    }

    public static ConversationTurn caller(String transcript, Instant at) {
        return new ConversationTurn(Speaker.CALLER, TurnKind.TRANSCRIPT, transcript, null, null, at);
    }

    public static ConversationTurn audio(String key, String transcript, long responseTimeMs, Instant at) {
        return new ConversationTurn(Speaker.ASSISTANT, TurnKind.AUDIO, transcript, key, responseTimeMs, at);
    }

    public static ConversationTurn speech(String text, long responseTimeMs, Instant at) {
        return new ConversationTurn(Speaker.ASSISTANT, TurnKind.TTS, text, null, responseTimeMs, at);
    }

    public static ConversationTurn event(String description, Instant at) {
        return new ConversationTurn(Speaker.SYSTEM, TurnKind.EVENT, description, null, null, at);
    }
}
