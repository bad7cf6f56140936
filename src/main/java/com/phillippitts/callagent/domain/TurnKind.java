package com.phillippitts.callagent.domain;

/**
 * How a conversation turn was produced.
 */
public enum TurnKind {
    /** Caller speech transcript. */
    TRANSCRIPT,
    /** Pre-recorded snippet played from the audio library. */
    AUDIO,
    /** Synthesized speech. */
    TTS,
    /** System event such as a completed recording. */
    EVENT
}
