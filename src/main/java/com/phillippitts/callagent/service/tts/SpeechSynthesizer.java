package com.phillippitts.callagent.service.tts;

import com.phillippitts.callagent.exception.SynthesisException;

/**
 * Text-to-speech.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes text in a voice.
     *
     * @param text what to say
     * @param voiceId voice from the client profile
     * @throws SynthesisException if synthesis fails
     */
    SynthesizedAudio synthesize(String text, String voiceId);
}
