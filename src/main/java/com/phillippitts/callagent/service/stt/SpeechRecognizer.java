package com.phillippitts.callagent.service.stt;

import com.phillippitts.callagent.exception.RecognitionException;

/**
 * Streaming speech-to-text for one call's inbound audio.
 */
public interface SpeechRecognizer {

    /**
     * Opens a recognition stream for a call.
     *
     * @param callId call the stream belongs to
     * @param listener receives fragments and errors, possibly on a recognizer thread
     * @throws RecognitionException if the stream cannot be opened
     */
    RecognitionStream open(String callId, RecognitionListener listener);
}
