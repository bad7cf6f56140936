package com.phillippitts.callagent.service.stt;

/**
 * An open recognition stream accepting raw 8 kHz mu-law audio.
 */
public interface RecognitionStream extends AutoCloseable {

    /**
     * Forwards inbound audio; must not block for long.
     */
    void send(byte[] ulaw);

    /**
     * Closes the stream. Idempotent; never throws.
     */
    @Override
    void close();
}
