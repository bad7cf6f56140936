package com.phillippitts.callagent.service.streaming;

import com.phillippitts.callagent.exception.TransportException;

/**
 * Outbound half of a telephony media stream.
 *
 * <p>Implementations must allow sends from several threads; frames from one thread are delivered
 * in order.
 */
public interface MediaStreamConnection {

    /**
     * Sends one frame of mu-law audio.
     *
     * @throws TransportException if the frame could not be written
     */
    void sendMedia(String streamSid, byte[] ulaw);

    /**
     * Asks the provider to discard audio it has buffered but not yet played.
     *
     * @throws TransportException if the frame could not be written
     */
    void sendClear(String streamSid);

    /**
     * Tells the provider the stream is ending.
     *
     * @throws TransportException if the frame could not be written
     */
    void sendStop(String streamSid);

    boolean isOpen();

    /**
     * Closes the connection. Idempotent; never throws.
     */
    void close();
}
