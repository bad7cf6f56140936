package com.phillippitts.callagent.service.streaming;

import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.exception.TransportException;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams mu-law audio to a media connection in fixed-size, paced, interruptible frames.
 *
 * <p>Audio is split into {@code chunkBytes} frames (the last one may be shorter) written in order
 * with {@code frameDelayMs} between frames. The interruption flag is checked before every frame,
 * including the trailing partial one, and streaming stops as soon as it is set. Every frame that was
 * written is mirrored to the recorder as outbound audio.
 *
 * <p>Blocks the calling thread for the whole response; run it on the response executor.
 */
public class StreamPacer {

    private static final Logger LOG = LogManager.getLogger(StreamPacer.class);

    private final int chunkBytes;
    private final long frameDelayMs;
    private final DualStreamRecorder recorder;
    private final Sleeper sleeper;

    public StreamPacer(StreamingProperties properties, DualStreamRecorder recorder, Sleeper sleeper) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.chunkBytes = properties.getChunkBytes();
        this.frameDelayMs = properties.getFrameDelayMs();
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Streams {@code audio} to {@code connection}.
     *
     * @param audio mu-law bytes to send
     * @param connection media connection of the call
     * @param streamSid stream identifier for the frame envelope
     * @param callId call whose recording receives the outbound audio
     * @param interruption barge-in flag; checked before every frame
     * @return frames and bytes written, and whether streaming was interrupted
     * @throws TransportException if a frame cannot be written
     */
    public PacingResult stream(byte[] audio,
                               MediaStreamConnection connection,
                               String streamSid,
                               String callId,
                               AtomicBoolean interruption) {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(interruption, "interruption must not be null");
        if (audio == null || audio.length == 0) {
            return PacingResult.empty();
        }

        int chunks = 0;
        long bytes = 0;
        for (int offset = 0; offset < audio.length; offset += chunkBytes) {
            if (interruption.get()) {
                LOG.debug("Streaming interrupted for call {} after {} chunks", callId, chunks);
                return new PacingResult(chunks, bytes, true);
            }
            byte[] chunk = Arrays.copyOfRange(audio, offset, Math.min(offset + chunkBytes, audio.length));
            connection.sendMedia(streamSid, chunk);
            recorder.addOutbound(callId, chunk);
            chunks++;
            bytes += chunk.length;

            if (offset + chunkBytes < audio.length && frameDelayMs > 0) {
                try {
                    sleeper.sleep(frameDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.debug("Streaming thread interrupted for call {}", callId);
                    return new PacingResult(chunks, bytes, true);
                }
            }
        }
        return new PacingResult(chunks, bytes, false);
    }

    public int getChunkBytes() {
        return chunkBytes;
    }
}
