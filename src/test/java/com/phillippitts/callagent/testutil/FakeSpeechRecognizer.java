package com.phillippitts.callagent.testutil;

import com.phillippitts.callagent.domain.TranscriptFragment;
import com.phillippitts.callagent.exception.RecognitionException;
import com.phillippitts.callagent.service.stt.RecognitionListener;
import com.phillippitts.callagent.service.stt.RecognitionStream;
import com.phillippitts.callagent.service.stt.SpeechRecognizer;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fake streaming recognizer. Tests push transcripts through {@link #say(String, Instant)} as if
 * the recognizer had heard them.
 *
 * <p>Behavior can be controlled via public fields:
 * <ul>
 *   <li>{@code failOpen}: {@link #open} throws {@link RecognitionException}</li>
 * </ul>
 */
public class FakeSpeechRecognizer implements SpeechRecognizer {

    public volatile boolean failOpen;
    public final AtomicLong bytesReceived = new AtomicLong();
    public final AtomicBoolean closed = new AtomicBoolean();
    private volatile RecognitionListener listener;

    @Override
    public RecognitionStream open(String callId, RecognitionListener listener) {
        if (failOpen) {
            throw new RecognitionException("fake recognizer unavailable");
        }
        this.listener = listener;
        return new RecognitionStream() {
            @Override
            public void send(byte[] ulaw) {
                bytesReceived.addAndGet(ulaw.length);
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };
    }

    /**
     * Delivers a final transcript fragment.
     */
    public void say(String text, Instant at) {
        listener.onFragment(new TranscriptFragment(text, true, at));
    }

    /**
     * Delivers an interim transcript fragment.
     */
    public void hear(String text, Instant at) {
        listener.onFragment(new TranscriptFragment(text, false, at));
    }

    public boolean isOpen() {
        return listener != null && !closed.get();
    }
}
