package com.phillippitts.callagent.service.stt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Recognizer used when no speech-to-text vendor is configured.
 *
 * <p>Accepts audio and logs how much was received when the stream closes; never produces
 * transcripts. Calls still start, record, greet and time out normally.
 */
public class LoggingSpeechRecognizer implements SpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(LoggingSpeechRecognizer.class);

    @Override
    public RecognitionStream open(String callId, RecognitionListener listener) {
        LOG.warn("No speech recognizer configured; call {} will not be transcribed", callId);
        return new CountingStream(callId);
    }

    private static final class CountingStream implements RecognitionStream {
        private final String callId;
        private final AtomicLong bytes = new AtomicLong();
        private final AtomicBoolean closed = new AtomicBoolean();

        CountingStream(String callId) {
            this.callId = callId;
        }

        @Override
        public void send(byte[] ulaw) {
            if (!closed.get() && ulaw != null) {
                bytes.addAndGet(ulaw.length);
            }
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                LOG.debug("Recognition stream closed for call {} ({} bytes received)", callId, bytes.get());
            }
        }
    }
}
