package com.phillippitts.callagent.service.tts;

import com.phillippitts.callagent.exception.SynthesisException;
import com.phillippitts.callagent.service.audio.AudioFormat;
import com.phillippitts.callagent.service.audio.MuLawCodec;
import com.phillippitts.callagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Synthesizer used when no text-to-speech vendor is configured.
 *
 * <p>Logs the text and returns mu-law silence lasting roughly as long as the text would take to
 * say (400 ms per word), so pacing, barge-in and turn timing behave as with real speech.
 */
public class SilentSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(SilentSpeechSynthesizer.class);

    static final int MILLIS_PER_WORD = 400;

    @Override
    public SynthesizedAudio synthesize(String text, String voiceId) {
        if (text == null || text.isBlank()) {
            throw new SynthesisException("Nothing to synthesize", voiceId);
        }
        int words = text.trim().split("\\s+").length;
        int bytes = words * MILLIS_PER_WORD * AudioFormat.MULAW_BYTE_RATE / 1000;
        byte[] silence = new byte[bytes];
        Arrays.fill(silence, MuLawCodec.SILENCE);
        LOG.info("Speaking (silent, voice={}): {}", voiceId, LogSanitizer.truncate(text, 80));
        return SynthesizedAudio.mulaw(silence);
    }
}
