package com.phillippitts.callagent.service.tts;

import com.phillippitts.callagent.exception.SynthesisException;
import com.phillippitts.callagent.service.audio.AudioFormat;
import com.phillippitts.callagent.service.audio.MuLawCodec;
import com.phillippitts.callagent.service.audio.PcmResampler;

import java.util.Objects;

/**
 * Audio returned by a speech synthesizer.
 *
 * @param data encoded audio
 * @param encoding how {@code data} is encoded
 * @param sampleRate sample rate of {@code data} in Hz
 */
public record SynthesizedAudio(byte[] data, Encoding encoding, int sampleRate) {

    /** Supported synthesizer output encodings. */
    public enum Encoding {
        /** G.711 mu-law, one byte per sample. */
        MULAW,
        /** Signed 16-bit little-endian PCM, mono. */
        PCM16LE
    }

    public SynthesizedAudio {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
    }

    public static SynthesizedAudio mulaw(byte[] data) {
        return new SynthesizedAudio(data, Encoding.MULAW, AudioFormat.TELEPHONY_SAMPLE_RATE);
    }

    /**
     * Converts to 8 kHz mu-law ready for the media stream.
     *
     * @throws SynthesisException if mu-law audio arrives at a rate other than 8 kHz
     */
    public byte[] toTelephonyMuLaw() {
        if (encoding == Encoding.MULAW) {
            if (sampleRate != AudioFormat.TELEPHONY_SAMPLE_RATE) {
                throw new SynthesisException("mu-law audio must be 8 kHz, got " + sampleRate + " Hz");
            }
            return data;
        }
        byte[] pcm8k = PcmResampler.resample(data, sampleRate, AudioFormat.TELEPHONY_SAMPLE_RATE);
        return MuLawCodec.encodePcm16Le(pcm8k);
    }
}
