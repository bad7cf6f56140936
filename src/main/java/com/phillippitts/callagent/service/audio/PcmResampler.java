package com.phillippitts.callagent.service.audio;

import java.util.Objects;

/**
 * Linear-interpolation resampler for PCM16LE mono audio.
 *
 * <p>Used to bring synthesized speech down to the 8 kHz telephony rate before mu-law encoding.
 */
public final class PcmResampler {

    private PcmResampler() {}

    /**
     * Resamples little-endian 16-bit mono PCM from {@code sourceRate} to {@code targetRate}.
     *
     * @return resampled PCM16LE; the input array itself when the rates match
     * @throws IllegalArgumentException if either rate is not positive
     */
    public static byte[] resample(byte[] pcm16le, int sourceRate, int targetRate) {
        Objects.requireNonNull(pcm16le, "pcm16le must not be null");
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: "
                    + sourceRate + " -> " + targetRate);
        }
        if (sourceRate == targetRate) {
            return pcm16le;
        }

        int inSamples = pcm16le.length / 2;
        if (inSamples == 0) {
            return new byte[0];
        }
        long outSamples = (long) inSamples * targetRate / sourceRate;
        byte[] out = new byte[(int) outSamples * 2];
        double step = (double) sourceRate / targetRate;

        for (int i = 0; i < outSamples; i++) {
            double pos = i * step;
            int idx = (int) pos;
            double frac = pos - idx;
            int a = sampleAt(pcm16le, Math.min(idx, inSamples - 1));
            int b = sampleAt(pcm16le, Math.min(idx + 1, inSamples - 1));
            int value = (int) Math.round(a + (b - a) * frac);
            out[2 * i] = (byte) (value & 0xFF);
            out[2 * i + 1] = (byte) ((value >> 8) & 0xFF);
        }
        return out;
    }

    private static int sampleAt(byte[] pcm16le, int index) {
        int lo = pcm16le[2 * index] & 0xFF;
        int hi = pcm16le[2 * index + 1];
        return (short) ((hi << 8) | lo);
    }
}
