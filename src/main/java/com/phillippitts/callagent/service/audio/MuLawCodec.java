package com.phillippitts.callagent.service.audio;

import java.util.Objects;

/**
 * G.711 mu-law codec.
 *
 * <p>Decoding uses the standard 256-entry expansion table (sign-symmetric, 0x00 maps to -32124,
 * 0x80 to 32124, 0x7F and 0xFF to 0). Encoding uses the usual biased segment search with
 * clipping at 32635.
 */
public final class MuLawCodec {

    private static final int BIAS = 0x84;
    private static final int CLIP = 32_635;

    /** mu-law byte of a zero sample; used for silence. */
    public static final byte SILENCE = (byte) 0xFF;

    private static final short[] DECODE_TABLE = new short[256];

    static {
        for (int i = 0; i < 256; i++) {
            int u = ~i & 0xFF;
            int sign = u & 0x80;
            int exponent = (u >> 4) & 0x07;
            int mantissa = u & 0x0F;
            int magnitude = (((mantissa << 3) + BIAS) << exponent) - BIAS;
            DECODE_TABLE[i] = (short) (sign != 0 ? -magnitude : magnitude);
        }
    }

    private MuLawCodec() {}

    /**
     * Expands one mu-law byte into a 16-bit linear sample.
     */
    public static short decode(byte ulaw) {
        return DECODE_TABLE[ulaw & 0xFF];
    }

    /**
     * Expands a mu-law buffer into linear samples, one sample per input byte.
     */
    public static short[] decode(byte[] ulaw) {
        Objects.requireNonNull(ulaw, "ulaw must not be null");
        short[] samples = new short[ulaw.length];
        for (int i = 0; i < ulaw.length; i++) {
            samples[i] = DECODE_TABLE[ulaw[i] & 0xFF];
        }
        return samples;
    }

    /**
     * Compresses one 16-bit linear sample to mu-law.
     */
    public static byte encode(short pcm) {
        int sample = pcm;
        int sign = (sample >> 8) & 0x80;
        if (sign != 0) {
            sample = -sample;
        }
        if (sample > CLIP) {
            sample = CLIP;
        }
        sample += BIAS;

        int exponent = 7;
        for (int mask = 0x4000; (sample & mask) == 0 && exponent > 0; mask >>= 1) {
            exponent--;
        }
        int mantissa = (sample >> (exponent + 3)) & 0x0F;
        return (byte) ~(sign | (exponent << 4) | mantissa);
    }

    /**
     * Compresses a PCM16LE mono buffer to mu-law (one output byte per sample).
     *
     * @param pcm16le little-endian 16-bit samples; a trailing odd byte is ignored
     */
    public static byte[] encodePcm16Le(byte[] pcm16le) {
        Objects.requireNonNull(pcm16le, "pcm16le must not be null");
        int samples = pcm16le.length / 2;
        byte[] out = new byte[samples];
        for (int i = 0; i < samples; i++) {
            int lo = pcm16le[2 * i] & 0xFF;
            int hi = pcm16le[2 * i + 1];
            out[i] = encode((short) ((hi << 8) | lo));
        }
        return out;
    }
}
