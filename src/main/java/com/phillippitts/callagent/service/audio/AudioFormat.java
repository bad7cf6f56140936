package com.phillippitts.callagent.service.audio;

/**
 * Single source of truth for telephony audio format.
 * Wire: 8 kHz G.711 mu-law, mono. Recordings: 8 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Telephony sample rate in Hz. */
    public static final int TELEPHONY_SAMPLE_RATE = 8_000;
    /** Bits per sample of decoded PCM. */
    public static final int PCM_BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int PCM_BLOCK_ALIGN = (PCM_BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second of decoded PCM at the telephony rate. */
    public static final int PCM_BYTE_RATE = TELEPHONY_SAMPLE_RATE * PCM_BLOCK_ALIGN;   // 16,000
    /** Bytes per second of mu-law audio (one byte per sample). */
    public static final int MULAW_BYTE_RATE = TELEPHONY_SAMPLE_RATE * CHANNELS;       // 8,000

    /** Peak sample value after normalization. */
    public static final int PCM16_FULL_SCALE = 32_767;

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)

    private AudioFormat() {}
}
