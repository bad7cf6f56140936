package com.phillippitts.callagent.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.callagent.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.callagent.service.audio.AudioFormat.PCM_BITS_PER_SAMPLE;
import static com.phillippitts.callagent.service.audio.AudioFormat.PCM_BLOCK_ALIGN;
import static com.phillippitts.callagent.service.audio.AudioFormat.PCM_BYTE_RATE;
import static com.phillippitts.callagent.service.audio.AudioFormat.TELEPHONY_SAMPLE_RATE;

/**
 * Writes minimal PCM WAV files for call recordings.
 *
 * <p>Format: 8 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given samples as PCM16LE mono 8 kHz.
     *
     * @param samples linear 16-bit samples
     * @param wavPath output file path (will be created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public static void writePcm16Mono8kHz(short[] samples, Path wavPath) throws IOException {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            int dataSize = samples.length * PCM_BLOCK_ALIGN;

            // RIFF header (44 bytes total)
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            // fmt subchunk
            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) CHANNELS);
            writeLEInt(os, TELEPHONY_SAMPLE_RATE);
            writeLEInt(os, PCM_BYTE_RATE);
            writeLEShort(os, (short) PCM_BLOCK_ALIGN);
            writeLEShort(os, (short) PCM_BITS_PER_SAMPLE);

            // data subchunk
            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);

            byte[] data = new byte[dataSize];
            for (int i = 0; i < samples.length; i++) {
                data[2 * i] = (byte) (samples[i] & 0xFF);
                data[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
            }
            os.write(data);
            os.flush();
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
