package com.phillippitts.callagent.service.recording;

import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.exception.RecordingException;
import com.phillippitts.callagent.service.audio.AudioFormat;
import com.phillippitts.callagent.service.audio.MuLawCodec;
import com.phillippitts.callagent.service.audio.WavWriter;
import com.phillippitts.callagent.service.logging.CallEventLog;
import com.phillippitts.callagent.service.metrics.CallMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Records both directions of a call and writes one chronologically merged WAV file per call.
 *
 * <p>Capture is a lock-free queue append per chunk, safe to call from the transport thread and
 * the response streaming thread at the same time. {@link #stop(String)} hands the buffers to the
 * recording executor, which must be single-threaded so recordings finalize in stop order.
 *
 * <p><b>Finalization:</b> segments from both directions are stable-sorted by timestamp (inbound
 * first on equal timestamps), concatenated, expanded from mu-law to 16-bit PCM, peak-normalized to
 * full scale and written as 8 kHz mono WAV named {@code yyyyMMdd_HHmmss_<callId>.wav}. A failure
 * drops that recording only.
 */
public class DualStreamRecorder {

    private static final Logger LOG = LogManager.getLogger(DualStreamRecorder.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final RecordingProperties properties;
    private final Executor recordingExecutor;
    private final CallEventLog eventLog;
    private final CallMetrics metrics;
    private final Clock clock;
    private final Map<String, CallRecording> recordings = new ConcurrentHashMap<>();

    public DualStreamRecorder(RecordingProperties properties,
                              Executor recordingExecutor,
                              CallEventLog eventLog,
                              CallMetrics metrics,
                              Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.recordingExecutor = Objects.requireNonNull(recordingExecutor, "recordingExecutor must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts recording a call.
     *
     * @return {@code true} if recording started, {@code false} if disabled or already recording
     */
    public boolean start(String callId) {
        Objects.requireNonNull(callId, "callId must not be null");
        if (!properties.isEnabled()) {
            LOG.debug("Recording disabled; not recording call {}", callId);
            return false;
        }
        CallRecording created = new CallRecording(callId, clock.instant());
        CallRecording existing = recordings.putIfAbsent(callId, created);
        if (existing != null) {
            LOG.debug("Call {} is already being recorded", callId);
            return false;
        }
        LOG.info("Recording started for call {}", callId);
        return true;
    }

    public boolean isRecording(String callId) {
        CallRecording recording = recordings.get(callId);
        return recording != null && recording.isActive();
    }

    public void addInbound(String callId, byte[] audio) {
        add(callId, AudioDirection.INBOUND, audio);
    }

    public void addOutbound(String callId, byte[] audio) {
        add(callId, AudioDirection.OUTBOUND, audio);
    }

    private void add(String callId, AudioDirection direction, byte[] audio) {
        if (callId == null || audio == null || audio.length == 0) {
            return;
        }
        CallRecording recording = recordings.get(callId);
        if (recording != null) {
            recording.add(new RecordedSegment(clock.instant(), direction, audio.clone()));
        }
    }

    /**
     * Stops capturing and queues the recording for finalization.
     *
     * @return completes with the written file, or empty when nothing was recorded, the call was
     *         not being recorded or finalization failed
     */
    public CompletableFuture<Optional<Path>> stop(String callId) {
        CallRecording recording = callId == null ? null : recordings.remove(callId);
        if (recording == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        recording.deactivate();
        Instant endedAt = clock.instant();
        LOG.info("Recording stopped for call {}; queued for finalization", callId);
        return CompletableFuture.supplyAsync(() -> finalizeSafely(recording, endedAt), recordingExecutor);
    }

    public Optional<RecordingStatus> status(String callId) {
        return Optional.ofNullable(recordings.get(callId)).map(CallRecording::status);
    }

    public int activeCount() {
        return recordings.size();
    }

    private Optional<Path> finalizeSafely(CallRecording recording, Instant endedAt) {
        try {
            Optional<Path> file = finalizeRecording(recording, endedAt);
            metrics.recording(file.isPresent() ? "completed" : "empty");
            return file;
        } catch (RecordingException e) {
            LOG.error("Recording for call {} dropped: {}", recording.callId(), e.getMessage(), e);
            metrics.recording("failed");
            return Optional.empty();
        }
    }

    Optional<Path> finalizeRecording(CallRecording recording, Instant endedAt) {
        String callId = recording.callId();
        List<RecordedSegment> merged = merge(
                CallRecording.drain(recording.inbound()),
                CallRecording.drain(recording.outbound()));
        if (merged.isEmpty()) {
            LOG.info("No audio captured for call {}; nothing to write", callId);
            return Optional.empty();
        }

        short[] pcm = normalize(MuLawCodec.decode(concatenate(merged)));
        Path directory = properties.directoryPath();
        Path file = directory.resolve(fileName(recording.startedAt(), callId));
        try {
            Files.createDirectories(directory);
            WavWriter.writePcm16Mono8kHz(pcm, file);
        } catch (IOException e) {
            throw new RecordingException("Failed to write recording to " + file, callId, e);
        }

        LOG.info("Recording saved for call {}: {} ({} samples, {}s)",
                callId, file, pcm.length, pcm.length / AudioFormat.TELEPHONY_SAMPLE_RATE);
        eventLog.recordingCompleted(callId, file, recording.startedAt(), endedAt);
        return Optional.of(file);
    }

    /**
     * Merges both directions into one timeline. The sort is stable and inbound segments are listed
     * first, so on equal timestamps inbound precedes outbound and each direction keeps its order.
     */
    static List<RecordedSegment> merge(List<RecordedSegment> inbound, List<RecordedSegment> outbound) {
        List<RecordedSegment> all = new ArrayList<>(inbound.size() + outbound.size());
        all.addAll(inbound);
        all.addAll(outbound);
        all.sort(Comparator.comparing(RecordedSegment::timestamp));
        return all;
    }

    static byte[] concatenate(List<RecordedSegment> segments) {
        int total = 0;
        for (RecordedSegment segment : segments) {
            total += segment.audio().length;
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (RecordedSegment segment : segments) {
            System.arraycopy(segment.audio(), 0, out, offset, segment.audio().length);
            offset += segment.audio().length;
        }
        return out;
    }

    /**
     * Scales samples so the loudest one reaches 16-bit full scale. Silence is returned unchanged.
     */
    static short[] normalize(short[] samples) {
        int peak = 0;
        for (short s : samples) {
            peak = Math.max(peak, Math.abs((int) s));
        }
        if (peak == 0) {
            return samples;
        }
        double scale = (double) AudioFormat.PCM16_FULL_SCALE / peak;
        short[] out = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            long scaled = Math.round(samples[i] * scale);
            out[i] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, scaled));
        }
        return out;
    }

    String fileName(Instant startedAt, String callId) {
        return FILE_TIMESTAMP.format(startedAt.atZone(clock.getZone())) + "_" + callId + ".wav";
    }
}
