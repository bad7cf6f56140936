package com.phillippitts.callagent.service.streaming;

import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.exception.TransportException;
import com.phillippitts.callagent.service.metrics.CallMetrics;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.testutil.FakeMediaStreamConnection;
import com.phillippitts.callagent.testutil.MutableClock;
import com.phillippitts.callagent.testutil.RecordingCallEventLog;
import com.phillippitts.callagent.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamPacerTest {

    @TempDir
    Path tempDir;

    private final List<Long> sleeps = new ArrayList<>();
    private FakeMediaStreamConnection connection;
    private DualStreamRecorder recorder;
    private StreamPacer pacer;

    @BeforeEach
    void setUp() {
        connection = new FakeMediaStreamConnection();
        recorder = new DualStreamRecorder(
                new RecordingProperties(true, tempDir.toString(), RecordingProperties.Mode.ALWAYS),
                new SyncExecutor(), new RecordingCallEventLog(), new CallMetrics(new SimpleMeterRegistry()),
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        // 8000-byte frames, 20 ms apart
        pacer = new StreamPacer(StreamingProperties.defaults(), recorder, sleeps::add);
    }

    @Test
    void shouldSplitAudioIntoFixedFramesWithShortTail() {
        // Arrange
        byte[] audio = sequence(20_000);

        // Act
        PacingResult result = pacer.stream(audio, connection, "MZ1", "CA1", new AtomicBoolean());

        // Assert
        assertThat(result).isEqualTo(new PacingResult(3, 20_000, false));
        assertThat(connection.mediaFrames).extracting(frame -> frame.length).containsExactly(8_000, 8_000, 4_000);
        assertThat(connection.sentAudio()).isEqualTo(audio);
        assertThat(sleeps).containsExactly(20L, 20L);
    }

    @Test
    void exactMultipleShouldNotSendEmptyFrame() {
        PacingResult result = pacer.stream(new byte[16_000], connection, "MZ1", "CA1", new AtomicBoolean());

        assertThat(result.chunksSent()).isEqualTo(2);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void emptyAudioShouldSendNothing() {
        assertThat(pacer.stream(new byte[0], connection, "MZ1", "CA1", new AtomicBoolean()))
                .isEqualTo(PacingResult.empty());
        assertThat(pacer.stream(null, connection, "MZ1", "CA1", new AtomicBoolean()))
                .isEqualTo(PacingResult.empty());
        assertThat(connection.mediaFrames).isEmpty();
    }

    @Test
    void interruptionShouldStopBeforeNextFrame() {
        // Arrange
        AtomicBoolean interruption = new AtomicBoolean();
        connection.onMediaSent = count -> {
            if (count == 2) {
                interruption.set(true);
            }
        };

        // Act
        PacingResult result = pacer.stream(new byte[40_000], connection, "MZ1", "CA1", interruption);

        // Assert
        assertThat(result).isEqualTo(new PacingResult(2, 16_000, true));
        assertThat(connection.mediaFrames).hasSize(2);
    }

    @Test
    void interruptionShouldAlsoSkipTrailingPartialFrame() {
        AtomicBoolean interruption = new AtomicBoolean();
        connection.onMediaSent = count -> interruption.set(true);

        PacingResult result = pacer.stream(new byte[9_000], connection, "MZ1", "CA1", interruption);

        assertThat(result.interrupted()).isTrue();
        assertThat(result.bytesSent()).isEqualTo(8_000);
    }

    @Test
    void alreadyInterruptedShouldSendNothing() {
        PacingResult result = pacer.stream(new byte[8_000], connection, "MZ1", "CA1", new AtomicBoolean(true));

        assertThat(result).isEqualTo(new PacingResult(0, 0, true));
        assertThat(connection.mediaFrames).isEmpty();
    }

    @Test
    void sentFramesShouldBeRecordedAsOutbound() {
        recorder.start("CA1");

        pacer.stream(new byte[12_000], connection, "MZ1", "CA1", new AtomicBoolean());

        assertThat(recorder.status("CA1").orElseThrow().outboundBytes()).isEqualTo(12_000);
    }

    @Test
    void transportFailureShouldPropagate() {
        connection.failSends = true;

        assertThatThrownBy(() -> pacer.stream(new byte[8_000], connection, "MZ1", "CA1", new AtomicBoolean()))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void interruptedSleepShouldEndStreamEarly() {
        StreamPacer interrupting = new StreamPacer(StreamingProperties.defaults(), recorder, millis -> {
            throw new InterruptedException("shutdown");
        });

        PacingResult result = interrupting.stream(new byte[24_000], connection, "MZ1", "CA1", new AtomicBoolean());

        assertThat(result).isEqualTo(new PacingResult(1, 8_000, true));
        assertThat(Thread.interrupted()).isTrue();
    }

    private static byte[] sequence(int length) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) i;
        }
        return out;
    }
}
