package com.phillippitts.callagent.service.turn;

import com.phillippitts.callagent.config.properties.TurnProperties;
import com.phillippitts.callagent.domain.CallDirection;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.domain.TranscriptFragment;
import com.phillippitts.callagent.domain.TurnState;
import com.phillippitts.callagent.domain.UtteranceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TurnDetectorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TurnDetector detector;
    private CallSession session;

    @BeforeEach
    void setUp() {
        // base 1500 ms, question 3000 ms within 10 s of a question, min 2 words
        detector = new TurnDetector(TurnProperties.defaults());
        session = new CallSession("CA1", CallDirection.INBOUND, "", "", ClientProfile.defaultProfile(), T0,
                Duration.ofSeconds(300), Duration.ofSeconds(600));
    }

    @Test
    void shouldDispatchAfterBaseSilence() {
        // Arrange
        detector.accept(session, fin("my drain is blocked", T0));

        // Act & Assert
        assertThat(detector.poll(session, T0.plusMillis(1_499))).isEmpty();
        assertThat(session.turnState()).isEqualTo(TurnState.SILENCE_WAIT);

        assertThat(detector.poll(session, T0.plusMillis(1_500))).contains("my drain is blocked");
        assertThat(session.turnState()).isEqualTo(TurnState.DISPATCHED);
        assertThat(session.hasBufferedText()).isFalse();
        assertThat(session.lastSpeechActivity()).isEmpty();
    }

    @Test
    void shouldJoinConsecutiveFinalFragments() {
        detector.accept(session, fin("my kitchen", T0));
        detector.accept(session, fin("drain is blocked", T0.plusMillis(800)));

        assertThat(detector.poll(session, T0.plusMillis(2_000))).isEmpty();
        assertThat(detector.poll(session, T0.plusMillis(2_300))).contains("my kitchen drain is blocked");
    }

    @Test
    void interimFragmentsShouldExtendSilenceWithoutBuffering() {
        detector.accept(session, fin("my drain", T0));
        detector.accept(session, new TranscriptFragment("is blo", false, T0.plusMillis(1_000)));

        assertThat(session.bufferedText()).isEqualTo("my drain");
        assertThat(detector.poll(session, T0.plusMillis(2_000))).isEmpty();
        assertThat(detector.poll(session, T0.plusMillis(2_500))).contains("my drain");
    }

    @Test
    void blankFragmentsShouldBeIgnored() {
        detector.accept(session, fin("   ", T0));

        assertThat(session.lastSpeechActivity()).isEmpty();
        assertThat(session.turnState()).isEqualTo(TurnState.LISTENING);
    }

    @Test
    void shouldWaitForMinimumWordCount() {
        detector.accept(session, fin("hello", T0));

        assertThat(detector.poll(session, T0.plusSeconds(5))).isEmpty();
        assertThat(session.turnState()).isEqualTo(TurnState.SILENCE_WAIT);

        detector.accept(session, fin("there", T0.plusSeconds(6)));
        assertThat(detector.poll(session, T0.plusSeconds(8))).contains("hello there");
    }

    @Test
    void shouldUseLongerThresholdShortlyAfterQuestion() {
        // Arrange
        session.recordAiUtterance(UtteranceType.QUESTION, T0);
        detector.accept(session, fin("it's at number twelve", T0.plusSeconds(1)));

        // Act & Assert
        assertThat(detector.thresholdFor(session, T0.plusSeconds(2))).isEqualTo(Duration.ofMillis(3_000));
        assertThat(detector.poll(session, T0.plusMillis(3_500))).isEmpty();
        assertThat(detector.poll(session, T0.plusMillis(4_000))).contains("it's at number twelve");
    }

    @Test
    void questionThresholdShouldExpireAfterWindow() {
        session.recordAiUtterance(UtteranceType.QUESTION, T0);

        assertThat(detector.thresholdFor(session, T0.plusMillis(9_999))).isEqualTo(Duration.ofMillis(3_000));
        assertThat(detector.thresholdFor(session, T0.plusMillis(10_000))).isEqualTo(Duration.ofMillis(1_500));
    }

    @Test
    void statementShouldUseBaseThreshold() {
        session.recordAiUtterance(UtteranceType.STATEMENT, T0);

        assertThat(detector.thresholdFor(session, T0.plusSeconds(1))).isEqualTo(Duration.ofMillis(1_500));
    }

    @Test
    void shouldNotDispatchWhileResponding() {
        detector.accept(session, fin("first question here", T0));
        assertThat(detector.poll(session, T0.plusSeconds(2))).isPresent();
        detector.responseStarted(session);

        detector.accept(session, fin("and another thing", T0.plusSeconds(3)));

        assertThat(session.turnState()).isEqualTo(TurnState.SPEAKING);
        assertThat(detector.poll(session, T0.plusSeconds(10))).isEmpty();
    }

    @Test
    void speechBufferedDuringResponseShouldDispatchAfterTurnFinished() {
        // Arrange
        detector.accept(session, fin("first question here", T0));
        detector.poll(session, T0.plusSeconds(2));
        detector.responseStarted(session);
        detector.accept(session, fin("and another thing", T0.plusSeconds(3)));

        // Act
        detector.turnFinished(session);

        // Assert
        assertThat(session.turnState()).isEqualTo(TurnState.ACCUMULATING);
        assertThat(detector.poll(session, T0.plusSeconds(5))).contains("and another thing");
    }

    @Test
    void turnFinishedWithoutBufferedSpeechShouldListen() {
        detector.accept(session, fin("first question here", T0));
        detector.poll(session, T0.plusSeconds(2));

        detector.turnFinished(session);

        assertThat(session.turnState()).isEqualTo(TurnState.LISTENING);
    }

    @Test
    void emptyBufferShouldNeverDispatch() {
        assertThat(detector.poll(session, T0.plusSeconds(60))).isEmpty();
        assertThat(session.turnState()).isEqualTo(TurnState.LISTENING);
    }

    private static TranscriptFragment fin(String text, Instant at) {
        return new TranscriptFragment(text, true, at);
    }
}
