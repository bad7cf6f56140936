package com.phillippitts.callagent.service.turn;

import com.phillippitts.callagent.config.properties.TurnProperties;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.TranscriptFragment;
import com.phillippitts.callagent.domain.TurnState;
import com.phillippitts.callagent.domain.UtteranceType;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides when the caller has finished speaking.
 *
 * <p>Final recognizer fragments accumulate in the session buffer. A periodic {@link #poll}
 * completes the utterance once the caller has been silent for the active threshold and at least
 * the configured number of words is buffered. The threshold is longer shortly after the assistant
 * asked a question, giving the caller time to think.
 *
 * <p>Fragments that arrive while an utterance is dispatched or the assistant is speaking are still
 * buffered; they are only considered for completion after {@link #turnFinished} returns the
 * session to listening.
 *
 * <p>Stateless; every method must be called on the session's serial lane.
 */
public class TurnDetector {

    private final Duration baseThreshold;
    private final Duration questionThreshold;
    private final Duration questionWindow;
    private final int minWords;

    public TurnDetector(TurnProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.baseThreshold = Duration.ofMillis(properties.getBaseSilenceMs());
        this.questionThreshold = Duration.ofMillis(properties.getQuestionSilenceMs());
        this.questionWindow = Duration.ofMillis(properties.getQuestionWindowMs());
        this.minWords = properties.getMinWords();
    }

    /**
     * Applies a recognizer fragment to the session.
     *
     * <p>Blank fragments are ignored. Any other fragment, interim or final, refreshes speech and
     * user activity. Final fragments are appended to the buffer.
     */
    public void accept(CallSession session, TranscriptFragment fragment) {
        if (fragment.isBlank()) {
            return;
        }
        session.recordSpeechActivity(fragment.receivedAt());
        if (!fragment.isFinal()) {
            return;
        }
        session.appendToBuffer(fragment.text());
        TurnState state = session.turnState();
        if (state == TurnState.LISTENING || state == TurnState.SILENCE_WAIT) {
            session.setTurnState(TurnState.ACCUMULATING);
        }
    }

    /**
     * Checks whether the buffered speech forms a completed utterance at {@code now}.
     *
     * <p>On completion the buffer is snapshotted and cleared, last speech activity is cleared and
     * the session moves to {@link TurnState#DISPATCHED}.
     *
     * @return the completed utterance, or empty when the caller is still speaking
     */
    public Optional<String> poll(CallSession session, Instant now) {
        TurnState state = session.turnState();
        if (state == TurnState.DISPATCHED || state == TurnState.SPEAKING) {
            return Optional.empty();
        }
        if (!session.hasBufferedText()) {
            return Optional.empty();
        }

        Optional<Instant> lastSpeech = session.lastSpeechActivity();
        if (lastSpeech.isPresent()) {
            Duration silence = Duration.between(lastSpeech.get(), now);
            if (silence.compareTo(thresholdFor(session, now)) < 0) {
                session.setTurnState(TurnState.SILENCE_WAIT);
                return Optional.empty();
            }
        }

        if (session.bufferedWordCount() < minWords) {
            session.setTurnState(TurnState.SILENCE_WAIT);
            return Optional.empty();
        }

        String utterance = session.bufferedText();
        session.clearBuffer();
        session.clearLastSpeechActivity();
        session.setTurnState(TurnState.DISPATCHED);
        return Optional.of(utterance);
    }

    /**
     * Silence needed at {@code now} before buffered speech counts as finished.
     */
    public Duration thresholdFor(CallSession session, Instant now) {
        boolean recentQuestion = session.lastAiUtteranceType().orElse(null) == UtteranceType.QUESTION
                && session.lastAiUtteranceAt()
                        .map(at -> Duration.between(at, now).compareTo(questionWindow) < 0)
                        .orElse(false);
        return recentQuestion ? questionThreshold : baseThreshold;
    }

    /**
     * Returns the session to listening once the dispatched turn has been answered or interrupted.
     * Speech buffered meanwhile keeps the session accumulating.
     */
    public void turnFinished(CallSession session) {
        session.setTurnState(session.hasBufferedText() ? TurnState.ACCUMULATING : TurnState.LISTENING);
    }

    /**
     * Marks the dispatched turn as being answered.
     */
    public void responseStarted(CallSession session) {
        session.setTurnState(TurnState.SPEAKING);
    }
}
