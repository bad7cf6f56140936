package com.phillippitts.callagent.service.orchestration;

import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.domain.AudioSnippet;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.CallSummary;
import com.phillippitts.callagent.domain.ConversationTurn;
import com.phillippitts.callagent.domain.TranscriptFragment;
import com.phillippitts.callagent.domain.UtteranceType;
import com.phillippitts.callagent.exception.GenerationException;
import com.phillippitts.callagent.exception.RecognitionException;
import com.phillippitts.callagent.exception.SynthesisException;
import com.phillippitts.callagent.exception.TransportException;
import com.phillippitts.callagent.service.generation.GenerationRequest;
import com.phillippitts.callagent.service.generation.GenerationResult;
import com.phillippitts.callagent.service.generation.ResponseDirective;
import com.phillippitts.callagent.service.generation.StatusTags;
import com.phillippitts.callagent.service.streaming.MediaStreamConnection;
import com.phillippitts.callagent.service.streaming.PacingResult;
import com.phillippitts.callagent.service.stt.RecognitionListener;
import com.phillippitts.callagent.service.stt.RecognitionStream;
import com.phillippitts.callagent.util.LogSanitizer;
import com.phillippitts.callagent.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one call from the media stream {@code start} frame to hang-up.
 *
 * <p>All session mutation runs on the call's {@link SerialExecutor} lane. Generation, synthesis
 * and paced streaming run on the shared response executor and post their results back to the
 * lane. Inbound audio is forwarded directly from the transport thread, and barge-in is raised
 * directly from the recognizer thread so that playback stops without waiting for the lane.
 *
 * <p>See {@link CallStateMachine} for the allowed state transitions.
 */
public class CallOrchestrator {

    private static final Logger LOG = LogManager.getLogger(CallOrchestrator.class);

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_TIMEOUT = "timeout";
    public static final String STATUS_DISCONNECTED = "disconnected";
    public static final String STATUS_TRANSPORT_ERROR = "transport_error";

    static final String INTRO_PLAYED_FLAG = "intro_played";
    static final int HISTORY_FOR_GENERATION = 10;

    private enum Attempt { PRIMARY, APOLOGY_SPEECH, APOLOGY_SNIPPET }

    private enum ReplyKind {
        AUDIO("audio"), SPEECH("tts"), APOLOGY("apology");

        private final String metricName;

        ReplyKind(String metricName) {
            this.metricName = metricName;
        }
    }

    private record Reply(ReplyKind kind, String audioKey, String text) {
    }

    private final String callId;
    private final MediaStreamConnection connection;
    private final CallDependencies deps;
    private final Runnable onClosed;
    private final SerialExecutor lane;
    private final CallStateMachine stateMachine = new CallStateMachine();
    private final RecognitionListener recognitionListener = new Listener();

    private volatile CallSession session;
    private volatile RecognitionStream recognition;
    private volatile ScheduledFuture<?> pollTask;

    // Lane-confined.
    private long dispatchStartedNanos;
    private long responseLatencyMs;

    CallOrchestrator(String callId, MediaStreamConnection connection, CallDependencies deps, Runnable onClosed) {
        this.callId = Objects.requireNonNull(callId, "callId must not be null");
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.deps = Objects.requireNonNull(deps, "deps must not be null");
        this.onClosed = onClosed == null ? () -> { } : onClosed;
        this.lane = new SerialExecutor(deps.getCallExecutor(), callId);
    }

    // ---- transport entry points ------------------------------------------------------------

    /**
     * Handles the {@code start} frame: registers the session and starts recording at once so that
     * no inbound audio is lost, then finishes setup on the lane.
     */
    public void start(CallStart start) {
        if (session != null || stateMachine.isClosed()) {
            LOG.warn("Duplicate start frame for call {} ignored", callId);
            return;
        }
        CallSession created = deps.getSessionManager()
                .create(callId, start.calledNumber(), start.callerNumber(), start.direction());
        created.setStreamSid(start.streamSid());
        RecordingProperties recording = deps.getRecordingProperties();
        if (recording.isEnabled() && recording.getMode() == RecordingProperties.Mode.ALWAYS) {
            deps.getRecorder().start(callId);
        }
        session = created;
        lane.execute(this::handleStart);
    }

    /**
     * Forwards inbound caller audio to the recorder and the recognizer. Runs on the transport thread.
     */
    public void onMedia(byte[] ulaw) {
        if (session == null || stateMachine.isClosed() || ulaw == null || ulaw.length == 0) {
            return;
        }
        deps.getRecorder().addInbound(callId, ulaw);
        RecognitionStream stream = recognition;
        if (stream != null) {
            try {
                stream.send(ulaw);
            } catch (RecognitionException e) {
                LOG.warn("Recognition send failed for call {}: {}", callId, e.getMessage());
            }
        }
    }

    /** Handles the {@code stop} frame. */
    public void onStop() {
        lane.execute(() -> close(STATUS_COMPLETED));
    }

    /** Handles the transport closing underneath the call. */
    public void onTransportClosed() {
        lane.execute(() -> close(STATUS_COMPLETED));
    }

    /**
     * Runs one silence and timeout check now instead of waiting for the scheduled poll.
     */
    public void pollNow() {
        lane.execute(this::tick);
    }

    public String getCallId() {
        return callId;
    }

    public CallState getState() {
        return stateMachine.current();
    }

    public Optional<CallSession> getSession() {
        return Optional.ofNullable(session);
    }

    RecognitionListener recognitionListener() {
        return recognitionListener;
    }

    // ---- lane: setup and polling -----------------------------------------------------------

    private void handleStart() {
        CallSession s = session;
        if (!stateMachine.transition(CallState.IDLE, CallState.STREAMING)) {
            return;
        }
        try {
            recognition = deps.getRecognizer().open(callId, recognitionListener);
        } catch (RecognitionException e) {
            LOG.error("Could not open speech recognition for call {}; continuing without transcripts",
                    callId, e);
            deps.getMetrics().failure("recognition");
        }

        Duration interval = Duration.ofMillis(deps.getTurnProperties().getPollIntervalMs());
        Instant firstPoll = deps.getScheduler().getClock().instant().plus(interval);
        pollTask = deps.getScheduler().scheduleAtFixedRate(() -> lane.execute(this::tick), firstPoll, interval);

        deps.getEventLog().callStarted(s);
        deps.getMetrics().callStarted(s.profile().clientId());
        LOG.info("Call {} started (stream={}, client={})", callId, s.streamSid(), s.profile().clientId());

        String greeting = s.profile().greetingSnippet();
        if (greeting != null) {
            Optional<AudioSnippet> snippet = deps.getAudioLibrary().snippet(greeting);
            if (snippet.isPresent()) {
                s.setFlag(INTRO_PLAYED_FLAG, true);
                responseLatencyMs = 0;
                dispatchStartedNanos = 0;
                startStreaming(CallState.RESPONDING_AUDIO, snippet.get().audio(),
                        new Reply(ReplyKind.AUDIO, snippet.get().key(), snippet.get().transcript()), false);
            } else {
                LOG.warn("Greeting snippet {} not in library for call {}", greeting, callId);
            }
        }
    }

    private void tick() {
        if (stateMachine.isClosed()) {
            return;
        }
        CallSession s = session;
        Instant now = deps.getClock().instant();
        if (s.isTimedOut(now)) {
            LOG.info("Call {} timed out after {} without caller activity", callId, s.activeTimeout());
            try {
                connection.sendStop(s.streamSid());
            } catch (TransportException e) {
                LOG.debug("Stop frame not delivered for call {}: {}", callId, e.getMessage());
            }
            close(STATUS_TIMEOUT);
            return;
        }
        if (stateMachine.current() != CallState.STREAMING) {
            return;
        }
        deps.getTurnDetector().poll(s, now).ifPresent(this::dispatch);
    }

    private void acceptFragment(TranscriptFragment fragment) {
        if (stateMachine.isClosed()) {
            return;
        }
        deps.getTurnDetector().accept(session, fragment);
    }

    // ---- lane: answering an utterance ------------------------------------------------------

    private void dispatch(String utterance) {
        CallSession s = session;
        if (!stateMachine.transition(CallState.STREAMING, CallState.DISPATCHING)) {
            deps.getTurnDetector().turnFinished(s);
            return;
        }
        dispatchStartedNanos = System.nanoTime();
        deps.getMetrics().utteranceCompleted();
        LOG.info("Caller said: {}", LogSanitizer.truncate(utterance, 120));

        ConversationTurn turn = ConversationTurn.caller(utterance, deps.getClock().instant());
        s.addTurn(turn);
        deps.getEventLog().turn(callId, turn);
        deps.getVariableExtractor().extract(s, utterance);
        s.setAiSpeaking(true);

        Optional<String> quick = deps.getAudioLibrary().quickResponse(utterance);
        if (quick.isPresent()) {
            resolve(new ResponseDirective.AudioKey(quick.get()), Attempt.PRIMARY);
            return;
        }

        GenerationRequest request = new GenerationRequest(callId, utterance, s.profile(), s.contextSummary(),
                s.recentHistory(HISTORY_FOR_GENERATION), deps.getAudioLibrary().promptCatalog());
        deps.getResponseExecutor().execute(() -> {
            GenerationResult result = null;
            try {
                result = deps.getGenerator().generate(request);
            } catch (GenerationException e) {
                LOG.warn("Response generation failed for call {}: {}", callId, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Response generator threw for call {}", callId, e);
            }
            GenerationResult generated = result;
            lane.execute(() -> onGenerated(generated));
        });
    }

    private void onGenerated(GenerationResult result) {
        if (stateMachine.isClosed()) {
            return;
        }
        if (result == null) {
            deps.getMetrics().failure("generation");
            fallback(Attempt.PRIMARY);
            return;
        }
        CallSession s = session;
        result.intentOptional().ifPresent(intent -> {
            s.setLastIntent(intent);
            LOG.debug("Intent for call {}: {}", callId, intent);
        });
        if (StatusTags.apply(s, result.tags())) {
            startRecordingOnConsent();
        }
        resolve(result.directive(), Attempt.PRIMARY);
    }

    private void startRecordingOnConsent() {
        RecordingProperties recording = deps.getRecordingProperties();
        if (recording.isEnabled() && recording.getMode() == RecordingProperties.Mode.ON_CONSENT
                && deps.getRecorder().start(callId)) {
            LOG.info("Caller consented; recording started for call {}", callId);
        }
    }

    private void resolve(ResponseDirective directive, Attempt attempt) {
        if (directive instanceof ResponseDirective.AudioKey key) {
            Optional<AudioSnippet> snippet = deps.getAudioLibrary().snippet(key.key());
            if (snippet.isEmpty()) {
                LOG.warn("Snippet {} not in library for call {}", key.key(), callId);
                deps.getMetrics().failure("snippet");
                fallback(attempt);
                return;
            }
            ReplyKind kind = attempt == Attempt.PRIMARY ? ReplyKind.AUDIO : ReplyKind.APOLOGY;
            markResponseReady();
            startStreaming(CallState.RESPONDING_AUDIO, snippet.get().audio(),
                    new Reply(kind, snippet.get().key(), snippet.get().transcript()), false);
        } else if (directive instanceof ResponseDirective.SynthesizeText speech) {
            if (speech.text().isBlank()) {
                if (speech.disconnect()) {
                    beginDisconnect();
                } else {
                    fallback(attempt);
                }
                return;
            }
            synthesize(speech, attempt);
        } else {
            throw new IllegalStateException("Unknown directive: " + directive);
        }
    }

    private void synthesize(ResponseDirective.SynthesizeText speech, Attempt attempt) {
        String voiceId = session.profile().voiceId();
        deps.getResponseExecutor().execute(() -> {
            byte[] audio = null;
            try {
                audio = deps.getSynthesizer().synthesize(speech.text(), voiceId).toTelephonyMuLaw();
            } catch (SynthesisException e) {
                LOG.warn("Speech synthesis failed for call {}: {}", callId, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Speech synthesizer threw for call {}", callId, e);
            }
            byte[] synthesized = audio;
            lane.execute(() -> onSynthesized(speech, attempt, synthesized));
        });
    }

    private void onSynthesized(ResponseDirective.SynthesizeText speech, Attempt attempt, byte[] audio) {
        if (stateMachine.isClosed()) {
            return;
        }
        if (audio == null || audio.length == 0) {
            deps.getMetrics().failure("synthesis");
            fallback(attempt);
            return;
        }
        ReplyKind kind = attempt == Attempt.PRIMARY ? ReplyKind.SPEECH : ReplyKind.APOLOGY;
        markResponseReady();
        startStreaming(CallState.RESPONDING_SPEECH, audio, new Reply(kind, null, speech.text()),
                speech.disconnect());
    }

    private void fallback(Attempt failed) {
        switch (failed) {
            case PRIMARY -> resolve(ResponseDirective.SynthesizeText.say(
                    deps.getFallbackProperties().getApologyText()), Attempt.APOLOGY_SPEECH);
            case APOLOGY_SPEECH -> {
                String snippet = deps.getFallbackProperties().getApologySnippet();
                if (snippet != null) {
                    resolve(new ResponseDirective.AudioKey(snippet), Attempt.APOLOGY_SNIPPET);
                } else {
                    giveUp();
                }
            }
            case APOLOGY_SNIPPET -> giveUp();
        }
    }

    private void giveUp() {
        LOG.error("No response could be played for call {}; listening again", callId);
        CallSession s = session;
        s.setAiSpeaking(false);
        s.interruptionFlag().set(false);
        stateMachine.transition(CallState.DISPATCHING, CallState.STREAMING);
        deps.getTurnDetector().turnFinished(s);
    }

    private void markResponseReady() {
        responseLatencyMs = dispatchStartedNanos == 0 ? 0 : TimeUtils.elapsedMillis(dispatchStartedNanos);
    }

    // ---- lane: streaming -------------------------------------------------------------------

    private void startStreaming(CallState target, byte[] audio, Reply reply, boolean disconnect) {
        CallState from = stateMachine.current();
        if (!stateMachine.transition(from, target)) {
            LOG.warn("Cannot start {} response in state {} for call {}", reply.kind().metricName, from, callId);
            return;
        }
        CallSession s = session;
        s.setAiSpeaking(true);
        deps.getTurnDetector().responseStarted(s);
        if (dispatchStartedNanos != 0) {
            deps.getMetrics().responseSent(reply.kind().metricName, System.nanoTime() - dispatchStartedNanos);
        }

        String streamSid = s.streamSid();
        AtomicBoolean interruption = s.interruptionFlag();
        deps.getResponseExecutor().execute(() -> {
            try {
                PacingResult result = deps.getPacer().stream(audio, connection, streamSid, callId, interruption);
                lane.execute(() -> onResponseFinished(reply, result, disconnect));
            } catch (TransportException e) {
                lane.execute(() -> onSendFailed(e));
            }
        });
    }

    private void onResponseFinished(Reply reply, PacingResult result, boolean disconnect) {
        if (stateMachine.isClosed()) {
            return;
        }
        CallSession s = session;
        if (result.interrupted() && result.chunksSent() == 0) {
            // Nothing reached the caller, so the reply is not part of the conversation.
            LOG.info("Response cancelled by caller on call {} before the first chunk", callId);
        } else {
            recordReply(s, reply);
            if (result.interrupted()) {
                LOG.info("Response interrupted by caller on call {} after {} chunks", callId, result.chunksSent());
            }
        }

        s.setAiSpeaking(false);
        s.interruptionFlag().set(false);
        dispatchStartedNanos = 0;

        if (disconnect) {
            beginDisconnect();
            return;
        }
        stateMachine.transition(stateMachine.current(), CallState.STREAMING);
        deps.getTurnDetector().turnFinished(s);
    }

    private void recordReply(CallSession s, Reply reply) {
        Instant now = deps.getClock().instant();
        ConversationTurn turn;
        if (reply.audioKey() != null) {
            turn = ConversationTurn.audio(reply.audioKey(), reply.text(), responseLatencyMs, now);
            s.recordSnippetUsed(reply.audioKey());
        } else {
            turn = ConversationTurn.speech(reply.text(), responseLatencyMs, now);
            s.recordSynthesizedResponse();
        }
        s.addTurn(turn);
        deps.getEventLog().turn(callId, turn);
        s.recordAiUtterance(UtteranceType.of(reply.text()), now);
    }

    private void onSendFailed(TransportException e) {
        if (stateMachine.isClosed()) {
            return;
        }
        if (!connection.isOpen()) {
            LOG.warn("Media connection lost for call {}: {}", callId, e.getMessage());
            close(STATUS_TRANSPORT_ERROR);
            return;
        }
        LOG.warn("Send failed on open connection for call {}: {}", callId, e.getMessage());
        deps.getMetrics().failure("transport");
        CallSession s = session;
        s.setAiSpeaking(false);
        s.interruptionFlag().set(false);
        dispatchStartedNanos = 0;
        stateMachine.transition(stateMachine.current(), CallState.STREAMING);
        deps.getTurnDetector().turnFinished(s);
    }

    // ---- lane: ending the call -------------------------------------------------------------

    private void beginDisconnect() {
        if (!stateMachine.transition(stateMachine.current(), CallState.DISCONNECTING)) {
            LOG.warn("Cannot disconnect call {} from state {}", callId, stateMachine.current());
            return;
        }
        int graceMs = deps.getStreamingProperties().getDisconnectGraceMs();
        LOG.info("Disconnecting call {} in {} ms", callId, graceMs);
        Instant at = deps.getScheduler().getClock().instant().plusMillis(graceMs);
        deps.getScheduler().schedule(() -> lane.execute(this::completeDisconnect), at);
    }

    private void completeDisconnect() {
        if (stateMachine.isClosed()) {
            return;
        }
        try {
            deps.getCallControl().terminateCall(callId);
        } catch (RuntimeException e) {
            LOG.error("Could not terminate call {} through call control", callId, e);
        }
        close(STATUS_DISCONNECTED);
    }

    private void close(String status) {
        if (!stateMachine.close()) {
            return;
        }
        ScheduledFuture<?> poll = pollTask;
        if (poll != null) {
            poll.cancel(false);
        }
        RecognitionStream stream = recognition;
        recognition = null;
        if (stream != null) {
            stream.close();
        }

        CallSession s = session;
        if (s != null) {
            s.interruptionFlag().set(true);
            Instant now = deps.getClock().instant();
            CallSummary summary = new CallSummary(callId, s.profile().clientId(), s.callerNumber(),
                    s.calledNumber(), s.direction(), TimeUtils.wholeSecondsBetween(s.createdAt(), now),
                    s.uniqueSnippetsUsed(), s.synthesizedResponses(), s.bargeIns(), s.flags(), s.variables(),
                    status);
            deps.getEventLog().callEnded(summary);
            deps.getMetrics().callEnded(s.profile().clientId(), status);
            deps.getSessionManager().remove(callId);
            LOG.info("Call {} ended ({}, {} s, {} barge-ins)", callId, status, summary.durationSeconds(),
                    summary.bargeIns());
        }
        connection.close();
        onClosed.run();
    }

    // ---- recognizer thread -----------------------------------------------------------------

    private final class Listener implements RecognitionListener {

        @Override
        public void onFragment(TranscriptFragment fragment) {
            CallSession s = session;
            if (s == null || stateMachine.isClosed()) {
                return;
            }
            if (fragment.isFinal() && !fragment.isBlank() && s.isAiSpeaking()) {
                raiseBargeIn(s);
            }
            lane.execute(() -> acceptFragment(fragment));
        }

        @Override
        public void onError(RecognitionException error) {
            LOG.warn("Recognition error for call {}: {}", callId, error.getMessage());
            deps.getMetrics().failure("recognition");
        }

        private void raiseBargeIn(CallSession s) {
            if (!s.interruptionFlag().compareAndSet(false, true)) {
                return;
            }
            s.recordBargeIn();
            deps.getMetrics().bargeIn();
            LOG.info("Caller barged in on call {}", callId);
            try {
                connection.sendClear(s.streamSid());
            } catch (TransportException e) {
                LOG.debug("Clear frame not delivered for call {}: {}", callId, e.getMessage());
            }
        }
    }
}
