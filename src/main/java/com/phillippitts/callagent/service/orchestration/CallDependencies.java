package com.phillippitts.callagent.service.orchestration;

import com.phillippitts.callagent.config.properties.FallbackProperties;
import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.config.properties.TurnProperties;
import com.phillippitts.callagent.service.generation.ResponseGenerator;
import com.phillippitts.callagent.service.generation.SessionVariableExtractor;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.logging.CallEventLog;
import com.phillippitts.callagent.service.metrics.CallMetrics;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.service.session.SessionManager;
import com.phillippitts.callagent.service.streaming.StreamPacer;
import com.phillippitts.callagent.service.stt.SpeechRecognizer;
import com.phillippitts.callagent.service.telephony.CallControl;
import com.phillippitts.callagent.service.tts.SpeechSynthesizer;
import com.phillippitts.callagent.service.turn.TurnDetector;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Shared collaborators handed to every {@link CallOrchestrator}. Built with
 * {@link CallDependenciesBuilder}; every dependency is required.
 */
public final class CallDependencies {

    private final SessionManager sessionManager;
    private final TurnDetector turnDetector;
    private final AudioLibrary audioLibrary;
    private final DualStreamRecorder recorder;
    private final StreamPacer pacer;
    private final SpeechRecognizer recognizer;
    private final SpeechSynthesizer synthesizer;
    private final ResponseGenerator generator;
    private final SessionVariableExtractor variableExtractor;
    private final CallControl callControl;
    private final CallEventLog eventLog;
    private final CallMetrics metrics;
    private final TurnProperties turnProperties;
    private final StreamingProperties streamingProperties;
    private final RecordingProperties recordingProperties;
    private final FallbackProperties fallbackProperties;
    private final Executor callExecutor;
    private final Executor responseExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    CallDependencies(CallDependenciesBuilder b) {
        this.sessionManager = Objects.requireNonNull(b.sessionManager, "sessionManager is required");
        this.turnDetector = Objects.requireNonNull(b.turnDetector, "turnDetector is required");
        this.audioLibrary = Objects.requireNonNull(b.audioLibrary, "audioLibrary is required");
        this.recorder = Objects.requireNonNull(b.recorder, "recorder is required");
        this.pacer = Objects.requireNonNull(b.pacer, "pacer is required");
        this.recognizer = Objects.requireNonNull(b.recognizer, "recognizer is required");
        this.synthesizer = Objects.requireNonNull(b.synthesizer, "synthesizer is required");
        this.generator = Objects.requireNonNull(b.generator, "generator is required");
        this.variableExtractor = Objects.requireNonNull(b.variableExtractor, "variableExtractor is required");
        this.callControl = Objects.requireNonNull(b.callControl, "callControl is required");
        this.eventLog = Objects.requireNonNull(b.eventLog, "eventLog is required");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics is required");
        this.turnProperties = Objects.requireNonNull(b.turnProperties, "turnProperties is required");
        this.streamingProperties = Objects.requireNonNull(b.streamingProperties, "streamingProperties is required");
        this.recordingProperties = Objects.requireNonNull(b.recordingProperties, "recordingProperties is required");
        this.fallbackProperties = Objects.requireNonNull(b.fallbackProperties, "fallbackProperties is required");
        this.callExecutor = Objects.requireNonNull(b.callExecutor, "callExecutor is required");
        this.responseExecutor = Objects.requireNonNull(b.responseExecutor, "responseExecutor is required");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler is required");
        this.clock = Objects.requireNonNull(b.clock, "clock is required");
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    public TurnDetector getTurnDetector() {
        return turnDetector;
    }

    public AudioLibrary getAudioLibrary() {
        return audioLibrary;
    }

    public DualStreamRecorder getRecorder() {
        return recorder;
    }

    public StreamPacer getPacer() {
        return pacer;
    }

    public SpeechRecognizer getRecognizer() {
        return recognizer;
    }

    public SpeechSynthesizer getSynthesizer() {
        return synthesizer;
    }

    public ResponseGenerator getGenerator() {
        return generator;
    }

    public SessionVariableExtractor getVariableExtractor() {
        return variableExtractor;
    }

    public CallControl getCallControl() {
        return callControl;
    }

    public CallEventLog getEventLog() {
        return eventLog;
    }

    public CallMetrics getMetrics() {
        return metrics;
    }

    public TurnProperties getTurnProperties() {
        return turnProperties;
    }

    public StreamingProperties getStreamingProperties() {
        return streamingProperties;
    }

    public RecordingProperties getRecordingProperties() {
        return recordingProperties;
    }

    public FallbackProperties getFallbackProperties() {
        return fallbackProperties;
    }

    public Executor getCallExecutor() {
        return callExecutor;
    }

    public Executor getResponseExecutor() {
        return responseExecutor;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public Clock getClock() {
        return clock;
    }
}
