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
import java.util.concurrent.Executor;

/**
 * Builder for {@link CallDependencies}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CallDependencies deps = CallDependenciesBuilder.builder()
 *     .sessionManager(sessionManager)
 *     .turnDetector(turnDetector)
 *     ...
 *     .clock(clock)
 *     .build();
 * }</pre>
 */
public final class CallDependenciesBuilder {

    SessionManager sessionManager;
    TurnDetector turnDetector;
    AudioLibrary audioLibrary;
    DualStreamRecorder recorder;
    StreamPacer pacer;
    SpeechRecognizer recognizer;
    SpeechSynthesizer synthesizer;
    ResponseGenerator generator;
    SessionVariableExtractor variableExtractor;
    CallControl callControl;
    CallEventLog eventLog;
    CallMetrics metrics;
    TurnProperties turnProperties;
    StreamingProperties streamingProperties;
    RecordingProperties recordingProperties;
    FallbackProperties fallbackProperties;
    Executor callExecutor;
    Executor responseExecutor;
    TaskScheduler scheduler;
    Clock clock;

    private CallDependenciesBuilder() {
    }

    public static CallDependenciesBuilder builder() {
        return new CallDependenciesBuilder();
    }

    /**
     * @param sessionManager session registry
     * @return this builder
     */
    public CallDependenciesBuilder sessionManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
        return this;
    }

    /**
     * @param turnDetector end-of-utterance detector
     * @return this builder
     */
    public CallDependenciesBuilder turnDetector(TurnDetector turnDetector) {
        this.turnDetector = turnDetector;
        return this;
    }

    /**
     * @param audioLibrary snippet library
     * @return this builder
     */
    public CallDependenciesBuilder audioLibrary(AudioLibrary audioLibrary) {
        this.audioLibrary = audioLibrary;
        return this;
    }

    /**
     * @param recorder call recorder
     * @return this builder
     */
    public CallDependenciesBuilder recorder(DualStreamRecorder recorder) {
        this.recorder = recorder;
        return this;
    }

    /**
     * @param pacer outbound audio pacer
     * @return this builder
     */
    public CallDependenciesBuilder pacer(StreamPacer pacer) {
        this.pacer = pacer;
        return this;
    }

    /**
     * @param recognizer speech-to-text
     * @return this builder
     */
    public CallDependenciesBuilder recognizer(SpeechRecognizer recognizer) {
        this.recognizer = recognizer;
        return this;
    }

    /**
     * @param synthesizer text-to-speech
     * @return this builder
     */
    public CallDependenciesBuilder synthesizer(SpeechSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
        return this;
    }

    /**
     * @param generator response generator
     * @return this builder
     */
    public CallDependenciesBuilder generator(ResponseGenerator generator) {
        this.generator = generator;
        return this;
    }

    /**
     * @param variableExtractor lead detail extractor
     * @return this builder
     */
    public CallDependenciesBuilder variableExtractor(SessionVariableExtractor variableExtractor) {
        this.variableExtractor = variableExtractor;
        return this;
    }

    /**
     * @param callControl call hang-up
     * @return this builder
     */
    public CallDependenciesBuilder callControl(CallControl callControl) {
        this.callControl = callControl;
        return this;
    }

    /**
     * @param eventLog call, conversation and usage log
     * @return this builder
     */
    public CallDependenciesBuilder eventLog(CallEventLog eventLog) {
        this.eventLog = eventLog;
        return this;
    }

    /**
     * @param metrics Micrometer call metrics
     * @return this builder
     */
    public CallDependenciesBuilder metrics(CallMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @param turnProperties turn detection settings (poll interval)
     * @return this builder
     */
    public CallDependenciesBuilder turnProperties(TurnProperties turnProperties) {
        this.turnProperties = turnProperties;
        return this;
    }

    /**
     * @param streamingProperties streaming settings (disconnect grace)
     * @return this builder
     */
    public CallDependenciesBuilder streamingProperties(StreamingProperties streamingProperties) {
        this.streamingProperties = streamingProperties;
        return this;
    }

    /**
     * @param recordingProperties recording settings
     * @return this builder
     */
    public CallDependenciesBuilder recordingProperties(RecordingProperties recordingProperties) {
        this.recordingProperties = recordingProperties;
        return this;
    }

    /**
     * @param fallbackProperties apology settings
     * @return this builder
     */
    public CallDependenciesBuilder fallbackProperties(FallbackProperties fallbackProperties) {
        this.fallbackProperties = fallbackProperties;
        return this;
    }

    /**
     * @param callExecutor pool backing the per-call lanes
     * @return this builder
     */
    public CallDependenciesBuilder callExecutor(Executor callExecutor) {
        this.callExecutor = callExecutor;
        return this;
    }

    /**
     * @param responseExecutor pool for generation, synthesis and streaming
     * @return this builder
     */
    public CallDependenciesBuilder responseExecutor(Executor responseExecutor) {
        this.responseExecutor = responseExecutor;
        return this;
    }

    /**
     * @param scheduler scheduler for silence polls and disconnect grace
     * @return this builder
     */
    public CallDependenciesBuilder scheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    /**
     * @param clock time source for session activity
     * @return this builder
     */
    public CallDependenciesBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if any dependency is missing
     */
    public CallDependencies build() {
        return new CallDependencies(this);
    }
}
