package com.phillippitts.callagent.config.orchestration;

import com.phillippitts.callagent.config.properties.FallbackProperties;
import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.config.properties.TurnProperties;
import com.phillippitts.callagent.presentation.websocket.MediaStreamWebSocketHandler;
import com.phillippitts.callagent.service.generation.ResponseGenerator;
import com.phillippitts.callagent.service.generation.SessionVariableExtractor;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.logging.CallEventLog;
import com.phillippitts.callagent.service.metrics.CallMetrics;
import com.phillippitts.callagent.service.orchestration.CallDependencies;
import com.phillippitts.callagent.service.orchestration.CallDependenciesBuilder;
import com.phillippitts.callagent.service.orchestration.CallOrchestratorFactory;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.service.session.SessionManager;
import com.phillippitts.callagent.service.streaming.StreamPacer;
import com.phillippitts.callagent.service.turn.TurnDetector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the per-call orchestrator factory and the media stream endpoint explicitly.
 * External collaborators are grouped in {@link CollaboratorDependencies}.
 */
@Configuration
public class OrchestrationConfig {

    private final SessionManager sessionManager;
    private final TurnDetector turnDetector;
    private final AudioLibrary audioLibrary;
    private final DualStreamRecorder recorder;
    private final StreamPacer pacer;
    private final CallEventLog eventLog;
    private final CallMetrics metrics;
    private final CollaboratorDependencies collaborators;

    public OrchestrationConfig(SessionManager sessionManager,
                               TurnDetector turnDetector,
                               AudioLibrary audioLibrary,
                               DualStreamRecorder recorder,
                               StreamPacer pacer,
                               CallEventLog eventLog,
                               CallMetrics metrics,
                               CollaboratorDependencies collaborators) {
        this.sessionManager = sessionManager;
        this.turnDetector = turnDetector;
        this.audioLibrary = audioLibrary;
        this.recorder = recorder;
        this.pacer = pacer;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.collaborators = collaborators;
    }

    @Bean
    public CallDependencies callDependencies(TurnProperties turnProperties,
                                             StreamingProperties streamingProperties,
                                             RecordingProperties recordingProperties,
                                             FallbackProperties fallbackProperties,
                                             SessionVariableExtractor variableExtractor,
                                             @Qualifier("callExecutor") Executor callExecutor,
                                             @Qualifier("responseExecutor") Executor responseExecutor,
                                             @Qualifier("callScheduler") TaskScheduler callScheduler,
                                             Clock clock) {
        return CallDependenciesBuilder.builder()
                .sessionManager(this.sessionManager)
                .turnDetector(this.turnDetector)
                .audioLibrary(this.audioLibrary)
                .recorder(this.recorder)
                .pacer(this.pacer)
                .eventLog(this.eventLog)
                .metrics(this.metrics)
                .recognizer(this.collaborators.getRecognizer())
                .synthesizer(this.collaborators.getSynthesizer())
                .generator(this.collaborators.getGenerator())
                .callControl(this.collaborators.getCallControl())
                .variableExtractor(variableExtractor)
                .turnProperties(turnProperties)
                .streamingProperties(streamingProperties)
                .recordingProperties(recordingProperties)
                .fallbackProperties(fallbackProperties)
                .callExecutor(callExecutor)
                .responseExecutor(responseExecutor)
                .scheduler(callScheduler)
                .clock(clock)
                .build();
    }

    @Bean
    public CallOrchestratorFactory callOrchestratorFactory(CallDependencies callDependencies) {
        return new CallOrchestratorFactory(callDependencies);
    }

    @Bean
    public MediaStreamWebSocketHandler mediaStreamWebSocketHandler(CallOrchestratorFactory factory) {
        return new MediaStreamWebSocketHandler(factory);
    }
}
