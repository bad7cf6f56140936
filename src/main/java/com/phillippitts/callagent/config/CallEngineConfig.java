package com.phillippitts.callagent.config;

import com.phillippitts.callagent.config.properties.AudioLibraryProperties;
import com.phillippitts.callagent.config.properties.ProfileProperties;
import com.phillippitts.callagent.config.properties.RecordingProperties;
import com.phillippitts.callagent.config.properties.StreamingProperties;
import com.phillippitts.callagent.config.properties.TimeoutProperties;
import com.phillippitts.callagent.config.properties.TurnProperties;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.logging.CallEventLog;
import com.phillippitts.callagent.service.logging.Log4jCallEventLog;
import com.phillippitts.callagent.service.metrics.CallMetrics;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.service.session.ClientProfileStore;
import com.phillippitts.callagent.service.session.PropertiesClientProfileStore;
import com.phillippitts.callagent.service.session.SessionManager;
import com.phillippitts.callagent.service.streaming.Sleeper;
import com.phillippitts.callagent.service.streaming.StreamPacer;
import com.phillippitts.callagent.service.turn.TurnDetector;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Shared, call-independent services of the engine.
 */
@Configuration
public class CallEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Snippet library, loaded eagerly so the first call never waits on disk.
     */
    @Bean(initMethod = "load")
    public AudioLibrary audioLibrary(AudioLibraryProperties properties) {
        return new AudioLibrary(properties);
    }

    @Bean
    public TurnDetector turnDetector(TurnProperties properties) {
        return new TurnDetector(properties);
    }

    @Bean
    public ClientProfileStore clientProfileStore(ProfileProperties properties) {
        return new PropertiesClientProfileStore(properties);
    }

    @Bean
    public CallEventLog callEventLog(Clock clock) {
        return new Log4jCallEventLog(clock);
    }

    @Bean
    public CallMetrics callMetrics(MeterRegistry registry) {
        return new CallMetrics(registry);
    }

    @Bean
    public DualStreamRecorder dualStreamRecorder(RecordingProperties properties,
                                                 @Qualifier("recordingExecutor") Executor recordingExecutor,
                                                 CallEventLog eventLog,
                                                 CallMetrics metrics,
                                                 Clock clock) {
        return new DualStreamRecorder(properties, recordingExecutor, eventLog, metrics, clock);
    }

    @Bean
    public SessionManager sessionManager(ClientProfileStore profiles,
                                         TimeoutProperties timeouts,
                                         DualStreamRecorder recorder,
                                         Clock clock) {
        return new SessionManager(profiles, timeouts, recorder, clock);
    }

    @Bean
    public StreamPacer streamPacer(StreamingProperties properties, DualStreamRecorder recorder) {
        return new StreamPacer(properties, recorder, Sleeper.SYSTEM);
    }
}
