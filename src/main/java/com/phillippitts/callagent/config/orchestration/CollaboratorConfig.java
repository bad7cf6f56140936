package com.phillippitts.callagent.config.orchestration;

import com.phillippitts.callagent.service.generation.KeywordResponseGenerator;
import com.phillippitts.callagent.service.generation.ResponseGenerator;
import com.phillippitts.callagent.service.generation.SessionVariableExtractor;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.stt.LoggingSpeechRecognizer;
import com.phillippitts.callagent.service.stt.SpeechRecognizer;
import com.phillippitts.callagent.service.telephony.CallControl;
import com.phillippitts.callagent.service.telephony.LoggingCallControl;
import com.phillippitts.callagent.service.tts.SilentSpeechSynthesizer;
import com.phillippitts.callagent.service.tts.SpeechSynthesizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default external collaborators. Each is replaced by declaring a bean of the same type, e.g. a
 * vendor speech recognizer, so the engine runs end to end without vendor credentials.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(SpeechRecognizer.class)
    public SpeechRecognizer speechRecognizer() {
        return new LoggingSpeechRecognizer();
    }

    @Bean
    @ConditionalOnMissingBean(SpeechSynthesizer.class)
    public SpeechSynthesizer speechSynthesizer() {
        return new SilentSpeechSynthesizer();
    }

    @Bean
    @ConditionalOnMissingBean(ResponseGenerator.class)
    public ResponseGenerator responseGenerator(AudioLibrary audioLibrary) {
        return new KeywordResponseGenerator(audioLibrary);
    }

    @Bean
    @ConditionalOnMissingBean(CallControl.class)
    public CallControl callControl() {
        return new LoggingCallControl();
    }

    @Bean
    public SessionVariableExtractor sessionVariableExtractor() {
        return new SessionVariableExtractor();
    }
}
