package com.phillippitts.callagent.config.orchestration;

import com.phillippitts.callagent.service.generation.ResponseGenerator;
import com.phillippitts.callagent.service.stt.SpeechRecognizer;
import com.phillippitts.callagent.service.telephony.CallControl;
import com.phillippitts.callagent.service.tts.SpeechSynthesizer;
import org.springframework.stereotype.Component;

/**
 * Groups the external collaborators (speech in, speech out, response choice, call control) for
 * cleaner constructor injection in {@link OrchestrationConfig}.
 */
@Component
public final class CollaboratorDependencies {
    private final SpeechRecognizer recognizer;
    private final SpeechSynthesizer synthesizer;
    private final ResponseGenerator generator;
    private final CallControl callControl;

    public CollaboratorDependencies(SpeechRecognizer recognizer,
                                    SpeechSynthesizer synthesizer,
                                    ResponseGenerator generator,
                                    CallControl callControl) {
        this.recognizer = recognizer;
        this.synthesizer = synthesizer;
        this.generator = generator;
        this.callControl = callControl;
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

    public CallControl getCallControl() {
        return callControl;
    }
}
