package com.phillippitts.callagent;

import com.phillippitts.callagent.presentation.websocket.MediaStreamWebSocketHandler;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.orchestration.CallOrchestratorFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "call.recording.enabled=false",
        "call.audio-library.manifest-path=target/no-such-manifest.json",
        "call.audio-library.audio-directory=target/no-such-audio"
    }
)
class CallAgentApplicationTests {

    @Autowired
    private CallOrchestratorFactory factory;

    @Autowired
    private MediaStreamWebSocketHandler mediaStreamHandler;

    @Autowired
    private AudioLibrary audioLibrary;

    @Test
    void contextLoads() {
        assertThat(factory).isNotNull();
        assertThat(mediaStreamHandler.activeCalls()).isZero();
        assertThat(audioLibrary.size()).isZero();
    }
}
