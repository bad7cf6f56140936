package com.phillippitts.callagent.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void callAgentExceptionShouldIncludeMessage() {
        CallAgentException ex = new CallAgentException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void callAgentExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        CallAgentException ex = new CallAgentException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transportExceptionShouldIncludeCallId() {
        IOException cause = new IOException("broken pipe");
        TransportException ex = new TransportException("Media stream send failed", "CA123", cause);

        assertThat(ex.getMessage()).contains("Media stream send failed").contains("CA123");
        assertThat(ex.getCallId()).isEqualTo("CA123");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void synthesisExceptionShouldDefaultVoiceToUnknown() {
        SynthesisException ex = new SynthesisException("synthesis failed");

        assertThat(ex.getMessage()).isEqualTo("synthesis failed");
        assertThat(ex.getVoiceId()).isEqualTo("unknown");
    }

    @Test
    void synthesisExceptionShouldIncludeVoice() {
        SynthesisException ex = new SynthesisException("synthesis failed", "voice-1");

        assertThat(ex.getMessage()).contains("voice-1");
        assertThat(ex.getVoiceId()).isEqualTo("voice-1");
    }

    @Test
    void recordingExceptionShouldIncludeCallId() {
        RecordingException ex = new RecordingException("Failed to write recording", "CA9");

        assertThat(ex.getMessage()).contains("CA9");
        assertThat(ex.getCallId()).isEqualTo("CA9");
    }

    @Test
    void profileNotFoundExceptionShouldIncludeNumber() {
        ProfileNotFoundException ex = new ProfileNotFoundException("+61390000000");

        assertThat(ex.getMessage()).contains("+61390000000");
        assertThat(ex.getPhoneNumber()).isEqualTo("+61390000000");
    }

    @Test
    void allExceptionsShouldExtendCallAgentException() {
        assertThat(new TransportException("x", "c")).isInstanceOf(CallAgentException.class);
        assertThat(new RecognitionException("x")).isInstanceOf(CallAgentException.class);
        assertThat(new GenerationException("x")).isInstanceOf(CallAgentException.class);
        assertThat(new SynthesisException("x")).isInstanceOf(CallAgentException.class);
        assertThat(new RecordingException("x", "c")).isInstanceOf(CallAgentException.class);
        assertThat(new ProfileNotFoundException("n")).isInstanceOf(CallAgentException.class);
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new CallAgentException("x")).isInstanceOf(RuntimeException.class);
    }
}
