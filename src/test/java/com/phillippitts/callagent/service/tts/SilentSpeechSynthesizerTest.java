package com.phillippitts.callagent.service.tts;

import com.phillippitts.callagent.exception.SynthesisException;
import com.phillippitts.callagent.service.audio.MuLawCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilentSpeechSynthesizerTest {

    private final SilentSpeechSynthesizer synthesizer = new SilentSpeechSynthesizer();

    @Test
    void shouldReturnSilenceSizedToWordCount() {
        SynthesizedAudio audio = synthesizer.synthesize("We can be there today", "voice-1");

        // 5 words x 400 ms at 8000 bytes per second
        assertThat(audio.encoding()).isEqualTo(SynthesizedAudio.Encoding.MULAW);
        assertThat(audio.data()).hasSize(16_000);
        assertThat(audio.data()).containsOnly(MuLawCodec.SILENCE);
    }

    @Test
    void blankTextShouldFail() {
        assertThatThrownBy(() -> synthesizer.synthesize("  ", "voice-1"))
                .isInstanceOf(SynthesisException.class);
    }
}
