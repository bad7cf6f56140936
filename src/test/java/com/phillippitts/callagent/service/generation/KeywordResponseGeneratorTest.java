package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.testutil.AudioLibraryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordResponseGeneratorTest {

    @TempDir
    Path tempDir;

    private KeywordResponseGenerator generator;

    @BeforeEach
    void setUp() {
        AudioLibraryFixture fixture = new AudioLibraryFixture(tempDir)
                .writeManifest("""
                        {
                          "general": {"drain.mp3": "Drains are our bread and butter."},
                          "emergency_services": {"blocked_drain.mp3": "We can clear that blocked drain today."},
                          "quick_responses": {"hello": "hello_there.mp3"}
                        }
                        """)
                .writePayload("drain.mp3", 800, (byte) 1)
                .writePayload("blocked_drain.mp3", 800, (byte) 2)
                .writePayload("hello_there.mp3", 800, (byte) 3);
        generator = new KeywordResponseGenerator(fixture.load());
    }

    @Test
    void longestMatchingPhraseShouldWin() {
        GenerationResult result = generator.generate(request("I've got a Blocked Drain in the kitchen"));

        assertThat(result.directive()).isEqualTo(new ResponseDirective.AudioKey("blocked_drain.mp3"));
        assertThat(result.intent()).isEqualTo("emergency_services");
    }

    @Test
    void shorterPhraseShouldMatchWhenOnlyOneFits() {
        GenerationResult result = generator.generate(request("my drain is blocked"));

        assertThat(result.directive()).isEqualTo(new ResponseDirective.AudioKey("drain.mp3"));
    }

    @Test
    void phrasesShouldMatchWholeWordsOnly() {
        GenerationResult result = generator.generate(request("the drainage is fine"));

        assertThat(result.directive()).isInstanceOf(ResponseDirective.SynthesizeText.class);
    }

    @Test
    void quickResponseSnippetsShouldNotBeKeywords() {
        GenerationResult result = generator.generate(request("hello there mate"));

        assertThat(result.directive())
                .isEqualTo(ResponseDirective.SynthesizeText.say(KeywordResponseGenerator.FOLLOW_UP));
        assertThat(result.intentOptional()).isEmpty();
    }

    @Test
    void goodbyeShouldThankCallerAndHangUp() {
        GenerationResult result = generator.generate(request("no that's all, bye"));

        assertThat(result.directive()).isEqualTo(new ResponseDirective.SynthesizeText(
                "Thanks for calling Pete's Plumbing. Have a great day!", true));
        assertThat(result.intent()).isEqualTo("Goodbye");
    }

    @Test
    void brushOffShouldOfferCallback() {
        GenerationResult result = generator.generate(request("sorry I'm busy at the moment"));

        assertThat(result.directive())
                .isEqualTo(ResponseDirective.SynthesizeText.say(KeywordResponseGenerator.BUSY_REPLY));
        assertThat(result.intent()).isEqualTo("Not Interested");
    }

    @Test
    void phraseForShouldTurnFilenameIntoWords() {
        assertThat(KeywordResponseGenerator.phraseFor("blocked_drain.mp3")).isEqualTo("blocked drain");
        assertThat(KeywordResponseGenerator.phraseFor("Hot-Water.ulaw")).isEqualTo("hot water");
    }

    private static GenerationRequest request(String utterance) {
        return new GenerationRequest("CA1", utterance, ClientProfile.defaultProfile(), "", List.of(), "");
    }
}
