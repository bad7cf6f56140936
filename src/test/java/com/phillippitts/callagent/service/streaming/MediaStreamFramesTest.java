package com.phillippitts.callagent.service.streaming;

import com.phillippitts.callagent.service.streaming.MediaStreamFrames.Event;
import com.phillippitts.callagent.service.streaming.MediaStreamFrames.InboundFrame;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaStreamFramesTest {

    @Test
    void shouldParseStartFrameWithCustomParameters() {
        String json = """
                {"event":"start","sequenceNumber":"1","streamSid":"MZ123",
                 "start":{"streamSid":"MZ123","callSid":"CA456","tracks":["inbound"],
                          "customParameters":{"From":"+61412345678","To":"+61390000000","Direction":"inbound"}}}
                """;

        InboundFrame frame = MediaStreamFrames.parse(json);

        assertThat(frame.event()).isEqualTo(Event.START);
        assertThat(frame.streamSid()).isEqualTo("MZ123");
        assertThat(frame.callSid()).isEqualTo("CA456");
        assertThat(frame.parameter("From")).isEqualTo("+61412345678");
        assertThat(frame.parameter("To")).isEqualTo("+61390000000");
        assertThat(frame.parameter("Missing")).isEmpty();
    }

    @Test
    void startFrameShouldFallBackToNestedStreamSid() {
        InboundFrame frame = MediaStreamFrames.parse(
                "{\"event\":\"start\",\"start\":{\"streamSid\":\"MZ9\",\"callSid\":\"CA9\"}}");

        assertThat(frame.streamSid()).isEqualTo("MZ9");
        assertThat(frame.customParameters()).isEmpty();
    }

    @Test
    void shouldDecodeMediaPayload() {
        byte[] audio = {(byte) 0xFF, 0x00, 0x7F};
        String json = new JSONObject()
                .put("event", "media")
                .put("streamSid", "MZ1")
                .put("media", new JSONObject()
                        .put("track", "inbound")
                        .put("payload", Base64.getEncoder().encodeToString(audio)))
                .toString();

        InboundFrame frame = MediaStreamFrames.parse(json);

        assertThat(frame.event()).isEqualTo(Event.MEDIA);
        assertThat(frame.payload()).containsExactly(audio);
    }

    @Test
    void shouldParseMarkAndStop() {
        assertThat(MediaStreamFrames.parse("{\"event\":\"mark\",\"mark\":{\"name\":\"greeting\"}}").markName())
                .isEqualTo("greeting");
        InboundFrame stop = MediaStreamFrames.parse("{\"event\":\"stop\",\"stop\":{\"callSid\":\"CA1\"}}");
        assertThat(stop.event()).isEqualTo(Event.STOP);
        assertThat(stop.callSid()).isEqualTo("CA1");
    }

    @Test
    void unknownOrMissingEventShouldParseAsUnknown() {
        assertThat(MediaStreamFrames.parse("{\"event\":\"dtmf\"}").event()).isEqualTo(Event.UNKNOWN);
        assertThat(MediaStreamFrames.parse("{}").event()).isEqualTo(Event.UNKNOWN);
        assertThat(MediaStreamFrames.parse("{\"event\":\"connected\"}").event()).isEqualTo(Event.CONNECTED);
    }

    @Test
    void malformedJsonShouldBeRejected() {
        assertThatThrownBy(() -> MediaStreamFrames.parse("not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed media-stream frame");
    }

    @Test
    void invalidBase64ShouldBeRejected() {
        assertThatThrownBy(() -> MediaStreamFrames.parse(
                "{\"event\":\"media\",\"media\":{\"payload\":\"***\"}}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outboundMediaShouldCarryBase64Payload() {
        JSONObject frame = new JSONObject(MediaStreamFrames.media("MZ1", new byte[] {1, 2, 3}));

        assertThat(frame.getString("event")).isEqualTo("media");
        assertThat(frame.getString("streamSid")).isEqualTo("MZ1");
        assertThat(Base64.getDecoder().decode(frame.getJSONObject("media").getString("payload")))
                .containsExactly(1, 2, 3);
    }

    @Test
    void clearAndStopFramesShouldNameStream() {
        JSONObject clear = new JSONObject(MediaStreamFrames.clear("MZ1"));
        JSONObject stop = new JSONObject(MediaStreamFrames.stop("MZ1"));

        assertThat(clear.getString("event")).isEqualTo("clear");
        assertThat(clear.getString("streamSid")).isEqualTo("MZ1");
        assertThat(stop.getString("event")).isEqualTo("stop");
    }
}
