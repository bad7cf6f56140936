package com.phillippitts.callagent.service.logging;

import com.phillippitts.callagent.domain.CallDirection;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.CallSummary;
import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.domain.ConversationTurn;
import com.phillippitts.callagent.testutil.MutableClock;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class Log4jCallEventLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:05:00Z");

    private Logger calls;
    private Logger conversation;
    private Logger usage;
    private Logger recordings;
    private Log4jCallEventLog log;

    @BeforeEach
    void setUp() {
        calls = mock(Logger.class);
        conversation = mock(Logger.class);
        usage = mock(Logger.class);
        recordings = mock(Logger.class);
        log = new Log4jCallEventLog(new MutableClock(NOW), calls, conversation, usage, recordings);
    }

    @Test
    void callStartedShouldWriteCallRow() {
        CallSession session = new CallSession("CA1", CallDirection.OUTBOUND, "+61412345678", "+61390000000",
                ClientProfile.defaultProfile(), NOW, Duration.ofSeconds(300), Duration.ofSeconds(600));

        log.callStarted(session);

        JSONObject row = captured(calls);
        assertThat(row.getString("event")).isEqualTo("call_started");
        assertThat(row.getString("call_sid")).isEqualTo("CA1");
        assertThat(row.getString("client_id")).isEqualTo("default");
        assertThat(row.getString("phone_number")).isEqualTo("+61412345678");
        assertThat(row.getString("to_number")).isEqualTo("+61390000000");
        assertThat(row.getString("call_direction")).isEqualTo("outbound");
        assertThat(row.getString("timestamp")).isEqualTo(NOW.toString());
    }

    @Test
    void audioTurnShouldNameSnippetAndLatency() {
        log.turn("CA1", ConversationTurn.audio("blocked_drain.mp3", "We can help.", 420, NOW));

        JSONObject row = captured(conversation);
        assertThat(row.getString("speaker")).isEqualTo("assistant");
        assertThat(row.getString("message_type")).isEqualTo("audio");
        assertThat(row.getString("content")).isEqualTo("We can help.");
        assertThat(row.getString("audio_files_used")).isEqualTo("blocked_drain.mp3");
        assertThat(row.getLong("response_time_ms")).isEqualTo(420);
    }

    @Test
    void callerTurnShouldHaveNullLatency() {
        log.turn("CA1", ConversationTurn.caller("my drain is blocked", NOW));

        JSONObject row = captured(conversation);
        assertThat(row.getString("speaker")).isEqualTo("caller");
        assertThat(row.getString("audio_files_used")).isEmpty();
        assertThat(row.isNull("response_time_ms")).isTrue();
    }

    @Test
    void callEndedShouldWriteCallAndUsageRows() {
        CallSummary summary = new CallSummary("CA1", "jameson_plumbing", "+61412345678", "+61390000000",
                CallDirection.INBOUND, 125, 2, 3, 1, Map.of("urgent_call", true), Map.of("customer_name", "Sarah"),
                "completed");

        log.callEnded(summary);

        JSONObject callRow = captured(calls);
        assertThat(callRow.getString("event")).isEqualTo("call_ended");
        assertThat(callRow.getLong("call_duration")).isEqualTo(125);
        assertThat(callRow.getInt("total_audio_files_used")).isEqualTo(2);
        assertThat(callRow.getInt("tts_responses_count")).isEqualTo(3);
        assertThat(callRow.getInt("barge_ins")).isEqualTo(1);
        assertThat(callRow.getJSONObject("session_flags").getBoolean("urgent_call")).isTrue();
        assertThat(callRow.getJSONObject("lead_data").getString("customer_name")).isEqualTo("Sarah");
        assertThat(callRow.getString("final_status")).isEqualTo("completed");

        JSONObject usageRow = captured(usage);
        assertThat(usageRow.getString("client_id")).isEqualTo("jameson_plumbing");
        assertThat(usageRow.getString("from_number")).isEqualTo("+61412345678");
        assertThat(usageRow.getLong("duration_secs")).isEqualTo(125);
        assertThat(usageRow.getLong("billed_minutes")).isEqualTo(3);
    }

    @Test
    void recordingRowShouldCarryDuration() {
        log.recordingCompleted("CA1", Path.of("call_recordings", "x.wav"), NOW.minusSeconds(90), NOW);

        JSONObject row = captured(recordings);
        assertThat(row.getString("file")).endsWith("x.wav");
        assertThat(row.getLong("duration_secs")).isEqualTo(90);
    }

    @Test
    void loggerFailureShouldNotPropagate() {
        doThrow(new IllegalStateException("appender down")).when(calls).info(anyString());

        assertThatCode(() -> log.callEnded(new CallSummary("CA1", "default", "", "", CallDirection.INBOUND,
                0, 0, 0, 0, Map.of(), Map.of(), "completed")))
                .doesNotThrowAnyException();
        captured(usage);
    }

    private static JSONObject captured(Logger logger) {
        ArgumentCaptor<String> row = ArgumentCaptor.forClass(String.class);
        verify(logger).info(row.capture());
        return new JSONObject(row.getValue());
    }
}
