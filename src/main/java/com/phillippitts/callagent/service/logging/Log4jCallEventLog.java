package com.phillippitts.callagent.service.logging;

import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.CallSummary;
import com.phillippitts.callagent.domain.ConversationTurn;
import com.phillippitts.callagent.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link CallEventLog} writing one JSON object per line to dedicated Log4j2 loggers.
 *
 * <p>Logger names ({@code callagent.calls}, {@code callagent.conversation}, {@code callagent.usage},
 * {@code callagent.recordings}) are routed to their own files by {@code log4j2-spring.xml}.
 */
public class Log4jCallEventLog implements CallEventLog {

    static final String CALLS_LOGGER = "callagent.calls";
    static final String CONVERSATION_LOGGER = "callagent.conversation";
    static final String USAGE_LOGGER = "callagent.usage";
    static final String RECORDINGS_LOGGER = "callagent.recordings";

    private static final Logger LOG = LogManager.getLogger(Log4jCallEventLog.class);

    private final Logger calls;
    private final Logger conversation;
    private final Logger usage;
    private final Logger recordings;
    private final Clock clock;

    public Log4jCallEventLog(Clock clock) {
        this(clock,
                LogManager.getLogger(CALLS_LOGGER),
                LogManager.getLogger(CONVERSATION_LOGGER),
                LogManager.getLogger(USAGE_LOGGER),
                LogManager.getLogger(RECORDINGS_LOGGER));
    }

    Log4jCallEventLog(Clock clock, Logger calls, Logger conversation, Logger usage, Logger recordings) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.calls = calls;
        this.conversation = conversation;
        this.usage = usage;
        this.recordings = recordings;
    }

    @Override
    public void callStarted(CallSession session) {
        JSONObject row = new JSONObject()
                .put("timestamp", clock.instant().toString())
                .put("event", "call_started")
                .put("call_sid", session.callId())
                .put("client_id", session.profile().clientId())
                .put("phone_number", session.callerNumber())
                .put("to_number", session.calledNumber())
                .put("call_direction", label(session.direction()));
        write(calls, row);
    }

    @Override
    public void turn(String callId, ConversationTurn turn) {
        JSONObject row = new JSONObject()
                .put("timestamp", turn.timestamp().toString())
                .put("call_sid", callId)
                .put("speaker", label(turn.speaker()))
                .put("message_type", label(turn.kind()))
                .put("content", turn.text())
                .put("audio_files_used", turn.audioKey() == null ? "" : turn.audioKey())
                .put("response_time_ms", turn.responseTimeMs() == null ? JSONObject.NULL : turn.responseTimeMs());
        write(conversation, row);
    }

    @Override
    public void callEnded(CallSummary summary) {
        String now = clock.instant().toString();
        JSONObject callRow = new JSONObject()
                .put("timestamp", now)
                .put("event", "call_ended")
                .put("call_sid", summary.callId())
                .put("client_id", summary.clientId())
                .put("phone_number", summary.callerNumber())
                .put("call_direction", label(summary.direction()))
                .put("call_duration", summary.durationSeconds())
                .put("total_audio_files_used", summary.uniqueSnippetsUsed())
                .put("tts_responses_count", summary.synthesizedResponses())
                .put("barge_ins", summary.bargeIns())
                .put("session_flags", new JSONObject(summary.flags()))
                .put("lead_data", new JSONObject(summary.variables()))
                .put("final_status", summary.endStatus());
        write(calls, callRow);

        JSONObject usageRow = new JSONObject()
                .put("timestamp", now)
                .put("client_id", summary.clientId())
                .put("to_number", summary.calledNumber())
                .put("from_number", summary.callerNumber())
                .put("call_sid", summary.callId())
                .put("call_direction", label(summary.direction()))
                .put("duration_secs", summary.durationSeconds())
                .put("billed_minutes", summary.billedMinutes());
        write(usage, usageRow);
    }

    @Override
    public void recordingCompleted(String callId, Path file, Instant startedAt, Instant endedAt) {
        JSONObject row = new JSONObject()
                .put("timestamp", clock.instant().toString())
                .put("call_sid", callId)
                .put("file", file.toString())
                .put("duration_secs", TimeUtils.wholeSecondsBetween(startedAt, endedAt));
        write(recordings, row);
    }

    private static void write(Logger target, JSONObject row) {
        try {
            target.info(row.toString());
        } catch (RuntimeException e) {
            LOG.warn("Failed to write {} row: {}", target.getName(), e.toString());
        }
    }

    private static String label(Enum<?> value) {
        return value == null ? "" : value.name().toLowerCase(Locale.ROOT);
    }
}
