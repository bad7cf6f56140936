package com.phillippitts.callagent.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Mutable state of one active call.
 *
 * <p><b>Thread Safety:</b> apart from the fields noted below, a session is mutated only on its
 * call's serial lane and must not be shared with other calls. {@link #isAiSpeaking()},
 * {@link #turnState()}, {@link #interruptionFlag()} and the barge-in counter are safe to read and
 * write from any thread so that barge-in can be raised as soon as caller speech arrives.
 */
public final class CallSession {

    private final String callId;
    private final CallDirection direction;
    private final String callerNumber;
    private final String calledNumber;
    private final ClientProfile profile;
    private final Instant createdAt;
    private final Duration callTimeout;
    private final Duration paymentTimeout;

    private volatile String streamSid;
    private volatile TurnState turnState = TurnState.LISTENING;
    private volatile boolean aiSpeaking;
    private final AtomicBoolean interruption = new AtomicBoolean(false);
    private final AtomicInteger bargeIns = new AtomicInteger();

    private final StringBuilder buffer = new StringBuilder();
    private Instant lastSpeechActivity;
    private Instant lastUserActivity;
    private UtteranceType lastAiUtteranceType;
    private Instant lastAiUtteranceAt;
    private boolean paymentLinkSent;
    private String lastIntent;

    private final Map<String, String> variables = new ConcurrentHashMap<>();
    private final Map<String, Boolean> flags = new LinkedHashMap<>();
    private final List<ConversationTurn> history = new ArrayList<>();
    private final Set<String> snippetsUsed = new LinkedHashSet<>();
    private int synthesizedResponses;

    public CallSession(String callId,
                       CallDirection direction,
                       String callerNumber,
                       String calledNumber,
                       ClientProfile profile,
                       Instant createdAt,
                       Duration callTimeout,
                       Duration paymentTimeout) {
        this.callId = Objects.requireNonNull(callId, "callId must not be null");
        this.direction = direction == null ? CallDirection.INBOUND : direction;
        this.callerNumber = callerNumber == null ? "" : callerNumber;
        this.calledNumber = calledNumber == null ? "" : calledNumber;
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        this.paymentTimeout = Objects.requireNonNull(paymentTimeout, "paymentTimeout must not be null");
        this.lastUserActivity = createdAt;
        for (String flag : profile.flagTemplate()) {
            flags.put(flag, Boolean.FALSE);
        }
    }

    public String callId() { return callId; }
    public CallDirection direction() { return direction; }
    public String callerNumber() { return callerNumber; }
    public String calledNumber() { return calledNumber; }
    public ClientProfile profile() { return profile; }
    public Instant createdAt() { return createdAt; }

    public String streamSid() { return streamSid; }
    public void setStreamSid(String streamSid) { this.streamSid = streamSid; }

    public TurnState turnState() { return turnState; }
    public void setTurnState(TurnState turnState) {
        this.turnState = Objects.requireNonNull(turnState, "turnState must not be null");
    }

    // ---- accumulation buffer --------------------------------------------------------------

    /**
     * Appends final recognized text, space separated.
     */
    public void appendToBuffer(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        if (buffer.length() > 0) {
            buffer.append(' ');
        }
        buffer.append(text.trim());
    }

    public String bufferedText() {
        return buffer.toString();
    }

    public boolean hasBufferedText() {
        return buffer.length() > 0;
    }

    public int bufferedWordCount() {
        String text = buffer.toString().trim();
        return text.isEmpty() ? 0 : text.split("\\s+").length;
    }

    public void clearBuffer() {
        buffer.setLength(0);
    }

    // ---- activity timestamps ----------------------------------------------------------------

    /**
     * Records caller speech at {@code at}; refreshes both speech and user activity.
     */
    public void recordSpeechActivity(Instant at) {
        this.lastSpeechActivity = at;
        this.lastUserActivity = at;
    }

    public Optional<Instant> lastSpeechActivity() {
        return Optional.ofNullable(lastSpeechActivity);
    }

    public void clearLastSpeechActivity() {
        this.lastSpeechActivity = null;
    }

    public Instant lastUserActivity() {
        return lastUserActivity;
    }

    // ---- assistant utterances ---------------------------------------------------------------

    public void recordAiUtterance(UtteranceType type, Instant at) {
        this.lastAiUtteranceType = Objects.requireNonNull(type, "type must not be null");
        this.lastAiUtteranceAt = at;
    }

    public Optional<UtteranceType> lastAiUtteranceType() {
        return Optional.ofNullable(lastAiUtteranceType);
    }

    public Optional<Instant> lastAiUtteranceAt() {
        return Optional.ofNullable(lastAiUtteranceAt);
    }

    public boolean isAiSpeaking() { return aiSpeaking; }
    public void setAiSpeaking(boolean aiSpeaking) { this.aiSpeaking = aiSpeaking; }

    /**
     * Flag polled by the stream pacer before each chunk; set on barge-in.
     */
    public AtomicBoolean interruptionFlag() {
        return interruption;
    }

    public int recordBargeIn() {
        return bargeIns.incrementAndGet();
    }

    public int bargeIns() {
        return bargeIns.get();
    }

    // ---- timeout --------------------------------------------------------------------------

    public void markPaymentLinkSent() { this.paymentLinkSent = true; }
    public void clearPaymentLinkSent() { this.paymentLinkSent = false; }
    public boolean isPaymentLinkSent() { return paymentLinkSent; }

    /**
     * Payment timeout while a payment link is outstanding, otherwise the call timeout.
     */
    public Duration activeTimeout() {
        return paymentLinkSent ? paymentTimeout : callTimeout;
    }

    /**
     * True when the caller has been inactive for longer than the active timeout.
     */
    public boolean isTimedOut(Instant now) {
        return Duration.between(lastUserActivity, now).compareTo(activeTimeout()) > 0;
    }

    // ---- variables and flags ---------------------------------------------------------------

    public void updateVariable(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        if (value == null || value.isBlank()) {
            variables.remove(name);
        } else {
            variables.put(name, value.trim());
        }
    }

    public Optional<String> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, String> variables() {
        return Map.copyOf(variables);
    }

    public void setFlag(String name, boolean value) {
        flags.put(name, value);
    }

    public boolean flag(String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }

    public Map<String, Boolean> flags() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public Optional<String> lastIntent() { return Optional.ofNullable(lastIntent); }
    public void setLastIntent(String lastIntent) { this.lastIntent = lastIntent; }

    /**
     * One-line context for the response generator: known variables and raised flags.
     */
    public String contextSummary() {
        List<String> parts = new ArrayList<>();
        variables.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> parts.add(e.getKey() + ": " + e.getValue()));
        String raised = flags.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.joining(", "));
        if (!raised.isEmpty()) {
            parts.add("Discussed topics: " + raised);
        }
        return parts.isEmpty() ? "No context yet" : String.join(" | ", parts);
    }

    // ---- history and counters -------------------------------------------------------------

    public void addTurn(ConversationTurn turn) {
        history.add(Objects.requireNonNull(turn, "turn must not be null"));
    }

    public List<ConversationTurn> history() {
        return List.copyOf(history);
    }

    /**
     * Returns at most the last {@code n} turns, oldest first.
     */
    public List<ConversationTurn> recentHistory(int n) {
        int from = Math.max(0, history.size() - Math.max(0, n));
        return List.copyOf(history.subList(from, history.size()));
    }

    public void recordSnippetUsed(String key) {
        snippetsUsed.add(key);
    }

    public int uniqueSnippetsUsed() {
        return snippetsUsed.size();
    }

    public void recordSynthesizedResponse() {
        synthesizedResponses++;
    }

    public int synthesizedResponses() {
        return synthesizedResponses;
    }

    @Override
    public String toString() {
        return "CallSession{callId=" + callId + ", client=" + profile.clientId()
                + ", direction=" + direction + ", turnState=" + turnState + '}';
    }
}
