package com.phillippitts.callagent.service.session;

import com.phillippitts.callagent.config.properties.TimeoutProperties;
import com.phillippitts.callagent.domain.CallDirection;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of active call sessions.
 *
 * <p>One session exists per active call id. Creation seeds the session from the profile of the
 * called number, falling back to the default profile. Removal also stops the call's recording.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe; the registry is a {@link ConcurrentHashMap}.
 */
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    private final ClientProfileStore profiles;
    private final TimeoutProperties timeouts;
    private final DualStreamRecorder recorder;
    private final Clock clock;
    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(ClientProfileStore profiles,
                          TimeoutProperties timeouts,
                          DualStreamRecorder recorder,
                          Clock clock) {
        this.profiles = Objects.requireNonNull(profiles, "profiles must not be null");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates the session for a call, or returns the existing one if the call is already registered.
     *
     * @param callId provider call identifier
     * @param calledNumber number that was dialled; selects the client profile
     * @param callerNumber number of the caller
     * @param direction inbound or outbound
     */
    public CallSession create(String callId, String calledNumber, String callerNumber, CallDirection direction) {
        Objects.requireNonNull(callId, "callId must not be null");
        return sessions.computeIfAbsent(callId, id -> {
            ClientProfile profile = profiles.resolve(calledNumber);
            if (profile.isDefault()) {
                LOG.info("No profile for number {}; using default profile",
                        LogSanitizer.maskNumber(calledNumber, 4));
            }
            CallSession session = new CallSession(id, direction, callerNumber, calledNumber, profile,
                    clock.instant(), timeouts.callTimeout(), timeouts.paymentTimeout());
            LOG.info("Session created for call {} (client={}, direction={})",
                    id, profile.clientId(), session.direction());
            return session;
        });
    }

    public Optional<CallSession> get(String callId) {
        return callId == null ? Optional.empty() : Optional.ofNullable(sessions.get(callId));
    }

    /**
     * Removes a call's session and stops its recording.
     *
     * @return the removed session, or empty when none was registered
     */
    public Optional<CallSession> remove(String callId) {
        if (callId == null) {
            return Optional.empty();
        }
        CallSession removed = sessions.remove(callId);
        recorder.stop(callId);
        if (removed != null) {
            LOG.info("Session removed for call {}", callId);
        }
        return Optional.ofNullable(removed);
    }

    public int activeCount() {
        return sessions.size();
    }

    public Collection<CallSession> activeSessions() {
        return List.copyOf(sessions.values());
    }

    public List<CallSession> sessionsForClient(String clientId) {
        return sessions.values().stream()
                .filter(s -> s.profile().clientId().equals(clientId))
                .collect(Collectors.toList());
    }
}
