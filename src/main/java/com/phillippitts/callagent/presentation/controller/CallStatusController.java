package com.phillippitts.callagent.presentation.controller;

import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.service.library.AudioLibrary;
import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.service.session.ClientProfileStore;
import com.phillippitts.callagent.service.session.SessionManager;
import com.phillippitts.callagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only operational view of live calls, the snippet library and client profiles.
 */
@RestController
@RequestMapping("/calls")
class CallStatusController {

    private static final Logger LOG = LogManager.getLogger(CallStatusController.class);

    private final SessionManager sessionManager;
    private final DualStreamRecorder recorder;
    private final AudioLibrary audioLibrary;
    private final ClientProfileStore profiles;
    private final Clock clock;

    CallStatusController(SessionManager sessionManager,
                         DualStreamRecorder recorder,
                         AudioLibrary audioLibrary,
                         ClientProfileStore profiles,
                         Clock clock) {
        this.sessionManager = sessionManager;
        this.recorder = recorder;
        this.audioLibrary = audioLibrary;
        this.profiles = profiles;
        this.clock = clock;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> activeCalls() {
        List<Map<String, Object>> calls = sessionManager.activeSessions().stream()
                .map(this::describe)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", calls.size());
        body.put("recording", recorder.activeCount());
        body.put("calls", calls);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{callId}")
    ResponseEntity<Map<String, Object>> call(@PathVariable String callId) {
        return sessionManager.get(callId)
                .map(session -> ResponseEntity.ok(describe(session)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/library")
    ResponseEntity<Map<String, Object>> library() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("loaded", audioLibrary.isLoaded());
        body.put("snippets", audioLibrary.size());
        body.put("totalBytes", audioLibrary.totalBytes());
        body.put("quickResponses", audioLibrary.quickResponseCount());
        body.put("missing", audioLibrary.missingKeys());
        return ResponseEntity.ok(body);
    }

    /**
     * Strict lookup; an unknown number is a 404 rather than the default profile.
     */
    @GetMapping("/profiles/{phoneNumber}")
    ResponseEntity<Map<String, Object>> profile(@PathVariable String phoneNumber) {
        LOG.debug("Profile lookup for {}", LogSanitizer.maskNumber(phoneNumber, 4));
        ClientProfile profile = profiles.require(phoneNumber);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clientId", profile.clientId());
        body.put("businessName", profile.businessName());
        body.put("assistantName", profile.assistantName());
        body.put("industry", profile.industry());
        body.put("location", profile.location());
        body.put("city", profile.city());
        body.put("website", profile.website());
        body.put("emergencyAvailable", profile.emergencyAvailable());
        body.put("currency", profile.currency());
        body.put("timezone", profile.timezone());
        body.put("greetingSnippet", profile.greetingSnippet());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> describe(CallSession session) {
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("callId", session.callId());
        call.put("clientId", session.profile().clientId());
        call.put("direction", session.direction().name());
        call.put("caller", LogSanitizer.maskNumber(session.callerNumber(), 4));
        call.put("durationSeconds", Duration.between(session.createdAt(), clock.instant()).toSeconds());
        call.put("turnState", session.turnState().name());
        call.put("aiSpeaking", session.isAiSpeaking());
        call.put("paymentLinkSent", session.isPaymentLinkSent());
        call.put("recording", recorder.isRecording(session.callId()));
        return call;
    }
}
