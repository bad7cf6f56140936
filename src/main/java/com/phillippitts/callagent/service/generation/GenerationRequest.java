package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.domain.ConversationTurn;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot handed to a {@link ResponseGenerator}. Built on the call lane, read elsewhere.
 *
 * @param callId call being answered
 * @param utterance completed caller utterance
 * @param profile client the call belongs to
 * @param sessionContext one-line summary of known session variables
 * @param recentHistory most recent conversation turns, oldest first
 * @param audioCatalog formatted snippet library the generator may choose from
 */
public record GenerationRequest(String callId,
                                String utterance,
                                ClientProfile profile,
                                String sessionContext,
                                List<ConversationTurn> recentHistory,
                                String audioCatalog) {

    public GenerationRequest {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(utterance, "utterance must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        sessionContext = sessionContext == null ? "" : sessionContext;
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
        audioCatalog = audioCatalog == null ? "" : audioCatalog;
    }
}
