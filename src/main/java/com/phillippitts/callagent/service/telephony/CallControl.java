package com.phillippitts.callagent.service.telephony;

import com.phillippitts.callagent.exception.CallAgentException;

/**
 * Out-of-band control of the telephone call itself.
 */
public interface CallControl {

    /**
     * Hangs up a call.
     *
     * @throws CallAgentException if the provider rejects the request
     */
    void terminateCall(String callId);
}
