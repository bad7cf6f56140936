package com.phillippitts.callagent.service.telephony;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Call control used when no provider API is configured; closing the media stream is then the only
 * way the call ends from this side.
 */
public class LoggingCallControl implements CallControl {

    private static final Logger LOG = LogManager.getLogger(LoggingCallControl.class);

    @Override
    public void terminateCall(String callId) {
        LOG.info("Terminate requested for call {} (no provider configured; closing stream only)", callId);
    }
}
