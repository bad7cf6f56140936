package com.phillippitts.callagent.service.recording;

/**
 * Direction of recorded audio. Declaration order is the tie-break order when merging.
 */
public enum AudioDirection {
    /** Caller to assistant. */
    INBOUND,
    /** Assistant to caller. */
    OUTBOUND
}
