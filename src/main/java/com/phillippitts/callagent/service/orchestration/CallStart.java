package com.phillippitts.callagent.service.orchestration;

import com.phillippitts.callagent.domain.CallDirection;

/**
 * Details carried by a media stream {@code start} frame.
 *
 * @param streamSid media stream identifier used in outbound frames
 * @param calledNumber number that was dialled
 * @param callerNumber number of the caller
 * @param direction inbound or outbound
 */
public record CallStart(String streamSid, String calledNumber, String callerNumber, CallDirection direction) {
}
