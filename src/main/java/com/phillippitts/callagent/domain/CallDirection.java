package com.phillippitts.callagent.domain;

/**
 * Direction of a phone call relative to the business line.
 */
public enum CallDirection {
    INBOUND,
    OUTBOUND;

    /**
     * Parses a direction label leniently; anything other than "outbound" is treated as inbound.
     */
    public static CallDirection fromLabel(String label) {
        return label != null && label.trim().equalsIgnoreCase("outbound") ? OUTBOUND : INBOUND;
    }
}
