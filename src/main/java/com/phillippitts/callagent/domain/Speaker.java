package com.phillippitts.callagent.domain;

/**
 * Who produced a conversation turn.
 */
public enum Speaker {
    CALLER,
    ASSISTANT,
    SYSTEM
}
