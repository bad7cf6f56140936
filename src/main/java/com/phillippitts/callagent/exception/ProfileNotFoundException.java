package com.phillippitts.callagent.exception;

/**
 * Thrown by strict profile lookups when no client profile is configured for a phone number.
 * Session creation never throws this; it falls back to the default profile.
 */
public class ProfileNotFoundException extends CallAgentException {

    private final String phoneNumber;

    public ProfileNotFoundException(String phoneNumber) {
        super("No client profile configured for number: " + phoneNumber);
        this.phoneNumber = phoneNumber;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }
}
