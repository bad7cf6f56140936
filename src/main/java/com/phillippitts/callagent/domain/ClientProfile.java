package com.phillippitts.callagent.domain;

import java.util.List;
import java.util.Objects;

/**
 * Business configuration a call is answered on behalf of.
 *
 * @param clientId stable client identifier used in usage logs
 * @param businessName business name spoken to callers
 * @param assistantName name of the virtual receptionist
 * @param industry industry key (for example {@code plumbing_services})
 * @param location country or region the business operates in
 * @param city city the business operates from
 * @param businessHours opening hours as spoken text
 * @param serviceArea area the business covers
 * @param phoneNumber the business line (called number) this profile answers
 * @param website public website, or {@code null}
 * @param emergencyAvailable whether out-of-hours emergency callouts are offered
 * @param currency ISO 4217 code prices are quoted in
 * @param timezone IANA zone id of the business
 * @param voiceId synthesizer voice identifier
 * @param greetingSnippet snippet key played when the stream starts, or {@code null}
 * @param persona extra persona text for the response generator, or {@code null}
 * @param flagTemplate names of per-call feature flags, all initially false
 */
public record ClientProfile(String clientId,
                            String businessName,
                            String assistantName,
                            String industry,
                            String location,
                            String city,
                            String businessHours,
                            String serviceArea,
                            String phoneNumber,
                            String website,
                            boolean emergencyAvailable,
                            String currency,
                            String timezone,
                            String voiceId,
                            String greetingSnippet,
                            String persona,
                            List<String> flagTemplate) {

    public static final String DEFAULT_CLIENT_ID = "default";

    public static final List<String> DEFAULT_FLAG_TEMPLATE = List.of(
            "intro_played",
            "services_explained",
            "pricing_discussed",
            "booking_requested",
            "urgent_call",
            "contact_details_collected",
            "appointment_scheduled",
            "emergency_handled");

    public ClientProfile {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(businessName, "businessName must not be null");
        flagTemplate = flagTemplate == null ? List.of() : List.copyOf(flagTemplate);
        greetingSnippet = (greetingSnippet == null || greetingSnippet.isBlank()) ? null : greetingSnippet;
        persona = (persona == null || persona.isBlank()) ? null : persona;
        website = (website == null || website.isBlank()) ? null : website;
    }

    /**
     * Fallback profile used when the called number is not configured.
     */
    public static ClientProfile defaultProfile() {
        return new ClientProfile(
                DEFAULT_CLIENT_ID,
                "Pete's Plumbing",
                "Pete",
                "plumbing_services",
                "Australia",
                "Melbourne",
                "Mon-Fri 8AM-6PM, Sat 8AM-4PM",
                "Melbourne Metro",
                "+61XXXXXXXXX",
                "https://petesplumbing.com.au",
                true,
                "AUD",
                "Australia/Melbourne",
                "21m00Tcm4TlvDq8ikWAM",
                null,
                null,
                DEFAULT_FLAG_TEMPLATE);
    }

    public boolean isDefault() {
        return DEFAULT_CLIENT_ID.equals(clientId);
    }
}
