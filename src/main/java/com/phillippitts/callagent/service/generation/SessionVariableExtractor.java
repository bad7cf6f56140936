package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.CallSession;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls lead details out of caller speech into session variables: customer name, Australian phone
 * number, job type, urgency and preferred time.
 *
 * <p>Must run on the call lane. Existing values are only overwritten by a new match.
 */
public class SessionVariableExtractor {

    public static final String CUSTOMER_NAME = "customer_name";
    public static final String PHONE_NUMBER = "phone_number";
    public static final String JOB_TYPE = "job_type";
    public static final String URGENCY = "urgency";
    public static final String PREFERRED_TIME = "preferred_time";

    private static final Pattern AU_PHONE = Pattern.compile("(?<![\\d+])(?:\\+?61|0)[2-478](?:[ -]?\\d){8}(?!\\d)");

    private static final Set<String> NAME_MARKERS = Set.of("name", "i'm", "im", "call");
    private static final Set<String> NAME_FILLERS = Set.of("is", "me", "a", "the");

    private static final Map<String, List<String>> JOB_KEYWORDS = new LinkedHashMap<>();

    static {
        JOB_KEYWORDS.put("blocked_drain", List.of("blocked", "drain", "clogged", "backup"));
        JOB_KEYWORDS.put("leaking_tap", List.of("leaking", "tap", "faucet", "drip"));
        JOB_KEYWORDS.put("toilet_repair", List.of("toilet", "loo", "cistern", "flush"));
        JOB_KEYWORDS.put("hot_water", List.of("hot water", "heater", "no hot water", "cold"));
        JOB_KEYWORDS.put("gas_fitting", List.of("gas", "stove", "cooktop", "hot water unit"));
        JOB_KEYWORDS.put("pipe_relining", List.of("pipe", "relining", "replacement", "burst"));
        JOB_KEYWORDS.put("bathroom_renovation", List.of("bathroom", "renovation", "reno", "kitchen"));
    }

    private static final List<String> URGENT_WORDS = List.of("urgent", "emergency", "asap", "now", "today");
    private static final List<String> NORMAL_WORDS = List.of("tomorrow", "next week", "when possible");
    private static final List<String> TIME_WORDS = List.of(
            "morning", "afternoon", "evening",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    public void extract(CallSession session, String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return;
        }
        String lower = utterance.toLowerCase(Locale.ROOT);

        extractName(utterance, lower).ifPresent(name -> session.updateVariable(CUSTOMER_NAME, name));

        Matcher phone = AU_PHONE.matcher(utterance);
        if (phone.find()) {
            session.updateVariable(PHONE_NUMBER, phone.group());
        }

        for (Map.Entry<String, List<String>> job : JOB_KEYWORDS.entrySet()) {
            if (containsAny(lower, job.getValue())) {
                session.updateVariable(JOB_TYPE, job.getKey());
                break;
            }
        }

        if (containsAny(lower, URGENT_WORDS)) {
            session.updateVariable(URGENCY, "urgent");
        } else if (containsAny(lower, NORMAL_WORDS)) {
            session.updateVariable(URGENCY, "normal");
        }

        for (String indicator : TIME_WORDS) {
            if (lower.contains(indicator)) {
                String current = session.variable(PREFERRED_TIME).orElse("");
                if (!current.contains(indicator)) {
                    session.updateVariable(PREFERRED_TIME, (current + " " + indicator).trim());
                }
            }
        }
    }

    private static Optional<String> extractName(String utterance, String lower) {
        if (!lower.contains("my name is") && !lower.contains("i'm") && !lower.contains("call me")) {
            return Optional.empty();
        }
        String[] words = utterance.trim().split("\\s+");
        for (int i = 0; i < words.length; i++) {
            if (!NAME_MARKERS.contains(words[i].toLowerCase(Locale.ROOT))) {
                continue;
            }
            int j = i + 1;
            while (j < words.length && NAME_FILLERS.contains(words[j].toLowerCase(Locale.ROOT))) {
                j++;
            }
            if (j < words.length) {
                String name = words[j].replaceAll("^[.,!?]+|[.,!?]+$", "");
                if (name.length() > 1) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
