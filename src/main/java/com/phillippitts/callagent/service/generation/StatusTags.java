package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Map;

/**
 * Applies status tags reported by the response generator to a session.
 *
 * <p>Must run on the call lane.
 */
public final class StatusTags {

    private static final Logger LOG = LogManager.getLogger(StatusTags.class);

    public static final String YES = "Yes";

    public static final String PAYMENT_LINK_SENT = "PAYMENT_LINK_SENT";
    public static final String CLIENT_PAID = "CLIENT_PAID";
    public static final String RECORDING_PERMISSION = "RECORDING_PERMISSION";
    public static final String PHONE_CONFIRMED = "PHONE_CONFIRMED";
    public static final String SEND_PAYMENT_LINK = "SEND_PAYMENT_LINK";

    public static final String CONFIRMED_PHONE_VARIABLE = "confirmed_phone_number";

    private StatusTags() {
    }

    /**
     * Applies tags in order. Tags naming one of the session's flags (case-insensitive) raise or
     * lower that flag.
     *
     * @return {@code true} if the caller granted recording permission
     */
    public static boolean apply(CallSession session, Map<String, String> tags) {
        boolean recordingConsent = false;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            String key = tag.getKey();
            String value = tag.getValue();
            switch (key) {
                case PAYMENT_LINK_SENT -> {
                    if (isYes(value)) {
                        session.markPaymentLinkSent();
                    }
                }
                case CLIENT_PAID -> {
                    if (isYes(value)) {
                        session.clearPaymentLinkSent();
                    }
                }
                case RECORDING_PERMISSION -> recordingConsent = recordingConsent || isYes(value);
                case PHONE_CONFIRMED -> {
                    session.updateVariable(CONFIRMED_PHONE_VARIABLE, value);
                    LOG.info("Phone confirmed: {}", LogSanitizer.maskNumber(value, 3));
                }
                case SEND_PAYMENT_LINK -> {
                    if (session.variable(CONFIRMED_PHONE_VARIABLE).isPresent()) {
                        session.markPaymentLinkSent();
                        LOG.info("Payment link requested for confirmed number");
                    } else {
                        LOG.warn("Payment link requested but no phone number has been confirmed");
                    }
                }
                default -> applyFlag(session, key, value);
            }
        }
        return recordingConsent;
    }

    static boolean isYes(String value) {
        return value != null && (YES.equalsIgnoreCase(value.trim()) || "true".equalsIgnoreCase(value.trim()));
    }

    private static void applyFlag(CallSession session, String key, String value) {
        String flag = key.toLowerCase(Locale.ROOT);
        if (session.flags().containsKey(flag)) {
            session.setFlag(flag, isYes(value));
        } else {
            LOG.debug("Ignoring unknown status tag {}={}", key, value);
        }
    }
}
