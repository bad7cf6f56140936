package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.domain.CallDirection;
import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.ClientProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatusTagsTest {

    private CallSession session;

    @BeforeEach
    void setUp() {
        session = new CallSession("CA1", CallDirection.INBOUND, "", "", ClientProfile.defaultProfile(),
                Instant.parse("2024-05-01T10:00:00Z"), Duration.ofSeconds(300), Duration.ofSeconds(600));
    }

    @Test
    void paymentLinkSentShouldSwitchToPaymentTimeout() {
        StatusTags.apply(session, Map.of(StatusTags.PAYMENT_LINK_SENT, "Yes"));

        assertThat(session.isPaymentLinkSent()).isTrue();
        assertThat(session.activeTimeout()).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void clientPaidShouldRestoreCallTimeout() {
        session.markPaymentLinkSent();

        StatusTags.apply(session, Map.of(StatusTags.CLIENT_PAID, "true"));

        assertThat(session.isPaymentLinkSent()).isFalse();
    }

    @Test
    void recordingPermissionShouldBeReported() {
        assertThat(StatusTags.apply(session, Map.of(StatusTags.RECORDING_PERMISSION, "Yes"))).isTrue();
        assertThat(StatusTags.apply(session, Map.of(StatusTags.RECORDING_PERMISSION, "No"))).isFalse();
        assertThat(StatusTags.apply(session, Map.of())).isFalse();
    }

    @Test
    void sendPaymentLinkShouldRequireConfirmedPhone() {
        StatusTags.apply(session, Map.of(StatusTags.SEND_PAYMENT_LINK, "Yes"));
        assertThat(session.isPaymentLinkSent()).isFalse();

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(StatusTags.PHONE_CONFIRMED, "0412345678");
        tags.put(StatusTags.SEND_PAYMENT_LINK, "Yes");
        StatusTags.apply(session, tags);

        assertThat(session.variable(StatusTags.CONFIRMED_PHONE_VARIABLE)).contains("0412345678");
        assertThat(session.isPaymentLinkSent()).isTrue();
    }

    @Test
    void parsedPhoneConfirmationShouldPrecedePaymentLinkRequest() {
        GenerationResult result = new GenerationResponseParser().parse(
                "SMS_FLAG: PHONE_CONFIRMED=0412345678\n"
                        + "SMS_FLAG: SEND_PAYMENT_LINK\n"
                        + "GENERATE: I've sent the payment link to your phone.");

        assertThat(result.tags().keySet())
                .containsExactly(StatusTags.PHONE_CONFIRMED, StatusTags.SEND_PAYMENT_LINK);

        StatusTags.apply(session, result.tags());

        assertThat(session.isPaymentLinkSent()).isTrue();
        assertThat(session.activeTimeout()).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void tagNamingSessionFlagShouldSetIt() {
        StatusTags.apply(session, Map.of("URGENT_CALL", "Yes", "PRICING_DISCUSSED", "no"));

        assertThat(session.flag("urgent_call")).isTrue();
        assertThat(session.flag("pricing_discussed")).isFalse();
    }

    @Test
    void unknownTagShouldBeIgnored() {
        StatusTags.apply(session, Map.of("SOMETHING_ELSE", "Yes"));

        assertThat(session.flags()).doesNotContainKey("something_else");
    }

    @Test
    void isYesShouldAcceptYesAndTrueOnly() {
        assertThat(StatusTags.isYes(" yes ")).isTrue();
        assertThat(StatusTags.isYes("TRUE")).isTrue();
        assertThat(StatusTags.isYes("y")).isFalse();
        assertThat(StatusTags.isYes(null)).isFalse();
    }
}
