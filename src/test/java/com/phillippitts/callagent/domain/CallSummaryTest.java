package com.phillippitts.callagent.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CallSummaryTest {

    @Test
    void zeroLengthCallShouldBillNothing() {
        assertThat(summary(0).billedMinutes()).isZero();
    }

    @Test
    void shortCallShouldBillOneMinute() {
        assertThat(summary(1).billedMinutes()).isEqualTo(1);
        assertThat(summary(60).billedMinutes()).isEqualTo(1);
    }

    @Test
    void partialMinutesShouldRoundUp() {
        assertThat(summary(61).billedMinutes()).isEqualTo(2);
        assertThat(summary(185).billedMinutes()).isEqualTo(4);
    }

    @Test
    void negativeDurationShouldClampToZero() {
        CallSummary s = summary(-5);

        assertThat(s.durationSeconds()).isZero();
        assertThat(s.billedMinutes()).isZero();
    }

    @Test
    void shouldCopyFlagsAndVariables() {
        Map<String, Boolean> flags = new HashMap<>();
        flags.put("urgent_call", true);

        CallSummary s = new CallSummary("CA1", "default", "", "", CallDirection.INBOUND, 10, 0, 0, 0,
                flags, null, "completed");
        flags.put("pricing_discussed", true);

        assertThat(s.flags()).containsOnlyKeys("urgent_call");
        assertThat(s.variables()).isEmpty();
    }

    private static CallSummary summary(long seconds) {
        return new CallSummary("CA1", "default", "+61412345678", "+61390000000", CallDirection.INBOUND,
                seconds, 0, 0, 0, Map.of(), Map.of(), "completed");
    }
}
