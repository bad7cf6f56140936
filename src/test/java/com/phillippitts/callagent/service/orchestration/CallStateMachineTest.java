package com.phillippitts.callagent.service.orchestration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CallStateMachineTest {

    @Test
    void shouldStartIdle() {
        CallStateMachine machine = new CallStateMachine();

        assertThat(machine.current()).isEqualTo(CallState.IDLE);
        assertThat(machine.isClosed()).isFalse();
    }

    @Test
    void shouldFollowAnsweredTurn() {
        CallStateMachine machine = new CallStateMachine();

        assertThat(machine.transition(CallState.IDLE, CallState.STREAMING)).isTrue();
        assertThat(machine.transition(CallState.STREAMING, CallState.DISPATCHING)).isTrue();
        assertThat(machine.transition(CallState.DISPATCHING, CallState.RESPONDING_SPEECH)).isTrue();
        assertThat(machine.transition(CallState.RESPONDING_SPEECH, CallState.STREAMING)).isTrue();

        assertThat(machine.current()).isEqualTo(CallState.STREAMING);
    }

    @Test
    void shouldRejectTransitionFromWrongState() {
        CallStateMachine machine = new CallStateMachine();

        assertThat(machine.transition(CallState.STREAMING, CallState.DISPATCHING)).isFalse();
        assertThat(machine.current()).isEqualTo(CallState.IDLE);
    }

    @Test
    void shouldRejectDisallowedTransition() {
        CallStateMachine machine = new CallStateMachine();
        machine.transition(CallState.IDLE, CallState.STREAMING);

        assertThat(machine.transition(CallState.STREAMING, CallState.RESPONDING_SPEECH)).isFalse();
        assertThat(machine.transition(CallState.STREAMING, CallState.DISCONNECTING)).isFalse();
        assertThat(machine.current()).isEqualTo(CallState.STREAMING);
    }

    @Test
    void greetingMayPlayStraightFromStreaming() {
        assertThat(CallStateMachine.isAllowed(CallState.STREAMING, CallState.RESPONDING_AUDIO)).isTrue();
        assertThat(CallStateMachine.isAllowed(CallState.DISPATCHING, CallState.DISCONNECTING)).isTrue();
        assertThat(CallStateMachine.isAllowed(CallState.DISCONNECTING, CallState.STREAMING)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(CallState.class)
    void closedShouldBeTerminal(CallState target) {
        CallStateMachine machine = new CallStateMachine();
        machine.close();

        assertThat(machine.transition(CallState.CLOSED, target)).isFalse();
        assertThat(machine.isClosed()).isTrue();
    }

    @Test
    void closeShouldSucceedOnlyOnce() throws InterruptedException {
        CallStateMachine machine = new CallStateMachine();
        machine.transition(CallState.IDLE, CallState.STREAMING);
        int threads = 8;
        CountDownLatch ready = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        ready.await();
                        if (machine.close()) {
                            winners.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            ready.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(winners).hasValue(1);
        assertThat(machine.current()).isEqualTo(CallState.CLOSED);
    }
}
