package com.phillippitts.callagent.service.streaming;

/**
 * Pause between outbound frames; replaced in tests to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
