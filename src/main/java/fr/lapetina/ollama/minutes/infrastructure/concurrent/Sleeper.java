package fr.lapetina.ollama.minutes.infrastructure.concurrent;

import java.time.Duration;

/**
 * Blocking pause used between attempts. Interruptible, so cancelling a task also
 * cancels its back-off.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
