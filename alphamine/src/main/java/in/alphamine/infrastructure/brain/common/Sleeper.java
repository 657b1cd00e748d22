package in.alphamine.infrastructure.brain.common;

import java.time.Duration;

/**
 * Blocking wait used for backoff and poll intervals. Tests substitute a recording instance.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
