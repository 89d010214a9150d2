package ai.imagegraph.executor.model;

import java.time.Duration;

/**
 * Blocking wait used between history polls.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
