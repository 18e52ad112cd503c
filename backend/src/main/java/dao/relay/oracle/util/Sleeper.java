package dao.relay.oracle.util;

import java.time.Duration;

/**
 * Blocking pause used by every retry and wait loop, so tests can run them without real time passing.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
