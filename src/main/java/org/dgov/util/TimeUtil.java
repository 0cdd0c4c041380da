package org.dgov.util;

import java.time.Clock;

/**
 * Unix-second helpers. All voting windows are evaluated against the clock of
 * the chain that applies the operation.
 */
public final class TimeUtil {

    private TimeUtil() {
    }

    /**
     * Returns the current Unix timestamp in seconds according to the given clock.
     */
    public static long getCurrentUnixTime(Clock clock) {
        return clock.instant().getEpochSecond();
    }

    /**
     * True once {@code now} is strictly past {@code end}.
     */
    public static boolean isExpired(long now, long end) {
        return now > end;
    }
}
