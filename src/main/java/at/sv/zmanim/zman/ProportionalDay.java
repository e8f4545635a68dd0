package at.sv.zmanim.zman;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Arithmetic of the proportional (temporal) day. A day is defined by any start and end; a temporal hour is a
 * twelfth of it, a half day based hour a sixth of the time between start and the end of the half.
 * <p>
 * Offsets are computed from the length of the whole interval, so twelve temporal hours end exactly at the end of
 * the day even when the length is not divisible into whole nanoseconds.
 * <p>
 * Every function is absent as soon as one of its inputs is absent.
 */
public final class ProportionalDay {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private ProportionalDay() {
    }

    public static Optional<Duration> temporalHour(Optional<ZonedDateTime> start, Optional<ZonedDateTime> end) {
        return both(start, end).map(day -> day.length().dividedBy(12));
    }

    /**
     * The time the given number of temporal hours after the start of the day. Negative hours lie before the start.
     */
    public static Optional<ZonedDateTime> shaahZmanisBasedZman(Optional<ZonedDateTime> start, Optional<ZonedDateTime> end,
                                                               double hours) {
        return both(start, end).map(day -> day.start.plus(multiply(day.length(), hours / 12)));
    }

    /**
     * Whole day based zman as used by the named day definitions. Counting backwards is not a valid use of a day
     * definition, so negative hours yield no time.
     */
    public static Optional<ZonedDateTime> proportionalZman(Optional<ZonedDateTime> start, Optional<ZonedDateTime> end,
                                                           double hours) {
        if (hours < 0) {
            return Optional.empty();
        }
        return shaahZmanisBasedZman(start, end, hours);
    }

    public static Optional<Duration> halfDayBasedShaahZmanis(Optional<ZonedDateTime> startOfHalfDay,
                                                             Optional<ZonedDateTime> endOfHalfDay) {
        return both(startOfHalfDay, endOfHalfDay).map(half -> half.length().dividedBy(6));
    }

    /**
     * A zman based on a sixth of a half day. Positive hours are counted from the start of the half day, negative
     * hours backwards from its end.
     */
    public static Optional<ZonedDateTime> halfDayBasedZman(Optional<ZonedDateTime> startOfHalfDay,
                                                           Optional<ZonedDateTime> endOfHalfDay, double hours) {
        return both(startOfHalfDay, endOfHalfDay).map(half -> {
            Duration offset = multiply(half.length(), hours / 6);
            if (hours >= 0) {
                return half.start.plus(offset);
            }
            return half.end.plus(offset);
        });
    }

    /**
     * Six temporal hours after the start of the day.
     */
    public static Optional<ZonedDateTime> midpoint(Optional<ZonedDateTime> start, Optional<ZonedDateTime> end) {
        return both(start, end).map(day -> day.start.plus(day.length().dividedBy(2)));
    }

    /**
     * Multiplies with nanosecond precision, rounding half up.
     */
    public static Duration multiply(Duration duration, double factor) {
        BigDecimal nanos = BigDecimal.valueOf(duration.getSeconds())
                                     .multiply(NANOS_PER_SECOND)
                                     .add(BigDecimal.valueOf(duration.getNano()))
                                     .multiply(BigDecimal.valueOf(factor))
                                     .setScale(0, RoundingMode.HALF_UP);
        return Duration.ofNanos(nanos.longValueExact());
    }

    private static Optional<Day> both(Optional<ZonedDateTime> start, Optional<ZonedDateTime> end) {
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Day(start.get(), end.get()));
    }

    private record Day(ZonedDateTime start, ZonedDateTime end) {

        Duration length() {
            return Duration.between(start, end);
        }
    }
}
