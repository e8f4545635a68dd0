package at.sv.zmanim.zman;

import at.sv.zmanim.astro.SolarEvent;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * How a {@link Zman} is derived. Definitions referring to other zmanim are resolved through the calendar, so a
 * definition only describes one step of the calculation.
 */
public interface ZmanDefinition {

    Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date);

    enum Event {
        SUNRISE,
        SEA_LEVEL_SUNRISE,
        ELEVATION_ADJUSTED_SUNRISE,
        SUNSET,
        SEA_LEVEL_SUNSET,
        ELEVATION_ADJUSTED_SUNSET,
        SUN_TRANSIT,
        SOLAR_MIDNIGHT,
        CHATZOS,
        CHATZOS_AS_HALF_DAY
    }

    record SunEvent(Event event) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return switch (event) {
                case SUNRISE -> calendar.getAstronomicalCalendar().getSunrise(date);
                case SEA_LEVEL_SUNRISE -> calendar.getAstronomicalCalendar().getSeaLevelSunrise(date);
                case ELEVATION_ADJUSTED_SUNRISE -> calendar.getElevationAdjustedSunrise(date);
                case SUNSET -> calendar.getAstronomicalCalendar().getSunset(date);
                case SEA_LEVEL_SUNSET -> calendar.getAstronomicalCalendar().getSeaLevelSunset(date);
                case ELEVATION_ADJUSTED_SUNSET -> calendar.getElevationAdjustedSunset(date);
                case SUN_TRANSIT -> calendar.getAstronomicalCalendar().getSunTransit(date);
                case SOLAR_MIDNIGHT -> calendar.getAstronomicalCalendar().getSolarMidnight(date);
                case CHATZOS -> calendar.getChatzos(date);
                case CHATZOS_AS_HALF_DAY -> calendar.getChatzosAsHalfDay(date);
            };
        }
    }

    /**
     * The sun crossing the given zenith in the morning ({@link SolarEvent#SUNRISE}) or the evening
     * ({@link SolarEvent#SUNSET}).
     */
    record DegreesOffset(double zenith, SolarEvent event) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return calendar.getAstronomicalCalendar().getOffsetByDegrees(date, zenith, event);
        }
    }

    record FixedOffset(Zman base, Duration offset) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return calendar.getZman(date, base).map(time -> time.plus(offset));
        }
    }

    /**
     * A number of GRA temporal hours after sunset, or before sunrise if negative.
     */
    record ZmanisOffset(double hours) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return calendar.getZmanisBasedOffset(date, hours);
        }
    }

    /**
     * An offset taken from the {@link ZmanimOptions}, subtracted from the base zman if {@code before}.
     */
    record ConfiguredOffset(Zman base, Function<ZmanimOptions, Duration> offset, boolean before)
            implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            Duration duration = offset.apply(calendar.getOptions());
            return calendar.getZman(date, base).map(time -> before ? time.minus(duration) : time.plus(duration));
        }
    }

    /**
     * A {@link DayPart} of the day from {@code start} to {@code end}. Only a synchronous day, one that is symmetric
     * around chatzos, may be anchored at chatzos.
     */
    record Anchored(DayPart part, Zman start, Zman end, boolean synchronous) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return calendar.getDayPart(date, part, calendar.getZman(date, start), calendar.getZman(date, end),
                    synchronous);
        }
    }

    record HalfDay(Zman start, Zman end, double hours) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return ProportionalDay.halfDayBasedZman(calendar.getZman(date, start), calendar.getZman(date, end), hours);
        }
    }

    record LocalMeanTime(double hours) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            return calendar.getAstronomicalCalendar().getLocalMeanTime(date, hours);
        }
    }

    /**
     * The later of two zmanim, absent if either is absent.
     */
    record Latest(Zman first, Zman second) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            Optional<ZonedDateTime> firstTime = calendar.getZman(date, first);
            Optional<ZonedDateTime> secondTime = calendar.getZman(date, second);
            if (firstTime.isEmpty() || secondTime.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(firstTime.get().isAfter(secondTime.get()) ? firstTime.get() : secondTime.get());
        }
    }

    /**
     * {@code base} plus the interval from {@code from} to {@code to} scaled by {@code factor}.
     */
    record ScaledInterval(Zman base, Zman from, Zman to, double factor) implements ZmanDefinition {

        @Override
        public Optional<ZonedDateTime> calculate(ZmanimCalendar calendar, LocalDate date) {
            Optional<ZonedDateTime> baseTime = calendar.getZman(date, base);
            Optional<ZonedDateTime> fromTime = calendar.getZman(date, from);
            Optional<ZonedDateTime> toTime = calendar.getZman(date, to);
            if (baseTime.isEmpty() || fromTime.isEmpty() || toTime.isEmpty()) {
                return Optional.empty();
            }
            Duration interval = Duration.between(fromTime.get(), toTime.get());
            return Optional.of(baseTime.get().plus(ProportionalDay.multiply(interval, factor)));
        }
    }
}
