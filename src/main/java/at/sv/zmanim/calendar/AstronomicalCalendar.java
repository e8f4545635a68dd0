package at.sv.zmanim.calendar;

import at.sv.zmanim.astro.AstronomicalCalculator;
import at.sv.zmanim.astro.NoaaCalculator;
import at.sv.zmanim.astro.SolarEvent;
import at.sv.zmanim.astro.Zenith;
import at.sv.zmanim.geo.GeoLocation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Sunrise, sunset, twilight and transit times of a location as clock times in the location's time zone.
 * <p>
 * All queries take the civil date explicitly; an instance holds no other state and can be shared between threads.
 * A time that does not occur on the date, e.g. sunrise during the polar night, is returned as {@link Optional#empty()}.
 */
@Slf4j
@Getter
public final class AstronomicalCalendar {

    static final double DEGREE_SEARCH_STEP = 0.0001;
    static final double DEGREE_SEARCH_LIMIT = 30;

    private final GeoLocation geoLocation;
    private final AstronomicalCalculator calculator;

    public AstronomicalCalendar(GeoLocation geoLocation) {
        this(geoLocation, new NoaaCalculator());
    }

    public AstronomicalCalendar(GeoLocation geoLocation, AstronomicalCalculator calculator) {
        this.geoLocation = geoLocation;
        this.calculator = calculator;
    }

    public ZoneId getTimeZone() {
        return geoLocation.getTimeZone();
    }

    /**
     * Sunrise including the solar radius, refraction and, if the location has one, the elevation of the observer.
     */
    public Optional<ZonedDateTime> getSunrise(LocalDate date) {
        return toDateTime(date, getUtcSunrise(date, Zenith.GEOMETRIC), SolarEvent.SUNRISE);
    }

    public Optional<ZonedDateTime> getSeaLevelSunrise(LocalDate date) {
        return toDateTime(date, getUtcSeaLevelSunrise(date, Zenith.GEOMETRIC), SolarEvent.SUNRISE);
    }

    public Optional<ZonedDateTime> getSunset(LocalDate date) {
        return toDateTime(date, getUtcSunset(date, Zenith.GEOMETRIC), SolarEvent.SUNSET);
    }

    public Optional<ZonedDateTime> getSeaLevelSunset(LocalDate date) {
        return toDateTime(date, getUtcSeaLevelSunset(date, Zenith.GEOMETRIC), SolarEvent.SUNSET);
    }

    public Optional<ZonedDateTime> getBeginCivilTwilight(LocalDate date) {
        return getSunriseOffsetByDegrees(date, Zenith.CIVIL);
    }

    public Optional<ZonedDateTime> getBeginNauticalTwilight(LocalDate date) {
        return getSunriseOffsetByDegrees(date, Zenith.NAUTICAL);
    }

    public Optional<ZonedDateTime> getBeginAstronomicalTwilight(LocalDate date) {
        return getSunriseOffsetByDegrees(date, Zenith.ASTRONOMICAL);
    }

    public Optional<ZonedDateTime> getEndCivilTwilight(LocalDate date) {
        return getSunsetOffsetByDegrees(date, Zenith.CIVIL);
    }

    public Optional<ZonedDateTime> getEndNauticalTwilight(LocalDate date) {
        return getSunsetOffsetByDegrees(date, Zenith.NAUTICAL);
    }

    public Optional<ZonedDateTime> getEndAstronomicalTwilight(LocalDate date) {
        return getSunsetOffsetByDegrees(date, Zenith.ASTRONOMICAL);
    }

    public Optional<ZonedDateTime> getSunriseOffsetByDegrees(LocalDate date, double zenith) {
        return getOffsetByDegrees(date, zenith, SolarEvent.SUNRISE);
    }

    public Optional<ZonedDateTime> getSunsetOffsetByDegrees(LocalDate date, double zenith) {
        return getOffsetByDegrees(date, zenith, SolarEvent.SUNSET);
    }

    /**
     * The time the center of the sun crosses the given zenith. The zenith is used as is, without any elevation
     * adjustment, so a zenith of exactly 90&deg; yields the sea level sunrise or sunset.
     *
     * @param event {@link SolarEvent#SUNRISE} for the morning crossing or {@link SolarEvent#SUNSET} for the evening
     *              crossing
     * @return empty if the sun does not cross the zenith, or for {@link SolarEvent#NOON} and
     * {@link SolarEvent#MIDNIGHT} which have no degree offset
     */
    public Optional<ZonedDateTime> getOffsetByDegrees(LocalDate date, double zenith, SolarEvent event) {
        return switch (event) {
            case SUNRISE -> toDateTime(date, getUtcSeaLevelSunrise(date, zenith), event);
            case SUNSET -> toDateTime(date, getUtcSeaLevelSunset(date, zenith), event);
            case NOON, MIDNIGHT -> {
                log.debug("No degree offset for {}", event);
                yield Optional.empty();
            }
        };
    }

    public OptionalDouble getUtcSunrise(LocalDate date, double zenith) {
        return calculator.getUtcSunrise(getAdjustedDate(date), geoLocation, zenith, true);
    }

    public OptionalDouble getUtcSeaLevelSunrise(LocalDate date, double zenith) {
        return calculator.getUtcSunrise(getAdjustedDate(date), geoLocation, zenith, false);
    }

    public OptionalDouble getUtcSunset(LocalDate date, double zenith) {
        return calculator.getUtcSunset(getAdjustedDate(date), geoLocation, zenith, true);
    }

    public OptionalDouble getUtcSeaLevelSunset(LocalDate date, double zenith) {
        return calculator.getUtcSunset(getAdjustedDate(date), geoLocation, zenith, false);
    }

    /**
     * One twelfth of the time between sea level sunrise and sea level sunset.
     */
    public Optional<Duration> getTemporalHour(LocalDate date) {
        return getSeaLevelSunrise(date).flatMap(sunrise -> getSeaLevelSunset(date)
                .map(sunset -> getTemporalHour(sunrise, sunset)));
    }

    public Duration getTemporalHour(ZonedDateTime startOfDay, ZonedDateTime endOfDay) {
        return Duration.between(startOfDay, endOfDay).dividedBy(12);
    }

    /**
     * The astronomical transit of the sun, when it crosses the meridian of the location.
     */
    public Optional<ZonedDateTime> getSunTransit(LocalDate date) {
        return getDateFromTime(date, calculator.getUtcNoon(getAdjustedDate(date), geoLocation), SolarEvent.NOON);
    }

    /**
     * The sun's lower transit following the transit of the given date.
     */
    public Optional<ZonedDateTime> getSolarMidnight(LocalDate date) {
        return getDateFromTime(date, calculator.getUtcMidnight(getAdjustedDate(date), geoLocation), SolarEvent.MIDNIGHT);
    }

    /**
     * The midpoint of an arbitrary day, i.e. six temporal hours after its start.
     */
    public ZonedDateTime getSunTransit(ZonedDateTime startOfDay, ZonedDateTime endOfDay) {
        return startOfDay.plus(getTemporalHour(startOfDay, endOfDay).multipliedBy(6));
    }

    /**
     * The clock time at which the local mean time of the location is the given number of hours. The clock hour is
     * placed on its date like a sunrise, so late hours east of the zone's meridian may land on the previous day.
     *
     * @param hours in [0, 24)
     * @return empty for hours outside of [0, 24)
     */
    public Optional<ZonedDateTime> getLocalMeanTime(LocalDate date, double hours) {
        if (hours < 0 || hours >= 24) {
            return Optional.empty();
        }
        Instant startOfDay = date.atStartOfDay(getTimeZone()).toInstant();
        double zoneOffsetHours = getTimeZone().getRules().getOffset(startOfDay).getTotalSeconds() / 3600.0;
        long localMeanTimeOffset = geoLocation.getLocalMeanTimeOffset(startOfDay);
        return getDateFromTime(date, hours - zoneOffsetHours, SolarEvent.SUNRISE)
                .map(clockTime -> clockTime.minus(localMeanTimeOffset, ChronoUnit.MILLIS));
    }

    /**
     * @return the geometric elevation of the sun in degrees, negative below the horizon
     */
    public double getSolarElevation(ZonedDateTime time) {
        return calculator.getSolarElevation(time.toInstant(), geoLocation);
    }

    /**
     * @return the azimuth of the sun in degrees, clockwise from north
     */
    public double getSolarAzimuth(ZonedDateTime time) {
        return calculator.getSolarAzimuth(time.toInstant(), geoLocation);
    }

    /**
     * Searches the depression of the sun below the geometric horizon at the given number of minutes before sea level
     * sunrise. The search steps through the degrees in increments of 0.0001&deg; and is far too slow to be used for
     * more than single lookups.
     *
     * @return the depression in degrees, empty if there is no sunrise or no matching depression up to 30&deg;
     */
    public OptionalDouble getSunriseSolarDipFromOffset(LocalDate date, double minutes) {
        Optional<ZonedDateTime> sunrise = getSeaLevelSunrise(date);
        if (sunrise.isEmpty()) {
            return OptionalDouble.empty();
        }
        Instant target = sunrise.get().toInstant().minusNanos(Math.round(minutes * 60 * 1e9));
        Optional<ZonedDateTime> offsetByDegrees = sunrise;
        int steps = 0;
        double degrees = 0;
        while (offsetByDegrees.isEmpty()
               || minutes < 0 && offsetByDegrees.get().toInstant().isBefore(target)
               || minutes > 0 && offsetByDegrees.get().toInstant().isAfter(target)) {
            steps += minutes > 0 ? 1 : -1;
            degrees = steps * DEGREE_SEARCH_STEP;
            if (Math.abs(degrees) > DEGREE_SEARCH_LIMIT) {
                log.debug("No sunrise dip found for {} minutes on {} at {}", minutes, date, geoLocation);
                return OptionalDouble.empty();
            }
            offsetByDegrees = getSunriseOffsetByDegrees(date, Zenith.belowHorizon(degrees));
        }
        return OptionalDouble.of(degrees);
    }

    /**
     * Searches the depression of the sun below the geometric horizon at the given number of minutes after sea level
     * sunset. Just like {@link #getSunriseSolarDipFromOffset(LocalDate, double)} this is a linear search.
     *
     * @return the depression in degrees, empty if there is no sunset or no matching depression up to 30&deg;
     */
    public OptionalDouble getSunsetSolarDipFromOffset(LocalDate date, double minutes) {
        Optional<ZonedDateTime> sunset = getSeaLevelSunset(date);
        if (sunset.isEmpty()) {
            return OptionalDouble.empty();
        }
        Instant target = sunset.get().toInstant().plusNanos(Math.round(minutes * 60 * 1e9));
        Optional<ZonedDateTime> offsetByDegrees = sunset;
        int steps = 0;
        double degrees = 0;
        while (offsetByDegrees.isEmpty()
               || minutes > 0 && offsetByDegrees.get().toInstant().isBefore(target)
               || minutes < 0 && offsetByDegrees.get().toInstant().isAfter(target)) {
            steps += minutes > 0 ? 1 : -1;
            degrees = steps * DEGREE_SEARCH_STEP;
            if (Math.abs(degrees) > DEGREE_SEARCH_LIMIT) {
                log.debug("No sunset dip found for {} minutes on {} at {}", minutes, date, geoLocation);
                return OptionalDouble.empty();
            }
            offsetByDegrees = getSunsetOffsetByDegrees(date, Zenith.belowHorizon(degrees));
        }
        return OptionalDouble.of(degrees);
    }

    /**
     * Turns a UTC time of day returned by the calculator into a date time in the time zone of the location.
     * <p>
     * The calculator only knows the time of day, so the date the event belongs to has to be derived from the
     * rough local solar time: a sunrise late in the UTC day, for example, happened on the previous UTC date.
     *
     * @param calculatedTime UTC hours in [0, 24), NaN for a time that does not exist
     */
    public Optional<ZonedDateTime> getDateFromTime(LocalDate date, double calculatedTime, SolarEvent event) {
        if (Double.isNaN(calculatedTime)) {
            return Optional.empty();
        }
        ZonedDateTime time = getAdjustedDate(date).atStartOfDay(ZoneOffset.UTC);

        double remainder = calculatedTime;
        long hours = (long) remainder;
        remainder -= hours;
        remainder *= 60;
        long minutes = (long) remainder;
        remainder -= minutes;
        remainder *= 60;
        long seconds = (long) remainder;
        remainder -= seconds;
        long nanos = (long) (remainder * 1e9);

        int localTimeHours = (int) (geoLocation.getLongitude() / 15);
        if (event == SolarEvent.SUNRISE && localTimeHours + hours > 18) {
            time = time.minusDays(1);
        } else if (event == SolarEvent.SUNSET && localTimeHours + hours < 6) {
            time = time.plusDays(1);
        } else if (event == SolarEvent.MIDNIGHT && localTimeHours + hours < 12) {
            time = time.plusDays(1);
        } else if (event == SolarEvent.NOON && localTimeHours + hours > 24) {
            time = time.minusDays(1);
        }

        time = time.plusHours(hours)
                   .plusMinutes(minutes)
                   .plusSeconds(seconds)
                   .plusNanos(nanos);
        return Optional.of(time.withZoneSameInstant(getTimeZone()));
    }

    /**
     * The date the calculator is queried for. Differs from the given date only for locations whose time zone lies
     * on the other side of the antimeridian.
     */
    LocalDate getAdjustedDate(LocalDate date) {
        Instant startOfDay = date.atStartOfDay(getTimeZone()).toInstant();
        int adjustment = geoLocation.getAntimeridianAdjustment(startOfDay);
        if (adjustment != 0) {
            log.trace("Antimeridian adjustment of {} day(s) for {}", adjustment, geoLocation);
        }
        return date.plusDays(adjustment);
    }

    private Optional<ZonedDateTime> toDateTime(LocalDate date, OptionalDouble utcHours, SolarEvent event) {
        if (utcHours.isEmpty()) {
            return Optional.empty();
        }
        return getDateFromTime(date, utcHours.getAsDouble(), event);
    }

    @Override
    public String toString() {
        return "AstronomicalCalendar{" +
               "geoLocation=" + geoLocation +
               ", calculator=" + calculator +
               '}';
    }
}
