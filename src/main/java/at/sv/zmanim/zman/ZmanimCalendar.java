package at.sv.zmanim.zman;

import at.sv.zmanim.calendar.AstronomicalCalendar;
import at.sv.zmanim.geo.GeoLocation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Calculates zmanim on top of an {@link AstronomicalCalendar}. Which sunrise and sunset the zmanim are based on and
 * how chatzos is determined is controlled by the {@link ZmanimOptions}.
 */
@Slf4j
@Getter
public final class ZmanimCalendar {

    private final AstronomicalCalendar astronomicalCalendar;
    private final ZmanimOptions options;

    public ZmanimCalendar(GeoLocation geoLocation) {
        this(new AstronomicalCalendar(geoLocation));
    }

    public ZmanimCalendar(AstronomicalCalendar astronomicalCalendar) {
        this(astronomicalCalendar, ZmanimOptions.defaults());
    }

    public ZmanimCalendar(AstronomicalCalendar astronomicalCalendar, ZmanimOptions options) {
        this.astronomicalCalendar = astronomicalCalendar;
        this.options = options;
    }

    /**
     * Sunrise including the elevation of the location if {@link ZmanimOptions#isUseElevation()}, sea level sunrise
     * otherwise.
     */
    public Optional<ZonedDateTime> getElevationAdjustedSunrise(LocalDate date) {
        if (options.isUseElevation()) {
            return astronomicalCalendar.getSunrise(date);
        }
        return astronomicalCalendar.getSeaLevelSunrise(date);
    }

    public Optional<ZonedDateTime> getElevationAdjustedSunset(LocalDate date) {
        if (options.isUseElevation()) {
            return astronomicalCalendar.getSunset(date);
        }
        return astronomicalCalendar.getSeaLevelSunset(date);
    }

    /**
     * The astronomical transit, or if configured the midpoint of sea level sunrise and sunset. Falls back to the
     * transit on days without sunrise or sunset.
     */
    public Optional<ZonedDateTime> getChatzos(LocalDate date) {
        if (options.isUseAstronomicalChatzos()) {
            return astronomicalCalendar.getSunTransit(date);
        }
        Optional<ZonedDateTime> halfDay = getChatzosAsHalfDay(date);
        if (halfDay.isEmpty()) {
            return astronomicalCalendar.getSunTransit(date);
        }
        return halfDay;
    }

    public Optional<ZonedDateTime> getChatzosAsHalfDay(LocalDate date) {
        return ProportionalDay.midpoint(astronomicalCalendar.getSeaLevelSunrise(date),
                astronomicalCalendar.getSeaLevelSunset(date));
    }

    /**
     * The given part of the day from {@code start} to {@code end}. With
     * {@link ZmanimOptions#isUseAstronomicalChatzosForOtherZmanim()} set, a synchronous day is split at chatzos
     * and the zman is measured within its half of the day.
     */
    public Optional<ZonedDateTime> getDayPart(LocalDate date, DayPart part, Optional<ZonedDateTime> start,
                                              Optional<ZonedDateTime> end, boolean synchronous) {
        if (options.isUseAstronomicalChatzosForOtherZmanim() && synchronous) {
            Optional<ZonedDateTime> chatzos = getChatzos(date);
            if (part.isMorning()) {
                return ProportionalDay.halfDayBasedZman(start, chatzos, part.getHalfDayHours());
            }
            return ProportionalDay.halfDayBasedZman(chatzos, end, part.getHalfDayHours());
        }
        return ProportionalDay.proportionalZman(start, end, part.getWholeDayHours());
    }

    public Optional<ZonedDateTime> getSofZmanShma(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.SOF_ZMAN_SHMA, day);
    }

    public Optional<ZonedDateTime> getSofZmanTfila(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.SOF_ZMAN_TFILA, day);
    }

    public Optional<ZonedDateTime> getMinchaGedola(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.MINCHA_GEDOLA, day);
    }

    public Optional<ZonedDateTime> getSamuchLeMinchaKetana(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.SAMUCH_LE_MINCHA_KETANA, day);
    }

    public Optional<ZonedDateTime> getMinchaKetana(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.MINCHA_KETANA, day);
    }

    public Optional<ZonedDateTime> getPlagHamincha(LocalDate date, ShaahZmanis day) {
        return getDayPart(date, DayPart.PLAG_HAMINCHA, day);
    }

    /**
     * The given number of GRA temporal hours after sunset, or before sunrise for negative hours.
     *
     * @return empty for zero hours or if there is no sunrise or sunset
     */
    public Optional<ZonedDateTime> getZmanisBasedOffset(LocalDate date, double hours) {
        if (hours == 0) {
            return Optional.empty();
        }
        Optional<ZonedDateTime> sunrise = getElevationAdjustedSunrise(date);
        Optional<ZonedDateTime> sunset = getElevationAdjustedSunset(date);
        if (sunrise.isEmpty() || sunset.isEmpty()) {
            return Optional.empty();
        }
        Duration offset = ProportionalDay.multiply(Duration.between(sunrise.get(), sunset.get()), hours / 12);
        return Optional.of(hours > 0 ? sunset.get().plus(offset) : sunrise.get().plus(offset));
    }

    /**
     * The time between sea level sunrise or sunset and the sun reaching the given depression, as a fraction of a
     * GRA temporal hour. A depression of 16.1&deg; at sunrise yields about 1.2 in Jerusalem around the equinox.
     *
     * @param degrees depression below the geometric horizon
     * @param sunset  {@code true} to measure after sunset, {@code false} to measure before sunrise
     */
    public OptionalDouble getPercentOfShaahZmanisFromDegrees(LocalDate date, double degrees, boolean sunset) {
        Optional<ZonedDateTime> seaLevelSunrise = astronomicalCalendar.getSeaLevelSunrise(date);
        Optional<ZonedDateTime> seaLevelSunset = astronomicalCalendar.getSeaLevelSunset(date);
        double zenith = 90 + degrees;
        Optional<ZonedDateTime> twilight = sunset
                ? astronomicalCalendar.getSunsetOffsetByDegrees(date, zenith)
                : astronomicalCalendar.getSunriseOffsetByDegrees(date, zenith);
        if (seaLevelSunrise.isEmpty() || seaLevelSunset.isEmpty() || twilight.isEmpty()) {
            return OptionalDouble.empty();
        }
        double shaahZmanis = Duration.between(seaLevelSunrise.get(), seaLevelSunset.get()).toMillis() / 12.0;
        long riseSetToTwilight = sunset
                ? Duration.between(seaLevelSunset.get(), twilight.get()).toMillis()
                : Duration.between(twilight.get(), seaLevelSunrise.get()).toMillis();
        return OptionalDouble.of(riseSetToTwilight / shaahZmanis);
    }

    public Optional<Duration> getShaahZmanis(LocalDate date, ShaahZmanis day) {
        return ProportionalDay.temporalHour(getZman(date, day.getStart()), getZman(date, day.getEnd()));
    }

    public Optional<ZonedDateTime> getZman(LocalDate date, Zman zman) {
        Optional<ZonedDateTime> time = ZmanTable.definitionOf(zman).calculate(this, date);
        if (time.isEmpty()) {
            log.trace("No {} on {} at {}", zman, date, astronomicalCalendar.getGeoLocation());
        }
        return time;
    }

    /**
     * Calculates the given zmanim in iteration order.
     */
    public Map<Zman, Optional<ZonedDateTime>> getZmanim(LocalDate date, Collection<Zman> zmanim) {
        Map<Zman, Optional<ZonedDateTime>> result = new LinkedHashMap<>();
        for (Zman zman : zmanim) {
            result.put(zman, getZman(date, zman));
        }
        return result;
    }

    private Optional<ZonedDateTime> getDayPart(LocalDate date, DayPart part, ShaahZmanis day) {
        return getDayPart(date, part, getZman(date, day.getStart()), getZman(date, day.getEnd()),
                day.isSynchronous());
    }

    @Override
    public String toString() {
        return "ZmanimCalendar{" +
               "astronomicalCalendar=" + astronomicalCalendar +
               ", options=" + options +
               '}';
    }
}
