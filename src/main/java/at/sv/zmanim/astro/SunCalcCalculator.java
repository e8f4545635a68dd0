package at.sv.zmanim.astro;

import at.sv.zmanim.geo.GeoLocation;
import org.shredzone.commons.suncalc.SunPosition;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.OptionalDouble;

/**
 * Calculator backed by commons-suncalc. Events are searched within the local mean solar day of the given date at the
 * location's longitude, the same day the NOAA calculator solves for, so an event close to midnight UTC is not lost
 * at the edge of the UTC day.
 */
public final class SunCalcCalculator implements AstronomicalCalculator {

    @Override
    public String getCalculatorName() {
        return "commons-suncalc";
    }

    @Override
    public OptionalDouble getUtcSunrise(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        ZonedDateTime start = startOfSolarDay(date, location);
        return toUtcHours(sunTimesFor(start, location, zenith, adjustForElevation).getRise());
    }

    @Override
    public OptionalDouble getUtcSunset(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        ZonedDateTime start = startOfSolarDay(date, location);
        return toUtcHours(sunTimesFor(start, location, zenith, adjustForElevation).getSet());
    }

    @Override
    public double getUtcNoon(LocalDate date, GeoLocation location) {
        ZonedDateTime start = startOfSolarDay(date, location);
        return toUtcHours(sunTimesFor(start, location, Zenith.GEOMETRIC, false).getNoon()).orElse(Double.NaN);
    }

    @Override
    public double getUtcMidnight(LocalDate date, GeoLocation location) {
        // the lower transit lies at the end of the solar day, so search from its noon
        ZonedDateTime solarNoon = startOfSolarDay(date, location).plusHours(12);
        return toUtcHours(sunTimesFor(solarNoon, location, Zenith.GEOMETRIC, false).getNadir()).orElse(Double.NaN);
    }

    @Override
    public double getSolarElevation(Instant instant, GeoLocation location) {
        return positionAt(instant, location).getTrueAltitude();
    }

    @Override
    public double getSolarAzimuth(Instant instant, GeoLocation location) {
        return positionAt(instant, location).getAzimuth();
    }

    private SunPosition positionAt(Instant instant, GeoLocation location) {
        return SunPosition.compute()
                          .on(instant.atZone(ZoneOffset.UTC))
                          .at(location.getLatitude(), location.getLongitude())
                          .execute();
    }

    /**
     * The geometric horizon maps to the library's visual sunrise definition (upper limb, refraction and horizon dip
     * of the observer elevation). Any other zenith is passed as the exact elevation angle of the sun's center.
     */
    private SunTimes sunTimesFor(ZonedDateTime start, GeoLocation location, double zenith, boolean adjustForElevation) {
        SunTimes.Parameters parameters = SunTimes.compute()
                                                 .on(start)
                                                 .at(location.getLatitude(), location.getLongitude())
                                                 .oneDay();
        if (zenith == Zenith.GEOMETRIC) {
            parameters.twilight(SunTimes.Twilight.VISUAL)
                      .elevation(adjustForElevation ? location.getElevation() : 0);
        } else {
            parameters.twilight(Zenith.GEOMETRIC - zenith);
        }
        return parameters.execute();
    }

    /**
     * Local mean midnight of the date at the location's longitude, in UTC.
     */
    static ZonedDateTime startOfSolarDay(LocalDate date, GeoLocation location) {
        long longitudeOffsetSeconds = Math.round(location.getLongitude() * 4 * 60);
        return date.atStartOfDay(ZoneOffset.UTC).minusSeconds(longitudeOffsetSeconds);
    }

    private static OptionalDouble toUtcHours(ZonedDateTime time) {
        if (time == null) {
            return OptionalDouble.empty();
        }
        ZonedDateTime utc = time.withZoneSameInstant(ZoneOffset.UTC);
        double hours = utc.getHour() + utc.getMinute() / 60.0 + utc.getSecond() / 3600.0 + utc.getNano() / 3.6e12;
        return OptionalDouble.of(hours);
    }

    @Override
    public String toString() {
        return "SunCalcCalculator";
    }
}
