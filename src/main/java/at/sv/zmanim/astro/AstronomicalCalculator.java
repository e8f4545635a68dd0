package at.sv.zmanim.astro;

import at.sv.zmanim.geo.GeoLocation;

import java.time.Instant;
import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * A solar position algorithm. All times are UTC hours of the day in [0, 24) without a date attached; resolving
 * them to an instant is the job of the caller.
 */
public interface AstronomicalCalculator {

    /**
     * Mean earth radius used for the elevation adjustment, in km.
     */
    double EARTH_RADIUS = 6356.9;
    double SOLAR_RADIUS = 16.0 / 60;
    double REFRACTION = 34.0 / 60;

    String getCalculatorName();

    /**
     * @param zenith             the zenith angle of the sun at the event
     * @param adjustForElevation if the observer elevation of the location should widen the horizon. Only used for
     *                           the geometric zenith.
     * @return the UTC time of sunrise in hours, empty if the sun does not reach the zenith on this date
     */
    OptionalDouble getUtcSunrise(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation);

    OptionalDouble getUtcSunset(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation);

    double getUtcNoon(LocalDate date, GeoLocation location);

    double getUtcMidnight(LocalDate date, GeoLocation location);

    /**
     * @return the geometric elevation of the sun above the horizon in degrees, without refraction
     */
    double getSolarElevation(Instant instant, GeoLocation location);

    /**
     * @return the azimuth of the sun in degrees, clockwise from north
     */
    double getSolarAzimuth(Instant instant, GeoLocation location);

    /**
     * The dip of the horizon for an observer at the given height.
     *
     * @param elevation in meters
     * @return the additional depression of the horizon in degrees
     */
    default double getElevationAdjustment(double elevation) {
        return Math.toDegrees(Math.acos(EARTH_RADIUS / (EARTH_RADIUS + (elevation / 1000))));
    }

    /**
     * Adjusts the geometric zenith for the solar radius, refraction and observer elevation. Any other zenith is
     * returned as is, as it already describes an exact solar depression.
     */
    default double adjustZenith(double zenith, double elevation) {
        if (zenith == Zenith.GEOMETRIC) {
            return zenith + (SOLAR_RADIUS + REFRACTION + getElevationAdjustment(elevation));
        }
        return zenith;
    }
}
