package at.sv.zmanim.geo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.ZoneId;

/**
 * An observer location: latitude, longitude, elevation above sea level and the time zone whose clock the
 * computed times are expressed in.
 * <p>
 * Instances are validated on construction and immutable afterwards.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class GeoLocation {

    private static final long MINUTE_MILLIS = 60 * 1000L;
    private static final long HOUR_MILLIS = 60 * MINUTE_MILLIS;

    private final String name;
    private final double latitude;
    private final double longitude;
    private final double elevation;
    private final ZoneId timeZone;

    public GeoLocation(double latitude, double longitude, ZoneId timeZone) {
        this(null, latitude, longitude, 0, timeZone);
    }

    public GeoLocation(double latitude, double longitude, double elevation, ZoneId timeZone) {
        this(null, latitude, longitude, elevation, timeZone);
    }

    public GeoLocation(String name, double latitude, double longitude, double elevation, ZoneId timeZone) {
        assertValidLatitude(latitude);
        assertValidLongitude(longitude);
        assertValidElevation(elevation);
        if (timeZone == null) {
            throw new IllegalArgumentException("Time zone is required");
        }
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.timeZone = timeZone;
    }

    private static void assertValidLatitude(double latitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidGeoLocationException("Invalid latitude '" + latitude + "': has to be in [-90..90]");
        }
    }

    private static void assertValidLongitude(double longitude) {
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidGeoLocationException("Invalid longitude '" + longitude + "': has to be in [-180..180]");
        }
    }

    private static void assertValidElevation(double elevation) {
        if (Double.isNaN(elevation) || Double.isInfinite(elevation) || elevation < 0) {
            throw new InvalidGeoLocationException("Invalid elevation '" + elevation + "': has to be a positive number of meters");
        }
    }

    public GeoLocation withElevation(double elevation) {
        return new GeoLocation(name, latitude, longitude, elevation, timeZone);
    }

    /**
     * The difference between the local mean time at this longitude and the clock time of the time zone at the
     * given instant, in milliseconds. Positive east of the zone's meridian.
     */
    public long getLocalMeanTimeOffset(Instant instant) {
        long longitudeOffset = (long) (longitude * 4 * MINUTE_MILLIS);
        long zoneOffset = timeZone.getRules().getOffset(instant).getTotalSeconds() * 1000L;
        return longitudeOffset - zoneOffset;
    }

    /**
     * Locations close to the antimeridian may use a time zone on the "other side" of the date line. For those the
     * zone's calendar day is a full day ahead of (or behind) the solar day.
     *
     * @return 1 if the working date has to be moved forward one day, -1 if backward, 0 otherwise
     */
    public int getAntimeridianAdjustment(Instant instant) {
        double localHoursOffset = getLocalMeanTimeOffset(instant) / (double) HOUR_MILLIS;
        if (localHoursOffset >= 20) {
            return 1;
        } else if (localHoursOffset <= -20) {
            return -1;
        }
        return 0;
    }
}
