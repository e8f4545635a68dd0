package at.sv.zmanim.astro;

import at.sv.zmanim.geo.GeoLocation;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.OptionalDouble;

import static at.sv.zmanim.astro.AstroMath.MINUTES_PER_DAY;
import static at.sv.zmanim.astro.AstroMath.cosDegrees;
import static at.sv.zmanim.astro.AstroMath.julianCenturies;
import static at.sv.zmanim.astro.AstroMath.julianDay;
import static at.sv.zmanim.astro.AstroMath.minutesToUtcHours;
import static at.sv.zmanim.astro.AstroMath.sinDegrees;

/**
 * Closed form sun position based on the NOAA solar calculator, which follows Jean Meeus' "Astronomical
 * Algorithms". Longitudes are used west positive internally, as in the NOAA worksheets.
 */
@Slf4j
public final class NoaaCalculator implements AstronomicalCalculator {

    @Override
    public String getCalculatorName() {
        return "US National Oceanic and Atmospheric Administration Algorithm";
    }

    @Override
    public OptionalDouble getUtcSunrise(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        return getUtcRiseSet(date, location, zenith, adjustForElevation, SolarEvent.SUNRISE);
    }

    @Override
    public OptionalDouble getUtcSunset(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        return getUtcRiseSet(date, location, zenith, adjustForElevation, SolarEvent.SUNSET);
    }

    private OptionalDouble getUtcRiseSet(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation,
                                         SolarEvent event) {
        if (Math.abs(location.getLatitude()) == 90) {
            return OptionalDouble.empty();
        }
        double elevation = adjustForElevation ? location.getElevation() : 0;
        double adjustedZenith = adjustZenith(zenith, elevation);
        double minutes = getSunRiseSetUtc(julianDay(date), location.getLatitude(), -location.getLongitude(),
                adjustedZenith, event);
        double hours = minutesToUtcHours(minutes);
        if (Double.isNaN(hours)) {
            log.trace("No {} for zenith {} on {} at {}", event, adjustedZenith, date, location);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(hours);
    }

    @Override
    public double getUtcNoon(LocalDate date, GeoLocation location) {
        return minutesToUtcHours(getSolarNoonMidnightUtc(julianDay(date), -location.getLongitude(), SolarEvent.NOON));
    }

    @Override
    public double getUtcMidnight(LocalDate date, GeoLocation location) {
        return minutesToUtcHours(getSolarNoonMidnightUtc(julianDay(date), -location.getLongitude(), SolarEvent.MIDNIGHT));
    }

    @Override
    public double getSolarElevation(Instant instant, GeoLocation location) {
        return 90 - getSolarZenith(instant, location).zenith;
    }

    @Override
    public double getSolarAzimuth(Instant instant, GeoLocation location) {
        SolarZenith solarZenith = getSolarZenith(instant, location);
        double latitude = location.getLatitude();
        double denominator = cosDegrees(latitude) * sinDegrees(solarZenith.zenith);
        double azimuth;
        if (Math.abs(denominator) > 0.001) {
            double cosAzimuth = (sinDegrees(latitude) * cosDegrees(solarZenith.zenith) - sinDegrees(solarZenith.declination))
                                / denominator;
            azimuth = 180 - AstroMath.clampedAcosDegrees(cosAzimuth) * (solarZenith.hourAngle > 0 ? -1 : 1);
        } else {
            azimuth = latitude > 0 ? 180 : 0;
        }
        return azimuth % 360;
    }

    private SolarZenith getSolarZenith(Instant instant, GeoLocation location) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        double time = (utc.getHour() + (utc.getMinute() + (utc.getSecond() + utc.getNano() / 1e9) / 60.0) / 60.0) / 24.0;
        double julianCenturies = julianCenturies(julianDay(utc.toLocalDate()) + time);
        double equationOfTime = getEquationOfTime(julianCenturies);
        double declination = getSunDeclination(julianCenturies);

        double adjustment = time + equationOfTime / MINUTES_PER_DAY;
        double trueSolarTime = ((adjustment + location.getLongitude() / 360) + 2) % 1;
        double hourAngle = trueSolarTime * Math.PI * 2 - Math.PI;

        double latitude = location.getLatitude();
        double cosZenith = sinDegrees(latitude) * sinDegrees(declination)
                           + cosDegrees(latitude) * cosDegrees(declination) * Math.cos(hourAngle);
        return new SolarZenith(AstroMath.clampedAcosDegrees(cosZenith), declination, hourAngle);
    }

    private record SolarZenith(double zenith, double declination, double hourAngle) {
    }

    /**
     * @param longitude west positive
     * @return the UTC time of the event in minutes, NaN if the sun never reaches the zenith
     */
    private double getSunRiseSetUtc(double julianDay, double latitude, double longitude, double zenith, SolarEvent event) {
        double noonMinutes = getSolarNoonMidnightUtc(julianDay, longitude, SolarEvent.NOON);
        double timeUtc = getRiseSetMinutes(julianCenturies(julianDay + noonMinutes / MINUTES_PER_DAY), latitude, longitude,
                zenith, event);
        // refine using the first approximation of the event time
        return getRiseSetMinutes(julianCenturies(julianDay + timeUtc / MINUTES_PER_DAY), latitude, longitude, zenith, event);
    }

    private double getRiseSetMinutes(double julianCenturies, double latitude, double longitude, double zenith, SolarEvent event) {
        double equationOfTime = getEquationOfTime(julianCenturies);
        double declination = getSunDeclination(julianCenturies);
        double hourAngle = getSunHourAngle(latitude, declination, zenith, event);
        double delta = longitude - Math.toDegrees(hourAngle);
        return 720 + 4 * delta - equationOfTime;
    }

    /**
     * @return the hour angle in radians, negative for sunset, NaN if there is no crossing
     */
    private static double getSunHourAngle(double latitude, double declination, double zenith, SolarEvent event) {
        double latRad = Math.toRadians(latitude);
        double declinationRad = Math.toRadians(declination);
        double hourAngle = Math.acos(Math.cos(Math.toRadians(zenith)) / (Math.cos(latRad) * Math.cos(declinationRad))
                                     - Math.tan(latRad) * Math.tan(declinationRad));
        if (event == SolarEvent.SUNSET) {
            return -hourAngle;
        }
        return hourAngle;
    }

    /**
     * @param longitude west positive
     * @return the UTC time of solar noon or the following solar midnight in minutes, relative to 0h UT of the day
     */
    private double getSolarNoonMidnightUtc(double julianDay, double longitude, SolarEvent event) {
        double day = event == SolarEvent.NOON ? julianDay : julianDay + 0.5;
        double equationOfTime = getEquationOfTime(julianCenturies(day + longitude / 360));
        double solarNoonUtc = longitude * 4 - equationOfTime;
        equationOfTime = getEquationOfTime(julianCenturies(day + solarNoonUtc / MINUTES_PER_DAY));
        double baseMinutes = event == SolarEvent.NOON ? 720 : MINUTES_PER_DAY;
        return baseMinutes + longitude * 4 - equationOfTime;
    }

    static double getSunGeometricMeanLongitude(double julianCenturies) {
        double longitude = 280.46646 + julianCenturies * (36000.76983 + 0.0003032 * julianCenturies);
        return AstroMath.modulo(longitude, 360);
    }

    static double getSunGeometricMeanAnomaly(double julianCenturies) {
        return 357.52911 + julianCenturies * (35999.05029 - 0.0001537 * julianCenturies);
    }

    static double getEarthOrbitEccentricity(double julianCenturies) {
        return 0.016708634 - julianCenturies * (0.000042037 + 0.0000001267 * julianCenturies);
    }

    static double getSunEquationOfCenter(double julianCenturies) {
        double anomaly = Math.toRadians(getSunGeometricMeanAnomaly(julianCenturies));
        return Math.sin(anomaly) * (1.914602 - julianCenturies * (0.004817 + 0.000014 * julianCenturies))
               + Math.sin(anomaly * 2) * (0.019993 - 0.000101 * julianCenturies)
               + Math.sin(anomaly * 3) * 0.000289;
    }

    static double getSunTrueLongitude(double julianCenturies) {
        return getSunGeometricMeanLongitude(julianCenturies) + getSunEquationOfCenter(julianCenturies);
    }

    static double getSunApparentLongitude(double julianCenturies) {
        double omega = 125.04 - 1934.136 * julianCenturies;
        return getSunTrueLongitude(julianCenturies) - 0.00569 - 0.00478 * sinDegrees(omega);
    }

    static double getMeanObliquityOfEcliptic(double julianCenturies) {
        double seconds = 21.448 - julianCenturies * (46.8150 + julianCenturies * (0.00059 - julianCenturies * 0.001813));
        return 23 + (26 + seconds / 60) / 60;
    }

    static double getObliquityCorrection(double julianCenturies) {
        double omega = 125.04 - 1934.136 * julianCenturies;
        return getMeanObliquityOfEcliptic(julianCenturies) + 0.00256 * cosDegrees(omega);
    }

    /**
     * @return the declination of the sun in degrees
     */
    static double getSunDeclination(double julianCenturies) {
        double sinDeclination = sinDegrees(getObliquityCorrection(julianCenturies))
                                * sinDegrees(getSunApparentLongitude(julianCenturies));
        return Math.toDegrees(Math.asin(sinDeclination));
    }

    /**
     * @return the difference between true and mean solar time in minutes
     */
    static double getEquationOfTime(double julianCenturies) {
        double epsilon = getObliquityCorrection(julianCenturies);
        double meanLongitude = Math.toRadians(getSunGeometricMeanLongitude(julianCenturies));
        double eccentricity = getEarthOrbitEccentricity(julianCenturies);
        double meanAnomaly = Math.toRadians(getSunGeometricMeanAnomaly(julianCenturies));

        double y = Math.tan(Math.toRadians(epsilon) / 2);
        y *= y;

        double sin2l0 = Math.sin(2 * meanLongitude);
        double sinM = Math.sin(meanAnomaly);
        double cos2l0 = Math.cos(2 * meanLongitude);
        double sin4l0 = Math.sin(4 * meanLongitude);
        double sin2M = Math.sin(2 * meanAnomaly);

        double equationOfTime = y * sin2l0 - 2 * eccentricity * sinM + 4 * eccentricity * y * sinM * cos2l0
                                - 0.5 * y * y * sin4l0 - 1.25 * eccentricity * eccentricity * sin2M;
        return Math.toDegrees(equationOfTime) * 4;
    }

    @Override
    public String toString() {
        return "NoaaCalculator";
    }
}
