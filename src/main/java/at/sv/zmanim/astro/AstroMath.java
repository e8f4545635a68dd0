package at.sv.zmanim.astro;

import java.time.LocalDate;

/**
 * Angle and time primitives shared by the calculators.
 */
public final class AstroMath {

    public static final double JULIAN_DAY_JAN_1_2000 = 2451545.0;
    public static final double JULIAN_DAYS_PER_CENTURY = 36525.0;
    public static final double MINUTES_PER_DAY = 1440.0;

    private AstroMath() {
    }

    /**
     * Julian day at 0h UT of the given civil date (Meeus, chapter 7, Gregorian calendar).
     */
    public static double julianDay(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        int a = year / 100;
        int b = 2 - a + a / 4;
        return Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;
    }

    public static double julianCenturies(double julianDay) {
        return (julianDay - JULIAN_DAY_JAN_1_2000) / JULIAN_DAYS_PER_CENTURY;
    }

    /**
     * Floor modulo for doubles, the result has the sign of the divisor.
     */
    public static double modulo(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Inverse cosine in degrees with the argument clamped to [-1, 1], for formulas where rounding may push the
     * argument slightly out of range.
     */
    public static double clampedAcosDegrees(double value) {
        return Math.toDegrees(Math.acos(clamp(value, -1, 1)));
    }

    public static double clampedAsinDegrees(double value) {
        return Math.toDegrees(Math.asin(clamp(value, -1, 1)));
    }

    public static double sinDegrees(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cosDegrees(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    /**
     * Normalizes a time in minutes into UTC hours in [0, 24).
     */
    public static double minutesToUtcHours(double minutes) {
        double hours = minutes / 60;
        if (hours >= 0) {
            return hours % 24;
        }
        return hours % 24 + 24;
    }
}
