package at.sv.zmanim.astro;

/**
 * The solar event a raw UTC time belongs to. Decides whether the rise or set branch of the hour angle is used
 * and in which direction the day boundary correction moves the date.
 */
public enum SolarEvent {
    SUNRISE,
    SUNSET,
    NOON,
    MIDNIGHT
}
