package at.sv.zmanim.geo;

/**
 * Signals an observer location outside the valid coordinate ranges.
 */
public final class InvalidGeoLocationException extends RuntimeException {
    public InvalidGeoLocationException(String message) {
        super(message);
    }
}
