package at.sv.zmanim.geo;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeoLocationTest {

    private static final Instant WINTER = Instant.parse("2024-01-15T00:00:00Z");
    private static final Instant SUMMER = Instant.parse("2024-07-15T00:00:00Z");

    @Test
    void invalidLatitude_exception() {
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(90.1, 0, ZoneOffset.UTC));
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(-90.1, 0, ZoneOffset.UTC));
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(Double.NaN, 0, ZoneOffset.UTC));
    }

    @Test
    void invalidLongitude_exception() {
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(0, 180.5, ZoneOffset.UTC));
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(0, -181, ZoneOffset.UTC));
    }

    @Test
    void negativeElevation_exception() {
        assertThrows(InvalidGeoLocationException.class, () -> new GeoLocation(0, 0, -1, ZoneOffset.UTC));
    }

    @Test
    void missingTimeZone_exception() {
        assertThrows(IllegalArgumentException.class, () -> new GeoLocation(0, 0, null));
    }

    @Test
    void boundaryValues_areAccepted() {
        GeoLocation location = new GeoLocation(90, -180, ZoneOffset.UTC);

        assertThat(location.getLatitude(), is(90.0));
        assertThat(location.getLongitude(), is(-180.0));
        assertThat(location.getElevation(), is(0.0));
    }

    @Test
    void withElevation_keepsOtherValues() {
        GeoLocation location = new GeoLocation("Jerusalem", 31.778, 35.2354, 0, ZoneId.of("Asia/Jerusalem"));

        GeoLocation elevated = location.withElevation(754);

        assertThat(elevated.getElevation(), is(754.0));
        assertThat(elevated.getName(), is("Jerusalem"));
        assertThat(elevated.getLatitude(), is(31.778));
        assertThat(elevated.withElevation(0), is(location));
    }

    @Test
    void getLocalMeanTimeOffset_longitudeMatchesZoneMeridian_zero() {
        GeoLocation location = new GeoLocation(48.2, 15, ZoneId.of("Europe/Vienna"));

        assertThat(location.getLocalMeanTimeOffset(WINTER), is(0L));
        assertThat(location.getLocalMeanTimeOffset(SUMMER), is(-3_600_000L));
    }

    @Test
    void getLocalMeanTimeOffset_eastOfZoneMeridian_positive() {
        GeoLocation location = new GeoLocation(48.2, 30, ZoneId.of("Europe/Vienna"));

        assertThat(location.getLocalMeanTimeOffset(WINTER), is(3_600_000L));
    }

    @Test
    void getAntimeridianAdjustment_regularLocation_zero() {
        GeoLocation location = new GeoLocation(31.778, 35.2354, ZoneId.of("Asia/Jerusalem"));

        assertThat(location.getAntimeridianAdjustment(WINTER), is(0));
    }

    @Test
    void getAntimeridianAdjustment_eastLongitudeWithWesternZone_movesForward() {
        GeoLocation location = new GeoLocation(-16.5, 179, ZoneOffset.ofHours(-11));

        assertThat(location.getAntimeridianAdjustment(WINTER), is(1));
    }

    @Test
    void getAntimeridianAdjustment_westLongitudeWithEasternZone_movesBackward() {
        GeoLocation location = new GeoLocation(-13.83, -171.76, ZoneOffset.ofHours(13));

        assertThat(location.getAntimeridianAdjustment(WINTER), is(-1));
    }
}
