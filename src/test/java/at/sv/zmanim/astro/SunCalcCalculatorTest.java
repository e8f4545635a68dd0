package at.sv.zmanim.astro;

import at.sv.zmanim.calendar.AstronomicalCalendar;
import at.sv.zmanim.geo.GeoLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.core.Is.is;

class SunCalcCalculatorTest {

    private LocalDate date;
    private AstronomicalCalendar calendar;

    private void assertTime(Optional<ZonedDateTime> time, int hour, int minute, int second, int toleranceSeconds) {
        assertThat("Time is missing", time.isPresent(), is(true));
        LocalTime expected = LocalTime.of(hour, minute, second);
        long difference = Math.abs(Duration.between(expected, time.get().toLocalTime()).getSeconds());
        assertThat("Time differs: " + time.get(), difference, lessThanOrEqualTo((long) toleranceSeconds));
        assertThat(time.get().toLocalDate(), is(date));
    }

    @BeforeEach
    void setUp() {
        date = LocalDate.of(2021, 1, 1);
        calendar = new AstronomicalCalendar(new GeoLocation(48.20, 16.39, 165, ZoneId.of("Europe/Vienna")),
                new SunCalcCalculator());
    }

    @Test
    void returnsCorrectTimes_vienna() {
        assertTime(calendar.getSunrise(date), 7, 42, 13, 60);
        assertTime(calendar.getSunTransit(date), 11, 58, 13, 60);
        assertTime(calendar.getSunset(date), 16, 14, 29, 60);
        assertTime(calendar.getBeginCivilTwilight(date), 7, 8, 51, 240);
        assertTime(calendar.getEndNauticalTwilight(date), 17, 27, 25, 240);
    }

    @Test
    void seaLevelSunrise_laterThanElevationAdjusted() {
        ZonedDateTime sunrise = calendar.getSunrise(date).orElseThrow();
        ZonedDateTime seaLevelSunrise = calendar.getSeaLevelSunrise(date).orElseThrow();

        assertThat(seaLevelSunrise.isAfter(sunrise), is(true));
    }

    @Test
    void agreesWithNoaa_withinMinutes() {
        AstronomicalCalendar noaa = new AstronomicalCalendar(calendar.getGeoLocation());

        assertThat(minutesBetween(calendar.getSunrise(date), noaa.getSunrise(date)), lessThanOrEqualTo(3L));
        assertThat(minutesBetween(calendar.getSunset(date), noaa.getSunset(date)), lessThanOrEqualTo(3L));
        assertThat(minutesBetween(calendar.getSunTransit(date), noaa.getSunTransit(date)), lessThanOrEqualTo(1L));
    }

    @Test
    void polarDay_noSunrise() {
        AstronomicalCalendar svalbard = new AstronomicalCalendar(
                new GeoLocation(78.22, 15.65, ZoneId.of("Arctic/Longyearbyen")), new SunCalcCalculator());
        LocalDate summer = LocalDate.of(2024, 6, 21);

        assertThat(svalbard.getSunrise(summer).isPresent(), is(false));
        assertThat(svalbard.getSunset(summer).isPresent(), is(false));
        assertThat(svalbard.getSunTransit(summer).isPresent(), is(true));
    }

    @Test
    void solarPosition_transit_south() {
        ZonedDateTime transit = calendar.getSunTransit(date).orElseThrow();

        assertThat(calendar.getSolarAzimuth(transit), closeTo(180, 1));
        assertThat(calendar.getSolarElevation(transit), closeTo(90 - 48.20 - 23.0, 0.5));
    }

    private static long minutesBetween(Optional<ZonedDateTime> first, Optional<ZonedDateTime> second) {
        return Math.abs(Duration.between(first.orElseThrow(), second.orElseThrow()).toMinutes());
    }

    @Test
    void eventsCloseToMidnightUtc_dhaka_presentOnEveryDay() {
        GeoLocation dhaka = new GeoLocation("Dhaka", 23.7, 90.4, 0, ZoneId.of("Asia/Dhaka"));
        calendar = new AstronomicalCalendar(dhaka, new SunCalcCalculator());
        AstronomicalCalendar noaa = new AstronomicalCalendar(dhaka);

        for (date = LocalDate.of(2024, 10, 20); date.isBefore(LocalDate.of(2024, 10, 30)); date = date.plusDays(1)) {
            ZonedDateTime expected = noaa.getSeaLevelSunrise(date).orElseThrow();
            assertTime(calendar.getSeaLevelSunrise(date), expected.getHour(), expected.getMinute(),
                    expected.getSecond(), 90);
        }
    }

    @Test
    void eventsCloseToMidnightUtc_dhaka_sunriseOfRequestedDate() {
        GeoLocation dhaka = new GeoLocation(23.7, 90.4, ZoneId.of("Asia/Dhaka"));
        calendar = new AstronomicalCalendar(dhaka, new SunCalcCalculator());
        date = LocalDate.of(2024, 10, 24);

        assertTime(calendar.getSeaLevelSunrise(date), 5, 59, 57, 90);
    }

    @Test
    void everyLongitude_sunTimesPresentAndCloseToNoaa() {
        for (double longitude = -180; longitude <= 180; longitude += 7.5) {
            ZoneOffset zone = ZoneOffset.ofHours((int) Math.round(longitude / 15));
            GeoLocation location = new GeoLocation(30, longitude, zone);
            calendar = new AstronomicalCalendar(location, new SunCalcCalculator());
            AstronomicalCalendar noaa = new AstronomicalCalendar(location);
            for (date = LocalDate.of(2024, 1, 1); date.getYear() == 2024; date = date.plusDays(9)) {
                assertCloseTo(calendar.getSeaLevelSunrise(date), noaa.getSeaLevelSunrise(date), location);
                assertCloseTo(calendar.getSeaLevelSunset(date), noaa.getSeaLevelSunset(date), location);
                assertCloseTo(calendar.getSunTransit(date), noaa.getSunTransit(date), location);
                assertCloseTo(calendar.getSolarMidnight(date), noaa.getSolarMidnight(date), location);
            }
        }
    }

    private void assertCloseTo(Optional<ZonedDateTime> time, Optional<ZonedDateTime> expected, GeoLocation location) {
        String description = location + " on " + date;
        assertThat("Missing for " + description, time.isPresent(), is(true));
        long difference = Duration.between(expected.orElseThrow(), time.get()).abs().getSeconds();
        assertThat("Differs for " + description + ": " + time.get(), difference, lessThanOrEqualTo(180L));
    }
}
