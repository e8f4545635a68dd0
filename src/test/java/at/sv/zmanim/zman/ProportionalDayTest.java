package at.sv.zmanim.zman;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class ProportionalDayTest {

    private ZonedDateTime start;
    private ZonedDateTime end;

    private Optional<ZonedDateTime> time(int hour, int minute) {
        return Optional.of(start.withHour(hour).withMinute(minute));
    }

    @BeforeEach
    void setUp() {
        start = ZonedDateTime.of(2024, 3, 20, 6, 0, 0, 0, ZoneId.of("Asia/Jerusalem"));
        end = start.withHour(18);
    }

    @Test
    void temporalHour_twelfthOfTheDay() {
        assertThat(ProportionalDay.temporalHour(Optional.of(start), Optional.of(end)),
                is(Optional.of(Duration.ofHours(1))));
    }

    @Test
    void temporalHour_missingStartOrEnd_empty() {
        assertThat(ProportionalDay.temporalHour(Optional.empty(), Optional.of(end)), is(Optional.empty()));
        assertThat(ProportionalDay.temporalHour(Optional.of(start), Optional.empty()), is(Optional.empty()));
    }

    @Test
    void shaahZmanisBasedZman_fractionalHours() {
        assertThat(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(end), 3), is(time(9, 0)));
        assertThat(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(end), 10.75), is(time(16, 45)));
        assertThat(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(end), -1.2), is(time(4, 48)));
    }

    @Test
    void shaahZmanisBasedZman_twelveHours_exactlyEndOfDay_evenForIndivisibleDays() {
        ZonedDateTime oddEnd = end.plusNanos(7);

        assertThat(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(oddEnd), 12),
                is(Optional.of(oddEnd)));
        assertThat(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(oddEnd), 0),
                is(Optional.of(start)));
    }

    @Test
    void proportionalZman_negativeHours_empty() {
        assertThat(ProportionalDay.proportionalZman(Optional.of(start), Optional.of(end), -0.5), is(Optional.empty()));
        assertThat(ProportionalDay.proportionalZman(Optional.of(start), Optional.of(end), 6.5), is(time(12, 30)));
    }

    @Test
    void halfDayBasedShaahZmanis_sixthOfTheHalfDay() {
        assertThat(ProportionalDay.halfDayBasedShaahZmanis(Optional.of(start), time(12, 0)),
                is(Optional.of(Duration.ofHours(1))));
    }

    @Test
    void halfDayBasedZman_positiveHours_fromStart() {
        assertThat(ProportionalDay.halfDayBasedZman(Optional.of(start), time(12, 0), 3), is(time(9, 0)));
        assertThat(ProportionalDay.halfDayBasedZman(Optional.of(start), time(12, 0), 6), is(time(12, 0)));
        assertThat(ProportionalDay.halfDayBasedZman(time(12, 0), Optional.of(end), 4.75), is(time(16, 45)));
    }

    @Test
    void halfDayBasedZman_negativeHours_fromEnd() {
        assertThat(ProportionalDay.halfDayBasedZman(Optional.of(start), time(12, 0), -1), is(time(11, 0)));
        assertThat(ProportionalDay.halfDayBasedZman(Optional.of(start), time(12, 0), -6), is(Optional.of(start)));
    }

    @Test
    void halfDayBasedZman_symmetric() {
        Optional<ZonedDateTime> noon = time(12, 0);

        assertThat(ProportionalDay.halfDayBasedZman(Optional.of(start), noon, 2),
                is(ProportionalDay.halfDayBasedZman(Optional.of(start), noon, -4)));
    }

    @Test
    void halfDayBasedZman_missingInput_empty() {
        assertThat(ProportionalDay.halfDayBasedZman(Optional.empty(), time(12, 0), 3), is(Optional.empty()));
    }

    @Test
    void midpoint_sixTemporalHours() {
        assertThat(ProportionalDay.midpoint(Optional.of(start), Optional.of(end)), is(time(12, 0)));
        assertThat(ProportionalDay.midpoint(Optional.of(start), Optional.of(end)),
                is(ProportionalDay.shaahZmanisBasedZman(Optional.of(start), Optional.of(end), 6)));
    }

    @Test
    void multiply_roundsHalfUp() {
        assertThat(ProportionalDay.multiply(Duration.ofNanos(1), 0.5), is(Duration.ofNanos(1)));
        assertThat(ProportionalDay.multiply(Duration.ofNanos(3), -0.5), is(Duration.ofNanos(-2)));
        assertThat(ProportionalDay.multiply(Duration.ofHours(1), 1.5), is(Duration.ofMinutes(90)));
    }
}
