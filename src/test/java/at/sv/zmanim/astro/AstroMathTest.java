package at.sv.zmanim.astro;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.core.Is.is;

class AstroMathTest {

    @Test
    void julianDay_epoch() {
        assertThat(AstroMath.julianDay(LocalDate.of(2000, 1, 1)), is(2451544.5));
    }

    @Test
    void julianDay_sputnikLaunch() {
        assertThat(AstroMath.julianDay(LocalDate.of(1957, 10, 4)), is(2436115.5));
    }

    @Test
    void julianDay_januaryAndFebruary_countAsPreviousYear() {
        assertThat(AstroMath.julianDay(LocalDate.of(2024, 3, 1)) - AstroMath.julianDay(LocalDate.of(2024, 2, 28)),
                is(2.0));
        assertThat(AstroMath.julianDay(LocalDate.of(2024, 1, 1)) - AstroMath.julianDay(LocalDate.of(2023, 12, 31)),
                is(1.0));
    }

    @Test
    void julianCenturies_epoch_zero() {
        assertThat(AstroMath.julianCenturies(AstroMath.JULIAN_DAY_JAN_1_2000), is(0.0));
        assertThat(AstroMath.julianCenturies(AstroMath.JULIAN_DAY_JAN_1_2000 + 36525), is(1.0));
    }

    @Test
    void modulo_negativeDividend_positiveResult() {
        assertThat(AstroMath.modulo(-30, 360), is(330.0));
        assertThat(AstroMath.modulo(725, 360), is(5.0));
    }

    @Test
    void clampedAcos_outOfRange_clamped() {
        assertThat(AstroMath.clampedAcosDegrees(1.0000001), is(0.0));
        assertThat(AstroMath.clampedAcosDegrees(-1.5), is(180.0));
        assertThat(AstroMath.clampedAsinDegrees(2), is(90.0));
    }

    @Test
    void minutesToUtcHours_normalizesIntoDay() {
        assertThat(AstroMath.minutesToUtcHours(0), is(0.0));
        assertThat(AstroMath.minutesToUtcHours(90), is(1.5));
        assertThat(AstroMath.minutesToUtcHours(1500), is(1.0));
        assertThat(AstroMath.minutesToUtcHours(-60), is(23.0));
        assertThat(AstroMath.minutesToUtcHours(-1500), closeTo(23.0, 1e-12));
        assertThat(Double.isNaN(AstroMath.minutesToUtcHours(Double.NaN)), is(true));
    }
}
