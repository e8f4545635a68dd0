package at.sv.zmanim.astro;

import at.sv.zmanim.geo.GeoLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingCalculatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 20);

    @Mock
    private AstronomicalCalculator delegate;

    private GeoLocation location;
    private CachingCalculator calculator;

    @BeforeEach
    void setUp() {
        location = new GeoLocation(31.778, 35.2354, ZoneId.of("Asia/Jerusalem"));
        calculator = new CachingCalculator(delegate, 100);
    }

    @Test
    void getUtcSunrise_sameQuery_delegatesOnce() {
        when(delegate.getUtcSunrise(any(), any(), anyDouble(), anyBoolean())).thenReturn(OptionalDouble.of(3.7));

        assertThat(calculator.getUtcSunrise(DATE, location, Zenith.GEOMETRIC, true)).hasValue(3.7);
        assertThat(calculator.getUtcSunrise(DATE, location, Zenith.GEOMETRIC, true)).hasValue(3.7);

        verify(delegate, times(1)).getUtcSunrise(DATE, location, Zenith.GEOMETRIC, true);
        assertThat(calculator.getCachedEntries()).isEqualTo(1);
    }

    @Test
    void getUtcSunrise_differentZenithOrElevationFlag_separateEntries() {
        when(delegate.getUtcSunrise(any(), any(), anyDouble(), anyBoolean())).thenReturn(OptionalDouble.of(3.7));

        calculator.getUtcSunrise(DATE, location, Zenith.GEOMETRIC, true);
        calculator.getUtcSunrise(DATE, location, Zenith.GEOMETRIC, false);
        calculator.getUtcSunrise(DATE, location, Zenith.CIVIL, false);
        calculator.getUtcSunrise(DATE, location.withElevation(100), Zenith.CIVIL, false);

        verify(delegate, times(4)).getUtcSunrise(any(), any(), anyDouble(), anyBoolean());
    }

    @Test
    void getUtcSunset_absentResult_isCachedToo() {
        when(delegate.getUtcSunset(any(), any(), anyDouble(), anyBoolean())).thenReturn(OptionalDouble.empty());

        assertThat(calculator.getUtcSunset(DATE, location, Zenith.GEOMETRIC, true)).isEmpty();
        assertThat(calculator.getUtcSunset(DATE, location, Zenith.GEOMETRIC, true)).isEmpty();

        verify(delegate, times(1)).getUtcSunset(DATE, location, Zenith.GEOMETRIC, true);
    }

    @Test
    void getUtcSunriseAndSunset_sameParameters_distinctEntries() {
        when(delegate.getUtcSunrise(any(), any(), anyDouble(), anyBoolean())).thenReturn(OptionalDouble.of(3.7));
        when(delegate.getUtcSunset(any(), any(), anyDouble(), anyBoolean())).thenReturn(OptionalDouble.of(15.8));

        assertThat(calculator.getUtcSunrise(DATE, location, Zenith.GEOMETRIC, true)).hasValue(3.7);
        assertThat(calculator.getUtcSunset(DATE, location, Zenith.GEOMETRIC, true)).hasValue(15.8);
    }

    @Test
    void getUtcNoon_nan_passedThrough() {
        when(delegate.getUtcNoon(DATE, location)).thenReturn(Double.NaN);

        assertThat(calculator.getUtcNoon(DATE, location)).isNaN();
        assertThat(calculator.getUtcNoon(DATE, location)).isNaN();

        verify(delegate, times(1)).getUtcNoon(DATE, location);
    }

    @Test
    void clearCache_queriesDelegateAgain() {
        when(delegate.getUtcMidnight(DATE, location)).thenReturn(21.8);

        calculator.getUtcMidnight(DATE, location);
        calculator.clearCache();
        calculator.getUtcMidnight(DATE, location);

        verify(delegate, times(2)).getUtcMidnight(DATE, location);
        assertThat(calculator.getCachedEntries()).isEqualTo(1);
    }

    @Test
    void solarPosition_notCached() {
        when(delegate.getSolarElevation(any(), any())).thenReturn(10.0);

        calculator.getSolarElevation(DATE.atStartOfDay(location.getTimeZone()).toInstant(), location);
        calculator.getSolarElevation(DATE.atStartOfDay(location.getTimeZone()).toInstant(), location);

        verify(delegate, times(2)).getSolarElevation(any(), any());
        assertThat(calculator.getCachedEntries()).isZero();
    }
}
