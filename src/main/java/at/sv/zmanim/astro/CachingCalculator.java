package at.sv.zmanim.astro;

import at.sv.zmanim.geo.GeoLocation;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Memoizes the rise, set, noon and midnight results of another calculator. Solar position queries at an instant
 * are passed through, as they are hardly ever repeated.
 */
@Slf4j
public final class CachingCalculator implements AstronomicalCalculator {

    private final AstronomicalCalculator delegate;
    private final Cache<Key, OptionalDouble> cache;

    public CachingCalculator(AstronomicalCalculator delegate, long maximumSize) {
        this.delegate = delegate;
        cache = Caffeine.newBuilder()
                        .maximumSize(maximumSize)
                        .build();
        log.debug("Caching results of {} (maximum size {})", delegate.getCalculatorName(), maximumSize);
    }

    @Override
    public String getCalculatorName() {
        return delegate.getCalculatorName();
    }

    @Override
    public OptionalDouble getUtcSunrise(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        Key key = new Key(Query.SUNRISE, date, location, zenith, adjustForElevation);
        return cache.get(key, k -> delegate.getUtcSunrise(date, location, zenith, adjustForElevation));
    }

    @Override
    public OptionalDouble getUtcSunset(LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
        Key key = new Key(Query.SUNSET, date, location, zenith, adjustForElevation);
        return cache.get(key, k -> delegate.getUtcSunset(date, location, zenith, adjustForElevation));
    }

    @Override
    public double getUtcNoon(LocalDate date, GeoLocation location) {
        Key key = new Key(Query.NOON, date, location, Zenith.GEOMETRIC, false);
        return cache.get(key, k -> OptionalDouble.of(delegate.getUtcNoon(date, location))).getAsDouble();
    }

    @Override
    public double getUtcMidnight(LocalDate date, GeoLocation location) {
        Key key = new Key(Query.MIDNIGHT, date, location, Zenith.GEOMETRIC, false);
        return cache.get(key, k -> OptionalDouble.of(delegate.getUtcMidnight(date, location))).getAsDouble();
    }

    @Override
    public double getSolarElevation(Instant instant, GeoLocation location) {
        return delegate.getSolarElevation(instant, location);
    }

    @Override
    public double getSolarAzimuth(Instant instant, GeoLocation location) {
        return delegate.getSolarAzimuth(instant, location);
    }

    @Override
    public double getElevationAdjustment(double elevation) {
        return delegate.getElevationAdjustment(elevation);
    }

    @Override
    public double adjustZenith(double zenith, double elevation) {
        return delegate.adjustZenith(zenith, elevation);
    }

    public long getCachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    private enum Query {
        SUNRISE, SUNSET, NOON, MIDNIGHT
    }

    private record Key(Query query, LocalDate date, double latitude, double longitude, double elevation, double zenith,
                       boolean adjustForElevation) {

        Key(Query query, LocalDate date, GeoLocation location, double zenith, boolean adjustForElevation) {
            this(query, date, location.getLatitude(), location.getLongitude(), location.getElevation(), zenith,
                    adjustForElevation);
        }
    }

    @Override
    public String toString() {
        return "CachingCalculator{" + delegate + "}";
    }
}
