package at.sv.zmanim.zman;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Settings that change which instants the zmanim are anchored to.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ZmanimOptions {

    /**
     * Use the elevation of the location for sunrise and sunset based zmanim. Sea level is used otherwise.
     */
    @Builder.Default
    private final boolean useElevation = false;
    /**
     * Chatzos is the astronomical transit of the sun instead of the midpoint between sea level sunrise and sunset.
     */
    @Builder.Default
    private final boolean useAstronomicalChatzos = true;
    /**
     * Zmanim of symmetric days are measured from and to chatzos in half day hours.
     */
    @Builder.Default
    private final boolean useAstronomicalChatzosForOtherZmanim = false;
    @Builder.Default
    private final Duration candleLightingOffset = Duration.ofMinutes(18);
    @Builder.Default
    private final Duration ateretTorahSunsetOffset = Duration.ofMinutes(40);

    public static ZmanimOptions defaults() {
        return builder().build();
    }
}
