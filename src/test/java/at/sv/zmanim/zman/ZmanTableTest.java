package at.sv.zmanim.zman;

import at.sv.zmanim.astro.SolarEvent;
import at.sv.zmanim.astro.Zenith;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZmanTableTest {

    @Test
    void everyZman_hasDefinition() {
        for (Zman zman : Zman.values()) {
            assertThat(ZmanTable.definitionOf(zman)).as(zman.name()).isNotNull();
        }
        assertThat(ZmanTable.getDefinitions()).hasSize(Zman.values().length);
    }

    @Test
    void definitions_areImmutable() {
        assertThatThrownBy(() -> ZmanTable.getDefinitions().remove(Zman.TZAIS))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void basicZmanim_definitions() {
        assertThat(ZmanTable.definitionOf(Zman.ALOS_HASHACHAR))
                .isEqualTo(new ZmanDefinition.DegreesOffset(Zenith.ZENITH_16_POINT_1, SolarEvent.SUNRISE));
        assertThat(ZmanTable.definitionOf(Zman.TZAIS))
                .isEqualTo(new ZmanDefinition.DegreesOffset(Zenith.ZENITH_8_POINT_5, SolarEvent.SUNSET));
        assertThat(ZmanTable.definitionOf(Zman.ALOS_72))
                .isEqualTo(new ZmanDefinition.FixedOffset(Zman.ELEVATION_ADJUSTED_SUNRISE, Duration.ofMinutes(-72)));
        assertThat(ZmanTable.definitionOf(Zman.SOF_ZMAN_SHMA_GRA))
                .isEqualTo(new ZmanDefinition.Anchored(DayPart.SOF_ZMAN_SHMA, Zman.ELEVATION_ADJUSTED_SUNRISE,
                        Zman.ELEVATION_ADJUSTED_SUNSET, true));
        assertThat(ZmanTable.definitionOf(Zman.PLAG_HAMINCHA_ATERET_TORAH))
                .isEqualTo(new ZmanDefinition.Anchored(DayPart.PLAG_HAMINCHA, Zman.ALOS_72_ZMANIS,
                        Zman.TZAIS_ATERET_TORAH, false));
        assertThat(ZmanTable.definitionOf(Zman.FIXED_LOCAL_CHATZOS)).isEqualTo(new ZmanDefinition.LocalMeanTime(12));
    }
}
