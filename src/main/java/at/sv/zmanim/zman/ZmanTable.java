package at.sv.zmanim.zman;

import at.sv.zmanim.astro.SolarEvent;
import at.sv.zmanim.astro.Zenith;
import at.sv.zmanim.zman.ZmanDefinition.Anchored;
import at.sv.zmanim.zman.ZmanDefinition.ConfiguredOffset;
import at.sv.zmanim.zman.ZmanDefinition.DegreesOffset;
import at.sv.zmanim.zman.ZmanDefinition.Event;
import at.sv.zmanim.zman.ZmanDefinition.FixedOffset;
import at.sv.zmanim.zman.ZmanDefinition.HalfDay;
import at.sv.zmanim.zman.ZmanDefinition.Latest;
import at.sv.zmanim.zman.ZmanDefinition.LocalMeanTime;
import at.sv.zmanim.zman.ZmanDefinition.ScaledInterval;
import at.sv.zmanim.zman.ZmanDefinition.SunEvent;
import at.sv.zmanim.zman.ZmanDefinition.ZmanisOffset;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static at.sv.zmanim.zman.DayPart.MINCHA_GEDOLA;
import static at.sv.zmanim.zman.DayPart.MINCHA_KETANA;
import static at.sv.zmanim.zman.DayPart.PLAG_HAMINCHA;
import static at.sv.zmanim.zman.DayPart.SAMUCH_LE_MINCHA_KETANA;
import static at.sv.zmanim.zman.DayPart.SOF_ZMAN_SHMA;
import static at.sv.zmanim.zman.DayPart.SOF_ZMAN_TFILA;

/**
 * The definition of every {@link Zman}.
 */
public final class ZmanTable {

    private static final Map<Zman, ZmanDefinition> DEFINITIONS;

    static {
        Map<Zman, ZmanDefinition> map = new EnumMap<>(Zman.class);

        map.put(Zman.SUNRISE, new SunEvent(Event.SUNRISE));
        map.put(Zman.SEA_LEVEL_SUNRISE, new SunEvent(Event.SEA_LEVEL_SUNRISE));
        map.put(Zman.ELEVATION_ADJUSTED_SUNRISE, new SunEvent(Event.ELEVATION_ADJUSTED_SUNRISE));
        map.put(Zman.SUNSET, new SunEvent(Event.SUNSET));
        map.put(Zman.SEA_LEVEL_SUNSET, new SunEvent(Event.SEA_LEVEL_SUNSET));
        map.put(Zman.ELEVATION_ADJUSTED_SUNSET, new SunEvent(Event.ELEVATION_ADJUSTED_SUNSET));
        map.put(Zman.SUN_TRANSIT, new SunEvent(Event.SUN_TRANSIT));
        map.put(Zman.SOLAR_MIDNIGHT, new SunEvent(Event.SOLAR_MIDNIGHT));
        map.put(Zman.BEGIN_CIVIL_TWILIGHT, rise(Zenith.CIVIL));
        map.put(Zman.BEGIN_NAUTICAL_TWILIGHT, rise(Zenith.NAUTICAL));
        map.put(Zman.BEGIN_ASTRONOMICAL_TWILIGHT, rise(Zenith.ASTRONOMICAL));
        map.put(Zman.END_CIVIL_TWILIGHT, set(Zenith.CIVIL));
        map.put(Zman.END_NAUTICAL_TWILIGHT, set(Zenith.NAUTICAL));
        map.put(Zman.END_ASTRONOMICAL_TWILIGHT, set(Zenith.ASTRONOMICAL));

        map.put(Zman.ALOS_HASHACHAR, rise(Zenith.ZENITH_16_POINT_1));
        map.put(Zman.ALOS_72, minutes(Zman.ELEVATION_ADJUSTED_SUNRISE, -72));
        map.put(Zman.CHATZOS, new SunEvent(Event.CHATZOS));
        map.put(Zman.CHATZOS_AS_HALF_DAY, new SunEvent(Event.CHATZOS_AS_HALF_DAY));
        map.put(Zman.SOF_ZMAN_SHMA_GRA, gra(SOF_ZMAN_SHMA));
        map.put(Zman.SOF_ZMAN_SHMA_MGA, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MGA));
        map.put(Zman.SOF_ZMAN_TFILA_GRA, gra(SOF_ZMAN_TFILA));
        map.put(Zman.SOF_ZMAN_TFILA_MGA, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MGA));
        map.put(Zman.MINCHA_GEDOLA, gra(MINCHA_GEDOLA));
        map.put(Zman.SAMUCH_LE_MINCHA_KETANA, gra(SAMUCH_LE_MINCHA_KETANA));
        map.put(Zman.MINCHA_KETANA, gra(MINCHA_KETANA));
        map.put(Zman.PLAG_HAMINCHA, gra(PLAG_HAMINCHA));
        map.put(Zman.CANDLE_LIGHTING, new ConfiguredOffset(Zman.SEA_LEVEL_SUNSET, ZmanimOptions::getCandleLightingOffset, true));
        map.put(Zman.TZAIS, set(Zenith.ZENITH_8_POINT_5));
        map.put(Zman.TZAIS_72, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 72));

        map.put(Zman.ALOS_60, minutes(Zman.ELEVATION_ADJUSTED_SUNRISE, -60));
        map.put(Zman.ALOS_72_ZMANIS, new ZmanisOffset(-1.2));
        map.put(Zman.ALOS_90, minutes(Zman.ELEVATION_ADJUSTED_SUNRISE, -90));
        map.put(Zman.ALOS_90_ZMANIS, new ZmanisOffset(-1.5));
        map.put(Zman.ALOS_96, minutes(Zman.ELEVATION_ADJUSTED_SUNRISE, -96));
        map.put(Zman.ALOS_96_ZMANIS, new ZmanisOffset(-1.6));
        map.put(Zman.ALOS_120, minutes(Zman.ELEVATION_ADJUSTED_SUNRISE, -120));
        map.put(Zman.ALOS_120_ZMANIS, new ZmanisOffset(-2.0));
        map.put(Zman.ALOS_16_POINT_1_DEGREES, rise(Zenith.ZENITH_16_POINT_1));
        map.put(Zman.ALOS_18_DEGREES, rise(Zenith.ZENITH_18_DEGREES));
        map.put(Zman.ALOS_19_DEGREES, rise(Zenith.ZENITH_19_DEGREES));
        map.put(Zman.ALOS_19_POINT_8_DEGREES, rise(Zenith.ZENITH_19_POINT_8));
        map.put(Zman.ALOS_26_DEGREES, rise(Zenith.ZENITH_26_DEGREES));
        map.put(Zman.ALOS_BAAL_HATANYA, rise(Zenith.ZENITH_16_POINT_9));

        map.put(Zman.MISHEYAKIR_7_POINT_65_DEGREES, rise(Zenith.ZENITH_7_POINT_65));
        map.put(Zman.MISHEYAKIR_9_POINT_5_DEGREES, rise(Zenith.ZENITH_9_POINT_5));
        map.put(Zman.MISHEYAKIR_10_POINT_2_DEGREES, rise(Zenith.ZENITH_10_POINT_2));
        map.put(Zman.MISHEYAKIR_11_DEGREES, rise(Zenith.ZENITH_11_DEGREES));
        map.put(Zman.MISHEYAKIR_11_POINT_5_DEGREES, rise(Zenith.ZENITH_11_POINT_5));

        // the Baal Hatanya's day ends when the sun's upper limb is 1.583 degrees below the horizon
        map.put(Zman.SUNRISE_BAAL_HATANYA, rise(Zenith.ZENITH_1_POINT_583));
        map.put(Zman.SUNSET_BAAL_HATANYA, set(Zenith.ZENITH_1_POINT_583));
        map.put(Zman.FIXED_LOCAL_CHATZOS, new LocalMeanTime(12));

        map.put(Zman.SOF_ZMAN_SHMA_MGA_16_POINT_1_DEGREES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_18_DEGREES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.DEGREES_18));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_19_POINT_8_DEGREES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.DEGREES_19_POINT_8));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_72_MINUTES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_72));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_72_MINUTES_ZMANIS, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_72_ZMANIS));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_90_MINUTES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_90));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_90_MINUTES_ZMANIS, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_90_ZMANIS));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_96_MINUTES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_96));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_96_MINUTES_ZMANIS, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_96_ZMANIS));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_120_MINUTES, anchored(SOF_ZMAN_SHMA, ShaahZmanis.MINUTES_120));
        map.put(Zman.SOF_ZMAN_SHMA_3_HOURS_BEFORE_CHATZOS, minutes(Zman.CHATZOS, -180));
        map.put(Zman.SOF_ZMAN_SHMA_ALOS_16_POINT_1_TO_SUNSET,
                new Anchored(SOF_ZMAN_SHMA, Zman.ALOS_16_POINT_1_DEGREES, Zman.ELEVATION_ADJUSTED_SUNSET, false));
        map.put(Zman.SOF_ZMAN_SHMA_ALOS_16_POINT_1_TO_TZAIS_GEONIM_7_POINT_083_DEGREES,
                new Anchored(SOF_ZMAN_SHMA, Zman.ALOS_16_POINT_1_DEGREES, Zman.TZAIS_GEONIM_7_POINT_083_DEGREES, false));
        map.put(Zman.SOF_ZMAN_SHMA_ATERET_TORAH, anchored(SOF_ZMAN_SHMA, ShaahZmanis.ATERET_TORAH));
        map.put(Zman.SOF_ZMAN_SHMA_BAAL_HATANYA, anchored(SOF_ZMAN_SHMA, ShaahZmanis.BAAL_HATANYA));
        map.put(Zman.SOF_ZMAN_SHMA_GRA_SUNRISE_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ELEVATION_ADJUSTED_SUNRISE, Zman.FIXED_LOCAL_CHATZOS, 3));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_16_POINT_1_DEGREES_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ALOS_16_POINT_1_DEGREES, Zman.FIXED_LOCAL_CHATZOS, 3));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_18_DEGREES_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ALOS_18_DEGREES, Zman.FIXED_LOCAL_CHATZOS, 3));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_72_MINUTES_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ALOS_72, Zman.FIXED_LOCAL_CHATZOS, 3));
        map.put(Zman.SOF_ZMAN_SHMA_MGA_90_MINUTES_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ALOS_90, Zman.FIXED_LOCAL_CHATZOS, 3));

        map.put(Zman.SOF_ZMAN_TFILA_MGA_16_POINT_1_DEGREES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_18_DEGREES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.DEGREES_18));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_19_POINT_8_DEGREES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.DEGREES_19_POINT_8));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_72_MINUTES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_72));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_72_MINUTES_ZMANIS, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_72_ZMANIS));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_90_MINUTES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_90));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_90_MINUTES_ZMANIS, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_90_ZMANIS));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_96_MINUTES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_96));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_96_MINUTES_ZMANIS, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_96_ZMANIS));
        map.put(Zman.SOF_ZMAN_TFILA_MGA_120_MINUTES, anchored(SOF_ZMAN_TFILA, ShaahZmanis.MINUTES_120));
        map.put(Zman.SOF_ZMAN_TFILA_2_HOURS_BEFORE_CHATZOS, minutes(Zman.CHATZOS, -120));
        map.put(Zman.SOF_ZMAN_TFILA_ATERET_TORAH, anchored(SOF_ZMAN_TFILA, ShaahZmanis.ATERET_TORAH));
        map.put(Zman.SOF_ZMAN_TFILA_BAAL_HATANYA, anchored(SOF_ZMAN_TFILA, ShaahZmanis.BAAL_HATANYA));
        map.put(Zman.SOF_ZMAN_TFILA_GRA_SUNRISE_TO_FIXED_LOCAL_CHATZOS,
                new HalfDay(Zman.ELEVATION_ADJUSTED_SUNRISE, Zman.FIXED_LOCAL_CHATZOS, 4));

        map.put(Zman.MINCHA_GEDOLA_30_MINUTES, minutes(Zman.CHATZOS, 30));
        map.put(Zman.MINCHA_GEDOLA_72_MINUTES, anchored(MINCHA_GEDOLA, ShaahZmanis.MINUTES_72));
        map.put(Zman.MINCHA_GEDOLA_16_POINT_1_DEGREES, anchored(MINCHA_GEDOLA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.MINCHA_GEDOLA_ATERET_TORAH, anchored(MINCHA_GEDOLA, ShaahZmanis.ATERET_TORAH));
        map.put(Zman.MINCHA_GEDOLA_BAAL_HATANYA, anchored(MINCHA_GEDOLA, ShaahZmanis.BAAL_HATANYA));
        map.put(Zman.MINCHA_GEDOLA_GREATER_THAN_30, new Latest(Zman.MINCHA_GEDOLA_30_MINUTES, Zman.MINCHA_GEDOLA));
        map.put(Zman.MINCHA_GEDOLA_BAAL_HATANYA_GREATER_THAN_30,
                new Latest(Zman.MINCHA_GEDOLA_30_MINUTES, Zman.MINCHA_GEDOLA_BAAL_HATANYA));
        map.put(Zman.MINCHA_GEDOLA_GRA_FIXED_LOCAL_CHATZOS_30_MINUTES, minutes(Zman.FIXED_LOCAL_CHATZOS, 30));
        map.put(Zman.SAMUCH_LE_MINCHA_KETANA_16_POINT_1_DEGREES,
                anchored(SAMUCH_LE_MINCHA_KETANA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.SAMUCH_LE_MINCHA_KETANA_72_MINUTES, anchored(SAMUCH_LE_MINCHA_KETANA, ShaahZmanis.MINUTES_72));
        map.put(Zman.MINCHA_KETANA_16_POINT_1_DEGREES, anchored(MINCHA_KETANA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.MINCHA_KETANA_72_MINUTES, anchored(MINCHA_KETANA, ShaahZmanis.MINUTES_72));
        map.put(Zman.MINCHA_KETANA_ATERET_TORAH, anchored(MINCHA_KETANA, ShaahZmanis.ATERET_TORAH));
        map.put(Zman.MINCHA_KETANA_BAAL_HATANYA, anchored(MINCHA_KETANA, ShaahZmanis.BAAL_HATANYA));
        map.put(Zman.MINCHA_KETANA_GRA_FIXED_LOCAL_CHATZOS_TO_SUNSET,
                new HalfDay(Zman.FIXED_LOCAL_CHATZOS, Zman.ELEVATION_ADJUSTED_SUNSET, 3.5));

        map.put(Zman.PLAG_HAMINCHA_60_MINUTES, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_60));
        map.put(Zman.PLAG_HAMINCHA_72_MINUTES, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_72));
        map.put(Zman.PLAG_HAMINCHA_72_MINUTES_ZMANIS, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_72_ZMANIS));
        map.put(Zman.PLAG_HAMINCHA_90_MINUTES, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_90));
        map.put(Zman.PLAG_HAMINCHA_90_MINUTES_ZMANIS, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_90_ZMANIS));
        map.put(Zman.PLAG_HAMINCHA_96_MINUTES, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_96));
        map.put(Zman.PLAG_HAMINCHA_96_MINUTES_ZMANIS, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_96_ZMANIS));
        map.put(Zman.PLAG_HAMINCHA_120_MINUTES, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_120));
        map.put(Zman.PLAG_HAMINCHA_120_MINUTES_ZMANIS, anchored(PLAG_HAMINCHA, ShaahZmanis.MINUTES_120_ZMANIS));
        map.put(Zman.PLAG_HAMINCHA_16_POINT_1_DEGREES, anchored(PLAG_HAMINCHA, ShaahZmanis.DEGREES_16_POINT_1));
        map.put(Zman.PLAG_HAMINCHA_18_DEGREES, anchored(PLAG_HAMINCHA, ShaahZmanis.DEGREES_18));
        map.put(Zman.PLAG_HAMINCHA_19_POINT_8_DEGREES, anchored(PLAG_HAMINCHA, ShaahZmanis.DEGREES_19_POINT_8));
        map.put(Zman.PLAG_HAMINCHA_26_DEGREES, anchored(PLAG_HAMINCHA, ShaahZmanis.DEGREES_26));
        map.put(Zman.PLAG_HAMINCHA_ATERET_TORAH, anchored(PLAG_HAMINCHA, ShaahZmanis.ATERET_TORAH));
        map.put(Zman.PLAG_HAMINCHA_BAAL_HATANYA, anchored(PLAG_HAMINCHA, ShaahZmanis.BAAL_HATANYA));
        map.put(Zman.PLAG_ALOS_TO_SUNSET,
                new Anchored(PLAG_HAMINCHA, Zman.ALOS_16_POINT_1_DEGREES, Zman.ELEVATION_ADJUSTED_SUNSET, false));
        map.put(Zman.PLAG_ALOS_16_POINT_1_TO_TZAIS_GEONIM_7_POINT_083_DEGREES,
                new Anchored(PLAG_HAMINCHA, Zman.ALOS_16_POINT_1_DEGREES, Zman.TZAIS_GEONIM_7_POINT_083_DEGREES, false));
        map.put(Zman.PLAG_HAMINCHA_GRA_FIXED_LOCAL_CHATZOS_TO_SUNSET,
                new HalfDay(Zman.FIXED_LOCAL_CHATZOS, Zman.ELEVATION_ADJUSTED_SUNSET, 4.75));

        map.put(Zman.BAIN_HASHMASHOS_RT_13_POINT_24_DEGREES, set(Zenith.ZENITH_13_POINT_24));
        map.put(Zman.BAIN_HASHMASHOS_RT_58_POINT_5_MINUTES,
                new FixedOffset(Zman.ELEVATION_ADJUSTED_SUNSET, Duration.ofSeconds(58 * 60 + 30)));
        map.put(Zman.BAIN_HASHMASHOS_RT_13_POINT_5_MINUTES_BEFORE_7_POINT_083_DEGREES,
                new FixedOffset(Zman.TZAIS_GEONIM_7_POINT_083_DEGREES, Duration.ofSeconds(-(13 * 60 + 30))));
        // 5/18 of the time between alos at 19.8 degrees and sunrise, after sunset
        map.put(Zman.BAIN_HASHMASHOS_RT_2_STARS, new ScaledInterval(Zman.ELEVATION_ADJUSTED_SUNSET,
                Zman.ALOS_19_POINT_8_DEGREES, Zman.ELEVATION_ADJUSTED_SUNRISE, 5 / 18d));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_18_MINUTES, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, -18));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_16_POINT_875_MINUTES,
                new FixedOffset(Zman.ELEVATION_ADJUSTED_SUNSET, Duration.ofMillis(-(16 * 60_000 + 52_500))));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_13_POINT_5_MINUTES,
                new FixedOffset(Zman.ELEVATION_ADJUSTED_SUNSET, Duration.ofSeconds(-(13 * 60 + 30))));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_3_POINT_05_DEGREES, set(Zenith.ZENITH_MINUS_3_POINT_05));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_2_POINT_8_DEGREES, set(Zenith.ZENITH_MINUS_2_POINT_8));
        map.put(Zman.BAIN_HASHMASHOS_YEREIM_2_POINT_1_DEGREES, set(Zenith.ZENITH_MINUS_2_POINT_1));

        map.put(Zman.TZAIS_50, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 50));
        map.put(Zman.TZAIS_60, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 60));
        map.put(Zman.TZAIS_72_ZMANIS, new ZmanisOffset(1.2));
        map.put(Zman.TZAIS_90, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 90));
        map.put(Zman.TZAIS_90_ZMANIS, new ZmanisOffset(1.5));
        map.put(Zman.TZAIS_96, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 96));
        map.put(Zman.TZAIS_96_ZMANIS, new ZmanisOffset(1.6));
        map.put(Zman.TZAIS_120, minutes(Zman.ELEVATION_ADJUSTED_SUNSET, 120));
        map.put(Zman.TZAIS_120_ZMANIS, new ZmanisOffset(2.0));
        map.put(Zman.TZAIS_16_POINT_1_DEGREES, set(Zenith.ZENITH_16_POINT_1));
        map.put(Zman.TZAIS_18_DEGREES, set(Zenith.ZENITH_18_DEGREES));
        map.put(Zman.TZAIS_19_POINT_8_DEGREES, set(Zenith.ZENITH_19_POINT_8));
        map.put(Zman.TZAIS_26_DEGREES, set(Zenith.ZENITH_26_DEGREES));
        map.put(Zman.TZAIS_ATERET_TORAH,
                new ConfiguredOffset(Zman.ELEVATION_ADJUSTED_SUNSET, ZmanimOptions::getAteretTorahSunsetOffset, false));
        map.put(Zman.TZAIS_BAAL_HATANYA, set(Zenith.ZENITH_6_DEGREES));
        map.put(Zman.TZAIS_GEONIM_3_POINT_65_DEGREES, set(Zenith.ZENITH_3_POINT_65));
        map.put(Zman.TZAIS_GEONIM_3_POINT_676_DEGREES, set(Zenith.ZENITH_3_POINT_676));
        map.put(Zman.TZAIS_GEONIM_3_POINT_7_DEGREES, set(Zenith.ZENITH_3_POINT_7));
        map.put(Zman.TZAIS_GEONIM_3_POINT_8_DEGREES, set(Zenith.ZENITH_3_POINT_8));
        map.put(Zman.TZAIS_GEONIM_4_POINT_37_DEGREES, set(Zenith.ZENITH_4_POINT_37));
        map.put(Zman.TZAIS_GEONIM_4_POINT_61_DEGREES, set(Zenith.ZENITH_4_POINT_61));
        map.put(Zman.TZAIS_GEONIM_4_POINT_8_DEGREES, set(Zenith.ZENITH_4_POINT_8));
        map.put(Zman.TZAIS_GEONIM_5_POINT_88_DEGREES, set(Zenith.ZENITH_5_POINT_88));
        map.put(Zman.TZAIS_GEONIM_5_POINT_95_DEGREES, set(Zenith.ZENITH_5_POINT_95));
        map.put(Zman.TZAIS_GEONIM_6_POINT_45_DEGREES, set(Zenith.ZENITH_6_POINT_45));
        map.put(Zman.TZAIS_GEONIM_7_POINT_083_DEGREES, set(Zenith.ZENITH_7_POINT_083));
        map.put(Zman.TZAIS_GEONIM_7_POINT_67_DEGREES, set(Zenith.ZENITH_7_POINT_67));
        map.put(Zman.TZAIS_GEONIM_8_POINT_5_DEGREES, set(Zenith.ZENITH_8_POINT_5));
        map.put(Zman.TZAIS_GEONIM_9_POINT_3_DEGREES, set(Zenith.ZENITH_9_POINT_3));
        map.put(Zman.TZAIS_GEONIM_9_POINT_75_DEGREES, set(Zenith.ZENITH_9_POINT_75));

        for (Zman zman : Zman.values()) {
            if (!map.containsKey(zman)) {
                throw new IllegalStateException("No definition for " + zman);
            }
        }
        DEFINITIONS = Collections.unmodifiableMap(map);
    }

    private ZmanTable() {
    }

    public static ZmanDefinition definitionOf(Zman zman) {
        return DEFINITIONS.get(zman);
    }

    public static Map<Zman, ZmanDefinition> getDefinitions() {
        return DEFINITIONS;
    }

    private static ZmanDefinition rise(double zenith) {
        return new DegreesOffset(zenith, SolarEvent.SUNRISE);
    }

    private static ZmanDefinition set(double zenith) {
        return new DegreesOffset(zenith, SolarEvent.SUNSET);
    }

    private static ZmanDefinition minutes(Zman base, long minutes) {
        return new FixedOffset(base, Duration.ofMinutes(minutes));
    }

    private static ZmanDefinition gra(DayPart part) {
        return anchored(part, ShaahZmanis.GRA);
    }

    private static ZmanDefinition anchored(DayPart part, ShaahZmanis day) {
        return new Anchored(part, day.getStart(), day.getEnd(), day.isSynchronous());
    }
}
