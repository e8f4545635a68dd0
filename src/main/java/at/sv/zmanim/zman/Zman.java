package at.sv.zmanim.zman;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The named zmanim. How each one is calculated is defined in {@link ZmanTable}.
 */
public enum Zman {
    // astronomical events
    SUNRISE,
    SEA_LEVEL_SUNRISE,
    ELEVATION_ADJUSTED_SUNRISE,
    SUNSET,
    SEA_LEVEL_SUNSET,
    ELEVATION_ADJUSTED_SUNSET,
    SUN_TRANSIT,
    SOLAR_MIDNIGHT,
    BEGIN_CIVIL_TWILIGHT,
    BEGIN_NAUTICAL_TWILIGHT,
    BEGIN_ASTRONOMICAL_TWILIGHT,
    END_CIVIL_TWILIGHT,
    END_NAUTICAL_TWILIGHT,
    END_ASTRONOMICAL_TWILIGHT,

    // basic zmanim
    ALOS_HASHACHAR(true),
    ALOS_72(true),
    CHATZOS(true),
    CHATZOS_AS_HALF_DAY,
    SOF_ZMAN_SHMA_GRA(true),
    SOF_ZMAN_SHMA_MGA(true),
    SOF_ZMAN_TFILA_GRA(true),
    SOF_ZMAN_TFILA_MGA(true),
    MINCHA_GEDOLA(true),
    SAMUCH_LE_MINCHA_KETANA,
    MINCHA_KETANA(true),
    PLAG_HAMINCHA(true),
    CANDLE_LIGHTING(true),
    TZAIS(true),
    TZAIS_72(true),

    // alos
    ALOS_60,
    ALOS_72_ZMANIS,
    ALOS_90,
    ALOS_90_ZMANIS,
    ALOS_96,
    ALOS_96_ZMANIS,
    ALOS_120,
    ALOS_120_ZMANIS,
    ALOS_16_POINT_1_DEGREES,
    ALOS_18_DEGREES,
    ALOS_19_DEGREES,
    ALOS_19_POINT_8_DEGREES,
    ALOS_26_DEGREES,
    ALOS_BAAL_HATANYA,

    // misheyakir
    MISHEYAKIR_7_POINT_65_DEGREES,
    MISHEYAKIR_9_POINT_5_DEGREES,
    MISHEYAKIR_10_POINT_2_DEGREES,
    MISHEYAKIR_11_DEGREES,
    MISHEYAKIR_11_POINT_5_DEGREES,

    SUNRISE_BAAL_HATANYA,
    SUNSET_BAAL_HATANYA,
    FIXED_LOCAL_CHATZOS,

    // sof zman shma
    SOF_ZMAN_SHMA_MGA_16_POINT_1_DEGREES,
    SOF_ZMAN_SHMA_MGA_18_DEGREES,
    SOF_ZMAN_SHMA_MGA_19_POINT_8_DEGREES,
    SOF_ZMAN_SHMA_MGA_72_MINUTES,
    SOF_ZMAN_SHMA_MGA_72_MINUTES_ZMANIS,
    SOF_ZMAN_SHMA_MGA_90_MINUTES,
    SOF_ZMAN_SHMA_MGA_90_MINUTES_ZMANIS,
    SOF_ZMAN_SHMA_MGA_96_MINUTES,
    SOF_ZMAN_SHMA_MGA_96_MINUTES_ZMANIS,
    SOF_ZMAN_SHMA_MGA_120_MINUTES,
    SOF_ZMAN_SHMA_3_HOURS_BEFORE_CHATZOS,
    SOF_ZMAN_SHMA_ALOS_16_POINT_1_TO_SUNSET,
    SOF_ZMAN_SHMA_ALOS_16_POINT_1_TO_TZAIS_GEONIM_7_POINT_083_DEGREES,
    SOF_ZMAN_SHMA_ATERET_TORAH,
    SOF_ZMAN_SHMA_BAAL_HATANYA,
    SOF_ZMAN_SHMA_GRA_SUNRISE_TO_FIXED_LOCAL_CHATZOS,
    SOF_ZMAN_SHMA_MGA_16_POINT_1_DEGREES_TO_FIXED_LOCAL_CHATZOS,
    SOF_ZMAN_SHMA_MGA_18_DEGREES_TO_FIXED_LOCAL_CHATZOS,
    SOF_ZMAN_SHMA_MGA_72_MINUTES_TO_FIXED_LOCAL_CHATZOS,
    SOF_ZMAN_SHMA_MGA_90_MINUTES_TO_FIXED_LOCAL_CHATZOS,

    // sof zman tfila
    SOF_ZMAN_TFILA_MGA_16_POINT_1_DEGREES,
    SOF_ZMAN_TFILA_MGA_18_DEGREES,
    SOF_ZMAN_TFILA_MGA_19_POINT_8_DEGREES,
    SOF_ZMAN_TFILA_MGA_72_MINUTES,
    SOF_ZMAN_TFILA_MGA_72_MINUTES_ZMANIS,
    SOF_ZMAN_TFILA_MGA_90_MINUTES,
    SOF_ZMAN_TFILA_MGA_90_MINUTES_ZMANIS,
    SOF_ZMAN_TFILA_MGA_96_MINUTES,
    SOF_ZMAN_TFILA_MGA_96_MINUTES_ZMANIS,
    SOF_ZMAN_TFILA_MGA_120_MINUTES,
    SOF_ZMAN_TFILA_2_HOURS_BEFORE_CHATZOS,
    SOF_ZMAN_TFILA_ATERET_TORAH,
    SOF_ZMAN_TFILA_BAAL_HATANYA,
    SOF_ZMAN_TFILA_GRA_SUNRISE_TO_FIXED_LOCAL_CHATZOS,

    // mincha
    MINCHA_GEDOLA_30_MINUTES,
    MINCHA_GEDOLA_72_MINUTES,
    MINCHA_GEDOLA_16_POINT_1_DEGREES,
    MINCHA_GEDOLA_ATERET_TORAH,
    MINCHA_GEDOLA_BAAL_HATANYA,
    MINCHA_GEDOLA_GREATER_THAN_30,
    MINCHA_GEDOLA_BAAL_HATANYA_GREATER_THAN_30,
    MINCHA_GEDOLA_GRA_FIXED_LOCAL_CHATZOS_30_MINUTES,
    SAMUCH_LE_MINCHA_KETANA_16_POINT_1_DEGREES,
    SAMUCH_LE_MINCHA_KETANA_72_MINUTES,
    MINCHA_KETANA_16_POINT_1_DEGREES,
    MINCHA_KETANA_72_MINUTES,
    MINCHA_KETANA_ATERET_TORAH,
    MINCHA_KETANA_BAAL_HATANYA,
    MINCHA_KETANA_GRA_FIXED_LOCAL_CHATZOS_TO_SUNSET,

    // plag hamincha
    PLAG_HAMINCHA_60_MINUTES,
    PLAG_HAMINCHA_72_MINUTES,
    PLAG_HAMINCHA_72_MINUTES_ZMANIS,
    PLAG_HAMINCHA_90_MINUTES,
    PLAG_HAMINCHA_90_MINUTES_ZMANIS,
    PLAG_HAMINCHA_96_MINUTES,
    PLAG_HAMINCHA_96_MINUTES_ZMANIS,
    PLAG_HAMINCHA_120_MINUTES,
    PLAG_HAMINCHA_120_MINUTES_ZMANIS,
    PLAG_HAMINCHA_16_POINT_1_DEGREES,
    PLAG_HAMINCHA_18_DEGREES,
    PLAG_HAMINCHA_19_POINT_8_DEGREES,
    PLAG_HAMINCHA_26_DEGREES,
    PLAG_HAMINCHA_ATERET_TORAH,
    PLAG_HAMINCHA_BAAL_HATANYA,
    PLAG_ALOS_TO_SUNSET,
    PLAG_ALOS_16_POINT_1_TO_TZAIS_GEONIM_7_POINT_083_DEGREES,
    PLAG_HAMINCHA_GRA_FIXED_LOCAL_CHATZOS_TO_SUNSET,

    // bain hashmashos
    BAIN_HASHMASHOS_RT_13_POINT_24_DEGREES,
    BAIN_HASHMASHOS_RT_58_POINT_5_MINUTES,
    BAIN_HASHMASHOS_RT_13_POINT_5_MINUTES_BEFORE_7_POINT_083_DEGREES,
    BAIN_HASHMASHOS_RT_2_STARS,
    BAIN_HASHMASHOS_YEREIM_18_MINUTES,
    BAIN_HASHMASHOS_YEREIM_16_POINT_875_MINUTES,
    BAIN_HASHMASHOS_YEREIM_13_POINT_5_MINUTES,
    BAIN_HASHMASHOS_YEREIM_3_POINT_05_DEGREES,
    BAIN_HASHMASHOS_YEREIM_2_POINT_8_DEGREES,
    BAIN_HASHMASHOS_YEREIM_2_POINT_1_DEGREES,

    // tzais
    TZAIS_50,
    TZAIS_60,
    TZAIS_72_ZMANIS,
    TZAIS_90,
    TZAIS_90_ZMANIS,
    TZAIS_96,
    TZAIS_96_ZMANIS,
    TZAIS_120,
    TZAIS_120_ZMANIS,
    TZAIS_16_POINT_1_DEGREES,
    TZAIS_18_DEGREES,
    TZAIS_19_POINT_8_DEGREES,
    TZAIS_26_DEGREES,
    TZAIS_ATERET_TORAH,
    TZAIS_BAAL_HATANYA,
    TZAIS_GEONIM_3_POINT_65_DEGREES,
    TZAIS_GEONIM_3_POINT_676_DEGREES,
    TZAIS_GEONIM_3_POINT_7_DEGREES,
    TZAIS_GEONIM_3_POINT_8_DEGREES,
    TZAIS_GEONIM_4_POINT_37_DEGREES,
    TZAIS_GEONIM_4_POINT_61_DEGREES,
    TZAIS_GEONIM_4_POINT_8_DEGREES,
    TZAIS_GEONIM_5_POINT_88_DEGREES,
    TZAIS_GEONIM_5_POINT_95_DEGREES,
    TZAIS_GEONIM_6_POINT_45_DEGREES,
    TZAIS_GEONIM_7_POINT_083_DEGREES,
    TZAIS_GEONIM_7_POINT_67_DEGREES,
    TZAIS_GEONIM_8_POINT_5_DEGREES,
    TZAIS_GEONIM_9_POINT_3_DEGREES,
    TZAIS_GEONIM_9_POINT_75_DEGREES;

    private final boolean basic;

    Zman() {
        this(false);
    }

    Zman(boolean basic) {
        this.basic = basic;
    }

    /**
     * If this zman is part of the commonly published set.
     */
    public boolean isBasic() {
        return basic;
    }

    /**
     * @return the name in lower camel case, e.g. {@code sofZmanShmaGra} for {@link #SOF_ZMAN_SHMA_GRA}
     */
    public String getKey() {
        StringBuilder key = new StringBuilder();
        for (String part : name().toLowerCase(Locale.ROOT).split("_")) {
            if (key.length() == 0) {
                key.append(part);
            } else {
                key.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return key.toString();
    }

    public static List<Zman> basicZmanim() {
        return Arrays.stream(values()).filter(Zman::isBasic).toList();
    }

    /**
     * Looks up a zman by its enum name or its key, ignoring case, dashes and underscores.
     */
    public static Optional<Zman> parse(String name) {
        String normalized = normalize(name);
        return Arrays.stream(values())
                     .filter(zman -> normalize(zman.name()).equals(normalized))
                     .findFirst();
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
