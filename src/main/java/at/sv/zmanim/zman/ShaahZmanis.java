package at.sv.zmanim.zman;

/**
 * The day definitions a shaah zmanis (temporal hour) can be based on, each given by the zman starting and the zman
 * ending the day.
 */
public enum ShaahZmanis {
    GRA(Zman.ELEVATION_ADJUSTED_SUNRISE, Zman.ELEVATION_ADJUSTED_SUNSET),
    MGA(Zman.ALOS_72, Zman.TZAIS_72),
    DEGREES_16_POINT_1(Zman.ALOS_16_POINT_1_DEGREES, Zman.TZAIS_16_POINT_1_DEGREES),
    DEGREES_18(Zman.ALOS_18_DEGREES, Zman.TZAIS_18_DEGREES),
    DEGREES_19_POINT_8(Zman.ALOS_19_POINT_8_DEGREES, Zman.TZAIS_19_POINT_8_DEGREES),
    DEGREES_26(Zman.ALOS_26_DEGREES, Zman.TZAIS_26_DEGREES),
    MINUTES_60(Zman.ALOS_60, Zman.TZAIS_60),
    MINUTES_72(Zman.ALOS_72, Zman.TZAIS_72),
    MINUTES_72_ZMANIS(Zman.ALOS_72_ZMANIS, Zman.TZAIS_72_ZMANIS),
    MINUTES_90(Zman.ALOS_90, Zman.TZAIS_90),
    MINUTES_90_ZMANIS(Zman.ALOS_90_ZMANIS, Zman.TZAIS_90_ZMANIS),
    MINUTES_96(Zman.ALOS_96, Zman.TZAIS_96),
    MINUTES_96_ZMANIS(Zman.ALOS_96_ZMANIS, Zman.TZAIS_96_ZMANIS),
    MINUTES_120(Zman.ALOS_120, Zman.TZAIS_120),
    MINUTES_120_ZMANIS(Zman.ALOS_120_ZMANIS, Zman.TZAIS_120_ZMANIS),
    ATERET_TORAH(Zman.ALOS_72_ZMANIS, Zman.TZAIS_ATERET_TORAH, false),
    BAAL_HATANYA(Zman.SUNRISE_BAAL_HATANYA, Zman.SUNSET_BAAL_HATANYA),
    ALOS_16_POINT_1_TO_TZAIS_3_POINT_7(Zman.ALOS_16_POINT_1_DEGREES, Zman.TZAIS_GEONIM_3_POINT_7_DEGREES, false),
    ALOS_16_POINT_1_TO_TZAIS_3_POINT_8(Zman.ALOS_16_POINT_1_DEGREES, Zman.TZAIS_GEONIM_3_POINT_8_DEGREES, false);

    private final Zman start;
    private final Zman end;
    private final boolean synchronous;

    ShaahZmanis(Zman start, Zman end) {
        this(start, end, true);
    }

    ShaahZmanis(Zman start, Zman end, boolean synchronous) {
        this.start = start;
        this.end = end;
        this.synchronous = synchronous;
    }

    public Zman getStart() {
        return start;
    }

    public Zman getEnd() {
        return end;
    }

    /**
     * If the day is symmetric around chatzos, i.e. starts as long before sunrise as it ends after sunset.
     */
    public boolean isSynchronous() {
        return synchronous;
    }
}
