package at.sv.zmanim.astro;

/**
 * Zenith angles in degrees, measured from the vertical: 90 is the geometric horizon, larger values are below it.
 */
public final class Zenith {

    public static final double GEOMETRIC = 90;
    public static final double CIVIL = 96;
    public static final double NAUTICAL = 102;
    public static final double ASTRONOMICAL = 108;


    public static final double ZENITH_1_POINT_583 = GEOMETRIC + 1.583;
    public static final double ZENITH_3_POINT_65 = GEOMETRIC + 3.65;
    public static final double ZENITH_3_POINT_676 = GEOMETRIC + 3.676;
    public static final double ZENITH_3_POINT_7 = GEOMETRIC + 3.7;
    public static final double ZENITH_3_POINT_8 = GEOMETRIC + 3.8;
    public static final double ZENITH_4_POINT_37 = GEOMETRIC + 4.37;
    public static final double ZENITH_4_POINT_61 = GEOMETRIC + 4.61;
    public static final double ZENITH_4_POINT_8 = GEOMETRIC + 4.8;
    public static final double ZENITH_5_POINT_88 = GEOMETRIC + 5.88;
    public static final double ZENITH_5_POINT_95 = GEOMETRIC + 5.95;
    public static final double ZENITH_6_DEGREES = GEOMETRIC + 6;
    public static final double ZENITH_6_POINT_45 = GEOMETRIC + 6.45;
    /** 7&deg;5' */
    public static final double ZENITH_7_POINT_083 = GEOMETRIC + 7 + 5.0 / 60;
    public static final double ZENITH_7_POINT_65 = GEOMETRIC + 7.65;
    public static final double ZENITH_7_POINT_67 = GEOMETRIC + 7.67;
    public static final double ZENITH_8_POINT_5 = GEOMETRIC + 8.5;
    public static final double ZENITH_9_POINT_3 = GEOMETRIC + 9.3;
    public static final double ZENITH_9_POINT_5 = GEOMETRIC + 9.5;
    public static final double ZENITH_9_POINT_75 = GEOMETRIC + 9.75;
    public static final double ZENITH_10_POINT_2 = GEOMETRIC + 10.2;
    public static final double ZENITH_11_DEGREES = GEOMETRIC + 11;
    public static final double ZENITH_11_POINT_5 = GEOMETRIC + 11.5;
    public static final double ZENITH_13_POINT_24 = GEOMETRIC + 13.24;
    public static final double ZENITH_16_POINT_1 = GEOMETRIC + 16.1;
    public static final double ZENITH_16_POINT_9 = GEOMETRIC + 16.9;
    public static final double ZENITH_18_DEGREES = ASTRONOMICAL;
    public static final double ZENITH_19_DEGREES = GEOMETRIC + 19;
    public static final double ZENITH_19_POINT_8 = GEOMETRIC + 19.8;
    public static final double ZENITH_26_DEGREES = GEOMETRIC + 26;
    public static final double ZENITH_MINUS_2_POINT_1 = GEOMETRIC - 2.1;
    public static final double ZENITH_MINUS_2_POINT_8 = GEOMETRIC - 2.8;
    public static final double ZENITH_MINUS_3_POINT_05 = GEOMETRIC - 3.05;

    private Zenith() {
    }

    /**
     * @param degrees the depression of the sun below the geometric horizon, negative values are above it
     * @return the corresponding zenith angle
     */
    public static double belowHorizon(double degrees) {
        return GEOMETRIC + degrees;
    }
}
