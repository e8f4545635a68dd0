package at.sv.zmanim.zman;

/**
 * The zmanim that can be anchored at chatzos. Morning zmanim are measured from the start of the day to chatzos,
 * afternoon zmanim from chatzos to the end of the day.
 */
public enum DayPart {
    SOF_ZMAN_SHMA(3, 3, true),
    SOF_ZMAN_TFILA(4, 4, true),
    MINCHA_GEDOLA(6.5, 0.5, false),
    SAMUCH_LE_MINCHA_KETANA(9, 3, false),
    MINCHA_KETANA(9.5, 3.5, false),
    PLAG_HAMINCHA(10.75, 4.75, false);

    private final double wholeDayHours;
    private final double halfDayHours;
    private final boolean morning;

    DayPart(double wholeDayHours, double halfDayHours, boolean morning) {
        this.wholeDayHours = wholeDayHours;
        this.halfDayHours = halfDayHours;
        this.morning = morning;
    }

    /**
     * Temporal hours after the start of the whole day.
     */
    public double getWholeDayHours() {
        return wholeDayHours;
    }

    /**
     * Half day hours after the start of the half day the zman falls into.
     */
    public double getHalfDayHours() {
        return halfDayHours;
    }

    public boolean isMorning() {
        return morning;
    }
}
