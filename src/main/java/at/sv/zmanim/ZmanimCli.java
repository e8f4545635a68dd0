package at.sv.zmanim;

import at.sv.zmanim.astro.AstronomicalCalculator;
import at.sv.zmanim.astro.CachingCalculator;
import at.sv.zmanim.astro.NoaaCalculator;
import at.sv.zmanim.astro.SunCalcCalculator;
import at.sv.zmanim.calendar.AstronomicalCalendar;
import at.sv.zmanim.geo.GeoLocation;
import at.sv.zmanim.geo.InvalidGeoLocationException;
import at.sv.zmanim.time.InvalidZmanExpression;
import at.sv.zmanim.time.ZmanExpressionResolver;
import at.sv.zmanim.zman.Zman;
import at.sv.zmanim.zman.ZmanimCalendar;
import at.sv.zmanim.zman.ZmanimOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Command(name = "zmanim", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints sunrise, sunset and the zmanim of a day for a location.")
public final class ZmanimCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ZmanimCli.class);

    enum Calculator {
        NOAA,
        SUNCALC
    }

    enum Format {
        TEXT,
        JSON
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            paramLabel = "EXPRESSION",
            arity = "0..*",
            description = "Zmanim or time expressions to calculate, e.g. sofZmanShmaGra, sunset-18, " +
                          "degrees:16.1:rise or 07:30. Default: the basic zmanim.")
    List<String> expressions;
    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of the location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of the location in degrees [-180..180], east positive.")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of the location. Always applied to the sunrise and " +
                          "sunset zmanim, and to the zmanim based on them if --use-elevation is set.")
    double elevation;
    @Option(names = "--tz", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone of the location, e.g. Asia/Jerusalem. Default: the system time zone.")
    String timeZone;
    @Option(names = "--name",
            defaultValue = "${env:LOCATION_NAME}",
            description = "An optional name of the location, shown in the report.")
    String locationName;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to calculate. Default: today in the time zone of the location.")
    LocalDate date;
    @Option(names = "--calculator",
            defaultValue = "${env:CALCULATOR:-NOAA}",
            description = "The algorithm used for the sun's position: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Calculator calculator;
    @Option(names = "--cache-size", paramLabel = "<entries>",
            defaultValue = "${env:CACHE_SIZE:-1000}",
            description = "The maximum number of cached sunrise and sunset results; 0 disables caching. " +
                          "Default: ${DEFAULT-VALUE}")
    long cacheSize;
    @Option(names = "--all",
            description = "Calculate every known zman instead of only the basic ones.")
    boolean all;
    @Option(names = "--format",
            defaultValue = "${env:FORMAT:-TEXT}",
            description = "The output format: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Format format;
    @Option(names = "--use-elevation",
            defaultValue = "${env:USE_ELEVATION:-false}",
            description = "Use the elevation for sunrise and sunset based zmanim instead of sea level. " +
                          "Default: ${DEFAULT-VALUE}")
    boolean useElevation;
    @Option(names = "--chatzos-as-half-day",
            defaultValue = "${env:CHATZOS_AS_HALF_DAY:-false}",
            description = "Use the midpoint of sea level sunrise and sunset as chatzos instead of the sun's transit." +
                          " Default: ${DEFAULT-VALUE}")
    boolean chatzosAsHalfDay;
    @Option(names = "--chatzos-for-other-zmanim",
            defaultValue = "${env:CHATZOS_FOR_OTHER_ZMANIM:-false}",
            description = "Measure the zmanim of symmetric days in half day hours from and to chatzos. " +
                          "Default: ${DEFAULT-VALUE}")
    boolean chatzosForOtherZmanim;
    @Option(names = "--candle-lighting-offset", paramLabel = "<minutes>",
            defaultValue = "${env:CANDLE_LIGHTING_OFFSET:-18}",
            description = "Minutes before sunset for candle lighting. Default: ${DEFAULT-VALUE} minutes.")
    int candleLightingOffsetInMinutes;
    @Option(names = "--ateret-torah-offset", paramLabel = "<minutes>",
            defaultValue = "${env:ATERET_TORAH_OFFSET:-40}",
            description = "Minutes after sunset for tzais according to the Ateret Torah. Default: ${DEFAULT-VALUE} minutes.")
    int ateretTorahOffsetInMinutes;

    public static void main(String[] args) {
        int execute = new CommandLine(new ZmanimCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        GeoLocation geoLocation = createGeoLocation();
        ZmanimCalendar calendar = new ZmanimCalendar(new AstronomicalCalendar(geoLocation, createCalculator()),
                createOptions());
        LocalDate day = date != null ? date : LocalDate.now(geoLocation.getTimeZone());
        LOG.debug("Calculating {} for {} on {}", describeRequest(), geoLocation, day);

        MDC.put("context", day.toString());
        Map<String, Optional<ZonedDateTime>> times = calculate(calendar, day);
        ZmanimReport report = new ZmanimReport(geoLocation, day, times);
        PrintWriter out = spec.commandLine().getOut();
        out.print(format == Format.JSON ? report.toJson() + System.lineSeparator() : report.toText());
        out.flush();
        MDC.remove("context");
    }

    private Map<String, Optional<ZonedDateTime>> calculate(ZmanimCalendar calendar, LocalDate day) {
        Map<String, Optional<ZonedDateTime>> times = new LinkedHashMap<>();
        if (expressions != null && !expressions.isEmpty()) {
            ZmanExpressionResolver resolver = new ZmanExpressionResolver(calendar);
            for (String expression : expressions) {
                try {
                    times.put(expression, resolver.resolve(expression, day));
                } catch (InvalidZmanExpression e) {
                    fail(e.getMessage());
                }
            }
            return times;
        }
        List<Zman> zmanim = all ? Arrays.asList(Zman.values()) : Zman.basicZmanim();
        calendar.getZmanim(day, zmanim).forEach((zman, time) -> times.put(zman.getKey(), time));
        return times;
    }

    private void assertConfigurationParameters() {
        if (cacheSize < 0) {
            fail("--cache-size must be >= 0");
        }
        if (candleLightingOffsetInMinutes < 0) {
            fail("--candle-lighting-offset must be >= 0");
        }
        if (ateretTorahOffsetInMinutes < 0) {
            fail("--ateret-torah-offset must be >= 0");
        }
    }

    private GeoLocation createGeoLocation() {
        ZoneId zone = parseTimeZone();
        try {
            return new GeoLocation(locationName, latitude, longitude, elevation, zone);
        } catch (InvalidGeoLocationException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private ZoneId parseTimeZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            fail("Invalid --tz '" + timeZone + "': " + e.getMessage());
            return null;
        }
    }

    private AstronomicalCalculator createCalculator() {
        AstronomicalCalculator astronomicalCalculator = calculator == Calculator.SUNCALC
                ? new SunCalcCalculator()
                : new NoaaCalculator();
        if (cacheSize == 0) {
            return astronomicalCalculator;
        }
        return new CachingCalculator(astronomicalCalculator, cacheSize);
    }

    private ZmanimOptions createOptions() {
        return ZmanimOptions.builder()
                            .useElevation(useElevation)
                            .useAstronomicalChatzos(!chatzosAsHalfDay)
                            .useAstronomicalChatzosForOtherZmanim(chatzosForOtherZmanim)
                            .candleLightingOffset(Duration.ofMinutes(candleLightingOffsetInMinutes))
                            .ateretTorahSunsetOffset(Duration.ofMinutes(ateretTorahOffsetInMinutes))
                            .build();
    }

    private String describeRequest() {
        if (expressions != null && !expressions.isEmpty()) {
            return String.join(", ", expressions);
        }
        return all ? "all zmanim" : "basic zmanim";
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
