package at.sv.zmanim.time;

import at.sv.zmanim.astro.Zenith;
import at.sv.zmanim.calendar.AstronomicalCalendar;
import at.sv.zmanim.zman.Zman;
import at.sv.zmanim.zman.ZmanimCalendar;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves user supplied time expressions for a date. Supported are:
 * <ul>
 *     <li>{@link java.time.format.DateTimeFormatter#ISO_LOCAL_TIME} clock times, e.g. {@code 07:30}</li>
 *     <li>zman names, e.g. {@code sofZmanShmaGra} or {@code SOF_ZMAN_SHMA_GRA}</li>
 *     <li>sun keywords, e.g. {@code sunrise}, {@code noon} or {@code civil_dusk}</li>
 *     <li>degree expressions, e.g. {@code degrees:16.1:rise}</li>
 *     <li>any of the above except clock times with a minute offset, e.g. {@code sunset-18} or {@code tzais + 2.5}</li>
 * </ul>
 */
public final class ZmanExpressionResolver {

    private static final Pattern OFFSET_EXPRESSION = Pattern.compile("^(.+?)\\s*([+-])\\s*(\\d+(?:\\.\\d+)?)$");
    private static final Pattern DEGREES_EXPRESSION = Pattern.compile("^degrees:(-?\\d+(?:\\.\\d+)?):(rise|set)$");

    private final ZmanimCalendar calendar;
    private final Map<String, LocalTime> timeCache;

    public ZmanExpressionResolver(ZmanimCalendar calendar) {
        this.calendar = calendar;
        timeCache = new ConcurrentHashMap<>();
    }

    /**
     * @param input the expression to resolve
     * @param date  the civil date in the time zone of the calendar's location
     * @return the resolved time, or empty if the referenced zman does not occur on the date
     * @throws InvalidZmanExpression if the input is not a supported expression
     */
    public Optional<ZonedDateTime> resolve(String input, LocalDate date) {
        if (input == null || input.isBlank()) {
            throw new InvalidZmanExpression("Empty zman expression");
        }
        String trimmed = input.trim();
        LocalTime time = tryParseTimeString(trimmed);
        if (time != null) {
            return Optional.of(date.atTime(time).atZone(calendar.getAstronomicalCalendar().getTimeZone()));
        }
        try {
            Optional<ZonedDateTime> keyword = tryParseKeyword(trimmed, date);
            if (keyword != null) {
                return keyword;
            }
            Matcher matcher = OFFSET_EXPRESSION.matcher(trimmed);
            if (matcher.matches()) {
                return parseOffsetExpression(matcher, date);
            }
        } catch (NumberFormatException e) {
            throw new InvalidZmanExpression("Failed to parse zman expression '" + input + "': " + e.getMessage(), e);
        }
        throw new InvalidZmanExpression("Failed to parse zman expression '" + input + "': unknown zman or keyword");
    }

    public void clearCache() {
        timeCache.clear();
    }

    private LocalTime tryParseTimeString(String input) {
        if (!Character.isDigit(input.charAt(0))) {
            return null;
        }
        return timeCache.computeIfAbsent(input, k -> {
            try {
                return LocalTime.parse(input);
            } catch (Exception ignore) {
                return null;
            }
        });
    }

    private Optional<ZonedDateTime> parseOffsetExpression(Matcher matcher, LocalDate date) {
        String base = matcher.group(1).trim();
        Optional<ZonedDateTime> baseTime = tryParseKeyword(base, date);
        if (baseTime == null) {
            throw new InvalidZmanExpression("Failed to parse zman expression '" + matcher.group() + "': unknown " +
                                            "zman or keyword '" + base + "'");
        }
        Duration offset = Duration.ofNanos(Math.round(Double.parseDouble(matcher.group(3)) * 60 * 1e9));
        if (matcher.group(2).equals("-")) {
            return baseTime.map(time -> time.minus(offset));
        }
        return baseTime.map(time -> time.plus(offset));
    }

    /**
     * @return {@code null} if the input is no known keyword, zman or degree expression
     */
    private Optional<ZonedDateTime> tryParseKeyword(String input, LocalDate date) {
        String lowerCase = input.toLowerCase(Locale.ENGLISH);
        Matcher degrees = DEGREES_EXPRESSION.matcher(lowerCase);
        if (degrees.matches()) {
            AstronomicalCalendar astronomicalCalendar = calendar.getAstronomicalCalendar();
            double zenith = Zenith.belowHorizon(Double.parseDouble(degrees.group(1)));
            if (degrees.group(2).equals("rise")) {
                return astronomicalCalendar.getSunriseOffsetByDegrees(date, zenith);
            }
            return astronomicalCalendar.getSunsetOffsetByDegrees(date, zenith);
        }
        Zman zman = parseSunKeyword(lowerCase);
        if (zman == null) {
            zman = Zman.parse(input).orElse(null);
        }
        if (zman == null) {
            return null;
        }
        return calendar.getZman(date, zman);
    }

    private static Zman parseSunKeyword(String input) {
        return switch (input) {
            case "astronomical_start", "astronomical_dawn" -> Zman.BEGIN_ASTRONOMICAL_TWILIGHT;
            case "nautical_start", "nautical_dawn" -> Zman.BEGIN_NAUTICAL_TWILIGHT;
            case "civil_start", "civil_dawn" -> Zman.BEGIN_CIVIL_TWILIGHT;
            case "sunrise" -> Zman.ELEVATION_ADJUSTED_SUNRISE;
            case "noon", "transit" -> Zman.SUN_TRANSIT;
            case "sunset" -> Zman.ELEVATION_ADJUSTED_SUNSET;
            case "civil_end", "civil_dusk" -> Zman.END_CIVIL_TWILIGHT;
            case "nautical_end", "nautical_dusk" -> Zman.END_NAUTICAL_TWILIGHT;
            case "astronomical_end", "astronomical_dusk" -> Zman.END_ASTRONOMICAL_TWILIGHT;
            case "midnight" -> Zman.SOLAR_MIDNIGHT;
            case "alos", "dawn" -> Zman.ALOS_HASHACHAR;
            case "candles" -> Zman.CANDLE_LIGHTING;
            default -> null;
        };
    }
}
