package at.sv.zmanim;

import at.sv.zmanim.geo.GeoLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * Formats calculated times of a single day, either as aligned plain text or as JSON. Times that do not occur on the
 * day are printed as {@code -}, or {@code null} in JSON.
 */
final class ZmanimReport {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final GeoLocation geoLocation;
    private final LocalDate date;
    private final Map<String, Optional<ZonedDateTime>> times;
    private final ObjectMapper mapper;

    ZmanimReport(GeoLocation geoLocation, LocalDate date, Map<String, Optional<ZonedDateTime>> times) {
        this.geoLocation = geoLocation;
        this.date = date;
        this.times = times;
        mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    String toText() {
        int width = times.keySet().stream().mapToInt(String::length).max().orElse(0);
        StringBuilder sb = new StringBuilder();
        sb.append(describeLocation()).append(" on ").append(date).append(System.lineSeparator());
        times.forEach((name, time) -> sb.append(String.format("%-" + width + "s  %s", name, formatTime(time, date)))
                                        .append(System.lineSeparator()));
        return sb.toString();
    }

    String toJson() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode location = root.putObject("location");
        if (geoLocation.getName() != null) {
            location.put("name", geoLocation.getName());
        }
        location.put("latitude", geoLocation.getLatitude());
        location.put("longitude", geoLocation.getLongitude());
        location.put("elevation", geoLocation.getElevation());
        location.put("timeZone", geoLocation.getTimeZone().getId());
        root.put("date", date.toString());
        ObjectNode zmanim = root.putObject("zmanim");
        times.forEach((name, time) -> {
            if (time.isPresent()) {
                zmanim.put(name, time.get().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
            } else {
                zmanim.putNull(name);
            }
        });
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write zmanim report as JSON", e);
        }
    }

    private String describeLocation() {
        String coordinates = geoLocation.getLatitude() + ", " + geoLocation.getLongitude();
        if (geoLocation.getName() != null) {
            return geoLocation.getName() + " (" + coordinates + ")";
        }
        return coordinates;
    }

    /**
     * Times falling on another civil date, e.g. solar midnight, carry their date.
     */
    private static String formatTime(Optional<ZonedDateTime> time, LocalDate date) {
        if (time.isEmpty()) {
            return "-";
        }
        String formatted = time.get().format(TIME_FORMATTER);
        if (!time.get().toLocalDate().equals(date)) {
            return formatted + " (" + time.get().toLocalDate() + ")";
        }
        return formatted;
    }
}
