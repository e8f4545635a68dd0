package at.sv.zmanim;

import at.sv.zmanim.geo.GeoLocation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class ZmanimReportTest {

    private static final String NL = System.lineSeparator();

    private ZoneId zone;
    private LocalDate date;
    private Map<String, Optional<ZonedDateTime>> times;

    @BeforeEach
    void setUp() {
        zone = ZoneId.of("Europe/Vienna");
        date = LocalDate.of(2021, 1, 1);
        times = new LinkedHashMap<>();
        times.put("sunrise", Optional.of(ZonedDateTime.of(2021, 1, 1, 7, 42, 13, 0, zone)));
        times.put("tzais", Optional.empty());
        times.put("solarMidnight", Optional.of(ZonedDateTime.of(2021, 1, 2, 0, 0, 5, 0, zone)));
    }

    @Test
    void toText_alignedLines_absentAsDash_otherDateSuffixed() {
        ZmanimReport report = new ZmanimReport(new GeoLocation("Vienna", 48.2, 16.39, 165, zone), date, times);

        assertThat(report.toText(), is("Vienna (48.2, 16.39) on 2021-01-01" + NL +
                                       "sunrise        07:42:13" + NL +
                                       "tzais          -" + NL +
                                       "solarMidnight  00:00:05 (2021-01-02)" + NL));
    }

    @Test
    void toText_withoutName_coordinatesOnly() {
        ZmanimReport report = new ZmanimReport(new GeoLocation(48.2, 16.39, zone), date, Map.of());

        assertThat(report.toText(), is("48.2, 16.39 on 2021-01-01" + NL));
    }

    @Test
    void toJson_locationAndIsoTimes() throws Exception {
        ZmanimReport report = new ZmanimReport(new GeoLocation(48.2, 16.39, zone), date, times);

        JsonNode root = new ObjectMapper().readTree(report.toJson());

        assertThat(root.get("location").has("name"), is(false));
        assertThat(root.get("location").get("latitude").asDouble(), is(48.2));
        assertThat(root.get("location").get("longitude").asDouble(), is(16.39));
        assertThat(root.get("location").get("elevation").asDouble(), is(0.0));
        assertThat(root.get("location").get("timeZone").asText(), is("Europe/Vienna"));
        assertThat(root.get("date").asText(), is("2021-01-01"));
        assertThat(root.get("zmanim").get("sunrise").asText(), is("2021-01-01T07:42:13+01:00"));
        assertThat(root.get("zmanim").get("tzais").isNull(), is(true));
        assertThat(root.get("zmanim").get("solarMidnight").asText(), is("2021-01-02T00:00:05+01:00"));
    }

    @Test
    void toJson_keepsOrderOfTimes() throws Exception {
        ZmanimReport report = new ZmanimReport(new GeoLocation("Vienna", 48.2, 16.39, 165, zone), date, times);

        JsonNode zmanim = new ObjectMapper().readTree(report.toJson()).get("zmanim");

        assertThat(zmanim.fieldNames().next(), is("sunrise"));
        assertThat(new ObjectMapper().readTree(report.toJson()).get("location").get("name").asText(), is("Vienna"));
    }
}
