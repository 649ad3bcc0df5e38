package at.sv.prayer;

import at.sv.prayer.time.PrayerTimesProvider;
import at.sv.prayer.time.PrayerTimesProviderImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Command(name = "PrayerTimetable", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Calculates the daily prayer times for a location from the position of the sun.")
public final class PrayerTimetable implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180], positive east of Greenwich.")
    double longitude;
    @Option(names = "--utc-offset", required = true, paramLabel = "<hours>",
            defaultValue = "${env:UTC_OFFSET}",
            description = "The offset of your local time from UTC in hours, including daylight saving time. " +
                          "Fractions are allowed, e.g. 6.5 for Myanmar.")
    double utcOffset;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:DATE}",
            description = "The first date to calculate. Default: today at the given UTC offset.")
    String date;
    @Option(names = "--days",
            defaultValue = "${env:DAYS:-1}",
            description = "The number of consecutive days to calculate. Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--method",
            defaultValue = "${env:METHOD:-Karachi}",
            description = "The calculation method: MWL, Karachi, Egypt, UmmAlQura or Custom. Default: ${DEFAULT-VALUE}")
    String method;
    @Option(names = "--asr-shadow",
            defaultValue = "${env:ASR_SHADOW:-1}",
            description = "The Asr shadow factor: 1 (Shafi, Maliki, Hanbali) or 2 (Hanafi). Default: ${DEFAULT-VALUE}")
    String asrShadow;
    @Option(names = "--fajr-angle", paramLabel = "<degrees>",
            defaultValue = "${env:FAJR_ANGLE}",
            description = "Custom Fajr angle in degrees below the horizon, e.g. -18. Requires --method Custom.")
    Double fajrAngle;
    @Option(names = "--isha-angle", paramLabel = "<degrees>",
            defaultValue = "${env:ISHA_ANGLE}",
            description = "Custom Isha angle in degrees below the horizon, e.g. -17. Requires --method Custom.")
    Double ishaAngle;
    @Option(names = "--isha-interval", paramLabel = "<minutes>",
            defaultValue = "${env:ISHA_INTERVAL}",
            description = "Fixed interval between Maghrib and Isha in minutes. Replaces the default of 90 minutes for " +
                          "UmmAlQura, or the Isha angle for Custom.")
    Integer ishaIntervalInMinutes;
    @Option(names = "--format",
            defaultValue = "${env:FORMAT:-text}",
            description = "The output format: text or json. Default: ${DEFAULT-VALUE}")
    String format;

    private final Supplier<ZonedDateTime> currentTime;
    private final PrayerTimesCalculator calculator;
    private final ObjectMapper objectMapper;
    private CalculationMethod calculationMethod;
    private AsrShadow shadow;
    private OutputFormat outputFormat;

    public PrayerTimetable() {
        this(ZonedDateTime::now, new PrayerTimesCalculatorImpl());
    }

    PrayerTimetable(Supplier<ZonedDateTime> currentTime, PrayerTimesCalculator calculator) {
        this.currentTime = currentTime;
        this.calculator = calculator;
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new PrayerTimetable()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZonedDateTime now = currentTime.get().withZoneSameInstant(getZoneOffset());
        LocalDate startDate = date != null ? parseDate(date) : now.toLocalDate();
        PrayerTimesProvider provider = new PrayerTimesProviderImpl(calculator, createRequestTemplate(startDate));
        log.debug("Calculating {} day(s) from {} using {}", days, startDate, calculationMethod);

        List<PrayerTimesResult> results = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            LocalDate day = startDate.plusDays(i);
            MDC.put("context", day.toString());
            results.add(provider.getPrayerTimes(day));
        }
        MDC.remove("context");

        if (outputFormat == OutputFormat.JSON) {
            printJson(results);
        } else {
            printText(results, now);
        }
    }

    private PrayerTimesRequest createRequestTemplate(LocalDate startDate) {
        return PrayerTimesRequest.builder()
                                 .latitude(latitude)
                                 .longitude(longitude)
                                 .utcOffset(utcOffset)
                                 .date(startDate)
                                 .method(calculationMethod)
                                 .asrShadow(shadow)
                                 .fajrAngle(fajrAngle)
                                 .ishaAngle(ishaAngle)
                                 .ishaInterval(getIshaInterval())
                                 .build();
    }

    private @Nullable Duration getIshaInterval() {
        if (ishaIntervalInMinutes == null) {
            return null;
        }
        return Duration.ofMinutes(ishaIntervalInMinutes);
    }

    private ZoneOffset getZoneOffset() {
        return ZoneOffset.ofTotalSeconds((int) Math.round(utcOffset * 3600));
    }

    private static String formatOffset(ZoneOffset offset) {
        return offset.equals(ZoneOffset.UTC) ? "" : offset.getId();
    }

    private void printText(List<PrayerTimesResult> results, ZonedDateTime now) {
        PrintWriter out = getOut();
        out.printf(Locale.ROOT, "Prayer times for %s, %s (UTC%s), method %s, asr %s%n", latitude, longitude,
                formatOffset(getZoneOffset()), calculationMethod, shadow);
        for (PrayerTimesResult result : results) {
            out.println();
            out.println(result.getDate());
            for (Prayer prayer : Prayer.values()) {
                out.printf(Locale.ROOT, "  %-8s %s%n", prayer.getDisplayName(), result.getTime(prayer));
            }
            if (result.getDate().equals(now.toLocalDate())) {
                int minuteOfDay = now.getHour() * 60 + now.getMinute();
                Optional<Prayer> next = result.nextPrayer(minuteOfDay);
                next.ifPresent(prayer -> out.printf(Locale.ROOT, "  Next: %s at %s%n", prayer.getDisplayName(),
                        result.getTime(prayer)));
            }
        }
        out.flush();
    }

    private void printJson(List<PrayerTimesResult> results) {
        PrintWriter out = getOut();
        try {
            out.println(objectMapper.writeValueAsString(results));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        out.flush();
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out, true);
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertCalculationConfigurations();
        assertOutputConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (utcOffset < -12 || utcOffset > 14) {
            fail("--utc-offset must be between -12 and 14 hours");
        }
    }

    private void assertCalculationConfigurations() {
        try {
            calculationMethod = CalculationMethod.parse(method);
            shadow = AsrShadow.parse(asrShadow);
        } catch (InvalidPropertyValue e) {
            fail(e.getMessage());
        }
        if ((fajrAngle != null || ishaAngle != null) && calculationMethod != CalculationMethod.CUSTOM) {
            fail("--fajr-angle and --isha-angle require --method Custom");
        }
        assertAngle("--fajr-angle", fajrAngle);
        assertAngle("--isha-angle", ishaAngle);
        if (ishaIntervalInMinutes != null) {
            if (ishaIntervalInMinutes < 0) {
                fail("--isha-interval must be >= 0");
            }
            if (calculationMethod != CalculationMethod.UMM_AL_QURA && calculationMethod != CalculationMethod.CUSTOM) {
                fail("--isha-interval requires --method UmmAlQura or Custom");
            }
        }
    }

    private void assertAngle(String option, Double angle) {
        if (angle != null && (angle < -90 || angle > 0)) {
            fail(option + " must be between -90 and 0 degrees");
        }
    }

    private void assertOutputConfigurations() {
        if (days < 1) {
            fail("--days must be >= 1");
        }
        outputFormat = OutputFormat.parse(format);
        if (outputFormat == null) {
            fail("--format must be either 'text' or 'json'");
        }
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            fail("--date must be formatted as yyyy-MM-dd: '" + value + "'");
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    enum OutputFormat {
        TEXT,
        JSON;

        static OutputFormat parse(String value) {
            if (value == null) {
                return TEXT;
            }
            for (OutputFormat outputFormat : values()) {
                if (outputFormat.name().equals(value.trim().toUpperCase(Locale.ENGLISH))) {
                    return outputFormat;
                }
            }
            return null;
        }
    }
}
