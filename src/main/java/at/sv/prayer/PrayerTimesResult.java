package at.sv.prayer;

import at.sv.prayer.solar.Solution;
import at.sv.prayer.time.TimeFormatter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The six formatted event times of a day, plus the minutes since local midnight of each reachable event for
 * scheduling consumers.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"date", "fajr", "sunrise", "dhuhr", "asr", "maghrib", "isha", "minutesSinceMidnight"})
public final class PrayerTimesResult {

    private final LocalDate date;
    private final String fajr;
    private final String sunrise;
    private final String dhuhr;
    private final String asr;
    private final String maghrib;
    private final String isha;
    /**
     * Only contains reachable events.
     */
    private final Map<Prayer, Integer> minutesSinceMidnight;

    private PrayerTimesResult(LocalDate date, Map<Prayer, String> formatted, Map<Prayer, Integer> minutes) {
        this.date = date;
        this.fajr = formatted.get(Prayer.FAJR);
        this.sunrise = formatted.get(Prayer.SUNRISE);
        this.dhuhr = formatted.get(Prayer.DHUHR);
        this.asr = formatted.get(Prayer.ASR);
        this.maghrib = formatted.get(Prayer.MAGHRIB);
        this.isha = formatted.get(Prayer.ISHA);
        this.minutesSinceMidnight = Collections.unmodifiableMap(minutes);
    }

    /**
     * @param localHours the solved local time in hours of every {@link Prayer}
     */
    public static PrayerTimesResult of(LocalDate date, Map<Prayer, Solution> localHours) {
        EnumMap<Prayer, String> formatted = new EnumMap<>(Prayer.class);
        EnumMap<Prayer, Integer> minutes = new EnumMap<>(Prayer.class);
        for (Prayer prayer : Prayer.values()) {
            Solution hours = localHours.getOrDefault(prayer, Solution.UNREACHABLE);
            formatted.put(prayer, TimeFormatter.format(hours));
            if (hours.isReachable()) {
                minutes.put(prayer, TimeFormatter.toMinutes(hours.getValue()));
            }
        }
        return new PrayerTimesResult(date, formatted, minutes);
    }

    public String getTime(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
        };
    }

    public OptionalInt getMinutes(Prayer prayer) {
        Integer minutes = minutesSinceMidnight.get(prayer);
        return minutes == null ? OptionalInt.empty() : OptionalInt.of(minutes);
    }

    public boolean isReachable(Prayer prayer) {
        return minutesSinceMidnight.containsKey(prayer);
    }

    /**
     * @param minuteOfDay the current minutes since local midnight
     * @return the first reachable prayer strictly after the given minute, or empty once Isha has passed
     */
    public Optional<Prayer> nextPrayer(int minuteOfDay) {
        for (Prayer prayer : Prayer.values()) {
            Integer minutes = minutesSinceMidnight.get(prayer);
            if (prayer.isPrayer() && minutes != null && minutes > minuteOfDay) {
                return Optional.of(prayer);
            }
        }
        return Optional.empty();
    }

    public String toDebugString() {
        StringBuilder sb = new StringBuilder();
        sb.append(date);
        for (Prayer prayer : Prayer.values()) {
            sb.append('\n').append(prayer.name().toLowerCase(Locale.ENGLISH)).append(": ").append(getTime(prayer));
        }
        return sb.toString();
    }
}
