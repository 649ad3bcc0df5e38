package at.sv.prayer.time;

import at.sv.prayer.solar.Solution;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders fractional local hours as 12-hour clock strings, e.g. "5:07 AM".
 */
public final class TimeFormatter {

    public static final String UNREACHABLE_PLACEHOLDER = "no time for this date/location";

    private static final int MINUTES_PER_DAY = 24 * 60;
    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{1,2}):(\\d{2})\\s*(AM|PM)$",
            Pattern.CASE_INSENSITIVE);

    private TimeFormatter() {
    }

    public static String format(Solution hours) {
        if (!hours.isReachable()) {
            return UNREACHABLE_PLACEHOLDER;
        }
        return format(hours.getValue());
    }

    /**
     * @param hours local hours; values outside [0, 24) are wrapped into the day
     */
    public static String format(double hours) {
        int minuteOfDay = toMinutes(hours);
        int hour = minuteOfDay / 60;
        int minute = minuteOfDay % 60;
        String period = hour >= 12 ? "PM" : "AM";
        int displayHour = hour % 12 == 0 ? 12 : hour % 12;
        return String.format(Locale.ROOT, "%d:%02d %s", displayHour, minute, period);
    }

    /**
     * Converts local hours to minutes since local midnight, using the same rounding as {@link #format(double)}.
     *
     * @return minutes in [0, 1440)
     */
    public static int toMinutes(double hours) {
        double wrapped = ((hours % 24) + 24) % 24;
        int hour = (int) Math.floor(wrapped);
        int minute = (int) Math.round((wrapped - hour) * 60);
        if (minute == 60) {
            minute = 0;
            hour = (hour + 1) % 24;
        }
        return (hour * 60 + minute) % MINUTES_PER_DAY;
    }

    /**
     * Inverse of {@link #format(double)}.
     *
     * @return the minutes since midnight, or empty for the unreachable placeholder or unparsable input
     */
    public static OptionalInt parseMinutes(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = CLOCK_TIME.matcher(text.trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour < 1 || hour > 12 || minute > 59) {
            return OptionalInt.empty();
        }
        boolean pm = matcher.group(3).equalsIgnoreCase("PM");
        int hourOfDay = hour % 12 + (pm ? 12 : 0);
        return OptionalInt.of(hourOfDay * 60 + minute);
    }
}
