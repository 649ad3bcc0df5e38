package at.sv.prayer.time;

import at.sv.prayer.solar.Solution;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.core.Is.is;

class TimeFormatterTest {

    private void assertFormat(double hours, String expected) {
        assertThat("Formatted time differs for " + hours, TimeFormatter.format(hours), is(expected));
    }

    @Test
    void midnightAndNoon_twelveHourClock() {
        assertFormat(0, "12:00 AM");
        assertFormat(12, "12:00 PM");
    }

    @Test
    void regularTimes_zeroPaddedMinutes() {
        assertFormat(5.1, "5:06 AM");
        assertFormat(13.5, "1:30 PM");
        assertFormat(23.75, "11:45 PM");
    }

    @Test
    void negativeOrBeyondDay_wrapsIntoDay() {
        assertFormat(-1, "11:00 PM");
        assertFormat(25.25, "1:15 AM");
        assertFormat(-24.5, "11:30 PM");
    }

    @Test
    void roundedMinuteOverflow_carriesIntoHour() {
        assertFormat(11.9999, "12:00 PM");
        assertFormat(23.9999, "12:00 AM");
        assertFormat(6.995, "7:00 AM");
    }

    @Test
    void unreachable_placeholder() {
        assertThat(TimeFormatter.format(Solution.UNREACHABLE), is("no time for this date/location"));
    }

    @Test
    void reachableSolution_formatsValue() {
        assertThat(TimeFormatter.format(Solution.of(18.25)), is("6:15 PM"));
    }

    @Test
    void toMinutes_sameRoundingAsFormat() {
        assertThat(TimeFormatter.toMinutes(12.2179), is(733));
        assertThat(TimeFormatter.toMinutes(23.9999), is(0));
        assertThat(TimeFormatter.toMinutes(-0.5), is(1410));
    }

    @Test
    void parseMinutes_validTimes() {
        assertThat(TimeFormatter.parseMinutes("12:00 AM"), is(OptionalInt.of(0)));
        assertThat(TimeFormatter.parseMinutes("12:30 PM"), is(OptionalInt.of(750)));
        assertThat(TimeFormatter.parseMinutes("7:05 pm"), is(OptionalInt.of(19 * 60 + 5)));
    }

    @Test
    void parseMinutes_placeholderOrInvalid_empty() {
        assertThat(TimeFormatter.parseMinutes(TimeFormatter.UNREACHABLE_PLACEHOLDER), is(OptionalInt.empty()));
        assertThat(TimeFormatter.parseMinutes("13:00 PM"), is(OptionalInt.empty()));
        assertThat(TimeFormatter.parseMinutes("5:60 AM"), is(OptionalInt.empty()));
        assertThat(TimeFormatter.parseMinutes(null), is(OptionalInt.empty()));
    }

    @Test
    void formatThenParse_reproducesMinuteWithinRounding() {
        for (int i = 0; i < 24 * 60; i += 7) {
            double hours = (i + 0.37) / 60.0;

            int parsed = TimeFormatter.parseMinutes(TimeFormatter.format(hours)).orElseThrow();

            double difference = Math.abs(parsed - hours * 60);
            double circularDifference = Math.min(difference, 24 * 60 - difference);
            assertThat("Round trip differs for " + hours, circularDifference, lessThanOrEqualTo(1.0));
        }
    }
}
