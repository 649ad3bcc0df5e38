package at.sv.prayer.time;

import at.sv.prayer.PrayerTimesResult;

import java.time.LocalDate;

/**
 * Provides the prayer times of a fixed location and calculation convention for any date.
 */
public interface PrayerTimesProvider {

    PrayerTimesResult getPrayerTimes(LocalDate date);

    default String toDebugString(LocalDate date) {
        return getPrayerTimes(date).toDebugString();
    }

    void clearCache();
}
