package at.sv.prayer;

import java.util.Locale;

/**
 * The daily events in chronological order. Sunrise is not a prayer, but marks the end of the Fajr period.
 */
public enum Prayer {
    FAJR,
    SUNRISE,
    DHUHR,
    ASR,
    MAGHRIB,
    ISHA;

    public boolean isPrayer() {
        return this != SUNRISE;
    }

    public String getDisplayName() {
        String name = name().toLowerCase(Locale.ENGLISH);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
