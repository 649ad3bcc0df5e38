package at.sv.prayer.time;

import at.sv.prayer.PrayerTimesCalculator;
import at.sv.prayer.PrayerTimesRequest;
import at.sv.prayer.PrayerTimesResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

@Slf4j
public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private static final int MAX_CACHED_DAYS = 366;

    private final PrayerTimesCalculator calculator;
    private final PrayerTimesRequest template;
    private final Cache<LocalDate, PrayerTimesResult> cache;

    /**
     * @param calculator the calculator to delegate to
     * @param template   location and conventions; its date is replaced for every lookup
     */
    public PrayerTimesProviderImpl(PrayerTimesCalculator calculator, PrayerTimesRequest template) {
        this.calculator = calculator;
        this.template = template;
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DAYS)
                        .build();
    }

    @Override
    public PrayerTimesResult getPrayerTimes(LocalDate date) {
        return cache.get(date, this::calculate);
    }

    private PrayerTimesResult calculate(LocalDate date) {
        log.trace("Calculating prayer times for {}", date);
        return calculator.calculate(template.toBuilder().date(date).build());
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }
}
