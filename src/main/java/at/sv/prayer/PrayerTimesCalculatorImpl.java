package at.sv.prayer;

import at.sv.prayer.solar.AsrAltitude;
import at.sv.prayer.solar.EventTimeSolver;
import at.sv.prayer.solar.SolarPosition;
import at.sv.prayer.solar.Solution;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;

@Slf4j
public final class PrayerTimesCalculatorImpl implements PrayerTimesCalculator {

    @Override
    public PrayerTimesResult calculate(PrayerTimesRequest request) {
        MethodAngles angles = request.getAngles();
        double lat = request.getLatitude();
        double lng = request.getLongitude();
        double utcOffset = request.getUtcOffset();
        LocalDate date = request.getDate();

        EnumMap<Prayer, Solution> times = new EnumMap<>(Prayer.class);
        times.put(Prayer.FAJR, solve(Prayer.FAJR, request, angles.fajrAngle(), true));
        times.put(Prayer.SUNRISE, solve(Prayer.SUNRISE, request, EventTimeSolver.HORIZON_ALTITUDE, true));
        times.put(Prayer.DHUHR, Solution.of(EventTimeSolver.solarNoon(lng, utcOffset, date)));

        SolarPosition noonPosition = EventTimeSolver.positionAtNoon(date, utcOffset);
        double asrAltitude = AsrAltitude.of(lat, noonPosition.declination(), request.getAsrShadow().getFactor());
        times.put(Prayer.ASR, solve(Prayer.ASR, request, asrAltitude, false));

        Solution maghrib = solve(Prayer.MAGHRIB, request, EventTimeSolver.HORIZON_ALTITUDE, false);
        times.put(Prayer.MAGHRIB, maghrib);
        times.put(Prayer.ISHA, solveIsha(request, angles.isha(), maghrib));

        log.trace("Solved {} for lat={}, lng={}, offset={}, method={}: {}", date, lat, lng, utcOffset,
                request.getMethod(), times);
        return PrayerTimesResult.of(date, times);
    }

    private Solution solveIsha(PrayerTimesRequest request, IshaRule rule, Solution maghrib) {
        if (rule.isFixedInterval()) {
            double intervalInHours = toHours(rule.intervalAfterMaghrib());
            return maghrib.map(maghribTime -> maghribTime + intervalInHours);
        }
        return solve(Prayer.ISHA, request, rule.angle(), false);
    }

    private Solution solve(Prayer prayer, PrayerTimesRequest request, double altitude, boolean beforeNoon) {
        Solution time = EventTimeSolver.solve(request.getLatitude(), request.getLongitude(), request.getUtcOffset(),
                request.getDate(), altitude, beforeNoon);
        if (!time.isReachable()) {
            log.debug("{} unreachable on {} at lat={}: sun does not reach {}°", prayer.getDisplayName(),
                    request.getDate(), request.getLatitude(), altitude);
        }
        return time;
    }

    private static double toHours(Duration duration) {
        return duration.toSeconds() / 3600.0;
    }
}
