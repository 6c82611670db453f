package in.fundpulse.service.market;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Market Hours Gate - decides whether real-time repricing is meaningful.
 *
 * Trading windows (exchange local time, weekdays only):
 *   Morning:   09:30 - 11:30
 *   Afternoon: 13:00 - 15:00
 * Both endpoints are inclusive at minute resolution, so 15:00:59 is still open.
 *
 * Holidays are not modelled; on a holiday the gate reports open and the refresh
 * simply finds no live session.
 */
public final class MarketHoursGate {
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Shanghai");

    private static final LocalTime MORNING_START = LocalTime.of(9, 30);
    private static final LocalTime MORNING_END = LocalTime.of(11, 30);
    private static final LocalTime AFTERNOON_START = LocalTime.of(13, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(15, 0);

    private final Clock clock;

    public MarketHoursGate() {
        this(Clock.system(DEFAULT_ZONE));
    }

    /**
     * @param clock supplies both the current instant and the exchange time zone
     */
    public MarketHoursGate(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check if the market is open now.
     */
    public boolean isOpen() {
        return isOpen(ZonedDateTime.now(clock));
    }

    public boolean isOpen(ZonedDateTime time) {
        return isOpen(time.withZoneSameInstant(clock.getZone()).toLocalDateTime());
    }

    /**
     * Check a wall-clock time already expressed in exchange local time.
     */
    public boolean isOpen(LocalDateTime localTime) {
        DayOfWeek day = localTime.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }

        LocalTime minute = localTime.toLocalTime().withSecond(0).withNano(0);
        return within(minute, MORNING_START, MORNING_END) || within(minute, AFTERNOON_START, AFTERNOON_END);
    }

    public ZoneId getZone() {
        return clock.getZone();
    }

    private static boolean within(LocalTime time, LocalTime start, LocalTime end) {
        return !time.isBefore(start) && !time.isAfter(end);
    }
}
