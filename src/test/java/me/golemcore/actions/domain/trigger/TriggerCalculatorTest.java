package me.golemcore.actions.domain.trigger;

import me.golemcore.actions.domain.exception.InvalidScheduleException;
import me.golemcore.actions.domain.exception.UnsupportedScheduleTypeException;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TriggerCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private TriggerCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new TriggerCalculator(Clock.fixed(NOW, ZoneOffset.UTC), new ActionsProperties());
    }

    @Test
    void shouldDefaultCronToDailyAtNine() {
        ActionTrigger trigger = calculator.calculate("cron", Map.of());

        CronActionTrigger cron = assertInstanceOf(CronActionTrigger.class, trigger);
        assertEquals("0 9 * * *", cron.getExpression());
        assertEquals(ZoneOffset.UTC, cron.getZone());
    }

    @Test
    void shouldAcceptScheduleTypeInAnyCase() {
        assertInstanceOf(CronActionTrigger.class,
                calculator.calculate(" CRON ", Map.of("expression", "0 12 * * *")));
    }

    @Test
    void shouldDefaultIntervalToSixtyMinutes() {
        IntervalActionTrigger trigger = assertInstanceOf(IntervalActionTrigger.class,
                calculator.calculate("interval", null));

        assertEquals(Duration.ofMinutes(60), trigger.getPeriod());
    }

    @Test
    void shouldConvertIntervalUnits() {
        assertEquals(Duration.ofSeconds(30), period(Map.of("value", 30, "unit", "seconds")));
        assertEquals(Duration.ofHours(2), period(Map.of("value", "2", "unit", "Hours")));
        assertEquals(Duration.ofDays(14), period(Map.of("value", 2, "unit", "weeks")));
        assertEquals(Duration.ofMinutes(5), period(Map.of("value", 5.0)));
    }

    @Test
    void shouldRejectInvalidIntervals() {
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("interval", Map.of("value", 0, "unit", "minutes")));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("interval", Map.of("value", -3)));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("interval", Map.of("value", 1.5)));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("interval", Map.of("value", "soon")));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("interval", Map.of("value", 1, "unit", "fortnights")));
    }

    @Test
    void shouldParseOneShotDateTimes() {
        assertEquals(Instant.parse("2026-03-05T07:00:00Z"),
                runAt(Map.of("datetime", "2026-03-05T09:00:00+02:00")));
        assertEquals(Instant.parse("2026-03-05T09:00:00Z"), runAt(Map.of("datetime", "2026-03-05T09:00:00Z")));
        assertEquals(Instant.parse("2026-03-05T09:30:00Z"), runAt(Map.of("run_at", "2026-03-05 09:30")));
        assertEquals(Instant.parse("2026-03-05T00:00:00Z"), runAt(Map.of("datetime", "2026-03-05")));
    }

    @Test
    void shouldReadLocalDateTimesInConfiguredZone() {
        ActionsProperties properties = new ActionsProperties();
        properties.getScheduler().setTimeZone("Europe/Berlin");
        TriggerCalculator berlin = new TriggerCalculator(Clock.fixed(NOW, ZoneOffset.UTC), properties);

        assertEquals(ZoneId.of("Europe/Berlin"), berlin.getZone());
        assertEquals(Instant.parse("2026-03-05T08:00:00Z"), berlin.parseInstant("2026-03-05T09:00:00"));
    }

    @Test
    void shouldRejectInvalidOneShots() {
        assertThrows(InvalidScheduleException.class, () -> calculator.calculate("once", Map.of()));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("once", Map.of("datetime", " ")));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.calculate("once", Map.of("datetime", "next tuesday")));
    }

    @Test
    void shouldRejectUnknownScheduleType() {
        assertThrows(UnsupportedScheduleTypeException.class, () -> calculator.calculate("hourly", Map.of()));
        assertThrows(UnsupportedScheduleTypeException.class, () -> calculator.calculate((String) null, Map.of()));
    }

    private Duration period(Map<String, Object> config) {
        return ((IntervalActionTrigger) calculator.calculate("interval", config)).getPeriod();
    }

    private Instant runAt(Map<String, Object> config) {
        return ((OnceActionTrigger) calculator.calculate("once", config)).getRunAt();
    }
}
