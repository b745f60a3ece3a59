package czm.dabs_be.activity;

import czm.dabs_be.config.DabsProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ActivityInputNormalizerTest {

    // 23:30 UTC on 24 June is already 25 June in London
    private final Clock clock = Clock.fixed(Instant.parse("2025-06-24T23:30:00Z"), ZoneId.of("Europe/London"));
    private final ActivityInputNormalizer normalizer = new ActivityInputNormalizer(clock, new DabsProperties());

    @Test
    void acceptsIsoAndUkDates() {
        assertEquals(LocalDate.of(2025, 3, 4), normalizer.date("2025-03-04"));
        assertEquals(LocalDate.of(2025, 3, 4), normalizer.date(" 04/03/2025 "));
    }

    @Test
    void unusableDateFallsBackToSiteToday() {
        LocalDate today = LocalDate.of(2025, 6, 25);
        assertEquals(today, normalizer.date(null));
        assertEquals(today, normalizer.date("31/02/2025"));
        assertEquals(today, normalizer.date("tomorrow"));
    }

    @Test
    void timeDefaultsToEightOclock() {
        assertEquals(LocalTime.of(7, 30), normalizer.time("07:30"));
        assertEquals(LocalTime.of(13, 15, 20), normalizer.time("13:15:20"));
        assertEquals(LocalTime.of(8, 0), normalizer.time("25:99"));
        assertEquals(LocalTime.of(8, 0), normalizer.time(""));
    }

    @Test
    void priorityAndTextCoercion() {
        assertEquals(ActivityPriority.CRITICAL, normalizer.priority("Critical"));
        assertEquals(ActivityPriority.MEDIUM, normalizer.priority("urgent"));
        assertNull(normalizer.text("   "));
        assertEquals("Level 2", normalizer.text(" Level 2 "));
    }
}
