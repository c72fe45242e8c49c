package io.github.byzatic.crontimestamps.expansion;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidConfigurationException;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchPolicy;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ExpansionConfigTest {

    @Test
    void defaults() {
        ExpansionConfig c = ExpansionConfig.defaults();
        assertEquals(1095, c.maxDateRange());
        assertEquals(DayMatchPolicy.VIXIE, c.dayMatchPolicy());
        assertEquals(ZoneOffset.UTC, c.zone());
        assertEquals(1_000_000L, c.maxTriggers());
    }

    @Test
    void toBuilderCopiesEverything() throws Exception {
        ExpansionConfig c = new ExpansionConfig.Builder()
                .maxDateRange(30)
                .dayMatchMode("contains")
                .zone(ZoneId.of("Asia/Tokyo"))
                .maxTriggers(500)
                .build();
        ExpansionConfig copy = c.toBuilder().build();
        assertEquals(30, copy.maxDateRange());
        assertEquals(DayMatchPolicy.CONTAINS, copy.dayMatchPolicy());
        assertEquals(ZoneId.of("Asia/Tokyo"), copy.zone());
        assertEquals(500, copy.maxTriggers());
    }

    @Test
    void rejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> new ExpansionConfig.Builder().maxDateRange(0));
        assertThrows(IllegalArgumentException.class, () -> new ExpansionConfig.Builder().maxTriggers(0));
        assertThrows(InvalidConfigurationException.class, () -> new ExpansionConfig.Builder().dayMatchMode("xor"));
    }
}
