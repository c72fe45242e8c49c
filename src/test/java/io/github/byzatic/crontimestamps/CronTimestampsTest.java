package io.github.byzatic.crontimestamps;

import com.google.common.collect.ImmutableSet;
import io.github.byzatic.crontimestamps.base_exceptions.InvalidConfigurationException;
import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchPolicy;
import io.github.byzatic.crontimestamps.expansion.EntryResult;
import io.github.byzatic.crontimestamps.expansion.ExpansionReport;
import io.github.byzatic.crontimestamps.expansion.TriggerInstant;
import io.github.byzatic.crontimestamps.expansion.WindowEntry;
import io.github.byzatic.crontimestamps.expansion.window.EntryWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CronTimestampsTest {
    CronTimestamps cron;

    @AfterEach
    void tearDown() {
        if (cron != null) cron.close();
    }

    @Test
    @DisplayName("global window: duplicates collapse and results carry no key")
    void globalWindowExpandsDistinctCrons() throws Exception {
        cron = new CronTimestamps.Builder().build();
        ExpansionReport report = cron.expandGlobalWindow(
                List.of("0 9 * * *", "0 9 * * *", "0 0 1 1 *"), LocalDate.of(2024, 1, 1), 3, "vixie");

        assertEquals(2, report.results().size());
        Set<TriggerInstant> triggers = report.triggersOrThrow();
        assertEquals(4, triggers.size());
        assertTrue(triggers.contains(new TriggerInstant("0 9 * * *", null, LocalDateTime.of(2024, 1, 2, 9, 0))));
        assertTrue(triggers.contains(new TriggerInstant("0 0 1 1 *", null, LocalDateTime.of(2024, 1, 1, 0, 0))));
    }

    @Test
    void globalWindowErrorsAreThrownUpFront() {
        cron = new CronTimestamps.Builder().build();
        assertThrows(InvalidWindowException.class,
                () -> cron.expandGlobalWindow(List.of("* * * * *"), LocalDate.of(2024, 1, 1), -5));
        assertThrows(WindowTooLargeException.class,
                () -> cron.expandGlobalWindow(List.of("* * * * *"), LocalDate.of(2024, 1, 1), 2000));
    }

    @Test
    void unknownDayMatchModeIsRejected() {
        cron = new CronTimestamps.Builder().build();
        assertThrows(InvalidConfigurationException.class,
                () -> cron.expandGlobalWindow(List.of("* * * * *"), LocalDate.of(2024, 1, 1), 1, "either"));
        assertThrows(InvalidConfigurationException.class,
                () -> cron.expandPerEntryWindow(List.of(), 1095, "both"));
        assertThrows(InvalidConfigurationException.class,
                () -> new CronTimestamps.Builder().dayMatchMode("sometimes"));
    }

    @Test
    void perEntryWindowKeepsIdsAndIsolatesFailures() throws Exception {
        cron = new CronTimestamps.Builder().parallel().build();
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        ExpansionReport report = cron.expandPerEntryWindow(List.of(
                new WindowEntry("a", "*/10 * * * *", start, start.plusMinutes(30)),
                WindowEntry.of("*/10 * * * *", start, start.plusMinutes(20)),
                new WindowEntry("broken", "*/0 * * * *", start, start.plusMinutes(30)),
                new WindowEntry("backwards", "* * * * *", start, start.minusMinutes(1))));

        List<EntryResult> results = report.results();
        assertEquals(4, results.get(0).triggers().size());
        assertEquals("a", results.get(0).windowKey());
        assertEquals(3, results.get(1).triggers().size());
        assertEquals("*/10 * * * *-2024-01-01-2024-01-01", results.get(1).windowKey());
        assertInstanceOf(MalformedFieldException.class, results.get(2).error().orElseThrow());
        assertInstanceOf(InvalidWindowException.class, results.get(3).error().orElseThrow());

        // same cron and timestamps, different keys: both kept
        assertEquals(7, report.triggers().size());
    }

    @Test
    void perEntryMaxDateRangeOverridesConfig() {
        cron = new CronTimestamps.Builder().build();
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        List<WindowEntry> entries = List.of(new WindowEntry("m", "0 0 * * *", start, start.plusDays(10)));

        ExpansionReport narrow = cron.expandPerEntryWindow(entries, 5, DayMatchPolicy.VIXIE);
        assertInstanceOf(WindowTooLargeException.class, narrow.results().get(0).error().orElseThrow());

        ExpansionReport wide = cron.expandPerEntryWindow(entries);
        assertEquals(11, wide.results().get(0).triggers().size());
    }

    @Test
    void policyIsAppliedPerCall() throws Exception {
        cron = new CronTimestamps.Builder().dayMatchPolicy(DayMatchPolicy.INTERSECT).build();
        List<String> crons = List.of("0 12 15 * MON");
        LocalDate feb = LocalDate.of(2024, 2, 1);

        assertTrue(cron.expandGlobalWindow(crons, feb, 29).triggersOrThrow().isEmpty());
        assertEquals(5, cron.expandGlobalWindow(crons, feb, 29, DayMatchPolicy.UNION).triggersOrThrow().size());
        assertEquals(5, cron.expandGlobalWindow(crons, feb, 29, "vixie").triggersOrThrow().size());
    }

    @Test
    void singleExpressionAndStream() throws Exception {
        cron = new CronTimestamps.Builder().zone(ZoneId.of("Europe/Berlin")).build();
        EntryWindow w = new EntryWindow(LocalDateTime.of(2024, 6, 1, 0, 0), LocalDateTime.of(2024, 6, 1, 2, 0));
        ImmutableSet<TriggerInstant> eager = cron.expand("0 * * * *", w);
        assertEquals(3, eager.size());
        try (Stream<TriggerInstant> lazy = cron.stream("0 * * * *", w)) {
            assertEquals(eager, lazy.collect(Collectors.toSet()));
        }

        TriggerInstant first = eager.stream().min(TriggerInstant.CHRONOLOGICAL).orElseThrow();
        assertEquals(Instant.parse("2024-05-31T22:00:00Z"), first.toInstant(cron.zone()));
    }

    @Test
    void closedInstanceRefusesWork() {
        cron = new CronTimestamps.Builder().parallel().build();
        cron.close();
        assertThrows(IllegalStateException.class, () -> cron.expandPerEntryWindow(List.of()));
        cron.close();
    }
}
