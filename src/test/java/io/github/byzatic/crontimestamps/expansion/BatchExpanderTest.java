package io.github.byzatic.crontimestamps.expansion;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import io.github.byzatic.crontimestamps.expansion.window.EntryWindow;
import io.github.byzatic.crontimestamps.expansion.window.GlobalWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class BatchExpanderTest {
    ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) pool.shutdownNow();
    }

    @Test
    void badEntriesDoNotAbortTheBatch() {
        BatchExpander batch = new BatchExpander(new TimestampExpander(ExpansionConfig.defaults()));
        GlobalWindow w = new GlobalWindow(LocalDate.of(2024, 1, 1), 3);
        ExpansionReport report = batch.expandAll(List.of(
                new BatchExpander.Task("0 9 * * *", null, w),
                new BatchExpander.Task("0 99 * * *", null, w),
                new BatchExpander.Task("0 9 * *", null, w),
                new BatchExpander.Task("30 9 * * *", null, w)));

        assertEquals(4, report.results().size());
        assertTrue(report.results().get(0).isSuccess());
        assertInstanceOf(MalformedFieldException.class, report.results().get(1).error().orElseThrow());
        assertInstanceOf(MalformedFieldException.class, report.results().get(2).error().orElseThrow());
        assertTrue(report.results().get(3).isSuccess());
        assertEquals(2, report.failures().size());
        assertTrue(report.hasFailures());
        assertEquals(6, report.triggers().size());
        assertThrows(MalformedFieldException.class, report::triggersOrThrow);
    }

    @Test
    void windowErrorsStayWithTheirEntry() {
        BatchExpander batch = new BatchExpander(new TimestampExpander(ExpansionConfig.defaults()));
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        ExpansionReport report = batch.expandAll(List.of(
                new BatchExpander.Task("0 0 * * *", "inverted", new EntryWindow(start, start.minusDays(1), "inverted")),
                new BatchExpander.Task("0 0 * * *", "huge", new EntryWindow(start, start.plusYears(4), "huge")),
                new BatchExpander.Task("0 0 * * *", "ok", new EntryWindow(start, start.plusDays(1), "ok"))));

        assertInstanceOf(InvalidWindowException.class, report.results().get(0).error().orElseThrow());
        assertInstanceOf(WindowTooLargeException.class, report.results().get(1).error().orElseThrow());
        EntryResult ok = report.results().get(2);
        assertTrue(ok.isSuccess());
        assertEquals("ok", ok.id());
        assertEquals("ok", ok.windowKey());
        assertEquals(2, ok.triggers().size());
    }

    @Test
    void surroundingBlanksDoNotChangeTheWindowKey() {
        BatchExpander batch = new BatchExpander(new TimestampExpander(ExpansionConfig.defaults()));
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        EntryWindow w = new EntryWindow(start, start.plusHours(1));
        ExpansionReport report = batch.expandAll(List.of(
                new BatchExpander.Task(" 0 * * * * ", null, w),
                new BatchExpander.Task("0 * * * *", null, w)));

        assertEquals("0 * * * *-2024-01-01-2024-01-01", report.results().get(0).windowKey());
        assertEquals(report.results().get(1).windowKey(), report.results().get(0).windowKey());
        assertEquals(report.results().get(1).triggers(), report.results().get(0).triggers());
        assertEquals(2, report.triggers().size());
    }

    @Test
    void parallelRunMatchesSequentialRun() throws Exception {
        pool = Executors.newFixedThreadPool(4);
        ExpansionConfig config = ExpansionConfig.defaults();
        GlobalWindow w = new GlobalWindow(LocalDate.of(2024, 1, 1), 120);
        List<BatchExpander.Task> tasks = new ArrayList<>();
        String[] crons = {"*/15 * * * *", "0 12 15 * MON", "0 0 1 1 *", "bad", "5-29/2,31-59/4 */3 4/5 * TUE-WED,1-3"};
        for (String cron : crons) tasks.add(new BatchExpander.Task(cron, null, w));

        ExpansionReport sequential = new BatchExpander(new TimestampExpander(config)).expandAll(tasks);
        ExpansionReport parallel = new BatchExpander(new TimestampExpander(config), pool).expandAll(tasks);

        assertEquals(sequential.triggers(), parallel.triggers());
        for (int i = 0; i < crons.length; i++) {
            assertEquals(crons[i], parallel.results().get(i).cron());
            assertEquals(sequential.results().get(i).isSuccess(), parallel.results().get(i).isSuccess());
        }
    }

    @Test
    void sortedTriggersAreChronological() {
        BatchExpander batch = new BatchExpander(new TimestampExpander(ExpansionConfig.defaults()));
        GlobalWindow w = new GlobalWindow(LocalDate.of(2024, 1, 1), 2);
        ExpansionReport report = batch.expandAll(List.of(
                new BatchExpander.Task("0 18 * * *", null, w),
                new BatchExpander.Task("0 6 * * *", null, w)));
        List<TriggerInstant> sorted = report.sortedTriggers();
        assertEquals(4, sorted.size());
        assertEquals(LocalDateTime.of(2024, 1, 1, 6, 0), sorted.get(0).triggerAt());
        assertEquals(LocalDateTime.of(2024, 1, 1, 18, 0), sorted.get(1).triggerAt());
        assertEquals(LocalDateTime.of(2024, 1, 2, 18, 0), sorted.get(3).triggerAt());
    }
}
