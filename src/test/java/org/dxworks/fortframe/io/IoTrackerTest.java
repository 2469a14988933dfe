package org.dxworks.fortframe.io;

import org.approvaltests.Approvals;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranSubroutine;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import static org.dxworks.fortframe.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.fortframe.TestUtils.SAMPLES;
import static org.dxworks.fortframe.TestUtils.parseFree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IoTrackerTest {

    private static FortranSubroutine firstSubroutine(String sample) throws IOException {
        return parseFree(Files.readString(SAMPLES.resolve(sample))).subroutines.get(0);
    }

    @Test
    void summarizes_open_read_close_session() throws IOException {
        FortranSubroutine loader = firstSubroutine("io_sample.f90");

        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(loader.ioSummary()));
    }

    @Test
    void separates_headers_from_data_and_keeps_branch_context() throws IOException {
        FortranSubroutine reader = firstSubroutine("io_conditions.f90");
        Map<String, FileIoReport> summary = reader.ioSummary();

        FileIoReport report = summary.get("input.dat");
        assertEquals("20", report.summary.unit);
        assertEquals(List.of("titldum"), report.summary.headers);
        assertEquals(1, report.summary.dataReads.size());
        assertEquals(List.of("a", "b"), report.summary.dataReads.get(0).columns);

        List<IoOperation> timeline = report.timeline;
        assertEquals(List.of("open", "read", "read", "close"),
                List.of(timeline.get(0).kind, timeline.get(1).kind, timeline.get(2).kind, timeline.get(3).kind));
        assertNull(timeline.get(1).condition);
        IoCondition branch = timeline.get(2).condition;
        assertEquals("if (flag)", branch.text);
        assertEquals("if", branch.type);
        assertEquals(7, branch.line);
        assertNull(timeline.get(3).condition);
    }

    @Test
    void one_line_if_covers_only_its_action() {
        IoTracker tracker = new IoTracker();
        IoStatementParser.observe("open(unit=30, file=\"log.txt\")", 1, tracker);
        IoStatementParser.observe("if (verbose) write(30, *) step, energy", 2, tracker);
        IoStatementParser.observe("write(30, *) step, energy", 3, tracker);
        IoStatementParser.observe("close(30)", 4, tracker);

        FileIoReport report = tracker.summarize().get("log.txt");
        assertEquals("30", report.summary.unit);
        assertEquals(2, report.summary.dataWrites.get(0).rows);
        assertEquals("if (verbose)", report.timeline.get(1).condition.text);
        assertNull(report.timeline.get(2).condition);
    }

    @Test
    void select_case_branches_replace_each_other() {
        IoTracker tracker = new IoTracker();
        IoStatementParser.observe("open(40, file='mode.dat')", 1, tracker);
        IoStatementParser.observe("select case (mode)", 2, tracker);
        IoStatementParser.observe("case (1)", 3, tracker);
        IoStatementParser.observe("read(40, *) alpha, beta", 4, tracker);
        IoStatementParser.observe("case default", 5, tracker);
        IoStatementParser.observe("rewind 40", 6, tracker);
        IoStatementParser.observe("end select", 7, tracker);
        IoStatementParser.observe("close(40)", 8, tracker);

        List<IoOperation> timeline = tracker.operationsTimeline().get("mode.dat");
        assertEquals("case (1)", timeline.get(1).condition.text);
        assertEquals("rewind", timeline.get(2).kind);
        assertEquals("case default", timeline.get(2).condition.text);
        assertNull(timeline.get(3).condition);
        assertTrue(tracker.conditions().isEmpty());
    }

    @Test
    void write_to_unopened_unit_gets_a_synthetic_session() {
        IoTracker tracker = new IoTracker();
        WarningLog warnings = WarningLog.quiet();
        IoStatementParser.observe("write(6, *) total", 3, tracker);
        IoStatementParser.observe("read(7, *) ignored", 4, tracker);
        tracker.finish(warnings, "main.f90", 1, "report");

        Map<String, FileIoReport> summary = tracker.summarize();
        assertEquals(List.of("unit_6"), List.copyOf(summary.keySet()));
        assertEquals(List.of("total"), summary.get("unit_6").summary.dataWrites.get(0).columns);
        assertEquals(1, tracker.getStragglers().size());
        assertEquals(1, warnings.ofKind(WarningKind.IO_TRACKER).size());
    }

    @Test
    void reopening_a_unit_archives_the_previous_session() {
        IoTracker tracker = new IoTracker();
        IoStatementParser.observe("open(11, file='first.txt')", 1, tracker);
        IoStatementParser.observe("open(11, file='second.txt')", 2, tracker);
        IoStatementParser.observe("close(11)", 3, tracker);

        assertEquals(2, tracker.completedSessions().size());
        assertEquals(List.of("first.txt", "second.txt"), List.copyOf(tracker.summarize().keySet()));
    }

    @Test
    void file_keys_are_normalized() {
        assertEquals("a.txt", IoTracker.normalizeFileKey("'a.txt'"));
        assertEquals("out.txt", IoTracker.normalizeFileKey("\"out.txt\""));
        assertEquals("name", IoTracker.normalizeFileKey("'data/' // trim(name)"));
        assertEquals("fname", IoTracker.normalizeFileKey("adjustl(trim(fname))"));
        assertEquals("<unknown>", IoTracker.normalizeFileKey(null));
        assertEquals("<unknown>", IoTracker.normalizeFileKey("  "));
    }

    @Test
    void quoted_operand_after_concatenation_loses_its_quotes() {
        assertEquals("out.txt", IoTracker.normalizeFileKey("trim(adjustl(dir))//'out.txt'"));
        assertEquals("log.dat", IoTracker.normalizeFileKey("prefix // \"log.dat\""));
    }

    @Test
    void unit_is_read_from_positional_and_keyword_forms() {
        assertEquals("10", IoStatementParser.unitOf("(10, file='a.txt')"));
        assertEquals("iu", IoStatementParser.unitOf("(unit=iu, fmt=*)"));
        assertEquals("5", IoStatementParser.unitOf("5"));
        assertEquals("'x.dat'", IoStatementParser.filenameExpression("open(1, file='x.dat', status='old')"));
    }
}
