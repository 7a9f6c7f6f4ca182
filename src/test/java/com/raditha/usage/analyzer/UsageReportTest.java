package com.raditha.usage.analyzer;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.TestSites;
import com.raditha.usage.model.UsageRecord;
import com.raditha.usage.tracker.TrackerDiagnostics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UsageReportTest {

    private static Finding finding(int id, DeclarationSite site, boolean written) {
        return Finding.of(Declaration.from(new DeclarationId(id), site), new UsageRecord(false, written));
    }

    private static UsageReport report(List<Finding> findings, TrackerDiagnostics.Snapshot diagnostics) {
        return new UsageReport(findings, 3, 12, diagnostics, UsageConfig.standard());
    }

    private final List<Finding> findings = List.of(
            finding(1, TestSites.privateField("A", "count", 4), true),
            finding(2, TestSites.parameter("A.java", "flag", 9), false),
            finding(3, TestSites.local("B.java", "tmp", 2), false));

    @Test
    void testQueries() {
        UsageReport report = report(findings, TrackerDiagnostics.Snapshot.EMPTY);

        assertTrue(report.hasFindings());
        assertEquals(3, report.getFindingCount());
        assertEquals(1, report.getFindings(UsageRule.UNUSED_PARAMETER).size());
        assertEquals(1, report.getFindings(DeclarationKind.LOCAL_VARIABLE).size());
        assertTrue(report.getFindings(DeclarationKind.LAMBDA_PARAMETER).isEmpty());

        Map<String, List<Finding>> byUnit = report.getFindingsByUnit();
        assertEquals(List.of("A.java", "B.java"), List.copyOf(byUnit.keySet()));
        assertEquals(2, byUnit.get("A.java").size());
    }

    @Test
    void testSummary() {
        UsageReport report = report(findings, TrackerDiagnostics.Snapshot.EMPTY);

        assertEquals("Found 3 unused declarations (1 fields, 1 parameters, 1 locals) among 12 tracked in 3 files",
                report.getSummary());
    }

    @Test
    void testDetailedReport() {
        String text = report(findings, TrackerDiagnostics.Snapshot.EMPTY).getDetailedReport();

        assertTrue(text.contains("UNUSED DECLARATION REPORT"));
        assertTrue(text.contains("USW001 L4:5     Private field 'count' is assigned but its value is never read"), text);
        assertTrue(text.contains("USW002 L9:5     Parameter 'flag' is never used"), text);
        assertTrue(text.indexOf("A.java") < text.indexOf("B.java"));
        assertFalse(text.contains("Diagnostics:"));
    }

    @Test
    void testDetailedReportWithoutFindings() {
        String text = report(List.of(), new TrackerDiagnostics.Snapshot(2, 0, 1)).getDetailedReport();

        assertFalse(text.contains("USW"));
        assertTrue(text.contains("No unused declarations found."));
        assertTrue(text.contains("Diagnostics: 2 dropped occurrences, 1 conflicting declarations"));
    }

    @Test
    void testFindingsAreCopied() {
        UsageReport report = report(findings, TrackerDiagnostics.Snapshot.EMPTY);
        assertThrows(UnsupportedOperationException.class, () -> report.findings().clear());
    }
}
