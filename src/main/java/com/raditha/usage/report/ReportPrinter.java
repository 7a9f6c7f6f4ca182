package com.raditha.usage.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.usage.analyzer.Finding;
import com.raditha.usage.analyzer.UsageReport;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.SiblingGroup;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a {@link UsageReport} as text or JSON.
 */
public class ReportPrinter {

    static final String VERSION = "1.0.0";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printText(UsageReport report) {
        out.print(report.getDetailedReport());
    }

    public void printJson(UsageReport report) throws JsonProcessingException {
        out.println(toJson(report));
    }

    /**
     * Render the report as pretty printed JSON.
     */
    public static String toJson(UsageReport report) throws JsonProcessingException {
        List<FindingDTO> findings = report.findings().stream()
                .map(ReportPrinter::toDTO)
                .toList();
        ReportDTO dto = new ReportDTO(
                VERSION,
                report.unitsAnalyzed(),
                report.declarationsTracked(),
                report.getFindingCount(),
                findings);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(dto);
    }

    private static FindingDTO toDTO(Finding finding) {
        Declaration declaration = finding.declaration();
        SiblingGroup sibling = declaration.siblingGroup();
        return new FindingDTO(
                finding.rule().getId(),
                declaration.kind().name(),
                declaration.name(),
                declaration.location().sourceUnit(),
                declaration.location().range().startLine(),
                declaration.location().range().startColumn(),
                finding.isWriteOnly(),
                finding.getMessage(),
                sibling == null ? null : new SiblingDTO(sibling.groupId(), sibling.index(), sibling.size()));
    }

    public record ReportDTO(String version, int filesAnalyzed, int declarationsTracked, int totalFindings,
                     List<FindingDTO> findings) {
    }

    public record FindingDTO(String rule, String kind, String name, String file, int line, int column,
                      boolean writeOnly, String message, SiblingDTO siblingGroup) {
    }

    public record SiblingDTO(String groupId, int index, int size) {
    }
}
