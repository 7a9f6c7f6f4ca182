package com.raditha.usage.analyzer;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.tracker.TrackerDiagnostics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Report containing the unused declarations of an analysis run, in report order.
 */
public record UsageReport(
        List<Finding> findings,
        int unitsAnalyzed,
        int declarationsTracked,
        TrackerDiagnostics.Snapshot diagnostics,
        UsageConfig config) {

    public UsageReport {
        findings = List.copyOf(findings);
    }

    /**
     * Check if any unused declarations were found.
     */
    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public int getFindingCount() {
        return findings.size();
    }

    /**
     * Get findings of a single rule.
     */
    public List<Finding> getFindings(UsageRule rule) {
        return findings.stream()
                .filter(f -> f.rule() == rule)
                .toList();
    }

    /**
     * Get findings for declarations of a single kind.
     */
    public List<Finding> getFindings(DeclarationKind kind) {
        return findings.stream()
                .filter(f -> f.declaration().kind() == kind)
                .toList();
    }

    /**
     * Findings grouped by source unit, units in report order.
     */
    public Map<String, List<Finding>> getFindingsByUnit() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::getSourceUnit, LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d unused declarations (%d fields, %d parameters, %d locals) among %d tracked in %d files",
                findings.size(),
                getFindings(UsageRule.UNUSED_PRIVATE_FIELD).size(),
                getFindings(UsageRule.UNUSED_PARAMETER).size(),
                getFindings(UsageRule.UNUSED_LOCAL_VARIABLE).size(),
                declarationsTracked,
                unitsAnalyzed);
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("UNUSED DECLARATION REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Include tests: ").append(config.includeTests()).append("\n");
        sb.append("Lambda parameters: ").append(config.trackLambdaParameters() ? "tracked" : "ignored").append("\n");
        sb.append("Local variables: ").append(config.trackLocalVariables() ? "tracked" : "ignored").append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (findings.isEmpty()) {
            sb.append("No unused declarations found.\n");
        } else {
            for (Map.Entry<String, List<Finding>> entry : getFindingsByUnit().entrySet()) {
                sb.append(entry.getKey()).append("\n");
                sb.append("-".repeat(80)).append("\n");
                for (Finding finding : entry.getValue()) {
                    sb.append(String.format("  %s %-8s %s%n",
                            finding.rule().getId(),
                            finding.declaration().location().range().toDisplayString(),
                            finding.getMessage()));
                }
                sb.append("\n");
            }
        }

        if (!diagnostics.isClean()) {
            sb.append(String.format("Diagnostics: %d dropped occurrences, %d conflicting declarations%n",
                    diagnostics.droppedOccurrences(), diagnostics.conflictingDeclarations()));
        }
        return sb.toString();
    }
}
