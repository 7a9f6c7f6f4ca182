package com.raditha.usage.analyzer;

import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.UsageRecord;

import java.util.Comparator;

/**
 * A declaration whose value is never read.
 *
 * @param rule        the reported rule
 * @param declaration the offending declaration
 * @param usage       what was observed for it; never a read
 */
public record Finding(UsageRule rule, Declaration declaration, UsageRecord usage) {

    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::declaration, Declaration.REPORT_ORDER)
            .thenComparing(Finding::rule);

    public static Finding of(Declaration declaration, UsageRecord usage) {
        return new Finding(UsageRule.forKind(declaration.kind()), declaration, usage);
    }

    /**
     * True when the declaration is assigned somewhere but never read.
     */
    public boolean isWriteOnly() {
        return usage.hasWrite();
    }

    public String getMessage() {
        return rule.message(declaration.name(), isWriteOnly());
    }

    public String getSourceUnit() {
        return declaration.location().sourceUnit();
    }
}
