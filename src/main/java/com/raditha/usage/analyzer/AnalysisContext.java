package com.raditha.usage.analyzer;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.extraction.BindingKeys;
import com.raditha.usage.extraction.CallableCollector;
import com.raditha.usage.extraction.ContractDetector;
import com.raditha.usage.extraction.DeclarationSites;
import com.raditha.usage.extraction.FieldResolver;
import com.raditha.usage.extraction.LocalScopeResolver;
import com.raditha.usage.extraction.SourceUnitIndex;
import com.raditha.usage.extraction.SymbolResolution;
import com.raditha.usage.policy.ExemptionPolicies;
import com.raditha.usage.tracker.DeclarationRegistry;

/**
 * Collaborators shared by the analyzers of one run.
 */
class AnalysisContext {

    private final UsageConfig config;
    private final SourceUnitIndex units;
    private final DeclarationRegistry registry = new DeclarationRegistry();
    private final ExemptionPolicies policies;
    private final LocalScopeResolver scopes = new LocalScopeResolver();
    private final BindingKeys keys;
    private final DeclarationSites sites;
    private final FieldResolver fields;
    private final CallableCollector callables;

    AnalysisContext(UsageConfig config, SourceUnitIndex units) {
        this.config = config;
        this.units = units;
        this.policies = new ExemptionPolicies(config);
        this.keys = new BindingKeys(units);
        this.sites = new DeclarationSites(units, keys);

        SymbolResolution symbols = new SymbolResolution();
        this.fields = new FieldResolver(keys, scopes, symbols);
        this.callables = new CallableCollector(new ContractDetector(symbols));
    }

    UsageConfig config() {
        return config;
    }

    SourceUnitIndex units() {
        return units;
    }

    DeclarationRegistry registry() {
        return registry;
    }

    ExemptionPolicies policies() {
        return policies;
    }

    LocalScopeResolver scopes() {
        return scopes;
    }

    BindingKeys keys() {
        return keys;
    }

    DeclarationSites sites() {
        return sites;
    }

    FieldResolver fields() {
        return fields;
    }

    CallableCollector callables() {
        return callables;
    }
}
