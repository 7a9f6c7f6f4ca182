package com.raditha.usage.config;

import com.raditha.usage.policy.DiscardedNames;
import com.raditha.usage.policy.FieldExemptionPolicy;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Configuration for usage analysis.
 *
 * @param includeTests              Include sources under {@code src/test} in the analysis
 * @param excludePatterns           File patterns to exclude (glob format)
 * @param trackLambdaParameters     Report unused lambda parameters
 * @param trackLocalVariables       Report unused local variables
 * @param preservedFieldAnnotations Simple names of annotations that exempt a field
 * @param discardedNames            Names that mark a parameter or local as intentionally unused
 * @param parallelism               Number of worker threads used to process source units
 */
public record UsageConfig(
        boolean includeTests,
        List<String> excludePatterns,
        boolean trackLambdaParameters,
        boolean trackLocalVariables,
        Set<String> preservedFieldAnnotations,
        DiscardedNames discardedNames,
        int parallelism) {

    /**
     * Validate configuration.
     */
    public UsageConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        preservedFieldAnnotations = preservedFieldAnnotations == null
                ? Set.of()
                : Set.copyOf(preservedFieldAnnotations);
        if (discardedNames == null) {
            discardedNames = DiscardedNames.defaults();
        }
    }

    /**
     * Standard preset: every declaration kind is tracked, framework-managed fields are exempt.
     * Good default for most projects.
     */
    public static UsageConfig standard() {
        return new UsageConfig(
                false, // includeTests
                defaultExcludePatterns(),
                true, // trackLambdaParameters
                true, // trackLocalVariables
                FieldExemptionPolicy.DEFAULT_PRESERVED_ANNOTATIONS,
                DiscardedNames.defaults(),
                defaultParallelism());
    }

    /**
     * Strict preset: tests are analyzed too and no field annotation buys an exemption.
     */
    public static UsageConfig strict() {
        return new UsageConfig(
                true,
                defaultExcludePatterns(),
                true,
                true,
                Set.of(),
                new DiscardedNames(List.of("_"), Set.of()),
                defaultParallelism());
    }

    /**
     * Lenient preset: only fields and callable parameters, lambdas and locals are left alone.
     */
    public static UsageConfig lenient() {
        return new UsageConfig(
                false,
                defaultExcludePatterns(),
                false,
                false,
                FieldExemptionPolicy.DEFAULT_PRESERVED_ANNOTATIONS,
                DiscardedNames.defaults(),
                defaultParallelism());
    }

    public UsageConfig withParallelism(int threads) {
        return new UsageConfig(includeTests, excludePatterns, trackLambdaParameters, trackLocalVariables,
                preservedFieldAnnotations, discardedNames, threads);
    }

    public UsageConfig withTracking(boolean lambdaParameters, boolean localVariables) {
        return new UsageConfig(includeTests, excludePatterns, lambdaParameters, localVariables,
                preservedFieldAnnotations, discardedNames, parallelism);
    }

    /**
     * Default file exclusion patterns.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/generated/**",
                "**/.git/**");
    }

    static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Check if a file path is excluded, either by a pattern or because it is a test source
     * and tests are not included.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        if (!includeTests && (normalized.contains("/src/test/") || normalized.startsWith("src/test/"))) {
            return true;
        }
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards; a leading **&#47; also matches at the root.
     */
    static boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '*' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                boolean slashFollows = i + 2 < pattern.length() && pattern.charAt(i + 2) == '/';
                regex.append(slashFollows ? "(?:.*/)?" : ".*");
                i += slashFollows ? 3 : 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return path.matches(regex.toString());
    }
}
