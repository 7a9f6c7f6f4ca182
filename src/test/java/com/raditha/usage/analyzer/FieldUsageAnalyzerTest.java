package com.raditha.usage.analyzer;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.model.DeclarationKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldUsageAnalyzerTest {

    private final UsageAnalyzer analyzer = new UsageAnalyzer(UsageConfig.standard().withParallelism(2));

    private List<Finding> fieldFindings(String code) {
        return analyzer.analyzeSources(Map.of("Sample.java", code)).getFindings(DeclarationKind.FIELD);
    }

    private static List<String> names(List<Finding> findings) {
        return findings.stream().map(f -> f.declaration().name()).toList();
    }

    @Test
    void testFieldNeverRead() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int x = 5;
                }
                """);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(UsageRule.UNUSED_PRIVATE_FIELD, finding.rule());
        assertFalse(finding.isWriteOnly(), "An initializer is not a write");
        assertEquals("Private field 'x' is declared but never used", finding.getMessage());
        assertEquals("Sample.java", finding.getSourceUnit());
        assertEquals(2, finding.declaration().location().range().startLine());
    }

    @Test
    void testFieldOnlyAssigned() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int x;
                    void set(int v) { x = v; }
                    void reset() { this.x = 0; }
                }
                """);

        assertEquals(List.of("x"), names(findings));
        assertTrue(findings.get(0).isWriteOnly());
        assertEquals("Private field 'x' is assigned but its value is never read", findings.get(0).getMessage());
    }

    @Test
    void testIncrementStatementIsNotARead() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int counter;
                    private int total;
                    void tick() {
                        counter++;
                        total += 5;
                    }
                }
                """);

        assertEquals(List.of("counter", "total"), names(findings));
        assertTrue(findings.stream().allMatch(Finding::isWriteOnly));
    }

    @Test
    void testConsumedIncrementIsARead() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int next;
                    int allocate() { return next++; }
                }
                """);

        assertTrue(findings.isEmpty(), "The incremented value is returned");
    }

    @Test
    void testFieldReadInAnotherMember() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int x;
                    private final String label;

                    Sample(String label) { this.label = label; }

                    int get() { return x; }

                    @Override
                    public String toString() { return this.label; }
                }
                """);

        assertTrue(findings.isEmpty(), names(findings).toString());
    }

    @Test
    void testFieldReadFromNestedTypes() {
        List<Finding> findings = fieldFindings("""
                class Outer {
                    private int secret;
                    private int shared;

                    class Inner {
                        int peek() { return Outer.this.secret; }
                    }

                    static class Node {
                        private int value;
                        private Node next;

                        int sum() { return next == null ? 0 : next.value; }
                    }

                    Runnable task = new Runnable() {
                        public void run() { System.out.println(shared); }
                    };
                }
                """);

        assertTrue(findings.isEmpty(), names(findings).toString());
    }

    @Test
    void testFieldCapturedByLambda() {
        List<Finding> findings = fieldFindings("""
                import java.util.ArrayList;
                import java.util.List;
                import java.util.function.Consumer;

                class Sample {
                    private final List<String> seen = new ArrayList<>();

                    void register(Consumer<Consumer<String>> bus) {
                        bus.accept(event -> seen.add(event));
                    }
                }
                """);

        assertTrue(findings.isEmpty(), names(findings).toString());
    }

    @Test
    void testFieldReadThroughSuperFromNestedSubclass() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int secret = 4;

                    static class Child extends Sample {
                        int peek() { return super.secret; }
                    }

                    static int use() { return new Child().peek(); }
                }
                """);

        assertTrue(findings.isEmpty(), names(findings).toString());
    }

    @Test
    void testShadowedFieldIsNotRead() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int size;

                    int twice(int size) { return size * 2; }
                }
                """);

        assertEquals(List.of("size"), names(findings));
    }

    @Test
    void testUnresolvableAccessCountsAsRead() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int size;

                    int of(com.example.Unknown other) { return other.size; }
                }
                """);

        assertTrue(findings.isEmpty(), "Ambiguous occurrences keep candidates alive");
    }

    @Test
    void testExemptFields() {
        List<Finding> findings = fieldFindings("""
                import lombok.Getter;

                class Sample implements java.io.Serializable {
                    private static final long serialVersionUID = 1L;
                    private static final int LIMIT = 10;
                    @Getter private String label;
                    @Autowired private Object service;
                    protected int inherited;
                    int packageVisible;
                    public String exposed;
                    private int unread;
                }
                """);

        assertEquals(List.of("unread"), names(findings));
    }

    @Test
    void testStrictPresetDropsAnnotationExemption() {
        UsageAnalyzer strict = new UsageAnalyzer(UsageConfig.strict().withParallelism(1));
        UsageReport report = strict.analyzeSources(Map.of("Sample.java", """
                class Sample {
                    @Autowired private Object service;
                }
                """));

        assertEquals(1, report.getFindings(UsageRule.UNUSED_PRIVATE_FIELD).size());
    }

    @Test
    void testMultiDeclaratorFieldKeepsSiblingGroup() {
        List<Finding> findings = fieldFindings("""
                class Sample {
                    private int a, b;
                    int first() { return a; }
                }
                """);

        assertEquals(List.of("b"), names(findings));
        var sibling = findings.get(0).declaration().sibling().orElseThrow();
        assertEquals(1, sibling.index());
        assertEquals(2, sibling.size());
    }

    @Test
    void testFieldsAcrossUnits() {
        UsageReport report = analyzer.analyzeSources(Map.of(
                "a/First.java", """
                        class First {
                            private int unused1;
                            private int kept;
                            int kept() { return kept; }
                        }
                        """,
                "b/Second.java", """
                        class Second {
                            private String name;
                            String name() { return name; }
                            private String ghost;
                        }
                        """));

        List<Finding> findings = report.getFindings(DeclarationKind.FIELD);
        assertEquals(List.of("unused1", "ghost"), names(findings), "Sorted by unit, then position");
        assertEquals(2, report.unitsAnalyzed());
    }
}
