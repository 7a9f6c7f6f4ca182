package com.raditha.usage.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.raditha.usage.analyzer.ProjectSources;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationTrait;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallableCollectorTest {

    private JavaParser parser;
    private CallableCollector collector;

    @BeforeEach
    void setUp() {
        parser = ProjectSources.createParser(List.of());
        collector = new CallableCollector(new ContractDetector(new SymbolResolution()));
    }

    private List<CallableUnit> collect(String code) {
        return collector.collect(ProjectSources.parse(parser, "Test.java", code));
    }

    @Test
    void testFindsEveryCallableKind() {
        List<CallableUnit> callables = collect("""
                abstract class Shape {
                    static { int loaded = 1; }
                    Shape(int sides) { }
                    abstract double area(double scale);
                    void each(java.util.List<String> names) {
                        names.forEach(n -> System.out.println(n));
                    }
                }
                """);

        List<String> names = callables.stream().map(CallableUnit::displayName).toList();
        assertEquals(5, callables.size(), names.toString());
        assertTrue(names.contains("Shape.<init>(int)"));
        assertTrue(names.contains("Shape.area(double)"));
        assertTrue(names.contains("Shape.each(java.util.List<String>)"));
        assertTrue(names.stream().anyMatch(n -> n.startsWith("lambda@")));
        assertTrue(names.stream().anyMatch(n -> n.startsWith("Shape.<clinit>@")));
    }

    @Test
    void testSignatureTraits() {
        List<CallableUnit> callables = collect("""
                abstract class Shape implements Comparable<Shape> {
                    abstract double area(double scale);
                    public int compareTo(Shape other) { return 0; }
                    public static void main(String[] args) { }
                }
                """);

        CallableUnit area = byName(callables, "area");
        CallableUnit compareTo = byName(callables, "compareTo");
        CallableUnit main = byName(callables, "main");

        assertTrue(area.signatureTraits().contains(DeclarationTrait.NO_BODY));
        assertFalse(area.hasBody());
        assertTrue(compareTo.signatureTraits().contains(DeclarationTrait.CONTRACT_BOUND));
        assertTrue(main.signatureTraits().contains(DeclarationTrait.ENTRY_POINT));
    }

    @Test
    void testParameterKinds() {
        List<CallableUnit> callables = collect("""
                class Outer {
                    void top(int a) {
                        class Local {
                            void inner(int b) { }
                        }
                        java.util.function.IntConsumer c = x -> { };
                    }
                }
                """);

        assertEquals(DeclarationKind.PARAMETER, byName(callables, "top").parameterKind());
        assertEquals(DeclarationKind.LOCAL_FUNCTION_PARAMETER, byName(callables, "inner").parameterKind());
        assertTrue(callables.stream().anyMatch(c -> c.parameterKind() == DeclarationKind.LAMBDA_PARAMETER));
    }

    @Test
    void testLocalsBelongToInnermostCallable() {
        List<CallableUnit> callables = collect("""
                class Outer {
                    void top() {
                        int outerLocal = 1;
                        Runnable r = () -> {
                            int lambdaLocal = 2;
                        };
                    }
                }
                """);

        CallableUnit top = byName(callables, "top");
        CallableUnit lambda = callables.stream()
                .filter(c -> c.parameterKind() == DeclarationKind.LAMBDA_PARAMETER)
                .findFirst()
                .orElseThrow();

        assertEquals(List.of("outerLocal", "r"), names(CallableCollector.ownedLocals(top)));
        assertEquals(List.of("lambdaLocal"), names(CallableCollector.ownedLocals(lambda)));
    }

    private static CallableUnit byName(List<CallableUnit> callables, String method) {
        return callables.stream()
                .filter(c -> c.displayName().contains("." + method + "("))
                .findFirst()
                .orElseThrow();
    }

    private static List<String> names(List<VariableDeclarator> variables) {
        return variables.stream().map(VariableDeclarator::getNameAsString).toList();
    }
}
