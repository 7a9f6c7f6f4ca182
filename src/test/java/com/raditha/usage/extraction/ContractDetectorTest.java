package com.raditha.usage.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.usage.analyzer.ProjectSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContractDetectorTest {

    private JavaParser parser;
    private ContractDetector detector;

    @BeforeEach
    void setUp() {
        parser = ProjectSources.createParser(List.of());
        detector = new ContractDetector(new SymbolResolution());
    }

    private MethodDeclaration method(String code, String name) {
        CompilationUnit cu = ProjectSources.parse(parser, "Test.java", code);
        return cu.findAll(MethodDeclaration.class).stream()
                .filter(m -> m.getNameAsString().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testOverrideAnnotation() {
        assertTrue(detector.isContractBound(method("""
                class A extends Thread {
                    @Override
                    public void run() { }
                }
                """, "run")));
    }

    @Test
    void testImplementationWithoutAnnotationFoundBySolver() {
        assertTrue(detector.isContractBound(method("""
                class Task implements Comparable<Task> {
                    public int compareTo(Task other) { return 0; }
                }
                """, "compareTo")));
    }

    @Test
    void testImplementationOfInterfaceInSameUnit() {
        assertTrue(detector.isContractBound(method("""
                interface Handler { void handle(String event); }
                class LoggingHandler implements Handler {
                    public void handle(String event) { }
                }
                """, "handle")));
    }

    @Test
    void testNewMethodOnSubclassIsNotBound() {
        assertFalse(detector.isContractBound(method("""
                class Worker implements Runnable {
                    public void run() { }
                    public void configure(int threads) { }
                }
                """, "configure")));
    }

    @Test
    void testObjectMethods() {
        String code = """
                class Value {
                    public boolean equals(Object o) { return false; }
                    public int hashCode() { return 0; }
                    public String toString() { return ""; }
                    public boolean equals(Value a, Value b) { return false; }
                }
                """;
        assertTrue(detector.isContractBound(method(code, "hashCode")));
        assertTrue(detector.isContractBound(method(code, "toString")));
    }

    @Test
    void testPlainClassMethodIsNotBound() {
        assertFalse(detector.isContractBound(method("""
                class Plain {
                    void process(int value) { }
                }
                """, "process")));
    }

    @Test
    void testPrivateAndStaticAreNeverBound() {
        String code = """
                class Worker implements Runnable {
                    public void run() { }
                    private void retry(int times) { }
                    static void helper(String s) { }
                }
                """;
        assertFalse(detector.isContractBound(method(code, "retry")));
        assertFalse(detector.isContractBound(method(code, "helper")));
    }

    @Test
    void testAnonymousAndInterfaceMethodsAreBound() {
        assertTrue(detector.isContractBound(method("""
                class A {
                    Runnable r = new Runnable() {
                        public void run() { }
                    };
                }
                """, "run")));
        assertTrue(detector.isContractBound(method("""
                interface Greeter {
                    default String greet(String name) { return "hi"; }
                }
                """, "greet")));
    }

    @Test
    void testUnresolvableSupertypeIsAssumedBound() {
        assertTrue(detector.isContractBound(method("""
                class Listener extends com.example.missing.BaseListener {
                    public void onEvent(String event) { }
                }
                """, "onEvent")));
    }

    @Test
    void testEntryPoint() {
        assertTrue(detector.isEntryPoint(method("""
                class App { public static void main(String[] args) { } }
                """, "main")));
        assertTrue(detector.isEntryPoint(method("""
                class App { public static void main(String... args) { } }
                """, "main")));
        assertFalse(detector.isEntryPoint(method("""
                class App { static void main(String[] args) { } }
                """, "main")));
    }
}
