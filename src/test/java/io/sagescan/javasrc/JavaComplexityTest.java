package io.sagescan.javasrc;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JavaComplexityTest {

    private static int complexityOf(String body) {
        CompilationUnit unit = StaticJavaParser.parse("class A { int m(int x) { " + body + " } }");
        return JavaComplexity.of(unit.findFirst(MethodDeclaration.class).orElseThrow());
    }

    @Test
    void of_startsAtOneForStraightLineCode() {
        assertThat(complexityOf("return x;")).isEqualTo(1);
    }

    @Test
    void of_countsBranchesLoopsAndBooleanOperators() {
        String body = """
                if (x > 0 && x < 10) { return 1; }
                for (int i = 0; i < x; i++) { x--; }
                while (x > 100) { x /= 2; }
                return x > 5 ? 1 : 0;
                """;

        assertThat(complexityOf(body)).isEqualTo(6);
    }

    @Test
    void of_countsLabelledSwitchEntriesAndCatches() {
        String body = """
                switch (x) { case 1: break; case 2: break; default: break; }
                try { x++; } catch (IllegalStateException e) { x--; }
                return x;
                """;

        assertThat(complexityOf(body)).isEqualTo(4);
    }

    @Test
    void of_includesLambdasButNotAnonymousClasses() {
        assertThat(complexityOf("Runnable r = () -> { if (x > 0) { return; } }; return x;")).isEqualTo(2);
        assertThat(complexityOf(
                "Runnable r = new Runnable() { public void run() { if (x > 0) { return; } } }; return x;"))
                .isEqualTo(1);
    }

    @Test
    void average_coversMethodsAndConstructors() {
        CompilationUnit unit = StaticJavaParser.parse("""
                class A {
                    A(int x) { if (x > 0) { x--; } }
                    void a() { }
                    int b(int x) { return x > 0 || x < -5 ? 1 : 0; }
                }
                """);

        assertThat(JavaComplexity.average(unit)).isEqualTo(2.0);
    }

    @Test
    void average_isZeroWithoutCallables() {
        assertThat(JavaComplexity.average(StaticJavaParser.parse("interface Marker { }"))).isEqualTo(0.0);
    }

    @Test
    void callables_listsConstructorsAndMethodsInSourceOrder() {
        CompilationUnit unit = StaticJavaParser.parse("""
                class A {
                    void first() { Runnable r = new Runnable() { public void run() { } }; }
                    A() { }
                    int last(int x) { return x; }
                }
                """);

        assertThat(JavaCheck.callables(unit))
                .extracting(callable -> callable.getNameAsString())
                .containsExactly("first", "run", "A", "last");
    }
}
