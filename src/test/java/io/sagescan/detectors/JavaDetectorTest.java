package io.sagescan.detectors;

import io.sagescan.model.Category;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JavaDetectorTest {

    private JavaDetector detector;

    @BeforeEach
    void setUp() {
        detector = new JavaDetector(AnalysisSettings.defaults());
    }

    @Test
    void canAnalyze_acceptsJavaSources() {
        assertThat(detector.canAnalyze(Path.of("src/Main.java"))).isTrue();
        assertThat(detector.canAnalyze(Path.of("Main.class"))).isFalse();
    }

    @Test
    void detect_findsStructuralIssues() {
        String content = """
                import java.util.*;
                import static java.util.Map.*;

                class Sample {
                    void check(String s) {
                        try {
                            if (s == "yes") {
                                System.out.println("ok");
                            }
                        } catch (Exception e) {
                            throw new IllegalStateException(e);
                        }
                    }

                    void many(int a, int b, int c, int d, int e, int f) {
                    }
                }
                """;

        FileRecord record = detector.analyzeSource(SourceText.of("Sample.java", content));

        assertThat(record.success()).isTrue();
        assertThat(record.language()).isEqualTo("java");
        assertThat(record.issues())
                .extracting(Issue::title, i -> i.location().startLine())
                .containsExactlyInAnyOrder(
                        tuple("Wildcard Import", 1),
                        tuple("String Comparison with ==", 7),
                        tuple("Overly Broad Catch: Exception", 10),
                        tuple("Too Many Parameters: many", 15));
    }

    @Test
    void detect_flagsBroadTypeInMultiCatch() {
        String content = """
                class A {
                    void run() {
                        try {
                            work();
                        } catch (java.io.IOException | RuntimeException e) {
                            log(e);
                        }
                    }
                }
                """;

        List<Issue> issues = detector.analyzeSource(SourceText.of("A.java", content)).issues();

        assertThat(issues).extracting(Issue::title).containsExactly("Overly Broad Catch: RuntimeException");
        assertThat(issues.get(0).category()).isEqualTo(Category.BEST_PRACTICE);
    }

    @Test
    void detect_flagsNegatedStringComparison() {
        String content = "class A { boolean f(String s) { return \"x\" != s; } }\n";

        List<Issue> issues = detector.analyzeSource(SourceText.of("A.java", content)).issues();

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.title()).isEqualTo("String Comparison with !=");
            assertThat(issue.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(issue.autoFixable()).isTrue();
        });
    }

    @Test
    void detect_findsLongMethodAndHighComplexity() {
        JavaDetector strict = new JavaDetector(new AnalysisSettings(2, 2, 5));
        String content = """
                class A {
                    int f(int x, int y) {
                        if (x > 0 && y > 0) {
                            return 1;
                        }
                        return 0;
                    }
                }
                """;

        List<Issue> issues = strict.analyzeSource(SourceText.of("A.java", content)).issues();

        assertThat(issues).extracting(Issue::title).containsExactlyInAnyOrder("Long Method: f", "High Complexity: f");
        Issue length = issues.stream().filter(i -> i.title().startsWith("Long")).findFirst().orElseThrow();
        assertThat(length.metadata()).containsEntry("length", 5);
        Issue complexity = issues.stream().filter(i -> i.title().startsWith("High")).findFirst().orElseThrow();
        assertThat(complexity.metadata()).containsEntry("complexity", 3);
    }

    @Test
    void detect_countsConstructorParameters() {
        String content = "class A { A(int a, int b, int c, int d, int e, int f) { } }\n";

        List<Issue> issues = detector.analyzeSource(SourceText.of("A.java", content)).issues();

        assertThat(issues).extracting(Issue::title).containsExactly("Too Many Parameters: A");
    }

    @Test
    void detect_reportsSyntaxErrorAsCriticalIssue() {
        FileRecord record = detector.analyzeSource(SourceText.of("Broken.java", "class Broken {\n    void f( {\n}\n"));

        assertThat(record.success()).isTrue();
        assertThat(record.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.title()).isEqualTo("Java Syntax Error");
            assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(issue.ruleId()).isEqualTo("syntax");
        });
    }

    @Test
    void detect_computesAverageComplexity() {
        String content = """
                class A {
                    // simple
                    void a() { }

                    void b(boolean x) { if (x) { a(); } }
                }
                """;

        FileRecord record = detector.analyzeSource(SourceText.of("A.java", content));

        assertThat(record.metrics().cyclomaticComplexity()).isEqualTo(1.5);
        assertThat(record.metrics().commentLines()).isEqualTo(1);
        assertThat(record.metrics().blankLines()).isEqualTo(1);
    }
}
