package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * One structural check over a parsed Java compilation unit.
 */
public interface JavaCheck {

    String id();

    String description();

    List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings);

    /**
     * Starts an issue spanning the given node, with id, location, snippet and rule id filled in.
     */
    default Issue.Builder issueAt(SourceText source, Node node) {
        int line = beginLine(node);
        int endLine = node.getEnd().map(p -> p.line).orElse(line);
        Integer column = node.getBegin().map(p -> p.column).orElse(null);
        return Issue.builder()
                .id(IssueIds.of(source.filePath(), id(), line))
                .location(new Location(source.filePath(), line, endLine, column, null))
                .codeSnippet(source.snippet(line, endLine))
                .ruleId(id());
    }

    /**
     * Methods and constructors under {@code root}, in source order.
     */
    static List<CallableDeclaration<?>> callables(Node root) {
        List<CallableDeclaration<?>> result = new ArrayList<>();
        root.walk(Node.TreeTraversal.PREORDER, node -> {
            if (node instanceof CallableDeclaration<?> callable) {
                result.add(callable);
            }
        });
        return result;
    }

    static int beginLine(Node node) {
        return node.getBegin().map(p -> p.line).orElse(1);
    }
}
