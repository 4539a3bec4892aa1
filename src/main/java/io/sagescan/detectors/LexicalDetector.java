package io.sagescan.detectors;

import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.SourceText;
import io.sagescan.rules.PatternDetector;
import io.sagescan.rules.RuleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Line-based detector for languages analysed without a parser.
 * <p>
 * Runs the lexical rule catalog through a {@link PatternDetector} after blanking comment
 * lines. It trades precision for coverage: patterns can fire inside strings.
 */
public class LexicalDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(LexicalDetector.class);

    /**
     * A language handled lexically.
     *
     * @param id         Language id reported on records and matched against rule language sets
     * @param extensions Lowercase file extensions including the dot
     */
    public record Language(String id, Set<String> extensions) {
        public Language {
            extensions = Set.copyOf(extensions);
        }
    }

    public static final Language TYPESCRIPT = new Language("typescript", Set.of(".ts", ".tsx"));
    public static final Language JAVASCRIPT = new Language("javascript", Set.of(".js", ".jsx", ".mjs", ".cjs"));

    private final Language language;
    private final PatternDetector patterns;

    public LexicalDetector(Language language, RuleCatalog catalog) {
        this.language = language;
        this.patterns = new PatternDetector(catalog, LexicalDetector::blankComment);
    }

    @Override
    public String language() {
        return language.id();
    }

    @Override
    public boolean canAnalyze(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && language.extensions().contains(name.substring(dot));
    }

    @Override
    public FileRecord analyzeSource(SourceText source) {
        List<Issue> issues = patterns.matchFile(source, language.id());
        log.debug("Analyzed {}: {} issues", source.filePath(), issues.size());
        return FileRecord.succeeded(source.filePath(), language.id(), issues, source.lineMetrics(List.of("//")));
    }

    /**
     * Replaces comment-only lines with spaces of the same length.
     */
    static String blankComment(String line) {
        String stripped = line.stripLeading();
        if (stripped.startsWith("//") || stripped.startsWith("/*") || stripped.startsWith("*")) {
            return " ".repeat(line.length());
        }
        return line;
    }
}
