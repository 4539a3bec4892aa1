package io.sagescan.security;

import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line scanner for hardcoded secrets and injection-prone constructs.
 * <p>
 * Secret candidates are reported only when the captured value's Shannon entropy reaches
 * the configured minimum, which filters out placeholders such as {@code "changeme"}.
 * Immutable and safe to share between threads.
 */
public class SecretScanner {

    public static final double DEFAULT_MIN_ENTROPY = 4.5;

    private record SecretPattern(Pattern pattern, String type) {
    }

    private record RiskPattern(Pattern pattern, String title, String description, Severity severity,
                               Set<String> languages) {
        boolean appliesTo(String language) {
            return languages.isEmpty() || languages.contains(language);
        }
    }

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final List<SecretPattern> SECRETS = List.of(
            new SecretPattern(Pattern.compile("(aws_access_key_id)\\s*=\\s*[\"']?([A-Z0-9]{20})[\"']?", CI), "AWS Access Key"),
            new SecretPattern(Pattern.compile("(aws_secret_access_key)\\s*=\\s*[\"']?([A-Za-z0-9/+=]{40})[\"']?", CI), "AWS Secret Key"),
            new SecretPattern(Pattern.compile("(github_token)\\s*=\\s*[\"']?(ghp_[A-Za-z0-9]{36})[\"']?", CI), "GitHub Token"),
            new SecretPattern(Pattern.compile("(api[_-]?key)\\s*=\\s*[\"']?([A-Za-z0-9_\\-]{32,})[\"']?", CI), "API Key"),
            new SecretPattern(Pattern.compile("(password|passwd)\\s*=\\s*[\"']([^\"']{8,})[\"']", CI), "Hardcoded Password"),
            new SecretPattern(Pattern.compile("(private[_-]?key)\\s*=\\s*[\"']([^\"']+)[\"']", CI), "Private Key"),
            new SecretPattern(Pattern.compile("(-----BEGIN\\s+(?:RSA\\s+)?PRIVATE\\s+KEY-----)", CI), "RSA Private Key")
    );

    private static final String SQL_INJECTION = "SQL Injection";
    private static final String XSS = "Cross-Site Scripting (XSS)";
    private static final String COMMAND_INJECTION = "Command Injection";

    private static final List<RiskPattern> RISKS = List.of(
            risk("(execute|query|run)\\s*\\([^)]*\\+[^)]*\\)", CI, SQL_INJECTION,
                    "SQL Injection via string concatenation", Severity.HIGH),
            risk("(SELECT|INSERT|UPDATE|DELETE).*%s.*%", CI, SQL_INJECTION,
                    "SQL Injection via string formatting", Severity.HIGH),
            risk("f[\"'].*?(SELECT|INSERT|UPDATE|DELETE).*?\\{", CI, SQL_INJECTION,
                    "SQL Injection via f-string", Severity.HIGH),
            risk("innerHTML\\s*=", CI, XSS, "Potential XSS via innerHTML", Severity.HIGH),
            risk("document\\.write\\s*\\(", CI, XSS, "Potential XSS via document.write", Severity.HIGH),
            risk("(?<![\\w.])eval\\s*\\(", CI, XSS, "Code Injection via eval", Severity.HIGH),
            risk("(exec|system|popen|subprocess\\.(?:call|run|Popen))\\s*\\([^)]*\\+", CI, COMMAND_INJECTION,
                    "Command Injection via concatenation", Severity.HIGH),
            risk("(os\\.system|os\\.popen|subprocess\\.(?:call|run))\\s*\\(.*shell\\s*=\\s*True", CI, COMMAND_INJECTION,
                    "Shell Command Injection risk", Severity.HIGH),
            // language specific
            risk("pickle\\.loads?\\(", 0, "Unsafe Pickle Deserialization", null, Severity.HIGH, "python"),
            risk("yaml\\.load\\([^,)]*\\)", 0, "Unsafe YAML Deserialization", null, Severity.HIGH, "python"),
            risk("random\\.random\\(\\)", 0, "Weak Random Number Generation", null, Severity.MEDIUM, "python"),
            risk("dangerouslySetInnerHTML", CI, "Dangerous React Property", null, Severity.HIGH, "javascript", "typescript"),
            risk("localStorage\\.setItem.*password", CI, "Password in LocalStorage", null, Severity.CRITICAL,
                    "javascript", "typescript")
    );

    private final double minEntropy;

    public SecretScanner() {
        this(DEFAULT_MIN_ENTROPY);
    }

    public SecretScanner(double minEntropy) {
        this.minEntropy = minEntropy;
    }

    public double minEntropy() {
        return minEntropy;
    }

    public List<Issue> scan(SourceText source, String language) {
        List<Issue> issues = new ArrayList<>();
        for (int n = 1; n <= source.lineCount(); n++) {
            String line = source.line(n);
            scanSecrets(source, line, n, issues);
            scanRisks(source, line, n, language, issues);
        }
        return issues;
    }

    private void scanSecrets(SourceText source, String line, int n, List<Issue> issues) {
        for (SecretPattern secret : SECRETS) {
            Matcher m = secret.pattern().matcher(line);
            while (m.find()) {
                String value = m.groupCount() > 1 ? m.group(2) : m.group(1);
                double entropy = shannonEntropy(value);
                if (entropy < minEntropy) {
                    continue;
                }
                issues.add(Issue.builder()
                        .id(IssueIds.of(source.filePath(), "secret", n))
                        .title("Hardcoded Secret: " + secret.type())
                        .description("Potential hardcoded " + secret.type().toLowerCase(Locale.ROOT) + " detected")
                        .severity(Severity.CRITICAL)
                        .category(Category.SECURITY)
                        .location(new Location(source.filePath(), n, n, m.start() + 1, m.end()))
                        .codeSnippet(source.snippet(n, n))
                        .suggestedFix("Store secrets in environment variables or use a secrets management service")
                        .ruleId("secret")
                        .metadata("entropy", Math.round(entropy * 100) / 100.0)
                        .build());
            }
        }
    }

    private void scanRisks(SourceText source, String line, int n, String language, List<Issue> issues) {
        for (RiskPattern risk : RISKS) {
            if (!risk.appliesTo(language) || !risk.pattern().matcher(line).find()) {
                continue;
            }
            issues.add(Issue.builder()
                    .id(IssueIds.of(source.filePath(), risk.title(), n))
                    .title(risk.title())
                    .description(risk.description())
                    .severity(risk.severity())
                    .category(Category.SECURITY)
                    .location(Location.line(source.filePath(), n))
                    .codeSnippet(source.snippet(n, n))
                    .ruleId("security")
                    .build());
        }
    }

    /**
     * Shannon entropy in bits per character; 0 for an empty string.
     */
    public static double shannonEntropy(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        value.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));
        int length = value.codePointCount(0, value.length());
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = (double) count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    private static RiskPattern risk(String regex, int flags, String title, String description, Severity severity,
                                    String... languages) {
        String text = description != null ? description : "Security issue detected: " + title;
        return new RiskPattern(Pattern.compile(regex, flags), title, text, severity, Set.of(languages));
    }
}
