package io.sagescan.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * File discovery driven by include and ignore globs.
 * <p>
 * Include globs are matched against the file name. Ignore globs are matched against
 * both the file name and the path relative to the root. Well-known build and tooling
 * directories are always skipped, and {@code .gitignore} entries of the root are
 * added to the ignore globs when requested.
 */
public class GlobFileDiscovery implements FileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(GlobFileDiscovery.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", "node_modules", "__pycache__", "venv", ".venv", "env",
            ".tox", ".pytest_cache", ".mypy_cache", ".idea", "build", "dist", "target"
    );

    private final List<PathMatcher> includes;
    private final List<String> ignorePatterns;
    private final boolean respectGitignore;

    public GlobFileDiscovery(List<String> includePatterns, List<String> ignorePatterns, boolean respectGitignore) {
        this.includes = includePatterns == null ? List.of() : includePatterns.stream()
                .map(GlobFileDiscovery::glob)
                .toList();
        this.ignorePatterns = ignorePatterns == null ? List.of() : List.copyOf(ignorePatterns);
        this.respectGitignore = respectGitignore;
    }

    @Override
    public List<Path> discover(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new FileAccessException("Path does not exist", root.toString());
        }

        List<PathMatcher> ignores = new ArrayList<>();
        for (String pattern : ignorePatterns) {
            ignores.add(glob(pattern));
        }

        if (Files.isRegularFile(root)) {
            Path name = root.getFileName();
            return isIncluded(name) && !isIgnored(name, name, ignores) ? List.of(root) : List.of();
        }

        if (respectGitignore) {
            ignores.addAll(loadGitignore(root));
        }

        Set<Path> files = new TreeSet<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root)) {
                    Path name = dir.getFileName();
                    if (SKIPPED_DIRECTORIES.contains(name.toString())
                            || isIgnored(name, root.relativize(dir), ignores)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    Path name = file.getFileName();
                    if (isIncluded(name) && !isIgnored(name, root.relativize(file), ignores)) {
                        files.add(file.normalize());
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        log.debug("Discovered {} files under {}", files.size(), root);
        return List.copyOf(files);
    }

    private boolean isIncluded(Path name) {
        if (includes.isEmpty()) {
            return true;
        }
        return includes.stream().anyMatch(m -> m.matches(name));
    }

    private static boolean isIgnored(Path name, Path relative, List<PathMatcher> ignores) {
        for (PathMatcher matcher : ignores) {
            if (matcher.matches(name) || matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> loadGitignore(Path root) {
        Path gitignore = root.resolve(".gitignore");
        if (!Files.isRegularFile(gitignore)) {
            return List.of();
        }
        List<PathMatcher> matchers = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(gitignore)) {
                String entry = line.strip();
                if (entry.isEmpty() || entry.startsWith("#") || entry.startsWith("!")) {
                    continue;
                }
                if (entry.startsWith("/")) {
                    entry = entry.substring(1);
                }
                if (entry.endsWith("/")) {
                    entry = entry.substring(0, entry.length() - 1);
                }
                if (entry.isEmpty()) {
                    continue;
                }
                try {
                    matchers.add(glob(entry));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring invalid .gitignore entry '{}': {}", entry, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", gitignore, e.getMessage());
        }
        return matchers;
    }

    private static PathMatcher glob(String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }
}
