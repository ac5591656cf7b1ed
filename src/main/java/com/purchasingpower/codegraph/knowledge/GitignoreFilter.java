package com.purchasingpower.codegraph.knowledge;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.ignore.IgnoreNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the repository's {@code .gitignore} rules while walking the file tree.
 *
 * <p>Rules are read lazily per directory and cached. A rule in a nested {@code .gitignore} wins
 * over rules of enclosing directories, matching git. The {@code .git} directory is always ignored.
 */
@Slf4j
public class GitignoreFilter {

    private static final String GIT_DIR = ".git";
    private static final String GITIGNORE = ".gitignore";

    private final Path rootDir;
    private final Map<Path, Optional<IgnoreNode>> rulesByDirectory = new HashMap<>();

    public GitignoreFilter(Path rootDir) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
    }

    public boolean isIgnored(Path path, boolean isDirectory) {
        Path absolute = path.toAbsolutePath().normalize();
        if (absolute.getFileName() != null && GIT_DIR.equals(absolute.getFileName().toString())) {
            return true;
        }

        Path directory = absolute.getParent();
        while (directory != null && directory.startsWith(rootDir)) {
            Optional<IgnoreNode> rules = rulesFor(directory);
            if (rules.isPresent()) {
                String relative = toPosix(directory.relativize(absolute));
                Boolean ignored = rules.get().checkIgnored(relative, isDirectory);
                if (ignored != null) {
                    return ignored;
                }
            }
            directory = directory.getParent();
        }
        return false;
    }

    private Optional<IgnoreNode> rulesFor(Path directory) {
        return rulesByDirectory.computeIfAbsent(directory, this::loadRules);
    }

    private Optional<IgnoreNode> loadRules(Path directory) {
        Path gitignore = directory.resolve(GITIGNORE);
        if (!Files.isRegularFile(gitignore)) {
            return Optional.empty();
        }
        IgnoreNode node = new IgnoreNode();
        try (InputStream in = Files.newInputStream(gitignore)) {
            node.parse(in);
            log.debug("Loaded {} ignore rules from {}", node.getRules().size(), gitignore);
            return Optional.of(node);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", gitignore, e.getMessage());
            return Optional.empty();
        }
    }

    private static String toPosix(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
