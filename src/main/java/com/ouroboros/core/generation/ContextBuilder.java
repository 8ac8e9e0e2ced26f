package com.ouroboros.core.generation;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.model.ImprovementOpportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Assembles the bounded source excerpt sent with a generation request: the
 * configured anchor files followed by one source file per affected tool.
 * Each file is truncated to {@code excerpt-chars}; the whole context stops
 * growing at {@code context-chars}.
 */
@Component
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    /** Directories never searched for tool sources. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn"
    );

    private final Path projectRoot;
    private final OuroborosProperties.Generation settings;

    public ContextBuilder(OuroborosProperties properties) {
        this(properties.projectRootPath(), properties.getGeneration());
    }

    ContextBuilder(Path projectRoot, OuroborosProperties.Generation settings) {
        this.projectRoot = projectRoot;
        this.settings = settings;
    }

    public String build(ImprovementOpportunity opportunity) {
        var files = new LinkedHashSet<Path>();
        for (String anchor : settings.getAnchorFiles()) {
            Path p = projectRoot.resolve(anchor).normalize();
            if (p.startsWith(projectRoot) && Files.isRegularFile(p)) {
                files.add(p);
            }
        }
        opportunity.affectedTools().stream()
                .limit(settings.getMaxTools())
                .map(this::findToolSource)
                .flatMap(Optional::stream)
                .forEach(files::add);

        var sb = new StringBuilder();
        for (Path file : files) {
            String excerpt = excerpt(file);
            if (excerpt == null) continue;
            String block = "### " + projectRoot.relativize(file).toString().replace('\\', '/')
                    + "\n```\n" + excerpt + "\n```\n\n";
            if (sb.length() + block.length() > settings.getContextChars()) {
                log.debug("Context limit reached; skipping {} and later files", file);
                break;
            }
            sb.append(block);
        }
        return sb.toString();
    }

    Optional<Path> findToolSource(String toolName) {
        String needle = simplify(toolName);
        if (needle.isEmpty()) return Optional.empty();
        var candidates = new ArrayList<Path>();
        for (String root : settings.getToolSourceRoots()) {
            Path dir = projectRoot.resolve(root).normalize();
            if (!dir.startsWith(projectRoot) || !Files.isDirectory(dir)) continue;
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> !shouldIgnore(p))
                        .filter(p -> simplify(stripExtension(p.getFileName().toString())).contains(needle))
                        .forEach(candidates::add);
            } catch (IOException e) {
                log.warn("Could not scan {} for tool '{}': {}", dir, toolName, e.getMessage());
            }
        }
        return candidates.stream().sorted().findFirst();
    }

    private String excerpt(Path file) {
        try {
            String content = Files.readString(file);
            return content.length() <= settings.getExcerptChars()
                    ? content
                    : content.substring(0, settings.getExcerptChars()) + "\n... (truncated)";
        } catch (MalformedInputException e) {
            log.debug("Skipping non-text file {}", file);
            return null;
        } catch (IOException e) {
            log.warn("Could not read context file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private boolean shouldIgnore(Path path) {
        for (Path component : projectRoot.relativize(path)) {
            if (IGNORE_DIRS.contains(component.toString())) return true;
        }
        return false;
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String simplify(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
