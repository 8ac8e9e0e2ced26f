package com.ouroboros.core.generation;

import com.ouroboros.core.config.OuroborosProperties;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Glob rules for resources generated changes may never touch: the repository
 * metadata, the pipeline's own state directory when it lives under the project
 * root, and any configured extras.
 */
@Component
public class ProtectedPaths {

    private final List<String> globs;
    private final List<PathMatcher> matchers;

    public ProtectedPaths(OuroborosProperties properties) {
        this(properties.projectRootPath(), properties.stateDirPath(),
                properties.getGeneration().getProtectedPaths());
    }

    public ProtectedPaths(Path projectRoot, Path stateDir, List<String> extraGlobs) {
        var all = new ArrayList<String>();
        all.add(".git");
        all.add(".git/**");
        if (stateDir.startsWith(projectRoot) && !stateDir.equals(projectRoot)) {
            String rel = projectRoot.relativize(stateDir).toString().replace('\\', '/');
            all.add(rel);
            all.add(rel + "/**");
        }
        if (extraGlobs != null) {
            all.addAll(extraGlobs);
        }
        this.globs = List.copyOf(all);
        this.matchers = globs.stream()
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .toList();
    }

    /**
     * @param relativePath normalized path relative to the project root
     */
    public boolean isProtected(Path relativePath) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    public List<String> globs() {
        return globs;
    }
}
