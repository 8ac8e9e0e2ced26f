package com.ouroboros.core.generation;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.generation.validation.SourceValidators;
import com.ouroboros.core.llm.LlmEmptyResponseException;
import com.ouroboros.core.llm.LlmParseException;
import com.ouroboros.core.llm.LlmService;
import com.ouroboros.core.model.ChangeKind;
import com.ouroboros.core.model.CodeChange;
import com.ouroboros.core.model.Improvement;
import com.ouroboros.core.model.ImprovementOpportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns one {@link ImprovementOpportunity} into a concrete {@link Improvement}
 * through a single structured call to the reasoning service, and validates the
 * result against the project tree.
 * <p>
 * Generated content is treated as data throughout: it is parsed for syntax, never
 * compiled to classes or loaded into this process.
 */
@Service
public class ChangeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChangeGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are the self-improvement engine of an autonomous software agent.
            You are given one improvement opportunity mined from the agent's own task
            history, plus excerpts of the agent's source code. Propose the smallest
            set of file changes that addresses the opportunity.

            RULES:
            1. Paths are relative to the project root. Never touch .git or state files.
            2. Each change has a kind: "create", "modify" or "delete".
            3. For "create" and "modify", "content" is the COMPLETE new file content,
               not a diff. For "delete", omit "content".
            4. List each path at most once.
            5. Generated code must be syntactically valid for its file type.
            6. Optionally supply "verificationScript": a POSIX sh script that exits 0
               when the change works. It runs in an empty directory containing only
               the changed files, with no network access.
            7. Keep the title under 72 characters; it becomes the commit subject.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final ContextBuilder contextBuilder;
    private final ProtectedPaths protectedPaths;
    private final SourceValidators validators;
    private final Path projectRoot;

    @Autowired
    public ChangeGenerator(LlmService llmService, ContextBuilder contextBuilder, ProtectedPaths protectedPaths,
                           SourceValidators validators, OuroborosProperties properties) {
        this(llmService, contextBuilder, protectedPaths, validators, properties.projectRootPath());
    }

    public ChangeGenerator(LlmService llmService, ContextBuilder contextBuilder, ProtectedPaths protectedPaths,
                           SourceValidators validators, Path projectRoot) {
        this.llmService = llmService;
        this.contextBuilder = contextBuilder;
        this.protectedPaths = protectedPaths;
        this.validators = validators;
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    /**
     * Asks the reasoning service for an improvement addressing {@code opportunity}.
     *
     * @return the candidate improvement, or {@code null} when the service failed or
     *         its response did not satisfy the schema
     */
    public Improvement generate(ImprovementOpportunity opportunity) {
        String userPrompt = buildUserPrompt(opportunity, contextBuilder.build(opportunity));
        GeneratedImprovement generated;
        try {
            generated = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, GeneratedImprovement.class);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            log.warn("Unusable response for opportunity {}: {}", opportunity.id(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Reasoning service call failed for opportunity {}: {}", opportunity.id(), e.getMessage(), e);
            return null;
        }

        List<String> schemaErrors = checkSchema(generated);
        if (!schemaErrors.isEmpty()) {
            log.warn("Response for opportunity {} violates the change schema: {}",
                    opportunity.id(), String.join("; ", schemaErrors));
            return null;
        }

        var changes = generated.changes().stream()
                .map(c -> new CodeChange(c.path().trim(), ChangeKind.parse(c.kind()), null,
                        ChangeKind.parse(c.kind()) == ChangeKind.DELETE ? null : c.content(),
                        c.description() != null ? c.description() : ""))
                .toList();
        String script = generated.verificationScript() != null && !generated.verificationScript().isBlank()
                ? generated.verificationScript()
                : null;
        var improvement = new Improvement(opportunity.id(), generated.title().trim(),
                generated.description() != null ? generated.description() : "", changes, script);
        log.info("Generated improvement '{}' with {} change(s) for opportunity {}",
                improvement.title(), changes.size(), opportunity.id());
        return improvement;
    }

    /**
     * Checks every change against the project tree and captures prior content for
     * modifications and deletions. One invalid change fails the whole improvement.
     */
    public ValidationReport validate(Improvement improvement) {
        var errors = new ArrayList<String>();
        var seen = new HashSet<Path>();
        var captured = new ArrayList<CodeChange>();

        if (improvement.changes().isEmpty()) {
            errors.add("improvement contains no changes");
        }

        for (CodeChange change : improvement.changes()) {
            Path relative = checkPath(change.path(), errors);
            if (relative == null) {
                captured.add(change);
                continue;
            }
            if (!seen.add(relative)) {
                errors.add(change.path() + ": appears more than once");
                continue;
            }
            if (change.kind() == null) {
                errors.add(change.path() + ": missing change kind");
                continue;
            }

            Path target = projectRoot.resolve(relative);
            CodeChange checked = change;
            switch (change.kind()) {
                case MODIFY, DELETE -> {
                    if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                        errors.add(change.path() + ": " + change.kind().name().toLowerCase(Locale.ROOT)
                                + " target does not exist");
                    } else {
                        try {
                            checked = change.withPriorContent(Files.readString(target));
                        } catch (IOException e) {
                            errors.add(change.path() + ": cannot read current content: " + e.getMessage());
                        }
                    }
                }
                case CREATE -> {
                    if (Files.isDirectory(target)) {
                        errors.add(change.path() + ": create target is a directory");
                    }
                }
            }
            if (change.kind() != ChangeKind.DELETE) {
                if (change.newContent() == null) {
                    errors.add(change.path() + ": no content for " + change.kind().name().toLowerCase(Locale.ROOT));
                } else {
                    errors.addAll(validators.validate(change.path(), change.newContent()));
                }
            }
            captured.add(checked);
        }

        boolean ok = errors.isEmpty();
        if (ok) {
            log.info("Improvement {} passed validation ({} change(s))", improvement.id(), captured.size());
        } else {
            log.warn("Improvement {} rejected: {}", improvement.id(), String.join("; ", errors));
        }
        return new ValidationReport(ok, errors, improvement.withChanges(captured));
    }

    private Path checkPath(String raw, List<String> errors) {
        if (raw == null || raw.isBlank()) {
            errors.add("change with empty path");
            return null;
        }
        Path relative;
        try {
            relative = Path.of(raw);
        } catch (InvalidPathException e) {
            errors.add(raw + ": invalid path");
            return null;
        }
        if (relative.isAbsolute()) {
            errors.add(raw + ": path must be relative to the project root");
            return null;
        }
        Path resolved = projectRoot.resolve(relative).normalize();
        if (!resolved.startsWith(projectRoot) || resolved.equals(projectRoot)) {
            errors.add(raw + ": path escapes the project root");
            return null;
        }
        Path normalized = projectRoot.relativize(resolved);
        if (protectedPaths.isProtected(normalized)) {
            errors.add(raw + ": path is protected");
            return null;
        }
        if (escapesThroughLink(resolved)) {
            errors.add(raw + ": path resolves outside the project root through a link");
            return null;
        }
        return normalized;
    }

    private boolean escapesThroughLink(Path resolved) {
        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) return true;
        try {
            return !existing.toRealPath().startsWith(projectRoot.toRealPath());
        } catch (IOException e) {
            return true;
        }
    }

    static List<String> checkSchema(GeneratedImprovement generated) {
        var errors = new ArrayList<String>();
        if (generated == null) {
            return List.of("empty response");
        }
        if (generated.title() == null || generated.title().isBlank()) {
            errors.add("title is required");
        }
        if (generated.changes() == null || generated.changes().isEmpty()) {
            errors.add("at least one change is required");
            return errors;
        }
        for (int i = 0; i < generated.changes().size(); i++) {
            GeneratedImprovement.GeneratedChange c = generated.changes().get(i);
            if (c == null) {
                errors.add("change " + i + " is null");
                continue;
            }
            if (c.path() == null || c.path().isBlank()) {
                errors.add("change " + i + " has no path");
            }
            ChangeKind kind = ChangeKind.parse(c.kind());
            if (kind == null) {
                errors.add("change " + i + " has unknown kind '" + c.kind() + "'");
            } else if (kind != ChangeKind.DELETE && c.content() == null) {
                errors.add("change " + i + " (" + kind + ") has no content");
            }
        }
        return errors;
    }

    String buildUserPrompt(ImprovementOpportunity opportunity, String sourceContext) {
        var sb = new StringBuilder();
        sb.append("Opportunity: ").append(opportunity.id()).append('\n');
        sb.append("Type: ").append(opportunity.type()).append('\n');
        sb.append("Priority: ").append(opportunity.priority()).append("/10\n");
        sb.append("Description: ").append(opportunity.description()).append("\n\n");

        if (!opportunity.context().isEmpty()) {
            sb.append("Evidence:\n");
            for (Map.Entry<String, Object> e : opportunity.context().entrySet()) {
                sb.append("- ").append(e.getKey()).append(": ").append(render(e.getValue())).append('\n');
            }
            sb.append('\n');
        }
        if (!sourceContext.isBlank()) {
            sb.append("Relevant source files:\n\n").append(sourceContext);
        } else {
            sb.append("No existing source files matched this opportunity.\n");
        }
        return sb.toString();
    }

    private static String render(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }
}
