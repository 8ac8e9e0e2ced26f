package com.ouroboros.core.generation;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.generation.GeneratedImprovement.GeneratedChange;
import com.ouroboros.core.generation.validation.SourceValidators;
import com.ouroboros.core.llm.LlmEmptyResponseException;
import com.ouroboros.core.llm.LlmParseException;
import com.ouroboros.core.llm.LlmService;
import com.ouroboros.core.model.ChangeKind;
import com.ouroboros.core.model.CodeChange;
import com.ouroboros.core.model.Improvement;
import com.ouroboros.core.model.ImprovementOpportunity;
import com.ouroboros.core.model.OpportunityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChangeGeneratorTest {

    @TempDir
    Path root;

    private LlmService llmService;
    private ChangeGenerator generator;

    private static final ImprovementOpportunity OPPORTUNITY = new ImprovementOpportunity(
            "fix-0badcafe", OpportunityType.FIX_FAILURE, "Fix recurring failure: connection timeout", 8,
            Map.of(ImprovementOpportunity.CTX_ERROR_MESSAGE, "connection timeout",
                    ImprovementOpportunity.CTX_TOOLS_INVOLVED, List.of("fetch")),
            Instant.parse("2026-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() throws IOException {
        llmService = mock(LlmService.class);
        var settings = new OuroborosProperties.Generation();
        var protectedPaths = new ProtectedPaths(root, root.resolve(".ouroboros"), List.of("secrets/**"));
        generator = new ChangeGenerator(llmService, new ContextBuilder(root, settings), protectedPaths,
                SourceValidators.defaults(), root);
        Files.createDirectories(root.resolve("src/main/java"));
        Files.writeString(root.resolve("src/main/java/Fetch.java"), "class Fetch { int timeout = 5; }");
    }

    private void respond(GeneratedImprovement response) {
        when(llmService.structuredCall(anyString(), anyString(), eq(GeneratedImprovement.class))).thenReturn(response);
    }

    private static CodeChange change(String path, ChangeKind kind, String content) {
        return new CodeChange(path, kind, null, content, "");
    }

    private static Improvement improvement(CodeChange... changes) {
        return new Improvement("fix-0badcafe", "title", "desc", List.of(changes), null);
    }

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("maps a well-formed response to an Improvement")
        void mapsResponse() {
            respond(new GeneratedImprovement(" Raise fetch timeout ", "Longer timeout", List.of(
                    new GeneratedChange("src/main/java/Fetch.java", "Modify", "raise timeout",
                            "class Fetch { int timeout = 30; }"),
                    new GeneratedChange("src/main/java/Old.java", "delete", "remove", "ignored")),
                    "  "));

            Improvement result = generator.generate(OPPORTUNITY);

            assertNotNull(result);
            assertEquals("fix-0badcafe", result.id());
            assertEquals("Raise fetch timeout", result.title());
            assertEquals(ChangeKind.MODIFY, result.changes().get(0).kind());
            assertEquals(ChangeKind.DELETE, result.changes().get(1).kind());
            assertNull(result.changes().get(1).newContent());
            assertFalse(result.hasVerificationScript());
        }

        @Test
        @DisplayName("sends the opportunity evidence and source context in the prompt")
        void promptContainsEvidence() {
            respond(new GeneratedImprovement("t", "d",
                    List.of(new GeneratedChange("a.txt", "create", "", "x")), null));

            generator.generate(OPPORTUNITY);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(eq(ChangeGenerator.SYSTEM_PROMPT), prompt.capture(),
                    eq(GeneratedImprovement.class));
            assertTrue(prompt.getValue().contains("Opportunity: fix-0badcafe"));
            assertTrue(prompt.getValue().contains("errorMessage: connection timeout"));
            assertTrue(prompt.getValue().contains("### src/main/java/Fetch.java"));
        }

        @Test
        @DisplayName("returns null when the response cannot be parsed")
        void parseFailure() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new LlmParseException("bad json"));
            assertNull(generator.generate(OPPORTUNITY));
        }

        @Test
        @DisplayName("returns null on an empty response")
        void emptyResponse() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new LlmEmptyResponseException("empty"));
            assertNull(generator.generate(OPPORTUNITY));
        }

        @Test
        @DisplayName("returns null when the reasoning service is unreachable")
        void transportFailure() {
            when(llmService.structuredCall(anyString(), anyString(), any()))
                    .thenThrow(new RuntimeException("connect timed out"));
            assertNull(generator.generate(OPPORTUNITY));
        }

        @Test
        @DisplayName("returns null when the response violates the schema")
        void schemaViolation() {
            respond(new GeneratedImprovement("t", "d",
                    List.of(new GeneratedChange("a.txt", "rename", "", "x")), null));
            assertNull(generator.generate(OPPORTUNITY));
        }
    }

    @Nested
    @DisplayName("checkSchema")
    class SchemaTests {

        @Test
        @DisplayName("requires a title and at least one change")
        void requiresTitleAndChanges() {
            List<String> errors = ChangeGenerator.checkSchema(new GeneratedImprovement(" ", "d", List.of(), null));
            assertEquals(2, errors.size());
        }

        @Test
        @DisplayName("create and modify need content, delete does not")
        void contentRules() {
            assertFalse(ChangeGenerator.checkSchema(new GeneratedImprovement("t", "d",
                    List.of(new GeneratedChange("a", "modify", "", null)), null)).isEmpty());
            assertTrue(ChangeGenerator.checkSchema(new GeneratedImprovement("t", "d",
                    List.of(new GeneratedChange("a", "delete", "", null)), null)).isEmpty());
        }

        @Test
        @DisplayName("null response is an error")
        void nullResponse() {
            assertEquals(List.of("empty response"), ChangeGenerator.checkSchema(null));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("accepts a valid modify and captures prior content")
        void capturesPriorContent() {
            ValidationReport report = generator.validate(improvement(
                    change("src/main/java/Fetch.java", ChangeKind.MODIFY, "class Fetch { int timeout = 30; }")));

            assertTrue(report.ok(), () -> String.join("; ", report.errors()));
            assertEquals("class Fetch { int timeout = 5; }", report.improvement().changes().get(0).priorContent());
        }

        @Test
        @DisplayName("rejects absolute paths")
        void absolutePath() {
            ValidationReport report = generator.validate(improvement(
                    change(root.resolve("x.txt").toString(), ChangeKind.CREATE, "x")));
            assertFalse(report.ok());
        }

        @Test
        @DisplayName("rejects paths escaping the project root")
        void escapingPath() {
            ValidationReport report = generator.validate(improvement(
                    change("src/../../outside.txt", ChangeKind.CREATE, "x")));
            assertFalse(report.ok());
            assertTrue(report.errors().get(0).contains("escapes the project root"));
        }

        @Test
        @DisplayName("rejects protected paths")
        void protectedPaths() {
            assertFalse(generator.validate(improvement(change(".git/config", ChangeKind.MODIFY, "x"))).ok());
            assertFalse(generator.validate(improvement(change(".ouroboros/improvements.jsonl", ChangeKind.CREATE, "x"))).ok());
            assertFalse(generator.validate(improvement(change("secrets/key.txt", ChangeKind.CREATE, "x"))).ok());
        }

        @Test
        @DisplayName("rejects duplicate paths")
        void duplicates() {
            ValidationReport report = generator.validate(improvement(
                    change("a.txt", ChangeKind.CREATE, "1"),
                    change("./a.txt", ChangeKind.CREATE, "2")));
            assertFalse(report.ok());
            assertTrue(report.errors().get(0).contains("more than once"));
        }

        @Test
        @DisplayName("modify and delete require an existing target")
        void missingTarget() {
            assertFalse(generator.validate(improvement(change("Nope.java", ChangeKind.MODIFY, "class Nope {}"))).ok());
            assertFalse(generator.validate(improvement(change("nope.txt", ChangeKind.DELETE, null))).ok());
        }

        @Test
        @DisplayName("error messages do not depend on the default locale")
        void localeIndependentMessages() {
            Locale original = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                ValidationReport report = generator.validate(improvement(
                        change("Nope.java", ChangeKind.MODIFY, "class Nope {}")));
                assertEquals("Nope.java: modify target does not exist", report.errors().get(0));
            } finally {
                Locale.setDefault(original);
            }
        }

        @Test
        @DisplayName("rejects syntactically invalid content")
        void syntaxErrors() {
            ValidationReport report = generator.validate(improvement(
                    change("src/main/java/Fetch.java", ChangeKind.MODIFY, "class Fetch { int timeout = ; ")));
            assertFalse(report.ok());
        }

        @Test
        @DisplayName("one invalid change fails the whole improvement")
        void allOrNothing() {
            ValidationReport report = generator.validate(improvement(
                    change("ok.txt", ChangeKind.CREATE, "fine"),
                    change("bad.json", ChangeKind.CREATE, "{oops")));
            assertFalse(report.ok());
            assertEquals(1, report.errors().size());
        }

        @Test
        @DisplayName("create onto a directory is rejected")
        void createOntoDirectory() {
            assertFalse(generator.validate(improvement(change("src/main/java", ChangeKind.CREATE, "x"))).ok());
        }

        @Test
        @DisplayName("an improvement without changes is rejected")
        void noChanges() {
            assertFalse(generator.validate(improvement()).ok());
        }

        @Test
        @DisplayName("delete needs no content and captures prior content")
        void deleteCapturesContent() {
            ValidationReport report = generator.validate(improvement(
                    change("src/main/java/Fetch.java", ChangeKind.DELETE, null)));
            assertTrue(report.ok());
            assertNotNull(report.improvement().changes().get(0).priorContent());
        }
    }
}
