package com.ouroboros.core.generation.validation;

import com.sun.source.util.JavacTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs the JDK compiler's parse phase only. No symbols are resolved and no class
 * files are produced, so generated sources with unknown imports still pass.
 */
@Component
public class JavaSourceValidator implements SourceValidator {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceValidator.class);

    private final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();

    @Override
    public Set<String> extensions() {
        return Set.of("java");
    }

    @Override
    public List<String> validate(String path, String content) {
        if (compiler == null) {
            log.warn("No system Java compiler available; accepting {} without a syntax check", path);
            return List.of();
        }
        var diagnostics = new DiagnosticCollector<JavaFileObject>();
        var source = new InMemorySource(path, content);
        var task = (JavacTask) compiler.getTask(null, null, diagnostics,
                List.of("-proc:none"), null, List.of(source));
        try {
            task.parse();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        var errors = new ArrayList<String>();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() == Diagnostic.Kind.ERROR) {
                errors.add(String.format("%s:%d: %s", path, d.getLineNumber(), d.getMessage(Locale.ROOT)));
            }
        }
        return errors;
    }

    private static final class InMemorySource extends SimpleJavaFileObject {
        private final String content;

        InMemorySource(String path, String content) {
            super(URI.create("string:///" + path.replace('\\', '/')), Kind.SOURCE);
            this.content = content;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return content;
        }
    }
}
