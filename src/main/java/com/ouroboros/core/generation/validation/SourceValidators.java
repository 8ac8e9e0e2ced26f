package com.ouroboros.core.generation.validation;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dispatches generated content to the {@link SourceValidator} registered for its
 * file extension. Extensions with no validator are accepted as plain text.
 */
@Component
public class SourceValidators {

    private final Map<String, SourceValidator> byExtension = new HashMap<>();

    public SourceValidators(List<SourceValidator> validators) {
        for (SourceValidator validator : validators) {
            for (String ext : validator.extensions()) {
                byExtension.put(ext, validator);
            }
        }
    }

    /** All built-in validators; used outside a Spring context. */
    public static SourceValidators defaults() {
        return new SourceValidators(List.of(
                new JavaSourceValidator(),
                new JsonSourceValidator(),
                new YamlSourceValidator(),
                new XmlSourceValidator()));
    }

    public List<String> validate(String path, String content) {
        SourceValidator validator = byExtension.get(extensionOf(path));
        if (validator == null) {
            return List.of();
        }
        return validator.validate(path, content);
    }

    public boolean hasValidatorFor(String path) {
        return byExtension.containsKey(extensionOf(path));
    }

    static String extensionOf(String path) {
        String name = path.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
