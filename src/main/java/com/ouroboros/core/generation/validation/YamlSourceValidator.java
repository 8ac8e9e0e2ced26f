package com.ouroboros.core.generation.validation;

import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.List;
import java.util.Set;

/**
 * Loads every document in the stream with the safe constructor, so arbitrary
 * type tags are rejected rather than instantiated.
 */
@Component
public class YamlSourceValidator implements SourceValidator {

    @Override
    public Set<String> extensions() {
        return Set.of("yml", "yaml");
    }

    @Override
    public List<String> validate(String path, String content) {
        var yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try {
            for (Object ignored : yaml.loadAll(content)) {
                // drain the iterator; parsing happens lazily
            }
            return List.of();
        } catch (YAMLException e) {
            return List.of(path + ": " + e.getMessage());
        }
    }
}
