package com.ouroboros.core.generation.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class JsonSourceValidator implements SourceValidator {

    private static final ObjectMapper STRICT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Override
    public Set<String> extensions() {
        return Set.of("json");
    }

    @Override
    public List<String> validate(String path, String content) {
        try {
            STRICT_MAPPER.readTree(content);
            return List.of();
        } catch (JsonProcessingException e) {
            return List.of(path + ": " + e.getOriginalMessage());
        }
    }
}
