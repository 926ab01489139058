package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.core.RelationTypeRegistry.RelationTypeDef;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads relation type definitions from a YAML file or classpath resource.
 * <pre>
 * version: 1
 * relationTypes:
 *   - id: part_of
 *     transitive: true
 *     inverseOf: has_part
 * </pre>
 */
public final class YamlRelationTypeLoader {

    public static final String DEFAULT_RESOURCE = "/relation-types.yaml";

    // DTOs mirroring YAML
    public record YRelationTypes(Integer version, List<YRelationType> relationTypes) {}
    public record YRelationType(
            String id,
            Boolean symmetric,
            Boolean transitive,
            Boolean reflexive,
            Boolean equivalence,
            String inverseOf
    ) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public RelationTypeRegistry loadDefault() throws IOException {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public RelationTypeRegistry loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toRegistry(mapper.readValue(in, YRelationTypes.class));
        }
    }

    public RelationTypeRegistry loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toRegistry(mapper.readValue(in, YRelationTypes.class));
        }
    }

    public RelationTypeRegistry load(InputStream in) throws IOException {
        return toRegistry(mapper.readValue(in, YRelationTypes.class));
    }

    private RelationTypeRegistry toRegistry(YRelationTypes y) {
        List<RelationTypeDef> defs = new ArrayList<>();
        for (YRelationType t : Optional.ofNullable(y.relationTypes()).orElse(List.of())) {
            defs.add(new RelationTypeDef(
                    t.id(),
                    Boolean.TRUE.equals(t.symmetric()),
                    Boolean.TRUE.equals(t.transitive()),
                    Boolean.TRUE.equals(t.reflexive()),
                    Boolean.TRUE.equals(t.equivalence()),
                    Optional.ofNullable(t.inverseOf()).filter(s -> !s.isBlank())
            ));
        }
        RelationTypeValidator.validate(defs);
        return RelationTypeRegistry.inMemory(defs);
    }
}
