package io.urlcrypt.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.urlcrypt.core.error.ShapeDefinitionException;
import io.urlcrypt.core.model.ShapeMember;
import io.urlcrypt.core.model.TargetShape;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML target shape declarations into {@link TargetShape} instances.
 *
 * <p>Document format (a map of shape name → shape):
 *
 * <pre>
 * customer-search:
 *   members:
 *     - name: lastName
 *       encrypted: true
 *     - name: address
 *       shape: address          # composite, references another declared shape
 * address:
 *   members:
 *     - name: zip
 *       wire-name: postalCode
 *       encrypted: true
 *       ignore-warning: true
 * </pre>
 *
 * The document is validated against the bundled {@code schemas/shapes.schema.json} (JSON Schema
 * 2020-12) before any shape is built, so unknown keys and wrong types are rejected at load time.
 * References are resolved by name; dangling and cyclic references are rejected.
 *
 * <p>Thread-safe.
 */
public final class ShapeParser {

    private static final Logger LOG = LoggerFactory.getLogger(ShapeParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/shapes.schema.json";

    private final JsonSchema documentSchema;

    public ShapeParser() {
        this.documentSchema = SCHEMA_FACTORY.getSchema(loadSchema());
    }

    /**
     * Parses a YAML file holding a shapes document.
     *
     * @return shapes by name, in declaration order
     * @throws ShapeDefinitionException if the file cannot be read or the document is invalid
     */
    public Map<String, TargetShape> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ShapeDefinitionException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses an already-read shapes document (e.g. the {@code shapes} section of a larger config
     * file).
     *
     * @param node   the shapes map; {@code null} or a missing node yields no shapes
     * @param source file path or resource name for error messages
     * @return shapes by name, in declaration order
     */
    public Map<String, TargetShape> parse(JsonNode node, String source) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        validate(node, source);

        Map<String, JsonNode> declared = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            declared.put(entry.getKey(), entry.getValue());
        }

        Map<String, TargetShape> resolved = new LinkedHashMap<>();
        for (String name : declared.keySet()) {
            resolve(name, declared, resolved, new ArrayDeque<>(), source);
        }
        LOG.debug("Parsed {} target shape(s) from {}: {}", resolved.size(), source, resolved.keySet());
        return Collections.unmodifiableMap(resolved);
    }

    private TargetShape resolve(
            String name,
            Map<String, JsonNode> declared,
            Map<String, TargetShape> resolved,
            Deque<String> inProgress,
            String source) {
        TargetShape done = resolved.get(name);
        if (done != null) {
            return done;
        }
        if (inProgress.contains(name)) {
            List<String> cycle = new ArrayList<>();
            inProgress.descendingIterator().forEachRemaining(cycle::add);
            cycle.add(name);
            throw new ShapeDefinitionException("Recursive shape reference: " + String.join(" -> ", cycle), source);
        }
        inProgress.push(name);

        TargetShape.Builder builder = TargetShape.builder(name);
        for (JsonNode memberNode : declared.get(name).get("members")) {
            String memberName = memberNode.get("name").asText();
            String reference = textOrNull(memberNode, "shape");
            boolean encrypted = memberNode.path("encrypted").asBoolean(false);
            if (reference != null) {
                if (encrypted) {
                    throw new ShapeDefinitionException(
                            "Member '" + memberName + "' of shape '" + name
                                    + "' references shape '" + reference + "' and cannot be encrypted",
                            source);
                }
                if (!declared.containsKey(reference)) {
                    throw new ShapeDefinitionException(
                            "Member '" + memberName + "' of shape '" + name
                                    + "' references unknown shape '" + reference + "'; declared shapes are: "
                                    + declared.keySet(),
                            source);
                }
                builder.composite(memberName, resolve(reference, declared, resolved, inProgress, source));
            } else {
                builder.member(new ShapeMember(
                        memberName,
                        textOrNull(memberNode, "wire-name"),
                        encrypted,
                        memberNode.path("ignore-warning").asBoolean(false),
                        null));
            }
        }

        inProgress.pop();
        TargetShape shape = builder.build();
        resolved.put(name, shape);
        return shape;
    }

    private void validate(JsonNode node, String source) {
        Set<ValidationMessage> errors = documentSchema.validate(node);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ShapeDefinitionException("Shape declarations failed schema validation: " + detail, source);
        }
    }

    private static JsonNode loadSchema() {
        try (InputStream in = ShapeParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
