package io.urlcrypt.core.schema;

import io.urlcrypt.core.model.FieldPolicy;
import io.urlcrypt.core.model.ShapeMember;
import io.urlcrypt.core.model.TargetShape;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens a {@link TargetShape} into the ordered list of {@link FieldPolicy} records the
 * schema-driven query strategy applies.
 *
 * <p>Traversal is depth-first in member declaration order. Each encrypted leaf yields one policy
 * named by its wire-name override, else its declared name; composites are walked and their
 * policies spliced in place. Duplicate names are kept. Shapes are assumed acyclic: {@link
 * TargetShapes} and {@link ShapeParser} reject recursive declarations before a shape reaches the
 * walker.
 */
public final class SchemaWalker {

    private SchemaWalker() {
        // utility class
    }

    /**
     * @param shape the shape to walk, may be {@code null}
     * @return an unmodifiable list of policies; empty for a {@code null} shape
     */
    public static List<FieldPolicy> walk(TargetShape shape) {
        if (shape == null) {
            return List.of();
        }
        List<FieldPolicy> policies = new ArrayList<>();
        collect(shape, policies);
        return Collections.unmodifiableList(policies);
    }

    private static void collect(TargetShape shape, List<FieldPolicy> policies) {
        for (ShapeMember member : shape.members()) {
            if (member.isComposite()) {
                collect(member.composite(), policies);
            } else if (member.encrypted()) {
                policies.add(new FieldPolicy(member.effectiveName(), member.ignoreWarning()));
            }
        }
    }
}
