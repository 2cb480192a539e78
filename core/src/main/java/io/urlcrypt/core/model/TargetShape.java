package io.urlcrypt.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Neutral description of the data shape a request binds to: an ordered list of members, some of
 * them encrypted leaves, some nested composites. Built once at startup (builder, annotation
 * derivation or YAML) and immutable afterwards.
 *
 * @param name    shape name, used in logs and for references between declared shapes
 * @param members members in declaration order
 */
public record TargetShape(String name, List<ShapeMember> members) {

    public TargetShape {
        Objects.requireNonNull(name, "name must not be null");
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Fluent builder; members keep the order they are added in. */
    public static final class Builder {

        private final String name;
        private final List<ShapeMember> members = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder plain(String memberName) {
            members.add(ShapeMember.plain(memberName));
            return this;
        }

        public Builder encrypted(String memberName) {
            members.add(ShapeMember.encrypted(memberName));
            return this;
        }

        public Builder encrypted(String memberName, String wireName, boolean ignoreWarning) {
            members.add(ShapeMember.encrypted(memberName, wireName, ignoreWarning));
            return this;
        }

        public Builder composite(String memberName, TargetShape shape) {
            members.add(ShapeMember.composite(memberName, shape));
            return this;
        }

        public Builder member(ShapeMember member) {
            members.add(Objects.requireNonNull(member, "member must not be null"));
            return this;
        }

        public TargetShape build() {
            return new TargetShape(name, members);
        }
    }
}
