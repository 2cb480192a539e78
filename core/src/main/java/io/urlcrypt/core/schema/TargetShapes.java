package io.urlcrypt.core.schema;

import io.urlcrypt.core.error.ShapeDefinitionException;
import io.urlcrypt.core.model.ShapeMember;
import io.urlcrypt.core.model.TargetShape;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link TargetShape} from an annotated Java type, once, at startup.
 *
 * <p>Records contribute their components, other classes their declared non-static fields
 * (superclass fields first). Terminal types are leaves: primitives, arrays, enums, every JDK
 * type (any package under {@code java.}, e.g. {@code String}, {@code java.time}, {@code URI},
 * {@code Locale}, {@code Date}) and any {@code CharSequence}, {@code Number}, collection or map.
 * Every other member type is walked as a composite.
 */
public final class TargetShapes {

    private TargetShapes() {
        // utility class
    }

    /**
     * @param type the binding type
     * @return the derived shape, named after the type's simple name
     * @throws ShapeDefinitionException if the type graph is recursive or a composite is marked
     *                                  {@link Encrypted}
     */
    public static TargetShape fromType(Class<?> type) {
        if (type == null) {
            throw new ShapeDefinitionException("type must not be null", null);
        }
        if (isTerminal(type)) {
            throw new ShapeDefinitionException(
                    "Type " + type.getName() + " is a terminal type and cannot be a target shape", type.getName());
        }
        return build(type, new ArrayDeque<>(), type.getName());
    }

    private static TargetShape build(Class<?> type, Deque<Class<?>> inProgress, String root) {
        if (inProgress.contains(type)) {
            throw new ShapeDefinitionException(
                    "Recursive shape: " + type.getName() + " is reachable from itself via " + path(inProgress, type),
                    root);
        }
        inProgress.push(type);
        TargetShape.Builder builder = TargetShape.builder(type.getSimpleName());
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                builder.member(member(component.getName(), component.getType(), component, inProgress, root));
            }
        } else {
            for (Field field : fieldsOf(type)) {
                builder.member(member(field.getName(), field.getType(), field, inProgress, root));
            }
        }
        inProgress.pop();
        return builder.build();
    }

    private static ShapeMember member(
            String name, Class<?> memberType, AnnotatedElement element, Deque<Class<?>> inProgress, String root) {
        Encrypted encrypted = element.getAnnotation(Encrypted.class);
        QueryName queryName = element.getAnnotation(QueryName.class);
        String wireName = queryName != null ? queryName.value() : null;
        if (isTerminal(memberType)) {
            return new ShapeMember(
                    name, wireName, encrypted != null, encrypted != null && encrypted.ignoreWarning(), null);
        }
        if (encrypted != null) {
            throw new ShapeDefinitionException(
                    "Member '" + name + "' of composite type " + memberType.getName()
                            + " cannot be @Encrypted; mark its leaf members instead",
                    root);
        }
        return ShapeMember.composite(name, build(memberType, inProgress, root));
    }

    private static List<Field> fieldsOf(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    static boolean isTerminal(Class<?> type) {
        return type.isPrimitive()
                || type.isArray()
                || type.isEnum()
                || CharSequence.class.isAssignableFrom(type)
                || Number.class.isAssignableFrom(type)
                || Collection.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type)
                || type.getPackageName().startsWith("java.");
    }

    private static String path(Deque<Class<?>> inProgress, Class<?> repeated) {
        List<String> names = new ArrayList<>();
        inProgress.descendingIterator().forEachRemaining(c -> names.add(c.getSimpleName()));
        names.add(repeated.getSimpleName());
        return String.join(" -> ", names);
    }
}
