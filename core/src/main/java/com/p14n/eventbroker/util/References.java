package com.p14n.eventbroker.util;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Converts between objects and textual references of the form
 * {@code package:Class.Nested.FIELD}.
 *
 * <p>
 * The part before the colon is a package name, the part after it a path
 * starting at a top-level class and following public nested classes and
 * public fields, e.g. {@code com.acme.jobs:Subscribers.AUDIT}.
 * </p>
 */
public final class References {

    private References() {
    }

    /**
     * Returns the reference to a class or an enum constant.
     *
     * @param obj a class or enum constant
     * @return the reference
     * @throws IllegalArgumentException if the object is of another kind, or the
     *                                  reference would not resolve back to it
     */
    public static String objToRef(Object obj) {
        String ref;
        if (obj instanceof Class) {
            ref = classRef((Class<?>) obj);
        } else if (obj instanceof Enum) {
            Enum<?> constant = (Enum<?>) obj;
            ref = classRef(constant.getDeclaringClass()) + "." + constant.name();
        } else {
            throw new IllegalArgumentException("Only classes and enum constants are supported, got " + obj);
        }

        Object resolved;
        try {
            resolved = refToObj(ref);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Cannot create a reference to " + obj, e);
        }
        if (resolved != obj) {
            throw new IllegalArgumentException("Reference " + ref + " does not resolve to " + obj);
        }
        return ref;
    }

    /**
     * Resolves a reference to the object it names.
     *
     * @param ref the reference, e.g. {@code com.acme:Jobs.Subscribers.AUDIT}
     * @return the class or field value the reference names
     * @throws IllegalArgumentException if the reference is malformed or names
     *                                  nothing accessible
     */
    public static Object refToObj(String ref) {
        int colon = ref == null ? -1 : ref.indexOf(':');
        if (colon < 0 || colon == ref.length() - 1) {
            throw new IllegalArgumentException("Invalid reference " + ref + ", expected package:Class");
        }
        String pkg = ref.substring(0, colon);
        String[] path = ref.substring(colon + 1).split("\\.");

        Object obj = loadClass(pkg.isEmpty() ? path[0] : pkg + "." + path[0]);
        for (int i = 1; i < path.length; i++) {
            String name = path[i];
            if (obj instanceof Class) {
                Class<?> nested = findNested((Class<?>) obj, name);
                obj = nested != null ? nested : readField((Class<?>) obj, null, name);
            } else if (obj == null) {
                throw new IllegalArgumentException("Cannot resolve " + name + " in " + ref + ", "
                        + path[i - 1] + " is null");
            } else {
                obj = readField(obj.getClass(), obj, name);
            }
        }
        return obj;
    }

    private static String classRef(Class<?> cls) {
        String canonical = cls.getCanonicalName();
        if (canonical == null || cls.isArray() || cls.isPrimitive()) {
            throw new IllegalArgumentException("Only top-level and nested classes are supported, got " + cls);
        }
        String pkg = cls.getPackageName();
        return pkg + ":" + (pkg.isEmpty() ? canonical : canonical.substring(pkg.length() + 1));
    }

    private static Class<?> loadClass(String name) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = References.class.getClassLoader();
        }
        try {
            return Class.forName(name, true, loader);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Class " + name + " not found", e);
        }
    }

    private static Class<?> findNested(Class<?> owner, String name) {
        for (Class<?> nested : owner.getClasses()) {
            if (nested.getSimpleName().equals(name)) {
                return nested;
            }
        }
        return null;
    }

    private static Object readField(Class<?> owner, Object target, String name) {
        try {
            Field field = owner.getField(name);
            if (target == null && !Modifier.isStatic(field.getModifiers())) {
                throw new IllegalArgumentException(owner.getName() + "." + name + " is not static");
            }
            return field.get(target);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new IllegalArgumentException("No accessible member " + name + " in " + owner.getName(), e);
        }
    }
}
