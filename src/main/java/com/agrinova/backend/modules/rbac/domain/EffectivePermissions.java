package com.agrinova.backend.modules.rbac.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable permission set resolved for one user at one instant.
 */
public final class EffectivePermissions {

    private static final EffectivePermissions NONE = new EffectivePermissions(Set.of());

    private final Set<String> names;

    private EffectivePermissions(Set<String> names) {
        this.names = names;
    }

    public static EffectivePermissions none() {
        return NONE;
    }

    public static EffectivePermissions of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return NONE;
        }
        return new EffectivePermissions(Collections.unmodifiableSet(new TreeSet<>(names)));
    }

    /**
     * baseline ∪ grants − denies. A permission that is both granted and denied is denied.
     */
    public static EffectivePermissions compute(Collection<String> baseline,
                                               Collection<String> grants,
                                               Collection<String> denies) {
        Set<String> result = new TreeSet<>(baseline);
        result.addAll(grants);
        result.removeAll(denies);
        return of(result);
    }

    public boolean allows(String permission) {
        return permission != null && names.contains(permission);
    }

    public boolean hasAny(Collection<String> permissions) {
        return permissions.stream().anyMatch(this::allows);
    }

    public boolean hasAll(Collection<String> permissions) {
        return permissions.stream().allMatch(this::allows);
    }

    public Set<String> names() {
        return names;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EffectivePermissions other)) {
            return false;
        }
        return names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "EffectivePermissions" + names;
    }
}
