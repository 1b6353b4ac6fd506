package com.atrium.authorization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Every catalog operation a user may perform, with the combined scope for each.
 *
 * @param scopes resolved scope per operation; operations without a grant are absent
 */
public record EffectivePermissions(Map<Operation, Scope> scopes) {

    private static final EffectivePermissions NONE = new EffectivePermissions(Map.of());

    public EffectivePermissions {
        scopes = Map.copyOf(scopes);
    }

    /** No permissions at all. */
    public static EffectivePermissions none() {
        return NONE;
    }

    public Optional<Scope> scopeFor(Operation operation) {
        return Optional.ofNullable(scopes.get(operation));
    }

    public boolean allows(Operation operation) {
        return scopes.containsKey(operation);
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    /**
     * Allowed actions grouped by module, both sorted ascending.
     */
    public Map<String, List<String>> actionsByModule() {
        Map<String, List<String>> grouped = new TreeMap<>();
        for (Operation operation : scopes.keySet()) {
            grouped.computeIfAbsent(operation.module(), m -> new ArrayList<>()).add(operation.action());
        }
        Map<String, List<String>> result = new TreeMap<>();
        grouped.forEach((module, actions) -> {
            Collections.sort(actions);
            result.put(module, List.copyOf(actions));
        });
        return Collections.unmodifiableMap(result);
    }
}
