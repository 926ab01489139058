package com.e2eq.lexikon.graph.core;

import java.util.*;

public final class InMemoryRelationTypeRegistry implements RelationTypeRegistry {
    private final Map<String, RelationTypeDef> types;

    public InMemoryRelationTypeRegistry(Collection<RelationTypeDef> defs) {
        Map<String, RelationTypeDef> m = new LinkedHashMap<>();
        for (RelationTypeDef d : defs) m.put(d.name(), d);
        this.types = Collections.unmodifiableMap(m);
    }

    public Optional<RelationTypeDef> typeOf(String name) { return Optional.ofNullable(name == null ? null : types.get(name)); }
    public Map<String, RelationTypeDef> types() { return types; }
}
