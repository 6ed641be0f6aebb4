package org.sirena.diagram;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Find-or-create store for entities keyed by their textual id. Entities keep the order
 * in which they were first referenced.
 */
public class EntityRegistry<E> {

    private final Map<String, E> entities = new LinkedHashMap<>();
    private final Function<String, E> factory;

    /**
     * @param factory builds an implicit entity for an id seen for the first time
     */
    public EntityRegistry(Function<String, E> factory) {
        this.factory = factory;
    }

    public E findOrCreate(String id) {
        return entities.computeIfAbsent(id, factory);
    }

    public Optional<E> find(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    /** Adds an entity built elsewhere; an existing entry under the same id wins. */
    public E putIfAbsent(String id, E entity) {
        E existing = entities.putIfAbsent(id, entity);
        return existing != null ? existing : entity;
    }

    public int size() {
        return entities.size();
    }

    /** Snapshot in first-seen order. */
    public List<E> values() {
        return new ArrayList<>(entities.values());
    }

    /** Returns {@code candidate} unless it is null or blank, in which case {@code current}. */
    public static String merge(String current, String candidate) {
        return candidate == null || candidate.isBlank() ? current : candidate;
    }
}
