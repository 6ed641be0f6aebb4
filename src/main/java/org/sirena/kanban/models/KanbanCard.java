package org.sirena.kanban.models;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param metadata keys from the {@code @{ ... }} block other than the named ones
 */
@Builder
public record KanbanCard(
        String id,
        String text,
        String assigned,
        String ticket,
        String icon,
        String label,
        String priority,
        Map<String, String> metadata
) {
    public KanbanCard {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
