package com.linlay.goapengine.spi;

import java.util.List;

public record ToolGroup(
        String role,
        String description,
        List<String> toolNames
) {
    public ToolGroup {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Tool group role must not be blank");
        }
        description = description == null ? role : description;
        toolNames = toolNames == null ? List.of() : List.copyOf(toolNames);
    }
}
