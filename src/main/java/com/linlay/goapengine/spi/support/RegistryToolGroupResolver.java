package com.linlay.goapengine.spi.support;

import com.linlay.goapengine.spi.ToolGroup;
import com.linlay.goapengine.spi.ToolGroupResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tool groups registered up front, looked up by case-insensitive role.
 */
public class RegistryToolGroupResolver implements ToolGroupResolver {

    private final String name;
    private final Map<String, ToolGroup> groupsByRole;

    public RegistryToolGroupResolver(String name, List<ToolGroup> toolGroups) {
        this.name = name;
        Map<String, ToolGroup> byRole = new LinkedHashMap<>();
        if (toolGroups != null) {
            for (ToolGroup group : toolGroups) {
                String key = normalizeRole(group.role());
                if (byRole.containsKey(key)) {
                    throw new IllegalStateException("Duplicate tool group role: " + group.role() + " in " + name);
                }
                byRole.put(key, group);
            }
        }
        this.groupsByRole = Map.copyOf(byRole);
    }

    @Override
    public Optional<ToolGroup> resolveToolGroup(String role) {
        return Optional.ofNullable(groupsByRole.get(normalizeRole(role)));
    }

    @Override
    public List<ToolGroup> availableToolGroups() {
        return groupsByRole.values().stream()
                .sorted((a, b) -> a.role().compareTo(b.role()))
                .toList();
    }

    public String getName() {
        return name;
    }

    private static String normalizeRole(String role) {
        return role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
    }
}
