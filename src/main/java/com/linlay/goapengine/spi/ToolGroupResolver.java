package com.linlay.goapengine.spi;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the tool groups actions ask for by role.
 */
public interface ToolGroupResolver {

    Optional<ToolGroup> resolveToolGroup(String role);

    List<ToolGroup> availableToolGroups();
}
