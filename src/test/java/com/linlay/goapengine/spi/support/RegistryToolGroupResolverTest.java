package com.linlay.goapengine.spi.support;

import com.linlay.goapengine.spi.ToolGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryToolGroupResolverTest {

    @Test
    void shouldResolveRoleIgnoringCase() {
        ToolGroup web = new ToolGroup("web", "search the web", List.of("search", "fetch"));
        RegistryToolGroupResolver resolver = new RegistryToolGroupResolver("tools", List.of(web));

        assertThat(resolver.resolveToolGroup("WEB")).contains(web);
        assertThat(resolver.resolveToolGroup(" web ")).contains(web);
        assertThat(resolver.resolveToolGroup("math")).isEmpty();
    }

    @Test
    void shouldListGroupsSortedByRole() {
        RegistryToolGroupResolver resolver = new RegistryToolGroupResolver("tools", List.of(
                new ToolGroup("web", null, List.of()),
                new ToolGroup("math", null, List.of("add"))));

        assertThat(resolver.availableToolGroups()).extracting(ToolGroup::role).containsExactly("math", "web");
    }

    @Test
    void shouldRejectDuplicateRoles() {
        assertThatThrownBy(() -> new RegistryToolGroupResolver("tools", List.of(
                new ToolGroup("web", null, List.of()),
                new ToolGroup("Web", null, List.of()))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
