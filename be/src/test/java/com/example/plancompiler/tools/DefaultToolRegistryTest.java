package com.example.plancompiler.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DefaultToolRegistry")
class DefaultToolRegistryTest {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    @DisplayName("loads the bundled catalog with sorted tool names")
    void loadsBundledCatalog() {
        DefaultToolRegistry registry = new DefaultToolRegistry(jsonMapper, "tools/available-tools.json");

        assertEquals(List.of("cancel_order", "check_inventory", "get_order", "process_payment", "send_notification"),
                registry.getAvailableToolNames());
        ToolDefinition payment = registry.find("process_payment").orElseThrow();
        assertTrue(payment.resource().startsWith("arn:"));
        assertEquals(Set.of("order_id", "amount"), payment.parameterNames());
        assertTrue(payment.parameters().stream().allMatch(ToolParameter::required));
    }

    @Test
    @DisplayName("accepts a bare list and ignores unknown fields")
    void loadsBareList() {
        DefaultToolRegistry registry = new DefaultToolRegistry(jsonMapper, "tools/bare-list-tools.json");

        assertEquals(List.of("lookup_customer"), registry.getAvailableToolNames());
        assertTrue(registry.find("lookup_customer").orElseThrow().parameters().get(0).required());
    }

    @Test
    @DisplayName("returns an empty registry when the catalog is missing")
    void missingCatalog() {
        DefaultToolRegistry registry = new DefaultToolRegistry(jsonMapper, "tools/does-not-exist.json");

        assertTrue(registry.getTools().isEmpty());
        assertTrue(registry.find("get_order").isEmpty());
    }

    @Test
    @DisplayName("fails fast on a catalog without a tool list")
    void brokenCatalog() {
        assertThrows(IllegalStateException.class,
                () -> new DefaultToolRegistry(jsonMapper, "tools/broken-tools.json"));
    }
}
