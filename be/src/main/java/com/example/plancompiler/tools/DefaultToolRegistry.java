package com.example.plancompiler.tools;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool registry backed by a JSON catalog on the classpath, loaded once at startup.
 * <p>
 * The catalog is either a bare list of tool definitions or an object holding that list under
 * {@code available_tools}, {@code tools} or {@code tool_definitions}.
 * </p>
 */
@Component
@Slf4j
public class DefaultToolRegistry implements ToolRegistry {

    private static final List<String> LIST_KEYS = List.of("available_tools", "tools", "tool_definitions");

    private final StaticToolRegistry delegate;

    public DefaultToolRegistry(
            JsonMapper jsonMapper,
            @Value("${plan-compiler.tools.catalog:tools/available-tools.json}") String catalogPath) {
        this.delegate = StaticToolRegistry.of(load(jsonMapper, catalogPath));
        log.info("Loaded tool catalog {} tools={}", catalogPath, delegate.getAvailableToolNames());
    }

    @Override
    public Optional<ToolDefinition> find(String toolName) {
        return delegate.find(toolName);
    }

    @Override
    public List<ToolDefinition> getTools() {
        return delegate.getTools();
    }

    static List<ToolDefinition> load(JsonMapper jsonMapper, String catalogPath) {
        Resource resource = new ClassPathResource(catalogPath);
        if (!resource.exists()) {
            log.warn("Tool catalog not found on classpath: {}", catalogPath);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            Object catalog = jsonMapper.readValue(in, new TypeReference<Object>() { });
            return jsonMapper.convertValue(extractToolList(catalog, catalogPath), new TypeReference<List<ToolDefinition>>() { });
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to parse tool catalog " + catalogPath, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tool catalog " + catalogPath, e);
        }
    }

    private static Object extractToolList(Object catalog, String catalogPath) {
        if (catalog instanceof List<?>) {
            return catalog;
        }
        if (catalog instanceof Map<?, ?> map) {
            for (String key : LIST_KEYS) {
                if (map.get(key) instanceof List<?> list) {
                    return list;
                }
            }
        }
        throw new IllegalStateException("Tool catalog " + catalogPath + " does not contain a list of tools");
    }
}
