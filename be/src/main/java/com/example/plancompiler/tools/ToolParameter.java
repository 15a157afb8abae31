package com.example.plancompiler.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A declared tool parameter. Only {@code name} and {@code required} take part in validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolParameter(String name, String type, String description, boolean required) {
}
