package com.example.plancompiler.api.v1.dto;

import java.util.List;

/**
 * API response for one available tool: name, description and declared parameter names.
 */
public record ToolInfoDto(String name, String description, List<String> parameters) {}
