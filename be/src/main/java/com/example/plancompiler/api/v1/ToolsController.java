package com.example.plancompiler.api.v1;

import com.example.plancompiler.api.v1.dto.ToolInfoDto;
import com.example.plancompiler.tools.ToolParameter;
import com.example.plancompiler.tools.ToolRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for listing the tools of the default catalog.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolInfoDto> list() {
        List<ToolInfoDto> tools = toolRegistry.getTools().stream()
                .map(tool -> new ToolInfoDto(
                        tool.name(),
                        tool.description(),
                        tool.parameters().stream().map(ToolParameter::name).toList()))
                .collect(Collectors.toList());
        log.debug("Listing available tools count={}", tools.size());
        return tools;
    }
}
