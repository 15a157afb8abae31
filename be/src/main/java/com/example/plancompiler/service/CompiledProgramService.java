package com.example.plancompiler.service;

import com.example.plancompiler.api.CompiledProgramNotFoundException;
import com.example.plancompiler.api.v1.dto.ProgramListItem;
import com.example.plancompiler.api.v1.dto.ProgramResponse;
import com.example.plancompiler.domain.CompiledProgram;
import com.example.plancompiler.repository.CompiledProgramRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read and delete access to stored compiled programs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompiledProgramService {

    private final CompiledProgramRepository repository;
    private final JsonMapper jsonMapper;

    @Transactional(readOnly = true)
    public List<ProgramListItem> findAll() {
        List<ProgramListItem> list = repository.findAllByOrderByCreatedAtDesc().stream()
                .map(program -> new ProgramListItem(program.getId(), program.getName(), program.getStateCount(), program.getCreatedAt()))
                .toList();
        log.debug("findAll returned {} programs", list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public ProgramResponse findById(UUID id) {
        log.debug("Finding compiled program by id={}", id);
        CompiledProgram program = load(id);
        return new ProgramResponse(
                program.getId(),
                program.getName(),
                readDefinition(program.getDefinitionJson()),
                readInputTemplate(program.getInputTemplateJson()),
                program.getStateCount(),
                program.getCreatedAt()
        );
    }

    @Transactional(readOnly = true)
    public Map<String, List<Object>> findInputTemplate(UUID id) {
        return readInputTemplate(load(id).getInputTemplateJson());
    }

    @Transactional
    public void delete(UUID id) {
        log.debug("Deleting compiled program id={}", id);
        if (!repository.existsById(id)) {
            throw new CompiledProgramNotFoundException(id);
        }
        repository.deleteById(id);
    }

    private CompiledProgram load(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new CompiledProgramNotFoundException(id));
    }

    private Map<String, Object> readDefinition(String json) {
        try {
            return jsonMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize state machine definition", e);
        }
    }

    private Map<String, List<Object>> readInputTemplate(String json) {
        try {
            return jsonMapper.readValue(json, new TypeReference<Map<String, List<Object>>>() { });
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize input template", e);
        }
    }
}
