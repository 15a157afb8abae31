package com.example.plancompiler.api.v1;

import com.example.plancompiler.api.v1.dto.ProgramListResponse;
import com.example.plancompiler.api.v1.dto.ProgramResponse;
import com.example.plancompiler.service.CompiledProgramService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for stored compiled programs: list, get by id, get input template, delete.
 */
@RestController
@RequestMapping("/api/v1/programs")
@RequiredArgsConstructor
@Slf4j
public class ProgramController {

    private final CompiledProgramService service;

    @GetMapping
    public ResponseEntity<ProgramListResponse> list() {
        log.debug("Listing all compiled programs");
        return ResponseEntity.ok(new ProgramListResponse(service.findAll()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProgramResponse> getById(@PathVariable UUID id) {
        log.info("Getting compiled program id={}", id);
        return ResponseEntity.ok(service.findById(id));
    }

    @GetMapping("/{id}/input-template")
    public ResponseEntity<Map<String, List<Object>>> inputTemplate(@PathVariable UUID id) {
        log.info("Getting input template for program id={}", id);
        return ResponseEntity.ok(service.findInputTemplate(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        log.info("Deleting compiled program id={}", id);
        service.delete(id);
        log.info("Deleted compiled program id={}", id);
        return ResponseEntity.noContent().build();
    }
}
