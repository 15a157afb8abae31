package com.example.plancompiler.api.v1;

import com.example.plancompiler.api.v1.dto.CompileResponse;
import com.example.plancompiler.api.v1.dto.PlanRequest;
import com.example.plancompiler.api.v1.dto.ValidationResponse;
import com.example.plancompiler.service.PlanCompilationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for validating and compiling workflow plans.
 * <p>
 * {@code POST /api/v1/plans/validate} reports every problem in a plan without compiling it;
 * {@code POST /api/v1/plans/compile} compiles a valid plan and stores the result.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
@Slf4j
public class PlanController {

    private final PlanCompilationService service;

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody PlanRequest request) {
        log.info("Validating plan customTools={}", request.tools() != null ? request.tools().size() : 0);
        ValidationResponse response = service.validate(request);
        log.info("Validated plan valid={} nodeCount={} errors={}", response.valid(), response.nodeCount(), response.errors().size());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody PlanRequest request) {
        log.info("Compiling plan customTools={}", request.tools() != null ? request.tools().size() : 0);
        CompileResponse response = service.compile(request);
        log.info("Compiled plan id={} name={} stateCount={}", response.id(), response.name(), response.stateCount());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
