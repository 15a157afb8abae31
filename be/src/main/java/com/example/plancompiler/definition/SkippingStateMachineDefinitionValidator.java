package com.example.plancompiler.definition;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no validation service is configured; accepts every definition.
 */
@Slf4j
public class SkippingStateMachineDefinitionValidator implements StateMachineDefinitionValidator {

    @Override
    public DefinitionValidationResult validate(String definitionJson) {
        log.debug("No definition validation service configured, skipping check");
        return DefinitionValidationResult.skipped();
    }
}
