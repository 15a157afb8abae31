package com.example.plancompiler.definition;

/**
 * Checks a compiled state machine definition against the target platform's rules.
 */
public interface StateMachineDefinitionValidator {

    /**
     * @param definitionJson the state machine definition as JSON text
     * @throws DefinitionValidationServiceException when the check itself could not be performed
     */
    DefinitionValidationResult validate(String definitionJson);
}
