package com.example.plancompiler.definition;

import lombok.extern.slf4j.Slf4j;

import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * Posts {@code {"definition": "<json>"}} to a validation service and reads back
 * {@code {result, diagnostics}}.
 * <p>
 * Failures are not retried: a rejected or unreachable check is reported to the caller as is.
 * </p>
 */
@Slf4j
public class HttpStateMachineDefinitionValidator implements StateMachineDefinitionValidator {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpStateMachineDefinitionValidator(RestTemplate restTemplate, String url) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.url = Objects.requireNonNull(url, "url");
    }

    @Override
    public DefinitionValidationResult validate(String definitionJson) {
        log.debug("Validating state machine definition url={} length={}", url, definitionJson.length());
        DefinitionValidationResult result;
        try {
            result = restTemplate.postForObject(url, Map.of("definition", definitionJson), DefinitionValidationResult.class);
        } catch (RestClientException e) {
            log.warn("Definition validation service call failed url={}: {}", url, e.getMessage());
            throw new DefinitionValidationServiceException(e.getMessage(), e);
        }
        if (result == null || result.result() == null) {
            throw new DefinitionValidationServiceException("Definition validation service returned no result");
        }
        log.info("Definition validation result={} diagnostics={}", result.result(), result.diagnostics().size());
        return result;
    }
}
