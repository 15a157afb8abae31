package com.example.plancompiler.config;

import com.example.plancompiler.definition.HttpStateMachineDefinitionValidator;
import com.example.plancompiler.definition.SkippingStateMachineDefinitionValidator;
import com.example.plancompiler.definition.StateMachineDefinitionValidator;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the definition validator: HTTP when {@code plan-compiler.definition-validator.url} is set,
 * otherwise a validator that skips the check.
 */
@Configuration
@Slf4j
public class DefinitionValidatorConfiguration {

    @Bean
    public StateMachineDefinitionValidator stateMachineDefinitionValidator(
            @Value("${plan-compiler.definition-validator.url:}") String url,
            @Value("${plan-compiler.definition-validator.timeout-seconds:30}") long timeoutSeconds) {
        if (url == null || url.isBlank()) {
            log.info("Definition validation service not configured; compiled definitions are not checked");
            return new SkippingStateMachineDefinitionValidator();
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(timeoutSeconds));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        log.info("Definition validation service url={}", url.trim());
        return new HttpStateMachineDefinitionValidator(new RestTemplate(requestFactory), url.trim());
    }
}
