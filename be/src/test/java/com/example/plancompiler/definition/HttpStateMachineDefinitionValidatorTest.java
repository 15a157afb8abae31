package com.example.plancompiler.definition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpStateMachineDefinitionValidator")
class HttpStateMachineDefinitionValidatorTest {

    private static final String URL = "http://validator.test/validate";
    private static final String DEFINITION = "{\"StartAt\":\"A\",\"States\":{}}";

    private MockRestServiceServer server;
    private HttpStateMachineDefinitionValidator validator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        validator = new HttpStateMachineDefinitionValidator(restTemplate, URL);
    }

    @Test
    @DisplayName("posts the definition and accepts an OK result")
    void accepted() {
        server.expect(once(), requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.definition").value(DEFINITION))
                .andRespond(withSuccess("{\"result\":\"OK\",\"diagnostics\":[]}", MediaType.APPLICATION_JSON));

        DefinitionValidationResult result = validator.validate(DEFINITION);

        assertTrue(result.isAccepted());
        assertTrue(result.diagnostics().isEmpty());
        server.verify();
    }

    @Test
    @DisplayName("returns FAIL with its diagnostics")
    void rejected() {
        server.expect(once(), requestTo(URL))
                .andRespond(withSuccess("""
                        {"result":"FAIL","diagnostics":[
                          {"severity":"ERROR","code":"MISSING_TRANSITION_TARGET","message":"Missing Next target: B","location":"/States/A"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        DefinitionValidationResult result = validator.validate(DEFINITION);

        assertFalse(result.isAccepted());
        assertEquals(1, result.diagnostics().size());
        assertEquals("MISSING_TRANSITION_TARGET", result.diagnostics().get(0).code());
        server.verify();
    }

    @Test
    @DisplayName("throws on a server error without retrying")
    void serverError() {
        server.expect(once(), requestTo(URL)).andRespond(withServerError());

        assertThrows(DefinitionValidationServiceException.class, () -> validator.validate(DEFINITION));
        server.verify();
    }

    @Test
    @DisplayName("skipping validator accepts everything")
    void skipping() {
        DefinitionValidationResult result = new SkippingStateMachineDefinitionValidator().validate(DEFINITION);

        assertEquals(DefinitionValidationResult.SKIPPED, result.result());
        assertTrue(result.isAccepted());
    }
}
