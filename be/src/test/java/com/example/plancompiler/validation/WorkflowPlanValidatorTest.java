package com.example.plancompiler.validation;

import com.example.plancompiler.plan.WorkflowPlan;
import com.example.plancompiler.plan.WorkflowPlanParser;
import com.example.plancompiler.tools.StaticToolRegistry;
import com.example.plancompiler.tools.ToolDefinition;
import com.example.plancompiler.tools.ToolParameter;
import com.example.plancompiler.tools.ToolRegistry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowPlanValidator")
class WorkflowPlanValidatorTest {

    private static final ToolRegistry TOOLS = StaticToolRegistry.of(List.of(
            new ToolDefinition("t1", "no parameters", "arn:t1", List.of()),
            new ToolDefinition("t2", "one parameter", "arn:t2", List.of(
                    new ToolParameter("p", "string", "value", false))),
            new ToolDefinition("notify", "needs a recipient", "arn:notify", List.of(
                    new ToolParameter("recipient", "string", "who", true),
                    new ToolParameter("message", "string", "what", false)))
    ));

    private final WorkflowPlanParser parser = new WorkflowPlanParser(JsonMapper.builder().build());

    private ValidationReport inspect(String rootJson) {
        WorkflowPlan plan = parser.parse("{ \"name\": \"test\", \"root\": " + rootJson + " }");
        return WorkflowPlanValidator.inspect(plan, TOOLS);
    }

    private static ValidationError single(ValidationReport report) {
        assertEquals(1, report.errors().size(), () -> "errors: " + report.errors());
        return report.errors().get(0);
    }

    @Nested
    @DisplayName("valid plans")
    class ValidPlans {

        @Test
        @DisplayName("passes when a later step references an earlier output, and counts nodes")
        void sequenceThreadsScope() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"v"},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $v %}"}}
                    ]}
                    """);

            assertTrue(report.isValid(), () -> "errors: " + report.errors());
            assertEquals(3, report.nodeCount());
            assertThat(report.nodeTypes()).containsExactlyInAnyOrder("sequence", "tool_call");
        }

        @Test
        @DisplayName("accepts dotted references below a defined variable and string concatenation")
        void dottedReferencesAndConcatenation() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"order"},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% 'Order ' & $order.id & ' is ' & $order.status %}"}}
                    ]}
                    """);

            assertTrue(report.isValid(), () -> "errors: " + report.errors());
        }

        @Test
        @DisplayName("makes every parallel branch output visible after the join")
        void parallelOutputsVisibleAfterJoin() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"parallel","branches":[
                        {"type":"tool_call","toolName":"t1","outputVariable":"a"},
                        {"type":"tool_call","toolName":"t1","outputVariable":"b"}
                      ]},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $a & $b %}"}}
                    ]}
                    """);

            assertTrue(report.isValid(), () -> "errors: " + report.errors());
        }

        @Test
        @DisplayName("lets a timeout handler read the wait output and a loop body read earlier steps")
        void timeoutHandlerAndLoopBody() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"counter"},
                      {"type":"loop",
                       "condition":{"type":"comparison","left":"{% $counter %}","operator":"<","right":3},
                       "body":{"type":"wait_for_event","eventType":"Ping","eventSource":"svc","entityId":"{% $counter %}",
                               "outputVariable":"event",
                               "onTimeout":{"type":"tool_call","toolName":"t2","parameters":{"p":"{% $event.error %}"}}}}
                    ]}
                    """);

            assertTrue(report.isValid(), () -> "errors: " + report.errors());
        }

        @Test
        @DisplayName("treats caller-supplied inputs as defined")
        void externalInputsInScope() {
            WorkflowPlan plan = parser.parse("""
                    {"root":{"type":"tool_call","toolName":"t2","parameters":{"p":"{% $customer.email %}"}}}
                    """);

            assertDoesNotThrow(() -> WorkflowPlanValidator.validate(plan, TOOLS, List.of("customer")));
        }
    }

    @Nested
    @DisplayName("invalid plans")
    class InvalidPlans {

        @Test
        @DisplayName("rejects a single-step sequence as DegenerateContainer")
        void singleStepSequence() {
            ValidationError error = single(inspect("""
                    {"type":"sequence","steps":[{"type":"tool_call","toolName":"t1"}]}
                    """));

            assertEquals(ValidationErrorKind.DEGENERATE_CONTAINER, error.kind());
            assertEquals("root.sequence.steps", error.field());
        }

        @Test
        @DisplayName("rejects an empty parallel as DegenerateContainer")
        void emptyParallel() {
            ValidationError error = single(inspect("""
                    {"type":"parallel","branches":[]}
                    """));

            assertEquals(ValidationErrorKind.DEGENERATE_CONTAINER, error.kind());
            assertEquals("root.parallel.branches", error.field());
        }

        @Test
        @DisplayName("rejects an unknown tool and throws from validate")
        void unknownTool() {
            String root = """
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1"},
                      {"type":"tool_call","toolName":"teleport","parameters":{"where":"moon"}}
                    ]}
                    """;
            ValidationError error = single(inspect(root));
            assertEquals(ValidationErrorKind.UNKNOWN_TOOL, error.kind());
            assertEquals("root.sequence.steps[1].tool_call.toolName", error.field());

            WorkflowPlan plan = parser.parse("{ \"root\": " + root + " }");
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class,
                    () -> WorkflowPlanValidator.validate(plan, TOOLS));
            assertEquals(ValidationErrorKind.UNKNOWN_TOOL, ex.getErrors().get(0).kind());
        }

        @Test
        @DisplayName("rejects undeclared parameters and missing required ones")
        void parameterChecks() {
            ValidationReport report = inspect("""
                    {"type":"tool_call","toolName":"notify","parameters":{"message":"hi","channel":"sms"}}
                    """);

            assertThat(report.errors()).extracting(ValidationError::kind, ValidationError::field)
                    .containsExactlyInAnyOrder(
                            tuple(ValidationErrorKind.UNKNOWN_PARAMETER, "root.tool_call.parameters.channel"),
                            tuple(ValidationErrorKind.MISSING_REQUIRED_PARAMETER, "root.tool_call.parameters.recipient"));
        }

        @Test
        @DisplayName("rejects a reference to a variable defined only later")
        void undefinedVariable() {
            ValidationError error = single(inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $v %}"}},
                      {"type":"tool_call","toolName":"t1","outputVariable":"v"}
                    ]}
                    """));

            assertEquals(ValidationErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals("root.sequence.steps[0].tool_call.parameters.p", error.field());
        }

        @Test
        @DisplayName("rejects a bare string as condition left operand")
        void bareConditionLeft() {
            ValidationError error = single(inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"x"},
                      {"type":"branch",
                       "condition":{"type":"comparison","left":"x","operator":"==","right":"yes"},
                       "ifTrue":{"type":"tool_call","toolName":"t1"},
                       "ifFalse":{"type":"tool_call","toolName":"t1"}}
                    ]}
                    """));

            assertEquals(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, error.kind());
            assertEquals("root.sequence.steps[1].branch.condition.left", error.field());
        }

        @Test
        @DisplayName("rejects function calls and indexers in expressions")
        void disallowedSyntax() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"items"},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $count($items) %}"}},
                      {"type":"branch",
                       "condition":{"type":"comparison","left":"{% $items[0] %}","operator":"==","right":1},
                       "ifTrue":{"type":"tool_call","toolName":"t1"},
                       "ifFalse":{"type":"tool_call","toolName":"t1"}}
                    ]}
                    """);

            assertThat(report.errors()).extracting(ValidationError::kind)
                    .containsExactly(ValidationErrorKind.DISALLOWED_EXPRESSION_SYNTAX, ValidationErrorKind.DISALLOWED_EXPRESSION_SYNTAX);
        }

        @Test
        @DisplayName("does not leak a branch-local output past the branch")
        void branchOutputNotVisibleAfterBranch() {
            ValidationError error = single(inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"status"},
                      {"type":"branch",
                       "condition":{"type":"comparison","left":"{% $status %}","operator":"==","right":"ok"},
                       "ifTrue":{"type":"tool_call","toolName":"t1","outputVariable":"w"},
                       "ifFalse":{"type":"tool_call","toolName":"t1"}},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $w %}"}}
                    ]}
                    """));

            assertEquals(ValidationErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals("root.sequence.steps[2].tool_call.parameters.p", error.field());
        }

        @Test
        @DisplayName("hides sibling parallel branch outputs from each other")
        void parallelBranchesIsolated() {
            ValidationError error = single(inspect("""
                    {"type":"parallel","branches":[
                      {"type":"tool_call","toolName":"t1","outputVariable":"a"},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $a %}"}}
                    ]}
                    """));

            assertEquals(ValidationErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals("root.parallel.branches[1].tool_call.parameters.p", error.field());
        }

        @Test
        @DisplayName("hides a failing call's output from its error handler")
        void errorHandlerCannotSeeOutput() {
            ValidationError error = single(inspect("""
                    {"type":"tool_call","toolName":"t1","outputVariable":"v",
                     "errorHandler":{"type":"tool_call","toolName":"t2","parameters":{"p":"{% $v %}"}}}
                    """));

            assertEquals(ValidationErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals("root.tool_call.errorHandler.tool_call.parameters.p", error.field());
        }

        @Test
        @DisplayName("requires prompts with variables to be one expression and entity ids to be references")
        void promptAndEntityId() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"user_input","prompt":"Hello {% $name %}","outputVariable":"answer"},
                      {"type":"wait_for_event","eventType":"Done","eventSource":"svc","entityId":"order-1"}
                    ]}
                    """);

            assertThat(report.errors()).extracting(ValidationError::kind, ValidationError::field)
                    .containsExactly(
                            tuple(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, "root.sequence.steps[0].user_input.prompt"),
                            tuple(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, "root.sequence.steps[1].wait_for_event.entityId"));
        }

        @Test
        @DisplayName("accumulates every error in one pass")
        void accumulatesErrors() {
            ValidationReport report = inspect("""
                    {"type":"sequence","steps":[
                      {"type":"tool_call","toolName":"missing"},
                      {"type":"tool_call","toolName":"t2","parameters":{"p":"{% $nowhere %}"}},
                      {"type":"parallel","branches":[{"type":"tool_call","toolName":"t1"}]}
                    ]}
                    """);

            assertThat(report.errors()).extracting(ValidationError::kind).containsExactly(
                    ValidationErrorKind.UNKNOWN_TOOL,
                    ValidationErrorKind.UNDEFINED_VARIABLE,
                    ValidationErrorKind.DEGENERATE_CONTAINER);
        }
    }
}
