package com.example.plancompiler.plan;

import com.example.plancompiler.validation.ValidationError;
import com.example.plancompiler.validation.ValidationErrorKind;
import com.example.plancompiler.validation.WorkflowValidationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowPlanParser")
class WorkflowPlanParserTest {

    private final WorkflowPlanParser parser = new WorkflowPlanParser(JsonMapper.builder().build());

    @Nested
    @DisplayName("well-formed plans")
    class WellFormed {

        @Test
        @DisplayName("parses a plan document into typed nodes")
        void parsesDirectDocument() {
            WorkflowPlan plan = parser.parse("""
                    {
                      "name": "Order check",
                      "description": "Look up and notify",
                      "root": {
                        "type": "sequence",
                        "steps": [
                          { "type": "tool_call", "toolName": "get_order", "parameters": { "order_id": "42" }, "outputVariable": "order" },
                          { "type": "user_input", "prompt": "Approve?", "options": ["yes", "no"], "outputVariable": "approval" }
                        ]
                      }
                    }
                    """);

            assertEquals("Order check", plan.name());
            assertEquals("Look up and notify", plan.description());
            SequenceNode root = (SequenceNode) plan.root();
            assertThat(root.steps()).hasSize(2);
            ToolCallNode call = (ToolCallNode) root.steps().get(0);
            assertEquals("get_order", call.toolName());
            assertEquals(Map.of("order_id", "42"), call.parameters());
            assertEquals("order", call.outputVariable());
            UserInputNode input = (UserInputNode) root.steps().get(1);
            assertThat(input.options()).containsExactly("yes", "no");
            assertEquals("approval", input.outputVariable());
        }

        @Test
        @DisplayName("unwraps the expected_workflow fixture wrapper")
        void unwrapsFixtureWrapper() {
            WorkflowPlan plan = parser.parse("""
                    { "expected_workflow": { "name": "wrapped", "root": { "type": "tool_call", "toolName": "t1" } } }
                    """);

            assertEquals("wrapped", plan.name());
            assertThat(plan.root()).isInstanceOf(ToolCallNode.class);
        }

        @Test
        @DisplayName("re-parses JSON-encoded root, parameters and condition")
        void reparsesEmbeddedJson() {
            Map<String, Object> document = Map.of(
                    "name", "embedded",
                    "root", """
                            {
                              "type": "branch",
                              "condition": "{\\"type\\": \\"comparison\\", \\"left\\": \\"{% $x %}\\", \\"operator\\": \\">=\\", \\"right\\": 3}",
                              "ifTrue": { "type": "tool_call", "toolName": "t1", "parameters": "{\\"p\\": \\"{% $x %}\\"}" },
                              "ifFalse": { "type": "tool_call", "toolName": "t2" }
                            }
                            """);

            WorkflowPlan plan = parser.parse(document);

            BranchNode branch = (BranchNode) plan.root();
            ComparisonCondition condition = (ComparisonCondition) branch.condition();
            assertEquals("{% $x %}", condition.left());
            assertEquals(ComparisonOperator.GE, condition.operator());
            assertEquals(3, condition.right());
            assertEquals(Map.of("p", "{% $x %}"), ((ToolCallNode) branch.ifTrue()).parameters());
        }

        @Test
        @DisplayName("parses nested logical conditions and wait_for_event fields")
        void parsesLogicalConditionAndWait() {
            WorkflowPlan plan = parser.parse("""
                    {
                      "root": {
                        "type": "loop",
                        "condition": {
                          "type": "logical",
                          "operator": "or",
                          "conditions": [
                            { "type": "comparison", "left": "{% $a %}", "operator": "==", "right": true },
                            { "type": "comparison", "left": "{% $b %}", "operator": "in", "right": "abc" }
                          ]
                        },
                        "body": {
                          "type": "wait_for_event",
                          "eventType": "Shipped",
                          "eventSource": "warehouse",
                          "entityId": "{% $order.id %}",
                          "timeout": 30,
                          "onTimeout": { "type": "tool_call", "toolName": "t1" }
                        }
                      }
                    }
                    """);

            LoopNode loop = (LoopNode) plan.root();
            LogicalCondition condition = (LogicalCondition) loop.condition();
            assertEquals(LogicalOperator.OR, condition.operator());
            assertThat(condition.conditions()).hasSize(2);
            WaitForEventNode wait = (WaitForEventNode) loop.body();
            assertEquals("Shipped", wait.eventType());
            assertEquals(30, wait.timeout());
            assertThat(wait.onTimeout()).isInstanceOf(ToolCallNode.class);
            assertEquals("workflow", plan.name());
        }
    }

    @Nested
    @DisplayName("malformed plans")
    class Malformed {

        @Test
        @DisplayName("fails with MalformedEmbeddedJson when an embedded string is not JSON")
        void malformedEmbeddedJson() {
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class, () -> parser.parse("""
                    {
                      "root": {
                        "type": "sequence",
                        "steps": [
                          { "type": "tool_call", "toolName": "t1", "parameters": "{\\"p\\": " },
                          { "type": "tool_call", "toolName": "t2" }
                        ]
                      }
                    }
                    """));

            ValidationError error = ex.getErrors().get(0);
            assertEquals(ValidationErrorKind.MALFORMED_EMBEDDED_JSON, error.kind());
            assertEquals("root.sequence.steps[0].tool_call.parameters", error.field());
        }

        @Test
        @DisplayName("fails with UnknownNodeKind for an unrecognized node type")
        void unknownNodeKind() {
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class, () -> parser.parse("""
                    { "root": { "type": "sequence", "steps": [ { "type": "tool_call", "toolName": "t1" }, { "type": "teleport" } ] } }
                    """));

            assertEquals(1, ex.getErrors().size());
            assertEquals(ValidationErrorKind.UNKNOWN_NODE_KIND, ex.getErrors().get(0).kind());
            assertEquals("root.sequence.steps[1].type", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails with UnsupportedConditionKind for an unknown operator")
        void unsupportedOperator() {
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class, () -> parser.parse("""
                    {
                      "root": {
                        "type": "branch",
                        "condition": { "type": "comparison", "left": "{% $x %}", "operator": "~=", "right": 1 },
                        "ifTrue": { "type": "tool_call", "toolName": "t1" },
                        "ifFalse": { "type": "tool_call", "toolName": "t2" }
                      }
                    }
                    """));

            assertEquals(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND, ex.getErrors().get(0).kind());
            assertEquals("root.branch.condition.operator", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails with MissingRequiredField when toolName is absent")
        void missingToolName() {
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class,
                    () -> parser.parse("{ \"root\": { \"type\": \"tool_call\" } }"));

            assertEquals(ValidationErrorKind.MISSING_REQUIRED_FIELD, ex.getErrors().get(0).kind());
            assertEquals("root.tool_call.toolName", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails when the document has no root")
        void missingRoot() {
            WorkflowValidationException ex = assertThrows(WorkflowValidationException.class,
                    () -> parser.parse(Map.of("name", "empty")));

            assertEquals("root", ex.getErrors().get(0).field());
        }
    }
}
