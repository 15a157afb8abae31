package com.example.plancompiler.validation;

import com.example.plancompiler.plan.BranchNode;
import com.example.plancompiler.plan.ComparisonCondition;
import com.example.plancompiler.plan.Condition;
import com.example.plancompiler.plan.LogicalCondition;
import com.example.plancompiler.plan.LoopNode;
import com.example.plancompiler.plan.ParallelNode;
import com.example.plancompiler.plan.SequenceNode;
import com.example.plancompiler.plan.ToolCallNode;
import com.example.plancompiler.plan.UserInputNode;
import com.example.plancompiler.plan.WaitForEventNode;
import com.example.plancompiler.plan.WorkflowNode;
import com.example.plancompiler.plan.WorkflowPlan;
import com.example.plancompiler.tools.ToolDefinition;
import com.example.plancompiler.tools.ToolParameter;
import com.example.plancompiler.tools.ToolRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a parsed workflow plan: containers, tool references, expression syntax and
 * define-before-use scoping of variables.
 * <p>
 * All problems are collected in one pass. Scope is threaded through the tree as an immutable
 * {@link ScopeSet}: sequences and loop bodies carry it forward step by step, both sides of a
 * branch start from the same scope and are not merged afterwards, parallel branches start from
 * the same scope and their outputs are joined once all of them finish.
 * </p>
 */
public final class WorkflowPlanValidator {

    private WorkflowPlanValidator() {
    }

    /**
     * Validates the plan and returns the report without throwing.
     */
    public static ValidationReport inspect(WorkflowPlan plan, ToolRegistry tools) {
        return inspect(plan, tools, List.of());
    }

    /**
     * Validates the plan with {@code externalInputs} already in scope at its root.
     */
    public static ValidationReport inspect(WorkflowPlan plan, ToolRegistry tools, Collection<String> externalInputs) {
        Walk walk = new Walk(tools);
        walk.node(plan.root(), "root", ScopeSet.of(externalInputs.toArray(String[]::new)));
        return new ValidationReport(walk.errors, walk.nodeCount, walk.nodeTypes);
    }

    /**
     * Validates the plan. Throws {@link WorkflowValidationException} with all errors if invalid.
     */
    public static ValidationReport validate(WorkflowPlan plan, ToolRegistry tools) {
        return validate(plan, tools, List.of());
    }

    public static ValidationReport validate(WorkflowPlan plan, ToolRegistry tools, Collection<String> externalInputs) {
        ValidationReport report = inspect(plan, tools, externalInputs);
        if (!report.isValid()) {
            throw new WorkflowValidationException(report.errors());
        }
        return report;
    }

    private static final class Walk {

        private final ToolRegistry tools;
        private final List<ValidationError> errors = new ArrayList<>();
        private final Set<String> nodeTypes = new LinkedHashSet<>();
        private int nodeCount;

        private Walk(ToolRegistry tools) {
            this.tools = tools;
        }

        /** Validates {@code node} against {@code scope} and returns the scope after it. */
        private ScopeSet node(WorkflowNode node, String path, ScopeSet scope) {
            nodeCount++;
            nodeTypes.add(node.typeName());
            String here = path + "." + node.typeName();

            if (node instanceof SequenceNode sequence) {
                if (isDegenerate(sequence.steps(), here + ".steps", "sequence")) {
                    return scope;
                }
                ScopeSet current = scope;
                for (int i = 0; i < sequence.steps().size(); i++) {
                    current = node(sequence.steps().get(i), here + ".steps[" + i + "]", current);
                }
                return current;
            }
            if (node instanceof ParallelNode parallel) {
                if (isDegenerate(parallel.branches(), here + ".branches", "parallel")) {
                    return scope;
                }
                ScopeSet joined = scope;
                for (int i = 0; i < parallel.branches().size(); i++) {
                    joined = joined.union(node(parallel.branches().get(i), here + ".branches[" + i + "]", scope));
                }
                return joined;
            }
            if (node instanceof ToolCallNode toolCall) {
                return toolCall(toolCall, here, scope);
            }
            if (node instanceof UserInputNode userInput) {
                prompt(userInput.prompt(), here + ".prompt", scope);
                return scope.with(userInput.outputVariable());
            }
            if (node instanceof BranchNode branch) {
                condition(branch.condition(), here + ".condition", scope);
                node(branch.ifTrue(), here + ".ifTrue", scope);
                node(branch.ifFalse(), here + ".ifFalse", scope);
                return scope;
            }
            if (node instanceof LoopNode loop) {
                condition(loop.condition(), here + ".condition", scope);
                return node(loop.body(), here + ".body", scope);
            }
            if (node instanceof WaitForEventNode wait) {
                if (wait.entityId() != null) {
                    reference(wait.entityId(), here + ".entityId", scope);
                }
                ScopeSet after = scope.with(wait.outputVariable());
                if (wait.onTimeout() != null) {
                    node(wait.onTimeout(), here + ".onTimeout", after);
                }
                return after;
            }
            throw new IllegalStateException("Unhandled node type " + node.getClass().getName());
        }

        private boolean isDegenerate(List<WorkflowNode> children, String path, String kind) {
            if (children.size() >= 2) {
                return false;
            }
            error(ValidationErrorKind.DEGENERATE_CONTAINER, path,
                    kind + " must have at least 2 children, found " + children.size());
            return true;
        }

        private ScopeSet toolCall(ToolCallNode toolCall, String here, ScopeSet scope) {
            Optional<ToolDefinition> tool = tools.find(toolCall.toolName());
            if (tool.isEmpty()) {
                error(ValidationErrorKind.UNKNOWN_TOOL, here + ".toolName", "unknown tool '" + toolCall.toolName() + "'");
            } else {
                parameters(toolCall, tool.get(), here + ".parameters", scope);
            }
            if (toolCall.errorHandler() != null) {
                // the handler runs when the call failed, so the call's output is not defined there
                node(toolCall.errorHandler(), here + ".errorHandler", scope);
            }
            return scope.with(toolCall.outputVariable());
        }

        private void parameters(ToolCallNode toolCall, ToolDefinition tool, String path, ScopeSet scope) {
            Set<String> declared = tool.parameterNames();
            for (Map.Entry<String, Object> entry : toolCall.parameters().entrySet()) {
                String parameterPath = path + "." + entry.getKey();
                if (!declared.contains(entry.getKey())) {
                    error(ValidationErrorKind.UNKNOWN_PARAMETER, parameterPath,
                            "tool '" + tool.name() + "' has no parameter '" + entry.getKey() + "'");
                    continue;
                }
                parameterValue(entry.getValue(), parameterPath, scope, 0);
            }
            for (ToolParameter parameter : tool.parameters()) {
                if (parameter.required() && !toolCall.parameters().containsKey(parameter.name())) {
                    error(ValidationErrorKind.MISSING_REQUIRED_PARAMETER, path + "." + parameter.name(),
                            "tool '" + tool.name() + "' requires parameter '" + parameter.name() + "'");
                }
            }
        }

        private void parameterValue(Object value, String path, ScopeSet scope, int depth) {
            if (value == null || value instanceof Number || value instanceof Boolean) {
                return;
            }
            if (value instanceof String text) {
                template(text, path, scope);
                return;
            }
            if (value instanceof Map<?, ?> map && depth == 0) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    parameterValue(entry.getValue(), path + "." + entry.getKey(), scope, depth + 1);
                }
                return;
            }
            if (value instanceof List<?> list && depth == 0) {
                for (int i = 0; i < list.size(); i++) {
                    parameterValue(list.get(i), path + "[" + i + "]", scope, depth + 1);
                }
                return;
            }
            error(ValidationErrorKind.INVALID_VALUE_TYPE, path, "parameter values may nest objects or lists only one level deep");
        }

        private void template(String text, String path, ScopeSet scope) {
            if (!VariableReferences.containsBlock(text)) {
                return;
            }
            if (VariableReferences.hasDisallowedSyntax(text)) {
                error(ValidationErrorKind.DISALLOWED_EXPRESSION_SYNTAX, path,
                        "function calls and indexers are not allowed in expressions: " + text);
                return;
            }
            if (!VariableReferences.isTemplate(text)) {
                error(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, path,
                        "expected {% ... $variable ... %} but got: " + text);
                return;
            }
            undefined(VariableReferences.variables(text), path, scope);
        }

        private void condition(Condition condition, String path, ScopeSet scope) {
            if (condition instanceof ComparisonCondition comparison) {
                if (comparison.left() instanceof String left) {
                    reference(left, path + ".left", scope);
                } else {
                    error(ValidationErrorKind.INVALID_VALUE_TYPE, path + ".left",
                            "left operand must be a {% $variable %} reference");
                }
                Object right = comparison.right();
                if (right instanceof String text && VariableReferences.containsBlock(text)) {
                    reference(text, path + ".right", scope);
                } else if (right instanceof Map<?, ?> || right instanceof List<?>) {
                    error(ValidationErrorKind.INVALID_VALUE_TYPE, path + ".right",
                            "right operand must be a reference, string, number, boolean or null");
                }
                return;
            }
            if (condition instanceof LogicalCondition logical) {
                if (logical.conditions().isEmpty()) {
                    error(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND, path + ".conditions",
                            "logical condition needs at least one sub-condition");
                }
                for (int i = 0; i < logical.conditions().size(); i++) {
                    condition(logical.conditions().get(i), path + ".conditions[" + i + "]", scope);
                }
                return;
            }
            throw new IllegalStateException("Unhandled condition type " + condition.getClass().getName());
        }

        private void reference(String text, String path, ScopeSet scope) {
            if (VariableReferences.hasDisallowedSyntax(text)) {
                error(ValidationErrorKind.DISALLOWED_EXPRESSION_SYNTAX, path,
                        "function calls and indexers are not allowed in references: " + text);
                return;
            }
            Optional<String> name = VariableReferences.singleReference(text);
            if (name.isEmpty()) {
                error(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, path,
                        "expected a {% $variable %} reference but got: " + text);
                return;
            }
            undefined(List.of(name.get()), path, scope);
        }

        private void prompt(String prompt, String path, ScopeSet scope) {
            if (!VariableReferences.containsBlock(prompt)) {
                return;
            }
            if (!VariableReferences.isWholeBlock(prompt)) {
                error(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE, path,
                        "a prompt using variables must be a single {% ... %} expression");
                return;
            }
            undefined(VariableReferences.variables(prompt), path, scope);
        }

        private void undefined(List<String> names, String path, ScopeSet scope) {
            for (String name : names) {
                if (!scope.defines(name)) {
                    error(ValidationErrorKind.UNDEFINED_VARIABLE, path,
                            "variable '" + name + "' is not defined at this point; in scope: " + scope);
                }
            }
        }

        private void error(ValidationErrorKind kind, String field, String message) {
            errors.add(new ValidationError(kind, field, message));
        }
    }
}
