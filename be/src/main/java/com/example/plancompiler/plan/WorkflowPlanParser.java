package com.example.plancompiler.plan;

import com.example.plancompiler.validation.ValidationError;
import com.example.plancompiler.validation.ValidationErrorKind;
import com.example.plancompiler.validation.WorkflowValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw JSON workflow plan into a typed {@link WorkflowPlan}.
 * <p>
 * Accepts either a plan document {@code {name, description, root}} or a fixture wrapper
 * {@code {expected_workflow: {...}}}. Plans produced by generators often carry nested objects
 * as JSON-encoded strings; any string found where an object or array is expected is decoded
 * again. Shape problems are fatal: the first one found is thrown as a
 * {@link WorkflowValidationException} carrying a single error.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowPlanParser {

    static final String FIXTURE_WRAPPER = "expected_workflow";

    private final JsonMapper jsonMapper;

    /**
     * Parses a plan given as a JSON string or an already decoded map.
     */
    public WorkflowPlan parse(Object raw) {
        if (raw == null) {
            throw fatal(ValidationErrorKind.MISSING_REQUIRED_FIELD, "plan", "plan is required");
        }
        Map<String, Object> document = asObject(raw, "plan");
        if (document.containsKey(FIXTURE_WRAPPER)) {
            document = asObject(document.get(FIXTURE_WRAPPER), FIXTURE_WRAPPER);
        }
        Object rootValue = document.get("root");
        if (rootValue == null) {
            throw fatal(ValidationErrorKind.MISSING_REQUIRED_FIELD, "root", "root is required");
        }
        WorkflowNode root = parseNode(asObject(rootValue, "root"), "root");
        String name = optionalString(document, "name", "name");
        log.debug("Parsed workflow plan name={} rootType={}", name, root.typeName());
        return new WorkflowPlan(name, optionalString(document, "description", "description"), root);
    }

    private WorkflowNode parseNode(Map<String, Object> node, String path) {
        String type = requireString(node, "type", path);
        String here = path + "." + type;
        String description = optionalString(node, "description", here + ".description");
        switch (type) {
            case SequenceNode.TYPE:
                return new SequenceNode(description, parseChildren(node, "steps", here));
            case ParallelNode.TYPE:
                return new ParallelNode(description, parseChildren(node, "branches", here));
            case ToolCallNode.TYPE:
                return new ToolCallNode(
                        description,
                        requireString(node, "toolName", here),
                        node.get("parameters") != null ? asObject(node.get("parameters"), here + ".parameters") : Map.of(),
                        optionalString(node, "outputVariable", here + ".outputVariable"),
                        optionalChild(node, "errorHandler", here)
                );
            case UserInputNode.TYPE:
                return new UserInputNode(
                        description,
                        optionalString(node, "prompt", here + ".prompt"),
                        optionalString(node, "inputType", here + ".inputType"),
                        node.get("options") != null ? asList(node.get("options"), here + ".options") : null,
                        optionalString(node, "outputVariable", here + ".outputVariable")
                );
            case BranchNode.TYPE:
                return new BranchNode(
                        description,
                        parseCondition(asObject(require(node, "condition", here), here + ".condition"), here + ".condition"),
                        requiredChild(node, "ifTrue", here),
                        requiredChild(node, "ifFalse", here)
                );
            case LoopNode.TYPE:
                return new LoopNode(
                        description,
                        parseCondition(asObject(require(node, "condition", here), here + ".condition"), here + ".condition"),
                        requiredChild(node, "body", here)
                );
            case WaitForEventNode.TYPE:
                return new WaitForEventNode(
                        description,
                        requireString(node, "eventType", here),
                        requireString(node, "eventSource", here),
                        optionalString(node, "entityId", here + ".entityId"),
                        optionalInteger(node, "timeout", here + ".timeout"),
                        optionalString(node, "outputVariable", here + ".outputVariable"),
                        optionalChild(node, "onTimeout", here)
                );
            default:
                throw fatal(ValidationErrorKind.UNKNOWN_NODE_KIND, path + ".type", "unknown node type '" + type + "'");
        }
    }

    private List<WorkflowNode> parseChildren(Map<String, Object> node, String field, String path) {
        List<Object> items = asList(require(node, field, path), path + "." + field);
        List<WorkflowNode> children = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            String itemPath = path + "." + field + "[" + i + "]";
            children.add(parseNode(asObject(items.get(i), itemPath), itemPath));
        }
        return children;
    }

    private WorkflowNode requiredChild(Map<String, Object> node, String field, String path) {
        String childPath = path + "." + field;
        return parseNode(asObject(require(node, field, path), childPath), childPath);
    }

    private WorkflowNode optionalChild(Map<String, Object> node, String field, String path) {
        Object value = node.get(field);
        if (value == null) {
            return null;
        }
        String childPath = path + "." + field;
        return parseNode(asObject(value, childPath), childPath);
    }

    private Condition parseCondition(Map<String, Object> condition, String path) {
        Object type = condition.get("type");
        if (type == null) {
            type = condition.containsKey("conditions") ? LogicalCondition.TYPE : ComparisonCondition.TYPE;
        }
        if (ComparisonCondition.TYPE.equals(type)) {
            String symbol = requireString(condition, "operator", path);
            ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol)
                    .orElseThrow(() -> fatal(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND, path + ".operator",
                            "unsupported comparison operator '" + symbol + "'"));
            return new ComparisonCondition(require(condition, "left", path), operator, condition.get("right"));
        }
        if (LogicalCondition.TYPE.equals(type)) {
            String symbol = requireString(condition, "operator", path);
            LogicalOperator operator = LogicalOperator.fromSymbol(symbol)
                    .orElseThrow(() -> fatal(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND, path + ".operator",
                            "unsupported logical operator '" + symbol + "'"));
            List<Object> items = asList(require(condition, "conditions", path), path + ".conditions");
            List<Condition> conditions = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                String itemPath = path + ".conditions[" + i + "]";
                conditions.add(parseCondition(asObject(items.get(i), itemPath), itemPath));
            }
            return new LogicalCondition(operator, conditions);
        }
        throw fatal(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND, path + ".type", "unsupported condition type '" + type + "'");
    }

    private Map<String, Object> asObject(Object value, String path) {
        Object decoded = value instanceof String text ? decode(text, path) : value;
        if (decoded instanceof Map<?, ?>) {
            return jsonMapper.convertValue(decoded, new TypeReference<Map<String, Object>>() { });
        }
        throw fatal(ValidationErrorKind.INVALID_VALUE_TYPE, path, "expected a JSON object");
    }

    private List<Object> asList(Object value, String path) {
        Object decoded = value instanceof String text ? decode(text, path) : value;
        if (decoded instanceof List<?>) {
            return jsonMapper.convertValue(decoded, new TypeReference<List<Object>>() { });
        }
        throw fatal(ValidationErrorKind.INVALID_VALUE_TYPE, path, "expected a JSON array");
    }

    private Object decode(String text, String path) {
        try {
            return jsonMapper.readValue(text, new TypeReference<Object>() { });
        } catch (JacksonException e) {
            log.warn("Embedded JSON at {} could not be parsed: {}", path, e.getMessage());
            throw fatal(ValidationErrorKind.MALFORMED_EMBEDDED_JSON, path, "malformed embedded JSON: " + e.getMessage());
        }
    }

    private static Object require(Map<String, Object> node, String field, String path) {
        Object value = node.get(field);
        if (value == null) {
            throw fatal(ValidationErrorKind.MISSING_REQUIRED_FIELD, path + "." + field, field + " is required");
        }
        return value;
    }

    private static String requireString(Map<String, Object> node, String field, String path) {
        Object value = require(node, field, path);
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        throw fatal(ValidationErrorKind.INVALID_VALUE_TYPE, path + "." + field, field + " must be a non-blank string");
    }

    private static String optionalString(Map<String, Object> node, String field, String path) {
        Object value = node.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw fatal(ValidationErrorKind.INVALID_VALUE_TYPE, path, field + " must be a string");
    }

    private static Integer optionalInteger(Map<String, Object> node, String field, String path) {
        Object value = node.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw fatal(ValidationErrorKind.INVALID_VALUE_TYPE, path, field + " must be a number");
    }

    private static WorkflowValidationException fatal(ValidationErrorKind kind, String path, String message) {
        return new WorkflowValidationException(new ValidationError(kind, path, message));
    }
}
