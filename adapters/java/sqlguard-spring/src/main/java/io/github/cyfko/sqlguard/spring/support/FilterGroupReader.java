package io.github.cyfko.sqlguard.spring.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;
import io.github.cyfko.sqlguard.core.exception.FilterValidationException;
import io.github.cyfko.sqlguard.core.model.Filter;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterItem;
import io.github.cyfko.sqlguard.core.model.FilterOperator;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.model.Logic;
import io.github.cyfko.sqlguard.core.model.ValueShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads a filter tree from request JSON.
 *
 * <h2>Format</h2>
 * <pre>{@code
 * {
 *   "logic": "AND",
 *   "items": [
 *     { "field": "status", "operator": "EQ", "value": "active" },
 *     { "logic": "OR", "items": [
 *         { "field": "quantity", "operator": ">=", "value": 10 },
 *         { "field": "expiry_date", "operator": "IS_NULL" }
 *     ]}
 *   ]
 * }
 * }</pre>
 * <p>
 * A node with {@code items} is a group, anything else a filter. {@code logic} defaults to
 * {@code AND} and {@code enabled} to {@code true}. A JSON array becomes an array value, or a
 * range when the operator expects one. Operators are resolved by
 * {@link FilterOperator#fromString(String)}, so both {@code "GTE"} and {@code ">="} work.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * The whole document is read before failing: every malformed node is reported with its JSON
 * path, and one {@link FilterValidationException} carries them all. Field names are not checked
 * here; disallowed ones are skipped when the tree is rendered.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterGroupReader {
    private static final Logger logger = Logger.getLogger(FilterGroupReader.class.getName());

    private final ObjectMapper objectMapper;

    public FilterGroupReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    /**
     * @param json the request body
     * @return the filter tree
     * @throws FilterValidationException if the JSON is malformed or any node is invalid
     */
    public FilterGroup read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FilterValidationException("Malformed filter JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    /**
     * @param root an already parsed document
     * @return the filter tree; an empty {@code AND} group for a missing or {@code null} root
     * @throws FilterValidationException if any node is invalid
     */
    public FilterGroup read(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return FilterGroup.and();
        }
        List<String> errors = new ArrayList<>();
        FilterGroup group = readGroup(root, "$", 1, errors);
        if (!errors.isEmpty()) {
            logger.fine(() -> "Rejected filter document with " + errors.size() + " error(s)");
            throw new FilterValidationException(errors);
        }
        return group;
    }

    private FilterGroup readGroup(JsonNode node, String path, int depth, List<String> errors) {
        if (!node.isObject()) {
            errors.add(path + ": expected an object");
            return null;
        }
        if (depth > FilterGroup.MAX_DEPTH) {
            errors.add(path + ": filter tree is nested deeper than " + FilterGroup.MAX_DEPTH + " levels");
            return null;
        }

        Logic logic = Logic.AND;
        JsonNode logicNode = node.get("logic");
        if (logicNode != null && !logicNode.isNull()) {
            try {
                logic = Logic.fromString(logicNode.asText());
            } catch (FilterDefinitionException e) {
                errors.add(path + ".logic: " + e.getMessage());
            }
        }

        JsonNode itemsNode = node.get("items");
        if (itemsNode == null || !itemsNode.isArray()) {
            errors.add(path + ".items: expected an array");
            return null;
        }

        List<FilterItem> items = new ArrayList<>(itemsNode.size());
        for (int i = 0; i < itemsNode.size(); i++) {
            JsonNode child = itemsNode.get(i);
            String childPath = path + ".items[" + i + "]";
            FilterItem item = child.has("items")
                    ? readGroup(child, childPath, depth + 1, errors)
                    : readFilter(child, childPath, errors);
            if (item != null) {
                items.add(item);
            }
        }
        return new FilterGroup(logic, items);
    }

    private Filter readFilter(JsonNode node, String path, List<String> errors) {
        if (!node.isObject()) {
            errors.add(path + ": expected an object");
            return null;
        }
        int before = errors.size();

        JsonNode fieldNode = node.get("field");
        if (fieldNode == null || !fieldNode.isTextual() || fieldNode.asText().isBlank()) {
            errors.add(path + ".field: is required");
        }

        FilterOperator operator = null;
        JsonNode operatorNode = node.get("operator");
        if (operatorNode == null || !operatorNode.isTextual()) {
            errors.add(path + ".operator: is required");
        } else {
            try {
                operator = FilterOperator.fromString(operatorNode.asText());
            } catch (FilterDefinitionException e) {
                errors.add(path + ".operator: " + e.getMessage());
            }
        }

        boolean enabled = true;
        JsonNode enabledNode = node.get("enabled");
        if (enabledNode != null && !enabledNode.isNull()) {
            if (enabledNode.isBoolean()) {
                enabled = enabledNode.booleanValue();
            } else {
                errors.add(path + ".enabled: expected a boolean");
            }
        }

        if (errors.size() > before) {
            return null;
        }
        try {
            FilterValue value = readValue(node.get("value"), operator.getShape());
            return new Filter(fieldNode.asText(), operator, value, enabled);
        } catch (FilterDefinitionException e) {
            errors.add(path + ".value: " + e.getMessage());
            return null;
        }
    }

    private static FilterValue readValue(JsonNode node, ValueShape shape) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FilterValue.NULL;
        }
        if (node.isArray()) {
            List<FilterValue.Scalar> scalars = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                scalars.add(readScalar(element));
            }
            if (shape == ValueShape.RANGE && scalars.size() == 2) {
                return new FilterValue.Range(scalars.get(0), scalars.get(1));
            }
            return new FilterValue.Array(scalars);
        }
        return readScalar(node);
    }

    private static FilterValue.Scalar readScalar(JsonNode node) {
        if (node.isTextual()) {
            return FilterValue.text(node.textValue());
        }
        if (node.isBoolean()) {
            return new FilterValue.Bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return FilterValue.scalar(node.numberValue());
        }
        throw new FilterDefinitionException("Unsupported JSON value of type " + node.getNodeType());
    }
}
