package com.baykanat.bloganalytics.domain.filter;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * JSON filter ağacını FilterPredicate'e derleyen recursive-descent derleyici. Yan etkisizdir.
 *
 * <pre>
 * {"and": [
 *   {"eq":  {"field": "country.code", "value": "US"}},
 *   {"gte": {"field": "created_at",   "value": "2025-01-01"}}
 * ]}
 * </pre>
 *
 * Her düğüm tam olarak bir anahtar taşır: and / or (boş olmayan liste), not (tek alt ağaç) ya da bir
 * operatör (eq, lt, lte, gt, gte, contains, in) ve {field, value} payload'ı.
 */
@Slf4j
@Component
public class FilterCompiler {

    private static final String AND = "and";
    private static final String OR = "or";
    private static final String NOT = "not";
    private static final String FIELD = "field";
    private static final String VALUE = "value";

    /** Swagger/OpenAPI örneklerinden kalan doldurulmamış şablon anahtarları (additionalProp1 ...). */
    private static final Pattern TEMPLATE_PLACEHOLDER = Pattern.compile("additionalProp\\d*", Pattern.CASE_INSENSITIVE);

    private static final int MAX_DEPTH = 16;
    private static final int MAX_IN_VALUES = 1000;

    /** Filter ağacını derler; null/empty ağaç derlenmez, çağıran filtre yok diye ele almalıdır. */
    public FilterPredicate compile(JsonNode tree) {
        FilterPredicate predicate = compileNode(tree, 1);
        log.debug("Compiled filter: {}", predicate);
        return predicate;
    }

    /** İstek DTO'larındaki opsiyonel filters alanı için: null, JSON null veya {} → boş. */
    public Optional<FilterPredicate> compileOptional(JsonNode tree) {
        if (tree == null || tree.isNull() || tree.isMissingNode() || (tree.isObject() && tree.isEmpty())) {
            return Optional.empty();
        }
        return Optional.of(compile(tree));
    }

    private FilterPredicate compileNode(JsonNode node, int depth) {
        if (depth > MAX_DEPTH) {
            throw new InvalidFilterException("filter nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (node == null || !node.isObject()) {
            throw new InvalidFilterException("filter node must be an object, got " + describe(node));
        }

        List<String> keys = new ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);
        for (String key : keys) {
            if (TEMPLATE_PLACEHOLDER.matcher(key).matches()) {
                throw new InvalidFilterException("unfilled template key '" + key + "'");
            }
        }
        if (keys.size() != 1) {
            throw new InvalidFilterException(keys.isEmpty()
                    ? "filter node is empty"
                    : "filter node must have exactly one operator key, got " + keys);
        }

        String key = keys.get(0);
        JsonNode payload = node.get(key);
        return switch (key) {
            case AND -> new FilterPredicate.And(compileChildren(AND, payload, depth));
            case OR -> new FilterPredicate.Or(compileChildren(OR, payload, depth));
            case NOT -> new FilterPredicate.Not(compileNode(payload, depth + 1));
            default -> compileLeaf(key, payload);
        };
    }

    private List<FilterPredicate> compileChildren(String combinator, JsonNode payload, int depth) {
        if (payload == null || !payload.isArray() || payload.isEmpty()) {
            throw new InvalidFilterException("'" + combinator + "' must be a non-empty list");
        }
        List<FilterPredicate> children = new ArrayList<>(payload.size());
        for (JsonNode child : payload) {
            children.add(compileNode(child, depth + 1));
        }
        return List.copyOf(children);
    }

    private FilterPredicate compileLeaf(String key, JsonNode payload) {
        FilterOperator operator = FilterOperator.fromKey(key)
                .orElseThrow(() -> new InvalidFilterException("unsupported filter key '" + key + "'"));

        if (payload == null || !payload.isObject()) {
            throw new InvalidFilterException("'" + key + "' payload must be an object with 'field' and 'value'");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = payload.fields();
        while (entries.hasNext()) {
            String payloadKey = entries.next().getKey();
            if (!Set.of(FIELD, VALUE).contains(payloadKey)) {
                throw new InvalidFilterException("unexpected key '" + payloadKey + "' in '" + key + "' payload");
            }
        }

        JsonNode fieldNode = payload.get(FIELD);
        if (fieldNode == null || fieldNode.isNull()) {
            throw new InvalidFilterException("'" + key + "' requires a 'field'");
        }
        if (!fieldNode.isTextual()) {
            throw new InvalidFilterException("'" + key + "' field must be a string");
        }
        JsonNode valueNode = payload.get(VALUE);
        if (valueNode == null || valueNode.isNull()) {
            throw new InvalidFilterException("'" + key + "' requires a 'value'");
        }

        FieldPath field = FieldPath.parse(fieldNode.asText());
        Object value;
        if (operator == FilterOperator.IN) {
            if (!valueNode.isArray()) {
                throw new InvalidFilterException("'in' expects a list value");
            }
            if (valueNode.size() > MAX_IN_VALUES) {
                throw new InvalidFilterException("'in' list exceeds " + MAX_IN_VALUES + " values");
            }
            List<Object> values = new ArrayList<>(valueNode.size());
            for (JsonNode element : valueNode) {
                values.add(toScalar(key, element));
            }
            value = List.copyOf(values);
        } else {
            value = toScalar(key, valueNode);
        }
        if (operator == FilterOperator.CONTAINS && !(value instanceof String)) {
            throw new InvalidFilterException("'contains' expects a string value");
        }
        return new FilterPredicate.Comparison(operator, field, value);
    }

    private Object toScalar(String key, JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        throw new InvalidFilterException("'" + key + "' value must be a scalar, got " + describe(node));
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
