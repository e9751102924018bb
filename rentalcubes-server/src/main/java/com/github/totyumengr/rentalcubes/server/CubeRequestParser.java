/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.rentalcubes.server;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.CubeQuery;
import com.github.totyumengr.rentalcubes.core.CubeQuery.CubeQueryBuilder;
import com.github.totyumengr.rentalcubes.core.FactTable.Meta;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.ComparisonOperator;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.Operand;
import com.github.totyumengr.rentalcubes.core.result.OrderKey;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.Direction;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.NullOrdering;

/**
 * Reads JSON query requests into {@link CubeQuery}. A request looks like:
 *
 * <pre>
 * {
 *   "groupBy": {"cube": ["country", "gender"]},
 *   "measures": ["price", "rating"],
 *   "countDistinct": ["customerId"],
 *   "where": {"and": [{"isNotNull": {"column": "country"}},
 *                     {"dateRange": "rentalDate", "from": "2018-01-01"}]},
 *   "having": {"compare": {"aggregate": "COUNT"}, "op": "&gt;=", "to": 5},
 *   "orderBy": [{"aggregate": "SUM", "argument": "price", "direction": "DESC"}],
 *   "rank": {"aggregate": "SUM", "argument": "price", "buckets": 10},
 *   "totalMarker": "TOTAL"
 * }
 * </pre>
 *
 * <p>Grouping is one of <code>cube</code>, <code>rollup</code>, <code>dimensions</code> with <code>sets</code>
 * (GROUPING SETS) or <code>dimensions</code> alone (plain GROUP BY). Operands are objects (<code>column</code>,
 * <code>aggregate</code> with optional <code>argument</code>, <code>date</code>), bare JSON strings and numbers are
 * literals.
 *
 * @author mengran
 *
 */
@Component
public class CubeRequestParser {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CubeRequestParser.class);
    
    private ObjectMapper objectMapper = new ObjectMapper();
    
    /**
     * @param request JSON request
     * @param meta fact-table to query
     * @param totalMarker marker used when request does not carry one
     * @return validated query
     * @throws CubeConfigurationException if request is malformed or does not fit the fact-table
     */
    public CubeQuery parse(String request, Meta meta, String totalMarker) throws CubeConfigurationException {
        
        JsonNode root = readTree(request);
        if (!root.isObject()) {
            throw new CubeConfigurationException("Query request must be an object but " + root);
        }
        
        CubeQueryBuilder builder = new CubeQueryBuilder(meta).groupBy(grouping(required(root, "groupBy")))
                .totalMarker(root.hasNonNull("totalMarker") ? root.get("totalMarker").asText() : totalMarker);
        if (root.hasNonNull("measures")) {
            builder.measures(strings(root.get("measures")));
        }
        if (root.hasNonNull("countDistinct")) {
            builder.countDistinct(strings(root.get("countDistinct")).toArray(new String[0]));
        }
        if (root.hasNonNull("where")) {
            builder.where(condition(root.get("where")));
        }
        if (root.hasNonNull("having")) {
            builder.having(condition(root.get("having")));
        }
        if (root.hasNonNull("rank")) {
            JsonNode rank = root.get("rank");
            builder.rank(function(required(rank, "aggregate")), argument(rank),
                    required(rank, "buckets").asInt());
        }
        if (root.hasNonNull("orderBy")) {
            for (JsonNode key : root.get("orderBy")) {
                builder.orderBy(orderKey(key));
            }
        }
        
        CubeQuery query = builder.done();
        LOGGER.debug("Parsed request {} into {}", request, query);
        return query;
    }
    
    /**
     * @param request JSON predicate, <code>null</code> or blank for none
     * @return condition, not validated yet
     * @throws CubeConfigurationException if request is malformed
     */
    public Condition parseCondition(String request) throws CubeConfigurationException {
        
        if (!StringUtils.hasText(request)) {
            return null;
        }
        return condition(readTree(request));
    }
    
    private JsonNode readTree(String request) throws CubeConfigurationException {
        
        try {
            return objectMapper.readTree(request);
        } catch (IOException e) {
            throw new CubeConfigurationException("Malformed JSON request " + request, e);
        }
    }
    
    private static JsonNode required(JsonNode node, String field) throws CubeConfigurationException {
        
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new CubeConfigurationException("Missing " + field + " in " + node);
        }
        return value;
    }
    
    private static List<String> strings(JsonNode node) throws CubeConfigurationException {
        
        if (!node.isArray()) {
            throw new CubeConfigurationException("Expect an array of names but " + node);
        }
        List<String> strings = new ArrayList<String>(node.size());
        for (JsonNode e : node) {
            strings.add(e.asText());
        }
        return strings;
    }
    
    private static GroupingSetSpec grouping(JsonNode node) throws CubeConfigurationException {
        
        if (node.hasNonNull("cube")) {
            return GroupingSetSpec.cube(strings(node.get("cube")));
        }
        if (node.hasNonNull("rollup")) {
            return GroupingSetSpec.rollup(strings(node.get("rollup")));
        }
        List<String> dimensions = strings(required(node, "dimensions"));
        if (!node.hasNonNull("sets")) {
            return GroupingSetSpec.groupBy(dimensions.toArray(new String[0]));
        }
        List<List<String>> sets = new ArrayList<List<String>>();
        for (JsonNode set : node.get("sets")) {
            sets.add(strings(set));
        }
        return GroupingSetSpec.groupingSets(dimensions, sets);
    }
    
    private static OrderKey orderKey(JsonNode node) throws CubeConfigurationException {
        
        Direction direction = node.hasNonNull("direction") ? enumOf(Direction.class, node.get("direction"))
                : Direction.ASC;
        NullOrdering nulls = node.hasNonNull("nulls") ? enumOf(NullOrdering.class, node.get("nulls"))
                : NullOrdering.NULLS_LAST;
        if (node.hasNonNull("dimension")) {
            return OrderKey.dimension(node.get("dimension").asText(), direction, nulls);
        }
        if (node.hasNonNull("aggregate")) {
            return OrderKey.aggregate(function(node.get("aggregate")), argument(node), direction, nulls);
        }
        if (node.has("bucket")) {
            return OrderKey.bucket(direction);
        }
        throw new CubeConfigurationException("Order key needs dimension, aggregate or bucket but " + node);
    }
    
    Condition condition(JsonNode node) throws CubeConfigurationException {
        
        if (node == null || !node.isObject() || node.size() == 0) {
            throw new CubeConfigurationException("Predicate must be a non-empty object but " + node);
        }
        if (node.hasNonNull("and")) {
            return Condition.and(conditions(node.get("and")));
        }
        if (node.hasNonNull("or")) {
            return Condition.or(conditions(node.get("or")));
        }
        if (node.hasNonNull("compare")) {
            ComparisonOperator operator;
            try {
                operator = ComparisonOperator.fromSymbol(required(node, "op").asText());
            } catch (IllegalArgumentException e) {
                throw new CubeConfigurationException(e.getMessage(), e);
            }
            return Condition.compare(operand(node.get("compare")), operator, operand(required(node, "to")));
        }
        if (node.hasNonNull("between")) {
            return Condition.between(operand(node.get("between")), literal(required(node, "low")),
                    literal(required(node, "high")));
        }
        if (node.hasNonNull("in")) {
            List<Object> values = new ArrayList<Object>();
            for (JsonNode value : required(node, "values")) {
                values.add(literal(value));
            }
            return Condition.in(operand(node.get("in")), values);
        }
        if (node.hasNonNull("isNull")) {
            return Condition.isNull(operand(node.get("isNull")));
        }
        if (node.hasNonNull("isNotNull")) {
            return Condition.isNotNull(operand(node.get("isNotNull")));
        }
        if (node.hasNonNull("isTotal")) {
            return Condition.isTotal(node.get("isTotal").asText());
        }
        if (node.hasNonNull("dateRange")) {
            return Condition.dateRange(node.get("dateRange").asText(),
                    node.hasNonNull("from") ? date(node.get("from").asText()) : null,
                    node.hasNonNull("to") ? date(node.get("to").asText()) : null);
        }
        throw new CubeConfigurationException("Unknown predicate " + node);
    }
    
    private List<Condition> conditions(JsonNode node) throws CubeConfigurationException {
        
        if (!node.isArray() || node.size() == 0) {
            throw new CubeConfigurationException("Expect a non-empty array of predicates but " + node);
        }
        List<Condition> conditions = new ArrayList<Condition>(node.size());
        for (Iterator<JsonNode> it = node.elements(); it.hasNext();) {
            conditions.add(condition(it.next()));
        }
        return conditions;
    }
    
    private static Operand operand(JsonNode node) throws CubeConfigurationException {
        
        if (node.isObject()) {
            if (node.hasNonNull("column")) {
                return Operand.column(node.get("column").asText());
            }
            if (node.hasNonNull("aggregate")) {
                return Operand.aggregate(function(node.get("aggregate")), argument(node));
            }
        }
        return Operand.literal(literal(node));
    }
    
    private static Object literal(JsonNode node) throws CubeConfigurationException {
        
        if (node.isObject() && node.hasNonNull("date")) {
            return date(node.get("date").asText());
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new CubeConfigurationException("Unsupported literal " + node);
    }
    
    private static String argument(JsonNode node) {
        return node.hasNonNull("argument") ? node.get("argument").asText() : null;
    }
    
    private static AggregateFunction function(JsonNode node) throws CubeConfigurationException {
        return enumOf(AggregateFunction.class, node);
    }
    
    private static <E extends Enum<E>> E enumOf(Class<E> type, JsonNode node) throws CubeConfigurationException {
        
        try {
            return Enum.valueOf(type, node.asText().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new CubeConfigurationException("Unknown " + type.getSimpleName() + " " + node.asText(), e);
        }
    }
    
    private static LocalDate date(String value) throws CubeConfigurationException {
        
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new CubeConfigurationException("Illegal date " + value, e);
        }
    }
    
}
