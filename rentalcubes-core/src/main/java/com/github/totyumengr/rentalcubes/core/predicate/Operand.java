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
package com.github.totyumengr.rentalcubes.core.predicate;

import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * Leaf of a predicate tree: a column, an aggregate or a literal.
 *
 * @author mengran
 *
 */
public abstract class Operand {

    /**
     * @param binding phase binding
     * @return domain of this operand
     */
    public abstract ValueType bind(ConditionBinding binding);

    public abstract SlotValue resolve(EvaluationContext context);

    public static Operand column(String name) {

        Assert.hasText(name, "Column name can not be empty.");
        return new ColumnOperand(name);
    }

    public static Operand aggregate(AggregateFunction function, String argument) {

        Assert.notNull(function, "Aggregate function can not be null.");
        return new AggregateOperand(function, argument);
    }

    public static Operand countAll() {
        return aggregate(AggregateFunction.COUNT, null);
    }

    public static Operand count(String measure) {
        return aggregate(AggregateFunction.COUNT, measure);
    }

    public static Operand sum(String measure) {
        return aggregate(AggregateFunction.SUM, measure);
    }

    public static Operand avg(String measure) {
        return aggregate(AggregateFunction.AVG, measure);
    }

    public static Operand min(String measure) {
        return aggregate(AggregateFunction.MIN, measure);
    }

    public static Operand max(String measure) {
        return aggregate(AggregateFunction.MAX, measure);
    }

    public static Operand countDistinct(String attribute) {
        return aggregate(AggregateFunction.COUNT_DISTINCT, attribute);
    }

    /**
     * @param value string, number or {@link java.time.LocalDate}
     * @return literal operand
     * @throws PredicateTypeException if value is <code>null</code> or of an unsupported type
     */
    public static Operand literal(Object value) throws PredicateTypeException {

        if (value instanceof Operand) {
            return (Operand) value;
        }
        ValueType.of(value);
        return new LiteralOperand(value);
    }

    private static final class ColumnOperand extends Operand {

        private final String name;

        ColumnOperand(String name) {
            this.name = name;
        }

        @Override
        public ValueType bind(ConditionBinding binding) {
            return binding.columnType(name);
        }

        @Override
        public SlotValue resolve(EvaluationContext context) {
            return context.column(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class AggregateOperand extends Operand {

        private final AggregateFunction function;
        private final String argument;

        AggregateOperand(AggregateFunction function, String argument) {
            this.function = function;
            this.argument = argument;
        }

        @Override
        public ValueType bind(ConditionBinding binding) {
            return binding.aggregateType(function, argument);
        }

        @Override
        public SlotValue resolve(EvaluationContext context) {
            return context.aggregate(function, argument);
        }

        @Override
        public String toString() {
            return function.label(argument);
        }
    }

    private static final class LiteralOperand extends Operand {

        private final SlotValue value;
        private final ValueType type;

        LiteralOperand(Object value) {
            this.value = SlotValue.of(value);
            this.type = ValueType.of(value);
        }

        @Override
        public ValueType bind(ConditionBinding binding) {
            return type;
        }

        @Override
        public SlotValue resolve(EvaluationContext context) {
            return value;
        }

        @Override
        public String toString() {
            return type == ValueType.NUMBER ? String.valueOf(value) : "'" + value + "'";
        }
    }
}
