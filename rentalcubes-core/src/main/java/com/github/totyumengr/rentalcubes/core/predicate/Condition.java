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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.ValueType;

/**
 * Boolean predicate tree evaluated against a row (WHERE) or a group (HAVING).
 *
 * <p>Comparisons, ranges and set membership against a {@link SlotValue#NULL} or {@link SlotValue#AGGREGATED} operand are
 * <code>false</code>, they never throw. Only {@link #isNull(String)} matches a natural missing value and only
 * {@link #isTotal(String)} matches a rolled-up slot. Junctions short-circuit left to right.
 *
 * <p>{@link #validate(ConditionBinding)} type checks the tree eagerly and raises {@link PredicateTypeException} when
 * incompatible domains meet.
 *
 * @author mengran
 *
 */
public abstract class Condition {

    /**
     * @param binding phase binding
     * @throws PredicateTypeException if incompatible domains are compared
     */
    public abstract void validate(ConditionBinding binding) throws PredicateTypeException;

    public abstract boolean test(EvaluationContext context);

    // ---------------------------- Factories ----------------------------

    public static Condition and(Condition... conditions) {
        return and(Arrays.asList(conditions));
    }

    public static Condition and(List<Condition> conditions) {
        return new Junction(true, conditions);
    }

    public static Condition or(Condition... conditions) {
        return or(Arrays.asList(conditions));
    }

    public static Condition or(List<Condition> conditions) {
        return new Junction(false, conditions);
    }

    public static Condition compare(Operand left, ComparisonOperator operator, Operand right) {
        return new Comparison(left, operator, right);
    }

    public static Condition compare(Operand left, ComparisonOperator operator, Object literal) {
        return new Comparison(left, operator, Operand.literal(literal));
    }

    public static Condition eq(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.EQ, literal);
    }

    public static Condition ne(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.NE, literal);
    }

    public static Condition lt(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.LT, literal);
    }

    public static Condition le(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.LE, literal);
    }

    public static Condition gt(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.GT, literal);
    }

    public static Condition ge(String column, Object literal) {
        return compare(Operand.column(column), ComparisonOperator.GE, literal);
    }

    /**
     * SQL <code>BETWEEN</code>, both bounds inclusive.
     */
    public static Condition between(Operand operand, Object low, Object high) {

        Assert.isTrue(low != null && high != null, "BETWEEN needs both bounds.");
        return new Range(operand, low, true, high, true, null);
    }

    public static Condition between(String column, Object low, Object high) {
        return between(Operand.column(column), low, high);
    }

    /**
     * Half-open date range <code>from &lt;= column &lt; to</code>. A <code>null</code> bound is open.
     * @param column date column
     * @param from inclusive lower bound
     * @param to exclusive upper bound
     * @return range condition, fails validation unless the column is a date
     */
    public static Condition dateRange(String column, LocalDate from, LocalDate to) {

        Assert.isTrue(from != null || to != null, "Date range needs one bound at least.");
        return new Range(Operand.column(column), from, true, to, false, ValueType.DATE);
    }

    public static Condition in(Operand operand, Collection<?> values) {
        return new Membership(operand, values);
    }

    public static Condition in(String column, Object... values) {
        return in(Operand.column(column), Arrays.asList(values));
    }

    public static Condition isNull(Operand operand) {
        return new NullCheck(operand, true);
    }

    public static Condition isNull(String column) {
        return isNull(Operand.column(column));
    }

    /**
     * Matches concrete values only: a rolled-up slot is not a value.
     */
    public static Condition isNotNull(Operand operand) {
        return new NullCheck(operand, false);
    }

    public static Condition isNotNull(String column) {
        return isNotNull(Operand.column(column));
    }

    /**
     * SQL <code>GROUPING(dimension) = 1</code>, only valid in HAVING.
     */
    public static Condition isTotal(String dimension) {
        return new TotalCheck(dimension);
    }

    // ---------------------------- Nodes ----------------------------

    private static PredicateTypeException mismatch(ConditionBinding binding, Object left, ValueType leftType,
            Object right, ValueType rightType) {
        return new PredicateTypeException(binding.getPhase() + " predicate compares " + left + " (" + leftType
                + ") with " + right + " (" + rightType + ")");
    }

    private static final class Junction extends Condition {

        private final boolean conjunction;
        private final List<Condition> conditions;

        Junction(boolean conjunction, List<Condition> conditions) {

            Assert.notEmpty(conditions, (conjunction ? "AND" : "OR") + " needs one condition at least.");
            Assert.noNullElements(conditions.toArray(), "Condition can not be null.");
            this.conjunction = conjunction;
            this.conditions = Collections.unmodifiableList(new ArrayList<Condition>(conditions));
        }

        @Override
        public void validate(ConditionBinding binding) {

            for (Condition condition : conditions) {
                condition.validate(binding);
            }
        }

        @Override
        public boolean test(EvaluationContext context) {

            for (Condition condition : conditions) {
                if (condition.test(context) != conjunction) {
                    return !conjunction;
                }
            }
            return conjunction;
        }

        @Override
        public String toString() {
            return conditions.stream().map(Object::toString)
                    .collect(Collectors.joining(conjunction ? " AND " : " OR ", "(", ")"));
        }
    }

    private static final class Comparison extends Condition {

        private final Operand left;
        private final ComparisonOperator operator;
        private final Operand right;

        Comparison(Operand left, ComparisonOperator operator, Operand right) {

            Assert.notNull(left, "Left operand can not be null.");
            Assert.notNull(operator, "Operator can not be null.");
            Assert.notNull(right, "Right operand can not be null.");
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public void validate(ConditionBinding binding) {

            ValueType leftType = left.bind(binding);
            ValueType rightType = right.bind(binding);
            if (leftType != rightType) {
                throw mismatch(binding, left, leftType, right, rightType);
            }
        }

        @Override
        public boolean test(EvaluationContext context) {

            SlotValue l = left.resolve(context);
            if (!l.isConcrete()) {
                return false;
            }
            SlotValue r = right.resolve(context);
            if (!r.isConcrete()) {
                return false;
            }
            return operator.test(ValueType.compareValues(l.getValue(), r.getValue()));
        }

        @Override
        public String toString() {
            return left + " " + operator.getSymbol() + " " + right;
        }
    }

    private static final class Range extends Condition {

        private final Operand operand;
        private final Object low;
        private final boolean lowInclusive;
        private final Object high;
        private final boolean highInclusive;
        private final ValueType requiredType;

        Range(Operand operand, Object low, boolean lowInclusive, Object high, boolean highInclusive,
                ValueType requiredType) {

            Assert.notNull(operand, "Operand can not be null.");
            this.operand = operand;
            this.low = low;
            this.lowInclusive = lowInclusive;
            this.high = high;
            this.highInclusive = highInclusive;
            this.requiredType = requiredType;
        }

        @Override
        public void validate(ConditionBinding binding) {

            ValueType type = operand.bind(binding);
            if (requiredType != null && type != requiredType) {
                throw new PredicateTypeException(binding.getPhase() + " range on " + operand + " needs a "
                        + requiredType + " but it is " + type);
            }
            for (Object bound : new Object[] {low, high}) {
                if (bound != null && ValueType.of(bound) != type) {
                    throw mismatch(binding, operand, type, bound, ValueType.of(bound));
                }
            }
        }

        @Override
        public boolean test(EvaluationContext context) {

            SlotValue value = operand.resolve(context);
            if (!value.isConcrete()) {
                return false;
            }
            if (low != null) {
                int compared = ValueType.compareValues(value.getValue(), low);
                if (compared < 0 || (compared == 0 && !lowInclusive)) {
                    return false;
                }
            }
            if (high != null) {
                int compared = ValueType.compareValues(value.getValue(), high);
                if (compared > 0 || (compared == 0 && !highInclusive)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return operand + " IN " + (lowInclusive ? "[" : "(") + low + ", " + high + (highInclusive ? "]" : ")");
        }
    }

    private static final class Membership extends Condition {

        private final Operand operand;
        private final List<Object> values;

        Membership(Operand operand, Collection<?> values) {

            Assert.notNull(operand, "Operand can not be null.");
            Assert.notEmpty(values, "IN needs one value at least.");
            Assert.noNullElements(values.toArray(), "IN values can not be null.");
            this.operand = operand;
            this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
        }

        @Override
        public void validate(ConditionBinding binding) {

            ValueType type = operand.bind(binding);
            for (Object value : values) {
                if (ValueType.of(value) != type) {
                    throw mismatch(binding, operand, type, value, ValueType.of(value));
                }
            }
        }

        @Override
        public boolean test(EvaluationContext context) {

            SlotValue value = operand.resolve(context);
            if (!value.isConcrete()) {
                return false;
            }
            for (Object candidate : values) {
                if (ValueType.compareValues(value.getValue(), candidate) == 0) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return operand + " IN " + values;
        }
    }

    private static final class NullCheck extends Condition {

        private final Operand operand;
        private final boolean expectNull;

        NullCheck(Operand operand, boolean expectNull) {

            Assert.notNull(operand, "Operand can not be null.");
            this.operand = operand;
            this.expectNull = expectNull;
        }

        @Override
        public void validate(ConditionBinding binding) {
            operand.bind(binding);
        }

        @Override
        public boolean test(EvaluationContext context) {

            SlotValue value = operand.resolve(context);
            return expectNull ? value.isNull() : value.isConcrete();
        }

        @Override
        public String toString() {
            return operand + (expectNull ? " IS NULL" : " IS NOT NULL");
        }
    }

    private static final class TotalCheck extends Condition {

        private final String dimension;

        TotalCheck(String dimension) {

            Assert.hasText(dimension, "Dimension can not be empty.");
            this.dimension = dimension;
        }

        @Override
        public void validate(ConditionBinding binding) {

            if (!binding.isGrouped()) {
                throw new CubeConfigurationException("IS TOTAL(" + dimension
                        + ") is only valid after aggregation, not in " + binding.getPhase());
            }
            binding.columnType(dimension);
        }

        @Override
        public boolean test(EvaluationContext context) {
            return context.column(dimension).isAggregated();
        }

        @Override
        public String toString() {
            return "IS TOTAL(" + dimension + ")";
        }
    }
}
