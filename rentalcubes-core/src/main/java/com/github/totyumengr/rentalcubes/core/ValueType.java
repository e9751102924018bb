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
package com.github.totyumengr.rentalcubes.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;

/**
 * Value domains of fact-table columns. Every column declares one, predicates are type checked against it and result
 * ordering uses its natural order.
 *
 * @author mengran
 *
 */
public enum ValueType {

    TEXT {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }
    },

    NUMBER {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Number;
        }

        @Override
        protected int compareConcrete(Object left, Object right) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
    },

    DATE {
        @Override
        public boolean accepts(Object value) {
            return value instanceof LocalDate;
        }
    };

    /**
     * @param value non-null value
     * @return <code>true</code> if value belongs to this domain
     */
    public abstract boolean accepts(Object value);

    /**
     * Compare two non-null values of this domain.
     * @param left left value
     * @param right right value
     * @return negative, zero or positive like {@link Comparable#compareTo(Object)}
     * @throws PredicateTypeException if one of the values is outside of this domain
     */
    public int compare(Object left, Object right) throws PredicateTypeException {

        if (!accepts(left) || !accepts(right)) {
            throw new PredicateTypeException("Can not compare " + left + " with " + right + " as " + this);
        }
        return compareConcrete(left, right);
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    protected int compareConcrete(Object left, Object right) {
        return ((Comparable) left).compareTo(right);
    }

    /**
     * @param value literal value
     * @return domain of given literal
     * @throws PredicateTypeException if value is not of a supported type
     */
    public static ValueType of(Object value) throws PredicateTypeException {

        for (ValueType type : values()) {
            if (type.accepts(value)) {
                return type;
            }
        }
        throw new PredicateTypeException("Unsupported value " + value
                + (value == null ? "" : " of " + value.getClass().getName()));
    }

    /**
     * Compare two non-null values of any (same) domain, numbers are compared by value.
     * @param left left value
     * @param right right value
     * @return negative, zero or positive like {@link Comparable#compareTo(Object)}
     */
    public static int compareValues(Object left, Object right) {
        return of(left).compare(left, right);
    }

    public static BigDecimal toBigDecimal(Number number) {

        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * @param number any number
     * @return the same value as an {@link Integer}, or <code>null</code> if it has a fraction or is out of int range
     */
    public static Integer toInteger(Number number) {

        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.intValue();
        }
        BigDecimal decimal = toBigDecimal(number).stripTrailingZeros();
        if (decimal.scale() > 0 || decimal.compareTo(INT_MIN) < 0 || decimal.compareTo(INT_MAX) > 0) {
            return null;
        }
        return decimal.intValue();
    }

    /**
     * One boxed form per numeric value: whole numbers in int range become {@link Integer}, whole numbers in long range
     * {@link Long}, anything else a {@link BigDecimal} without trailing zeros.
     * @param number any number
     * @return canonical form, equal to the canonical form of every other number with the same value
     */
    public static Number canonical(Number number) {

        Integer integer = toInteger(number);
        if (integer != null) {
            return integer;
        }
        BigDecimal decimal = toBigDecimal(number).stripTrailingZeros();
        if (decimal.scale() <= 0 && decimal.compareTo(LONG_MIN) >= 0 && decimal.compareTo(LONG_MAX) <= 0) {
            return decimal.longValue();
        }
        return decimal;
    }

    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
}
