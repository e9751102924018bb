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
package com.github.totyumengr.rentalcubes.core.aggregate;

import java.math.BigDecimal;

import com.github.totyumengr.rentalcubes.core.ValueType;

/**
 * Running statistics of one measure inside one group. Null values leave every statistic untouched.
 *
 * @author mengran
 *
 */
final class MeasureStats {

    private final ValueType type;

    BigDecimal sum;
    long nonNullCount;
    Object min;
    Object max;

    MeasureStats(ValueType type) {
        super();
        this.type = type;
    }

    void update(Object value) {

        if (value == null) {
            return;
        }
        nonNullCount++;
        if (type == ValueType.NUMBER) {
            BigDecimal v = ValueType.toBigDecimal((Number) value);
            sum = sum == null ? v : sum.add(v);
        }
        if (min == null || type.compare(value, min) < 0) {
            min = value;
        }
        if (max == null || type.compare(value, max) > 0) {
            max = value;
        }
    }

    void merge(MeasureStats other) {

        if (other.nonNullCount == 0) {
            return;
        }
        nonNullCount += other.nonNullCount;
        if (other.sum != null) {
            sum = sum == null ? other.sum : sum.add(other.sum);
        }
        if (min == null || type.compare(other.min, min) < 0) {
            min = other.min;
        }
        if (max == null || type.compare(other.max, max) > 0) {
            max = other.max;
        }
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nonNullCount) * 31 + (sum == null ? 0 : sum.hashCode());
    }

    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MeasureStats)) {
            return false;
        }
        MeasureStats other = (MeasureStats) obj;
        return type == other.type && nonNullCount == other.nonNullCount && equal(sum, other.sum)
                && equal(min, other.min) && equal(max, other.max);
    }

    private static boolean equal(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public String toString() {
        return "[sum=" + sum + ", nonNullCount=" + nonNullCount + ", min=" + min + ", max=" + max + "]";
    }

}
