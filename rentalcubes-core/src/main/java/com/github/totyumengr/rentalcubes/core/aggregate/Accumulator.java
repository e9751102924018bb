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
import java.math.RoundingMode;
import java.util.Arrays;

import org.roaringbitmap.RoaringBitmap;

import com.github.totyumengr.rentalcubes.core.Aggregations;
import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;

/**
 * Running aggregate state of one group: row count, per-measure (sum, non-null count, min, max) and one
 * {@link RoaringBitmap} per distinct-counted attribute.
 *
 * <p>Created lazily on the first row of its key and updated monotonically by one worker. Partial accumulators of the
 * same key are combined with {@link #merge(Accumulator)}; averages are always derived at read time from the merged
 * (sum, non-null count), never from partial averages.
 *
 * @author mengran
 *
 */
public final class Accumulator {

    private final AccumulatorLayout layout;

    private long count;
    private final MeasureStats[] measures;
    private final RoaringBitmap[] distincts;

    public Accumulator(AccumulatorLayout layout) {
        super();
        this.layout = layout;
        this.measures = new MeasureStats[layout.getMeasures().size()];
        for (int i = 0; i < measures.length; i++) {
            measures[i] = new MeasureStats(layout.getMeasureType(i));
        }
        this.distincts = new RoaringBitmap[layout.getDistinctAttributes().size()];
        for (int i = 0; i < distincts.length; i++) {
            distincts[i] = new RoaringBitmap();
        }
    }

    /**
     * @param measureValues one value per layout measure, <code>null</code> allowed
     * @param distinctValues one value per layout distinct attribute, <code>null</code> allowed
     */
    public void update(Object[] measureValues, Integer[] distinctValues) {

        count++;
        for (int i = 0; i < measures.length; i++) {
            measures[i].update(measureValues[i]);
        }
        for (int i = 0; i < distincts.length; i++) {
            if (distinctValues[i] != null) {
                distincts[i].add(distinctValues[i].intValue());
            }
        }
    }

    /**
     * Fold another partial accumulator of the same key into this one. Counts and sums add, min/max take the extremes
     * and distinct bitmaps are or-ed.
     * @param other partial accumulator built with the same layout
     */
    public void merge(Accumulator other) {

        if (other.layout != layout) {
            throw new IllegalArgumentException("Can not merge accumulators of different layouts.");
        }
        count += other.count;
        for (int i = 0; i < measures.length; i++) {
            measures[i].merge(other.measures[i]);
        }
        for (int i = 0; i < distincts.length; i++) {
            distincts[i].or(other.distincts[i]);
        }
    }

    public AccumulatorLayout getLayout() {
        return layout;
    }

    /**
     * @return <code>COUNT(*)</code>
     */
    public long getCount() {
        return count;
    }

    /**
     * @param measure measure name
     * @return <code>COUNT(measure)</code>, rows with a non-null value
     */
    public long getCount(String measure) {
        return stats(measure).nonNullCount;
    }

    /**
     * @param measure measure name
     * @return sum or <code>null</code> if the group has no non-null value
     */
    public BigDecimal getSum(String measure) {
        return stats(measure).sum;
    }

    /**
     * @param measure measure name
     * @return average scaled to {@link Aggregations#IND_SCALE}, or <code>null</code> if the group has no non-null value
     */
    public BigDecimal getAvg(String measure) {

        MeasureStats stats = stats(measure);
        if (stats.nonNullCount == 0 || stats.sum == null) {
            return null;
        }
        return stats.sum.divide(BigDecimal.valueOf(stats.nonNullCount), Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }

    public Object getMin(String measure) {
        return stats(measure).min;
    }

    public Object getMax(String measure) {
        return stats(measure).max;
    }

    /**
     * @param attribute distinct-counted attribute
     * @return <code>COUNT(DISTINCT attribute)</code>
     */
    public long getDistinctCount(String attribute) {
        return distinctBitmap(attribute).getLongCardinality();
    }

    /**
     * @param attribute distinct-counted attribute
     * @return copy of the distinct member bitmap
     */
    public RoaringBitmap getDistinct(String attribute) {
        return distinctBitmap(attribute).clone();
    }

    /**
     * @param function aggregate function
     * @param argument measure, distinct attribute or <code>null</code> for <code>COUNT(*)</code>
     * @return aggregate value, <code>null</code> means "no value"
     */
    public Object value(AggregateFunction function, String argument) {

        switch (function) {
        case COUNT:
            return argument == null ? getCount() : getCount(argument);
        case SUM:
            return getSum(argument);
        case AVG:
            return getAvg(argument);
        case MIN:
            return getMin(argument);
        case MAX:
            return getMax(argument);
        case COUNT_DISTINCT:
            return getDistinctCount(argument);
        default:
            throw new IllegalArgumentException("Unknown function " + function);
        }
    }

    private MeasureStats stats(String measure) {

        int index = layout.measureIndex(measure);
        if (index < 0) {
            throw new CubeConfigurationException("Measure " + measure + " is not aggregated by this query.");
        }
        return measures[index];
    }

    private RoaringBitmap distinctBitmap(String attribute) {

        int index = layout.distinctIndex(attribute);
        if (index < 0) {
            throw new CubeConfigurationException("Attribute " + attribute + " is not distinct-counted by this query.");
        }
        return distincts[index];
    }

    @Override
    public int hashCode() {
        return Long.hashCode(count) * 31 + Arrays.hashCode(measures);
    }

    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Accumulator)) {
            return false;
        }
        Accumulator other = (Accumulator) obj;
        return count == other.count && Arrays.equals(measures, other.measures)
                && Arrays.equals(distincts, other.distincts);
    }

    @Override
    public String toString() {
        return "Accumulator [count=" + count + ", measures=" + Arrays.toString(measures) + "]";
    }

}
