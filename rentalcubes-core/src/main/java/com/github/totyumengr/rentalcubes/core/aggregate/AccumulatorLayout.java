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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.ValueType;

/**
 * Which measures and distinct-count attributes the accumulators of one query track.
 *
 * @author mengran
 *
 */
public final class AccumulatorLayout {

    private final List<String> measures;
    private final ValueType[] measureTypes;
    private final List<String> distinctAttributes;

    /**
     * @param meta fact-table layout
     * @param measures aggregated measure columns
     * @param distinctAttributes integer columns (dimension or measure) to distinct-count
     * @throws CubeConfigurationException if a column is unknown, listed twice or not of the right kind
     */
    public AccumulatorLayout(FactTable.Meta meta, List<String> measures, List<String> distinctAttributes)
            throws CubeConfigurationException {
        super();
        this.measures = Collections.unmodifiableList(new ArrayList<String>(measures));
        this.measureTypes = new ValueType[measures.size()];
        for (int i = 0; i < measures.size(); i++) {
            String measure = measures.get(i);
            if (!meta.isInd(measure)) {
                throw new CubeConfigurationException("Unknown measure " + measure + " of " + meta.getName());
            }
            if (measures.indexOf(measure) != i) {
                throw new CubeConfigurationException("Measure " + measure + " is listed twice.");
            }
            measureTypes[i] = meta.getType(measure);
        }
        this.distinctAttributes = Collections.unmodifiableList(new ArrayList<String>(distinctAttributes));
        for (int i = 0; i < distinctAttributes.size(); i++) {
            String attribute = distinctAttributes.get(i);
            if (meta.getType(attribute) != ValueType.NUMBER) {
                throw new CubeConfigurationException("Distinct count needs an integer column, " + attribute + " is "
                        + meta.getType(attribute));
            }
            if (!meta.isInteger(attribute)) {
                throw new CubeConfigurationException("Distinct count needs an integer column, " + attribute
                        + " has fractional or out of int range values.");
            }
            if (distinctAttributes.indexOf(attribute) != i) {
                throw new CubeConfigurationException("Distinct attribute " + attribute + " is listed twice.");
            }
        }
    }

    public List<String> getMeasures() {
        return measures;
    }

    public ValueType getMeasureType(int index) {
        return measureTypes[index];
    }

    public List<String> getDistinctAttributes() {
        return distinctAttributes;
    }

    public int measureIndex(String measure) {
        return measures.indexOf(measure);
    }

    public int distinctIndex(String attribute) {
        return distinctAttributes.indexOf(attribute);
    }

    /**
     * Check an aggregate reference against this layout.
     * @param function aggregate function
     * @param argument measure, distinct attribute or <code>null</code> for <code>COUNT(*)</code>
     * @return domain of the aggregate value
     * @throws CubeConfigurationException if the argument is not tracked by this layout
     * @throws PredicateTypeException if the function does not apply to the measure's domain
     */
    public ValueType typeOf(AggregateFunction function, String argument)
            throws CubeConfigurationException, PredicateTypeException {

        if (function == AggregateFunction.COUNT && argument == null) {
            return ValueType.NUMBER;
        }
        if (argument == null) {
            throw new CubeConfigurationException(function + " needs an argument.");
        }
        if (function == AggregateFunction.COUNT_DISTINCT) {
            if (distinctIndex(argument) < 0) {
                throw new CubeConfigurationException(function.label(argument) + " is not distinct-counted by this query.");
            }
            return ValueType.NUMBER;
        }
        int index = measureIndex(argument);
        if (index < 0) {
            throw new CubeConfigurationException("Measure " + argument + " is not aggregated by this query.");
        }
        switch (function) {
        case COUNT:
            return ValueType.NUMBER;
        case SUM:
        case AVG:
            if (measureTypes[index] != ValueType.NUMBER) {
                throw new PredicateTypeException(function.label(argument) + " needs a number measure, " + argument
                        + " is " + measureTypes[index]);
            }
            return ValueType.NUMBER;
        default:
            return measureTypes[index];
        }
    }

    @Override
    public String toString() {
        return "AccumulatorLayout [measures=" + measures + ", distinctAttributes=" + distinctAttributes + "]";
    }

}
