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

import java.util.List;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AccumulatorLayout;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * HAVING binding: configured grouping dimensions and the aggregates tracked by the query's accumulators.
 * 
 * @author mengran
 *
 */
public class GroupBinding implements ConditionBinding {
    
    private final FactTable.Meta meta;
    private final List<String> dimensions;
    private final AccumulatorLayout layout;
    
    public GroupBinding(FactTable.Meta meta, List<String> dimensions, AccumulatorLayout layout) {
        super();
        this.meta = meta;
        this.dimensions = dimensions;
        this.layout = layout;
    }

    @Override
    public String getPhase() {
        return "HAVING";
    }

    @Override
    public ValueType columnType(String column) {
        
        if (!dimensions.contains(column)) {
            throw new CubeConfigurationException("Column " + column + " is not a grouping dimension of " + dimensions);
        }
        return meta.getType(column);
    }

    @Override
    public ValueType aggregateType(AggregateFunction function, String argument) {
        return layout.typeOf(function, argument);
    }

    @Override
    public boolean isGrouped() {
        return true;
    }
    
}
