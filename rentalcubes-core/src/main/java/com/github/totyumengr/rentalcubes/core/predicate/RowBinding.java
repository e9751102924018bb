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

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * WHERE binding: any dimension or measure column of the fact-table, no aggregates.
 * 
 * @author mengran
 *
 */
public class RowBinding implements ConditionBinding {
    
    private final FactTable.Meta meta;
    
    public RowBinding(FactTable.Meta meta) {
        super();
        this.meta = meta;
    }

    @Override
    public String getPhase() {
        return "WHERE";
    }

    @Override
    public ValueType columnType(String column) {
        return meta.getType(column);
    }

    @Override
    public ValueType aggregateType(AggregateFunction function, String argument) {
        throw new CubeConfigurationException("Aggregate " + function.label(argument) + " can not be used in WHERE.");
    }

    @Override
    public boolean isGrouped() {
        return false;
    }
    
}
