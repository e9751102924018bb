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
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * Resolves operand domains while a {@link Condition} is validated, before any row is read.
 * 
 * @author mengran
 *
 */
public interface ConditionBinding {
    
    /**
     * @return "WHERE" or "HAVING", used in error messages
     */
    String getPhase();
    
    /**
     * @param column column name
     * @return domain of the column
     * @throws CubeConfigurationException if the column can not be referenced in this phase
     */
    ValueType columnType(String column) throws CubeConfigurationException;
    
    /**
     * @param function aggregate function
     * @param argument aggregate argument
     * @return domain of the aggregate value
     * @throws CubeConfigurationException if aggregates can not be referenced in this phase
     * @throws PredicateTypeException if the function does not apply to the argument
     */
    ValueType aggregateType(AggregateFunction function, String argument) 
            throws CubeConfigurationException, PredicateTypeException;
    
    /**
     * @return <code>true</code> if slots may be {@link com.github.totyumengr.rentalcubes.core.SlotValue#AGGREGATED}
     */
    boolean isGrouped();
}
