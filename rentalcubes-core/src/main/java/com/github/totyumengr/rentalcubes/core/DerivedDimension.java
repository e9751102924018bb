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

import java.util.List;

/**
 * Computed dimension column, evaluated once per record when a {@link FactTable} is built.
 * 
 * @author mengran
 *
 */
public interface DerivedDimension {
    
    /**
     * @return domain of derived values
     */
    ValueType getType();
    
    /**
     * @return dimension or measure columns the value is computed from. The derived column is only added to fact-tables
     *      having all of them.
     */
    List<String> getSourceColumns();
    
    /**
     * @param sourceValues values of {@link #getSourceColumns()} in the same order, elements may be <code>null</code>
     * @return derived value or <code>null</code> for a natural missing value
     */
    Object derive(List<Object> sourceValues);
    
}
