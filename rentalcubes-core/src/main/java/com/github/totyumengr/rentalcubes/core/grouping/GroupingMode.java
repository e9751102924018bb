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
package com.github.totyumengr.rentalcubes.core.grouping;

/**
 * How a dimension list is expanded into grouping sets.
 * 
 * @author mengran
 *
 */
public enum GroupingMode {
    
    /**
     * <code>GROUPING SETS ((a, b), (a), ())</code>: caller supplied subsets, used as-is.
     */
    EXPLICIT,
    
    /**
     * <code>ROLLUP (a, b, c)</code>: hierarchical prefixes, most detailed first, grand total last.
     */
    ROLLUP,
    
    /**
     * <code>CUBE (a, b)</code>: the full power set.
     */
    CUBE
}
