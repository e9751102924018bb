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
package com.github.totyumengr.rentalcubes.server;

import com.github.totyumengr.rentalcubes.core.Aggregations;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.RentalCube;

/**
 * Owns the rental cube served by this application. Every {@link Aggregations} call runs against the cube loaded
 * last, a reload swaps it without disturbing running queries.
 * @author mengran
 *
 */
public interface RentalCubeManager extends Aggregations {

    /**
     * (Re)load the cube from configured sources.
     * @return record count of the new cube
     */
    int load();
    
    boolean isLoaded();
    
    /**
     * @return current cube
     * @throws IllegalStateException if nothing is loaded yet
     */
    RentalCube cube() throws IllegalStateException;
    
    FactTable.Meta meta() throws IllegalStateException;
    
    /**
     * Set calculation mode of current cube.
     * @param parallel <code>true</code> means partial aggregations run in parallel
     */
    void setMode(boolean parallel);
    
    String getTotalMarker();
    
}
