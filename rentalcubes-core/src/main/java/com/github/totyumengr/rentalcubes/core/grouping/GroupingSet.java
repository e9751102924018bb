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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One subset of the configured dimensions, aggregated over in one pass. Bit <code>i</code> of {@link #getMask()} is set
 * when dimension <code>i</code> is grouped by.
 *
 * @author mengran
 *
 */
public final class GroupingSet {

    private final int index;
    private final int mask;
    private final List<String> dimensions;
    private final int dimensionCount;

    GroupingSet(int index, int mask, List<String> allDimensions) {
        super();
        this.index = index;
        this.mask = mask;
        this.dimensionCount = allDimensions.size();
        List<String> dims = new ArrayList<String>();
        for (int i = 0; i < allDimensions.size(); i++) {
            if (contains(i)) {
                dims.add(allDimensions.get(i));
            }
        }
        this.dimensions = Collections.unmodifiableList(dims);
    }

    /**
     * @return position in enumeration order
     */
    public int getIndex() {
        return index;
    }

    public int getMask() {
        return mask;
    }

    public boolean contains(int dimensionIndex) {
        return (mask & (1 << dimensionIndex)) != 0;
    }

    /**
     * @return grouped dimension names, in configured order
     */
    public List<String> getDimensions() {
        return dimensions;
    }

    public boolean isGrandTotal() {
        return mask == 0;
    }

    /**
     * SQL <code>GROUPING_ID</code> value: one bit per configured dimension, first dimension most significant, set when the
     * dimension is aggregated away.
     * @return grouping id
     */
    public int getGroupingId() {

        int id = 0;
        for (int i = 0; i < dimensionCount; i++) {
            id = (id << 1) | (contains(i) ? 0 : 1);
        }
        return id;
    }

    @Override
    public int hashCode() {
        return mask;
    }

    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GroupingSet)) {
            return false;
        }
        GroupingSet other = (GroupingSet) obj;
        return mask == other.mask && dimensionCount == other.dimensionCount;
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", dimensions) + ")";
    }

}
