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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;

/**
 * Dimension list plus {@link GroupingMode}. Validated and enumerated once when created, immutable thereafter.
 *
 * <pre>
 * GroupingSetSpec.rollup("country", "genre")
 * // GROUP BY ROLLUP(country, genre): (country, genre), (country), ()
 *
 * GroupingSetSpec.cube("country", "genre")
 * // GROUP BY CUBE(country, genre): (country, genre), (country), (genre), ()
 *
 * GroupingSetSpec.groupingSets(Arrays.asList("country", "gender"),
 *     Arrays.asList(Arrays.asList("country", "gender"), Arrays.asList("gender"), Collections.emptyList()))
 * // GROUP BY GROUPING SETS((country, gender), (gender), ())
 * </pre>
 *
 * @author mengran
 *
 */
public final class GroupingSetSpec {

    /**
     * Caps CUBE's exponential blow-up, 2^8 = 256 grouping sets at most.
     */
    public static final int MAX_DIMENSIONS = 8;

    private final GroupingMode mode;
    private final List<String> dimensions;
    private final List<GroupingSet> groupingSets;

    private GroupingSetSpec(GroupingMode mode, List<String> dimensions, List<List<String>> explicitSets) {
        super();
        this.mode = mode;
        this.dimensions = validateDimensions(dimensions);
        this.groupingSets = Collections.unmodifiableList(enumerate(explicitSets));
    }

    public static GroupingSetSpec rollup(String... dimensions) {
        return rollup(Arrays.asList(dimensions));
    }

    public static GroupingSetSpec rollup(List<String> dimensions) {
        return new GroupingSetSpec(GroupingMode.ROLLUP, dimensions, null);
    }

    public static GroupingSetSpec cube(String... dimensions) {
        return cube(Arrays.asList(dimensions));
    }

    public static GroupingSetSpec cube(List<String> dimensions) {
        return new GroupingSetSpec(GroupingMode.CUBE, dimensions, null);
    }

    /**
     * @param dimensions configured dimension list, one {@link GroupKey} slot each
     * @param sets subsets of <code>dimensions</code>, order inside one subset does not matter
     * @return explicit grouping sets
     */
    public static GroupingSetSpec groupingSets(List<String> dimensions, List<List<String>> sets) {

        if (sets == null || sets.isEmpty()) {
            throw new CubeConfigurationException("GROUPING SETS requires at least one set.");
        }
        return new GroupingSetSpec(GroupingMode.EXPLICIT, dimensions, sets);
    }

    /**
     * Plain <code>GROUP BY a, b</code>, a single grouping set holding every dimension.
     * @param dimensions grouped dimensions
     * @return grouping spec
     */
    public static GroupingSetSpec groupBy(String... dimensions) {
        return groupingSets(Arrays.asList(dimensions), Collections.singletonList(Arrays.asList(dimensions)));
    }

    private static List<String> validateDimensions(List<String> dimensions) {

        if (dimensions == null || dimensions.isEmpty()) {
            throw new CubeConfigurationException("Grouping requires at least one dimension.");
        }
        if (dimensions.size() > MAX_DIMENSIONS) {
            throw new CubeConfigurationException(String.format(
                    "Grouping over %d dimensions exceeds maximum of %d (CUBE would generate %d grouping sets)",
                    dimensions.size(), MAX_DIMENSIONS, 1L << dimensions.size()));
        }
        Set<String> seen = new HashSet<String>();
        for (String dimension : dimensions) {
            if (dimension == null || dimension.isEmpty()) {
                throw new CubeConfigurationException("Dimension name can not be empty in " + dimensions);
            }
            if (!seen.add(dimension)) {
                throw new CubeConfigurationException("Dimension " + dimension + " is listed twice in " + dimensions);
            }
        }
        return Collections.unmodifiableList(new ArrayList<String>(dimensions));
    }

    private List<GroupingSet> enumerate(List<List<String>> explicitSets) {

        int n = dimensions.size();
        List<GroupingSet> result = new ArrayList<GroupingSet>();
        switch (mode) {
        case ROLLUP:
            // (d1..dn), (d1..dn-1), ..., (d1), ()
            for (int prefix = n; prefix >= 0; prefix--) {
                result.add(new GroupingSet(result.size(), (1 << prefix) - 1, dimensions));
            }
            break;
        case CUBE:
            // Descending inclusion bitmask with d1 most significant: (a, b), (a), (b), ()
            for (int inclusion = (1 << n) - 1; inclusion >= 0; inclusion--) {
                int mask = 0;
                for (int i = 0; i < n; i++) {
                    if ((inclusion & (1 << (n - 1 - i))) != 0) {
                        mask |= 1 << i;
                    }
                }
                result.add(new GroupingSet(result.size(), mask, dimensions));
            }
            break;
        case EXPLICIT:
            Set<Integer> masks = new HashSet<Integer>();
            for (List<String> set : explicitSets) {
                if (set == null) {
                    throw new CubeConfigurationException("Grouping set can not be null in " + explicitSets);
                }
                int mask = 0;
                for (String dimension : set) {
                    int index = dimensions.indexOf(dimension);
                    if (index < 0) {
                        throw new CubeConfigurationException("Grouping set " + set + " contains " + dimension
                                + " which is not one of " + dimensions);
                    }
                    mask |= 1 << index;
                }
                if (!masks.add(mask)) {
                    throw new CubeConfigurationException("Duplicate grouping set " + set + " in " + explicitSets);
                }
                result.add(new GroupingSet(result.size(), mask, dimensions));
            }
            break;
        default:
            throw new IllegalStateException("Unknown mode " + mode);
        }
        return result;
    }

    public GroupingMode getMode() {
        return mode;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    /**
     * @return grouping sets in enumeration order, stable across runs
     */
    public List<GroupingSet> getGroupingSets() {
        return groupingSets;
    }

    @Override
    public String toString() {
        return mode == GroupingMode.EXPLICIT ? "GROUPING SETS" + groupingSets : mode + dimensions.toString();
    }

}
