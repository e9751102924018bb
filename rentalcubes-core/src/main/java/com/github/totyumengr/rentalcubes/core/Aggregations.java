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

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.result.ResultRow;

/**
 * <p>Define supported calculation operations.
 * @author mengran
 *
 */
public interface Aggregations {

    /**
     * Calculation scale
     */
    int IND_SCALE = 8;

    /**
     * Run a cube query with a fresh {@link QueryContext}.
     * @param query validated query
     * @return ordered result rows
     */
    List<ResultRow> query(CubeQuery query);

    /**
     * Run a cube query. It equal to "SELECT {dims}, {aggregates} FROM {fact table of cube} WHERE {where} GROUP BY
     * {CUBE|ROLLUP|GROUPING SETS} HAVING {having} ORDER BY {order keys}".
     * @param query validated query
     * @param context cancellation context
     * @return ordered result rows
     * @throws QueryCancelledException if context is cancelled before the rows are assembled
     */
    List<ResultRow> query(CubeQuery query, QueryContext context);

    /**
     * Sum calculation of given indicate. It equal to "SELECT SUM({indName}) FROM {fact table of cube}".
     * @param indName indicate name for sum
     * @return result of sum operation
     */
    BigDecimal sum(String indName);

    /**
     * Sum calculation of given indicate with filter. It equal to "SELECT SUM({indName}) FROM {fact table of cube} WHERE
     * {where}".
     * @param indName indicate name for sum
     * @param where filter, <code>null</code> for none
     * @return result of sum operation
     */
    BigDecimal sum(String indName, Condition where);

    /**
     * Sum calculation of given indicate with filter and grouper. It equal to "SELECT SUM({indName}) FROM {fact table of
     * cube} WHERE {where} group by {dimension}". A <code>null</code> key holds the rows missing the dimension.
     * @param indName indicate name for sum
     * @param groupByDimName group by dimension
     * @param where filter, <code>null</code> for none
     * @return result of sum operation
     */
    Map<Object, BigDecimal> sum(String indName, String groupByDimName, Condition where);

}
