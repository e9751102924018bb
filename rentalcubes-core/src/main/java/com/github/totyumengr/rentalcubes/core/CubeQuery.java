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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.aggregate.AccumulatorLayout;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.GroupBinding;
import com.github.totyumengr.rentalcubes.core.predicate.RowBinding;
import com.github.totyumengr.rentalcubes.core.result.OrderKey;
import com.github.totyumengr.rentalcubes.core.result.RankingRequest;
import com.github.totyumengr.rentalcubes.core.result.ResultAssembler;

/**
 * Validated cube query, the in-process counterpart of
 * <code>SELECT dims, aggregates FROM fact WHERE .. GROUP BY CUBE|ROLLUP|GROUPING SETS .. HAVING .. ORDER BY ..</code>.
 *
 * <p>Built with {@link CubeQueryBuilder} against a fact-table layout. Every configuration and type error is raised by
 * {@link CubeQueryBuilder#done()}, before any row is read. Immutable after that.
 *
 * @author mengran
 *
 */
public final class CubeQuery {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeQuery.class);

    public static final String DEFAULT_TOTAL_MARKER = "TOTAL";

    private final FactTable.Meta meta;
    private final GroupingSetSpec groupingSpec;
    private final AccumulatorLayout layout;
    private final Condition where;
    private final ResultAssembler assembler;

    private CubeQuery(FactTable.Meta meta, GroupingSetSpec groupingSpec, AccumulatorLayout layout, Condition where,
            ResultAssembler assembler) {
        super();
        this.meta = meta;
        this.groupingSpec = groupingSpec;
        this.layout = layout;
        this.where = where;
        this.assembler = assembler;
    }

    public FactTable.Meta getMeta() {
        return meta;
    }

    public GroupingSetSpec getGroupingSpec() {
        return groupingSpec;
    }

    public AccumulatorLayout getLayout() {
        return layout;
    }

    /**
     * @return pre-aggregation filter, <code>null</code> if none
     */
    public Condition getWhere() {
        return where;
    }

    public ResultAssembler getAssembler() {
        return assembler;
    }

    @Override
    public String toString() {
        return "CubeQuery [groupBy=" + groupingSpec + ", layout=" + layout + ", where=" + where + "]";
    }

    /**
     * Builder pattern class for {@link CubeQuery}, chain model begin with {@link #groupBy(GroupingSetSpec)} and end
     * with {@link #done()}. Measures default to every measure of the fact-table.
     *
     * @author mengran
     *
     */
    public static class CubeQueryBuilder {

        private final FactTable.Meta meta;

        private GroupingSetSpec groupingSpec;
        private List<String> measures;
        private List<String> distinctAttributes = new ArrayList<String>();
        private Condition where;
        private Condition having;
        private List<OrderKey> orderKeys = new ArrayList<OrderKey>();
        private RankingRequest ranking;
        private String totalMarker = DEFAULT_TOTAL_MARKER;

        public CubeQueryBuilder(FactTable.Meta meta) {
            super();
            Assert.notNull(meta, "Fact-table meta can not be null.");
            this.meta = meta;
        }

        public CubeQueryBuilder groupBy(GroupingSetSpec groupingSpec) {
            this.groupingSpec = groupingSpec;
            return this;
        }

        public CubeQueryBuilder measures(String... measures) {
            return measures(Arrays.asList(measures));
        }

        public CubeQueryBuilder measures(List<String> measures) {
            this.measures = new ArrayList<String>(measures);
            return this;
        }

        public CubeQueryBuilder countDistinct(String... attributes) {
            this.distinctAttributes.addAll(Arrays.asList(attributes));
            return this;
        }

        public CubeQueryBuilder where(Condition where) {
            this.where = where;
            return this;
        }

        public CubeQueryBuilder having(Condition having) {
            this.having = having;
            return this;
        }

        public CubeQueryBuilder orderBy(OrderKey... orderKeys) {
            this.orderKeys.addAll(Arrays.asList(orderKeys));
            return this;
        }

        /**
         * Assign <code>NTILE(buckets)</code> per grouping set, ordered by the aggregate descending.
         */
        public CubeQueryBuilder rank(AggregateFunction function, String argument, int buckets) {
            this.ranking = new RankingRequest(function, argument, buckets);
            return this;
        }

        public CubeQueryBuilder totalMarker(String totalMarker) {
            this.totalMarker = totalMarker;
            return this;
        }

        /**
         * @return validated query
         * @throws CubeConfigurationException if grouping, measures, ordering or ranking do not fit the fact-table
         * @throws PredicateTypeException if WHERE, HAVING or ranking compare incompatible domains
         */
        public CubeQuery done() throws CubeConfigurationException, PredicateTypeException {

            if (groupingSpec == null) {
                throw new CubeConfigurationException("Grouping is not specified, call #groupBy first.");
            }
            for (String dimension : groupingSpec.getDimensions()) {
                if (!meta.isDim(dimension)) {
                    throw new CubeConfigurationException("Unknown dimension " + dimension + " of " + meta.getName());
                }
            }
            Assert.hasText(totalMarker, "Total marker can not be empty.");

            AccumulatorLayout layout = new AccumulatorLayout(meta, measures == null ? meta.getIndNames() : measures,
                    distinctAttributes);
            if (where != null) {
                where.validate(new RowBinding(meta));
            }
            ResultAssembler assembler = new ResultAssembler(groupingSpec.getDimensions(), having, orderKeys, ranking,
                    totalMarker);
            assembler.validate(new GroupBinding(meta, groupingSpec.getDimensions(), layout));

            CubeQuery query = new CubeQuery(meta, groupingSpec, layout, where, assembler);
            LOGGER.debug("Query prepared {} having {} order by {} rank {}", query, having, orderKeys, ranking);
            return query;
        }
    }

}
