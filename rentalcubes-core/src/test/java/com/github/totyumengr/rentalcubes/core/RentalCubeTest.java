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
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.totyumengr.rentalcubes.core.CubeQuery.CubeQueryBuilder;
import com.github.totyumengr.rentalcubes.core.FactTable.FactTableBuilder;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.ComparisonOperator;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.Operand;
import com.github.totyumengr.rentalcubes.core.result.OrderKey;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.Direction;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.NullOrdering;
import com.github.totyumengr.rentalcubes.core.result.ResultRow;

/**
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class RentalCubeTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(RentalCubeTest.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private static RentalCube rentalCube;

    @BeforeClass
    public static void prepare() throws Throwable {

        long startTime = System.currentTimeMillis();
        rentalCube = new RentalCube(RentalFixtures.rentals());
        rentalCube.setParallelism(4);
        LOGGER.info("prepare - end: {}, {}ms", System.currentTimeMillis(), System.currentTimeMillis() - startTime);
    }

    private static CubeQueryBuilder query() {
        return new CubeQueryBuilder(rentalCube.getFactTable().getMeta());
    }

    private static void log(List<ResultRow> rows) throws Throwable {

        List<Map<String, Object>> display = new ArrayList<Map<String, Object>>(rows.size());
        for (ResultRow row : rows) {
            display.add(row.toDisplayMap());
        }
        LOGGER.info("Result {}", MAPPER.writeValueAsString(display));
    }

    @Test
    public void test_0_1_Rollup_NullRatingExcluded() throws Throwable {

        FactTable table = new FactTableBuilder().build("example")
                .addDimColumn("customer", ValueType.NUMBER)
                .addIndColumn("price", ValueType.NUMBER, false)
                .addIndColumn("rating", ValueType.NUMBER, true)
                .addRecord(1, Arrays.asList(1), Arrays.asList(new BigDecimal("2.00"), 8))
                .addRecord(2, Arrays.asList(1), Arrays.asList(new BigDecimal("3.00"), null))
                .addRecord(3, Arrays.asList(2), Arrays.asList(new BigDecimal("1.00"), 5))
                .done();
        RentalCube cube = new RentalCube(table);
        List<ResultRow> rows = cube.query(new CubeQueryBuilder(table.getMeta())
                .groupBy(GroupingSetSpec.rollup("customer")).done());
        log(rows);

        Assert.assertEquals(3, rows.size());
        Assert.assertEquals(1, rows.get(0).getDisplayValue("customer"));
        Assert.assertEquals(2L, rows.get(0).getCount());
        Assert.assertEquals("5.00", rows.get(0).getSum("price").toString());
        Assert.assertEquals(0, new BigDecimal(8).compareTo(rows.get(0).getAvg("rating")));
        Assert.assertEquals(1L, rows.get(0).getCount("rating"));

        Assert.assertEquals(2, rows.get(1).getDisplayValue("customer"));
        Assert.assertEquals(1L, rows.get(1).getCount());
        Assert.assertEquals("1.00", rows.get(1).getSum("price").toString());
        Assert.assertEquals(0, new BigDecimal(5).compareTo(rows.get(1).getAvg("rating")));

        Assert.assertTrue(rows.get(2).isTotal("customer"));
        Assert.assertTrue(rows.get(2).isGrandTotal());
        Assert.assertEquals("TOTAL", rows.get(2).getDisplayValue("customer"));
        Assert.assertEquals(3L, rows.get(2).getCount());
        Assert.assertEquals("6.00", rows.get(2).getSum("price").toString());
        Assert.assertEquals(0, new BigDecimal("6.5").compareTo(rows.get(2).getAvg("rating")));
    }

    @Test
    public void test_0_2_AllRatingsNull_NoValue() throws Throwable {

        FactTable table = new FactTableBuilder().build("unrated")
                .addDimColumn("customer", ValueType.NUMBER)
                .addIndColumn("rating", ValueType.NUMBER, true)
                .addRecord(1, Arrays.asList(1), Arrays.asList((Object) null))
                .addRecord(2, Arrays.asList(1), Arrays.asList((Object) null))
                .done();
        List<ResultRow> rows = new RentalCube(table).query(new CubeQueryBuilder(table.getMeta())
                .groupBy(GroupingSetSpec.groupBy("customer")).done());

        Assert.assertEquals(1, rows.size());
        Assert.assertEquals(2L, rows.get(0).getCount());
        Assert.assertNull(rows.get(0).getAvg("rating"));
        Assert.assertNull(rows.get(0).getSum("rating"));
        Assert.assertNull(rows.get(0).getMin("rating"));
    }

    @Test
    public void test_1_1_Rollup_Country_NullAndTotalAreDistinct() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country")).done());
        log(rows);

        Assert.assertEquals(4, rows.size());
        Assert.assertEquals("Austria", rows.get(0).getDisplayValue("country"));
        Assert.assertEquals(29L, rows.get(0).getCount());
        Assert.assertEquals("62.91", rows.get(0).getSum("price").toString());
        Assert.assertEquals("5.70000000", rows.get(0).getAvg("rating").toString());

        Assert.assertEquals("Belgium", rows.get(1).getDisplayValue("country"));
        Assert.assertEquals(28L, rows.get(1).getCount());
        Assert.assertEquals("76.88", rows.get(1).getSum("price").toString());
        Assert.assertEquals("5.30769231", rows.get(1).getAvg("rating").toString());

        // Natural missing country is a group of its own, not the total
        Assert.assertTrue(rows.get(2).getSlot("country").isNull());
        Assert.assertNull(rows.get(2).getDisplayValue("country"));
        Assert.assertFalse(rows.get(2).isTotal("country"));
        Assert.assertEquals(3L, rows.get(2).getCount());

        Assert.assertEquals("TOTAL", rows.get(3).getDisplayValue("country"));
        Assert.assertEquals(60L, rows.get(3).getCount());
        Assert.assertEquals("149.78", rows.get(3).getSum("price").toString());
        Assert.assertEquals("5.45714286", rows.get(3).getAvg("rating").toString());
        Assert.assertEquals(1, rows.get(3).getGroupingId());
    }

    @Test
    public void test_1_2_Cube_CountryGenre() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.cube("country", "genre"))
                .where(Condition.isNotNull("country")).done());
        log(rows);

        // 2 countries x 3 genres + 2 country totals + 3 genre totals + grand total
        Assert.assertEquals(2 * 3 + 2 + 3 + 1, rows.size());
        Map<Integer, Integer> perGroupingId = new HashMap<Integer, Integer>();
        for (ResultRow row : rows) {
            perGroupingId.merge(row.getGroupingId(), 1, Integer::sum);
        }
        Assert.assertEquals(Integer.valueOf(6), perGroupingId.get(0));
        Assert.assertEquals(Integer.valueOf(2), perGroupingId.get(1));
        Assert.assertEquals(Integer.valueOf(3), perGroupingId.get(2));
        Assert.assertEquals(Integer.valueOf(1), perGroupingId.get(3));

        ResultRow grandTotal = rows.get(rows.size() - 1);
        Assert.assertTrue(grandTotal.isGrandTotal());
        Assert.assertEquals(57L, grandTotal.getCount());
        Assert.assertEquals("139.79", grandTotal.getSum("price").toString());

        for (ResultRow row : rows) {
            if (row.isTotal("country") && "Drama".equals(row.getDisplayValue("genre"))) {
                Assert.assertEquals(21L, row.getCount());
                Assert.assertEquals("52.40", row.getSum("price").toString());
                Assert.assertEquals("3.88888889", row.getAvg("rating").toString());
            }
            if ("Belgium".equals(row.getDisplayValue("country")) && "Drama".equals(row.getDisplayValue("genre"))) {
                Assert.assertEquals(11L, row.getCount());
                Assert.assertEquals("2.75000000", row.getAvg("rating").toString());
            }
        }
    }

    @Test
    public void test_1_3_GroupingSets_GrandTotalEqualsFilteredInput() throws Throwable {

        Condition where = Condition.dateRange("rentalDate", LocalDate.of(2019, 1, 1), LocalDate.of(2019, 2, 1));
        List<ResultRow> rows = rentalCube.query(query()
                .groupBy(GroupingSetSpec.groupingSets(Arrays.asList("gender", "genre"),
                        Arrays.asList(Arrays.asList("gender"), Arrays.asList("genre"), Arrays.<String> asList())))
                .where(where).done());
        log(rows);

        ResultRow grandTotal = rows.get(rows.size() - 1);
        Assert.assertTrue(grandTotal.isGrandTotal());
        Assert.assertEquals(39L, grandTotal.getCount());
        Assert.assertEquals(0, new BigDecimal("90.86").compareTo(rentalCube.sum("price", where)));
        Assert.assertEquals("90.86", grandTotal.getSum("price").toString());
        Assert.assertEquals(2 + 3 + 1, rows.size());
    }

    @Test
    public void test_1_4_DerivedDimensions() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.groupBy("dayType", "priceTier"))
                .where(Condition.or(Condition.eq("dayType", "Weekend"), Condition.eq("priceTier", "Budget (<$1.00)")))
                .done());
        log(rows);

        long weekend = 0;
        long budget = 0;
        for (ResultRow row : rows) {
            if ("Weekend".equals(row.getDisplayValue("dayType"))) {
                weekend += row.getCount();
            }
            if ("Budget (<$1.00)".equals(row.getDisplayValue("priceTier"))) {
                budget += row.getCount();
            }
        }
        Assert.assertEquals(13L, weekend);
        Assert.assertEquals(10L, budget);

        Map<Object, BigDecimal> byTier = rentalCube.sum("price", "priceTier", null);
        Assert.assertEquals("5.00000000", byTier.get("Budget (<$1.00)").toString());
        Assert.assertEquals("51.50000000", byTier.get("Luxury ($4.00+)").toString());
        Assert.assertEquals(5, byTier.size());
    }

    @Test
    public void test_1_5_EmptyInput_GrandTotalKept() throws Throwable {

        Condition nobody = Condition.eq("customerId", 99);
        for (GroupingSetSpec spec : Arrays.asList(GroupingSetSpec.rollup("country", "genre"),
                GroupingSetSpec.cube("country", "genre"))) {
            List<ResultRow> rows = rentalCube.query(query().groupBy(spec).where(nobody).done());
            log(rows);

            Assert.assertEquals(1, rows.size());
            ResultRow total = rows.get(0);
            Assert.assertTrue(total.isGrandTotal());
            Assert.assertEquals(0L, total.getCount());
            Assert.assertEquals(0L, total.getCount("rating"));
            Assert.assertNull(total.getSum("price"));
            Assert.assertNull(total.getAvg("rating"));
            Assert.assertNull(total.getMax("rentalDate"));
        }

        // No grand total set, no row
        Assert.assertTrue(rentalCube.query(query().groupBy(GroupingSetSpec.groupBy("country")).where(nobody).done())
                .isEmpty());
    }

    @Test
    public void test_2_1_Having_DropsSubtotalsKeepsValues() throws Throwable {

        Condition having = Condition.compare(Operand.countAll(), ComparisonOperator.GT, 10);
        List<ResultRow> all = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country", "genre")).done());
        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country", "genre"))
                .having(having).done());
        log(rows);

        Assert.assertEquals(5, rows.size());
        Assert.assertEquals(Arrays.asList("Austria", "Comedy"), Arrays.asList(rows.get(0).getDisplayValue("country"),
                rows.get(0).getDisplayValue("genre")));
        Assert.assertEquals(Arrays.asList("Austria", "TOTAL"), Arrays.asList(rows.get(1).getDisplayValue("country"),
                rows.get(1).getDisplayValue("genre")));
        Assert.assertEquals(Arrays.asList("Belgium", "Drama"), Arrays.asList(rows.get(2).getDisplayValue("country"),
                rows.get(2).getDisplayValue("genre")));
        Assert.assertEquals(Arrays.asList("Belgium", "TOTAL"), Arrays.asList(rows.get(3).getDisplayValue("country"),
                rows.get(3).getDisplayValue("genre")));
        Assert.assertTrue(rows.get(4).isGrandTotal());

        for (ResultRow row : rows) {
            Assert.assertTrue(row.getCount() > 10);
            for (ResultRow before : all) {
                if (before.getKey().equals(row.getKey())) {
                    Assert.assertEquals(before.toDisplayMap(), row.toDisplayMap());
                }
            }
        }
    }

    @Test
    public void test_2_2_Having_IsTotalAndAverage() throws Throwable {

        Condition having = Condition.and(Condition.isTotal("genre"),
                Condition.compare(Operand.avg("rating"), ComparisonOperator.GE, new BigDecimal("5.5")));
        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country", "genre"))
                .having(having).done());
        log(rows);

        // Austria 5.70, Belgium 5.31, missing country 4.00, grand total 5.46
        Assert.assertEquals(1, rows.size());
        Assert.assertEquals("Austria", rows.get(0).getDisplayValue("country"));
    }

    @Test
    public void test_2_3_OrderBy_NullOrdering() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country"))
                .orderBy(OrderKey.dimension("country", Direction.DESC, NullOrdering.NULLS_FIRST)).done());

        Assert.assertTrue(rows.get(0).isTotal("country"));
        Assert.assertTrue(rows.get(1).getSlot("country").isNull());
        Assert.assertEquals("Belgium", rows.get(2).getDisplayValue("country"));
        Assert.assertEquals("Austria", rows.get(3).getDisplayValue("country"));

        rows = rentalCube.query(query().groupBy(GroupingSetSpec.groupBy("genre"))
                .orderBy(OrderKey.aggregate(AggregateFunction.SUM, "price", Direction.DESC)).done());
        Assert.assertEquals(Arrays.asList("Drama", "Action", "Comedy"), Arrays.asList(
                rows.get(0).getDisplayValue("genre"), rows.get(1).getDisplayValue("genre"),
                rows.get(2).getDisplayValue("genre")));
    }

    @Test
    public void test_3_1_Parallel_EqualsSequential() throws Throwable {

        CubeQuery cubeQuery = query().groupBy(GroupingSetSpec.cube("country", "gender", "genre"))
                .countDistinct("customerId").done();
        rentalCube.setParallelMode(false);
        List<ResultRow> sequential = rentalCube.query(cubeQuery);
        rentalCube.setParallelMode(true);
        List<ResultRow> parallel = rentalCube.query(cubeQuery);

        Assert.assertEquals(sequential.size(), parallel.size());
        for (int i = 0; i < sequential.size(); i++) {
            Assert.assertEquals(sequential.get(i).toDisplayMap(), parallel.get(i).toDisplayMap());
        }
    }

    @Test(expected = QueryCancelledException.class)
    public void test_3_2_Cancelled() throws Throwable {

        QueryContext context = new QueryContext(8);
        context.cancel();
        rentalCube.query(query().groupBy(GroupingSetSpec.rollup("country")).done(), context);
    }

    @Test
    public void test_4_1_Rank_CustomersBySpend() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("customerId"))
                .rank(AggregateFunction.SUM, "price", 3)
                .orderBy(OrderKey.bucket(Direction.ASC), OrderKey.aggregate(AggregateFunction.SUM, "price",
                        Direction.DESC)).done());
        log(rows);

        // Customer totals: 1 29.46, 3 27.45, 4 24.97, 6 24.46, 2 22.46, 5 10.99, 7 9.99
        Map<Object, Integer> buckets = new HashMap<Object, Integer>();
        for (ResultRow row : rows) {
            if (!row.isGrandTotal()) {
                buckets.put(row.getDisplayValue("customerId"), row.getBucket());
            } else {
                // Grand total is ranked in its own partition
                Assert.assertEquals(Integer.valueOf(1), row.getBucket());
            }
        }
        Assert.assertEquals(Integer.valueOf(1), buckets.get(1));
        Assert.assertEquals(Integer.valueOf(1), buckets.get(3));
        Assert.assertEquals(Integer.valueOf(1), buckets.get(4));
        Assert.assertEquals(Integer.valueOf(2), buckets.get(6));
        Assert.assertEquals(Integer.valueOf(2), buckets.get(2));
        Assert.assertEquals(Integer.valueOf(3), buckets.get(5));
        Assert.assertEquals(Integer.valueOf(3), buckets.get(7));
        // Grand total spend leads bucket 1, then the top customer
        Assert.assertTrue(rows.get(0).isGrandTotal());
        Assert.assertEquals(1, rows.get(1).getDisplayValue("customerId"));
    }

    @Test
    public void test_4_2_CountDistinct_MinMaxDates() throws Throwable {

        List<ResultRow> rows = rentalCube.query(query().groupBy(GroupingSetSpec.rollup("genre"))
                .measures("price", "rentalDate").countDistinct("customerId")
                .having(Condition.compare(Operand.countDistinct("customerId"), ComparisonOperator.GE, 7)).done());
        log(rows);

        // Action 7, Drama 7, grand total 7, Comedy 6 dropped
        Assert.assertEquals(3, rows.size());
        Assert.assertEquals("Action", rows.get(0).getDisplayValue("genre"));
        Assert.assertEquals(7L, rows.get(0).getDistinctCount("customerId"));
        Assert.assertEquals("Drama", rows.get(1).getDisplayValue("genre"));
        Assert.assertTrue(rows.get(2).isGrandTotal());
        Assert.assertEquals(LocalDate.of(2018, 12, 20), rows.get(2).getMin("rentalDate"));
        Assert.assertEquals(LocalDate.of(2019, 1, 29), rows.get(2).getMax("rentalDate"));
    }

    @Test
    public void test_5_1_Sum() throws Throwable {

        Assert.assertEquals("149.78000000", rentalCube.sum("price").toString());
        Assert.assertEquals("62.91000000", rentalCube.sum("price", Condition.eq("country", "Austria")).toString());

        Map<Object, BigDecimal> byCountry = rentalCube.sum("price", "country", null);
        Assert.assertEquals(3, byCountry.size());
        Assert.assertEquals("76.88000000", byCountry.get("Belgium").toString());
        Assert.assertEquals("9.99000000", byCountry.get(null).toString());
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_6_1_UnknownDimension() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country", "studio")).done();
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_6_2_HavingOnUngroupedColumn() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country")).having(Condition.eq("genre", "Drama")).done();
    }

    @Test(expected = PredicateTypeException.class)
    public void test_6_3_WhereTypeMismatch() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country")).where(Condition.gt("country", 5)).done();
    }

    @Test(expected = PredicateTypeException.class)
    public void test_6_4_AverageOfDate() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country"))
                .having(Condition.compare(Operand.avg("rentalDate"), ComparisonOperator.GT, 1)).done();
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_6_5_BucketOrderWithoutRanking() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country")).orderBy(OrderKey.bucket(Direction.ASC)).done();
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_6_6_TotalCheckInWhere() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country")).where(Condition.isTotal("country")).done();
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_6_7_CountDistinctOfDecimal() throws Throwable {
        query().groupBy(GroupingSetSpec.rollup("country")).countDistinct("price").done();
    }

}
