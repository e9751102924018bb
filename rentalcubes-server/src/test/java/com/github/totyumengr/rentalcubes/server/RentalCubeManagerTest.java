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

import java.math.BigDecimal;
import java.util.Map;

import org.junit.Assert;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.MethodSorters;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import com.github.totyumengr.rentalcubes.core.CubeQuery;
import com.github.totyumengr.rentalcubes.core.QueryCancelledException;
import com.github.totyumengr.rentalcubes.core.QueryContext;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;

/**
 * Lazy loading with LEFT JOIN semantics over rentals of unknown customers and movies.
 * @author mengran
 *
 */
@RunWith(SpringRunner.class)
@SpringBootTest(classes = Application.class, properties = {
        "rentalcubes.load-on-startup=false",
        "rentalcubes.join.left=true",
        "rentalcubes.data.renting=classpath:orphan/renting.tsv",
        "rentalcubes.parallelism=2"})
@AutoConfigureMockMvc
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class RentalCubeManagerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private RentalCubeManager manager;
    
    @Test
    public void test_0_1_NotLoaded() throws Exception {
        
        Assert.assertFalse(manager.isLoaded());
        MvcResult result = mockMvc.perform(MockMvcRequestBuilders.post("/query")
                .contentType(MediaType.APPLICATION_JSON).content("{\"groupBy\": {\"cube\": [\"country\"]}}"))
                .andReturn();
        Assert.assertEquals(503, result.getResponse().getStatus());
        Assert.assertTrue(result.getResponse().getContentAsString().contains("not loaded"));
    }
    
    @Test
    public void test_1_1_Load() throws Exception {
        
        MvcResult result = mockMvc.perform(MockMvcRequestBuilders.post("/load")).andReturn();
        Assert.assertEquals(200, result.getResponse().getStatus());
        Assert.assertEquals("{\"records\":3}", result.getResponse().getContentAsString());
        Assert.assertTrue(manager.isLoaded());
        Assert.assertEquals(2, manager.cube().getParallelism());
        Assert.assertEquals("TOTAL", manager.getTotalMarker());
    }
    
    @Test
    public void test_1_2_OrphansGroupAsNull() {
        
        Map<Object, BigDecimal> byCountry = manager.sum("price", "country", null);
        Assert.assertEquals(3, byCountry.size());
        Assert.assertEquals(0, BigDecimal.ZERO.compareTo(byCountry.get("Austria")));
        Assert.assertEquals(0, new BigDecimal("2.09").compareTo(byCountry.get("Belgium")));
        Assert.assertEquals(0, new BigDecimal("2.19").compareTo(byCountry.get(null)));
        Assert.assertEquals(0, new BigDecimal("4.28").compareTo(manager.sum("price")));
    }
    
    @Test
    public void test_2_1_Cancelled() {
        
        CubeQuery query = new CubeQuery.CubeQueryBuilder(manager.meta())
                .groupBy(GroupingSetSpec.cube("country", "genre")).done();
        QueryContext context = new QueryContext();
        context.cancel();
        try {
            manager.query(query, context);
            Assert.fail("Cancelled query must not return rows.");
        } catch (QueryCancelledException e) {
            Assert.assertTrue(context.isCancelled());
        }
        // 3 pairs, 3 countries with NULL, 3 genres with NULL and the grand total
        Assert.assertEquals(10, manager.query(query).size());
    }
    
}
