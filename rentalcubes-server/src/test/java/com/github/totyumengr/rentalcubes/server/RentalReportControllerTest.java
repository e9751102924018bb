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
import java.util.List;
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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs reports over the bundled sample: 10 customers in Austria, Belgium and Spain renting 8 movies 120 times.
 * @author mengran
 *
 */
@RunWith(SpringRunner.class)
@SpringBootTest(classes = Application.class)
@AutoConfigureMockMvc
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class RentalReportControllerTest {
    
    private ObjectMapper objectMapper = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    
    @Autowired
    private MockMvc mockMvc;
    
    private MvcResult get(String uri) throws Exception {
        return mockMvc.perform(MockMvcRequestBuilders.get(uri)).andReturn();
    }
    
    private MvcResult post(String uri, String body) throws Exception {
        return mockMvc.perform(MockMvcRequestBuilders.post(uri).contentType(MediaType.APPLICATION_JSON)
                .content(body)).andReturn();
    }
    
    private List<Map<String, Object>> rows(MvcResult result) throws Exception {
        
        Assert.assertEquals(result.getResponse().getContentAsString(), 200, result.getResponse().getStatus());
        return objectMapper.readValue(result.getResponse().getContentAsString(), 
                new TypeReference<List<Map<String, Object>>>() {});
    }
    
    private Map<String, Object> object(MvcResult result) throws Exception {
        return objectMapper.readValue(result.getResponse().getContentAsString(), 
                new TypeReference<Map<String, Object>>() {});
    }
    
    private static void assertDecimal(String expected, Object actual) {
        Assert.assertEquals(expected + " vs " + actual, 0, new BigDecimal(expected).compareTo((BigDecimal) actual));
    }
    
    private static long count(Map<String, Object> row, String label) {
        return ((Number) row.get(label)).longValue();
    }
    
    @Test
    public void test_0_1_Status() throws Exception {
        
        MvcResult result = get("/status");
        Assert.assertEquals(200, result.getResponse().getStatus());
        Map<String, Object> status = object(result);
        Assert.assertEquals(Boolean.TRUE, status.get("loaded"));
        Assert.assertEquals(120, status.get("records"));
        @SuppressWarnings("unchecked")
        List<String> dimensions = (List<String>) status.get("dimensions");
        Assert.assertTrue(dimensions.contains("country"));
        Assert.assertTrue(dimensions.contains("rentalYear"));
        Assert.assertTrue(dimensions.contains("priceTier"));
    }
    
    @Test
    public void test_1_1_QueryRollup() throws Exception {
        
        List<Map<String, Object>> rows = rows(post("/query", 
                "{\"groupBy\": {\"rollup\": [\"country\"]}, \"measures\": [\"price\", \"rating\"]}"));
        Assert.assertEquals(4, rows.size());
        
        Assert.assertEquals("Austria", rows.get(0).get("country"));
        Assert.assertEquals(35, count(rows.get(0), "COUNT(*)"));
        assertDecimal("73.75", rows.get(0).get("SUM(price)"));
        assertDecimal("5.53333333", rows.get(0).get("AVG(rating)"));
        Assert.assertEquals("Belgium", rows.get(1).get("country"));
        Assert.assertEquals("Spain", rows.get(2).get("country"));
        assertDecimal("105.56", rows.get(2).get("SUM(price)"));
        
        Map<String, Object> total = rows.get(3);
        Assert.assertEquals("TOTAL", total.get("country"));
        Assert.assertEquals(1, total.get("GROUPING_ID"));
        Assert.assertEquals(120, count(total, "COUNT(*)"));
        Assert.assertEquals(98, count(total, "COUNT(rating)"));
        assertDecimal("243.60", total.get("SUM(price)"));
        assertDecimal("5.34693878", total.get("AVG(rating)"));
    }
    
    @Test
    public void test_1_2_QueryHavingOrder() throws Exception {
        
        List<Map<String, Object>> rows = rows(post("/query", "{"
                + "\"groupBy\": {\"dimensions\": [\"genre\"]},"
                + "\"measures\": [\"price\"],"
                + "\"countDistinct\": [\"customerId\"],"
                + "\"having\": {\"compare\": {\"aggregate\": \"COUNT_DISTINCT\", \"argument\": \"customerId\"},"
                + "              \"op\": \">=\", \"to\": 9},"
                + "\"orderBy\": [{\"aggregate\": \"SUM\", \"argument\": \"price\", \"direction\": \"DESC\"}]}"));
        Assert.assertEquals(3, rows.size());
        Assert.assertEquals("Comedy", rows.get(0).get("genre"));
        Assert.assertEquals("Drama", rows.get(1).get("genre"));
        Assert.assertEquals("Action", rows.get(2).get("genre"));
        Assert.assertEquals(9, count(rows.get(1), "COUNT_DISTINCT(customerId)"));
    }
    
    @Test
    public void test_1_3_QueryWhereDates() throws Exception {
        
        List<Map<String, Object>> rows = rows(post("/query", "{"
                + "\"groupBy\": {\"cube\": [\"rentalYear\"]},"
                + "\"measures\": [\"rentalDate\"],"
                + "\"where\": {\"dateRange\": \"rentalDate\", \"from\": \"2018-01-01\", \"to\": \"2019-01-01\"},"
                + "\"totalMarker\": \"ALL\"}"));
        Assert.assertEquals(2, rows.size());
        Assert.assertEquals(2018, rows.get(0).get("rentalYear"));
        Assert.assertEquals(92, count(rows.get(0), "COUNT(*)"));
        Assert.assertEquals("ALL", rows.get(1).get("rentalYear"));
        Assert.assertEquals(92, count(rows.get(1), "COUNT(rentalDate)"));
    }
    
    @Test
    public void test_2_1_Reports() throws Exception {
        
        MvcResult result = get("/reports");
        Assert.assertEquals(200, result.getResponse().getStatus());
        List<String> names = objectMapper.readValue(result.getResponse().getContentAsString(), 
                new TypeReference<List<String>>() {});
        Assert.assertTrue(names.contains("demographics"));
        Assert.assertTrue(names.contains("customer-deciles"));
        
        for (String name : names) {
            Assert.assertFalse(name, rows(get("/reports/" + name)).isEmpty());
        }
        Assert.assertEquals(404, get("/reports/unknown").getResponse().getStatus());
    }
    
    @Test
    public void test_2_2_Demographics() throws Exception {
        
        List<Map<String, Object>> rows = rows(get("/reports/demographics"));
        // 3 x 2 pairs, 3 countries, 2 genders and the grand total
        Assert.assertEquals(12, rows.size());
        Map<String, Object> first = rows.get(0);
        Assert.assertEquals("Austria", first.get("country"));
        Assert.assertEquals("female", first.get("gender"));
        Assert.assertEquals(29, count(first, "COUNT(*)"));
        assertDecimal("5.79166667", first.get("AVG(rating)"));
        
        Map<String, Object> grandTotal = rows.get(11);
        Assert.assertEquals("TOTAL", grandTotal.get("country"));
        Assert.assertEquals("TOTAL", grandTotal.get("gender"));
        Assert.assertEquals(3, grandTotal.get("GROUPING_ID"));
        Assert.assertEquals(10, count(grandTotal, "COUNT_DISTINCT(customerId)"));
    }
    
    @Test
    public void test_2_3_CustomerRankings() throws Exception {
        
        List<Map<String, Object>> deciles = rows(get("/reports/customer-deciles"));
        Assert.assertEquals(10, deciles.size());
        Assert.assertEquals(2, deciles.get(0).get("customerId"));
        Assert.assertEquals(1, deciles.get(0).get("NTILE"));
        Assert.assertEquals(7, deciles.get(9).get("customerId"));
        Assert.assertEquals(10, deciles.get(9).get("NTILE"));
        
        List<Map<String, Object>> vips = rows(get("/reports/vip-customers"));
        Assert.assertEquals(6, vips.size());
        Assert.assertEquals(2, vips.get(0).get("customerId"));
        Assert.assertEquals(9, vips.get(1).get("customerId"));
        
        List<Map<String, Object>> value = rows(get("/reports/customer-value"));
        Assert.assertEquals(10, value.size());
        Assert.assertEquals(2, value.get(0).get("customerId"));
        Assert.assertEquals("Austria", value.get(0).get("country"));
        assertDecimal("43.49", value.get(0).get("SUM(price)"));
    }
    
    @Test
    public void test_2_4_Segments() throws Exception {
        
        MvcResult result = get("/segments");
        Assert.assertEquals(200, result.getResponse().getStatus());
        Map<String, Object> segments = object(result);
        @SuppressWarnings("unchecked")
        Map<String, Object> top = (Map<String, Object>) segments.get("Top 10%");
        Assert.assertEquals(1, top.get("members"));
        assertDecimal("43.49", top.get("total"));
        @SuppressWarnings("unchecked")
        Map<String, Object> bottom = (Map<String, Object>) segments.get("Bottom 50%");
        Assert.assertEquals(5, bottom.get("members"));
        assertDecimal("88.87", bottom.get("total"));
        assertDecimal("17.774", bottom.get("average"));
    }
    
    @Test
    public void test_3_1_Sum() throws Exception {
        
        MvcResult result = get("/sum?indName=price");
        Assert.assertEquals(200, result.getResponse().getStatus());
        assertDecimal("243.60", objectMapper.readValue(result.getResponse().getContentAsString(), BigDecimal.class));
        
        result = mockMvc.perform(MockMvcRequestBuilders.get("/sum").param("indName", "price")
                .param("where", "{\"compare\": {\"column\": \"country\"}, \"op\": \"=\", \"to\": \"Belgium\"}"))
                .andReturn();
        assertDecimal("64.29", objectMapper.readValue(result.getResponse().getContentAsString(), BigDecimal.class));
        
        List<Map<String, Object>> rows = rows(mockMvc.perform(MockMvcRequestBuilders.get("/groupsum")
                .param("indName", "price").param("groupbyDim", "rentalYear")).andReturn());
        Assert.assertEquals(3, rows.size());
        Assert.assertEquals(2017, rows.get(0).get("rentalYear"));
        assertDecimal("26.27", rows.get(0).get("SUM(price)"));
        assertDecimal("28.75", rows.get(2).get("SUM(price)"));
    }
    
    @Test
    public void test_4_1_BadRequests() throws Exception {
        
        MvcResult result = post("/query", "{\"groupBy\": {\"cube\": [\"country\"]},"
                + "\"where\": {\"compare\": {\"column\": \"country\"}, \"op\": \">\", \"to\": 5}}");
        Assert.assertEquals(400, result.getResponse().getStatus());
        Assert.assertEquals("PredicateTypeException", object(result).get("error"));
        
        result = post("/query", "{\"groupBy\": {\"cube\": [\"planet\"]}}");
        Assert.assertEquals(400, result.getResponse().getStatus());
        Assert.assertEquals("CubeConfigurationException", object(result).get("error"));
        
        result = post("/query", "{\"groupBy\": ");
        Assert.assertEquals(400, result.getResponse().getStatus());
        
        result = post("/query", "{\"groupBy\": {\"rollup\": [\"genre\"]}, \"orderBy\": [{\"bucket\": true}]}");
        Assert.assertEquals(400, result.getResponse().getStatus());
        
        result = mockMvc.perform(MockMvcRequestBuilders.get("/sum").param("indName", "rentalDate")).andReturn();
        Assert.assertEquals(400, result.getResponse().getStatus());
    }
    
    @Test
    public void test_4_2_DistinctCountOfPrice() throws Exception {
        
        MvcResult result = post("/query", "{\"groupBy\": {\"rollup\": [\"genre\"]}, \"countDistinct\": [\"price\"]}");
        Assert.assertEquals(400, result.getResponse().getStatus());
        Assert.assertEquals("CubeConfigurationException", object(result).get("error"));
    }
    
    @Test
    public void test_4_3_NoMatchingRental() throws Exception {
        
        List<Map<String, Object>> rows = rows(post("/query", "{\"groupBy\": {\"rollup\": [\"country\", \"genre\"]},"
                + "\"where\": {\"compare\": {\"column\": \"customerId\"}, \"op\": \"=\", \"to\": 999}}"));
        Assert.assertEquals(1, rows.size());
        Assert.assertEquals(3, rows.get(0).get("GROUPING_ID"));
        Assert.assertEquals(0, rows.get(0).get("COUNT(*)"));
        Assert.assertNull(rows.get(0).get("SUM(price)"));
        Assert.assertNull(rows.get(0).get("AVG(rating)"));
    }
    
    @Test
    public void test_5_1_Mode() throws Exception {
        
        List<Map<String, Object>> parallel = rows(get("/reports/revenue"));
        
        MvcResult result = mockMvc.perform(MockMvcRequestBuilders.post("/mode").param("parallel", "false"))
                .andReturn();
        Assert.assertEquals("false", result.getResponse().getContentAsString());
        Assert.assertEquals(Boolean.FALSE, object(get("/status")).get("parallel"));
        Assert.assertEquals(parallel, rows(get("/reports/revenue")));
        
        mockMvc.perform(MockMvcRequestBuilders.post("/mode").param("parallel", "true")).andReturn();
        Assert.assertEquals(Boolean.TRUE, object(get("/status")).get("parallel"));
    }
    
}
