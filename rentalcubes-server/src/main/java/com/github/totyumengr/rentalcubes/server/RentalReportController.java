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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.CubeException;
import com.github.totyumengr.rentalcubes.core.CubeQuery;
import com.github.totyumengr.rentalcubes.core.FactTable.Meta;
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.QueryCancelledException;
import com.github.totyumengr.rentalcubes.core.ReferentialIntegrityException;
import com.github.totyumengr.rentalcubes.core.rank.BucketSummary;
import com.github.totyumengr.rentalcubes.core.result.ResultRow;

/**
 * HTTP surface of rental reports. Result rows are rendered by {@link ResultRow#toDisplayMap()}.
 * @author mengran
 *
 */
@Controller
public class RentalReportController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RentalReportController.class);
    
    @Autowired
    private RentalCubeManager manager;
    
    @Autowired
    private CubeRequestParser parser;
    
    @Autowired
    private RentalReports reports;
    
    @RequestMapping(value="/status", method=RequestMethod.GET)
    public @ResponseBody Map<String, Object> status() {
        
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("loaded", manager.isLoaded());
        if (manager.isLoaded()) {
            Meta meta = manager.meta();
            status.put("records", manager.cube().getFactTable().size());
            status.put("dimensions", meta.getDimNames());
            status.put("measures", meta.getIndNames());
            status.put("parallel", manager.cube().isParallelMode());
        }
        
        LOGGER.info("Rental cube status {}", status);
        
        return status;
    }
    
    @RequestMapping(value="/load", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> load() {
        
        LOGGER.info("Try to load rental cube.");
        long timing = System.currentTimeMillis();
        int records = manager.load();
        LOGGER.info("Sucess to load rental cube with {} records using {}ms.", records, 
                System.currentTimeMillis() - timing);
        
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("records", records);
        return result;
    }
    
    @RequestMapping(value="/mode", method={RequestMethod.POST, RequestMethod.GET})
    public @ResponseBody String mode(@RequestParam boolean parallel) {
        
        manager.setMode(parallel);
        
        LOGGER.info("Success to set parallel mode {}", parallel);
        
        return Boolean.toString(parallel);
    }
    
    @RequestMapping(value="/query", method=RequestMethod.POST)
    public @ResponseBody List<Map<String, Object>> query(@RequestBody String request) {
        
        LOGGER.info("Try to query {}", request);
        long timing = System.currentTimeMillis();
        CubeQuery query = parser.parse(request, manager.meta(), manager.getTotalMarker());
        List<Map<String, Object>> rows = render(manager.query(query));
        LOGGER.info("Sucess to query {} result size is {} using {}ms.", query, rows.size(), 
                System.currentTimeMillis() - timing);
        
        return rows;
    }
    
    @RequestMapping(value="/reports", method=RequestMethod.GET)
    public @ResponseBody Set<String> reports() {
        return reports.names();
    }
    
    @RequestMapping(value="/reports/{name}", method=RequestMethod.GET)
    public ResponseEntity<List<Map<String, Object>>> report(@PathVariable String name) {
        
        if (!reports.contains(name)) {
            LOGGER.info("Report {} not found in {}", name, reports.names());
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }
        LOGGER.info("Try to run report {}", name);
        long timing = System.currentTimeMillis();
        List<Map<String, Object>> rows = render(manager.query(reports.report(name, manager.meta(), 
                manager.getTotalMarker())));
        LOGGER.info("Sucess to run report {} result size is {} using {}ms.", name, rows.size(), 
                System.currentTimeMillis() - timing);
        
        return new ResponseEntity<>(rows, HttpStatus.OK);
    }
    
    @RequestMapping(value="/segments", method=RequestMethod.GET)
    public @ResponseBody Map<String, BucketSummary> segments() {
        return reports.spendSegments(manager);
    }
    
    @RequestMapping(value="/sum", method={RequestMethod.POST, RequestMethod.GET})
    public @ResponseBody BigDecimal sum(@RequestParam String indName, 
            @RequestParam(required=false) String where) {
        
        LOGGER.info("Try to sum {} with filter {}.", indName, where);
        long timing = System.currentTimeMillis();
        BigDecimal sum = manager.sum(indName, parser.parseCondition(where));
        LOGGER.info("Sucess to sum {} result is {} using {}ms.", indName, sum, System.currentTimeMillis() - timing);
        
        return sum;
    }
    
    @RequestMapping(value="/groupsum", method={RequestMethod.POST, RequestMethod.GET})
    public @ResponseBody List<Map<String, Object>> groupsum(@RequestParam String indName, 
            @RequestParam(required=false) String where,
            @RequestParam String groupbyDim) {
        
        LOGGER.info("Try to sum {} group by {} with filter {}.", indName, groupbyDim, where);
        long timing = System.currentTimeMillis();
        Map<Object, BigDecimal> sum = manager.sum(indName, groupbyDim, parser.parseCondition(where));
        // Null is a legal group, so render pairs instead of a JSON object
        List<Map<String, Object>> rows = new ArrayList<>(sum.size());
        for (Entry<Object, BigDecimal> e : sum.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>(2);
            row.put(groupbyDim, e.getKey());
            row.put("SUM(" + indName + ")", e.getValue());
            rows.add(row);
        }
        LOGGER.info("Sucess to sum {} group by {} result size is {} using {}ms.", indName, groupbyDim, rows.size(), 
                System.currentTimeMillis() - timing);
        LOGGER.debug("Sucess to sum {} group by {} result is {}.", indName, groupbyDim, sum);
        
        return rows;
    }
    
    private static List<Map<String, Object>> render(List<ResultRow> rows) {
        
        List<Map<String, Object>> rendered = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            rendered.add(row.toDisplayMap());
        }
        return rendered;
    }
    
    @ExceptionHandler({CubeConfigurationException.class, PredicateTypeException.class, 
        IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }
    
    @ExceptionHandler(QueryCancelledException.class)
    public ResponseEntity<Map<String, String>> cancelled(QueryCancelledException e) {
        return error(HttpStatus.CONFLICT, e);
    }
    
    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<Map<String, String>> unprocessable(ReferentialIntegrityException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }
    
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> unavailable(IllegalStateException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }
    
    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        
        if (e instanceof CubeException) {
            LOGGER.warn("Request failed with {}: {}", status, e.getMessage());
        } else {
            LOGGER.warn("Request failed with " + status, e);
        }
        Map<String, String> body = new LinkedHashMap<>(2);
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, status);
    }
    
}
