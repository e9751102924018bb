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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import com.github.totyumengr.rentalcubes.core.CubeQuery;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.FactTable.Meta;
import com.github.totyumengr.rentalcubes.core.QueryContext;
import com.github.totyumengr.rentalcubes.core.RentalCube;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.result.ResultRow;

/**
 * Single node implementation of {@link RentalCubeManager}. Queries running longer than
 * <code>rentalcubes.query.timeout-ms</code> are cancelled through their {@link QueryContext}.
 * @author mengran
 *
 */
@Service
public class RentalCubeManagerImpl implements RentalCubeManager {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(RentalCubeManagerImpl.class);
    
    @Autowired
    private RentalDataLoader loader;
    
    @Value("${rentalcubes.load-on-startup:true}")
    private boolean loadOnStartup;
    @Value("${rentalcubes.parallel:true}")
    private boolean parallel;
    @Value("${rentalcubes.parallelism:-1}")
    private int parallelism;
    @Value("${rentalcubes.query.timeout-ms:0}")
    private long timeoutMs;
    @Value("${rentalcubes.total-marker:" + CubeQuery.DEFAULT_TOTAL_MARKER + "}")
    private String totalMarker;
    
    /**
     * Manage target object.
     */
    private volatile RentalCube rentalCube;
    
    private ScheduledExecutorService watchdog;
    
    @PostConstruct
    public void init() {
        
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("rentalcubes-watchdog-");
        threadFactory.setDaemon(true);
        watchdog = Executors.newSingleThreadScheduledExecutor(threadFactory);
        
        if (loadOnStartup) {
            load();
        } else {
            LOGGER.info("Skip loading on startup, call load explicitly.");
        }
    }
    
    @PreDestroy
    public void destroy() {
        watchdog.shutdownNow();
    }
    
    @Override
    public synchronized int load() {
        
        FactTable factTable = loader.load();
        RentalCube cube = new RentalCube(factTable);
        cube.setParallelMode(parallel);
        // Not positive means cpu core count
        if (parallelism > 0) {
            cube.setParallelism(parallelism);
        }
        rentalCube = cube;
        LOGGER.info("Success to build cube {} with mode {} and parallelism {}", factTable.getMeta(), parallel,
                cube.getParallelism());
        return factTable.size();
    }
    
    @Override
    public boolean isLoaded() {
        return rentalCube != null;
    }
    
    @Override
    public RentalCube cube() throws IllegalStateException {
        
        RentalCube cube = rentalCube;
        if (cube == null) {
            throw new IllegalStateException("Rental cube is not loaded yet.");
        }
        return cube;
    }
    
    @Override
    public Meta meta() throws IllegalStateException {
        return cube().getFactTable().getMeta();
    }
    
    @Override
    public synchronized void setMode(boolean parallel) {
        
        this.parallel = parallel;
        if (rentalCube != null) {
            rentalCube.setParallelMode(parallel);
        }
    }
    
    @Override
    public String getTotalMarker() {
        return totalMarker;
    }
    
    @Override
    public List<ResultRow> query(CubeQuery query) {
        return query(query, new QueryContext());
    }
    
    @Override
    public List<ResultRow> query(CubeQuery query, QueryContext context) {
        
        RentalCube cube = cube();
        ScheduledFuture<?> timeout = null;
        if (timeoutMs > 0) {
            timeout = watchdog.schedule(new Runnable() {
                
                @Override
                public void run() {
                    LOGGER.warn("Cancel query {} after {}ms.", query, timeoutMs);
                    context.cancel();
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
        }
        try {
            return cube.query(query, context);
        } finally {
            if (timeout != null) {
                timeout.cancel(false);
            }
        }
    }
    
    @Override
    public BigDecimal sum(String indName) {
        return cube().sum(indName);
    }
    
    @Override
    public BigDecimal sum(String indName, Condition where) {
        return cube().sum(indName, where);
    }
    
    @Override
    public Map<Object, BigDecimal> sum(String indName, String groupByDimName, Condition where) {
        return cube().sum(indName, groupByDimName, where);
    }
    
}
