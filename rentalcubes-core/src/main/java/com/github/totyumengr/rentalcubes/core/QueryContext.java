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

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.util.Assert;

/**
 * Per-query execution context. Carries the cooperative cancellation flag which workers check between row batches.
 *
 * @author mengran
 *
 */
public class QueryContext {

    public static final int DEFAULT_BATCH_SIZE = 4096;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final int batchSize;

    public QueryContext() {
        this(DEFAULT_BATCH_SIZE);
    }

    /**
     * @param batchSize rows processed between two cancellation checks
     */
    public QueryContext(int batchSize) {
        super();
        Assert.isTrue(batchSize > 0, "Batch size must be positive.");
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Request cancellation, can be called from any thread.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param phase description of current phase for message
     * @throws QueryCancelledException if {@link #cancel()} has been called
     */
    public void checkCancelled(String phase) throws QueryCancelledException {

        if (cancelled.get()) {
            throw new QueryCancelledException("Query cancelled during " + phase + ".");
        }
    }

    @Override
    public String toString() {
        return "QueryContext [cancelled=" + cancelled + ", batchSize=" + batchSize + "]";
    }

}
