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
package com.github.totyumengr.rentalcubes.core.predicate;

/**
 * Binary comparison operators.
 * 
 * @author mengran
 *
 */
public enum ComparisonOperator {
    
    EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">=");
    
    private final String symbol;
    
    private ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }
    
    public String getSymbol() {
        return symbol;
    }
    
    /**
     * @param compared result of comparing left with right
     * @return whether the comparison holds
     */
    public boolean test(int compared) {
        
        switch (this) {
        case EQ:
            return compared == 0;
        case NE:
            return compared != 0;
        case LT:
            return compared < 0;
        case LE:
            return compared <= 0;
        case GT:
            return compared > 0;
        default:
            return compared >= 0;
        }
    }
    
    /**
     * @param symbol one of <code>= &lt;&gt; != &lt; &lt;= &gt; &gt;=</code>
     * @return operator
     * @throws IllegalArgumentException for unknown symbols
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        
        if ("!=".equals(symbol)) {
            return NE;
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol) || op.name().equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator " + symbol);
    }
}
