package com.purchasingpower.hybridquery.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExecutorProperties {

    /**
     * Evaluate the children of a logical group concurrently.
     */
    private boolean parallelSiblings = false;

    /**
     * Upper bound for one query execution in milliseconds. 0 disables the timeout.
     */
    @Min(0)
    private long timeoutMs = 0;

    @Min(1)
    private int clausePoolSize = 8;

    @Min(1)
    private int queryPoolSize = 4;

    @Min(0)
    private int queryQueueCapacity = 100;
}
