package com.opsassistant.tools;

import java.util.Map;

/**
 * A data-fetching capability that plan steps invoke by {@link ToolKind}.
 * <p>
 * Implementations must be safe for concurrent use: the plan executor calls
 * the same instance from several worker threads.
 */
public interface Tool {

    ToolKind kind();

    /**
     * Invokes the tool.
     *
     * @param parameters step parameters, already resolved against earlier step outputs
     * @return tool output (maps, lists and scalars only)
     * @throws ToolFaultException when the call fails
     */
    Object invoke(Map<String, Object> parameters);
}
