package com.opsassistant.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each {@link ToolKind} to its implementation.
 * <p>
 * Only kinds with a registered implementation are considered available to
 * the planner and the validator.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolKind, Tool> tools;

    public ToolRegistry(List<Tool> tools) {
        var map = new EnumMap<ToolKind, Tool>(ToolKind.class);
        for (Tool tool : tools) {
            Tool previous = map.put(tool.kind(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool registration for " + tool.kind().wireName()
                        + ": " + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
        }
        this.tools = Collections.unmodifiableMap(map);
        log.info("Registered tools: {}", this.tools.keySet());
    }

    public static ToolRegistry of(Tool... tools) {
        return new ToolRegistry(List.of(tools));
    }

    public Optional<Tool> find(ToolKind kind) {
        return Optional.ofNullable(tools.get(kind));
    }

    public Tool require(ToolKind kind) {
        Tool tool = tools.get(kind);
        if (tool == null) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                    "No tool registered for '" + kind.wireName() + "'");
        }
        return tool;
    }

    public boolean isRegistered(ToolKind kind) {
        return tools.containsKey(kind);
    }

    public Set<ToolKind> registeredKinds() {
        return tools.keySet();
    }
}
