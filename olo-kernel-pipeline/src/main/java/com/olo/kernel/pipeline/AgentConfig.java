package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One stage of a pipeline: the agent that runs it, its position, its dependencies (DAG mode) and where to go
 * next. The kernel never runs the agent; it only hands the name and this config to a worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentConfig {

    private final String name;
    private final int stageOrder;
    private final List<String> requires;
    private final List<String> after;
    private final JoinStrategy joinStrategy;
    private final String outputKey;
    private final List<RoutingRule> routingRules;
    private final String defaultNext;
    private final String errorNext;
    private final Integer timeoutSeconds;
    private final int maxRetries;
    private final boolean hasLlm;
    private final boolean hasTools;

    @JsonCreator
    public AgentConfig(
            @JsonProperty("name") String name,
            @JsonProperty("stage_order") Integer stageOrder,
            @JsonProperty("requires") List<String> requires,
            @JsonProperty("after") List<String> after,
            @JsonProperty("join_strategy") JoinStrategy joinStrategy,
            @JsonProperty("output_key") String outputKey,
            @JsonProperty("routing_rules") List<RoutingRule> routingRules,
            @JsonProperty("default_next") String defaultNext,
            @JsonProperty("error_next") String errorNext,
            @JsonProperty("timeout_seconds") Integer timeoutSeconds,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("has_llm") Boolean hasLlm,
            @JsonProperty("has_tools") Boolean hasTools) {
        this.name = name;
        this.stageOrder = stageOrder != null ? stageOrder : 0;
        this.requires = requires != null ? List.copyOf(requires) : List.of();
        this.after = after != null ? List.copyOf(after) : List.of();
        this.joinStrategy = joinStrategy != null ? joinStrategy : JoinStrategy.ALL;
        this.outputKey = outputKey != null && !outputKey.isBlank() ? outputKey : name;
        this.routingRules = routingRules != null ? List.copyOf(routingRules) : List.of();
        this.defaultNext = defaultNext;
        this.errorNext = errorNext;
        this.timeoutSeconds = timeoutSeconds;
        this.maxRetries = maxRetries != null ? maxRetries : 0;
        this.hasLlm = hasLlm != null && hasLlm;
        this.hasTools = hasTools != null && hasTools;
    }

    /** Minimal stage: name and order, linear routing. */
    public static AgentConfig of(String name, int stageOrder) {
        return new AgentConfig(name, stageOrder, null, null, null, null, null, null, null, null, null, null, null);
    }

    public AgentConfig withRouting(List<RoutingRule> rules, String defaultNext, String errorNext) {
        return new AgentConfig(name, stageOrder, requires, after, joinStrategy, outputKey, rules, defaultNext,
                errorNext, timeoutSeconds, maxRetries, hasLlm, hasTools);
    }

    public AgentConfig withDependencies(List<String> requires, List<String> after, JoinStrategy joinStrategy) {
        return new AgentConfig(name, stageOrder, requires, after, joinStrategy, outputKey, routingRules, defaultNext,
                errorNext, timeoutSeconds, maxRetries, hasLlm, hasTools);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("stage_order")
    public int getStageOrder() {
        return stageOrder;
    }

    /** Hard dependencies: stages that must complete before this one (DAG mode). */
    @JsonProperty("requires")
    public List<String> getRequires() {
        return requires;
    }

    /** Soft ordering: stages that must have finished, successfully or not, before this one (DAG mode). */
    @JsonProperty("after")
    public List<String> getAfter() {
        return after;
    }

    @JsonProperty("join_strategy")
    public JoinStrategy getJoinStrategy() {
        return joinStrategy;
    }

    /** Key under {@code outputs}; defaults to the agent name. */
    @JsonProperty("output_key")
    public String getOutputKey() {
        return outputKey;
    }

    @JsonProperty("routing_rules")
    public List<RoutingRule> getRoutingRules() {
        return routingRules;
    }

    @JsonProperty("default_next")
    public String getDefaultNext() {
        return defaultNext;
    }

    /** Stage to route to when the agent reports failure; null makes failure fatal. */
    @JsonProperty("error_next")
    public String getErrorNext() {
        return errorNext;
    }

    /** Per-agent timeout; null means the pipeline default. */
    @JsonProperty("timeout_seconds")
    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @JsonProperty("max_retries")
    public int getMaxRetries() {
        return maxRetries;
    }

    @JsonProperty("has_llm")
    public boolean isHasLlm() {
        return hasLlm;
    }

    @JsonProperty("has_tools")
    public boolean isHasTools() {
        return hasTools;
    }
}
