package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.error.KernelException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stage/agent graph of one pipeline plus its bounds. Immutable.
 * <p>
 * Stages run in {@code stage_order} unless routing rules say otherwise. With {@code enable_dag_execution},
 * {@code requires}/{@code after} dependencies must form an acyclic graph and {@link #getReadyStages} tells
 * which stages may run in parallel.
 */
public final class PipelineConfig {

    public static final String END = "end";
    public static final String CLARIFICATION = "clarification";
    public static final String CONFIRMATION = "confirmation";

    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final int DEFAULT_MAX_LLM_CALLS = 10;
    public static final int DEFAULT_MAX_AGENT_HOPS = 21;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private final String name;
    private final List<AgentConfig> agents;
    private final int maxIterations;
    private final int maxLlmCalls;
    private final int maxAgentHops;
    private final int defaultTimeoutSeconds;
    private final boolean enableDagExecution;
    private final List<EdgeLimit> edgeLimits;

    private final Map<String, AgentConfig> agentsByName;
    private final List<String> stageOrder;

    @JsonCreator
    public PipelineConfig(
            @JsonProperty("name") String name,
            @JsonProperty("agents") List<AgentConfig> agents,
            @JsonProperty("max_iterations") Integer maxIterations,
            @JsonProperty("max_llm_calls") Integer maxLlmCalls,
            @JsonProperty("max_agent_hops") Integer maxAgentHops,
            @JsonProperty("default_timeout_seconds") Integer defaultTimeoutSeconds,
            @JsonProperty("enable_dag_execution") Boolean enableDagExecution,
            @JsonProperty("edge_limits") List<EdgeLimit> edgeLimits) {
        this.name = name;
        this.agents = agents != null ? List.copyOf(agents) : List.of();
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.maxLlmCalls = maxLlmCalls != null ? maxLlmCalls : DEFAULT_MAX_LLM_CALLS;
        this.maxAgentHops = maxAgentHops != null ? maxAgentHops : DEFAULT_MAX_AGENT_HOPS;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds != null ? defaultTimeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.enableDagExecution = enableDagExecution != null && enableDagExecution;
        this.edgeLimits = edgeLimits != null ? List.copyOf(edgeLimits) : List.of();

        Map<String, AgentConfig> byName = new LinkedHashMap<>();
        for (AgentConfig agent : this.agents) {
            if (agent.getName() != null) {
                byName.putIfAbsent(agent.getName(), agent);
            }
        }
        this.agentsByName = byName;
        List<AgentConfig> sorted = new ArrayList<>(this.agents);
        sorted.sort(Comparator.comparingInt(AgentConfig::getStageOrder));
        List<String> order = new ArrayList<>();
        for (AgentConfig agent : sorted) {
            if (agent.getName() != null) {
                order.add(agent.getName());
            }
        }
        this.stageOrder = List.copyOf(order);
    }

    /** Linear pipeline with default bounds. */
    public static PipelineConfig linear(String name, List<AgentConfig> agents) {
        return new PipelineConfig(name, agents, null, null, null, null, null, null);
    }

    /**
     * Checks the configuration is runnable.
     *
     * @throws KernelException VALIDATION describing the first problem found
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw KernelException.validation("pipeline name is required");
        }
        if (agents.isEmpty()) {
            throw KernelException.validation("pipeline %s has no agents", name);
        }
        requirePositive(maxIterations, "max_iterations");
        requirePositive(maxLlmCalls, "max_llm_calls");
        requirePositive(maxAgentHops, "max_agent_hops");
        Set<String> seen = new HashSet<>();
        for (AgentConfig agent : agents) {
            if (agent.getName() == null || agent.getName().isBlank()) {
                throw KernelException.validation("pipeline %s has an agent without a name", name);
            }
            if (isReservedTarget(agent.getName())) {
                throw KernelException.validation("agent name %s is reserved", agent.getName());
            }
            if (!seen.add(agent.getName())) {
                throw KernelException.validation("duplicate agent name: %s", agent.getName());
            }
        }
        for (AgentConfig agent : agents) {
            for (RoutingRule rule : agent.getRoutingRules()) {
                requireTarget(agent.getName(), "routing rule", rule.getTarget());
            }
            if (agent.getDefaultNext() != null) {
                requireTarget(agent.getName(), "default_next", agent.getDefaultNext());
            }
            if (agent.getErrorNext() != null) {
                requireTarget(agent.getName(), "error_next", agent.getErrorNext());
            }
        }
        for (EdgeLimit limit : edgeLimits) {
            if (!agentsByName.containsKey(limit.getFrom())) {
                throw KernelException.validation("edge limit references unknown stage: %s", limit.getFrom());
            }
            requireTarget(limit.getFrom(), "edge limit", limit.getTo());
            requirePositive(limit.getMaxCount(), "edge limit max_count");
        }
        if (enableDagExecution) {
            validateDependencies();
        }
    }

    private void requireTarget(String agent, String what, String target) {
        if (target == null || (!agentsByName.containsKey(target) && !isReservedTarget(target))) {
            throw KernelException.validation("agent %s: %s targets unknown stage: %s", agent, what, target);
        }
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw KernelException.validation("%s must be positive, got: %d", field, value);
        }
    }

    private void validateDependencies() {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (AgentConfig agent : agents) {
            inDegree.putIfAbsent(agent.getName(), 0);
            for (String dep : dependenciesOf(agent)) {
                if (!agentsByName.containsKey(dep)) {
                    throw KernelException.validation("agent %s depends on unknown stage: %s", agent.getName(), dep);
                }
                if (dep.equals(agent.getName())) {
                    throw KernelException.validation("agent %s depends on itself", agent.getName());
                }
                inDegree.merge(agent.getName(), 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(agent.getName());
            }
        }
        Deque<String> queue = new ArrayDeque<>();
        for (String stage : stageOrder) {
            if (inDegree.get(stage) == 0) {
                queue.add(stage);
            }
        }
        int visited = 0;
        while (!queue.isEmpty()) {
            String stage = queue.poll();
            visited++;
            for (String next : dependents.getOrDefault(stage, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }
        if (visited < agents.size()) {
            Set<String> cyclic = new TreeSet<>();
            inDegree.forEach((stage, degree) -> {
                if (degree > 0) cyclic.add(stage);
            });
            throw KernelException.validation("pipeline %s has a dependency cycle involving: %s", name, cyclic);
        }
    }

    private static Set<String> dependenciesOf(AgentConfig agent) {
        Set<String> deps = new HashSet<>(agent.getRequires());
        deps.addAll(agent.getAfter());
        return deps;
    }

    /**
     * Stages that may start now: not yet completed or failed, every {@code after} stage finished, and
     * {@code requires} satisfied per the stage's join strategy. Returned in stage order.
     */
    public List<String> getReadyStages(Collection<String> completed, Collection<String> failed) {
        Set<String> done = new HashSet<>(completed);
        Set<String> finished = new HashSet<>(done);
        finished.addAll(failed);
        List<String> ready = new ArrayList<>();
        for (String stage : stageOrder) {
            if (finished.contains(stage)) {
                continue;
            }
            AgentConfig agent = agentsByName.get(stage);
            if (!finished.containsAll(agent.getAfter())) {
                continue;
            }
            List<String> requires = agent.getRequires();
            boolean satisfied = requires.isEmpty()
                    || (agent.getJoinStrategy() == JoinStrategy.ANY
                    ? requires.stream().anyMatch(done::contains)
                    : done.containsAll(requires));
            if (satisfied) {
                ready.add(stage);
            }
        }
        return ready;
    }

    /** Max traversals of {@code from -> to}, or 0 when unlimited. */
    public int getEdgeLimit(String from, String to) {
        for (EdgeLimit limit : edgeLimits) {
            if (limit.getFrom().equals(from) && limit.getTo().equals(to)) {
                return limit.getMaxCount();
            }
        }
        return 0;
    }

    /** Stage after {@code stage} in stage order, or {@link #END} when it is the last. */
    public String nextInOrder(String stage) {
        int index = stageOrder.indexOf(stage);
        if (index < 0 || index + 1 >= stageOrder.size()) {
            return END;
        }
        return stageOrder.get(index + 1);
    }

    public int indexOf(String stage) {
        return stageOrder.indexOf(stage);
    }

    public int resolveTimeoutSeconds(String agentName) {
        AgentConfig agent = agentsByName.get(agentName);
        if (agent != null && agent.getTimeoutSeconds() != null && agent.getTimeoutSeconds() > 0) {
            return agent.getTimeoutSeconds();
        }
        return defaultTimeoutSeconds;
    }

    public static boolean isReservedTarget(String target) {
        return END.equals(target) || CLARIFICATION.equals(target) || CONFIRMATION.equals(target);
    }

    @JsonIgnore
    public AgentConfig getAgent(String agentName) {
        return agentName != null ? agentsByName.get(agentName) : null;
    }

    public boolean hasStage(String stage) {
        return stage != null && agentsByName.containsKey(stage);
    }

    /** Agent names sorted by stage order (stable for equal orders). */
    @JsonIgnore
    public List<String> getStageOrder() {
        return stageOrder;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("agents")
    public List<AgentConfig> getAgents() {
        return agents;
    }

    @JsonProperty("max_iterations")
    public int getMaxIterations() {
        return maxIterations;
    }

    @JsonProperty("max_llm_calls")
    public int getMaxLlmCalls() {
        return maxLlmCalls;
    }

    @JsonProperty("max_agent_hops")
    public int getMaxAgentHops() {
        return maxAgentHops;
    }

    @JsonProperty("default_timeout_seconds")
    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    @JsonProperty("enable_dag_execution")
    public boolean isEnableDagExecution() {
        return enableDagExecution;
    }

    @JsonProperty("edge_limits")
    public List<EdgeLimit> getEdgeLimits() {
        return edgeLimits;
    }
}
