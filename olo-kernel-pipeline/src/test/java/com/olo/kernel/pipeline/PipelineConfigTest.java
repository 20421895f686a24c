package com.olo.kernel.pipeline;

import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineConfigTest {

    private static final String THREE_STAGE_JSON = """
            {
              "name": "research",
              "max_llm_calls": 6,
              "agents": [
                {"name": "critic", "stage_order": 3,
                 "routing_rules": [{"condition": "verdict", "value": "retry", "target": "planner"}],
                 "default_next": "end"},
                {"name": "planner", "stage_order": 1, "has_llm": true},
                {"name": "executor", "stage_order": 2, "error_next": "critic", "timeout_seconds": 30}
              ],
              "edge_limits": [{"from": "critic", "to": "planner", "max_count": 2}],
              "extra_field_from_worker": true
            }
            """;

    @Test
    void fromJson_sortsStagesAndAppliesDefaults() {
        PipelineConfig config = PipelineConfigJson.fromJson(THREE_STAGE_JSON);

        config.validate();
        assertEquals(List.of("planner", "executor", "critic"), config.getStageOrder());
        assertEquals(6, config.getMaxLlmCalls());
        assertEquals(3, config.getMaxIterations());
        assertEquals(21, config.getMaxAgentHops());
        assertEquals(2, config.getEdgeLimit("critic", "planner"));
        assertEquals(0, config.getEdgeLimit("planner", "executor"));
        assertEquals(30, config.resolveTimeoutSeconds("executor"));
        assertEquals(300, config.resolveTimeoutSeconds("planner"));
        assertEquals("critic", config.nextInOrder("executor"));
        assertEquals(PipelineConfig.END, config.nextInOrder("critic"));
        assertTrue(config.getAgent("planner").isHasLlm());
        assertEquals("planner", config.getAgent("planner").getOutputKey());
    }

    @Test
    void validate_rejectsMissingName() {
        PipelineConfig config = PipelineConfig.linear(" ", List.of(AgentConfig.of("a", 1)));

        KernelException e = assertThrows(KernelException.class, config::validate);
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }

    @Test
    void validate_rejectsDuplicateAgents() {
        PipelineConfig config = PipelineConfig.linear("p", List.of(AgentConfig.of("a", 1), AgentConfig.of("a", 2)));

        KernelException e = assertThrows(KernelException.class, config::validate);
        assertEquals("duplicate agent name: a", e.getMessage());
    }

    @Test
    void validate_rejectsUnknownRoutingTarget() {
        AgentConfig a = AgentConfig.of("a", 1)
                .withRouting(List.of(new RoutingRule("ok", true, "nowhere")), null, null);
        PipelineConfig config = PipelineConfig.linear("p", List.of(a));

        KernelException e = assertThrows(KernelException.class, config::validate);
        assertTrue(e.getMessage().contains("nowhere"), e.getMessage());
    }

    @Test
    void validate_allowsReservedTargets() {
        AgentConfig a = AgentConfig.of("a", 1)
                .withRouting(List.of(new RoutingRule("needs_input", true, PipelineConfig.CLARIFICATION)),
                        PipelineConfig.END, PipelineConfig.CONFIRMATION);

        assertDoesNotThrow(() -> PipelineConfig.linear("p", List.of(a)).validate());
    }

    @Test
    void validate_detectsDependencyCycleInDagMode() {
        AgentConfig a = AgentConfig.of("a", 1).withDependencies(List.of("c"), null, null);
        AgentConfig b = AgentConfig.of("b", 2).withDependencies(List.of("a"), null, null);
        AgentConfig c = AgentConfig.of("c", 3).withDependencies(List.of("b"), null, null);
        PipelineConfig config = new PipelineConfig("dag", List.of(a, b, c), null, null, null, null, true, null);

        KernelException e = assertThrows(KernelException.class, config::validate);
        assertEquals("pipeline dag has a dependency cycle involving: [a, b, c]", e.getMessage());
    }

    @Test
    void validate_ignoresDependenciesWhenDagDisabled() {
        AgentConfig a = AgentConfig.of("a", 1).withDependencies(List.of("b"), null, null);
        AgentConfig b = AgentConfig.of("b", 2).withDependencies(List.of("a"), null, null);

        assertDoesNotThrow(() -> PipelineConfig.linear("p", List.of(a, b)).validate());
    }

    @Test
    void getReadyStages_honoursJoinStrategies() {
        AgentConfig fetchA = AgentConfig.of("fetch_a", 1);
        AgentConfig fetchB = AgentConfig.of("fetch_b", 1);
        AgentConfig mergeAll = AgentConfig.of("merge_all", 2)
                .withDependencies(List.of("fetch_a", "fetch_b"), null, JoinStrategy.ALL);
        AgentConfig firstWins = AgentConfig.of("first_wins", 2)
                .withDependencies(List.of("fetch_a", "fetch_b"), null, JoinStrategy.ANY);
        AgentConfig report = AgentConfig.of("report", 3).withDependencies(null, List.of("merge_all"), null);
        PipelineConfig config = new PipelineConfig("dag",
                List.of(fetchA, fetchB, mergeAll, firstWins, report), null, null, null, null, true, null);
        config.validate();

        assertEquals(List.of("fetch_a", "fetch_b"), config.getReadyStages(Set.of(), Set.of()));
        assertEquals(List.of("fetch_b", "first_wins"), config.getReadyStages(Set.of("fetch_a"), Set.of()));
        assertEquals(List.of("first_wins"), config.getReadyStages(Set.of("fetch_a"), Set.of("fetch_b")));
        assertEquals(List.of("first_wins", "report"),
                config.getReadyStages(Set.of("fetch_a"), Set.of("fetch_b", "merge_all")));
    }

    @Test
    void routingRule_matchesAcrossValueTypes() {
        assertTrue(new RoutingRule("score", 3, "x").matches(Map.of("score", 3.0)));
        assertTrue(new RoutingRule("ok", true, "x").matches(Map.of("ok", "true")));
        assertTrue(new RoutingRule("verdict", "retry", "x").matches(Map.of("verdict", "retry")));
        assertTrue(new RoutingRule("tags", List.of("a"), "x").matches(Map.of("tags", List.of("a"))));
        assertFalse(new RoutingRule("verdict", "retry", "x").matches(Map.of("verdict", "done")));
        assertFalse(new RoutingRule("missing", "v", "x").matches(Map.of()));
    }

    @Test
    void toJson_roundTripsThroughFromJson() {
        PipelineConfig config = PipelineConfigJson.fromJson(THREE_STAGE_JSON);

        PipelineConfig again = PipelineConfigJson.fromJson(PipelineConfigJson.toJson(config));

        assertEquals(config.getStageOrder(), again.getStageOrder());
        assertEquals(config.getEdgeLimit("critic", "planner"), again.getEdgeLimit("critic", "planner"));
        assertEquals(config.getAgent("critic").getRoutingRules(), again.getAgent("critic").getRoutingRules());
    }

    @Test
    void fromJson_malformedIsValidationError() {
        KernelException e = assertThrows(KernelException.class, () -> PipelineConfigJson.fromJson("{\"agents\": 5"));
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }
}
