package com.olo.kernel.ipc.handler;

import com.olo.kernel.Kernel;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.EnvelopeJson;
import com.olo.kernel.orchestrator.AgentExecutionMetrics;
import com.olo.kernel.orchestrator.Instruction;
import com.olo.kernel.orchestrator.RoutingDecision;
import com.olo.kernel.pipeline.PipelineConfigJson;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code orchestration} service. {@code ReportAgentResult} answers with the routing decision and the next
 * instruction, so a worker needs one round trip per agent.
 */
public final class OrchestrationServiceHandler implements ServiceHandler {

    private final Kernel kernel;

    public OrchestrationServiceHandler(Kernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public String serviceName() {
        return "orchestration";
    }

    @Override
    public Object handle(String method, RequestBody body) {
        switch (method) {
            case "InitializeSession": {
                Map<String, Object> envelopeMap = body.object("envelope");
                Envelope envelope = envelopeMap != null ? EnvelopeJson.fromMap(envelopeMap) : null;
                return kernel.initializeSession(body.requireText("process_id"),
                        PipelineConfigJson.fromMap(EngineServiceHandler.requireObject(body, "pipeline_config")),
                        envelope, body.bool("force", false));
            }
            case "GetNextInstruction":
                return kernel.getNextInstruction(body.requireText("process_id"));
            case "ReportAgentResult":
                return reportAgentResult(body);
            case "GetSessionState":
                return kernel.getSessionState(body.requireText("process_id"));
            default:
                throw ServiceHandler.unknownMethod(serviceName(), method);
        }
    }

    private Map<String, Object> reportAgentResult(RequestBody body) {
        String pid = body.requireText("process_id");
        AgentExecutionMetrics metrics = body.convert("metrics", AgentExecutionMetrics.class);
        RoutingDecision decision = kernel.reportAgentResult(pid, body.requireText("agent_name"),
                body.object("output"), metrics, body.bool("success", true), body.text("error"));
        Instruction next = kernel.getNextInstruction(pid);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("decision", decision);
        result.put("instruction", next);
        return result;
    }
}
