package com.olo.kernel.ipc.handler;

import com.olo.kernel.Kernel;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.EnvelopeJson;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.pipeline.PipelineConfigJson;

import java.util.List;
import java.util.Map;

/**
 * {@code engine} service: envelope storage and bounds, plus {@code ExecutePipeline}, which binds a pipeline and
 * returns the first instruction.
 */
public final class EngineServiceHandler implements ServiceHandler {

    private final Kernel kernel;

    public EngineServiceHandler(Kernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public String serviceName() {
        return "engine";
    }

    @Override
    public Object handle(String method, RequestBody body) {
        switch (method) {
            case "CreateEnvelope":
                return createEnvelope(body);
            case "GetEnvelope":
                return kernel.getEnvelope(body.requireText("pid"));
            case "UpdateEnvelope":
                return updateEnvelope(body);
            case "CheckBounds":
                return kernel.checkBounds(body.requireText("pid"));
            case "ExecutePipeline":
                return executePipeline(body);
            case "CloneEnvelope":
                return kernel.cloneEnvelope(body.requireText("pid"));
            default:
                throw ServiceHandler.unknownMethod(serviceName(), method);
        }
    }

    private Envelope createEnvelope(RequestBody body) {
        String pid = body.text("pid");
        Envelope created = kernel.createEnvelope(pid,
                body.text("request_id", KernelServiceHandler.generatedId("req")),
                body.text("user_id", KernelServiceHandler.ANONYMOUS_USER),
                body.text("session_id", KernelServiceHandler.generatedId("sess")),
                body.text("raw_input", ""));
        List<String> stageOrder = body.textList("stage_order");
        if (stageOrder.isEmpty()) {
            return created;
        }
        created.setStageOrder(stageOrder);
        created.setCurrentStage(stageOrder.get(0));
        return kernel.updateEnvelope(pid != null ? pid : created.getEnvelopeId(), created);
    }

    private Envelope updateEnvelope(RequestBody body) {
        Envelope envelope = EnvelopeJson.fromMap(requireObject(body, "envelope"));
        return kernel.updateEnvelope(body.text("pid", envelope.getEnvelopeId()), envelope);
    }

    private Object executePipeline(RequestBody body) {
        Map<String, Object> envelopeMap = body.object("envelope");
        Envelope envelope = envelopeMap != null ? EnvelopeJson.fromMap(envelopeMap) : null;
        String pid = body.text("pid");
        if (pid == null) {
            if (envelope == null) {
                throw KernelException.validation("Missing required field: pid");
            }
            pid = envelope.getEnvelopeId();
        }
        kernel.initializeSession(pid, PipelineConfigJson.fromMap(requireObject(body, "pipeline_config")), envelope,
                body.bool("force", false));
        return kernel.getNextInstruction(pid);
    }

    static Map<String, Object> requireObject(RequestBody body, String field) {
        Map<String, Object> value = body.object(field);
        if (value == null) {
            throw KernelException.validation("Missing required field: %s", field);
        }
        return value;
    }
}
