package com.olo.kernel.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olo.kernel.Kernel;
import com.olo.kernel.KernelMetrics;
import com.olo.kernel.config.KernelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KernelDispatcherTest {

    private static final String PIPELINE = """
            {"name":"triage","agents":[
              {"name":"intent","stage_order":0},
              {"name":"planner","stage_order":1}
            ]}""";

    private final ObjectMapper mapper = IpcJson.mapper();
    private KernelDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
        Kernel kernel = new Kernel(KernelConfig.builder().build(), clock, new KernelMetrics());
        dispatcher = new KernelDispatcher(kernel);
    }

    private JsonNode call(String service, String method, String body) throws IOException {
        return dispatcher.handle("req-1", service, method, mapper.readTree(body));
    }

    private JsonNode ok(String service, String method, String body) throws IOException {
        JsonNode reply = call(service, method, body);
        assertTrue(reply.get("ok").asBoolean(), () -> "expected success: " + reply);
        return reply.get("body");
    }

    private static String errorCode(JsonNode reply) {
        assertFalse(reply.get("ok").asBoolean());
        return reply.get("error").get("code").asText();
    }

    private void createProcess(String pid) throws IOException {
        ok("kernel", "CreateProcess", """
                {"pid":"%s","user_id":"u1","session_id":"s1"}""".formatted(pid));
    }

    @Test
    void createProcessReturnsReadyProcess() throws IOException {
        JsonNode body = ok("kernel", "CreateProcess", """
                {"pid":"p1","user_id":"u1","priority":"high"}""");

        assertEquals("p1", body.get("pid").asText());
        assertEquals("ready", body.get("state").asText());
        assertTrue(body.get("request_id").asText().startsWith("req_"));
    }

    @Test
    void quotaBreachIsReportedByCheckQuota() throws IOException {
        ok("kernel", "CreateProcess", """
                {"pid":"p1","user_id":"u1","quota":{"max_llm_calls":10}}""");
        ok("kernel", "RecordUsage", """
                {"pid":"p1","llm_calls":15}""");

        JsonNode quota = ok("kernel", "CheckQuota", "{\"pid\":\"p1\"}");

        assertFalse(quota.get("within_bounds").asBoolean());
        assertEquals("llm_calls 15 >= 10", quota.get("exceeded_reason").asText());
    }

    @Test
    void recordInferenceCountsTowardInferenceQuota() throws IOException {
        ok("kernel", "CreateProcess", """
                {"pid":"p1","user_id":"u1","quota":{"max_inference_input_chars":1000}}""");

        JsonNode usage = ok("kernel", "RecordInference", """
                {"pid":"p1","input_chars":1500}""");

        assertEquals(1, usage.get("inference_requests").asInt());
        assertEquals("inference_input_chars 1500 >= 1000",
                ok("kernel", "CheckQuota", "{\"pid\":\"p1\"}").get("exceeded_reason").asText());
        assertEquals("INVALID_ARGUMENT", errorCode(call("kernel", "RecordInference", """
                {"pid":"p1","requests":-1}""")));
    }

    @Test
    void createProcessWithParentPidLinksChild() throws IOException {
        createProcess("parent");

        JsonNode child = ok("kernel", "CreateProcess", """
                {"pid":"child","user_id":"u1","session_id":"s1","parent_pid":"parent"}""");

        assertEquals("parent", child.get("parent_pid").asText());
        assertEquals("child", ok("kernel", "GetProcess", "{\"pid\":\"parent\"}").get("child_pids").get(0).asText());
        assertEquals("NOT_FOUND", errorCode(call("kernel", "CreateProcess", """
                {"pid":"x","user_id":"u1","session_id":"s1","parent_pid":"ghost"}""")));
    }

    @Test
    void singleCallQuotaIsExhaustedByOneCall() throws IOException {
        ok("kernel", "CreateProcess", """
                {"pid":"p1","quota":"{\\"max_llm_calls\\":1}"}""");
        ok("kernel", "RecordUsage", "{\"pid\":\"p1\",\"llm_calls\":1}");

        JsonNode quota = ok("kernel", "CheckQuota", "{\"pid\":\"p1\"}");

        assertFalse(quota.get("within_bounds").asBoolean());
        assertTrue(quota.get("exceeded_reason").asText().contains("llm_calls"));
    }

    @Test
    void unknownServiceAndMethodAreNotFound() throws IOException {
        JsonNode service = call("scheduler", "Run", "{}");
        JsonNode method = call("kernel", "Explode", "{}");

        assertEquals("NOT_FOUND", errorCode(service));
        assertEquals("Unknown service: scheduler", service.get("error").get("message").asText());
        assertEquals("NOT_FOUND", errorCode(method));
        assertEquals("req-1", method.get("id").asText());
    }

    @Test
    void malformedBodiesAreInvalidArgument() throws IOException {
        assertEquals("INVALID_ARGUMENT", errorCode(call("kernel", "GetProcess", "[1,2]")));
        JsonNode missing = call("kernel", "GetProcess", "{}");
        assertEquals("INVALID_ARGUMENT", errorCode(missing));
        assertEquals("Missing required field: pid", missing.get("error").get("message").asText());
        assertEquals("INVALID_ARGUMENT", errorCode(call("kernel", "ListProcesses", "{\"state\":\"sleeping\"}")));
    }

    @Test
    void getProcessForUnknownPidIsNotFound() throws IOException {
        assertEquals("NOT_FOUND", errorCode(call("kernel", "GetProcess", "{\"pid\":\"ghost\"}")));
    }

    @Test
    void dispatchAnswersUndecodableInputWithErrorFrame() throws IOException {
        Frame frame = dispatcher.dispatch("not json".getBytes(StandardCharsets.UTF_8));

        assertEquals(MessageType.ERROR, frame.getType());
        JsonNode reply = mapper.readTree(frame.getPayload());
        assertEquals("INVALID_ARGUMENT", errorCode(reply));
        assertTrue(reply.get("error").get("message").asText().startsWith("Invalid request"));
    }

    @Test
    void dispatchRequiresEnvelopeFields() throws IOException {
        Frame frame = dispatcher.dispatch("{\"id\":\"7\",\"service\":\"kernel\"}".getBytes(StandardCharsets.UTF_8));

        JsonNode reply = mapper.readTree(frame.getPayload());
        assertEquals(MessageType.ERROR, frame.getType());
        assertEquals("7", reply.get("id").asText());
        assertEquals("Missing required request field: method", reply.get("error").get("message").asText());
    }

    @Test
    void dispatchWrapsFailedCallInResponseFrame() throws IOException {
        Frame frame = dispatcher.dispatch("""
                {"id":"9","service":"kernel","method":"GetProcess","body":{"pid":"ghost"}}"""
                .getBytes(StandardCharsets.UTF_8));

        JsonNode reply = mapper.readTree(frame.getPayload());
        assertEquals(MessageType.RESPONSE, frame.getType());
        assertEquals("9", reply.get("id").asText());
        assertEquals("NOT_FOUND", errorCode(reply));
    }

    @Test
    void orchestrationRoundTripOverHandlers() throws IOException {
        createProcess("p1");
        ok("engine", "CreateEnvelope", """
                {"pid":"p1","user_id":"u1","session_id":"s1","raw_input":"plan my trip"}""");
        JsonNode session = ok("orchestration", "InitializeSession",
                mapper.createObjectNode()
                        .put("process_id", "p1")
                        .put("pipeline_config", PIPELINE)
                        .toString());
        assertEquals("intent", session.get("current_stage").asText());

        JsonNode instruction = ok("orchestration", "GetNextInstruction", "{\"process_id\":\"p1\"}");
        assertEquals("run_agent", instruction.get("kind").asText());
        assertEquals("intent", instruction.get("agent_name").asText());

        JsonNode reported = ok("orchestration", "ReportAgentResult", """
                {"process_id":"p1","agent_name":"intent","output":{"intent":"travel"},
                 "metrics":{"llm_calls":1,"tokens_in":20,"tokens_out":5}}""");
        assertEquals("planner", reported.get("decision").get("target").asText());
        assertEquals("planner", reported.get("instruction").get("agent_name").asText());

        JsonNode process = ok("kernel", "GetProcess", "{\"pid\":\"p1\"}");
        assertEquals(1, process.get("usage").get("llm_calls").asInt());
        assertEquals(1, process.get("usage").get("agent_hops").asInt());
    }

    @Test
    void executePipelineInitializesAndReturnsFirstInstruction() throws IOException {
        ok("engine", "CreateEnvelope", "{\"pid\":\"p2\",\"raw_input\":\"hi\"}");

        JsonNode instruction = ok("engine", "ExecutePipeline",
                mapper.createObjectNode().put("pid", "p2").put("pipeline_config", PIPELINE).toString());

        assertEquals("run_agent", instruction.get("kind").asText());
        assertEquals("intent", instruction.get("agent_name").asText());
    }

    @Test
    void interruptLifecycleOverHandlers() throws IOException {
        createProcess("p1");
        assertEquals("INVALID_ARGUMENT", errorCode(call("interrupt", "CreateInterrupt", """
                {"pid":"p1","kind":"shrug"}""")));

        JsonNode interrupt = ok("interrupt", "CreateInterrupt", """
                {"pid":"p1","kind":"clarification","question":"Which city?"}""");
        String id = interrupt.get("id").asText();
        assertEquals("u1", interrupt.get("user_id").asText());

        JsonNode pending = ok("interrupt", "GetPendingForSession", "{\"session_id\":\"s1\"}");
        assertEquals(1, pending.get("interrupts").size());

        String resolve = """
                {"interrupt_id":"%s","user_id":"u1","response":{"text":"Lisbon"}}""".formatted(id);
        assertTrue(ok("interrupt", "ResolveInterrupt", resolve).get("success").asBoolean());
        assertFalse(ok("interrupt", "ResolveInterrupt", resolve).get("success").asBoolean());
        assertEquals("NOT_FOUND", errorCode(call("interrupt", "GetInterrupt", "{\"interrupt_id\":\"nope\"}")));
    }

    @Test
    void checkRateLimitReportsAllowance() throws IOException {
        JsonNode result = ok("kernel", "CheckRateLimit", "{\"user_id\":\"u7\"}");

        assertTrue(result.get("allowed").asBoolean());
        assertTrue(result.has("current_count"));
    }

    @Test
    void getNextRunnableFollowsPriority() throws IOException {
        assertEquals("NOT_FOUND", errorCode(call("kernel", "GetNextRunnable", "{}")));

        ok("kernel", "CreateProcess", "{\"pid\":\"low\",\"priority\":\"low\"}");
        ok("kernel", "CreateProcess", "{\"pid\":\"high\",\"priority\":\"high\"}");

        assertEquals("high", ok("kernel", "GetNextRunnable", "{}").get("pid").asText());
    }

    @Test
    void processCountsSummarizeStates() throws IOException {
        createProcess("p1");
        createProcess("p2");
        ok("kernel", "TerminateProcess", "{\"pid\":\"p2\",\"terminal_reason\":\"completed\"}");

        JsonNode counts = ok("kernel", "GetProcessCounts", "{}");

        assertEquals(2, counts.get("total").asInt());
        assertEquals(1, counts.get("counts_by_state").get("terminated").asInt());
    }
}
