package com.olo.kernel.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.olo.kernel.Kernel;
import com.olo.kernel.KernelRecovery;
import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.ipc.handler.EngineServiceHandler;
import com.olo.kernel.ipc.handler.InterruptServiceHandler;
import com.olo.kernel.ipc.handler.KernelServiceHandler;
import com.olo.kernel.ipc.handler.OrchestrationServiceHandler;
import com.olo.kernel.ipc.handler.RequestBody;
import com.olo.kernel.ipc.handler.ServiceHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes {@code {id, service, method, body}} requests to service handlers and builds the
 * {@code {id, ok, body}} or {@code {id, ok:false, error:{code, message}}} reply.
 * <p>
 * A request that cannot be decoded at all yields an ERROR frame; every decoded request yields a RESPONSE frame,
 * whether or not the call succeeded.
 */
public final class KernelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(KernelDispatcher.class);

    public static final String UNAVAILABLE = "UNAVAILABLE";

    private final Map<String, ServiceHandler> handlers = new LinkedHashMap<>();
    private final KernelRecovery recovery;
    private final ObjectMapper mapper = IpcJson.mapper();

    public KernelDispatcher(Kernel kernel) {
        this(new KernelRecovery(kernel.getMetrics()), List.of(
                new KernelServiceHandler(kernel),
                new EngineServiceHandler(kernel),
                new OrchestrationServiceHandler(kernel),
                new InterruptServiceHandler(kernel)));
    }

    public KernelDispatcher(KernelRecovery recovery, List<ServiceHandler> services) {
        this.recovery = recovery;
        for (ServiceHandler handler : services) {
            handlers.put(handler.serviceName(), handler);
        }
    }

    /** Decodes one REQUEST payload and returns the frame to send back. */
    public Frame dispatch(byte[] payload) {
        JsonNode request;
        try {
            request = mapper.readTree(payload);
        } catch (IOException e) {
            log.warn("Dispatch | undecodable request error={}", e.getMessage());
            return errorFrame("", ErrorKind.VALIDATION.getCode(), "Invalid request: " + e.getMessage());
        }
        if (request == null || !request.isObject()) {
            return errorFrame("", ErrorKind.VALIDATION.getCode(), "Invalid request: expected a JSON object");
        }
        String id = field(request, "id");
        for (String required : new String[]{"id", "service", "method"}) {
            if (field(request, required).isEmpty()) {
                return errorFrame(id, ErrorKind.VALIDATION.getCode(), "Missing required request field: " + required);
            }
        }
        ObjectNode reply = handle(id, field(request, "service"), field(request, "method"), request.get("body"));
        return new Frame(MessageType.RESPONSE, toBytes(reply));
    }

    /** Runs one call and returns the reply object. Never throws. */
    public ObjectNode handle(String id, String service, String method, JsonNode body) {
        long started = System.nanoTime();
        try {
            JsonNode result = recovery.call(service + "." + method, () -> {
                ServiceHandler handler = handlers.get(service);
                if (handler == null) {
                    throw new KernelException(ErrorKind.NOT_FOUND, "Unknown service: " + service);
                }
                return mapper.valueToTree(handler.handle(method, new RequestBody(body, mapper)));
            });
            ObjectNode reply = mapper.createObjectNode();
            reply.put("id", id);
            reply.put("ok", true);
            reply.set("body", result);
            log.debug("Dispatch | id={} service={} method={} ok=true tookMs={}", id, service, method,
                    (System.nanoTime() - started) / 1_000_000);
            return reply;
        } catch (KernelException e) {
            if (e.getKind() == ErrorKind.INTERNAL) {
                log.error("Dispatch | id={} service={} method={} code={} error={}", id, service, method, e.getCode(),
                        e.getMessage());
            } else {
                log.info("Dispatch | id={} service={} method={} code={} error={}", id, service, method, e.getCode(),
                        e.getMessage());
            }
            return failure(id, e.getCode(), e.getMessage());
        }
    }

    public Frame errorFrame(String id, String code, String message) {
        return new Frame(MessageType.ERROR, toBytes(failure(id, code, message)));
    }

    private ObjectNode failure(String id, String code, String message) {
        ObjectNode reply = mapper.createObjectNode();
        reply.put("id", id != null ? id : "");
        reply.put("ok", false);
        ObjectNode error = reply.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return reply;
    }

    private byte[] toBytes(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw KernelException.internal("failed to encode reply", e);
        }
    }

    private static String field(JsonNode request, String name) {
        JsonNode value = request.get(name);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
