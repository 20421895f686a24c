package com.olo.kernel.ipc.handler;

import com.olo.kernel.Kernel;
import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.interrupt.InterruptResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** {@code interrupt} service. Resolve and cancel answer {@code {"success": bool}} rather than failing. */
public final class InterruptServiceHandler implements ServiceHandler {

    private final Kernel kernel;

    public InterruptServiceHandler(Kernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public String serviceName() {
        return "interrupt";
    }

    @Override
    public Object handle(String method, RequestBody body) {
        switch (method) {
            case "CreateInterrupt":
                return kernel.createInterrupt(body.text("pid", body.text("process_id")),
                        interruptKind(body.requireText("kind")),
                        body.text("request_id"), body.text("user_id"), body.text("session_id"),
                        body.text("question"), body.text("message"), body.object("data"));
            case "ResolveInterrupt": {
                InterruptResponse response = body.convert("response", InterruptResponse.class);
                boolean success = kernel.resolveInterrupt(body.requireText("interrupt_id"),
                        response != null ? response : new InterruptResponse(null, null, null, null, null),
                        body.text("user_id"));
                return Map.of("success", success);
            }
            case "CancelInterrupt":
                return Map.of("success", kernel.cancelInterrupt(body.requireText("interrupt_id"),
                        body.text("reason", "cancelled")));
            case "GetInterrupt": {
                String id = body.requireText("interrupt_id");
                return kernel.getInterrupt(id)
                        .orElseThrow(() -> new KernelException(ErrorKind.NOT_FOUND, "Interrupt " + id + " not found"));
            }
            case "GetPendingForSession": {
                List<InterruptKind> kinds = new ArrayList<>();
                for (String kind : body.textList("kinds")) {
                    kinds.add(interruptKind(kind));
                }
                return Map.of("interrupts", kernel.getPendingForSession(body.requireText("session_id"), kinds));
            }
            default:
                throw ServiceHandler.unknownMethod(serviceName(), method);
        }
    }

    private static InterruptKind interruptKind(String value) {
        InterruptKind kind = InterruptKind.fromValue(value);
        if (kind == null) {
            throw KernelException.validation("Invalid interrupt kind: %s", value);
        }
        return kind;
    }
}
