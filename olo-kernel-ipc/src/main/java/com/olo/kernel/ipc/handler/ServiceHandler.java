package com.olo.kernel.ipc.handler;

import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;

/**
 * One named service on the call surface. Results are serialized with the IPC mapper; failures are thrown as
 * {@link KernelException}.
 */
public interface ServiceHandler {

    String serviceName();

    Object handle(String method, RequestBody body);

    static KernelException unknownMethod(String service, String method) {
        return new KernelException(ErrorKind.NOT_FOUND, "Unknown " + service + " method: " + method);
    }
}
