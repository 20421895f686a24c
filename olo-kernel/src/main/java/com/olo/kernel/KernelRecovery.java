package com.olo.kernel;

import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Contains unexpected failures of one kernel operation. {@link KernelException}s pass through; anything else
 * becomes {@code INTERNAL} with the message {@code "Panic in <operation>: <message>"}.
 */
public final class KernelRecovery {

    private static final Logger log = LoggerFactory.getLogger(KernelRecovery.class);

    private final KernelMetrics metrics;

    public KernelRecovery(KernelMetrics metrics) {
        this.metrics = metrics;
    }

    public <T> T call(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (KernelException e) {
            throw e;
        } catch (RuntimeException | Error e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("panic_recovered | operation={} error={}", operation, message, e);
            if (metrics != null) {
                metrics.panic(operation);
            }
            throw new KernelException(ErrorKind.INTERNAL, "Panic in " + operation + ": " + message, e);
        }
    }

    public void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }
}
