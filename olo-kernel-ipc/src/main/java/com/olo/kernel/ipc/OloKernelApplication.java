package com.olo.kernel.ipc;

import com.olo.kernel.Kernel;
import com.olo.kernel.cleanup.CleanupConfig;
import com.olo.kernel.cleanup.CleanupService;
import com.olo.kernel.config.KernelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Kernel process entry point. Configuration comes from {@code OLO_KERNEL_*} environment variables.
 * <p>
 * The server and cleanup threads run in the background; the main thread blocks until interrupted. A shutdown
 * hook stops both on Ctrl+C or SIGTERM.
 */
public final class OloKernelApplication {

    private static final Logger log = LoggerFactory.getLogger(OloKernelApplication.class);

    public static void main(String[] args) {
        KernelConfig config = KernelConfig.fromEnvironment();
        log.info("Starting OLO kernel | host={} port={} limits={} cleanupIntervalSeconds={}",
                config.getHost(), config.getPort(), config.getIpcLimits(), config.getCleanupIntervalSeconds());

        Kernel kernel = new Kernel(config);
        CleanupService cleanup = new CleanupService(kernel, CleanupConfig.from(config));
        IpcServer server = new IpcServer(new KernelDispatcher(kernel), config.getHost(), config.getPort(),
                config.getIpcLimits());
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to bind {}:{} | error={}", config.getHost(), config.getPort(), e.getMessage());
            System.exit(1);
            return;
        }
        cleanup.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down kernel...");
            server.stop();
            cleanup.stop();
        }, "olo-kernel-shutdown"));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down kernel...");
            server.stop();
            cleanup.stop();
        }
    }

    private OloKernelApplication() {
    }
}
