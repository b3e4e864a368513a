package com.forge.bootstrap;

import com.forge.config.ForgeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForgeBootstrapTest {

    @TempDir
    Path dir;

    @Test
    void initialize_discoversHandlersAndWiresMetricsListener() {
        ForgeConfig config = ForgeConfig.builder().workflowDir(dir.toString()).build();

        try (WorkflowRuntime runtime = ForgeBootstrap.initialize(config)) {
            assertTrue(runtime.getHandlerRegistry().isRegistered("test_upper"));
            assertNotNull(runtime.getOrchestrator());
            assertEquals(1, runtime.getEventBus().listenerCount());
            assertNotNull(runtime.getMetrics().getRegistry());
        }
    }
}
