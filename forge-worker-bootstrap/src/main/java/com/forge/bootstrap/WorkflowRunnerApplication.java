package com.forge.bootstrap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.forge.config.ForgeConfig;
import com.forge.engine.error.OrchestrationException;
import com.forge.engine.error.WorkflowNotFoundException;
import com.forge.engine.error.WorkflowValidationException;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line entry point: {@code WorkflowRunnerApplication <workflowId> [inputJson]}.
 * Runs the workflow once and prints the execution record as JSON on stdout.
 * <p>
 * Exit codes: 0 completed, 1 execution or persistence failure, 2 usage / not found / invalid workflow.
 */
public final class WorkflowRunnerApplication {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunnerApplication.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private WorkflowRunnerApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, ForgeConfig.fromEnvironment(), System.out));
    }

    static int run(String[] args, ForgeConfig config, PrintStream out) {
        if (args.length < 1 || args[0].isBlank()) {
            log.error("Usage: WorkflowRunnerApplication <workflowId> [inputJson]");
            return EXIT_USAGE;
        }
        String workflowId = args[0].trim();
        Map<String, Object> input;
        try {
            input = args.length > 1 ? MAPPER.readValue(args[1], MAP_TYPE) : Map.of();
        } catch (JsonProcessingException e) {
            log.error("Input is not a JSON object: {}", e.getOriginalMessage());
            return EXIT_USAGE;
        }

        try (WorkflowRuntime runtime = ForgeBootstrap.initialize(config)) {
            WorkflowExecution execution = runtime.getOrchestrator().executeWorkflow(workflowId, input, "cli");
            out.println(MAPPER.writeValueAsString(toView(execution)));
            return EXIT_OK;
        } catch (WorkflowNotFoundException e) {
            log.error("Workflow not found: {}", e.getWorkflowId());
            return EXIT_USAGE;
        } catch (WorkflowValidationException e) {
            log.error("Workflow {} is invalid: {}", e.getWorkflowId(), e.getErrors());
            return EXIT_USAGE;
        } catch (OrchestrationException e) {
            log.error("Execution {} failed: {}", e.getExecutionId(), e.getMessage());
            return EXIT_FAILED;
        } catch (PersistenceException e) {
            log.error("Persistence failure during {}: {}", e.getOperation(), e.getMessage(), e);
            return EXIT_FAILED;
        } catch (JsonProcessingException e) {
            log.error("Execution finished but result could not be serialized: {}", e.getOriginalMessage(), e);
            return EXIT_FAILED;
        }
    }

    static Map<String, Object> toView(WorkflowExecution execution) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", execution.getId());
        view.put("workflowId", execution.getWorkflowId());
        view.put("status", execution.getStatus().toValue());
        view.put("triggeredBy", execution.getTriggeredBy());
        view.put("partialFailure", execution.isPartialFailure());
        view.put("failedNodeIds", execution.getFailedNodeIds());
        view.put("result", execution.getResultData());
        view.put("startedAt", String.valueOf(execution.getStartedAt()));
        view.put("completedAt", String.valueOf(execution.getCompletedAt()));
        return view;
    }
}
