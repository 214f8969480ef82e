package io.agentrelay.runtime;

import io.agentrelay.agent.Agent;
import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.broker.BrokerSaturatedException;
import io.agentrelay.broker.MessageBroker;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.Message;
import io.agentrelay.model.PartialProgress;
import io.agentrelay.model.Response;
import io.agentrelay.model.ResponseStatus;
import io.agentrelay.model.StepRecord;
import io.agentrelay.observability.OrchestratorMetrics;
import io.agentrelay.observability.WorkflowEventLogger;
import io.agentrelay.workflow.WorkflowCatalog;
import io.agentrelay.workflow.WorkflowDefinition;
import io.agentrelay.workflow.WorkflowLedger;
import io.agentrelay.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes messages to agents and runs multi-step workflows.
 *
 * <p>{@link #process} runs on the caller's thread with no deadline. {@link #processAsync} runs the
 * step sequence on a workflow thread and bounds it by a timeout; on expiry the run is cancelled by
 * interruption, its unwind is awaited, and the steps committed so far are reported as partial
 * progress.
 */
public final class Orchestrator implements Agent, AutoCloseable {
    public static final String WORKFLOW_MESSAGE_TYPE = "workflow";
    public static final String TOPIC_COMPLETED = "workflow.completed";
    public static final String TOPIC_FAILED = "workflow.failed";
    public static final String TOPIC_TIMED_OUT = "workflow.timed_out";
    public static final String TOPIC_STEP_COMPLETED = "workflow.step_completed";
    public static final String REASON_CANCEL_UNWIND_OVERRUN = "cancel_unwind_overrun";

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final AgentRelayConfig config;
    private final AgentRegistry agentRegistry;
    private final WorkflowCatalog workflowCatalog;
    private final MessageBroker broker;
    private final WorkflowEventLogger eventLogger;
    private final OrchestratorMetrics metrics;
    private final PartialProgressExtractor progressExtractor;
    private final Map<String, String> routingRules;
    private final ExecutorService workflowExecutor;

    public Orchestrator(AgentRelayConfig config, MessageBroker broker) {
        this(
                config,
                new AgentRegistry(),
                WorkflowCatalog.withDefaults(),
                broker,
                new WorkflowEventLogger(config.eventLogFile()),
                new OrchestratorMetrics()
        );
    }

    public Orchestrator(
            AgentRelayConfig config,
            AgentRegistry agentRegistry,
            WorkflowCatalog workflowCatalog,
            MessageBroker broker,
            WorkflowEventLogger eventLogger,
            OrchestratorMetrics metrics
    ) {
        this(config, agentRegistry, workflowCatalog, broker, eventLogger, metrics,
                Executors.newCachedThreadPool(workflowThreadFactory()));
    }

    Orchestrator(
            AgentRelayConfig config,
            AgentRegistry agentRegistry,
            WorkflowCatalog workflowCatalog,
            MessageBroker broker,
            WorkflowEventLogger eventLogger,
            OrchestratorMetrics metrics,
            ExecutorService workflowExecutor
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry");
        this.workflowCatalog = Objects.requireNonNull(workflowCatalog, "workflowCatalog");
        this.broker = broker;
        this.eventLogger = Objects.requireNonNull(eventLogger, "eventLogger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.progressExtractor = new PartialProgressExtractor();
        this.routingRules = new ConcurrentHashMap<>(defaultRoutingRules());
        this.routingRules.putAll(config.routingRules());
        this.workflowExecutor = Objects.requireNonNull(workflowExecutor, "workflowExecutor");
    }

    public static Map<String, String> defaultRoutingRules() {
        Map<String, String> rules = new LinkedHashMap<>();
        rules.put("generate_plan", "project_plan_agent");
        rules.put("update_plan", "project_plan_agent");
        rules.put("assess_risks", "risk_assessment_agent");
        rules.put("update_risk", "risk_assessment_agent");
        rules.put("generate_report", "status_reporter_agent");
        rules.put("schedule_report", "status_reporter_agent");
        rules.put("generate_roadmap", "roadmapping_agent");
        rules.put("track_kpi_progress", "roadmapping_agent");
        return Collections.unmodifiableMap(rules);
    }

    @Override
    public String id() {
        return config.orchestratorAgentId();
    }

    public void registerAgent(Agent agent) {
        agentRegistry.register(agent);
        log.info("Registered agent: {}", agent.id());
    }

    public void addRoutingRule(String messageType, String agentId) {
        if (messageType == null || messageType.isBlank()) {
            throw new IllegalArgumentException("message type cannot be empty");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        routingRules.put(messageType.trim(), agentId.trim());
    }

    public void registerWorkflow(WorkflowDefinition definition) {
        workflowCatalog.register(definition);
        log.info("Registered workflow: {} {}", definition.type(), definition.stepNames());
    }

    public Map<String, String> routingRules() {
        return Collections.unmodifiableMap(new TreeMap<>(routingRules));
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public WorkflowCatalog workflowCatalog() {
        return workflowCatalog;
    }

    public OrchestratorMetrics metrics() {
        return metrics;
    }

    @Override
    public Response process(Message message) {
        if (message == null || !message.isWellFormed()) {
            return Response.error(id(), "Invalid message format");
        }
        WorkflowRequest request = resolveWorkflow(message);
        if (request == null) {
            return route(message);
        }
        try {
            return runWorkflow(request).toResponse(id());
        } catch (NoSuchWorkflowException | NoSuchAgentException e) {
            return rejected(request, e);
        } catch (RuntimeException e) {
            log.error("Error processing message {}", message.type(), e);
            return Response.error(id(), "Error processing message: " + e.getMessage());
        }
    }

    public Response processAsync(Message message) {
        return processAsync(message, config.defaultTimeoutSeconds());
    }

    /**
     * @throws InvalidTimeoutException if {@code timeoutSeconds} is negative, NaN or infinite; no
     *                                 work is started in that case
     */
    public Response processAsync(Message message, double timeoutSeconds) {
        validateTimeout(timeoutSeconds);
        if (message == null || !message.isWellFormed()) {
            return Response.error(id(), "Invalid message format");
        }
        WorkflowRequest request = resolveWorkflow(message);
        if (request == null) {
            return route(message);
        }
        try {
            return runWorkflowAsync(request, timeoutSeconds).toResponse(id());
        } catch (NoSuchWorkflowException | NoSuchAgentException e) {
            return rejected(request, e);
        } catch (RuntimeException e) {
            log.error("Error processing message {}", message.type(), e);
            return Response.error(id(), "Error processing message: " + e.getMessage());
        }
    }

    /**
     * Runs a workflow on the calling thread.
     *
     * @throws NoSuchWorkflowException if the type is not registered
     * @throws NoSuchAgentException    if a step names an unregistered agent
     */
    public WorkflowOutcome runWorkflow(String workflowType, Map<String, Object> data) {
        return runWorkflow(new WorkflowRequest(workflowType, workflowType, data));
    }

    /**
     * Runs a workflow bounded by {@code timeoutSeconds}.
     *
     * @throws InvalidTimeoutException if the timeout is negative, NaN or infinite
     * @throws NoSuchWorkflowException if the type is not registered
     * @throws NoSuchAgentException    if a step names an unregistered agent
     */
    public WorkflowOutcome runWorkflowAsync(String workflowType, Map<String, Object> data, double timeoutSeconds) {
        validateTimeout(timeoutSeconds);
        return runWorkflowAsync(new WorkflowRequest(workflowType, workflowType, data), timeoutSeconds);
    }

    @Override
    public void close() {
        workflowExecutor.shutdown();
        try {
            if (!workflowExecutor.awaitTermination(config.cancelGraceMillis(), TimeUnit.MILLISECONDS)) {
                workflowExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workflowExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private WorkflowOutcome runWorkflow(WorkflowRequest request) {
        RunPlan plan = prepare(request, null);
        log.info("Starting workflow: {}", plan.workflowType());
        metrics.runStarted();
        WorkflowLedger ledger = new WorkflowLedger();
        WorkflowOutcome outcome;
        try {
            outcome = executeSteps(plan, ledger, new AtomicBoolean(false));
            if (outcome == null) {
                outcome = failed(plan, ledger.snapshot(), null, "Workflow run interrupted", null);
            }
        } catch (RuntimeException e) {
            outcome = failed(plan, ledger.snapshot(), null, "Workflow run failed: " + e.getMessage(), e);
        }
        return finish(outcome);
    }

    private WorkflowOutcome runWorkflowAsync(WorkflowRequest request, double timeoutSeconds) {
        RunPlan plan = prepare(request, timeoutSeconds);
        if (timeoutSeconds < config.shortTimeoutWarningSeconds()) {
            eventLogger.shortTimeout(plan.workflowType(), plan.messageType(), timeoutSeconds, config.shortTimeoutWarningSeconds());
            metrics.shortTimeoutWarned();
        }
        log.info("Starting workflow: {} (timeout={}s)", plan.workflowType(), timeoutSeconds);

        WorkflowLedger ledger = new WorkflowLedger();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicBoolean started = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        metrics.runStarted();

        Future<WorkflowOutcome> future;
        try {
            future = workflowExecutor.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return executeSteps(plan, ledger, cancelled);
                } finally {
                    finished.countDown();
                }
            });
        } catch (RejectedExecutionException e) {
            return finish(failed(plan, List.of(), null, "Orchestrator is shut down", e));
        }

        try {
            WorkflowOutcome outcome = future.get(toNanos(timeoutSeconds), TimeUnit.NANOSECONDS);
            if (outcome == null) {
                outcome = failed(plan, ledger.snapshot(), null, "Workflow run interrupted", null);
            }
            return finish(outcome);
        } catch (TimeoutException e) {
            if (!cancel(plan, future, cancelled, started, finished)) {
                WorkflowOutcome completed = completedBeforeCancel(plan, ledger, future);
                if (completed != null) {
                    return finish(completed);
                }
            }
            List<StepRecord> committed = ledger.seal();
            PartialProgress progress = progressExtractor.extract(committed, timeoutSeconds);
            return finish(WorkflowOutcome.timedOut(plan.workflowType(), plan.messageType(), committed, progress));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return finish(failed(plan, ledger.seal(), null, "Workflow run failed: " + cause.getMessage(), cause));
        } catch (InterruptedException e) {
            cancel(plan, future, cancelled, started, finished);
            Thread.currentThread().interrupt();
            return finish(failed(plan, ledger.seal(), null, "Interrupted while waiting for workflow", e));
        }
    }

    /**
     * Returns {@code false} when the run had already completed and could not be cancelled.
     */
    private boolean cancel(
            RunPlan plan,
            Future<WorkflowOutcome> future,
            AtomicBoolean cancelled,
            AtomicBoolean started,
            CountDownLatch finished
    ) {
        cancelled.set(true);
        if (!future.cancel(true) && future.isDone()) {
            return false;
        }
        if (started.compareAndSet(false, true)) {
            return true;
        }
        boolean interrupted = false;
        try {
            if (!finished.await(config.cancelGraceMillis(), TimeUnit.MILLISECONDS)) {
                log.warn(
                        "Workflow {} did not unwind within {} ms after cancellation, reason={}",
                        plan.workflowType(), config.cancelGraceMillis(), REASON_CANCEL_UNWIND_OVERRUN
                );
            }
        } catch (InterruptedException e) {
            interrupted = true;
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return true;
    }

    private WorkflowOutcome completedBeforeCancel(RunPlan plan, WorkflowLedger ledger, Future<WorkflowOutcome> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failed(plan, ledger.seal(), null, "Workflow run failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Runs the bound steps in order. Returns {@code null} when the run was cancelled; nothing is
     * committed after cancellation.
     */
    private WorkflowOutcome executeSteps(RunPlan plan, WorkflowLedger ledger, AtomicBoolean cancelled) {
        Map<String, Map<String, Object>> accumulated = new LinkedHashMap<>();
        for (BoundStep bound : plan.steps()) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                return null;
            }
            WorkflowStep step = bound.step();
            Map<String, Object> input;
            try {
                input = step.inputMapping().map(Collections.unmodifiableMap(accumulated), plan.input());
            } catch (RuntimeException e) {
                return failed(plan, ledger.snapshot(), bound, "Input mapping failed for step " + step.name() + ": " + e.getMessage(), e);
            }

            log.debug("Running step {} of workflow {} on {}", step.name(), plan.workflowType(), step.agentId());
            long startedAt = System.nanoTime();
            Response response;
            try {
                response = bound.agent().process(Message.of(step.name(), input));
            } catch (InterruptedException e) {
                metrics.agentInvoked(step.agentId(), false, System.nanoTime() - startedAt);
                if (cancelled.get()) {
                    return null;
                }
                Thread.currentThread().interrupt();
                return failed(plan, ledger.snapshot(), bound, "Agent " + step.agentId() + " was interrupted", e);
            } catch (Exception e) {
                metrics.agentInvoked(step.agentId(), false, System.nanoTime() - startedAt);
                if (cancelled.get()) {
                    return null;
                }
                return failed(plan, ledger.snapshot(), bound, describe(e), e);
            }

            boolean accepted = response != null
                    && (response.status() == ResponseStatus.SUCCESS || response.status() == ResponseStatus.PENDING);
            metrics.agentInvoked(step.agentId(), accepted, System.nanoTime() - startedAt);
            if (cancelled.get()) {
                return null;
            }
            if (!accepted) {
                return failed(plan, ledger.snapshot(), bound, rejectionMessage(step, response), null);
            }

            StepRecord record = new StepRecord(step.name(), response.status(), response.data());
            if (!ledger.append(record)) {
                return null;
            }
            accumulated.put(step.name(), response.data() == null ? Map.of() : response.data());
            publishStep(plan, record);
        }
        return WorkflowOutcome.completed(plan.workflowType(), plan.messageType(), ledger.snapshot(), plan.timeoutSeconds());
    }

    private WorkflowOutcome finish(WorkflowOutcome outcome) {
        List<String> completed = outcome.completedStepNames();
        switch (outcome.state()) {
            case COMPLETED -> {
                metrics.runFinished(OrchestratorMetrics.OUTCOME_COMPLETED);
                log.info("Completed workflow: {} steps={}", outcome.workflowType(), completed);
            }
            case FAILED -> {
                metrics.runFinished(OrchestratorMetrics.OUTCOME_FAILED);
                eventLogger.workflowError(
                        outcome.workflowType(),
                        outcome.messageType(),
                        outcome.timeoutSeconds(),
                        completed,
                        outcome.failedStep(),
                        outcome.error()
                );
            }
            case TIMED_OUT -> {
                metrics.runFinished(OrchestratorMetrics.OUTCOME_TIMED_OUT);
                metrics.workflowTimedOut(outcome.workflowType());
                eventLogger.workflowTimeout(
                        outcome.workflowType(),
                        outcome.messageType(),
                        outcome.timeoutSeconds(),
                        completed
                );
            }
            default -> throw new IllegalStateException("Unexpected workflow state: " + outcome.state());
        }
        publishOutcome(outcome);
        return outcome;
    }

    private void publishOutcome(WorkflowOutcome outcome) {
        if (broker == null) {
            return;
        }
        String topic = switch (outcome.state()) {
            case COMPLETED -> TOPIC_COMPLETED;
            case FAILED -> TOPIC_FAILED;
            case TIMED_OUT -> TOPIC_TIMED_OUT;
            default -> throw new IllegalStateException("Unexpected workflow state: " + outcome.state());
        };
        List<String> completed = outcome.completedStepNames();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflow_type", outcome.workflowType());
        data.put("message_type", outcome.messageType());
        data.put("state", outcome.state().name().toLowerCase(Locale.ROOT));
        data.put("completed_steps", completed);
        data.put("total_steps_completed", completed.size());
        if (outcome.timeoutSeconds() != null) {
            data.put("timeout_seconds", outcome.timeoutSeconds());
        }
        safePublish(topic, data);
    }

    private void publishStep(RunPlan plan, StepRecord record) {
        if (broker == null || !config.publishStepEvents()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflow_type", plan.workflowType());
        data.put("step", record.step());
        data.put("status", record.status().wireName());
        safePublish(TOPIC_STEP_COMPLETED, data);
    }

    private void safePublish(String topic, Map<String, Object> data) {
        try {
            broker.publish(topic, Message.of(topic, data));
        } catch (BrokerSaturatedException e) {
            metrics.publicationDropped();
            log.warn("Dropped {} publication, broker saturated (capacity={})", topic, e.capacity());
        } catch (IllegalStateException e) {
            metrics.publicationDropped();
            log.warn("Dropped {} publication: {}", topic, e.getMessage());
        }
    }

    private Response route(Message message) {
        String agentId;
        Agent agent;
        try {
            String resolved = resolveAgentId(message.type());
            agent = agentRegistry.findById(resolved).orElseThrow(() -> NoSuchAgentException.notRegistered(resolved));
            agentId = resolved;
        } catch (NoSuchAgentException e) {
            log.warn("{}", e.getMessage());
            return Response.error(id(), e.getMessage());
        }

        log.info("Routing message {} to agent {}", message.type(), agentId);
        long startedAt = System.nanoTime();
        boolean success = false;
        try {
            Response response = agent.process(message);
            if (response == null) {
                return Response.error(agentId, "Agent " + agentId + " returned no response");
            }
            success = response.isSuccess();
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.error(id(), "Interrupted while routing to agent " + agentId);
        } catch (Exception e) {
            AgentFailureException failure = new AgentFailureException(null, agentId, describe(e), e);
            log.error("Agent {} failed on {}", agentId, message.type(), failure);
            return Response.error(id(), failure.getMessage());
        } finally {
            metrics.agentInvoked(agentId, success, System.nanoTime() - startedAt);
        }
    }

    private String resolveAgentId(String messageType) {
        String agentId = routingRules.get(messageType);
        if (agentId != null) {
            return agentId;
        }
        if (agentRegistry.contains(messageType)) {
            return messageType;
        }
        throw NoSuchAgentException.forMessageType(messageType);
    }

    private WorkflowRequest resolveWorkflow(Message message) {
        if (WORKFLOW_MESSAGE_TYPE.equals(message.type())) {
            Object rawType = message.data().get("workflow_type");
            String workflowType = rawType == null ? "" : String.valueOf(rawType).trim();
            return new WorkflowRequest(workflowType, message.type(), asMap(message.data().get("data")));
        }
        if (workflowCatalog.contains(message.type())) {
            return new WorkflowRequest(message.type(), message.type(), message.data());
        }
        return null;
    }

    private RunPlan prepare(WorkflowRequest request, Double timeoutSeconds) {
        WorkflowDefinition definition = workflowCatalog.find(request.workflowType())
                .orElseThrow(() -> new NoSuchWorkflowException(request.workflowType()));
        List<BoundStep> bound = new ArrayList<>(definition.steps().size());
        for (WorkflowStep step : definition.steps()) {
            Agent agent = agentRegistry.findById(step.agentId())
                    .orElseThrow(() -> NoSuchAgentException.forStep(definition.type(), step.name(), step.agentId()));
            bound.add(new BoundStep(step, agent));
        }
        return new RunPlan(definition.type(), request.messageType(), request.data(), List.copyOf(bound), timeoutSeconds);
    }

    private Response rejected(WorkflowRequest request, IllegalArgumentException error) {
        metrics.runRejected();
        log.warn("Rejected workflow {}: {}", request.workflowType(), error.getMessage());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflow_type", request.workflowType());
        data.put("steps", List.of());
        return Response.error(id(), data, error.getMessage());
    }

    private WorkflowOutcome failed(RunPlan plan, List<StepRecord> committed, BoundStep bound, String message, Throwable cause) {
        String stepName = bound == null ? null : bound.step().name();
        String agentId = bound == null ? null : bound.step().agentId();
        AgentFailureException failure = new AgentFailureException(stepName, agentId, message, cause);
        if (cause != null) {
            log.debug("Workflow {} failed at step {}", plan.workflowType(), stepName, cause);
        }
        return WorkflowOutcome.failed(plan.workflowType(), plan.messageType(), committed, stepName, failure, plan.timeoutSeconds());
    }

    private static String rejectionMessage(WorkflowStep step, Response response) {
        if (response == null) {
            return "Agent " + step.agentId() + " returned no response for step " + step.name();
        }
        if (response.status() == ResponseStatus.TIMEOUT) {
            return "Agent " + step.agentId() + " reported a timeout for step " + step.name();
        }
        if (response.error() != null && !response.error().isBlank()) {
            return response.error();
        }
        return "Agent " + step.agentId() + " failed step " + step.name();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static Map<String, Object> asMap(Object raw) {
        if (raw instanceof Map<?, ?>) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) raw).entrySet()) {
                out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        return Map.of();
    }

    static void validateTimeout(double timeoutSeconds) {
        if (Double.isNaN(timeoutSeconds) || Double.isInfinite(timeoutSeconds) || timeoutSeconds < 0.0) {
            throw new InvalidTimeoutException(timeoutSeconds);
        }
    }

    private static long toNanos(double seconds) {
        double nanos = seconds * 1_000_000_000.0;
        return nanos >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) nanos;
    }

    private static ThreadFactory workflowThreadFactory() {
        AtomicLong seq = new AtomicLong(0L);
        return runnable -> {
            Thread thread = new Thread(runnable, "agentrelay-workflow-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record WorkflowRequest(String workflowType, String messageType, Map<String, Object> data) {
        private WorkflowRequest {
            data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    private record BoundStep(WorkflowStep step, Agent agent) {
    }

    private record RunPlan(
            String workflowType,
            String messageType,
            Map<String, Object> input,
            List<BoundStep> steps,
            Double timeoutSeconds
    ) {
    }
}
