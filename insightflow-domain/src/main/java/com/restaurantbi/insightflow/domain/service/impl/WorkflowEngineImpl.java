package com.restaurantbi.insightflow.domain.service.impl;

import com.restaurantbi.insightflow.domain.batch.BatchStore;
import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.event.Event;
import com.restaurantbi.insightflow.domain.event.EventPublisher;
import com.restaurantbi.insightflow.domain.exception.ConflictException;
import com.restaurantbi.insightflow.domain.exception.RunNotFoundException;
import com.restaurantbi.insightflow.domain.executor.CancellationSignal;
import com.restaurantbi.insightflow.domain.executor.TaskContext;
import com.restaurantbi.insightflow.domain.executor.TaskExecutorRegistry;
import com.restaurantbi.insightflow.domain.executor.TaskResult;
import com.restaurantbi.insightflow.domain.executor.TaskTimeoutException;
import com.restaurantbi.insightflow.domain.output.TaskOutputStore;
import com.restaurantbi.insightflow.domain.pipeline.PipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.retry.FailureClassifier;
import com.restaurantbi.insightflow.domain.retry.RetryDecision;
import com.restaurantbi.insightflow.domain.retry.RetryPolicy;
import com.restaurantbi.insightflow.domain.run.AdmissionTable;
import com.restaurantbi.insightflow.domain.run.RunState;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.TaskInstance;
import com.restaurantbi.insightflow.domain.run.TaskState;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.service.EngineSettings;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import com.restaurantbi.insightflow.domain.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * WorkflowEngineImpl - 基于线程池的工作流引擎
 * <p>
 * 1. 准入: AdmissionTable 比较并交换，同一逻辑键至多一个活动运行。
 * 2. 调度: 依赖全部 SUCCEEDED 的任务提交到工作线程池，互不依赖的任务并行执行。
 * 3. 完成回调: 在运行锁内重新评估该运行；过期尝试（已超时或已被取代）的回调被忽略。
 * 4. 重试与超时: 由定时线程池驱动，引擎线程从不阻塞等待任务。
 * </p>
 * <p>
 * 每个运行的状态只在其 RunContext 锁内修改，事件在锁内按序号发布，因此同一运行的事件保持因果顺序。
 * </p>
 */
@Slf4j
public class WorkflowEngineImpl implements WorkflowEngine {

    private final PipelineCatalog catalog;
    private final TaskExecutorRegistry executorRegistry;
    private final RetryPolicy retryPolicy;
    private final AdmissionTable admissionTable;
    private final WorkflowRunRepository runRepository;
    private final BatchStore batchStore;
    private final TaskOutputStore outputStore;
    private final EventPublisher eventPublisher;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService timer;
    private final EngineSettings settings;
    private final Clock clock;

    private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();

    public WorkflowEngineImpl(PipelineCatalog catalog,
                              TaskExecutorRegistry executorRegistry,
                              RetryPolicy retryPolicy,
                              AdmissionTable admissionTable,
                              WorkflowRunRepository runRepository,
                              BatchStore batchStore,
                              TaskOutputStore outputStore,
                              EventPublisher eventPublisher,
                              ExecutorService workerPool,
                              ScheduledExecutorService timer,
                              EngineSettings settings,
                              Clock clock) {
        this.catalog = catalog;
        this.executorRegistry = executorRegistry;
        this.retryPolicy = retryPolicy;
        this.admissionTable = admissionTable;
        this.runRepository = runRepository;
        this.batchStore = batchStore;
        this.outputStore = outputStore;
        this.eventPublisher = eventPublisher;
        this.workerPool = workerPool;
        this.timer = timer;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String submit(String pipelineId, String logicalKey) {
        return submit(pipelineId, logicalKey, RunTrigger.MANUAL);
    }

    @Override
    public String enqueueRetraining(String pipelineId, String modelId, String logicalKey) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Retraining requires a model id");
        }
        return admit(pipelineId, logicalKey, RunTrigger.RETRAINING, modelId);
    }

    @Override
    public String submit(String pipelineId, String logicalKey, RunTrigger trigger) {
        return admit(pipelineId, logicalKey, trigger, null);
    }

    private String admit(String pipelineId, String logicalKey, RunTrigger trigger, String targetModelId) {
        if (logicalKey == null || logicalKey.isBlank()) {
            throw new IllegalArgumentException("Logical key cannot be empty");
        }
        PipelineDefinition definition = catalog.get(pipelineId);
        WorkflowRun run = WorkflowRun.create(definition, logicalKey, trigger, now());
        run.setTargetModelId(targetModelId);

        Optional<String> holder = admissionTable.tryAdmit(pipelineId, logicalKey, run.getRunId());
        if (holder.isPresent()) {
            log.warn("Rejected {} trigger for pipeline [{}] key [{}]: run [{}] is active",
                    trigger, pipelineId, logicalKey, holder.get());
            throw new ConflictException(pipelineId, logicalKey, holder.get());
        }

        RunContext ctx = new RunContext(definition, run);
        activeRuns.put(run.getRunId(), ctx);
        synchronized (ctx) {
            try {
                persist(ctx);
                emitRun(ctx);
                run.setState(RunState.RUNNING);
                run.setStartedAt(now());
                persist(ctx);
                emitRun(ctx);
                log.info("Run [{}] admitted for pipeline [{}] key [{}] ({})",
                        run.getRunId(), pipelineId, logicalKey, trigger);
                scheduleRunTimeout(ctx);
                dispatchReady(ctx);
            } catch (RuntimeException e) {
                log.error("Failed to start run [{}]", run.getRunId(), e);
                terminate(ctx, RunState.FAILED, "Engine error: " + e.getMessage());
            }
        }
        return run.getRunId();
    }

    @Override
    public boolean cancel(String runId, String reason) {
        RunContext ctx = activeRuns.get(runId);
        if (ctx == null) {
            if (runRepository.findById(runId).isPresent()) {
                return false;
            }
            throw new RunNotFoundException(runId);
        }
        synchronized (ctx) {
            if (ctx.run.isTerminal()) {
                return false;
            }
            log.info("Cancelling run [{}]: {}", runId, reason);
            terminate(ctx, RunState.FAILED, "Cancelled: " + reason);
            return true;
        }
    }

    @Override
    public Optional<WorkflowRun> findRun(String runId) {
        RunContext ctx = activeRuns.get(runId);
        if (ctx != null) {
            synchronized (ctx) {
                return Optional.of(ctx.run.copy());
            }
        }
        return runRepository.findById(runId);
    }

    @Override
    public CompletableFuture<WorkflowRun> completion(String runId) {
        RunContext ctx = activeRuns.get(runId);
        if (ctx != null) {
            return ctx.completion;
        }
        WorkflowRun run = runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (!run.isTerminal()) {
            throw new IllegalStateException("Run [" + runId + "] is not terminal but is not owned by this engine");
        }
        return CompletableFuture.completedFuture(run);
    }

    @Override
    public List<WorkflowRun> activeRuns() {
        List<WorkflowRun> runs = new ArrayList<>();
        for (RunContext ctx : activeRuns.values()) {
            synchronized (ctx) {
                runs.add(ctx.run.copy());
            }
        }
        return runs;
    }

    // ---------------------------------------------------------------- scheduling

    /**
     * 启动所有依赖已满足的 PENDING 任务，然后检查运行是否完成。调用方持有运行锁。
     */
    private void dispatchReady(RunContext ctx) {
        for (TaskSpec spec : ctx.definition.getTasks()) {
            if (ctx.run.isTerminal()) {
                return;
            }
            TaskInstance instance = ctx.run.task(spec.getId());
            if (instance.getState() == TaskState.PENDING && dependenciesSucceeded(ctx, spec)) {
                startAttempt(ctx, spec);
            }
        }
        checkCompletion(ctx);
    }

    private boolean dependenciesSucceeded(RunContext ctx, TaskSpec spec) {
        for (String dependency : spec.getDependsOn()) {
            if (ctx.run.task(dependency).getState() != TaskState.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    private void startAttempt(RunContext ctx, TaskSpec spec) {
        WorkflowRun run = ctx.run;
        TaskInstance instance = run.task(spec.getId());
        instance.setAttempt(instance.getAttempt() + 1);
        instance.setState(TaskState.RUNNING);
        if (instance.getStartedAt() == null) {
            instance.setStartedAt(now());
        }
        instance.setInputRef(run.getBatchHandle());
        persist(ctx);
        emitTask(ctx, instance, Map.of("attempt", instance.getAttempt()));

        DataBatch input = run.getBatchHandle() == null ? null : batchStore.get(run.getBatchHandle()).orElse(null);
        Attempt attempt = new Attempt(instance.getAttempt());
        TaskContext context = TaskContext.builder()
                .runId(run.getRunId())
                .pipelineId(run.getPipelineId())
                .logicalKey(run.getLogicalKey())
                .taskId(spec.getId())
                .kind(spec.getKind())
                .attempt(attempt.number)
                .input(input)
                .spec(spec)
                .targetModelId(run.getTargetModelId())
                .cancellation(attempt.signal)
                .build();
        ctx.inFlight.put(spec.getId(), attempt);

        log.info("Starting task [{}] attempt {} of run [{}]", spec.getId(), attempt.number, run.getRunId());
        try {
            attempt.future = workerPool.submit(() -> runAttempt(ctx, spec, context, attempt.number));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected task [{}] of run [{}]", spec.getId(), run.getRunId(), e);
            ctx.inFlight.remove(spec.getId());
            terminate(ctx, RunState.FAILED, "Worker pool rejected task [" + spec.getId() + "]");
            return;
        }
        Duration timeout = spec.getTimeout() != null ? spec.getTimeout() : settings.getDefaultTaskTimeout();
        attempt.timeout = timer.schedule(() -> onAttemptTimeout(ctx, spec, attempt.number, timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 工作线程中执行，不持有运行锁
     */
    private void runAttempt(RunContext ctx, TaskSpec spec, TaskContext context, int attemptNumber) {
        TaskResult result;
        try {
            result = executorRegistry.get(spec.getKind()).execute(context);
        } catch (Exception e) {
            onAttemptFinished(ctx, spec, attemptNumber, null, e);
            return;
        }
        onAttemptFinished(ctx, spec, attemptNumber, result, null);
    }

    private void onAttemptFinished(RunContext ctx, TaskSpec spec, int attemptNumber, TaskResult result, Exception error) {
        synchronized (ctx) {
            try {
                Attempt current = ctx.inFlight.get(spec.getId());
                if (ctx.run.isTerminal() || current == null || current.number != attemptNumber) {
                    log.debug("Ignoring stale completion of task [{}] attempt {} in run [{}]",
                            spec.getId(), attemptNumber, ctx.run.getRunId());
                    return;
                }
                ctx.inFlight.remove(spec.getId());
                cancelQuietly(current.timeout);
                if (error == null) {
                    handleSuccess(ctx, spec, attemptNumber, result);
                } else {
                    handleFailure(ctx, spec, attemptNumber, error);
                }
                dispatchReady(ctx);
            } catch (RuntimeException e) {
                log.error("Failed to process completion of task [{}] in run [{}]", spec.getId(), ctx.run.getRunId(), e);
                terminate(ctx, RunState.FAILED, "Engine error: " + e.getMessage());
            }
        }
    }

    private void onAttemptTimeout(RunContext ctx, TaskSpec spec, int attemptNumber, Duration timeout) {
        synchronized (ctx) {
            try {
                Attempt current = ctx.inFlight.get(spec.getId());
                if (ctx.run.isTerminal() || current == null || current.number != attemptNumber) {
                    return;
                }
                ctx.inFlight.remove(spec.getId());
                current.cancel("timeout after " + timeout);
                handleFailure(ctx, spec, attemptNumber, new TaskTimeoutException(spec.getId(), attemptNumber, timeout));
                dispatchReady(ctx);
            } catch (RuntimeException e) {
                log.error("Failed to process timeout of task [{}] in run [{}]", spec.getId(), ctx.run.getRunId(), e);
                terminate(ctx, RunState.FAILED, "Engine error: " + e.getMessage());
            }
        }
    }

    private void onRetryDue(RunContext ctx, TaskSpec spec) {
        synchronized (ctx) {
            try {
                ctx.retryTimers.remove(spec.getId());
                if (ctx.run.isTerminal() || ctx.run.task(spec.getId()).getState() != TaskState.RETRY_WAIT) {
                    return;
                }
                startAttempt(ctx, spec);
            } catch (RuntimeException e) {
                log.error("Failed to retry task [{}] in run [{}]", spec.getId(), ctx.run.getRunId(), e);
                terminate(ctx, RunState.FAILED, "Engine error: " + e.getMessage());
            }
        }
    }

    private void onRunTimeout(RunContext ctx, Duration budget) {
        synchronized (ctx) {
            if (ctx.run.isTerminal()) {
                return;
            }
            log.error("Run [{}] exceeded its time budget of {}", ctx.run.getRunId(), budget);
            terminate(ctx, RunState.FAILED, "Run timed out after " + budget);
        }
    }

    // ---------------------------------------------------------------- outcomes

    private void handleSuccess(RunContext ctx, TaskSpec spec, int attemptNumber, TaskResult result) {
        WorkflowRun run = ctx.run;
        TaskInstance instance = run.task(spec.getId());
        Object output = result.getOutput();

        String outputRef = outputStore.write(run.getRunId(), spec.getId(), attemptNumber, output);
        outputStore.markAuthoritative(run.getRunId(), spec.getId(), attemptNumber);
        instance.setOutputRef(outputRef);
        if (spec.getKind() == TaskKind.INGEST && output instanceof DataBatch) {
            run.setBatchHandle(batchStore.put((DataBatch) output));
        }

        instance.setState(TaskState.SUCCEEDED);
        instance.setFinishedAt(now());
        instance.setLastError(null);
        persist(ctx);

        Map<String, Object> payload = new HashMap<>();
        payload.put("attempt", attemptNumber);
        payload.put("outputRef", outputRef);
        payload.put("modelId", spec.modelId(run.getTargetModelId()));
        payload.put("metrics", result.getMetrics());
        emitTask(ctx, instance, payload);
        log.info("Task [{}] of run [{}] succeeded on attempt {}", spec.getId(), run.getRunId(), attemptNumber);

        if (output instanceof ValidationResult && !((ValidationResult) output).isPassed()) {
            ValidationResult validation = (ValidationResult) output;
            terminate(ctx, RunState.BLOCKED, "Validation [" + validation.getId() + "] rejected batch with "
                    + validation.getViolationCount() + " violations");
        }
    }

    private void handleFailure(RunContext ctx, TaskSpec spec, int attemptNumber, Throwable error) {
        WorkflowRun run = ctx.run;
        TaskInstance instance = run.task(spec.getId());
        Instant firstFailureAt = instance.getFirstFailureAt();
        RetryDecision decision = retryPolicy.nextAction(spec.getKind(), spec.getRetry(), attemptNumber, error, firstFailureAt);
        if (firstFailureAt == null) {
            instance.setFirstFailureAt(now());
        }
        instance.setLastError(describe(error));

        if (decision.isRetry()) {
            instance.setState(TaskState.RETRY_WAIT);
            persist(ctx);
            Map<String, Object> payload = new HashMap<>();
            payload.put("attempt", attemptNumber);
            payload.put("delayMillis", decision.getDelay().toMillis());
            payload.put("error", instance.getLastError());
            emitTask(ctx, instance, payload);
            log.warn("Task [{}] of run [{}] failed on attempt {}, retrying in {}: {}",
                    spec.getId(), run.getRunId(), attemptNumber, decision.getDelay(), instance.getLastError());
            ctx.retryTimers.put(spec.getId(), timer.schedule(() -> onRetryDue(ctx, spec),
                    decision.getDelay().toMillis(), TimeUnit.MILLISECONDS));
            return;
        }

        instance.setState(TaskState.FAILED);
        instance.setFinishedAt(now());
        persist(ctx);
        emitTask(ctx, instance, Map.of("attempt", attemptNumber, "error", decision.getReason()));
        log.error("Task [{}] of run [{}] abandoned: {}", spec.getId(), run.getRunId(), decision.getReason());

        if (spec.isOptional()) {
            skipDependents(ctx, spec.getId());
        } else {
            terminate(ctx, RunState.FAILED, "Task [" + spec.getId() + "] failed: " + decision.getReason());
        }
    }

    /**
     * 可选任务失败后，传递地将其下游标记为 SKIPPED
     */
    private void skipDependents(RunContext ctx, String taskId) {
        Deque<String> queue = new ArrayDeque<>();
        queue.add(taskId);
        while (!queue.isEmpty()) {
            for (TaskSpec dependent : ctx.definition.dependentsOf(queue.poll())) {
                TaskInstance instance = ctx.run.task(dependent.getId());
                if (instance.getState() == TaskState.PENDING) {
                    instance.setState(TaskState.SKIPPED);
                    instance.setFinishedAt(now());
                    instance.setLastError("Upstream task [" + taskId + "] failed");
                    emitTask(ctx, instance, null);
                    queue.add(dependent.getId());
                }
            }
        }
        persist(ctx);
    }

    private void checkCompletion(RunContext ctx) {
        if (ctx.run.isTerminal()) {
            return;
        }
        for (TaskInstance instance : ctx.run.taskInstances()) {
            if (!instance.getState().isTerminal()) {
                return;
            }
        }
        terminate(ctx, RunState.SUCCEEDED, null);
    }

    /**
     * 将运行置为终态：取消进行中的尝试与定时器，未完成任务标记为 CANCELLED（BLOCKED 时未启动的任务标记为 SKIPPED），
     * 释放准入。调用方持有运行锁。
     */
    private void terminate(RunContext ctx, RunState state, String reason) {
        WorkflowRun run = ctx.run;
        if (run.isTerminal()) {
            return;
        }
        for (Map.Entry<String, Attempt> entry : ctx.inFlight.entrySet()) {
            entry.getValue().cancel(reason);
        }
        ctx.inFlight.clear();
        ctx.retryTimers.values().forEach(WorkflowEngineImpl::cancelQuietly);
        ctx.retryTimers.clear();
        cancelQuietly(ctx.runTimeout);

        for (TaskInstance instance : run.taskInstances()) {
            if (instance.getState().isTerminal()) {
                continue;
            }
            boolean neverStarted = instance.getState() == TaskState.PENDING;
            instance.setState(state == RunState.BLOCKED && neverStarted ? TaskState.SKIPPED : TaskState.CANCELLED);
            instance.setFinishedAt(now());
            emitTask(ctx, instance, null);
        }

        run.setState(state);
        run.setFinishedAt(now());
        run.setLastError(reason);
        persist(ctx);
        emitRun(ctx);

        admissionTable.release(run.getPipelineId(), run.getLogicalKey(), run.getRunId());
        activeRuns.remove(run.getRunId());
        if (state == RunState.SUCCEEDED) {
            log.info("Run [{}] of pipeline [{}] succeeded", run.getRunId(), run.getPipelineId());
        } else {
            log.warn("Run [{}] of pipeline [{}] ended {}: {}", run.getRunId(), run.getPipelineId(), state, reason);
        }
        ctx.completion.complete(run.copy());
    }

    private void scheduleRunTimeout(RunContext ctx) {
        Duration budget = runBudget(ctx.definition);
        ctx.runTimeout = timer.schedule(() -> onRunTimeout(ctx, budget), budget.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 运行级时间预算：定义中显式声明，否则为各任务 timeout × maxAttempts 与重试等待上限之和
     */
    Duration runBudget(PipelineDefinition definition) {
        if (definition.getRunTimeout() != null) {
            return definition.getRunTimeout();
        }
        Duration budget = Duration.ZERO;
        for (TaskSpec spec : definition.getTasks()) {
            Duration timeout = spec.getTimeout() != null ? spec.getTimeout() : settings.getDefaultTaskTimeout();
            int attempts = retryPolicy.maxAttempts(spec.getKind(), spec.getRetry());
            budget = budget.plus(timeout.multipliedBy(attempts)).plus(retryPolicy.maxTotalWait(spec.getRetry()));
        }
        return budget;
    }

    // ---------------------------------------------------------------- events & persistence

    private void emitRun(RunContext ctx) {
        WorkflowRun run = ctx.run;
        Map<String, Object> payload = new HashMap<>();
        payload.put("trigger", run.getTrigger().name());
        if (run.getLastError() != null) {
            payload.put("error", run.getLastError());
        }
        publish(ctx, Event.runType(run.getState()), null, payload);
    }

    private void emitTask(RunContext ctx, TaskInstance instance, Map<String, Object> payload) {
        publish(ctx, Event.taskType(instance.getState()), instance.getTaskId(), payload);
    }

    private void publish(RunContext ctx, String type, String taskId, Map<String, Object> payload) {
        WorkflowRun run = ctx.run;
        String source = "/pipelines/" + run.getPipelineId() + "/runs/" + run.getRunId()
                + (taskId == null ? "" : "/tasks/" + taskId);
        Event event = Event.builder()
                .type(type)
                .source(source)
                .time(now())
                .pipelineId(run.getPipelineId())
                .runId(run.getRunId())
                .logicalKey(run.getLogicalKey())
                .taskId(taskId)
                .sequence(run.nextSequence())
                .payload(payload == null ? new HashMap<>() : new HashMap<>(payload))
                .build();
        try {
            eventPublisher.publish(event);
        } catch (Exception e) {
            log.error("Failed to publish event {} for run [{}]", type, run.getRunId(), e);
        }
    }

    private void persist(RunContext ctx) {
        try {
            runRepository.save(ctx.run.copy());
        } catch (Exception e) {
            log.error("Failed to persist run [{}]", ctx.run.getRunId(), e);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static String describe(Throwable error) {
        Throwable cause = FailureClassifier.unwrap(error);
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static void cancelQuietly(Future<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * 运行的可变状态，所有访问都在该对象的锁内
     */
    private static final class RunContext {
        private final PipelineDefinition definition;
        private final WorkflowRun run;
        private final Map<String, Attempt> inFlight = new HashMap<>();
        private final Map<String, ScheduledFuture<?>> retryTimers = new HashMap<>();
        private final CompletableFuture<WorkflowRun> completion = new CompletableFuture<>();
        private ScheduledFuture<?> runTimeout;

        private RunContext(PipelineDefinition definition, WorkflowRun run) {
            this.definition = definition;
            this.run = run;
        }
    }

    /**
     * 一次进行中的尝试
     */
    private static final class Attempt {
        private final int number;
        private final CancellationSignal signal = new CancellationSignal();
        private Future<?> future;
        private ScheduledFuture<?> timeout;

        private Attempt(int number) {
            this.number = number;
        }

        private void cancel(String reason) {
            signal.cancel(reason);
            if (future != null) {
                future.cancel(true);
            }
            cancelQuietly(timeout);
        }
    }
}
