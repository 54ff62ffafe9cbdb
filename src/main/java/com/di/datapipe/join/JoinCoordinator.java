package com.di.datapipe.join;

import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.state.LoadStateStore;
import com.di.datapipe.state.TableLoadMarker;
import com.di.datapipe.util.JobIds;
import com.di.datapipe.util.MdcKeys;
import com.di.datapipe.util.MdcPropagation;
import com.di.datapipe.warehouse.LoadCompletionListener;
import com.di.datapipe.warehouse.QueryJobSpec;
import com.di.datapipe.warehouse.Warehouse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Gates each derived table on its dependencies' completion markers and runs the join query once
 * they are all COMPLETED.
 *
 * <h3>Evaluation of one join</h3>
 * <ol>
 *   <li>No task yet → create a PENDING task.</li>
 *   <li>Terminal task → replace it with a fresh PENDING task when a dependency's completed version
 *       moved past the versions it ran against, or when it FAILED more than {@code retryAfter}
 *       ago. Otherwise nothing to do.</li>
 *   <li>PENDING task → READY only when every dependency's marker is COMPLETED. A missing, running
 *       or failed dependency keeps it PENDING; past {@code staleAfter} that is reported once at WARN
 *       and always visible on the {@code datapipe.join.pending.seconds} gauge.</li>
 *   <li>READY → RUNNING: snapshot dependency versions, submit the query (destination replaced).</li>
 *   <li>RUNNING → COMPLETED or FAILED.</li>
 * </ol>
 *
 * Evaluation runs on load completion (asynchronously, off the loader's delivery) and on a periodic
 * sweep. Evaluations of the same join are serialised.
 */
@Slf4j
public class JoinCoordinator implements LoadCompletionListener {

    private final Map<String, JoinDefinition> definitions;
    private final LoadStateStore stateStore;
    private final Warehouse warehouse;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration staleAfter;
    private final Duration retryAfter;
    private final Executor executor;

    private final ConcurrentMap<String, JoinTask> current = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    public JoinCoordinator(List<JoinDefinition> definitions,
                           LoadStateStore stateStore,
                           Warehouse warehouse,
                           PipelineMetrics metrics,
                           Clock clock,
                           Duration staleAfter,
                           Duration retryAfter,
                           Executor executor) {
        Map<String, JoinDefinition> byName = new LinkedHashMap<>();
        for (JoinDefinition d : definitions) {
            String error = d.validationError();
            if (error != null) {
                throw new IllegalArgumentException("Invalid join definition: " + error);
            }
            if (byName.put(d.getName(), d) != null) {
                throw new IllegalArgumentException("Duplicate join name: " + d.getName());
            }
        }
        this.definitions = byName;
        this.stateStore = stateStore;
        this.warehouse = warehouse;
        this.metrics = metrics;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.retryAfter = retryAfter;
        this.executor = executor;
    }

    // ------------------------------------------------------------------
    // Triggers
    // ------------------------------------------------------------------

    @Override
    public void onLoadCompleted(TableLoadMarker marker) {
        for (JoinDefinition def : definitions.values()) {
            if (def.dependsOnTable(marker.getTable())) {
                log.debug("[JOIN] {} notified: {} v{}", def.getName(), marker.getTable(), marker.getVersion());
                executor.execute(MdcPropagation.wrapRunnable(() -> evaluate(def.getName())));
            }
        }
    }

    @Scheduled(fixedDelayString = "${datapipe.join.sweep-interval:PT1M}",
               initialDelayString = "${datapipe.join.sweep-interval:PT1M}")
    public void sweep() {
        evaluateAll();
    }

    public void evaluateAll() {
        for (String name : definitions.keySet()) {
            evaluate(name);
        }
    }

    /**
     * Evaluates one join and returns its current task afterwards.
     */
    public JoinTaskSnapshot evaluate(String name) {
        JoinDefinition def = definitions.get(name);
        if (def == null) {
            throw new IllegalArgumentException("Unknown join: " + name);
        }
        synchronized (locks.computeIfAbsent(name, n -> new Object())) {
            try (MDC.MDCCloseable j = MDC.putCloseable(MdcKeys.JOIN, name)) {
                return evaluateLocked(def).snapshot();
            }
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private JoinTask evaluateLocked(JoinDefinition def) {
        Map<String, Optional<TableLoadMarker>> markers = new LinkedHashMap<>();
        for (String table : def.dependencyTables()) {
            markers.put(table, stateStore.find(table));
        }

        JoinTask task = current.get(def.getName());
        if (task == null || needsFreshTask(task, markers)) {
            task = newTask(def, task);
        }
        if (task.getState() != JoinState.PENDING) {
            return task;
        }

        List<String> blocking = blockingDependencies(markers);
        if (!blocking.isEmpty()) {
            reportPending(def, task, blocking);
            return task;
        }

        task.transition(JoinState.PENDING, JoinState.READY);
        metrics.recordJoinTransition(def.getName(), JoinState.READY.name());
        metrics.setJoinPendingSince(def.getName(), 0);
        log.info("[JOIN] {} READY task={} dependencies={}", def.getName(), task.getId(), versionsOf(markers));

        run(def, task, versionsOf(markers));
        return task;
    }

    private boolean needsFreshTask(JoinTask task, Map<String, Optional<TableLoadMarker>> markers) {
        if (!task.getState().isTerminal()) {
            return false;
        }
        if (dependenciesAdvanced(task, markers)) {
            return true;
        }
        return task.getState() == JoinState.FAILED
                && task.getFinishedAt() != null
                && !clock.instant().isBefore(task.getFinishedAt().plus(retryAfter));
    }

    private static boolean dependenciesAdvanced(JoinTask task, Map<String, Optional<TableLoadMarker>> markers) {
        Map<String, Long> ranAgainst = task.getInputVersions();
        for (Map.Entry<String, Optional<TableLoadMarker>> e : markers.entrySet()) {
            long version = e.getValue().map(TableLoadMarker::getVersion).orElse(0L);
            if (version > ranAgainst.getOrDefault(e.getKey(), 0L)) {
                return true;
            }
        }
        return false;
    }

    private JoinTask newTask(JoinDefinition def, JoinTask previous) {
        JoinTask task = new JoinTask(JobIds.next("join", def.getName(), clock), def.getName(), clock.instant());
        current.put(def.getName(), task);
        metrics.recordJoinTransition(def.getName(), JoinState.PENDING.name());
        metrics.setJoinPendingSince(def.getName(), task.getCreatedAt().toEpochMilli());
        if (previous == null) {
            log.info("[JOIN] {} PENDING task={}", def.getName(), task.getId());
        } else {
            log.info("[JOIN] {} PENDING task={} replaces {} task={}",
                    def.getName(), task.getId(), previous.getState(), previous.getId());
        }
        return task;
    }

    private static List<String> blockingDependencies(Map<String, Optional<TableLoadMarker>> markers) {
        List<String> blocking = new ArrayList<>();
        for (Map.Entry<String, Optional<TableLoadMarker>> e : markers.entrySet()) {
            if (e.getValue().map(m -> !m.isCompleted()).orElse(true)) {
                blocking.add(e.getKey() + "=" + e.getValue().map(m -> m.getStatus().name()).orElse("MISSING"));
            }
        }
        return blocking;
    }

    private void reportPending(JoinDefinition def, JoinTask task, List<String> blocking) {
        Duration pending = Duration.between(task.getCreatedAt(), clock.instant());
        if (pending.compareTo(staleAfter) >= 0 && task.markStaleReported()) {
            log.warn("[JOIN] {} task={} PENDING for {}s waiting on {}",
                    def.getName(), task.getId(), pending.toSeconds(), blocking);
        } else {
            log.debug("[JOIN] {} task={} still PENDING on {}", def.getName(), task.getId(), blocking);
        }
    }

    private void run(JoinDefinition def, JoinTask task, Map<String, Long> versions) {
        if (!task.start(versions, clock.instant())) {
            return;
        }
        metrics.recordJoinTransition(def.getName(), JoinState.RUNNING.name());
        log.info("[JOIN] {} RUNNING task={} → {}", def.getName(), task.getId(), def.getDestinationTable());
        try {
            long rows = warehouse.runQuery(QueryJobSpec.builder()
                    .jobId(task.getId())
                    .destinationTable(def.getDestinationTable())
                    .query(def.getQuery())
                    .build()).getRowCount();
            task.complete(rows, clock.instant());
            metrics.recordJoinTransition(def.getName(), JoinState.COMPLETED.name());
            log.info("[JOIN] {} COMPLETED task={} rows={}", def.getName(), task.getId(), rows);
        } catch (RuntimeException e) {
            FailureCategory category = FailureCategory.categorize(e);
            task.fail(category.name() + ": " + e.getMessage(), clock.instant());
            metrics.recordJoinTransition(def.getName(), JoinState.FAILED.name());
            log.error("[JOIN] {} FAILED task={} [{}]; retry after {}",
                    def.getName(), task.getId(), category.name(), retryAfter, e);
        }
    }

    private static Map<String, Long> versionsOf(Map<String, Optional<TableLoadMarker>> markers) {
        return markers.entrySet().stream().collect(Collectors.toMap(
                Map.Entry::getKey,
                e -> e.getValue().map(TableLoadMarker::getVersion).orElse(0L),
                (a, b) -> a,
                LinkedHashMap::new));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<JoinTaskSnapshot> currentTask(String name) {
        return Optional.ofNullable(current.get(name)).map(JoinTask::snapshot);
    }

    public List<JoinTaskSnapshot> currentTasks() {
        return definitions.keySet().stream()
                .map(current::get)
                .filter(Objects::nonNull)
                .map(JoinTask::snapshot)
                .toList();
    }

    public List<JoinDefinition> definitions() {
        return List.copyOf(definitions.values());
    }
}
