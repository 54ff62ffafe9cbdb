package com.di.datapipe.api;

import com.di.datapipe.api.dto.FetchTriggerResponse;
import com.di.datapipe.api.dto.PipelineStatusResponse;
import com.di.datapipe.api.dto.SubscriptionStatus;
import com.di.datapipe.bus.DeadLetterSink;
import com.di.datapipe.bus.PushSubscription;
import com.di.datapipe.config.PipelineProperties;
import com.di.datapipe.join.JoinCoordinator;
import com.di.datapipe.join.JoinTaskSnapshot;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetRegistration;
import com.di.datapipe.scheduler.DatasetScheduler;
import com.di.datapipe.state.LoadStateStore;
import com.di.datapipe.state.TableLoadMarker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Operator view of the pipeline.
 *
 * <p><strong>Base path:</strong> {@code /api/pipeline}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>GET</td><td>/status</td><td>Table markers, join tasks, dead letters, subscriptions</td></tr>
 * <tr><td>GET</td><td>/tables/{table}</td><td>One table's completion marker</td></tr>
 * <tr><td>GET</td><td>/joins</td><td>Current task per join</td></tr>
 * <tr><td>POST</td><td>/joins/{name}/evaluate</td><td>Evaluate one join now</td></tr>
 * <tr><td>POST</td><td>/datasets/{id}/fetch</td><td>Publish a FetchRequest outside the schedule</td></tr>
 * </table>
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineStatusController {

    private final PipelineProperties properties;
    private final DatasetCatalog catalog;
    private final LoadStateStore loadStateStore;
    private final JoinCoordinator joinCoordinator;
    private final DeadLetterSink deadLetters;
    private final DatasetScheduler scheduler;
    private final ObjectProvider<PushSubscription> subscriptions;

    @GetMapping("/status")
    public PipelineStatusResponse status(@RequestParam(defaultValue = "20") int deadLetterLimit) {
        return PipelineStatusResponse.builder()
                .runtime(properties.getRuntime())
                .datasets(catalog.all().stream().map(DatasetRegistration::getId).toList())
                .tables(loadStateStore.findAll())
                .joins(joinCoordinator.currentTasks())
                .deadLetters(deadLetters.recent(Math.max(0, deadLetterLimit)))
                .subscriptions(subscriptions.orderedStream()
                        .map(s -> SubscriptionStatus.builder()
                                .name(s.name())
                                .outstanding(s.outstanding())
                                .deliveryAttempts(s.deliveryAttempts())
                                .acked(s.ackedCount())
                                .build())
                        .toList())
                .build();
    }

    @GetMapping("/tables/{table}")
    public ResponseEntity<TableLoadMarker> table(@PathVariable String table) {
        return loadStateStore.find(table)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/joins")
    public List<JoinTaskSnapshot> joins() {
        return joinCoordinator.currentTasks();
    }

    @PostMapping("/joins/{name}/evaluate")
    public JoinTaskSnapshot evaluateJoin(@PathVariable String name) {
        log.info("[CONTROLLER] POST /api/pipeline/joins/{}/evaluate", name);
        return joinCoordinator.evaluate(name);
    }

    @PostMapping("/datasets/{id}/fetch")
    public ResponseEntity<FetchTriggerResponse> fetch(@PathVariable String id) {
        log.info("[CONTROLLER] POST /api/pipeline/datasets/{}/fetch", id);
        if (catalog.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Optional<String> messageId = scheduler.tick(id);
        FetchTriggerResponse body = FetchTriggerResponse.builder()
                .datasetId(id)
                .status(messageId.isPresent() ? "PUBLISHED" : "FAILED")
                .messageId(messageId.orElse(null))
                .build();
        return ResponseEntity.status(messageId.isPresent() ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
    }
}
