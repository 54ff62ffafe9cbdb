package com.di.datapipe.ingestion;

import com.di.datapipe.bus.MessageHandler;
import com.di.datapipe.bus.PushMessage;
import com.di.datapipe.bus.TopicPublisher;
import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.exception.PipelineException;
import com.di.datapipe.exception.TransientStageException;
import com.di.datapipe.landing.LandingStore;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetDescriptor;
import com.di.datapipe.model.LandedObjectEvent;
import com.di.datapipe.model.PayloadCodec;
import com.di.datapipe.util.MdcKeys;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Trigger-bus handler: fetch, land, notify.
 *
 * <ol>
 *   <li>Decode the FetchRequest (undecodable → not retried).</li>
 *   <li>Fetch through the dataset's fetcher, bounded by {@code fetchTimeout}.</li>
 *   <li>Write each object to the landing store under its declared name, replacing any previous one.</li>
 *   <li>Publish a {@link LandedObjectEvent} per object, retrying the publish in place.</li>
 * </ol>
 *
 * Returning normally acknowledges the delivery. Duplicate or concurrent runs for one request are
 * safe because every write replaces the whole object and every event names the same object.
 */
@Slf4j
public class IngestionWorker implements MessageHandler {

    private final FetcherRegistry fetchers;
    private final DatasetCatalog catalog;
    private final LandingStore landing;
    private final TopicPublisher notifications;
    private final Retry publishRetry;
    private final Duration fetchTimeout;
    private final ExecutorService fetchPool;
    private final PipelineMetrics metrics;

    public IngestionWorker(FetcherRegistry fetchers,
                           DatasetCatalog catalog,
                           LandingStore landing,
                           TopicPublisher notifications,
                           Retry publishRetry,
                           Duration fetchTimeout,
                           ExecutorService fetchPool,
                           PipelineMetrics metrics) {
        this.fetchers = fetchers;
        this.catalog = catalog;
        this.landing = landing;
        this.notifications = notifications;
        this.publishRetry = publishRetry;
        this.fetchTimeout = fetchTimeout;
        this.fetchPool = fetchPool;
        this.metrics = metrics;
    }

    @Override
    public void handle(PushMessage message) {
        DatasetDescriptor descriptor = PayloadCodec.decodeFetchRequest(message.getData());
        try (MDC.MDCCloseable d = MDC.putCloseable(MdcKeys.DATASET_ID, descriptor.getId())) {
            log.info("[INGEST] dataset={} attempt={}", descriptor.getId(), message.getDeliveryAttempt());
            List<FetchedObject> objects = fetch(descriptor);
            for (FetchedObject object : objects) {
                String objectName = descriptor.objectName(object.getSuffix());
                land(descriptor, objectName, object);
                notifyLanded(descriptor, objectName);
            }
            log.info("[INGEST] dataset={} landed {} object(s)", descriptor.getId(), objects.size());
        }
    }

    private List<FetchedObject> fetch(DatasetDescriptor descriptor) {
        DatasetFetcher fetcher = fetchers.get(catalog.fetcherFor(descriptor.getId()));
        long start = System.currentTimeMillis();
        Future<List<FetchedObject>> future = fetchPool.submit(() -> fetcher.fetch(descriptor));
        try {
            List<FetchedObject> objects = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (objects == null || objects.isEmpty()) {
                throw new TransientStageException("Fetcher " + fetcher.type() + " returned nothing for " + descriptor.getId());
            }
            metrics.recordFetch(descriptor.getId(), true, System.currentTimeMillis() - start);
            return objects;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordFetch(descriptor.getId(), false, System.currentTimeMillis() - start);
            throw new PipelineException(FailureCategory.TIMEOUT,
                    "Fetch of " + descriptor.getId() + " exceeded " + fetchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.recordFetch(descriptor.getId(), false, System.currentTimeMillis() - start);
            throw new TransientStageException("Interrupted fetching " + descriptor.getId(), e);
        } catch (ExecutionException e) {
            metrics.recordFetch(descriptor.getId(), false, System.currentTimeMillis() - start);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TransientStageException("Fetch of " + descriptor.getId() + " failed", cause);
        } catch (TransientStageException e) {
            metrics.recordFetch(descriptor.getId(), false, System.currentTimeMillis() - start);
            throw e;
        }
    }

    private void land(DatasetDescriptor descriptor, String objectName, FetchedObject object) {
        landing.write(descriptor.getGcsBucket(), objectName, object.getContent(), object.getContentType());
        metrics.recordLandingWrite(descriptor.getId(), object.getContent().length);
        log.info("[INGEST] wrote gs://{}/{} ({} bytes)", descriptor.getGcsBucket(), objectName, object.getContent().length);
    }

    private void notifyLanded(DatasetDescriptor descriptor, String objectName) {
        LandedObjectEvent event = LandedObjectEvent.builder()
                .bucket(descriptor.getGcsBucket())
                .objectName(objectName)
                .datasetId(descriptor.getId())
                .build();
        byte[] payload = PayloadCodec.encodeLandedObject(event);
        Map<String, String> attributes = Map.of("dataset_id", descriptor.getId(), "object_name", objectName);
        String messageId = publishRetry.executeSupplier(() -> notifications.publish(payload, attributes));
        log.info("[INGEST] published LandedObjectEvent messageId={} for {}", messageId, event.sourceUri());
    }
}
