package com.di.datapipe.warehouse;

import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.exception.MalformedInputException;
import com.di.datapipe.exception.PermissionDeniedException;
import com.di.datapipe.exception.PipelineException;
import com.di.datapipe.exception.TransientStageException;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.CsvOptions;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobConfiguration;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobInfo.WriteDisposition;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.LoadJobConfiguration;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * BigQuery warehouse. Loads are CSV load jobs with schema auto-detection and one header row; queries
 * write to a destination table. Both use {@code WRITE_TRUNCATE}, so a re-run replaces the table.
 *
 * <p>The caller's job id is used as the BigQuery job id. Each attempt carries a fresh one, so a
 * redelivered load is a new job rather than a lookup of an earlier one.
 */
@Slf4j
public class BigQueryWarehouse implements Warehouse {

    /** BigQuery error reasons that mean the content or query itself is wrong. */
    private static final Set<String> MALFORMED_REASONS = Set.of("invalid", "invalidQuery", "notFound");

    /** Authorization failures. BigQuery also answers 403 for quota and rate limits, which are not. */
    private static final Set<String> DENIED_REASONS = Set.of("accessDenied", "forbidden");

    private static final Set<String> TRANSIENT_REASONS = Set.of(
            "rateLimitExceeded", "quotaExceeded", "backendError", "internalError", "jobBackendError");

    private final BigQuery bigQuery;
    private final String project;
    private final String dataset;
    private final Duration loadTimeout;
    private final Duration queryTimeout;

    public BigQueryWarehouse(BigQuery bigQuery, String project, String dataset,
                             Duration loadTimeout, Duration queryTimeout) {
        this.bigQuery = bigQuery;
        this.project = project;
        this.dataset = dataset;
        this.loadTimeout = loadTimeout;
        this.queryTimeout = queryTimeout;
    }

    @Override
    public JobResult runLoad(LoadJobSpec spec) {
        TableId tableId = TableId.of(project, dataset, spec.getTable());
        CsvOptions csv = CsvOptions.newBuilder()
                .setSkipLeadingRows(spec.getSkipLeadingRows())
                .build();
        LoadJobConfiguration config = LoadJobConfiguration
                .newBuilder(tableId, spec.sourceUri(), csv)
                .setAutodetect(true)
                .setWriteDisposition(WriteDisposition.WRITE_TRUNCATE)
                .setMaxBadRecords(0)
                .build();

        log.info("[LOAD] submitting jobId={} {} → {}.{}.{}",
                spec.getJobId(), spec.sourceUri(), project, dataset, spec.getTable());
        long start = System.currentTimeMillis();
        Job job = submitAndWait(spec.getJobId(), config, loadTimeout);

        JobStatistics.LoadStatistics stats = job.getStatistics();
        long rows = stats != null && stats.getOutputRows() != null ? stats.getOutputRows() : 0L;
        long elapsed = System.currentTimeMillis() - start;
        log.info("[LOAD] jobId={} complete: outputRows={} in {}ms", spec.getJobId(), rows, elapsed);
        return new JobResult(spec.getJobId(), spec.getTable(), rows, elapsed);
    }

    @Override
    public JobResult runQuery(QueryJobSpec spec) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(spec.getQuery())
                .setDestinationTable(TableId.of(project, dataset, spec.getDestinationTable()))
                .setDefaultDataset(DatasetId.of(project, dataset))
                .setWriteDisposition(WriteDisposition.WRITE_TRUNCATE)
                .setUseLegacySql(false)
                .build();

        log.info("[JOIN] submitting query jobId={} → {}.{}.{}",
                spec.getJobId(), project, dataset, spec.getDestinationTable());
        long start = System.currentTimeMillis();
        submitAndWait(spec.getJobId(), config, queryTimeout);
        long rows = rowCount(spec.getDestinationTable()).orElse(0L);
        long elapsed = System.currentTimeMillis() - start;
        log.info("[JOIN] query jobId={} complete: rows={} in {}ms", spec.getJobId(), rows, elapsed);
        return new JobResult(spec.getJobId(), spec.getDestinationTable(), rows, elapsed);
    }

    @Override
    public Optional<Long> rowCount(String table) {
        try {
            Table t = bigQuery.getTable(TableId.of(project, dataset, table));
            if (t == null) {
                return Optional.empty();
            }
            BigInteger rows = t.getNumRows();
            return Optional.of(rows == null ? 0L : rows.longValue());
        } catch (BigQueryException e) {
            throw translate("row count of " + table, e);
        }
    }

    private Job submitAndWait(String jobId, JobConfiguration config, Duration timeout) {
        Job job;
        try {
            job = bigQuery.create(JobInfo.newBuilder(config)
                    .setJobId(JobId.newBuilder().setJob(jobId).setProject(project).build())
                    .build());
            job = job.waitFor(RetryOption.totalTimeout(org.threeten.bp.Duration.ofMillis(timeout.toMillis())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStageException("Interrupted waiting for BigQuery job " + jobId, e);
        } catch (BigQueryException e) {
            throw translate("job " + jobId, e);
        }

        // waitFor returns null on timeout or if the job no longer exists
        if (job == null) {
            throw new PipelineException(FailureCategory.TIMEOUT,
                    "BigQuery job " + jobId + " did not finish within " + timeout);
        }
        BigQueryError error = job.getStatus().getError();
        if (error != null) {
            throw jobFailure(jobId, error);
        }
        return job;
    }

    static PipelineException jobFailure(String jobId, BigQueryError error) {
        String reason = error.getReason();
        String message = "BigQuery job " + jobId + " failed [" + reason + "]: " + error.getMessage();
        if (reason != null && MALFORMED_REASONS.contains(reason)) {
            return new MalformedInputException(message);
        }
        if (reason != null && DENIED_REASONS.contains(reason)) {
            return new PermissionDeniedException(message);
        }
        return new TransientStageException(message);
    }

    static PipelineException translate(String what, BigQueryException e) {
        String reason = e.getError() != null ? e.getError().getReason() : null;
        if (reason != null && TRANSIENT_REASONS.contains(reason)) {
            return new TransientStageException("BigQuery throttled or failed " + what + " [" + reason + "]: "
                    + e.getMessage(), e);
        }
        if ((reason != null && DENIED_REASONS.contains(reason)) || (reason == null && e.getCode() == 403)) {
            return new PermissionDeniedException("BigQuery denied " + what + ": " + e.getMessage(), e);
        }
        if ((reason != null && MALFORMED_REASONS.contains(reason)) || (reason == null && e.getCode() == 400)) {
            return new MalformedInputException("BigQuery rejected " + what + ": " + e.getMessage(), e);
        }
        return new TransientStageException("BigQuery call failed for " + what + ": " + e.getMessage(), e);
    }
}
