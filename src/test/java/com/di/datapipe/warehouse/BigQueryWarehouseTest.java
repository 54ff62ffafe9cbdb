package com.di.datapipe.warehouse;

import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.exception.PipelineException;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.lang.reflect.Proxy;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BigQueryWarehouse Tests")
class BigQueryWarehouseTest {

    private static final LoadJobSpec LOAD = LoadJobSpec.builder()
            .jobId("load_household_income_20240501100000000_0a1b2c3d")
            .table("household_income")
            .bucket("landing")
            .objectName("SAIPE")
            .build();

    /** A client whose every call fails with {@code failure}. */
    private static BigQuery failingClient(BigQueryException failure) {
        return (BigQuery) Proxy.newProxyInstance(
                BigQuery.class.getClassLoader(),
                new Class<?>[]{BigQuery.class},
                (proxy, method, args) -> {
                    if ("toString".equals(method.getName())) {
                        return "failing BigQuery";
                    }
                    throw failure;
                });
    }

    private static BigQueryWarehouse warehouse(BigQueryException failure) {
        return new BigQueryWarehouse(failingClient(failure), "proj", "datapipe",
                Duration.ofMinutes(1), Duration.ofMinutes(1));
    }

    private static BigQueryException rejected(int code, String reason) {
        return new BigQueryException(code, reason + " from BigQuery", new BigQueryError(reason, "global", reason));
    }

    // ============================================================================
    // Submission failures
    // ============================================================================

    @ParameterizedTest(name = "HTTP {0} {1} -> {2}")
    @CsvSource({
            "403, rateLimitExceeded, TRANSIENT",
            "403, quotaExceeded,     TRANSIENT",
            "500, backendError,      TRANSIENT",
            "403, accessDenied,      PERMISSION_DENIED",
            "403, forbidden,         PERMISSION_DENIED",
            "400, invalid,           MALFORMED_INPUT",
            "404, notFound,          MALFORMED_INPUT"
    })
    @DisplayName("Should categorize a rejected load by the error reason, not only the status code")
    void testRunLoad_CategorizedByReason(int code, String reason, FailureCategory expected) {
        PipelineException e = assertThrows(PipelineException.class,
                () -> warehouse(rejected(code, reason)).runLoad(LOAD));
        assertEquals(expected, e.getCategory());
    }

    @Test
    @DisplayName("A quota 403 stays retryable so the load is redelivered instead of dead-lettered")
    void testRunLoad_QuotaExceededRetryable() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> warehouse(rejected(403, "rateLimitExceeded")).runLoad(LOAD));
        assertTrue(FailureCategory.categorize(e).isRetryable());
    }

    @Test
    @DisplayName("Should fall back to the status code when BigQuery gives no reason")
    void testRunLoad_NoReason() {
        assertEquals(FailureCategory.PERMISSION_DENIED, assertThrows(PipelineException.class,
                () -> warehouse(new BigQueryException(403, "denied")).runLoad(LOAD)).getCategory());
        assertEquals(FailureCategory.MALFORMED_INPUT, assertThrows(PipelineException.class,
                () -> warehouse(new BigQueryException(400, "bad")).runLoad(LOAD)).getCategory());
        assertEquals(FailureCategory.TRANSIENT, assertThrows(PipelineException.class,
                () -> warehouse(new BigQueryException(503, "unavailable")).runLoad(LOAD)).getCategory());
    }

    @Test
    @DisplayName("Should apply the same mapping to table lookups")
    void testRowCount_QuotaExceeded() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> warehouse(rejected(403, "quotaExceeded")).rowCount("household_income"));
        assertEquals(FailureCategory.TRANSIENT, e.getCategory());
    }

    // ============================================================================
    // Job status errors
    // ============================================================================

    @Test
    @DisplayName("Should categorize a failed job's status error by reason")
    void testJobFailure() {
        String jobId = LOAD.getJobId();
        assertEquals(FailureCategory.TRANSIENT, BigQueryWarehouse.jobFailure(jobId,
                new BigQueryError("quotaExceeded", "global", "too many loads")).getCategory());
        assertEquals(FailureCategory.PERMISSION_DENIED, BigQueryWarehouse.jobFailure(jobId,
                new BigQueryError("accessDenied", "global", "no access")).getCategory());
        assertEquals(FailureCategory.MALFORMED_INPUT, BigQueryWarehouse.jobFailure(jobId,
                new BigQueryError("invalid", "SAIPE", "ragged row")).getCategory());
    }
}
