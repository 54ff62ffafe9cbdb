package com.di.datapipe.ingestion;

import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.exception.InvalidMessageException;
import com.di.datapipe.exception.PipelineException;
import com.di.datapipe.exception.TransientStageException;
import com.di.datapipe.model.DatasetDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Fetches a dataset with a single HTTP GET of its {@code url}.
 *
 * <p>A JSON values body is normalised to CSV; any other body is landed byte for byte. Prefix
 * datasets produce one object named {@code <prefix>.csv}.
 *
 * <p>Connection and read timeouts come from the {@link RestTemplate}. Network errors, 5xx and 429 are
 * transient; any other 4xx is reported as an unknown source failure.
 */
@Slf4j
@RequiredArgsConstructor
public class HttpDatasetFetcher implements DatasetFetcher {

    public static final String TYPE = "http";
    static final String CSV_SUFFIX = ".csv";

    private final RestTemplate restTemplate;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<FetchedObject> fetch(DatasetDescriptor descriptor) {
        String url = descriptor.getUrl();
        if (url == null || url.isBlank()) {
            throw new InvalidMessageException("Dataset " + descriptor.getId() + " has no url to fetch");
        }
        log.debug("[INGEST] GET {}", url);

        byte[] body = get(descriptor.getId(), url);
        Optional<byte[]> csv = ValuesJsonToCsv.convert(body);
        if (csv.isPresent()) {
            log.info("[INGEST] dataset={} normalised JSON values body ({} bytes) to CSV ({} bytes)",
                    descriptor.getId(), body.length, csv.get().length);
            return List.of(new FetchedObject(CSV_SUFFIX, csv.get(), "text/csv"));
        }
        return List.of(new FetchedObject(CSV_SUFFIX, body, "application/octet-stream"));
    }

    private byte[] get(String datasetId, String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.parseMediaType("text/csv"), MediaType.ALL));
        try {
            ResponseEntity<byte[]> response =
                    restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
            byte[] body = response.getBody();
            return body == null ? new byte[0] : body;
        } catch (ResourceAccessException e) {
            throw new TransientStageException("Network failure fetching " + datasetId + " from " + url, e);
        } catch (HttpServerErrorException e) {
            throw new TransientStageException("Source returned " + e.getStatusCode() + " for " + datasetId, e);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientStageException("Source rate-limited fetch of " + datasetId, e);
            }
            throw new PipelineException(FailureCategory.UNKNOWN,
                    "Source rejected fetch of " + datasetId + " with " + e.getStatusCode(), e);
        }
    }
}
