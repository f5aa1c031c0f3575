package com.mlab.telescope.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlab.telescope.exception.JobFailedException;
import com.mlab.telescope.exception.TableDoesNotExistException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import com.mlab.telescope.model.JobState;
import com.mlab.telescope.model.JobStatus;
import com.mlab.telescope.model.QueryPriority;
import com.mlab.telescope.model.ResultPage;
import com.mlab.telescope.model.WarehouseSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link WarehouseClient} over the BigQuery v2 REST API.
 *
 * Endpoints used:
 *   POST /projects/{project}/jobs              start a query job
 *   GET  /projects/{project}/jobs/{job}        job status
 *   GET  /projects/{project}/queries/{job}     result pages
 *
 * Result cells arrive as {"v": "..."} strings; null cells are left out of the
 * returned row maps so that downstream mapping sees them as missing.
 */
@Slf4j
public class BigQueryRestClient implements WarehouseClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final WarehouseSession session;

    public BigQueryRestClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl,
                              WarehouseSession session) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.session = session;
    }

    @Override
    public String insertQueryJob(String queryText, QueryPriority priority) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode query = body.putObject("configuration").putObject("query");
        query.put("query", queryText);
        query.put("priority", priority.name());
        query.put("useLegacySql", true);

        URI uri = uri("projects", session.projectId(), "jobs").build().toUri();
        JsonNode response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.POST, entity(body), JsonNode.class).getBody();
        } catch (RestClientException e) {
            throw new WarehouseCommunicationException("Failed to communicate with the warehouse", e);
        }

        String jobId = response == null ? null : response.path("jobReference").path("jobId").asText(null);
        if (jobId == null || jobId.isEmpty()) {
            throw new WarehouseCommunicationException("No job id returned for submitted query");
        }
        return jobId;
    }

    @Override
    public JobStatus getJobStatus(String jobId) {
        URI uri = uri("projects", session.projectId(), "jobs", jobId).build().toUri();
        JsonNode response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, entity(null), JsonNode.class).getBody();
        } catch (RestClientException e) {
            throw new WarehouseCommunicationException("Failed to read status of job " + jobId, e);
        }

        JsonNode status = response == null ? null : response.get("status");
        if (status == null || !status.hasNonNull("state")) {
            throw new WarehouseCommunicationException("Malformed status response for job " + jobId);
        }

        String rawState = status.get("state").asText();
        JsonNode errorResult = status.get("errorResult");
        String errorMessage = errorResult == null ? null : errorResult.path("message").asText(null);
        return new JobStatus(jobId, rawState, parseState(rawState, errorResult != null), errorMessage);
    }

    @Override
    public ResultPage getQueryResults(String jobId, String pageToken, int maxResults) {
        UriComponentsBuilder builder = uri("projects", session.projectId(), "queries", jobId)
                .queryParam("maxResults", maxResults)
                .queryParam("timeoutMs", 0);
        if (pageToken != null) {
            builder.queryParam("pageToken", pageToken);
        }

        JsonNode response;
        try {
            response = restTemplate.exchange(builder.build().toUri(), HttpMethod.GET, entity(null), JsonNode.class)
                    .getBody();
        } catch (HttpClientErrorException.NotFound e) {
            throw new TableDoesNotExistException(jobId, e);
        } catch (HttpClientErrorException.BadRequest e) {
            throw new JobFailedException(400, "Query rejected for job " + jobId + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new WarehouseCommunicationException("Failed to communicate with the warehouse", e);
        }

        if (response == null) {
            throw new WarehouseCommunicationException("Empty results response for job " + jobId);
        }
        return parseResultPage(response);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UriComponentsBuilder uri(String... pathSegments) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl).pathSegment(pathSegments);
    }

    private HttpEntity<JsonNode> entity(JsonNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(session.accessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return new HttpEntity<>(body, headers);
    }

    private static JobState parseState(String rawState, boolean hasError) {
        return switch (rawState) {
            case "PENDING" -> JobState.PENDING;
            case "RUNNING" -> JobState.RUNNING;
            case "DONE" -> hasError ? JobState.FAILED : JobState.DONE;
            default -> null;
        };
    }

    private ResultPage parseResultPage(JsonNode response) {
        long totalRows = response.path("totalRows").asLong(-1);
        if (totalRows < 0) {
            throw new WarehouseCommunicationException("Results response carried no row count");
        }
        if (totalRows == 0) {
            return new ResultPage(0, List.of(), null);
        }

        List<String> fields = new ArrayList<>();
        for (JsonNode field : response.path("schema").path("fields")) {
            fields.add(field.path("name").asText());
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (JsonNode row : response.path("rows")) {
            Map<String, String> parsed = new HashMap<>();
            JsonNode cells = row.path("f");
            for (int i = 0; i < fields.size() && i < cells.size(); i++) {
                JsonNode value = cells.get(i).get("v");
                if (value != null && !value.isNull()) {
                    parsed.put(fields.get(i), value.asText());
                }
            }
            rows.add(parsed);
        }

        String pageToken = response.hasNonNull("pageToken") ? response.get("pageToken").asText() : null;
        return new ResultPage(totalRows, rows, pageToken);
    }
}
