package com.mlab.telescope.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlab.telescope.exception.JobFailedException;
import com.mlab.telescope.exception.TableDoesNotExistException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import com.mlab.telescope.model.JobState;
import com.mlab.telescope.model.JobStatus;
import com.mlab.telescope.model.QueryPriority;
import com.mlab.telescope.model.ResultPage;
import com.mlab.telescope.model.WarehouseSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BigQueryRestClientTest {

    private static final String BASE_URL = "https://bigquery.test/v2";
    private static final String RESULTS_URL = BASE_URL + "/projects/mlab-project/queries/job_1?maxResults=100&timeoutMs=0";

    private MockRestServiceServer server;
    private BigQueryRestClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new BigQueryRestClient(restTemplate, new ObjectMapper(), BASE_URL,
                new WarehouseSession("mlab-project", "token-123"));
    }

    @Nested
    class insertQueryJob {

        @Test
        void returnsJobId() {
            server.expect(requestTo(BASE_URL + "/projects/mlab-project/jobs"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Authorization", "Bearer token-123"))
                    .andExpect(jsonPath("$.configuration.query.query").value("SELECT 1"))
                    .andExpect(jsonPath("$.configuration.query.priority").value("BATCH"))
                    .andExpect(jsonPath("$.configuration.query.useLegacySql").value(true))
                    .andRespond(withSuccess("{\"jobReference\": {\"jobId\": \"job_1\"}}", MediaType.APPLICATION_JSON));

            assertThat(client.insertQueryJob("SELECT 1", QueryPriority.BATCH)).isEqualTo("job_1");
            server.verify();
        }

        @Test
        void serverErrorIsCommunicationFailure() {
            server.expect(requestTo(BASE_URL + "/projects/mlab-project/jobs"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> client.insertQueryJob("SELECT 1", QueryPriority.INTERACTIVE))
                    .isInstanceOf(WarehouseCommunicationException.class);
        }

        @Test
        void missingJobIdIsCommunicationFailure() {
            server.expect(requestTo(BASE_URL + "/projects/mlab-project/jobs"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.insertQueryJob("SELECT 1", QueryPriority.INTERACTIVE))
                    .isInstanceOf(WarehouseCommunicationException.class);
        }
    }

    @Nested
    class getJobStatus {

        private void respondWith(String body) {
            server.expect(requestTo(BASE_URL + "/projects/mlab-project/jobs/job_1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
        }

        @Test
        void running() {
            respondWith("{\"status\": {\"state\": \"RUNNING\"}}");

            assertThat(client.getJobStatus("job_1").state()).isEqualTo(JobState.RUNNING);
        }

        @Test
        void doneWithErrorIsFailed() {
            respondWith("{\"status\": {\"state\": \"DONE\", \"errorResult\": {\"message\": \"Resources exceeded\"}}}");

            JobStatus status = client.getJobStatus("job_1");

            assertThat(status.state()).isEqualTo(JobState.FAILED);
            assertThat(status.errorMessage()).isEqualTo("Resources exceeded");
        }

        @Test
        void unknownStateHasNoMapping() {
            respondWith("{\"status\": {\"state\": \"SUSPENDED\"}}");

            JobStatus status = client.getJobStatus("job_1");

            assertThat(status.state()).isNull();
            assertThat(status.rawState()).isEqualTo("SUSPENDED");
        }

        @Test
        void missingStatusIsCommunicationFailure() {
            respondWith("{\"id\": \"job_1\"}");

            assertThatThrownBy(() -> client.getJobStatus("job_1"))
                    .isInstanceOf(WarehouseCommunicationException.class);
        }
    }

    @Nested
    class getQueryResults {

        @Test
        void parsesRowsAgainstSchema() {
            server.expect(requestTo(RESULTS_URL))
                    .andRespond(withSuccess("{"
                            + "\"totalRows\": \"2\","
                            + "\"schema\": {\"fields\": ["
                            + "  {\"name\": \"web100_log_entry_log_time\"},"
                            + "  {\"name\": \"web100_log_entry_snap_State\"}]},"
                            + "\"rows\": ["
                            + "  {\"f\": [{\"v\": \"1391212800\"}, {\"v\": \"5\"}]},"
                            + "  {\"f\": [{\"v\": \"1391212801\"}, {\"v\": null}]}],"
                            + "\"pageToken\": \"next-page\"}", MediaType.APPLICATION_JSON));

            ResultPage page = client.getQueryResults("job_1", null, 100);

            assertThat(page.totalRows()).isEqualTo(2);
            assertThat(page.rows()).containsExactly(
                    Map.of("web100_log_entry_log_time", "1391212800", "web100_log_entry_snap_State", "5"),
                    Map.of("web100_log_entry_log_time", "1391212801"));
            assertThat(page.pageToken()).isEqualTo("next-page");
            assertThat(page.hasNextPage()).isTrue();
        }

        @Test
        void passesPageToken() {
            server.expect(requestTo(RESULTS_URL + "&pageToken=abc"))
                    .andRespond(withSuccess("{\"totalRows\": \"0\"}", MediaType.APPLICATION_JSON));

            ResultPage page = client.getQueryResults("job_1", "abc", 100);

            assertThat(page.rows()).isEmpty();
            assertThat(page.hasNextPage()).isFalse();
            server.verify();
        }

        @Test
        void notFoundMeansTableDoesNotExist() {
            server.expect(requestTo(RESULTS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> client.getQueryResults("job_1", null, 100))
                    .isInstanceOf(TableDoesNotExistException.class);
        }

        @Test
        void badRequestMeansJobFailed() {
            server.expect(requestTo(RESULTS_URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

            assertThatThrownBy(() -> client.getQueryResults("job_1", null, 100))
                    .isInstanceOfSatisfying(JobFailedException.class,
                            e -> assertThat(e.getHttpStatus()).isEqualTo(400));
        }

        @Test
        void otherErrorsAreCommunicationFailures() {
            server.expect(requestTo(RESULTS_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

            assertThatThrownBy(() -> client.getQueryResults("job_1", null, 100))
                    .isInstanceOf(WarehouseCommunicationException.class);
        }

        @Test
        void missingRowCountIsCommunicationFailure() {
            server.expect(requestTo(RESULTS_URL))
                    .andRespond(withSuccess("{\"jobComplete\": false}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.getQueryResults("job_1", null, 100))
                    .isInstanceOf(WarehouseCommunicationException.class);
        }
    }
}
