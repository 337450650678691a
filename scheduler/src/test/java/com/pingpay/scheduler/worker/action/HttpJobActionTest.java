package com.pingpay.scheduler.worker.action;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobDefinition;
import com.pingpay.scheduler.model.JobFixtures;
import com.pingpay.scheduler.model.JobType;
import com.pingpay.scheduler.model.ScheduleType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpJobAction against a local MockWebServer.
 */
class HttpJobActionTest {

    MockWebServer server;
    HttpJobAction action;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        action = new HttpJobAction(Duration.ofSeconds(1), "PingPay-Scheduler/1.0");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void execute_postsPayloadAsJsonWithUserAgent() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(204));

        action.execute(jobTargeting(server.url("/charge").toString(), "{\"amount\":42}"));

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getPath()).isEqualTo("/charge");
        assertThat(req.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(req.getHeader("User-Agent")).isEqualTo("PingPay-Scheduler/1.0");
        assertThat(req.getBody().readUtf8()).isEqualTo("{\"amount\":42}");
    }

    @Test
    void execute_withoutPayload_sendsEmptyBody() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThatCode(() -> action.execute(jobTargeting(server.url("/ping").toString(), null)))
                .doesNotThrowAnyException();
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBodySize()).isZero();
    }

    @Test
    void execute_serverError_failsWithStatusAndBody() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("upstream exploded"));

        assertThatThrownBy(() -> action.execute(jobTargeting(server.url("/charge").toString(), "{}")))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("upstream exploded");
    }

    @Test
    void execute_slowTarget_timesOut() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeadersDelay(3, TimeUnit.SECONDS));

        assertThatThrownBy(() -> action.execute(jobTargeting(server.url("/slow").toString(), "{}")))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("timed out after 1s");
    }

    @Test
    void execute_malformedTarget_failsWithoutRequest() {
        assertThatThrownBy(() -> action.execute(jobTargeting("http://bad host/x", "{}")))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("Invalid target URL");
        assertThat(server.getRequestCount()).isZero();
    }

    private static Job jobTargeting(String url, String payload) {
        return JobFixtures.job(new JobDefinition("http-job", null, JobType.HTTP, url, payload,
                ScheduleType.CRON, "0 * * * *", null, null, null, null));
    }
}
