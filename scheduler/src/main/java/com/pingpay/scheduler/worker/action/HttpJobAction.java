package com.pingpay.scheduler.worker.action;

import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP job action: POST the job's payload as JSON to its target URL.
 *
 * Any 2xx is success. Non-2xx, a timeout, or a connection failure throws
 * {@link ActionExecutionException}. The request timeout (30 s by default)
 * bounds how long a worker thread can be held by one target.
 */
@Component
public class HttpJobAction implements JobAction {

    private static final Logger log = LoggerFactory.getLogger(HttpJobAction.class);

    // Longest response body excerpt kept in an error message.
    private static final int MAX_BODY_IN_ERROR = 500;

    private final HttpClient http;
    private final Duration   timeout;
    private final String     userAgent;

    public HttpJobAction(
            @Value("${scheduler.action.http-timeout:30s}") Duration timeout,
            @Value("${scheduler.action.user-agent:PingPay-Scheduler/1.0}") String userAgent) {
        this.timeout   = timeout;
        this.userAgent = userAgent;
        this.http      = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public JobType type() {
        return JobType.HTTP;
    }

    @Override
    public void execute(Job job) {
        String target = job.getTarget();
        log.info("Making HTTP request to {} for job {}", target, job.getId());

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(target))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("User-Agent",   userAgent)
                    .POST(job.getPayload() != null
                            ? HttpRequest.BodyPublishers.ofString(job.getPayload())
                            : HttpRequest.BodyPublishers.noBody())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ActionExecutionException("Invalid target URL: " + target, e);
        }

        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ActionExecutionException(
                        "HTTP " + resp.statusCode() + " from " + target + ": " + abbreviate(resp.body()));
            }
            log.info("HTTP request to {} completed with status {}", target, resp.statusCode());
        } catch (ActionExecutionException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ActionExecutionException(
                    "HTTP request to " + target + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("HTTP request to " + target + " was interrupted", e);
        } catch (Exception e) {
            throw new ActionExecutionException("HTTP request to " + target + " failed: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_BODY_IN_ERROR ? body : body.substring(0, MAX_BODY_IN_ERROR) + "...";
    }
}
