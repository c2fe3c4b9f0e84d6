package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.TargetType;
import com.example.cronscheduler.exception.DispatchTimeoutException;
import com.example.cronscheduler.exception.DispatchTransportException;
import com.example.cronscheduler.exception.TargetConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Handler for HTTP callback jobs.
 * <p>
 * Sends the job's method, headers and (for POST, PUT and PATCH) JSON payload
 * to its target URL. Any HTTP status counts as a completed attempt; only 2xx
 * is a success. The job timeout is a hard deadline on the whole exchange.
 */
@Slf4j
@Component
public class HttpDispatchHandler implements DispatchHandler {

    // Worst case of four bytes per character
    private static final long MAX_BODY_BYTES = ExecutionLog.RESPONSE_BODY_LIMIT * 4L;

    private final WebClient webClient;

    public HttpDispatchHandler(@Qualifier("dispatchWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public TargetType getTargetType() {
        return TargetType.HTTP;
    }

    @Override
    public DispatchResult dispatch(CronJob job) {
        var url = job.getTargetUrl();
        var method = job.getHttpMethod() != null ? job.getHttpMethod() : JobHttpMethod.GET;
        var timeout = Duration.ofMillis(job.getTimeoutMs());

        log.debug("Dispatching job {}: {} {} (timeout {}ms)", job.getId(), method, url, job.getTimeoutMs());

        WebClient.RequestBodySpec spec = webClient.method(method.toHttpMethod())
                .uri(URI.create(url))
                .headers(h -> {
                    if (job.getHeaders() != null) {
                        job.getHeaders().forEach(h::set);
                    }
                });

        WebClient.RequestHeadersSpec<?> request = spec;
        if (method.supportsBody() && job.getPayload() != null) {
            request = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(job.getPayload());
        }

        try {
            var result = request
                    .exchangeToMono(response -> readBody(response)
                            .map(body -> DispatchResult.fromResponse(response.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();

            if (result == null) {
                throw new DispatchTransportException(url, "No response received", null);
            }
            return result;
        } catch (DispatchTransportException e) {
            throw e;
        } catch (RuntimeException e) {
            var cause = Exceptions.unwrap(e);
            if (isTimeout(cause)) {
                throw new DispatchTimeoutException(job.getTimeoutMs(), cause);
            }
            throw new DispatchTransportException(url, describe(cause), cause);
        }
    }

    @Override
    public void validate(CronJob job) {
        var url = job.getTargetUrl();
        if (url == null || url.isBlank()) {
            throw new TargetConfigurationException(TargetType.HTTP, "Target URL is required for HTTP jobs");
        }

        try {
            var uri = new URI(url);
            var scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
                throw new TargetConfigurationException(TargetType.HTTP, "Target URL must be an absolute http or https URL");
            }
        } catch (URISyntaxException e) {
            throw new TargetConfigurationException(TargetType.HTTP, "Invalid target URL: " + e.getMessage());
        }
    }

    /**
     * Read at most enough bytes to fill the stored body limit; the rest of the
     * response is discarded when the exchange completes
     */
    private static Mono<String> readBody(ClientResponse response) {
        var charset = response.headers().contentType()
                .map(MediaType::getCharset)
                .orElse(StandardCharsets.UTF_8);

        var body = DataBufferUtils.takeUntilByteCount(response.bodyToFlux(DataBuffer.class), MAX_BODY_BYTES);
        return DataBufferUtils.join(body)
                .map(buffer -> {
                    try {
                        return buffer.toString(charset);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty("");
    }

    private static boolean isTimeout(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        var root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        var message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return root == error ? message : error.getClass().getSimpleName() + ": " + message;
    }
}
