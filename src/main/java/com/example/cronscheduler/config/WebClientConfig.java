package com.example.cronscheduler.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for job callbacks.
 * <p>
 * One client serves every HTTP job. There is no base URL and no default
 * content type: each job supplies its own URL, method and headers, and the
 * per-job timeout is applied on each request.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Value("${cron-scheduler.dispatch.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${cron-scheduler.dispatch.max-in-memory-size:2097152}")
    private int maxInMemorySize;

    @Value("${spring.application.name:cron-scheduler}")
    private String applicationName;

    @Bean(name = "dispatchWebClient")
    public WebClient dispatchWebClient(WebClient.Builder builder) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .followRedirect(false);

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .defaultHeader(HttpHeaders.USER_AGENT, applicationName)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[Dispatch] Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses
     */
    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.debug("[Dispatch] Error response status: {}", clientResponse.statusCode());
            } else {
                log.debug("[Dispatch] Response status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
