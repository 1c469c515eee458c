package com.example.acgarden.utils;

import com.example.acgarden.exception.NetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Plain GET of a text resource. Any transport failure or non-2xx status is
 * reported as a {@link NetworkException}; nothing is retried.
 */
@Slf4j
@Component
public class HttpTextFetcher {

    private static final String USER_AGENT = "ac-garden/0.0.1";
    private static final int MAX_ERROR_SNIPPET = 500;

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpTextFetcher(HttpClient httpClient,
                           @Value("${acgarden.http.request-timeout-seconds:60}") long requestTimeoutSeconds) {
        this.httpClient = httpClient;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    }

    public String fetchText(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Malformed URL: " + url, e);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(requestTimeout)
                .header("User-Agent", USER_AGENT)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NetworkException("Error fetching URL " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted while fetching " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body();
            String msg = "Failed HTTP " + status + " fetching " + url;
            if (body != null && !body.isBlank()) {
                String snippet = body.length() > MAX_ERROR_SNIPPET ? body.substring(0, MAX_ERROR_SNIPPET) + "..." : body;
                msg += ", response body: " + snippet;
            }
            throw new NetworkException(msg);
        }

        log.debug("Fetched {} (HTTP {}, {} chars)", url, status, response.body().length());
        return response.body();
    }
}
