// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.client;

import com.alphix.liquidity.config.DepositProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * POSTs JSON to the liquidity API and hands back the parsed body. Non-2xx answers and unreadable
 * bodies fail the future with {@link CollaboratorException}.
 */
public abstract class JsonApiClient {

    private static final Logger LOG = LoggerFactory.getLogger(JsonApiClient.class);

    protected final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final DepositProperties properties;

    protected JsonApiClient(final HttpClient httpClient, final ObjectMapper mapper, final DepositProperties properties) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.properties = properties;
    }

    protected CompletableFuture<JsonNode> post(final String path, final ObjectNode body) {
        final String url = trimSlash(properties.getPrepareApi().getBaseUrl()) + path;
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofMillis(Math.max(500, properties.getPrepareApi().getTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
        } catch (IOException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new CollaboratorException("Cannot build request to " + url, e));
        }
        LOG.debug("POST {} {}", url, body);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> readBody(url, response));
    }

    private JsonNode readBody(final String url, final HttpResponse<String> response) {
        JsonNode root;
        try {
            String raw = response.body();
            root = raw == null || raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
        } catch (IOException e) {
            throw new CollaboratorException("Unreadable response from " + url, response.statusCode(), e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String message = root.path("message").asText("HTTP " + response.statusCode());
            LOG.warn("POST {} failed: {} {}", url, response.statusCode(), message);
            throw new CollaboratorException(message, response.statusCode(), null);
        }
        return root;
    }

    private static String trimSlash(final String baseUrl) {
        if (baseUrl == null) {
            return "";
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
