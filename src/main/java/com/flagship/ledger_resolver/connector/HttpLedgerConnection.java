package com.flagship.ledger_resolver.connector;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * A connection to one ledger through its HTTP gateway.
 */
@Slf4j
class HttpLedgerConnection implements LedgerConnection {

    private final String poolName;
    private final URI baseUri;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private volatile boolean closed;

    HttpLedgerConnection(String poolName, URI baseUri, HttpClient httpClient, Duration requestTimeout) {
        this.poolName = poolName;
        this.baseUri = baseUri;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    void checkStatus() throws LedgerTransportException {
        send(HttpRequest.newBuilder(baseUri.resolve(baseUri.getPath() + "/status")).GET());
    }

    @Override
    public String submitRequest(String requestJson) throws LedgerTransportException {
        ensureOpen();
        return send(HttpRequest.newBuilder(baseUri.resolve(baseUri.getPath() + "/submit"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestJson, StandardCharsets.UTF_8)));
    }

    @Override
    public String getTransactions() throws LedgerTransportException {
        ensureOpen();
        return send(HttpRequest.newBuilder(baseUri.resolve(baseUri.getPath() + "/genesis")).GET());
    }

    @Override
    public void close() {
        closed = true;
        log.debug("Closed gateway connection for pool {}", poolName);
    }

    private void ensureOpen() throws LedgerTransportException {
        if (closed) {
            throw new LedgerTransportException("Connection to pool " + poolName + " is closed");
        }
    }

    private String send(HttpRequest.Builder request) throws LedgerTransportException {
        HttpRequest httpRequest = request.timeout(requestTimeout).build();
        try {
            HttpResponse<String> response = httpClient.send(httpRequest,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new LedgerTransportException(String.format(
                        "Gateway for pool %s returned status %d for %s",
                        poolName, response.statusCode(), httpRequest.uri().getPath()));
            }
            return response.body();
        } catch (HttpTimeoutException e) {
            throw new LedgerTimeoutException("Request to pool " + poolName + " timed out after " + requestTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerTransportException("Request to pool " + poolName + " was interrupted", e);
        } catch (LedgerTransportException e) {
            throw e;
        } catch (IOException e) {
            throw new LedgerTransportException("Request to pool " + poolName + " failed: " + e.getMessage(), e);
        }
    }
}
