package com.flagship.ledger_resolver.connector;

import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Connector for ledgers exposed through an HTTP ledger gateway
 * (an indy-vdr-proxy style service that holds the node connections).
 *
 * Opening a connection checks the gateway status endpoint, so an unreachable
 * gateway fails the open rather than the first request.
 */
@Slf4j
public class HttpLedgerConnector implements LedgerConnector {

    private final Duration connectTimeout;

    public HttpLedgerConnector(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public LedgerConnection open(LedgerPoolConfig config, String transactions) throws LedgerTransportException {
        String gatewayUrl = config.getGatewayUrl();
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            throw new LedgerTransportException("No gateway URL configured for pool " + config.getName());
        }

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (config.getSocksProxy() != null && !config.getSocksProxy().isBlank()) {
            builder.proxy(ProxySelector.of(parseProxy(config.getSocksProxy())));
        }

        URI baseUri = URI.create(gatewayUrl.endsWith("/")
                ? gatewayUrl.substring(0, gatewayUrl.length() - 1)
                : gatewayUrl);

        HttpLedgerConnection connection = new HttpLedgerConnection(
                config.getName(), baseUri, builder.build(), config.getRequestTimeout());
        connection.checkStatus();

        log.debug("Opened gateway connection for pool {} at {}", config.getName(), baseUri);
        return connection;
    }

    static InetSocketAddress parseProxy(String proxy) throws LedgerTransportException {
        String hostPort = proxy.contains("://") ? proxy.substring(proxy.indexOf("://") + 3) : proxy;
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new LedgerTransportException("Invalid proxy address: " + proxy);
        }
        try {
            int port = Integer.parseInt(hostPort.substring(colon + 1));
            return InetSocketAddress.createUnresolved(hostPort.substring(0, colon), port);
        } catch (IllegalArgumentException e) {
            throw new LedgerTransportException("Invalid proxy address: " + proxy, e);
        }
    }
}
