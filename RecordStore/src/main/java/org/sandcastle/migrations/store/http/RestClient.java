package org.sandcastle.migrations.store.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Thin JSON-over-HTTP client for one record store. Every call is cold: nothing is sent until
 * the returned {@link Mono} is subscribed.
 */
@Slf4j
public class RestClient implements AutoCloseable {
    @Getter
    private final ConnectionContext connectionContext;
    private final HttpClient client;
    /** Pool created for this client only, null when the shared Reactor pool is used. */
    private final ConnectionProvider ownedProvider;

    private static final String USER_AGENT_HEADER_NAME = HttpHeaderNames.USER_AGENT.toString();
    private static final String CONTENT_TYPE_HEADER_NAME = HttpHeaderNames.CONTENT_TYPE.toString();
    private static final String ACCEPT_HEADER_NAME = HttpHeaderNames.ACCEPT.toString();
    private static final String AUTHORIZATION_HEADER_NAME = HttpHeaderNames.AUTHORIZATION.toString();
    private static final String HOST_HEADER_NAME = HttpHeaderNames.HOST.toString();

    private static final String USER_AGENT = "GraphMigration-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final Duration RESPONSE_TIMEOUT = Duration.ofMinutes(2);

    public RestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections If &gt; 0, an HttpClient will be created with a provider
     *                       that uses this value for maxConnections.  Otherwise, a client
     *                       will be created with default values provided by Reactor.
     */
    public RestClient(ConnectionContext connectionContext, int maxConnections) {
        this(connectionContext, maxConnections <= 0 ? null : ConnectionProvider.create("RestClient", maxConnections));
    }

    private RestClient(ConnectionContext connectionContext, ConnectionProvider provider) {
        this(connectionContext, provider == null ? HttpClient.create() : HttpClient.create(provider), provider);
    }

    protected RestClient(ConnectionContext connectionContext, HttpClient httpClient) {
        this(connectionContext, httpClient, null);
    }

    private RestClient(ConnectionContext connectionContext, HttpClient httpClient, ConnectionProvider ownedProvider) {
        this.connectionContext = connectionContext;
        this.ownedProvider = ownedProvider;
        HttpClient configured = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .responseTimeout(RESPONSE_TIMEOUT)
            .keepAlive(true);
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            configured = configured.secure(connectionContext.isInsecure()
                ? insecureSslProvider()
                : SslProvider.defaultClientProvider());
        }
        this.client = configured;
    }

    private static SslProvider insecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            return SslProvider.builder().sslContext(sslContext).handlerConfigurator(sslHandler -> {
                SSLEngine engine = sslHandler.engine();
                SSLParameters sslParameters = engine.getSSLParameters();
                sslParameters.setEndpointIdentificationAlgorithm(null);
                engine.setSSLParameters(sslParameters);
            }).build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }

    /** Releases the connection pool this client created, if any. */
    @Override
    public void close() {
        if (ownedProvider != null) {
            log.debug("Disposing connection pool for {}", connectionContext.getUri());
            ownedProvider.dispose();
        }
    }

    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    public Mono<HttpResponse> asyncRequest(HttpMethod method, String path, String body, Map<String, String> additionalHeaders) {
        Map<String, String> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, USER_AGENT);
        headers.put(HOST_HEADER_NAME, getHostHeaderValue(connectionContext));
        headers.put(ACCEPT_HEADER_NAME, JSON_CONTENT_TYPE);
        if (connectionContext.getAccessToken() != null) {
            headers.put(AUTHORIZATION_HEADER_NAME, "Bearer " + connectionContext.getAccessToken());
        }
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, JSON_CONTENT_TYPE);
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        String uri = path.startsWith("/") ? path : "/" + path;
        log.atDebug().setMessage("{} {}").addArgument(method).addArgument(uri).log();
        return client
            .headers(h -> headers.forEach(h::add))
            .request(method)
            .uri(uri)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            );
    }

    private Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest(HttpMethod.GET, path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest(HttpMethod.POST, path, body, null);
    }

    public Mono<HttpResponse> patchAsync(String path, String body) {
        return asyncRequest(HttpMethod.PATCH, path, body, null);
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return asyncRequest(HttpMethod.DELETE, path, null, null);
    }
}
