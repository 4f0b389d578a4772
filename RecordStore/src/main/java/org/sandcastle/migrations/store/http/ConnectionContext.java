package org.sandcastle.migrations.store.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Getter;
import lombok.ToString;

/**
 * Where a record store lives and how to authenticate against it.
 */
@Getter
@ToString(exclude = "accessToken")
public class ConnectionContext {
    public static final String DEFAULT_API_VERSION = "60.0";

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final String accessToken;
    private final String apiVersion;

    public ConnectionContext(String uri, String accessToken, String apiVersion, boolean insecure) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Store URI must be provided");
        }
        try {
            this.uri = new URI(uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid store URI: " + uri, e);
        }
        if ("http".equalsIgnoreCase(this.uri.getScheme())) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(this.uri.getScheme())) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Unsupported protocol in " + uri);
        }
        if (this.uri.getHost() == null) {
            throw new IllegalArgumentException("No host in store URI " + uri);
        }
        this.accessToken = accessToken;
        this.apiVersion = apiVersion == null || apiVersion.isBlank() ? DEFAULT_API_VERSION : apiVersion;
        this.insecure = insecure;
    }

    public ConnectionContext(String uri, String accessToken) {
        this(uri, accessToken, DEFAULT_API_VERSION, false);
    }

    /** Path prefix of the versioned data API, without leading or trailing slash. */
    public String getApiPath() {
        return "services/data/v" + apiVersion;
    }
}
