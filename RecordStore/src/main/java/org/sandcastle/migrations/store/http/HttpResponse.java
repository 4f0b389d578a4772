package org.sandcastle.migrations.store.http;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class HttpResponse {
    private final int statusCode;
    private final String statusText;
    private final Map<String, String> headers;
    private final String body;

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
