package com.mk.fx.qa.load.traffic.rest;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.Data;

@Data
public class RestResponseData {
    private int statusCode;
    private Map<String, String> headers;
    private byte[] body;
    private long responseTimeMs;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public int bodyLength() {
        return body == null ? 0 : body.length;
    }
}
