package com.mk.fx.qa.load.traffic.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single request against the target host. At most one body source is used, {@code multipart}
 * before {@code form}; a request without either is sent with no body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Request {
    private HttpMethod method;
    private String path;
    private Map<String, String> headers;
    private Map<String, String> form;
    private MultipartBody multipart;

    public static Request get(String path) {
        return Request.builder().method(HttpMethod.GET).path(path).build();
    }
}
