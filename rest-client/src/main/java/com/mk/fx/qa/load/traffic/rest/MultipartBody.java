package com.mk.fx.qa.load.traffic.rest;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds a {@code multipart/form-data} payload from text fields and file parts. The encoded body
 * is kept in memory, which suits the image fixtures it is used for.
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";

    private final String boundary;
    private final List<Part> parts = new ArrayList<>();

    public MultipartBody() {
        this("----traffic-load-" + UUID.randomUUID().toString().replace("-", ""));
    }

    MultipartBody(String boundary) {
        this.boundary = Objects.requireNonNull(boundary, "boundary");
    }

    public MultipartBody addField(String name, String value) {
        Objects.requireNonNull(name, "name");
        parts.add(new Part(name, null, null, (value != null ? value : "").getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public MultipartBody addFile(String name, String fileName, String contentType, byte[] content) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
        parts.add(new Part(name, fileName, contentType != null ? contentType : "application/octet-stream", content));
        return this;
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public String getBoundary() {
        return boundary;
    }

    public int partCount() {
        return parts.size();
    }

    public byte[] toByteArray() {
        var out = new ByteArrayOutputStream();
        for (Part part : parts) {
            write(out, "--" + boundary + CRLF);
            if (part.fileName() == null) {
                write(out, "Content-Disposition: form-data; name=\"" + escape(part.name()) + "\"" + CRLF);
            } else {
                write(out, "Content-Disposition: form-data; name=\"" + escape(part.name())
                        + "\"; filename=\"" + escape(part.fileName()) + "\"" + CRLF);
                write(out, "Content-Type: " + part.contentType() + CRLF);
            }
            write(out, CRLF);
            out.writeBytes(part.content());
            write(out, CRLF);
        }
        write(out, "--" + boundary + "--" + CRLF);
        return out.toByteArray();
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private record Part(String name, String fileName, String contentType, byte[] content) {}
}
