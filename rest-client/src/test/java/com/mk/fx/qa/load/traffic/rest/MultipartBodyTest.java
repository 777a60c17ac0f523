package com.mk.fx.qa.load.traffic.rest;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MultipartBodyTest {

  @Test
  void encodesFieldsAndFilesBetweenBoundaries() {
    var body =
        new MultipartBody("XYZ")
            .addField("username", "user1")
            .addField("hashtags", "[\"cats\"]")
            .addFile("file", "a.jpg", "image/jpeg", new byte[] {1, 2, 3});

    String encoded = new String(body.toByteArray(), StandardCharsets.ISO_8859_1);

    assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=XYZ");
    assertThat(body.partCount()).isEqualTo(3);
    assertThat(encoded)
        .startsWith("--XYZ\r\n")
        .contains("Content-Disposition: form-data; name=\"username\"\r\n\r\nuser1\r\n")
        .contains("name=\"hashtags\"\r\n\r\n[\"cats\"]\r\n")
        .contains("name=\"file\"; filename=\"a.jpg\"\r\nContent-Type: image/jpeg\r\n\r\n\u0001\u0002\u0003\r\n")
        .endsWith("--XYZ--\r\n");
  }

  @Test
  void quotesInNamesAreEscaped_andDefaultBoundaryIsUnique() {
    var body = new MultipartBody().addFile("file", "we\"ird.png", null, new byte[0]);
    String encoded = new String(body.toByteArray(), StandardCharsets.UTF_8);

    assertThat(encoded).contains("filename=\"we\\\"ird.png\"");
    assertThat(encoded).contains("Content-Type: application/octet-stream");
    assertThat(body.getBoundary()).isNotEqualTo(new MultipartBody().getBoundary());
  }
}
