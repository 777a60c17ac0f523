package com.mk.fx.qa.load.traffic.rest;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadHttpClientTest {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> lastContentType = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastHeader = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/ok", exchange -> respond(exchange, 200, "OK"));
    server.createContext("/err", exchange -> respond(exchange, 500, "ERR"));
    server.createContext("/empty", exchange -> respond(exchange, 200, ""));
    server.createContext(
        "/echo",
        exchange -> {
          lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
          lastHeader.set(exchange.getRequestHeaders().getFirst("X-Run"));
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          respond(exchange, 200, "[]");
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @Test
  void get_returnsStatusAndBody_andNormalisesBaseUrl() {
    var client = new LoadHttpClient(baseUrl);
    assertFalse(client.getBaseUrl().endsWith("/"));

    RestResponseData response = client.execute(Request.get("/ok"));

    assertEquals(200, response.getStatusCode());
    assertTrue(response.isSuccessful());
    assertEquals("OK", response.bodyAsString());
    assertTrue(response.getResponseTimeMs() >= 0);
  }

  @Test
  void errorStatus_isReturnedNotThrown() {
    var client = new LoadHttpClient(baseUrl);
    RestResponseData response = client.execute(Request.get("err"));
    assertEquals(500, response.getStatusCode());
    assertFalse(response.isSuccessful());
  }

  @Test
  void emptyBody_hasZeroLength() {
    var client = new LoadHttpClient(baseUrl);
    RestResponseData response = client.execute(Request.get("/empty"));
    assertEquals(0, response.bodyLength());
    assertEquals("", response.bodyAsString());
  }

  @Test
  void formPost_isUrlEncoded_andGlobalHeadersSent() {
    var client =
        new LoadHttpClient(
            baseUrl, Duration.ofSeconds(2), Duration.ofSeconds(5), Map.of("X-Run", "smoke"));
    var request =
        Request.builder()
            .method(HttpMethod.POST)
            .path("/echo")
            .form(Map.of("keyword", "hot dogs"))
            .build();

    client.execute(request);

    assertEquals("application/x-www-form-urlencoded", lastContentType.get());
    assertEquals("keyword=hot+dogs", lastBody.get());
    assertEquals("smoke", lastHeader.get());
  }

  @Test
  void multipartPost_sendsBoundaryContentType() {
    var client = new LoadHttpClient(baseUrl);
    var body = new MultipartBody().addField("username", "user7");
    var request =
        Request.builder().method(HttpMethod.POST).path("/echo").multipart(body).build();

    client.execute(request);

    assertEquals(body.contentType(), lastContentType.get());
    assertTrue(lastBody.get().contains("name=\"username\""));
    assertTrue(lastBody.get().contains("user7"));
  }

  @Test
  void connectionRefused_throwsTransportException() {
    var client =
        new LoadHttpClient(
            "http://127.0.0.1:1", Duration.ofSeconds(1), Duration.ofSeconds(1), Map.of());
    var ex = assertThrows(TransportException.class, () -> client.execute(Request.get("/ok")));
    assertNotNull(ex.getCause());
    assertNotNull(ex.getMessage());
  }

  @Test
  void invalidBaseUrl_rejected() {
    assertThrows(NullPointerException.class, () -> new LoadHttpClient(null));
    assertThrows(IllegalArgumentException.class, () -> new LoadHttpClient("  "));
  }
}
