package com.mk.fx.qa.load.traffic.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** In-process stand-in for the image service front ends. */
public final class StubImageServer implements AutoCloseable {

  public final AtomicInteger uploadStatus = new AtomicInteger(200);
  public final AtomicInteger downloadStatus = new AtomicInteger(200);
  public final AtomicReference<String> landingPage =
      new AtomicReference<>("<html><title>UiFrontend</title></html>");
  public final AtomicReference<String> searchResponse =
      new AtomicReference<>("[\"/download/thumbnail_1.jpg\",\"/download/thumbnail_2.jpg\"]");
  public final AtomicReference<byte[]> downloadBody = new AtomicReference<>(new byte[] {1, 2, 3});
  public final AtomicReference<String> lastUploadBody = new AtomicReference<>();
  public final AtomicReference<String> lastUploadContentType = new AtomicReference<>();
  public final AtomicReference<String> lastSearchBody = new AtomicReference<>();
  public final AtomicReference<String> lastDownloadPath = new AtomicReference<>();

  private final Map<String, AtomicLong> hits = new ConcurrentHashMap<>();
  private final HttpServer server;
  private final ExecutorService executor = Executors.newCachedThreadPool();

  public StubImageServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.setExecutor(executor);
    server.createContext(
        "/",
        exchange -> {
          count("/");
          respond(exchange, 200, landingPage.get().getBytes(StandardCharsets.UTF_8));
        });
    server.createContext(
        "/upload",
        exchange -> {
          count("/upload");
          lastUploadContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
          lastUploadBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1));
          respond(exchange, uploadStatus.get(), "OK".getBytes(StandardCharsets.UTF_8));
        });
    server.createContext(
        "/search",
        exchange -> {
          count("/search");
          lastSearchBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          respond(exchange, 200, searchResponse.get().getBytes(StandardCharsets.UTF_8));
        });
    server.createContext(
        "/download/",
        exchange -> {
          count("/download/");
          lastDownloadPath.set(exchange.getRequestURI().getPath());
          respond(exchange, downloadStatus.get(), downloadBody.get());
        });
    server.start();
  }

  /** Host and port, as given to {@code target_host}. */
  public String hostAndPort() {
    return "127.0.0.1:" + server.getAddress().getPort();
  }

  public String baseUrl() {
    return "http://" + hostAndPort();
  }

  public long hits(String context) {
    AtomicLong counter = hits.get(context);
    return counter == null ? 0 : counter.get();
  }

  private void count(String context) {
    hits.computeIfAbsent(context, key -> new AtomicLong()).incrementAndGet();
  }

  private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
    exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  @Override
  public void close() {
    server.stop(0);
    executor.shutdownNow();
  }
}
