package com.mk.fx.qa.load.traffic.rest;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonUtilTest {

  @Test
  void toStringList_decodesArray() throws Exception {
    var ids = JsonUtil.toStringList("[\"/download/thumbnail_a.jpg\",\"/download/b.jpg\"]".getBytes(StandardCharsets.UTF_8));
    assertEquals(List.of("/download/thumbnail_a.jpg", "/download/b.jpg"), ids);
  }

  @Test
  void toStringList_nullLiteralIsEmpty() throws Exception {
    assertTrue(JsonUtil.toStringList("null".getBytes(StandardCharsets.UTF_8)).isEmpty());
  }

  @Test
  void toStringList_rejectsObjects() {
    assertThrows(
        JsonProcessingException.class,
        () -> JsonUtil.toStringList("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void toJson_writesArray() throws Exception {
    assertEquals("[\"cats\"]", JsonUtil.toJson(List.of("cats")));
  }
}
