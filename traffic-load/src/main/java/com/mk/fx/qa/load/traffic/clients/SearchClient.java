package com.mk.fx.qa.load.traffic.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.load.traffic.exceptions.UnexpectedContentException;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import com.mk.fx.qa.load.traffic.rest.HttpMethod;
import com.mk.fx.qa.load.traffic.rest.JsonUtil;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import com.mk.fx.qa.load.traffic.rest.Request;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Searches by a random category and feeds the returned download paths into the shared ring for
 * the download workload.
 */
public class SearchClient extends HttpWorkloadClient {

  static final String PATH = "/search";

  private final List<String> categories;
  private final DiscoveredIdRing ring;
  private final Random random;

  public SearchClient(
      LoadHttpClient http, List<String> categories, DiscoveredIdRing ring, Random random) {
    super(http);
    Objects.requireNonNull(categories, "categories");
    if (categories.isEmpty()) {
      throw new IllegalArgumentException("categories must not be empty");
    }
    this.categories = List.copyOf(categories);
    this.ring = Objects.requireNonNull(ring, "ring");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public WorkloadType type() {
    return WorkloadType.SEARCH;
  }

  @Override
  public void makeRequest() {
    String keyword = categories.get(random.nextInt(categories.size()));
    var response =
        send(
            Request.builder()
                .method(HttpMethod.POST)
                .path(PATH)
                .form(Map.of("keyword", keyword))
                .build());

    List<String> ids;
    try {
      ids = JsonUtil.toStringList(response.getBody());
    } catch (JsonProcessingException e) {
      throw new UnexpectedContentException(
          "search response is not a JSON array of strings: " + e.getOriginalMessage(), e);
    }

    for (String id : ids) {
      if (id == null || id.isBlank()) {
        continue;
      }
      // ring full
      if (!ring.offer(id)) {
        break;
      }
    }
  }
}
