package com.mk.fx.qa.load.traffic.clients;

import com.mk.fx.qa.load.traffic.catalog.Fixture;
import com.mk.fx.qa.load.traffic.catalog.FixtureCatalog;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import com.mk.fx.qa.load.traffic.rest.HttpMethod;
import com.mk.fx.qa.load.traffic.rest.JsonUtil;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import com.mk.fx.qa.load.traffic.rest.MultipartBody;
import com.mk.fx.qa.load.traffic.rest.Request;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/** Uploads a random fixture with a synthetic user name and its category as the only hashtag. */
public class UploadClient extends HttpWorkloadClient {

  static final String PATH = "/upload";

  private final FixtureCatalog catalog;
  private final UserIdentityGenerator users;
  private final Random random;

  public UploadClient(
      LoadHttpClient http, FixtureCatalog catalog, UserIdentityGenerator users, Random random) {
    super(http);
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.users = Objects.requireNonNull(users, "users");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public WorkloadType type() {
    return WorkloadType.UPLOAD;
  }

  @Override
  public void makeRequest() throws Exception {
    Fixture fixture = catalog.randomFixture(random);
    var body =
        new MultipartBody()
            .addField("username", users.next())
            .addField("hashtags", JsonUtil.toJson(List.of(fixture.category())))
            .addFile(
                "file",
                fixture.fileName(),
                fixture.contentType(),
                Files.readAllBytes(fixture.path()));

    send(Request.builder().method(HttpMethod.POST).path(PATH).multipart(body).build());
  }
}
