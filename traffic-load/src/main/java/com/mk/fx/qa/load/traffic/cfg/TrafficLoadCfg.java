package com.mk.fx.qa.load.traffic.cfg;

import com.mk.fx.qa.load.traffic.model.WorkloadType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Run configuration. The snake_case command-line flag names ({@code --upload_rate},
 * {@code --rampup_time}, ...) are mapped onto these properties in {@code application.yml}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load")
public class TrafficLoadCfg {

  /** Root of the fixture corpus, one sub-directory per category. */
  @NotBlank private String imagesPath = "data";

  /** Host (optionally {@code host:port}) under test. */
  @NotBlank private String targetHost = "127.0.0.1";

  @NotBlank private String scheme = "http";

  @Min(0)
  private int uploadRate = 1;

  @Min(0)
  private int uiRate = 1;

  @Min(0)
  private int searchRate = 1;

  @Min(0)
  private int downloadRate = 1;

  @NotNull
  @DurationMin(nanos = 0)
  private Duration testDuration = Duration.ofMinutes(10);

  @NotNull
  @DurationMin(nanos = 0)
  private Duration rampupTime = Duration.ofMinutes(2);

  @Positive private int userCount = 1000;

  @Positive private int workers = 200;

  @NotNull
  @DurationMin(millis = 1)
  private Duration reportInterval = Duration.ofSeconds(10);

  @Positive private int downloadRingCapacity = 1000;

  @NotBlank private String livenessMarker = "UiFrontend";

  @Min(0)
  @Max(100)
  private int fullSizeDownloadPercent = 1;

  @NotNull
  @DurationMin(millis = 1)
  private Duration connectTimeout = Duration.ofSeconds(5);

  @NotNull
  @DurationMin(millis = 1)
  private Duration requestTimeout = Duration.ofSeconds(30);

  public String baseUrl() {
    return scheme + "://" + targetHost;
  }

  /** Configured steady-state rate for a workload; zero disables it. */
  public int rateFor(WorkloadType type) {
    return switch (type) {
      case UPLOAD -> uploadRate;
      case BROWSE -> uiRate;
      case SEARCH -> searchRate;
      case DOWNLOAD -> downloadRate;
    };
  }
}
