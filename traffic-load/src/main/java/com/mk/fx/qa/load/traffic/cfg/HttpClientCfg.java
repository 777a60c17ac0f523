package com.mk.fx.qa.load.traffic.cfg;

import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the shared HTTP client pointed at the host under test. */
@Configuration
public class HttpClientCfg {

  @Bean(destroyMethod = "close")
  public LoadHttpClient loadHttpClient(TrafficLoadCfg cfg) {
    return new LoadHttpClient(
        cfg.baseUrl(), cfg.getConnectTimeout(), cfg.getRequestTimeout(), Map.of());
  }
}
