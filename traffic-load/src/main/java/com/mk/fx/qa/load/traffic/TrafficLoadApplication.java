package com.mk.fx.qa.load.traffic;

import com.mk.fx.qa.load.traffic.catalog.NoFixturesFoundException;
import com.mk.fx.qa.load.traffic.cfg.TrafficLoadCfg;
import com.mk.fx.qa.load.traffic.exceptions.LivenessCheckFailedException;
import com.mk.fx.qa.load.traffic.service.TrafficLoadService;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class TrafficLoadApplication implements CommandLineRunner, ExitCodeGenerator {

  static final int EXIT_FATAL = 1;

  private final TrafficLoadService loadService;
  private final TrafficLoadCfg cfg;
  private int exitCode;

  public TrafficLoadApplication(TrafficLoadService loadService, TrafficLoadCfg cfg) {
    this.loadService = loadService;
    this.cfg = cfg;
  }

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(TrafficLoadApplication.class, args)));
  }

  @Override
  public void run(String... args) throws Exception {
    try {
      loadService.run();
    } catch (NoFixturesFoundException | IOException e) {
      log.error("failed to load images from path '{}': {}", cfg.getImagesPath(), e.toString());
      exitCode = EXIT_FATAL;
    } catch (LivenessCheckFailedException e) {
      log.error(e.getMessage());
      exitCode = EXIT_FATAL;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
