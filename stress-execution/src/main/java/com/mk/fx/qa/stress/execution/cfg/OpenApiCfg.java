package com.mk.fx.qa.stress.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Stress Execution Runner API")
                .description(
                    "Starts per-core CPU stress runs and exposes their progress, monitor snapshots"
                        + " and errors."));
  }
}
