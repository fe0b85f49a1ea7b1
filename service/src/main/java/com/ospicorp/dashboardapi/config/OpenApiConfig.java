package com.ospicorp.dashboardapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  static final String BEARER_SCHEME = "bearer-jwt";

  /**
   * API description of the dashboard data endpoints. The bearer scheme is always declared and
   * only required globally when JWT security is switched on.
   */
  @Bean
  OpenAPI dashboardApi(@Value("${security.auth.enabled:false}") boolean authEnabled,
      @Value("${dashboard.default-start:2018-01-01}") String defaultStart) {
    OpenAPI api = new OpenAPI()
        .info(new Info()
            .title("Sensor Dashboard Data API")
            .version("v1")
            .description("Heatmap, evolution and summary data of the sensor feeds of a place. "
                + "Dates are UTC; a missing start defaults to " + defaultStart
                + " and a missing end to today."))
        .tags(List.of(new Tag().name("Data")
            .description("Repartition grids, calendar series, scalar aggregates and XY pairs")))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")));
    if (authEnabled) {
      api.addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
    return api;
  }
}
