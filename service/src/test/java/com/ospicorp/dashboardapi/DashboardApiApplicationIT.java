package com.ospicorp.dashboardapi;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Full stack against a seeded database. */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers
class DashboardApiApplicationIT {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    POSTGRES.start();
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("dashboard.seed.enabled", () -> "true");
  }

  @Autowired
  private TestRestTemplate rest;

  @Test
  @SuppressWarnings("unchecked")
  void weekRepartitionOfSeededPlaceIsComplete() {
    ResponseEntity<Map> response = rest.getForEntity(
        "/v1/data/demo/repartition/conso_elec/week?start=2018-01-01&end=2018-01-31", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
    List<Object> values = (List<Object>) data.get("values");
    assertThat(values).hasSize(168).allSatisfy(value -> assertThat(value).isInstanceOf(Number.class));
  }

  @Test
  @SuppressWarnings("unchecked")
  void yearRepartitionHasSevenCellsPerWeek() {
    ResponseEntity<Map> response = rest.getForEntity(
        "/v1/data/demo/repartition/temperature/year_h?start=2018-01-01&end=2018-01-31", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> axe = (Map<String, Object>) response.getBody().get("axe");
    Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
    List<Object> weeks = (List<Object>) axe.get("x");
    assertThat((List<Object>) axe.get("year")).hasSameSizeAs(weeks);
    assertThat((List<Object>) data.get("values")).hasSize(weeks.size() * 7);
  }

  @Test
  @SuppressWarnings("unchecked")
  void monthlyEvolutionOfSeededPlace() {
    ResponseEntity<Map> response = rest.getForEntity(
        "/v1/data/demo/evolution/conso_elec/month?start=2018-01-01&end=2018-03-31", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat((List<Object>) response.getBody().get("axeX"))
        .containsExactly("Jan 2018", "Feb 2018", "Mar 2018");
  }

  @Test
  void unknownPlaceIsProblemDetail() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/data/nowhere/sum/conso_elec", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }

  @Test
  void openApiDocumentIsValid() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);

    SwaggerParseResult result = new OpenAPIV3Parser().readContents(response.getBody(), null, null);

    assertThat(result.getOpenAPI()).isNotNull();
    assertThat(result.getOpenAPI().getPaths())
        .containsKey("/v1/data/{placeId}/repartition/{dataType}/{repartitionType}")
        .containsKey("/v1/data/{placeId}/evolution/{dataType}/{frequency}");
    assertThat(result.getOpenAPI().getComponents().getSecuritySchemes()).containsKey("bearer-jwt");
  }
}
