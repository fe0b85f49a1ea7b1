package com.ospicorp.dashboardapi.data.controller;

import com.ospicorp.dashboardapi.data.model.RepartitionResponse;
import com.ospicorp.dashboardapi.data.model.ScalarResult;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import com.ospicorp.dashboardapi.data.model.XyChart;
import com.ospicorp.dashboardapi.data.model.enums.Aggregation;
import com.ospicorp.dashboardapi.data.model.enums.DataType;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.GroupByField;
import com.ospicorp.dashboardapi.data.model.enums.RepartitionType;
import com.ospicorp.dashboardapi.data.service.DashboardDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/data/{placeId}")
@Validated
@Tag(name = "Data")
public class DataController {
  private static final String PLACE_ID_REGEX = "^[A-Za-z0-9_.-]{1,64}$";
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final DashboardDataService svc;

  public DataController(DashboardDataService svc) {
    this.svc = svc;
  }

  @GetMapping("/repartition/{dataType}/{repartitionType}")
  @Operation(summary = "Heatmap data",
      description = "Weekday x hour (week) or ISO week x weekday (year_h, year_v) grid of a feed.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Axes and dense grid",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = RepartitionResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request"),
      @ApiResponse(responseCode = "404", description = "Place or feed not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public RepartitionResponse repartition(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX)
      @Parameter(description = "Place identifier", example = "demo-house") String placeId,
      @PathVariable @Parameter(description = "Measured quantity", example = "conso_elec") String dataType,
      @PathVariable @Parameter(description = "week, year_h or year_v", example = "week") String repartitionType,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "Start date (inclusive)") LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "End date (inclusive)") LocalDate end) {
    return svc.getRepartition(placeId, parseDataType(dataType),
        parseRepartitionType(repartitionType), start, end);
  }

  @GetMapping("/evolution/{dataType}/{frequency}")
  @Operation(summary = "Evolution series",
      description = "One value per calendar bucket, zero where storage has no value.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = SeriesChart.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request"),
      @ApiResponse(responseCode = "404", description = "Place or feed not found")
  })
  public ResponseEntity<?> evolution(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable @Parameter(description = "hour, day, week, month or year", example = "day") String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    SeriesChart chart = svc.getEvolution(placeId, parseDataType(dataType),
        parseFrequency(frequency), start, end);
    Object body = contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)
        ? chart.toRows()
        : chart;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/sum-group/{dataType}/{frequency}/{groupBy}")
  @Operation(summary = "Sum grouped by weekday")
  public SeriesChart sumGroupBy(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable String frequency,
      @PathVariable @Parameter(description = "Grouping column", example = "weekDay") String groupBy,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getSumGroupBy(placeId, parseDataType(dataType), parseFrequency(frequency),
        parseGroupBy(groupBy), start, end);
  }

  @GetMapping("/sum/{dataType}")
  @Operation(summary = "Sum of daily values")
  public ScalarResult sum(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getSum(placeId, parseDataType(dataType), start, end);
  }

  @GetMapping("/avg/{dataType}/{frequency}")
  @Operation(summary = "Average of the values of a frequency")
  public ScalarResult average(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getAggregate(placeId, parseDataType(dataType), parseFrequency(frequency),
        Aggregation.AVG, start, end);
  }

  @GetMapping("/max/{dataType}/{frequency}")
  @Operation(summary = "Maximum of the values of a frequency")
  public ScalarResult max(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getAggregate(placeId, parseDataType(dataType), parseFrequency(frequency),
        Aggregation.MAX, start, end);
  }

  @GetMapping("/min/{dataType}/{frequency}")
  @Operation(summary = "Minimum of the values of a frequency")
  public ScalarResult min(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getAggregate(placeId, parseDataType(dataType), parseFrequency(frequency),
        Aggregation.MIN, start, end);
  }

  @GetMapping("/inf/{dataType}/{value}/{frequency}")
  @Operation(summary = "Number of values below a threshold")
  public ScalarResult countBelow(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataType,
      @PathVariable @Parameter(description = "Exclusive upper bound", example = "0") double value,
      @PathVariable String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.countBelow(placeId, parseDataType(dataType), value, parseFrequency(frequency),
        start, end);
  }

  @GetMapping("/xy/{dataTypeX}/{dataTypeY}/{frequency}")
  @Operation(summary = "Scatter data of two feeds",
      description = "Values of two feeds paired on their common buckets.")
  public XyChart xy(
      @PathVariable @Pattern(regexp = PLACE_ID_REGEX) String placeId,
      @PathVariable String dataTypeX,
      @PathVariable String dataTypeY,
      @PathVariable String frequency,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
    return svc.getXy(placeId, parseDataType(dataTypeX), parseDataType(dataTypeY),
        parseFrequency(frequency), start, end);
  }

  private static DataType parseDataType(String value) {
    try {
      return DataType.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter(
          "Invalid data type. Supported values: conso_elec,temperature,dju,pressure,nebulosity,humidity.",
          1001, ex);
    }
  }

  private static Frequency parseFrequency(String value) {
    try {
      return Frequency.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid frequency code. Supported values: hour,day,week,month,year.",
          1002, ex);
    }
  }

  private static RepartitionType parseRepartitionType(String value) {
    try {
      return RepartitionType.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid repartition type. Supported values: week,year_h,year_v.",
          1003, ex);
    }
  }

  private static GroupByField parseGroupBy(String value) {
    try {
      return GroupByField.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid group-by field. Supported values: weekDay.", 1004, ex);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 1005, null);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    MediaType.sortBySpecificityAndQuality(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode,
      Throwable cause) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode, cause);
  }
}
