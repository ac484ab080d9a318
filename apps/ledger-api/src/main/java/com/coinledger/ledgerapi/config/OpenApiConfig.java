package com.coinledger.ledgerapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import java.util.Map;
import java.util.Optional;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** API docs for the ledger. Writes are documented with the problem responses they can return. */
@Configuration
public class OpenApiConfig {
  private static final String PROBLEM_JSON = "application/problem+json";

  // status -> error codes mapped to it by GlobalExceptionHandler
  private static final Map<String, String> WRITE_PROBLEMS =
      Map.of(
          "400", "INVALID_INPUT",
          "404", "NOT_FOUND (unknown account or currency)",
          "409", "ALREADY_EXISTS, INSUFFICIENT_HOLDINGS or CONFLICT (retry)",
          "422", "ARITHMETIC_ERROR or RATE_UNAVAILABLE");

  @Bean
  public OpenAPI ledgerOpenApi(
      ObjectProvider<BuildProperties> buildPropertiesProvider, LedgerProperties properties) {
    String version =
        Optional.ofNullable(buildPropertiesProvider.getIfAvailable())
            .map(BuildProperties::getVersion)
            .filter(value -> !value.isBlank())
            .orElse("unknown");

    return new OpenAPI()
        .info(
            new Info()
                .title("Coin Ledger API")
                .version(version)
                .description(
                    "Holdings, transactions and exchange rates across fiat, crypto and "
                        + "stablecoin assets. Cost basis and portfolio values are expressed in "
                        + properties.getCostBasisCurrency()
                        + ". Transactions can be recorded one at a time or imported as CSV."));
  }

  @Bean
  public GroupedOpenApi ledgerApiGroup() {
    return GroupedOpenApi.builder()
        .group("ledger")
        .pathsToMatch(
            "/v1/currencies/**", "/v1/rates/**", "/v1/transactions/**", "/v1/holdings/**")
        .addOpenApiCustomizer(writeProblemResponses())
        .build();
  }

  @Bean
  public GroupedOpenApi portfolioApiGroup() {
    return GroupedOpenApi.builder().group("portfolio").pathsToMatch("/v1/portfolio/**").build();
  }

  @Bean
  public GroupedOpenApi opsApiGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch("/actuator/health", "/actuator/health/**")
        .build();
  }

  static OpenApiCustomizer writeProblemResponses() {
    return openApi -> {
      if (openApi.getPaths() == null) {
        return;
      }
      for (PathItem item : openApi.getPaths().values()) {
        for (Map.Entry<PathItem.HttpMethod, Operation> entry :
            item.readOperationsMap().entrySet()) {
          if (entry.getKey() == PathItem.HttpMethod.GET) {
            continue;
          }
          Operation operation = entry.getValue();
          if (operation.getResponses() == null) {
            operation.setResponses(new ApiResponses());
          }
          ApiResponses responses = operation.getResponses();
          WRITE_PROBLEMS.forEach(
              (status, codes) -> responses.putIfAbsent(status, problemResponse(codes)));
        }
      }
    };
  }

  private static ApiResponse problemResponse(String codes) {
    return new ApiResponse()
        .description("Problem detail with code " + codes)
        .content(
            new Content()
                .addMediaType(PROBLEM_JSON, new MediaType().schema(new ObjectSchema())));
  }
}
