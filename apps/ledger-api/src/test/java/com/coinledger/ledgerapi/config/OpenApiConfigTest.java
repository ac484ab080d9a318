package com.coinledger.ledgerapi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

class OpenApiConfigTest {

  @Test
  void shouldDocumentProblemResponsesOnWritesOnly() {
    Operation record =
        new Operation()
            .responses(
                new ApiResponses()
                    .addApiResponse("201", new ApiResponse().description("Created"))
                    .addApiResponse("400", new ApiResponse().description("Bad payload")));
    Operation list = new Operation().responses(new ApiResponses());
    PathItem transactions = new PathItem().post(record).get(list);
    OpenAPI openApi =
        new OpenAPI().paths(new Paths().addPathItem("/v1/transactions", transactions));

    OpenApiConfig.writeProblemResponses().customise(openApi);

    ApiResponses recordResponses = record.getResponses();
    assertEquals("Bad payload", recordResponses.get("400").getDescription());
    assertTrue(recordResponses.get("409").getDescription().contains("INSUFFICIENT_HOLDINGS"));
    assertNotNull(recordResponses.get("422").getContent().get("application/problem+json"));
    assertNotNull(recordResponses.get("404"));
    assertNull(list.getResponses().get("409"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldDescribeCostBasisCurrencyAndFallBackToUnknownVersion() {
    ObjectProvider<BuildProperties> noBuildInfo = mock(ObjectProvider.class);
    when(noBuildInfo.getIfAvailable()).thenReturn(null);
    LedgerProperties properties = new LedgerProperties();
    properties.setCostBasisCurrency("EUR");

    OpenAPI openApi = new OpenApiConfig().ledgerOpenApi(noBuildInfo, properties);

    assertEquals("Coin Ledger API", openApi.getInfo().getTitle());
    assertEquals("unknown", openApi.getInfo().getVersion());
    assertTrue(openApi.getInfo().getDescription().contains("EUR"));
  }
}
