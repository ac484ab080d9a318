package com.coinledger.ledgerapi.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;

/** A rate in to-units per from-unit; a missing timestamp means now. */
public record UpsertRateRequest(
    @NotBlank String from,
    @NotBlank String to,
    @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal rate,
    Instant timestamp,
    String source,
    String notes) {}
