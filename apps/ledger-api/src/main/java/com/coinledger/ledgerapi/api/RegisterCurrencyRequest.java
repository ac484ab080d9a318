package com.coinledger.ledgerapi.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RegisterCurrencyRequest(
    @NotBlank String code,
    @NotBlank String name,
    @NotBlank String symbol,
    @NotNull @Min(0) Integer decimals,
    @NotBlank String assetClass) {}
