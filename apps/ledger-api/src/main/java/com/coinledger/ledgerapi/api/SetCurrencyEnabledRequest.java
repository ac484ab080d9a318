package com.coinledger.ledgerapi.api;

import jakarta.validation.constraints.NotNull;

public record SetCurrencyEnabledRequest(@NotNull Boolean enabled) {}
