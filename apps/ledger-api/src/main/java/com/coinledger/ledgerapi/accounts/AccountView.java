package com.coinledger.ledgerapi.accounts;

import java.util.UUID;

public record AccountView(
    UUID id, String name, String accountType, UUID categoryId, String categoryName) {}
