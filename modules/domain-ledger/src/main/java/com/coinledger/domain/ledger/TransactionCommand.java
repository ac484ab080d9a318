package com.coinledger.domain.ledger;

import java.time.Instant;

/**
 * A request to record one ledger event. Account references are names or ids and are resolved by
 * the recorder; a {@code null} timestamp means "now".
 */
public sealed interface TransactionCommand
    permits BuyCommand, SellCommand, TransferCommand, SwapCommand {

  TransactionType type();

  Instant timestamp();

  String notes();

  String externalId();
}
