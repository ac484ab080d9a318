package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.ExchangeRate;
import com.coinledger.domain.ledger.HoldingSnapshot;
import com.coinledger.domain.ledger.TransactionRecord;
import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of recording (or previewing) one transaction.
 *
 * @param realizedGain advisory gain in the cost-basis currency; negative for a loss, {@code null}
 *     when the transaction realizes nothing
 * @param capturedRate rate the swap was priced at, {@code null} for other types and for a
 *     same-asset swap between accounts
 * @param dryRun {@code true} when every change was rolled back
 */
public record RecordedTransaction(
    TransactionRecord transaction,
    List<HoldingSnapshot> holdings,
    BigDecimal realizedGain,
    ExchangeRate capturedRate,
    boolean dryRun) {}
