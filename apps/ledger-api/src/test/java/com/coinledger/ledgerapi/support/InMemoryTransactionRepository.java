package com.coinledger.ledgerapi.support;

import com.coinledger.domain.ledger.TransactionRecord;
import com.coinledger.ledgerapi.transactions.TransactionRepository;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

public final class InMemoryTransactionRepository implements TransactionRepository {
  private static final Comparator<TransactionRecord> NEWEST_FIRST =
      Comparator.comparing(TransactionRecord::timestamp)
          .thenComparing(TransactionRecord::id)
          .reversed();

  private final InMemoryLedger ledger;

  public InMemoryTransactionRepository(InMemoryLedger ledger) {
    this.ledger = ledger;
  }

  @Override
  public boolean existsByExternalId(String externalId) {
    return ledger.transactions.stream().anyMatch(tx -> externalId.equals(tx.externalId()));
  }

  @Override
  public TransactionRecord insert(TransactionRecord record) {
    TransactionRecord saved =
        record.withId(++ledger.transactionSequence, InMemoryLedger.SEEDED_AT);
    ledger.transactions.add(saved);
    return saved;
  }

  @Override
  public List<TransactionRecord> findRecent(int limit) {
    return ledger.transactions.stream().sorted(NEWEST_FIRST).limit(limit).toList();
  }

  @Override
  public List<TransactionRecord> findByAccount(UUID accountId, int limit) {
    return ledger.transactions.stream()
        .filter(
            tx -> accountId.equals(tx.fromAccountId()) || accountId.equals(tx.toAccountId()))
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .toList();
  }
}
