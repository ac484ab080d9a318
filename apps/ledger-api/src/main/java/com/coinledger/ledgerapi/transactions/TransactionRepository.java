package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.TransactionRecord;
import java.util.List;
import java.util.UUID;

public interface TransactionRepository {
  boolean existsByExternalId(String externalId);

  /** Appends the record and returns it with its generated id and creation time. */
  TransactionRecord insert(TransactionRecord record);

  List<TransactionRecord> findRecent(int limit);

  /** Transactions where the account is on either side, newest first. */
  List<TransactionRecord> findByAccount(UUID accountId, int limit);
}
