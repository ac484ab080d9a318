package com.coinledger.ledgerapi.holdings;

import com.coinledger.domain.ledger.Holding;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface HoldingRepository {
  Optional<Holding> find(UUID accountId, String asset);

  /** Reads the row and holds a lock on it until the surrounding transaction ends. */
  Optional<Holding> findForUpdate(UUID accountId, String asset);

  List<Holding> findByAccount(UUID accountId);

  List<Holding> findAll();

  void insert(Holding holding);

  void update(Holding holding);
}
