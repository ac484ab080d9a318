package com.coinledger.ledgerapi.portfolio;

import java.util.List;

public interface PortfolioReadRepository {
  /** Holdings with a positive quantity, joined with their account and category. */
  List<PositionView> findOpenPositions();
}
