package io.ledgerrelay.ledger;

import java.util.List;

public interface TransactionFeed {

    List<LedgerTransaction> fetch(String cursor, int limit);
}
