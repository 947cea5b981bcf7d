package io.ledgerrelay.ledger;

import java.util.Optional;

public interface AccountLookup {

    Optional<AccountBalances> loadAccount(String accountId);
}
