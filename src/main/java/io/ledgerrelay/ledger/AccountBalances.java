package io.ledgerrelay.ledger;

import java.util.List;

public record AccountBalances(String accountId, long sequence, List<Balance> balances) {

    public AccountBalances {
        balances = balances == null ? List.of() : List.copyOf(balances);
    }

    public AccountBalances(String accountId, List<Balance> balances) {
        this(accountId, 0L, balances);
    }

    public boolean hasTrustline(String assetCode) {
        if (assetCode == null || assetCode.isBlank()) {
            return false;
        }
        for (Balance balance : balances) {
            if (assetCode.equals(balance.assetCode())) {
                return true;
            }
        }
        return false;
    }

    public record Balance(String assetType, String assetCode, String assetIssuer, String balance) {
    }
}
