package io.ledgerrelay.ledger;

import io.ledgerrelay.config.RuntimeSettings;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

public final class InterestPredicate implements Predicate<LedgerTransaction> {
    private final boolean successfulOnly;
    private final boolean requireMemo;
    private final Set<String> memoTypes;

    public InterestPredicate(boolean successfulOnly, boolean requireMemo, List<String> memoTypes) {
        this.successfulOnly = successfulOnly;
        this.requireMemo = requireMemo;
        this.memoTypes = memoTypes == null ? Set.of() : Set.copyOf(memoTypes);
    }

    public static InterestPredicate from(RuntimeSettings settings) {
        return new InterestPredicate(settings.successfulOnly(), settings.requireMemo(), settings.memoTypes());
    }

    public static InterestPredicate acceptAll() {
        return new InterestPredicate(false, false, List.of());
    }

    @Override
    public boolean test(LedgerTransaction tx) {
        if (successfulOnly && !tx.successful()) {
            return false;
        }
        String memoType = tx.memoType() == null ? "none" : tx.memoType().toLowerCase(Locale.ROOT);
        if (requireMemo && ("none".equals(memoType) || tx.memo() == null || tx.memo().isBlank())) {
            return false;
        }
        return memoTypes.isEmpty() || memoTypes.contains(memoType);
    }
}
