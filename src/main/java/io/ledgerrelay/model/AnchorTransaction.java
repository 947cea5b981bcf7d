package io.ledgerrelay.model;

public record AnchorTransaction(
        String id,
        String kind,
        String status,
        String assetCode,
        String stellarAccount,
        String amountIn,
        String amountFee,
        String amountOut,
        String memo,
        String memoType,
        String stellarTransactionId,
        long startedAtMs,
        Long completedAtMs,
        long updatedAtMs
) {
    public static final String KIND_DEPOSIT = "deposit";
    public static final String KIND_WITHDRAWAL = "withdrawal";
}
