package io.ledgerrelay.ledger;

public record SubmitResult(String hash, boolean successful, String resultXdr) {
}
