package io.ledgerrelay.ledger;

public interface TransactionSubmitter {

    long fetchBaseFee();

    // ConnectivityException leaves the outcome of the submission unknown.
    SubmitResult submit(String envelopeXdr);
}
