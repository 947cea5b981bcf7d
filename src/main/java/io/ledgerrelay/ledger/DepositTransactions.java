package io.ledgerrelay.ledger;

import org.stellar.sdk.Account;
import org.stellar.sdk.Asset;
import org.stellar.sdk.CreateAccountOperation;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Network;
import org.stellar.sdk.Operation;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;

public final class DepositTransactions {
    private static final long TIMEOUT_SECONDS = 300L;

    private final Network network;
    private final KeyPair distribution;

    public DepositTransactions(String networkPassphrase, String distributionSeed) {
        if (networkPassphrase == null || networkPassphrase.isBlank()) {
            throw new IllegalArgumentException("network passphrase must not be blank");
        }
        if (distributionSeed == null || distributionSeed.isBlank()) {
            throw new IllegalArgumentException("distribution seed must not be blank");
        }
        try {
            this.distribution = KeyPair.fromSecretSeed(distributionSeed.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("distribution seed is not a valid Stellar secret seed", e);
        }
        this.network = new Network(networkPassphrase);
    }

    public String distributionAccountId() {
        return distribution.getAccountId();
    }

    public SignedEnvelope createAccount(long sequence, long baseFee, String destination, String startingBalance) {
        return sign(sequence, baseFee, new CreateAccountOperation.Builder(destination, startingBalance).build());
    }

    public SignedEnvelope payment(long sequence, long baseFee, String destination, String assetCode,
                                  String issuer, String amount) {
        Asset asset = Asset.create(null, assetCode, issuer);
        return sign(sequence, baseFee, new PaymentOperation.Builder(destination, asset, amount).build());
    }

    private SignedEnvelope sign(long sequence, long baseFee, Operation operation) {
        Account source = new Account(distribution.getAccountId(), sequence);
        Transaction tx = new TransactionBuilder(source, network)
                .addOperation(operation)
                .setBaseFee(Math.toIntExact(baseFee))
                .setTimeout(TIMEOUT_SECONDS)
                .build();
        tx.sign(distribution);
        return new SignedEnvelope(tx.hashHex(), tx.toEnvelopeXdrBase64());
    }

    public record SignedEnvelope(String hash, String envelopeXdr) {
    }
}
