package io.ledgerrelay.anchor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrelay.config.DepositSettings;
import io.ledgerrelay.ledger.AccountBalances;
import io.ledgerrelay.ledger.AccountLookup;
import io.ledgerrelay.ledger.DepositTransactions;
import io.ledgerrelay.ledger.LedgerException;
import io.ledgerrelay.ledger.SubmitResult;
import io.ledgerrelay.ledger.TransactionRejectedException;
import io.ledgerrelay.ledger.TransactionSubmitter;
import io.ledgerrelay.model.AnchorStatus;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.storage.AnchorTransactionStore;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskResult;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Pays a deposit out from the distribution account. The deposit moves to
 * {@code pending_stellar} before anything is submitted, so a second run never submits twice.
 */
public final class CreateStellarDepositHandler implements TaskHandler {
    public static final String TYPE = "create_stellar_deposit";
    static final String NO_TRUST = "op_no_trust";
    private static final Logger log = LoggerFactory.getLogger(CreateStellarDepositHandler.class);

    private final AnchorTransactionStore store;
    private final AccountLookup accounts;
    private final TransactionSubmitter submitter;
    private final Supplier<DepositSettings> settings;
    private final LongSupplier clock;

    public CreateStellarDepositHandler(AnchorTransactionStore store, AccountLookup accounts, TransactionSubmitter submitter,
                                       Supplier<DepositSettings> settings, LongSupplier clock) {
        this.store = store;
        this.accounts = accounts;
        this.submitter = submitter;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        String id = context.payload().path("transaction_id").asText("");
        if (id.isBlank()) {
            return TaskResult.fatal("payload requires transaction_id");
        }
        Optional<AnchorTransaction> found = store.get(id);
        if (found.isEmpty() || !AnchorTransaction.KIND_DEPOSIT.equals(found.get().kind())) {
            return TaskResult.fatal("deposit not found: " + id);
        }
        AnchorTransaction deposit = found.get();
        AnchorStatus from = AnchorStatus.fromString(deposit.status());
        if (from != AnchorStatus.PENDING_ANCHOR && from != AnchorStatus.PENDING_TRUST) {
            log.debug("Deposit {} is {}, nothing to submit", id, deposit.status());
            return result("skipped", deposit.id(), deposit.status(), null);
        }
        DepositSettings deposits = settings.get();
        if (!deposits.configured()) {
            return TaskResult.fatal("deposit payouts need deposit.distributionSeed and deposit.issuerAccount");
        }
        if (deposit.stellarAccount() == null || deposit.stellarAccount().isBlank()) {
            return TaskResult.fatal("deposit has no stellar account: " + id);
        }
        String amountOut;
        try {
            amountOut = payoutAmount(deposit);
        } catch (IllegalArgumentException e) {
            return TaskResult.fatal(e.getMessage());
        }
        DepositTransactions transactions;
        try {
            transactions = new DepositTransactions(deposits.networkPassphrase(), deposits.distributionSeed());
        } catch (IllegalArgumentException e) {
            return TaskResult.fatal(e.getMessage());
        }

        if (!store.transition(id, from, AnchorStatus.PENDING_STELLAR, clock.getAsLong())) {
            return result("skipped", id, store.get(id).map(AnchorTransaction::status).orElse("missing"), null);
        }

        AccountBalances distribution;
        Optional<AccountBalances> destination;
        long baseFee;
        try {
            distribution = accounts.loadAccount(transactions.distributionAccountId())
                    .orElseThrow(() -> new IllegalStateException("distribution account does not exist on the ledger"));
            destination = accounts.loadAccount(deposit.stellarAccount());
            baseFee = submitter.fetchBaseFee();
        } catch (LedgerException | IllegalStateException e) {
            store.transition(id, AnchorStatus.PENDING_STELLAR, from, clock.getAsLong());
            log.warn("Could not prepare payout for deposit {}: {}", id, e.getMessage());
            return TaskResult.fail("could not prepare payout: " + e.getMessage());
        }

        DepositTransactions.SignedEnvelope envelope;
        try {
            envelope = destination.isEmpty()
                    ? transactions.createAccount(distribution.sequence(), baseFee, deposit.stellarAccount(),
                    deposits.startingBalance())
                    : transactions.payment(distribution.sequence(), baseFee, deposit.stellarAccount(),
                    deposit.assetCode(), deposits.issuerAccount(), amountOut);
        } catch (RuntimeException e) {
            store.transition(id, AnchorStatus.PENDING_STELLAR, from, clock.getAsLong());
            return TaskResult.fatal("could not build transaction for deposit " + id + ": " + e.getMessage());
        }

        if (destination.isEmpty()) {
            SubmitResult submitted;
            try {
                submitted = submitter.submit(envelope.envelopeXdr());
            } catch (LedgerException e) {
                log.warn("Create account for deposit {} failed: {}", id, e.getMessage());
                return TaskResult.fatal("create account failed, deposit left pending_stellar: " + e.getMessage());
            }
            if (!submitted.successful()) {
                return TaskResult.fatal("create account transaction " + submitted.hash() + " failed on the ledger");
            }
            store.transition(id, AnchorStatus.PENDING_STELLAR, AnchorStatus.PENDING_TRUST, clock.getAsLong());
            log.info("Created account {} for deposit {}, waiting for its trustline", deposit.stellarAccount(), id);
            return result("account_created", id, AnchorStatus.PENDING_TRUST.wireName(), submitted.hash());
        }

        SubmitResult submitted;
        try {
            submitted = submitter.submit(envelope.envelopeXdr());
        } catch (TransactionRejectedException e) {
            if (e.hasOperationCode(NO_TRUST)) {
                store.transition(id, AnchorStatus.PENDING_STELLAR, AnchorStatus.PENDING_TRUST, clock.getAsLong());
                log.info("Deposit {} destination {} has no {} trustline", id, deposit.stellarAccount(), deposit.assetCode());
                return result("pending_trust", id, AnchorStatus.PENDING_TRUST.wireName(), null);
            }
            log.warn("Payment for deposit {} rejected: {}", id, e.getMessage());
            return TaskResult.fatal("payment rejected, deposit left pending_stellar: " + e.getMessage());
        } catch (LedgerException e) {
            log.warn("Payment for deposit {} has an unknown outcome: {}", id, e.getMessage());
            return TaskResult.fatal("payment outcome unknown, deposit left pending_stellar: " + e.getMessage());
        }
        if (!submitted.successful()) {
            return TaskResult.fatal("payment transaction " + submitted.hash() + " failed on the ledger");
        }
        store.completeDeposit(id, submitted.hash(), amountOut, clock.getAsLong());
        log.info("Deposit {} paid {} {} in {}", id, amountOut, deposit.assetCode(), submitted.hash());
        return result("completed", id, AnchorStatus.COMPLETED.wireName(), submitted.hash());
    }

    static String payoutAmount(AnchorTransaction deposit) {
        if (deposit.amountIn() == null || deposit.amountIn().isBlank()) {
            throw new IllegalArgumentException("deposit has no amount_in: " + deposit.id());
        }
        BigDecimal amount;
        try {
            BigDecimal fee = deposit.amountFee() == null || deposit.amountFee().isBlank()
                    ? BigDecimal.ZERO
                    : new BigDecimal(deposit.amountFee().trim());
            amount = new BigDecimal(deposit.amountIn().trim()).subtract(fee).setScale(7, RoundingMode.HALF_EVEN);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("deposit amounts are not numeric: " + deposit.id(), e);
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("deposit pays out nothing after fees: " + deposit.id());
        }
        return amount.stripTrailingZeros().toPlainString();
    }

    private TaskResult result(String outcome, String transactionId, String status, String hash) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("result", outcome);
        out.put("transaction_id", transactionId);
        out.put("status", status);
        if (hash != null) {
            out.put("hash", hash);
        }
        return TaskResult.ok(out);
    }
}
