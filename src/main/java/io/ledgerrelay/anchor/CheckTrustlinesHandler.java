package io.ledgerrelay.anchor;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrelay.bus.Broker;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.ledger.AccountBalances;
import io.ledgerrelay.ledger.AccountLookup;
import io.ledgerrelay.ledger.LedgerException;
import io.ledgerrelay.model.AnchorStatus;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.storage.AnchorTransactionStore;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskResult;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.LongSupplier;

public final class CheckTrustlinesHandler implements TaskHandler {
    public static final String TYPE = "check_trustlines";
    private static final Logger log = LoggerFactory.getLogger(CheckTrustlinesHandler.class);

    private final AnchorTransactionStore store;
    private final AccountLookup accounts;
    private final Broker broker;
    private final LongSupplier clock;

    public CheckTrustlinesHandler(AnchorTransactionStore store, AccountLookup accounts, Broker broker, LongSupplier clock) {
        this.store = store;
        this.accounts = accounts;
        this.broker = broker;
        this.clock = clock;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        int checked = 0;
        int skipped = 0;
        ArrayNode ready = Jsons.mapper().createArrayNode();
        for (AnchorTransaction deposit : store.listByStatus(AnchorTransaction.KIND_DEPOSIT, AnchorStatus.PENDING_TRUST)) {
            if (deposit.stellarAccount() == null || deposit.stellarAccount().isBlank()) {
                skipped++;
                continue;
            }
            Optional<AccountBalances> account;
            try {
                account = accounts.loadAccount(deposit.stellarAccount());
            } catch (LedgerException e) {
                log.warn("Could not load account {} for deposit {}: {}", deposit.stellarAccount(), deposit.id(), e.getMessage());
                skipped++;
                continue;
            }
            checked++;
            if (account.isEmpty() || !account.get().hasTrustline(deposit.assetCode())) {
                continue;
            }
            // Published before the status change; a rerun republishes under the same dedup key.
            ObjectNode payload = Jsons.mapper().createObjectNode();
            payload.put("transaction_id", deposit.id());
            broker.publish(LedgerRelayConfig.TASKS_TOPIC, MessageEnvelope.task(LedgerRelayConfig.TASKS_TOPIC,
                    CreateStellarDepositHandler.TYPE, payload,
                    CreateStellarDepositHandler.TYPE + ":" + deposit.id() + ":" + deposit.updatedAtMs(), false));
            store.transition(deposit.id(), AnchorStatus.PENDING_TRUST, AnchorStatus.PENDING_ANCHOR, clock.getAsLong());
            log.info("Deposit {} has a {} trustline, payout queued", deposit.id(), deposit.assetCode());
            ready.add(deposit.id());
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("checked", checked);
        out.put("skipped", skipped);
        out.set("ready", ready);
        return TaskResult.ok(out);
    }
}
