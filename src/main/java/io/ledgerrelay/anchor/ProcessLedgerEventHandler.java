package io.ledgerrelay.anchor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrelay.model.AnchorStatus;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.model.LedgerEvent;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.storage.AnchorTransactionStore;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskResult;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

public final class ProcessLedgerEventHandler implements TaskHandler {
    private static final Logger log = LoggerFactory.getLogger(ProcessLedgerEventHandler.class);

    private final AnchorTransactionStore store;
    private final LongSupplier clock;

    public ProcessLedgerEventHandler(AnchorTransactionStore store, LongSupplier clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String taskType() {
        return MessageEnvelope.LEDGER_EVENT_TASK_TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        LedgerEvent event = context.ledgerEvent();
        Optional<AnchorTransaction> already = store.findByStellarTransactionId(event.hash());
        if (already.isPresent()) {
            return result("already_completed", event, already.get().id());
        }
        if (event.memo() == null || event.memo().isBlank()) {
            return result("unmatched", event, null);
        }
        List<AnchorTransaction> candidates = store.findAwaitingWithdrawals(event.memo());
        for (AnchorTransaction withdrawal : candidates) {
            if (withdrawal.memoType() != null && !withdrawal.memoType().isBlank()
                    && !withdrawal.memoType().equalsIgnoreCase(String.valueOf(event.memoType()))) {
                continue;
            }
            if (!event.payload().path("successful").asBoolean(true)) {
                if (store.transition(withdrawal.id(), AnchorStatus.PENDING_USER_TRANSFER_START, AnchorStatus.PENDING_STELLAR,
                        clock.getAsLong())) {
                    log.warn("Ledger transaction {} for withdrawal {} failed on the ledger", event.hash(), withdrawal.id());
                    return result("payment_failed", event, withdrawal.id());
                }
                continue;
            }
            long completedAtMs = OffsetDateTime.parse(event.createdAt()).toInstant().toEpochMilli();
            if (store.completeWithdrawal(withdrawal.id(), event.hash(), completedAtMs, clock.getAsLong())) {
                log.info("Withdrawal {} completed by ledger transaction {}", withdrawal.id(), event.hash());
                return result("completed", event, withdrawal.id());
            }
        }
        return result("unmatched", event, null);
    }

    private TaskResult result(String outcome, LedgerEvent event, String transactionId) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("result", outcome);
        out.put("event_id", event.eventId());
        out.put("hash", event.hash());
        if (transactionId != null) {
            out.put("transaction_id", transactionId);
        }
        return TaskResult.ok(out);
    }
}
