package io.ledgerrelay.ledger;

import java.util.List;

public class TransactionRejectedException extends HorizonRequestException {
    private final String transactionCode;
    private final List<String> operationCodes;

    public TransactionRejectedException(int status, String message, String transactionCode, List<String> operationCodes) {
        super(status, message);
        this.transactionCode = transactionCode;
        this.operationCodes = operationCodes == null ? List.of() : List.copyOf(operationCodes);
    }

    public String transactionCode() {
        return transactionCode;
    }

    public List<String> operationCodes() {
        return operationCodes;
    }

    public boolean hasOperationCode(String code) {
        return operationCodes.contains(code);
    }
}
