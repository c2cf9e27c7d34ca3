package org.pilot.usertransactions.exception;

public class TransactionNotFoundException extends RuntimeException {

    private final Long transactionId;

    public TransactionNotFoundException(Long transactionId) {
        super("Transaction not found");
        this.transactionId = transactionId;
    }

    public Long getTransactionId() {
        return transactionId;
    }
}
