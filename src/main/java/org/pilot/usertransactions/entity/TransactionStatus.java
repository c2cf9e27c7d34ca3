package org.pilot.usertransactions.entity;

public enum TransactionStatus {
    PENDING, COMPLETED, FAILED
}
