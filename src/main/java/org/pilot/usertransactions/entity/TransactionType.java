package org.pilot.usertransactions.entity;

public enum TransactionType {
    DEPOSIT, WITHDRAWAL
}
