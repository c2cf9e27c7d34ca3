package org.pilot.usertransactions.validation;

import org.pilot.usertransactions.dto.CreateTransactionRequest;
import org.pilot.usertransactions.dto.UpdateStatusRequest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field rules for each transaction endpoint.
 */
public final class TransactionRules {

    private static final Pattern DECIMAL_UP_TO_2 = Pattern.compile("^[-+]?[0-9]*(\\.[0-9]{0,2})?$");
    private static final Set<String> NOT_DECIMAL = Set.of("", "+", "-");
    private static final Pattern NUMBER = Pattern.compile("^[-+]?([0-9]+\\.?[0-9]*|\\.[0-9]+)$");
    private static final Pattern INTEGER = Pattern.compile("^[-+]?[0-9]+$");

    private static final Set<String> TRANSACTION_TYPES = Set.of("DEPOSIT", "WITHDRAWAL");
    private static final Set<String> TARGET_STATUSES = Set.of("COMPLETED", "FAILED");

    private TransactionRules() {
    }

    public static List<FieldRule> forCreate(CreateTransactionRequest req) {
        return List.of(
                FieldRule.body("amount", req.getAmount(), req.has("amount"))
                        .required("Amount is required")
                        .check(TransactionRules::isDecimalUpTo2Places, "Amount must be a decimal with up to 2 decimal places")
                        .check(TransactionRules::isGreaterThanZero, "Amount must be greater than zero"),
                FieldRule.body("transaction_type", req.getTransactionType(), req.has("transaction_type"))
                        .required("Transaction type is required")
                        .check(TRANSACTION_TYPES::contains, "Transaction type must be DEPOSIT or WITHDRAWAL"),
                FieldRule.body("user", req.getUser(), req.has("user"))
                        .required("User ID is required")
                        .check(TransactionRules::isPositiveInteger, "User ID must be a positive integer")
        );
    }

    public static List<FieldRule> forList(String userId) {
        return List.of(
                FieldRule.query("user_id", userId)
                        .required("user_id query parameter is required")
                        .check(TransactionRules::isPositiveInteger, "user_id must be a positive integer")
        );
    }

    public static List<FieldRule> forGet(String transactionId) {
        return List.of(transactionIdRule(transactionId));
    }

    public static List<FieldRule> forStatusUpdate(String transactionId, UpdateStatusRequest req) {
        return List.of(
                transactionIdRule(transactionId),
                FieldRule.body("status", req.getStatus(), req.hasStatus())
                        .required("Status is required")
                        .check(TARGET_STATUSES::contains, "Status must be either COMPLETED or FAILED")
        );
    }

    private static FieldRule transactionIdRule(String transactionId) {
        return FieldRule.path("transaction_id", transactionId)
                .required("transaction_id parameter is required")
                .check(TransactionRules::isPositiveInteger, "transaction_id must be a positive integer");
    }

    static boolean isDecimalUpTo2Places(String value) {
        return !NOT_DECIMAL.contains(value) && DECIMAL_UP_TO_2.matcher(value).matches();
    }

    static boolean isGreaterThanZero(String value) {
        if (!NUMBER.matcher(value).matches()) return false;
        try {
            return new BigDecimal(value).signum() > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static boolean isPositiveInteger(String value) {
        // Long.parseLong alone would also take non-ASCII digits
        if (!INTEGER.matcher(value).matches()) return false;
        try {
            return Long.parseLong(value) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
