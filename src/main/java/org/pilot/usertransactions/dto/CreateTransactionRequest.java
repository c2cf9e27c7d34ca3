package org.pilot.usertransactions.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Raw create body. Fields stay textual so that malformed values reach the
 * validation rules instead of failing JSON binding; numbers are coerced to
 * their literal text by Jackson. Setters record which properties the body
 * carried, including ones sent as {@code null}.
 */
@Getter
@NoArgsConstructor
public class CreateTransactionRequest {
    private String amount;

    @JsonProperty("transaction_type")
    private String transactionType;

    private String user;

    @Getter(AccessLevel.NONE)
    private final Set<String> present = new HashSet<>();

    public CreateTransactionRequest(String amount, String transactionType, String user) {
        if (amount != null) setAmount(amount);
        if (transactionType != null) setTransactionType(transactionType);
        if (user != null) setUser(user);
    }

    public void setAmount(String amount) {
        this.amount = amount;
        present.add("amount");
    }

    @JsonProperty("transaction_type")
    public void setTransactionType(String transactionType) {
        this.transactionType = transactionType;
        present.add("transaction_type");
    }

    public void setUser(String user) {
        this.user = user;
        present.add("user");
    }

    public boolean has(String property) {
        return present.contains(property);
    }
}
