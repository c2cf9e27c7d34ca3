package org.pilot.usertransactions.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.pilot.usertransactions.entity.TransactionRecord;
import org.pilot.usertransactions.entity.TransactionStatus;
import org.pilot.usertransactions.entity.TransactionType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Transaction as returned by the API. {@code user} is only populated by the
 * create endpoint and omitted from the JSON otherwise.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"transaction_id", "amount", "transaction_type", "status", "user", "timestamp"})
public class TransactionResponse {

    @JsonProperty("transaction_id")
    private Long transactionId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal amount;

    @JsonProperty("transaction_type")
    private TransactionType transactionType;

    private TransactionStatus status;

    private Long user;

    private Instant timestamp;

    public static TransactionResponse of(TransactionRecord rec) {
        BigDecimal amount = rec.getAmount() == null ? null : rec.getAmount().setScale(2, RoundingMode.HALF_UP);
        return new TransactionResponse(rec.getId(), amount, rec.getType(), rec.getStatus(), null, rec.getTimestamp());
    }

    public static TransactionResponse withUser(TransactionRecord rec) {
        TransactionResponse res = of(rec);
        res.setUser(rec.getUserId());
        return res;
    }
}
