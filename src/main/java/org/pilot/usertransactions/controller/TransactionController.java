package org.pilot.usertransactions.controller;

import org.pilot.usertransactions.dto.CreateTransactionRequest;
import org.pilot.usertransactions.dto.TransactionListResponse;
import org.pilot.usertransactions.dto.TransactionResponse;
import org.pilot.usertransactions.dto.UpdateStatusRequest;
import org.pilot.usertransactions.entity.TransactionStatus;
import org.pilot.usertransactions.entity.TransactionType;
import org.pilot.usertransactions.service.TransactionService;
import org.pilot.usertransactions.validation.RequestValidator;
import org.pilot.usertransactions.validation.TransactionRules;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/transactions")
public class TransactionController {

    private final TransactionService transactionService;

    public TransactionController(TransactionService transactionService) {
        this.transactionService = transactionService;
    }

    @PostMapping({"", "/"})
    public ResponseEntity<TransactionResponse> createTransaction(@RequestBody(required = false) CreateTransactionRequest req) {
        CreateTransactionRequest body = req != null ? req : new CreateTransactionRequest();
        RequestValidator.validate(TransactionRules.forCreate(body));

        TransactionResponse res = transactionService.create(
                new BigDecimal(body.getAmount()),
                TransactionType.valueOf(body.getTransactionType()),
                Long.parseLong(body.getUser()));
        return ResponseEntity.status(HttpStatus.CREATED).body(res);
    }

    @GetMapping({"", "/"})
    public ResponseEntity<TransactionListResponse> listTransactions(@RequestParam(value = "user_id", required = false) String userId) {
        RequestValidator.validate(TransactionRules.forList(userId));
        return ResponseEntity.ok(transactionService.listForUser(Long.parseLong(userId)));
    }

    @GetMapping({"/{transaction_id}", "/{transaction_id}/"})
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("transaction_id") String transactionId) {
        RequestValidator.validate(TransactionRules.forGet(transactionId));
        return ResponseEntity.ok(transactionService.get(Long.parseLong(transactionId)));
    }

    @PutMapping({"/{transaction_id}", "/{transaction_id}/"})
    public ResponseEntity<TransactionResponse> updateStatus(@PathVariable("transaction_id") String transactionId,
                                                            @RequestBody(required = false) UpdateStatusRequest req) {
        UpdateStatusRequest body = req != null ? req : new UpdateStatusRequest();
        RequestValidator.validate(TransactionRules.forStatusUpdate(transactionId, body));
        return ResponseEntity.ok(transactionService.updateStatus(Long.parseLong(transactionId), TransactionStatus.valueOf(body.getStatus())));
    }
}
