package com.portfoliotracker.engine.controller;

import com.portfoliotracker.engine.controller.dto.TransactionRequest;
import com.portfoliotracker.engine.domain.Transaction;
import com.portfoliotracker.engine.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for reading and appending ledger transactions.
 */
@RestController
@RequestMapping("/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerService ledgerService;

    /**
     * List transactions in replay order, optionally filtered by symbol and date range.
     */
    @GetMapping
    public ResponseEntity<List<Transaction>> getTransactions(
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("GET /transactions - symbol: {}, {} to {}", symbol, startDate, endDate);

        return ResponseEntity.ok(ledgerService.getTransactions(symbol, startDate, endDate));
    }

    /**
     * Append a transaction.
     *
     * @param request the transaction to record
     * @return the stored transaction with its id
     */
    @PostMapping
    public ResponseEntity<Transaction> addTransaction(@Valid @RequestBody TransactionRequest request) {

        log.info("POST /transactions - {} {} x{} on {}",
                request.getType(), request.getSymbol(), request.getQuantity(), request.getDate());

        Transaction saved = ledgerService.append(request.toTransaction());

        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }
}
