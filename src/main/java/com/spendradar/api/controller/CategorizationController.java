package com.spendradar.api.controller;

import com.spendradar.api.dto.BatchRequest;
import com.spendradar.api.dto.BatchResponse;
import com.spendradar.api.dto.FeedbackRequest;
import com.spendradar.api.dto.LearningResponse;
import com.spendradar.api.dto.MatchResponse;
import com.spendradar.api.dto.SessionResponse;
import com.spendradar.api.dto.SuggestRequest;
import com.spendradar.domain.Transaction;
import com.spendradar.learning.LearningOutcome;
import com.spendradar.session.BatchCategorizationResult;
import com.spendradar.session.CategorizationSession;
import com.spendradar.session.CategorizationSessionHolder;
import com.spendradar.session.CategorizationSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Categorization API: suggest, batch, feedback, categories, session refresh.
 */
@RestController
@RequestMapping("/api/v1/categorization")
@RequiredArgsConstructor
public class CategorizationController {

    private final CategorizationSessionService sessionService;
    private final CategorizationSessionHolder sessionHolder;

    @PostMapping("/suggest")
    public ResponseEntity<MatchResponse> suggest(@Valid @RequestBody SuggestRequest request) {
        CategorizationSession session = sessionHolder.current();
        return ResponseEntity.ok(MatchResponse.from(
                sessionService.suggest(session, request.description(), request.amount(), request.date())));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchResponse> batch(@Valid @RequestBody BatchRequest request) {
        List<Transaction> transactions = request.transactions().stream()
                .map(CategorizationController::toTransaction)
                .toList();
        BatchCategorizationResult result = sessionService.categorizeBatch(
                sessionHolder.current(), transactions, request.onlyUncategorizedOrDefault());
        List<BatchResponse.Item> items = result.decisions().stream()
                .map(d -> new BatchResponse.Item(
                        d.transaction().getId(),
                        d.transaction().getDescription(),
                        d.assigned(),
                        MatchResponse.from(d.result())))
                .toList();
        return ResponseEntity.ok(new BatchResponse(result.processed(), result.assigned(), result.skipped(), items));
    }

    @PostMapping("/feedback")
    public ResponseEntity<LearningResponse> feedback(@Valid @RequestBody FeedbackRequest request) {
        LearningOutcome outcome = sessionService.confirmCategory(
                sessionHolder.current(), request.description(), request.category());
        return ResponseEntity.ok(new LearningResponse(
                outcome.addedRules().stream()
                        .map(r -> new LearningResponse.RuleDto(r.keyword(), r.category()))
                        .toList(),
                outcome.vendorKeys(),
                outcome.rules().size()));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<String>> categories() {
        return ResponseEntity.ok(sessionHolder.current().categories());
    }

    @PostMapping("/session/refresh")
    public ResponseEntity<SessionResponse> refresh() {
        CategorizationSession session = sessionHolder.refresh();
        return ResponseEntity.ok(new SessionResponse(
                session.openedAt(), session.rules().size(), session.vendorMap().size(), session.categories()));
    }

    private static Transaction toTransaction(BatchRequest.Item item) {
        Transaction tx = new Transaction(item.date(), item.description(), item.amount(), item.category());
        tx.setId(item.id());
        return tx;
    }
}
