package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import com.zenith.backend.dto.IncomeRequest;
import com.zenith.backend.dto.PurchaseRequest;
import com.zenith.backend.dto.TransactionDTO;
import com.zenith.backend.security.UserPrincipal;
import com.zenith.backend.service.LedgerService;
import com.zenith.backend.service.PurchaseDecision;
import com.zenith.backend.service.PurchaseRuleEngine;
import com.zenith.backend.service.ai.PurchaseAdvice;
import com.zenith.backend.service.ai.PurchaseAdvisor;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Money movement. Blocked purchases are normal 200 responses carrying the decision.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_PURCHASES)
public class LedgerController {

    private final PurchaseRuleEngine ruleEngine;
    private final PurchaseAdvisor purchaseAdvisor;
    private final LedgerService ledgerService;

    @PostMapping({"/purchases/attempt", "/purchases/execute"})
    public PurchaseDecision attemptPurchase(@AuthenticationPrincipal UserPrincipal principal,
                                            @Valid @RequestBody PurchaseRequest request) {
        return ruleEngine.evaluatePurchase(principal.getUserId(), request.getAmount(), request.getItemName());
    }

    @PostMapping("/purchases/evaluate")
    public PurchaseAdvice evaluatePurchase(@AuthenticationPrincipal UserPrincipal principal,
                                           @Valid @RequestBody PurchaseRequest request) {
        return purchaseAdvisor.evaluate(principal.getUserId(), request.getItemName(), request.getAmount());
    }

    @PostMapping("/income")
    public PurchaseDecision addIncome(@AuthenticationPrincipal UserPrincipal principal,
                                      @Valid @RequestBody IncomeRequest request) {
        return ruleEngine.addIncome(principal.getUserId(), request.getAmount(), request.getSource());
    }

    @GetMapping("/transactions")
    public List<TransactionDTO> transactions(@AuthenticationPrincipal UserPrincipal principal) {
        return ledgerService.history(principal.getUserId());
    }
}
