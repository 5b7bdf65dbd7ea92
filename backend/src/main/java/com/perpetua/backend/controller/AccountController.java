package com.perpetua.backend.controller;

import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.account.AccountRiskProfiler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/account")
@RequiredArgsConstructor
@Tag(name = "Account")
public class AccountController {

    private final AccountRiskProfiler accountRiskProfiler;

    @GetMapping("/profile")
    @Operation(summary = "Compute the current account risk profile from live exchange state")
    public ResponseEntity<AccountRiskProfile> getProfile() {
        return ResponseEntity.ok(accountRiskProfiler.profile());
    }
}
