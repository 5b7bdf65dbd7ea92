package com.perpetua.backend.trading.execution;

import com.perpetua.backend.service.exchange.ExchangeGateway.ExchangePosition;
import com.perpetua.backend.trading.account.AccountRiskProfile;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-cycle state shared by all symbols of one cycle: the account profile computed at cycle
 * start and the notional and margin admitted by Buys since then.
 */
public class CycleContext {

    private final String cycleId;
    private final AccountRiskProfile profile;
    private final Instant startedAt;
    private final Instant deadline;
    private double admittedNotional;
    private double committedMargin;

    public CycleContext(AccountRiskProfile profile, Instant startedAt, Instant deadline) {
        this(UUID.randomUUID().toString(), profile, startedAt, deadline);
    }

    public CycleContext(String cycleId, AccountRiskProfile profile, Instant startedAt, Instant deadline) {
        this.cycleId = cycleId;
        this.profile = profile;
        this.startedAt = startedAt;
        this.deadline = deadline;
    }

    public String getCycleId() {
        return cycleId;
    }

    public AccountRiskProfile getProfile() {
        return profile;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    public double totalEquity() {
        return profile.account().totalEquity();
    }

    public double availableCash() {
        return profile.account().availableCash();
    }

    /**
     * Absolute notional of exchange positions as seen at cycle start.
     */
    public double exchangeOpenNotional() {
        return profile.account().positions().stream()
                .mapToDouble(ExchangePosition::notional)
                .map(Math::abs)
                .sum();
    }

    public synchronized double getAdmittedNotional() {
        return admittedNotional;
    }

    public synchronized double getCommittedMargin() {
        return committedMargin;
    }

    public synchronized void recordAdmission(double notional, double margin) {
        admittedNotional += notional;
        committedMargin += margin;
    }
}
