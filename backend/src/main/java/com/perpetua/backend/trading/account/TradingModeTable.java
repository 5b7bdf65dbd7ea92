package com.perpetua.backend.trading.account;

import com.perpetua.backend.config.TradingProperties;

import java.util.List;

/**
 * Ordered, first-match table from account return to a risk budget.
 * Rows run from the most defensive mode to the least; the last row must be unbounded.
 */
public record TradingModeTable(List<ModeBudget> rows) {

    public TradingModeTable {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Trading mode table must not be empty");
        }
        rows = List.copyOf(rows);
        if (rows.get(rows.size() - 1).returnUpperBound() != null) {
            throw new IllegalArgumentException("Last trading mode row must have no upper bound");
        }
    }

    public static TradingModeTable from(List<TradingProperties.ModeThreshold> thresholds) {
        return new TradingModeTable(thresholds.stream()
                .map(row -> new ModeBudget(row.getMode(), row.getReturnUpperBound(), row.getMaxRiskPct(),
                        row.getMaxLeverage(), row.getMaxPositions()))
                .toList());
    }

    public static TradingModeTable defaults() {
        return from(new TradingProperties.Account().getModes());
    }

    public ModeBudget resolve(double returnOnCapital) {
        for (ModeBudget row : rows) {
            if (row.returnUpperBound() == null || returnOnCapital < row.returnUpperBound()) {
                return row;
            }
        }
        return rows.get(rows.size() - 1);
    }

    /**
     * @param returnUpperBound exclusive bound on return since inception, null for "otherwise"
     */
    public record ModeBudget(TradingMode mode, Double returnUpperBound, double maxRiskPct, int maxLeverage, int maxPositions) {}
}
