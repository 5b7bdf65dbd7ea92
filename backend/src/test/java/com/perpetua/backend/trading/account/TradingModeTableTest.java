package com.perpetua.backend.trading.account;

import com.perpetua.backend.trading.account.TradingModeTable.ModeBudget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradingModeTableTest {

    private final TradingModeTable table = TradingModeTable.defaults();

    @Test
    void resolvesFirstRowWhoseBoundExceedsReturn() {
        assertThat(table.resolve(-0.25).mode()).isEqualTo(TradingMode.SURVIVAL);
        assertThat(table.resolve(-0.10).mode()).isEqualTo(TradingMode.DEFENSIVE);
        assertThat(table.resolve(-0.07).mode()).isEqualTo(TradingMode.DEFENSIVE);
        assertThat(table.resolve(0.0).mode()).isEqualTo(TradingMode.NORMAL);
        assertThat(table.resolve(0.15).mode()).isEqualTo(TradingMode.OFFENSIVE);
        assertThat(table.resolve(3.0).mode()).isEqualTo(TradingMode.AGGRESSIVE);
    }

    @Test
    void normalModeBudget() {
        ModeBudget normal = table.resolve(0.05);

        assertThat(normal.maxRiskPct()).isEqualTo(0.02);
        assertThat(normal.maxLeverage()).isEqualTo(5);
        assertThat(normal.maxPositions()).isEqualTo(3);
    }

    @Test
    void rejectsTableWithoutCatchAllRow() {
        List<ModeBudget> rows = List.of(new ModeBudget(TradingMode.NORMAL, 0.1, 0.02, 5, 3));

        assertThatThrownBy(() -> new TradingModeTable(rows))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TradingModeTable(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
