package com.perpetua.backend.trading.execution;

import com.perpetua.backend.exception.DecisionValidationException;
import com.perpetua.backend.model.Trade.Operation;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DecisionParserTest {

    private final DecisionParser parser = new DecisionParser(Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    void parsesBuyWithProtectionLevels() {
        TradeDecision decision = parser.parse("""
                {"operation":"Buy","buy":{"pricing":50000,"amount":0.002,"leverage":5},
                 "adjustProfit":{"stopLoss":49000,"takeProfit":51500},"chat":"trend up"}
                """);

        assertThat(decision.operation()).isEqualTo(Operation.BUY);
        assertThat(decision.buy().amount()).isEqualTo(0.002);
        assertThat(decision.buy().leverage()).isEqualTo(5);
        assertThat(decision.stopLoss()).isEqualTo(49000.0);
        assertThat(decision.takeProfit()).isEqualTo(51500.0);
        assertThat(decision.chat()).isEqualTo("trend up");
    }

    @Test
    void parsesSellAndHold() {
        assertThat(parser.parse("{\"operation\":\"SELL\",\"sell\":{\"percentage\":40}}").sell().percentage())
                .isEqualTo(40.0);

        TradeDecision hold = parser.parse("{\"operation\":\"hold\"}");
        assertThat(hold.operation()).isEqualTo(Operation.HOLD);
        assertThat(hold.hasAdjustment()).isFalse();
    }

    @Test
    void rejectsUnknownField() {
        assertThatThrownBy(() -> parser.parse("{\"operation\":\"Hold\",\"confidence\":0.9}"))
                .isInstanceOf(DecisionValidationException.class)
                .hasMessageStartingWith("Malformed trade decision");
    }

    @Test
    void rejectsStringWhereNumberExpected() {
        assertThatThrownBy(() -> parser.parse("{\"operation\":\"Sell\",\"sell\":{\"percentage\":\"40\"}}"))
                .isInstanceOf(DecisionValidationException.class)
                .hasMessageStartingWith("Malformed trade decision");
    }

    @Test
    void rejectsFractionalLeverage() {
        assertThatThrownBy(() -> parser.parse(
                "{\"operation\":\"Buy\",\"buy\":{\"pricing\":100,\"amount\":1,\"leverage\":2.5}}"))
                .isInstanceOf(DecisionValidationException.class);
    }

    @Test
    void rejectsUnknownOperation() {
        assertThatThrownBy(() -> parser.parse("{\"operation\":\"Short\"}"))
                .isInstanceOf(DecisionValidationException.class);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(DecisionValidationException.class)
                .hasMessage("Empty trade decision");
        assertThatThrownBy(() -> parser.parse("not json"))
                .isInstanceOf(DecisionValidationException.class);
    }

    @Test
    void rejectsBuyWithoutBuyOrder() {
        DecisionValidationException error = catchThrowableOfType(
                () -> parser.parse("{\"operation\":\"Buy\"}"), DecisionValidationException.class);

        assertThat(error.getViolations()).containsExactly("buy: required when operation is Buy");
    }

    @Test
    void rejectsPercentageAboveHundred() {
        DecisionValidationException error = catchThrowableOfType(
                () -> parser.parse("{\"operation\":\"Sell\",\"sell\":{\"percentage\":150}}"),
                DecisionValidationException.class);

        assertThat(error.getMessage()).startsWith("Invalid trade decision");
        assertThat(error.getViolations()).anyMatch(v -> v.startsWith("sell.percentage"));
    }

    @Test
    void rejectsNonPositiveAmount() {
        DecisionValidationException error = catchThrowableOfType(
                () -> parser.parse("{\"operation\":\"Buy\",\"buy\":{\"pricing\":100,\"amount\":0,\"leverage\":2}}"),
                DecisionValidationException.class);

        assertThat(error.getViolations()).anyMatch(v -> v.startsWith("buy.amount"));
    }
}
