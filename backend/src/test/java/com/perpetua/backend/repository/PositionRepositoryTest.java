package com.perpetua.backend.repository;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.PositionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PositionRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PositionRepository positionRepository;

    @Test
    void findsOpenPositionPerSymbol() {
        Position btc = entityManager.persist(position(Instrument.BTC, PositionStatus.OPEN, 0.0, null));
        entityManager.persist(position(Instrument.ETH, PositionStatus.CLOSED, 5.0, NOW));
        entityManager.flush();

        assertThat(positionRepository.findFirstBySymbolAndStatus(Instrument.BTC, PositionStatus.OPEN)).contains(btc);
        assertThat(positionRepository.findFirstBySymbolAndStatus(Instrument.ETH, PositionStatus.OPEN)).isEmpty();
        assertThat(positionRepository.countBySymbolAndStatus(Instrument.BTC, PositionStatus.OPEN)).isEqualTo(1);
    }

    @Test
    void closedHistoryIsOrderedByCloseTime() {
        entityManager.persist(position(Instrument.BTC, PositionStatus.CLOSED, 3.0, NOW.minusSeconds(60)));
        entityManager.persist(position(Instrument.ETH, PositionStatus.LIQUIDATED, -8.0, NOW.minusSeconds(3600)));
        entityManager.persist(position(Instrument.SOL, PositionStatus.OPEN, 0.0, null));
        entityManager.flush();

        List<Position> closed = positionRepository.findByStatusInOrderByClosedAtAsc(
                List.of(PositionStatus.CLOSED, PositionStatus.LIQUIDATED));

        assertThat(closed).extracting(Position::getRealizedPnl).containsExactly(-8.0, 3.0);
    }

    @Test
    void closedSinceFiltersByWindowStart() {
        entityManager.persist(position(Instrument.BTC, PositionStatus.CLOSED, -2.0, NOW.minusSeconds(3600)));
        entityManager.persist(position(Instrument.ETH, PositionStatus.CLOSED, -9.0, NOW.minusSeconds(90000)));
        entityManager.flush();

        List<Position> lastDay = positionRepository.findByStatusInAndClosedAtGreaterThanEqual(
                List.of(PositionStatus.CLOSED, PositionStatus.LIQUIDATED), NOW.minusSeconds(86400));

        assertThat(lastDay).extracting(Position::getSymbol).containsExactly(Instrument.BTC);
    }

    private static Position position(Instrument symbol, PositionStatus status, double pnl, Instant closedAt) {
        return Position.builder()
                .symbol(symbol)
                .status(status)
                .entryPrice(100.0)
                .entryAmount(1.0)
                .entryLeverage(2)
                .realizedPnl(pnl)
                .openedAt(NOW.minusSeconds(100000))
                .closedAt(closedAt)
                .build();
    }
}
