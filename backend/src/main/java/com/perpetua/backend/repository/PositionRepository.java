package com.perpetua.backend.repository;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    Optional<Position> findFirstBySymbolAndStatus(Instrument symbol, PositionStatus status);

    long countBySymbolAndStatus(Instrument symbol, PositionStatus status);

    List<Position> findByStatus(PositionStatus status);

    List<Position> findByStatusInOrderByClosedAtAsc(Collection<PositionStatus> statuses);

    List<Position> findByStatusInAndClosedAtGreaterThanEqual(Collection<PositionStatus> statuses, Instant since);
}
