package com.perpetua.backend.repository;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradeRepository extends JpaRepository<Trade, Long> {

    List<Trade> findTop50ByOrderByCreatedAtDesc();

    List<Trade> findBySymbolOrderByCreatedAtDesc(Instrument symbol);

    List<Trade> findByStatus(Trade.TradeStatus status);

    List<Trade> findByPositionId(Long positionId);
}
