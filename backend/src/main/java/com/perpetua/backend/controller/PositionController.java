package com.perpetua.backend.controller;

import com.perpetua.backend.dto.PositionDTO;
import com.perpetua.backend.model.Position.PositionStatus;
import com.perpetua.backend.repository.PositionRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionController {

    private final PositionRepository positionRepository;

    @GetMapping
    @Operation(summary = "List positions, optionally filtered by status")
    public ResponseEntity<List<PositionDTO>> getPositions(@RequestParam(required = false) PositionStatus status) {
        List<PositionDTO> positions = (status == null
                ? positionRepository.findAll(Sort.by(Sort.Direction.DESC, "openedAt"))
                : positionRepository.findByStatus(status))
                .stream()
                .map(PositionDTO::from)
                .toList();
        return ResponseEntity.ok(positions);
    }
}
