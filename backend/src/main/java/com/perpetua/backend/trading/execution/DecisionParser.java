package com.perpetua.backend.trading.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.perpetua.backend.exception.DecisionValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Strict reader for advisor decisions: unknown fields, coerced scalars and a missing
 * operation-specific sub-object all fail with {@link DecisionValidationException}.
 */
@Slf4j
@Component
public class DecisionParser {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private final Validator validator;

    public DecisionParser(Validator validator) {
        this.validator = validator;
    }

    public TradeDecision parse(String json) {
        if (json == null || json.isBlank()) {
            throw new DecisionValidationException("Empty trade decision");
        }
        TradeDecision decision;
        try {
            decision = mapper.readValue(json, TradeDecision.class);
        } catch (JsonProcessingException e) {
            throw new DecisionValidationException("Malformed trade decision: " + e.getOriginalMessage(), e);
        }
        if (decision == null) {
            throw new DecisionValidationException("Empty trade decision");
        }
        Set<ConstraintViolation<TradeDecision>> violations = validator.validate(decision);
        if (!violations.isEmpty()) {
            List<String> details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .distinct()
                    .sorted()
                    .toList();
            throw new DecisionValidationException("Invalid trade decision", details);
        }
        return decision.requireConsistent();
    }
}
