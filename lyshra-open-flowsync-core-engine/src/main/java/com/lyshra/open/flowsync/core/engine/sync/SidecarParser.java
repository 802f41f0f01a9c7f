package com.lyshra.open.flowsync.core.engine.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.models.source.WorkflowSidecar;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses and validates companion metadata files
 * ({@code canonical_workflow_id} plus per-environment {@code native_id}).
 */
@Slf4j
public final class SidecarParser {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.byDefaultProvider()
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory();

    private SidecarParser() {
        // Utility class
    }

    public static WorkflowSidecar parse(String path, String content) {
        WorkflowSidecar sidecar;
        try {
            sidecar = JSON_MAPPER.readValue(content, WorkflowSidecar.class);
        } catch (JsonProcessingException e) {
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.SIDECAR_PARSE_FAILED,
                    Map.of("path", path, "reason", String.valueOf(e.getOriginalMessage())), e);
        }
        if (sidecar == null) {
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.SIDECAR_PARSE_FAILED,
                    Map.of("path", path, "reason", "document is null"));
        }

        Validator validator = VALIDATOR_FACTORY.getValidator();
        Set<ConstraintViolation<WorkflowSidecar>> violations = validator.validate(sidecar);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.debug("Companion metadata file {} failed validation: {}", path, details);
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.SIDECAR_CONSTRAINT_VIOLATION,
                    Map.of("path", path, "violations", details));
        }
        return sidecar;
    }
}
