package com.purchasingpower.emsflow.api;

import com.purchasingpower.emsflow.exception.DuplicateRequestException;
import com.purchasingpower.emsflow.service.AutomationAssistantService;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for the automation-rule assistant.
 *
 * POST /api/v1/assistant/query                 run one request to completion (409 if its id is running)
 * POST /api/v1/assistant/requests/{id}/cancel  cancel a running request
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private final AutomationAssistantService assistantService;

    @PostMapping("/query")
    public ResponseEntity<AssistantResponse> query(@Valid @RequestBody AssistantRequest request) {
        String requestId = request.getRequestId() != null && !request.getRequestId().isBlank()
                ? request.getRequestId()
                : UUID.randomUUID().toString();
        log.info("📨 Assistant query {}: {}", requestId, request.getQuery());

        try {
            WorkflowOutcome outcome = assistantService.handle(request.getQuery(), requestId);
            return ResponseEntity.ok(AssistantResponse.fromOutcome(requestId, outcome));
        } catch (DuplicateRequestException e) {
            log.warn("Assistant query {} rejected: {}", requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(AssistantResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Assistant query {} failed", requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AssistantResponse.error("Request failed: " + e.getMessage()));
        }
    }

    @PostMapping("/requests/{requestId}/cancel")
    public ResponseEntity<AssistantResponse> cancel(@PathVariable String requestId) {
        if (!assistantService.cancel(requestId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(AssistantResponse.error("No running request with id " + requestId));
        }
        return ResponseEntity.accepted().body(AssistantResponse.builder()
                .success(true)
                .requestId(requestId)
                .status("CANCELLING")
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AssistantResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(AssistantResponse.error(message));
    }
}
