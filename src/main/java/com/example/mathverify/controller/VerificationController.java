package com.example.mathverify.controller;

import com.example.mathverify.model.AutoFix;
import com.example.mathverify.model.Heading;
import com.example.mathverify.model.NormalizedSolution;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifyRequest;
import com.example.mathverify.orchestrator.VerificationDispatcher;
import com.example.mathverify.service.BlockParser;
import com.example.mathverify.service.DirectiveNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for exercise verification.
 */
@RestController
@RequestMapping("/api")
public class VerificationController {

    private static final Logger log = LoggerFactory.getLogger(VerificationController.class);

    private final VerificationDispatcher dispatcher;
    private final DirectiveNormalizer normalizer;
    private final BlockParser blockParser;

    public VerificationController(VerificationDispatcher dispatcher,
                                  DirectiveNormalizer normalizer,
                                  BlockParser blockParser) {
        this.dispatcher = dispatcher;
        this.normalizer = normalizer;
        this.blockParser = blockParser;
    }

    /**
     * Verifies a generated solution, optionally normalizing it first.
     *
     * <p>Endpoint: POST /api/verify
     * <p>Body: {@code {"topic": "...", "statement": "...", "solution": "...", "autoFix": true}}
     */
    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> verify(@RequestBody VerifyRequest request) {
        if (request.statement() == null) {
            return badRequest("Missing statement.");
        }
        if (request.solution() == null || request.solution().isBlank()) {
            return badRequest("Missing or empty solution.");
        }

        log.info("Received verification request (topic='{}', autoFix={}, {} chars)",
                request.topic(), request.autoFix(), request.solution().length());
        try {
            if (request.autoFix()) {
                NormalizedSolution normalized = normalizer.normalize(request.statement(), request.solution());
                VerificationReport report = dispatcher.verify(request.topic(), normalized);
                return ResponseEntity.ok()
                        .header("X-AutoFix-Applied", normalized.fixes().stream()
                                .map(AutoFix::name).collect(Collectors.joining(",")))
                        .body(report);
            }
            return ResponseEntity.ok(dispatcher.verify(request.topic(), request.statement(), request.solution()));

        } catch (Exception e) {
            log.error("Error during verification", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during verification",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Applies the auto-fix repairs without verifying.
     *
     * <p>Endpoint: POST /api/normalize
     */
    @PostMapping(value = "/normalize", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> normalize(@RequestBody VerifyRequest request) {
        if (request.solution() == null) {
            return badRequest("Missing solution.");
        }
        return ResponseEntity.ok(normalizer.normalize(request.statement(), request.solution()));
    }

    /**
     * Splits a solution into its heading blocks; an unstructured text gives an empty object.
     *
     * <p>Endpoint: POST /api/blocks
     */
    @PostMapping(value = "/blocks", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> blocks(@RequestBody VerifyRequest request) {
        if (request.solution() == null) {
            return badRequest("Missing solution.");
        }
        Map<Heading, String> blocks = blockParser.extractBlocks(request.solution());
        return ResponseEntity.ok(blocks);
    }

    /**
     * Lists the registered verifiers.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "math-verify",
                "verifiers", dispatcher.registeredVerifiers()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
