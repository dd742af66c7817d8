package com.phillippitts.livenesswatch.presentation.controller;

import com.phillippitts.livenesswatch.domain.WatchdogSnapshot;
import com.phillippitts.livenesswatch.service.watchdog.Watchdog;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * External triggers for the watchdog.
 *
 * <p>Feed and stop accept either a JSON body or a plain-text body. A plain-text body holding a
 * JSON object is read like the JSON body; any other text is taken as the {@code info} string.
 * Both forms go through the same constraints.
 */
@RestController
@RequestMapping("/api/v1/watchdog")
class WatchdogController {

    private static final Logger LOG = LogManager.getLogger(WatchdogController.class);

    private final Watchdog watchdog;
    private final Validator validator;

    WatchdogController(Watchdog watchdog, Validator validator) {
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @PostMapping(path = "/feed", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> feed(@Valid @RequestBody(required = false) FeedRequest request) {
        FeedRequest r = request == null ? FeedRequest.EMPTY : request;
        LOG.debug("Feed trigger: timeoutMs={}, info={}", r.timeoutMs(), r.info());
        return result(watchdog.feed(r.timeoutMs(), r.info()));
    }

    @PostMapping(path = "/feed", consumes = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<Map<String, Object>> feedText(@RequestBody(required = false) String text) {
        FeedRequest r = validated(FeedRequest.fromText(text));
        LOG.debug("Feed trigger (text): timeoutMs={}, info={}", r.timeoutMs(), r.info());
        return result(watchdog.feed(r.timeoutMs(), r.info()));
    }

    @PostMapping(path = "/stop", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> stop(@Valid @RequestBody(required = false) StopRequest request) {
        StopRequest r = request == null ? StopRequest.EMPTY : request;
        LOG.debug("Stop trigger: info={}", r.info());
        return result(watchdog.manualStop(r.info()));
    }

    @PostMapping(path = "/stop", consumes = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<Map<String, Object>> stopText(@RequestBody(required = false) String text) {
        StopRequest r = validated(StopRequest.fromText(text));
        return result(watchdog.manualStop(r.info()));
    }

    @GetMapping
    ResponseEntity<WatchdogSnapshot> status() {
        return ResponseEntity.ok(watchdog.snapshot());
    }

    private <T> T validated(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return request;
    }

    private static ResponseEntity<Map<String, Object>> result(boolean success) {
        return ResponseEntity.ok(Map.of("success", success));
    }
}
