package com.neuronplatform.orchestrator.controller;

import com.neuronplatform.common.trace.TraceContextUtil;
import com.neuronplatform.orchestrator.logger.TurnFlowLogger;
import com.neuronplatform.orchestrator.service.BrainStats;
import com.neuronplatform.orchestrator.service.ConversationService;
import com.neuronplatform.orchestrator.service.SessionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/conversation")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationService conversationService;
    private final TurnFlowLogger      turnFlowLogger;

    public ConversationController(ConversationService conversationService, TurnFlowLogger turnFlowLogger) {
        this.conversationService = conversationService;
        this.turnFlowLogger      = turnFlowLogger;
    }

    @PostMapping("/turn")
    public Mono<ResponseEntity<TurnResponse>> turn(
            @RequestBody TurnRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceIdHeader) {
        String traceId = traceIdHeader == null || traceIdHeader.isBlank()
            ? TraceContextUtil.newTraceId()
            : traceIdHeader;

        Mono<ResponseEntity<TurnResponse>> pipeline = conversationService.turn(request.text())
            .map(result -> ResponseEntity.ok(TurnResponse.from(result, traceId)))
            .doOnEach(turnFlowLogger.stage(TurnFlowLogger.RESPONSE_SENT))
            .onErrorResume(IllegalArgumentException.class, e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("[Conversation] rejected turn reason={} traceId={}", e.getMessage(), traceId));
                return Mono.just(ResponseEntity.badRequest().build());
            });

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    @GetMapping("/brain")
    public Mono<ResponseEntity<BrainStats>> brain() {
        return Mono.fromCallable(conversationService::brainStats)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/profile")
    public Mono<ResponseEntity<SessionProfile>> profile() {
        return Mono.fromCallable(conversationService::profile)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/seed/{seed}")
    public Mono<ResponseEntity<SessionProfile>> seed(@PathVariable long seed) {
        return Mono.fromCallable(() -> {
                conversationService.setSeed(seed);
                return conversationService.profile();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
