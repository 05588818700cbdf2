package com.ai.hotline.controller;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.provider.JambonzProviderAdapter;
import com.ai.hotline.service.CallFlowService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Jambonz application webhooks. The body is read as raw text so that a malformed
 * payload still gets a verb array back instead of a 400.
 */
@RestController
public class JambonzController {

    private final CallFlowService callFlowService;
    private final JambonzProviderAdapter adapter;
    private final Executor turnExecutor;
    private final long turnTimeoutMillis;

    public JambonzController(CallFlowService callFlowService,
                             JambonzProviderAdapter adapter,
                             @Qualifier("turnExecutor") Executor turnExecutor,
                             HotlineProperties properties) {
        this.callFlowService = callFlowService;
        this.adapter = adapter;
        this.turnExecutor = turnExecutor;
        this.turnTimeoutMillis = properties.getTurnTimeout().toMillis();
    }

    @PostMapping(value = JambonzProviderAdapter.CALL_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<String>> call(@RequestBody(required = false) String body) {
        return CompletableFuture.supplyAsync(() -> callFlowService.answerCall(adapter, body), turnExecutor)
                .completeOnTimeout(callFlowService.fallbackGreeting(adapter), turnTimeoutMillis, TimeUnit.MILLISECONDS)
                .thenApply(this::verbs);
    }

    @PostMapping(value = JambonzProviderAdapter.GATHER_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<String>> gather(@RequestBody(required = false) String body) {
        return CompletableFuture.supplyAsync(() -> callFlowService.handleSpeech(adapter, body), turnExecutor)
                .completeOnTimeout(callFlowService.fallbackTurn(adapter), turnTimeoutMillis, TimeUnit.MILLISECONDS)
                .thenApply(this::verbs);
    }

    private ResponseEntity<String> verbs(String document) {
        return ResponseEntity.ok().contentType(adapter.contentType()).body(document);
    }
}
