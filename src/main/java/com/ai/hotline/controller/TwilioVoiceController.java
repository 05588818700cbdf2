package com.ai.hotline.controller;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.provider.TwimlProviderAdapter;
import com.ai.hotline.service.CallFlowService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Twilio voice webhooks. Configure the number's "A call comes in" URL as {@code <base-url>/voice}.
 */
@RestController
public class TwilioVoiceController {

    private final CallFlowService callFlowService;
    private final TwimlProviderAdapter adapter;
    private final Executor turnExecutor;
    private final long turnTimeoutMillis;

    public TwilioVoiceController(CallFlowService callFlowService,
                                 TwimlProviderAdapter adapter,
                                 @Qualifier("turnExecutor") Executor turnExecutor,
                                 HotlineProperties properties) {
        this.callFlowService = callFlowService;
        this.adapter = adapter;
        this.turnExecutor = turnExecutor;
        this.turnTimeoutMillis = properties.getTurnTimeout().toMillis();
    }

    @PostMapping(value = TwimlProviderAdapter.VOICE_PATH, produces = MediaType.APPLICATION_XML_VALUE)
    public CompletableFuture<ResponseEntity<String>> voice(@RequestParam(required = false) Map<String, String> params) {
        return CompletableFuture.supplyAsync(() -> callFlowService.answerCall(adapter, params), turnExecutor)
                .completeOnTimeout(callFlowService.fallbackGreeting(adapter), turnTimeoutMillis, TimeUnit.MILLISECONDS)
                .thenApply(this::twiml);
    }

    @PostMapping(value = TwimlProviderAdapter.GATHER_PATH, produces = MediaType.APPLICATION_XML_VALUE)
    public CompletableFuture<ResponseEntity<String>> gather(@RequestParam(required = false) Map<String, String> params) {
        return CompletableFuture.supplyAsync(() -> callFlowService.handleSpeech(adapter, params), turnExecutor)
                .completeOnTimeout(callFlowService.fallbackTurn(adapter), turnTimeoutMillis, TimeUnit.MILLISECONDS)
                .thenApply(this::twiml);
    }

    private ResponseEntity<String> twiml(String document) {
        return ResponseEntity.ok().contentType(adapter.contentType()).body(document);
    }
}
