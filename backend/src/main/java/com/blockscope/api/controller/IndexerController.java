package com.blockscope.api.controller;

import com.blockscope.api.dto.ApiResponse;
import com.blockscope.explorer.AddressExplorerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/indexer/status. Always 200; failures are reported in data.state.
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final AddressExplorerService explorerService;

    @GetMapping("/status")
    public Mono<ResponseEntity<?>> status() {
        return Mono.fromCallable(() -> explorerService.getIndexerStatus(true))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(status -> ResponseEntity.ok(ApiResponse.of(status, Map.of("generatedAt", Instant.now().toString()))));
    }
}
