package com.blockscope.api.controller;

import com.blockscope.api.dto.ApiResponse;
import com.blockscope.api.dto.ErrorBody;
import com.blockscope.api.validation.AddressValidator;
import com.blockscope.explorer.AddressExplorerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/xpub")
@RequiredArgsConstructor
public class XpubController {

    private final AddressValidator addressValidator;
    private final AddressExplorerService explorerService;

    @GetMapping("/{xpub}")
    public Mono<ResponseEntity<?>> getXpub(@PathVariable String xpub) {
        if (!addressValidator.isValidXpub(xpub)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_XPUB", "Invalid extended public key")));
        }
        String key = xpub.trim();
        return Mono.fromCallable(() -> explorerService.getXpubDetails(key))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(details -> ResponseEntity.ok(ApiResponse.of(details)));
    }
}
