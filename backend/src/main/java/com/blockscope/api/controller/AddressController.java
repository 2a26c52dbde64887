package com.blockscope.api.controller;

import com.blockscope.api.dto.ApiResponse;
import com.blockscope.api.dto.ErrorBody;
import com.blockscope.api.validation.AddressValidator;
import com.blockscope.explorer.AddressDetails;
import com.blockscope.explorer.AddressExplorerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * GET /api/v1/address/{address}?page=&pageSize=
 */
@RestController
@RequestMapping("/api/v1/address")
@RequiredArgsConstructor
public class AddressController {

    private final AddressValidator addressValidator;
    private final AddressExplorerService explorerService;

    @GetMapping("/{address}")
    public Mono<ResponseEntity<?>> getAddress(@PathVariable String address,
                                              @RequestParam(defaultValue = "1") int page,
                                              @RequestParam(defaultValue = "25") int pageSize) {
        if (!addressValidator.isValidAddress(address)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid Bitcoin address")));
        }
        String addr = address.trim();
        return Mono.fromCallable(() -> explorerService.getAddressDetails(addr, page, pageSize))
                .subscribeOn(Schedulers.boundedElastic())
                .map(AddressController::toResponse);
    }

    private static ResponseEntity<?> toResponse(AddressDetails details) {
        return ResponseEntity.ok(ApiResponse.of(details, Map.of("pagination", details.pagination())));
    }
}
