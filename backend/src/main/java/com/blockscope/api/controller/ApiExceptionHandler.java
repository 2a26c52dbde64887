package com.blockscope.api.controller;

import com.blockscope.api.dto.ErrorBody;
import com.blockscope.explorer.AddressNotFoundException;
import com.blockscope.explorer.BadRequestException;
import com.blockscope.explorer.IndexerUnavailableException;
import com.blockscope.indexer.adapter.RpcBadRequestException;
import com.blockscope.indexer.adapter.RpcException;
import com.blockscope.indexer.adapter.RpcNotFoundException;
import com.blockscope.indexer.engine.IndexerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps explorer and indexer failures to ErrorBody: 400 bad input, 404 unknown address, 503 index or node unavailable.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({BadRequestException.class, RpcBadRequestException.class})
    public ResponseEntity<ErrorBody> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("BAD_REQUEST", ex.getReason()));
    }

    @ExceptionHandler({AddressNotFoundException.class, RpcNotFoundException.class})
    public ResponseEntity<ErrorBody> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler({IndexerUnavailableException.class, IndexerException.class, RpcException.class})
    public ResponseEntity<ErrorBody> handleUnavailable(RuntimeException ex) {
        log.warn("Request failed, service unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("SERVICE_UNAVAILABLE", ex.getMessage()));
    }
}
