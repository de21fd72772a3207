package com.cachebench.qa.controller;

import com.cachebench.qa.dto.AskRequest;
import com.cachebench.qa.dto.AskResponse;
import com.cachebench.qa.dto.HealthResponse;
import com.cachebench.qa.service.CacheAsideAnswerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
public class AskController {

    private static final Logger log = LoggerFactory.getLogger(AskController.class);

    private final CacheAsideAnswerService answerService;
    private final String redisUrl;

    public AskController(CacheAsideAnswerService answerService,
                         @Value("${spring.data.redis.url:redis://localhost:6379/0}") String redisUrl) {
        this.answerService = answerService;
        this.redisUrl      = redisUrl;
    }

    @PostMapping("/ask")
    public Mono<ResponseEntity<AskResponse>> ask(@RequestBody AskRequest request) {
        if (request == null || request.query() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "field 'query' is required"));
        }
        return answerService.handle(request.query())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Ask endpoint error. query={}", request.query(), e))
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().build()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.just(ResponseEntity.ok(new HealthResponse("ok", redisUrl)));
    }
}
