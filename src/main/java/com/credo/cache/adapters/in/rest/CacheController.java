package com.credo.cache.adapters.in.rest;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.credo.cache.application.port.in.Cache;
import com.credo.cache.bootstrap.config.CacheProperties;
import com.credo.cache.domain.error.CacheException;

/**
 * REST controller for inspecting and exercising the cache by hand.
 * <p>
 * Writes are fire-and-forget, so PUT and DELETE answer 202 Accepted; their
 * failures show up in the cache error log, not in the response.
 * </p>
 */
@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final Cache cache;
    private final long timeoutMs;

    public CacheController(Cache cache, CacheProperties cacheProperties) {
        this.cache = cache;
        this.timeoutMs = Math.max(1, cacheProperties.getRest().getTimeoutMs());
    }

    /**
     * Usage: GET /api/cache/{key}
     */
    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> getOne(@PathVariable String key) {
        try {
            Object value = await(cache.get(key));
            Map<String, Object> response = new HashMap<>();
            response.put("key", key);
            response.put("found", value != null);
            response.put("value", value);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return failure("get", e);
        }
    }

    /**
     * Usage: GET /api/cache?keys=key1,key2,key3
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getMany(@RequestParam List<String> keys) {
        try {
            List<Object> values = await(cache.get(keys));
            Map<String, Object> response = new HashMap<>();
            response.put("keys", keys);
            response.put("values", values);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return failure("get_many", e);
        }
    }

    /**
     * Usage: PUT /api/cache/{key}?expires=60 with a JSON body
     */
    @PutMapping("/{key}")
    public ResponseEntity<Map<String, Object>> set(@PathVariable String key,
            @RequestBody Object value,
            @RequestParam(required = false, defaultValue = "0") long expires) {
        try {
            cache.set(key, value, expires);
            log.info("action=rest_cache_set key={} expiresSeconds={}", key, expires);
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "key", key));
        } catch (Exception e) {
            return failure("set", e);
        }
    }

    /**
     * Usage: DELETE /api/cache/{key}
     */
    @DeleteMapping("/{key}")
    public ResponseEntity<Map<String, Object>> clearOne(@PathVariable String key) {
        try {
            cache.clear(key);
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "keys", List.of(key)));
        } catch (Exception e) {
            return failure("clear", e);
        }
    }

    /**
     * Usage: DELETE /api/cache?keys=key1,key2
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearMany(@RequestParam List<String> keys) {
        try {
            cache.clear(keys);
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "keys", keys));
        } catch (Exception e) {
            return failure("clear", e);
        }
    }

    /**
     * Usage: POST /api/cache/script with {"script": "...", "keys": [...],
     * "parameters": [...]}
     */
    @PostMapping("/script")
    public ResponseEntity<Map<String, Object>> execute(@RequestBody ScriptRequest request) {
        try {
            Object result = await(cache.execute(request.script(), request.keys(), request.parameters()));
            Map<String, Object> response = new HashMap<>();
            response.put("result", result);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return failure("execute", e);
        }
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "cache", cache.getName(),
                "timestamp", Instant.now().toString()));
    }

    // ─────────────────── Private Helpers ───────────────────

    private <T> T await(CompletableFuture<T> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private ResponseEntity<Map<String, Object>> failure(String operation, Exception e) {
        if (e instanceof IllegalArgumentException) {
            log.warn("action=rest_cache_rejected operation={} error={}", operation, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (e instanceof TimeoutException) {
            log.error("action=rest_cache_timeout operation={} timeoutMs={}", operation, timeoutMs);
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(Map.of("error", "Cache did not respond in time"));
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }

        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof CacheException) {
            log.error("action=rest_cache_failed operation={} error={}", operation, cause.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", cause.getMessage()));
        }

        log.error("action=rest_cache_error operation={} error={}", operation, cause.getMessage(), cause);
        return ResponseEntity.internalServerError().body(Map.of("error", "Unable to complete cache operation"));
    }

    /**
     * Body of a script execution request.
     */
    public record ScriptRequest(String script, List<String> keys, List<String> parameters) {
    }
}
