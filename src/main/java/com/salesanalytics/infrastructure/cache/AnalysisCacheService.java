package com.salesanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.config.SalesAnalyticsProperties;
import com.salesanalytics.domain.model.AnalysisReport;
import com.salesanalytics.domain.model.ColumnMapping;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis cache of finished analysis reports.
 *
 * A report is a pure function of the uploaded CSV and the settings it was
 * read with, so the key carries a digest of both and entries never go stale;
 * the TTL only bounds memory. A TTL of 0 turns caching off.
 *
 * Failure Handling:
 * - Redis errors reach the "redis" circuit breaker, whose fallbacks degrade to recomputing
 * - An entry that no longer deserializes is evicted and treated as a miss
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisCacheService {

    static final String KEY_PREFIX = "sales:analysis:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final SalesAnalyticsProperties properties;

    /**
     * {@code sales:analysis:<md5 of body>:<topN>:<md5 of column mapping and date patterns>}
     */
    public String keyFor(String csvContent, ColumnMapping mapping, List<String> dateFormats, int topN) {
        String readSettings = String.join("|", mapping.requiredColumns()) + "#" + String.join("|", dateFormats);
        return KEY_PREFIX + md5(csvContent) + ":" + topN + ":" + md5(readSettings);
    }

    /**
     * Cached report for the key, flagged as cached.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "lookupFallback")
    public Optional<AnalysisReport> lookup(String key) {
        if (!isEnabled()) {
            return Optional.empty();
        }

        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            log.debug("No cached report for key: {}", key);
            return Optional.empty();
        }

        try {
            AnalysisReport report = objectMapper.readValue(json, AnalysisReport.class);
            report.setCached(true);
            log.debug("Cached report found for key: {}", key);
            return Optional.of(report);

        } catch (JsonProcessingException e) {
            log.warn("Evicting unreadable cached report {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "storeFallback")
    public void store(String key, AnalysisReport report) {
        if (!isEnabled()) {
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Analysis report for {} cannot be serialized: {}", key, e.getOriginalMessage());
            return;
        }

        Duration ttl = Duration.ofSeconds(properties.getCacheTtlSeconds());
        redisTemplate.opsForValue().set(key, json, ttl);
        log.debug("Cached report for key: {} ({} rows, TTL: {})",
                key, report.getDataSummary() == null ? 0 : report.getDataSummary().getTotalRows(), ttl);
    }

    boolean isEnabled() {
        return properties.getCacheTtlSeconds() > 0;
    }

    Optional<AnalysisReport> lookupFallback(String key, Exception e) {
        log.warn("Report cache unavailable ({}), recomputing analysis", e.getMessage());
        return Optional.empty();
    }

    void storeFallback(String key, AnalysisReport report, Exception e) {
        log.warn("Report cache unavailable ({}), result not cached", e.getMessage());
    }

    private static String md5(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    }
}
