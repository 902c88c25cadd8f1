package com.pathtopology.engine.service.elevation;

import com.pathtopology.engine.dto.ElevationLookupRequest;
import com.pathtopology.engine.dto.ElevationLookupResponse;
import com.pathtopology.engine.exception.ElevationUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fetches terrain heights from the external elevation API.
 *
 * Cache-aside on Redis: the terrain model changes rarely, and the same line
 * is often re-sampled when a segment is edited back and forth. A Redis
 * failure only costs a remote call; a remote failure aborts the segment
 * write.
 */
@Component
@Slf4j
public class ElevationSampleClient {

    private static final String CACHE_KEY_PREFIX = "elevation:samples:";

    private final RestTemplate restTemplate;
    private final RedisTemplate<String, Object> redisTemplate;
    private final String elevationUrl;
    private final int srid;
    private final long cacheTtlHours;

    public ElevationSampleClient(
        RestTemplate elevationRestTemplate,
        RedisTemplate<String, Object> redisTemplate,
        @Value("${topology.elevation.url}") String elevationUrl,
        @Value("${topology.srid:2154}") int srid,
        @Value("${topology.elevation.cache-ttl-hours:168}") long cacheTtlHours
    ) {
        this.restTemplate = elevationRestTemplate;
        this.redisTemplate = redisTemplate;
        this.elevationUrl = elevationUrl;
        this.srid = srid;
        this.cacheTtlHours = cacheTtlHours;
    }

    /**
     * Heights for each coordinate, in the order given.
     */
    public List<Double> fetchHeights(Coordinate[] coordinates) {
        ElevationLookupRequest request = ElevationLookupRequest.of(srid, coordinates);
        String cacheKey = cacheKey(request);

        ElevationLookupResponse cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Elevation samples via cache: {} points", coordinates.length);
            return cached.heights();
        }

        ElevationLookupResponse response;
        try {
            response = restTemplate.postForObject(elevationUrl, request, ElevationLookupResponse.class);
        } catch (RestClientException e) {
            log.error("Elevation lookup failed for {} points", coordinates.length, e);
            throw new ElevationUnavailableException("Elevation service call failed", e);
        }

        if (response == null || response.heights() == null) {
            throw new ElevationUnavailableException("Elevation service returned no heights");
        }
        if (response.heights().size() != coordinates.length) {
            throw new ElevationUnavailableException(String.format(
                "Elevation service returned %d heights for %d points",
                response.heights().size(), coordinates.length));
        }

        writeCache(cacheKey, response);
        return response.heights();
    }

    String cacheKey(ElevationLookupRequest request) {
        StringBuilder sb = new StringBuilder().append(request.srid());
        for (ElevationLookupRequest.SamplePoint point : request.points()) {
            sb.append(';').append(point.x()).append(',').append(point.y());
        }
        return CACHE_KEY_PREFIX + DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private ElevationLookupResponse readCache(String cacheKey) {
        try {
            Object value = redisTemplate.opsForValue().get(cacheKey);
            return value instanceof ElevationLookupResponse response ? response : null;
        } catch (RuntimeException e) {
            log.warn("Elevation cache read failed, calling the service directly: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(String cacheKey, ElevationLookupResponse response) {
        try {
            redisTemplate.opsForValue().set(cacheKey, response, cacheTtlHours, TimeUnit.HOURS);
        } catch (RuntimeException e) {
            log.warn("Elevation cache write failed: {}", e.getMessage());
        }
    }
}
