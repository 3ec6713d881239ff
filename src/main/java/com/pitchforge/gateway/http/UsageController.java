package com.pitchforge.gateway.http;

import com.pitchforge.cache.CacheStats;
import com.pitchforge.content.ContentGenerationService;
import com.pitchforge.observability.DoctorCommand;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only operator view of the generation core, plus cache clearing.
 */
@RestController
public class UsageController {

    private final ContentGenerationService service;
    private final DoctorCommand doctor;

    public UsageController(ContentGenerationService service, DoctorCommand doctor) {
        this.service = service;
        this.doctor = doctor;
    }

    @GetMapping("/v1/usage")
    public Map<String, Object> usage() {
        var m = service.usage();
        var body = new LinkedHashMap<String, Object>();
        body.put("totalRequests", m.totalRequests());
        body.put("successCount", m.successCount());
        body.put("failureCount", m.failureCount());
        body.put("successRatePercentage", m.successRatePercentage());
        body.put("averageLatencyMs", m.averageLatencyMs());
        body.put("perProviderCounts", m.perProviderCounts());
        body.put("perTaskStats", m.perTaskStats());
        body.put("retryCounts", m.retryCounts());
        body.put("updatedAt", m.updatedAt());
        return body;
    }

    @GetMapping("/v1/cache/stats")
    public CacheStats cacheStats() {
        return service.cacheStats();
    }

    @DeleteMapping("/v1/cache")
    public Map<String, Object> clearCache() {
        var before = service.cacheStats().size();
        service.clearCache();
        return Map.of("cleared", before);
    }

    @GetMapping("/v1/doctor")
    public Map<String, String> doctor() {
        return Map.of("report", doctor.run());
    }
}
