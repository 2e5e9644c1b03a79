package com.partfinder.controller;

import com.partfinder.model.SearchRequest;
import com.partfinder.model.StoreSearchRequest;
import com.partfinder.model.StoreSearchResponse;
import com.partfinder.model.StoreSearchResult;
import com.partfinder.model.StoreTypeTag;
import com.partfinder.service.SearchRequestResolver;
import com.partfinder.service.StoreLocatorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StoreLocatorController {

    private final SearchRequestResolver requestResolver;
    private final StoreLocatorService storeLocatorService;

    /**
     * Find nearby stores likely to carry a part
     */
    @PostMapping("/stores/search")
    public ResponseEntity<StoreSearchResponse> searchStores(@RequestBody StoreSearchRequest body) {
        log.info("=== /api/stores/search called ===");

        // invalid requests surface as InvalidSearchRequestException, handled by ApiExceptionHandler
        SearchRequest request = requestResolver.resolve(body);
        StoreSearchResult result = storeLocatorService.findStores(request);

        log.info("Returning {} store(s) for '{}' (degraded: {})",
                result.getStores().size(), request.getPart().getName(), result.isDegraded());

        return ResponseEntity.ok(StoreSearchResponse.builder()
                .success(true)
                .origin(request.getOrigin())
                .maxDistanceMiles(request.getMaxDistanceMiles())
                .storeTypes(result.getStoreTypes().stream().map(StoreTypeTag::tag).toList())
                .stores(result.getStores())
                .degraded(result.isDegraded())
                .advisory(result.getAdvisory())
                .build());
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
