package com.genomics.controller;

import com.genomics.config.CatalogConfig;
import com.genomics.model.ReferenceCatalog;
import com.genomics.service.CatalogService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/catalog")
public class CatalogApiController {

    private final CatalogService catalogService;

    public CatalogApiController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public record CatalogRequest(String version, List<CatalogConfig.GeneDefinition> genes) {
    }

    @GetMapping
    public Map<String, Object> getCatalog() {
        ReferenceCatalog catalog = catalogService.current();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", catalog.version());
        response.put("genes", catalog.genes());
        response.put("staleRecords", catalogService.staleGeneRecords().size());
        return response;
    }

    /**
     * Install a new catalog version; every mutation record is re-derived
     * against it before it takes effect.
     */
    @PutMapping
    public Map<String, Object> replaceCatalog(@RequestBody CatalogRequest request) {
        List<CatalogConfig.GeneDefinition> genes = request.genes() != null ? request.genes() : List.of();
        ReferenceCatalog catalog = new ReferenceCatalog(request.version(),
            genes.stream().map(CatalogConfig.GeneDefinition::toReference).toList());
        int rederived = catalogService.replaceCatalog(catalog);
        return Map.of("version", catalog.version(), "reclassified", rederived);
    }

    @PostMapping("/reclassify")
    public Map<String, Object> reclassify() {
        int rederived = catalogService.reclassifyStale();
        return Map.of("version", catalogService.current().version(), "reclassified", rederived);
    }
}
