package com.yamdb.backend.modules.catalog.presentation;

import com.yamdb.backend.global.security.SecurityUtils;
import com.yamdb.backend.global.web.PageRequests;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.catalog.application.CatalogService;
import com.yamdb.backend.modules.catalog.presentation.dto.CatalogEntryResponse;
import com.yamdb.backend.modules.catalog.presentation.dto.CreateCatalogEntryRequest;
import com.yamdb.backend.modules.catalog.presentation.dto.UpdateCatalogEntryRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
public class CategoryController {

    private final CatalogService catalogService;

    public CategoryController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<CatalogEntryResponse>> list(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(catalogService.listCategories(search, PageRequests.of(page, size, Sort.by("name"))));
    }

    @Operation(summary = "Create category", description = "Admin only. Name and slug must be unique.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Name or slug already used")
    })
    @PostMapping
    public ResponseEntity<CatalogEntryResponse> create(@Valid @RequestBody CreateCatalogEntryRequest request) {
        return ResponseEntity.status(201).body(catalogService.createCategory(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{slug}")
    public ResponseEntity<CatalogEntryResponse> get(@PathVariable("slug") String slug) {
        return ResponseEntity.ok(catalogService.getCategory(slug));
    }

    @PatchMapping("/{slug}")
    public ResponseEntity<CatalogEntryResponse> update(
            @PathVariable("slug") String slug,
            @Valid @RequestBody UpdateCatalogEntryRequest request
    ) {
        return ResponseEntity.ok(catalogService.updateCategory(SecurityUtils.currentActor(), slug, request));
    }

    @Operation(summary = "Delete category", description = "Titles in the category stay, with no category.")
    @DeleteMapping("/{slug}")
    public ResponseEntity<Void> delete(@PathVariable("slug") String slug) {
        catalogService.deleteCategory(SecurityUtils.currentActor(), slug);
        return ResponseEntity.noContent().build();
    }
}
