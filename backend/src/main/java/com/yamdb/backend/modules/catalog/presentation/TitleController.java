package com.yamdb.backend.modules.catalog.presentation;

import java.util.UUID;

import com.yamdb.backend.global.security.SecurityUtils;
import com.yamdb.backend.global.web.PageRequests;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.catalog.application.TitleService;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleSearchCondition;
import com.yamdb.backend.modules.catalog.presentation.dto.CreateTitleRequest;
import com.yamdb.backend.modules.catalog.presentation.dto.TitleResponse;
import com.yamdb.backend.modules.catalog.presentation.dto.UpdateTitleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

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
@RequestMapping("/titles")
public class TitleController {

    private final TitleService titleService;

    public TitleController(TitleService titleService) {
        this.titleService = titleService;
    }

    @Operation(
            summary = "List titles",
            description = """
                    `category`, `genre` and `name` match case-insensitive substrings \
                    (slugs for category and genre); `year` matches exactly.
                    """
    )
    @GetMapping
    public ResponseEntity<PageResponse<TitleResponse>> list(
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "genre", required = false) String genre,
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "year", required = false) Integer year,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        TitleSearchCondition condition = new TitleSearchCondition(category, genre, name, year);
        return ResponseEntity.ok(titleService.listTitles(condition, PageRequests.of(page, size)));
    }

    @Operation(summary = "Create title", description = "Admin only. Category and genres are given by slug.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Future year, unknown slug or empty genre list")
    })
    @PostMapping
    public ResponseEntity<TitleResponse> create(@Valid @RequestBody CreateTitleRequest request) {
        return ResponseEntity.status(201).body(titleService.createTitle(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{titleId}")
    public ResponseEntity<TitleResponse> get(@PathVariable("titleId") UUID titleId) {
        return ResponseEntity.ok(titleService.getTitle(titleId));
    }

    @PatchMapping("/{titleId}")
    public ResponseEntity<TitleResponse> update(
            @PathVariable("titleId") UUID titleId,
            @Valid @RequestBody UpdateTitleRequest request
    ) {
        return ResponseEntity.ok(titleService.updateTitle(SecurityUtils.currentActor(), titleId, request));
    }

    @Operation(summary = "Delete title", description = "Also deletes the title's reviews and their comments.")
    @DeleteMapping("/{titleId}")
    public ResponseEntity<Void> delete(@PathVariable("titleId") UUID titleId) {
        titleService.deleteTitle(SecurityUtils.currentActor(), titleId);
        return ResponseEntity.noContent().build();
    }
}
