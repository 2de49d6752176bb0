package org.jagriti.casesearch.controllers;

import org.jagriti.casesearch.controllers.dto.CaseSearchRequest;
import org.jagriti.casesearch.domain.SearchKind;
import org.jagriti.casesearch.domain.SearchResult;
import org.jagriti.casesearch.services.CaseSearchService;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Case search endpoints, one per {@link SearchKind}: {@code POST /cases/by-case-number},
 * {@code /cases/by-complainant}, and so on.
 */
@Slf4j
@RestController
@RequestMapping("/cases")
@RequiredArgsConstructor
public class CaseSearchController {

    private static final String BASE_PATH = "/cases/";

    private final CaseSearchService caseSearchService;

    @Operation(summary = "Search District Consumer Court cases",
            description = "Searches one district commission of a state by the dimension named in the path")
    @PostMapping("/{searchKind}")
    public ResponseEntity<SearchResult> search(
            @Parameter(example = "by-complainant") @PathVariable("searchKind") final String slug,
            @Valid @RequestBody final CaseSearchRequest request) {
        final SearchKind kind = SearchKind.fromSlug(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown search type: " + slug));
        log.info("Searching cases by {}: {}", kind.label(), request.searchValue());
        final SearchResult result = caseSearchService.search(request.toCriteria(kind));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        final List<String> endpoints = Arrays.stream(SearchKind.values())
                .map(kind -> BASE_PATH + kind.slug())
                .toList();
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("module", "case-search");
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }
}
