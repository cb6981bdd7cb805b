package com.hybridsearch.controller;

import com.hybridsearch.service.SearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/hits")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;

    @GetMapping
    public ResponseEntity<SearchResponse> hits(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "w", required = false) Double pagerankWeight,
        @RequestParam(name = "mode", required = false) String mode,
        @RequestParam(name = "limit", required = false) Integer limit) {

        return ResponseEntity.ok(searchService.search(query, pagerankWeight, mode, limit));
    }
}
