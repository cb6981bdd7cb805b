package com.hybridsearch.controller;

import com.hybridsearch.model.IndexStatus;
import com.hybridsearch.model.PipelineReport;
import com.hybridsearch.service.IndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/index")
@RequiredArgsConstructor
public class IndexController {

    private final IndexService indexService;

    @PostMapping("/rebuild")
    public ResponseEntity<PipelineReport> rebuild() {
        return ResponseEntity.ok(indexService.rebuild());
    }

    @GetMapping
    public ResponseEntity<IndexStatus> status() {
        return ResponseEntity.ok(indexService.status());
    }
}
