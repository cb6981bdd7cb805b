package com.hybridsearch.service;

import com.hybridsearch.controller.SearchResponse;

public interface SearchService {
    SearchResponse search(String query, Double pagerankWeight, String mode, Integer limit);
}
