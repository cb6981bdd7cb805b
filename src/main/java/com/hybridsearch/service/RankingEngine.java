package com.hybridsearch.service;

import com.hybridsearch.model.RankingResult;
import com.hybridsearch.model.SearchMode;

public interface RankingEngine {

    /**
     * Ranks the loaded index against {@code query}.
     *
     * @param pagerankWeight share of PageRank in the traditional score, in {@code [0, 1]}
     * @param mode requested mode; semantic modes degrade to traditional when semantic ranking
     *             cannot be served, which the result reports
     */
    RankingResult rank(String query, double pagerankWeight, SearchMode mode);
}
