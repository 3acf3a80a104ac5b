package com.attorneyroster.scrape.extract;

import com.attorneyroster.scrape.model.CandidateRecord;

import java.util.List;

public record PageExtraction(String strategy, int blocksMatched, List<CandidateRecord> candidates) {

    public static PageExtraction none() {
        return new PageExtraction(null, 0, List.of());
    }

    public int rejectedBlocks() {
        return blocksMatched - candidates.size();
    }
}
