package com.attorneyroster.scrape.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

public class ResultBlockSelectorStrategy implements ExtractionStrategy {
    static final String RESULT_BLOCK_SELECTOR = ".attorney-result, .member-listing, .search-result";

    @Override
    public String name() {
        return "result_block";
    }

    @Override
    public Optional<List<Element>> tryExtract(Document document) {
        List<Element> blocks = document.select(RESULT_BLOCK_SELECTOR);
        return blocks.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(blocks));
    }
}
