package com.attorneyroster.scrape.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/**
 * One structural guess at where attorney result blocks live in a search-results page.
 */
public interface ExtractionStrategy {

    String name();

    /**
     * @return the matched result blocks, or empty when this strategy finds nothing on the page
     */
    Optional<List<Element>> tryExtract(Document document);
}
