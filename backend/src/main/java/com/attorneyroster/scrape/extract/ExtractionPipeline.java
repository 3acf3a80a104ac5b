package com.attorneyroster.scrape.extract;

import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the structural strategies in priority order and parses the blocks of the first one that
 * matches. Later strategies are never consulted once an earlier one finds blocks.
 */
@Component
public class ExtractionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final List<ExtractionStrategy> strategies;
    private final ResultBlockParser blockParser;

    @Autowired
    public ExtractionPipeline(ResultBlockParser blockParser) {
        this(
            List.of(new ResultBlockSelectorStrategy(), new ResultTableStrategy(), new ResultContainerStrategy()),
            blockParser
        );
    }

    ExtractionPipeline(List<ExtractionStrategy> strategies, ResultBlockParser blockParser) {
        this.strategies = List.copyOf(strategies);
        this.blockParser = blockParser;
    }

    public PageExtraction extract(String html, String baseUri, JurisdictionDefinition jurisdiction) {
        if (html == null || html.isBlank()) {
            return PageExtraction.none();
        }
        return extract(Jsoup.parse(html, baseUri == null ? "" : baseUri), jurisdiction);
    }

    public PageExtraction extract(Document document, JurisdictionDefinition jurisdiction) {
        for (ExtractionStrategy strategy : strategies) {
            Optional<List<Element>> blocks;
            try {
                blocks = strategy.tryExtract(document);
            } catch (RuntimeException e) {
                log.warn("Extraction strategy {} failed on {}", strategy.name(), document.location(), e);
                continue;
            }
            if (blocks.isEmpty() || blocks.get().isEmpty()) {
                continue;
            }
            List<CandidateRecord> candidates = new ArrayList<>();
            for (Element block : blocks.get()) {
                try {
                    blockParser.parse(block, jurisdiction).ifPresent(candidates::add);
                } catch (RuntimeException e) {
                    log.warn(
                        "Skipping unparseable {} block from strategy {}",
                        ResultBlockParser.describe(block),
                        strategy.name(),
                        e
                    );
                }
            }
            log.debug(
                "Strategy {} matched {} block(s), {} candidate(s) on {}",
                strategy.name(),
                blocks.get().size(),
                candidates.size(),
                document.location()
            );
            return new PageExtraction(strategy.name(), blocks.get().size(), candidates);
        }
        return PageExtraction.none();
    }
}
