package com.attorneyroster.scrape.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public class ResultContainerStrategy implements ExtractionStrategy {
    private static final Pattern CONTAINER_HINT = Pattern.compile("member|attorney|result", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "result_container";
    }

    @Override
    public Optional<List<Element>> tryExtract(Document document) {
        List<Element> blocks = new ArrayList<>();
        for (Element div : document.select("div")) {
            if (CONTAINER_HINT.matcher(div.className()).find() || CONTAINER_HINT.matcher(div.id()).find()) {
                blocks.add(div);
            }
        }
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks);
    }
}
