package com.attorneyroster.scrape.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Treats every row after the header of the first results-like table as one block.
 */
public class ResultTableStrategy implements ExtractionStrategy {
    private static final Pattern TABLE_HINT = Pattern.compile("result|member|attorney", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "result_table";
    }

    @Override
    public Optional<List<Element>> tryExtract(Document document) {
        for (Element table : document.select("table")) {
            if (!matchesHint(table)) {
                continue;
            }
            List<Element> rows = ownRows(table);
            if (rows.size() <= 1) {
                return Optional.empty();
            }
            return Optional.of(List.copyOf(rows.subList(1, rows.size())));
        }
        return Optional.empty();
    }

    /**
     * Rows of this table only; rows of nested layout tables are left out.
     */
    static List<Element> ownRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            String tag = child.normalName();
            if ("tr".equals(tag)) {
                rows.add(child);
            } else if ("thead".equals(tag) || "tbody".equals(tag) || "tfoot".equals(tag)) {
                for (Element row : child.children()) {
                    if ("tr".equals(row.normalName())) {
                        rows.add(row);
                    }
                }
            }
        }
        return rows;
    }

    static boolean matchesHint(Element element) {
        return TABLE_HINT.matcher(element.className()).find() || TABLE_HINT.matcher(element.id()).find();
    }
}
