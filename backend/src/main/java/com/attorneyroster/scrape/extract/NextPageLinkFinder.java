package com.attorneyroster.scrape.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates the "next page" link of a result page and resolves it to an absolute locator.
 */
@Component
public class NextPageLinkFinder {
    private static final Pattern NEXT_TEXT = Pattern.compile("\\bnext\\b|»|›", Pattern.CASE_INSENSITIVE);

    public Optional<String> find(Document document, String baseUrl) {
        for (Element link : document.select("a[href]")) {
            if (!NEXT_TEXT.matcher(link.ownText()).find() && !NEXT_TEXT.matcher(link.text()).find()) {
                continue;
            }
            String href = link.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                continue;
            }
            String resolved = resolve(link, href, baseUrl);
            if (resolved != null) {
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    private String resolve(Element link, String href, String baseUrl) {
        String absolute = link.absUrl("href");
        if (absolute.isBlank() && baseUrl != null && !baseUrl.isBlank()) {
            try {
                absolute = URI.create(baseUrl).resolve(href).toString();
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        if (absolute.isBlank() || !absolute.toLowerCase(Locale.ROOT).startsWith("http")) {
            return null;
        }
        return stripFragment(absolute);
    }

    static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
