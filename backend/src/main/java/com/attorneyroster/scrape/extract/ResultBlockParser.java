package com.attorneyroster.scrape.extract;

import com.attorneyroster.scrape.model.CandidateField;
import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.util.TextUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls loosely-typed attorney fields out of a single result block. Table rows and free-form
 * blocks are read differently; in both cases a block without a resolvable name is rejected.
 */
@Component
public class ResultBlockParser {
    private static final String NAME_SELECTOR = "h2, h3, h4, a, strong";
    private static final Pattern HREF_BAR_NUMBER = Pattern.compile("BarNumber=(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRM_LABEL = labelPattern("Firm(?:\\s+Name)?|Company|Employer");
    private static final Pattern STATUS_LABEL = labelPattern("Status");
    private static final Pattern ADMISSION_LABEL = labelPattern("Date Admitted|Admission Date|Admitted");
    private static final Pattern LAW_SCHOOL_LABEL = labelPattern("Law School");
    private static final Pattern COUNTY_LABEL = labelPattern("County");
    private static final Pattern PRACTICE_LABEL = labelPattern("Practice Areas?");
    private static final Pattern PHONE_TEXT = Pattern.compile("\\(?\\b\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}\\b");
    private static final Pattern WEBSITE_TEXT = Pattern.compile("web\\s*site", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;|]");

    private final Map<Integer, Pattern> labelledBarPatterns = new ConcurrentHashMap<>();
    private final Map<Integer, Pattern> bareBarPatterns = new ConcurrentHashMap<>();
    private final Map<List<String>, Pattern> cityPatterns = new ConcurrentHashMap<>();

    public Optional<CandidateRecord> parse(Element block, JurisdictionDefinition jurisdiction) {
        if (block == null) {
            return Optional.empty();
        }
        if ("tr".equalsIgnoreCase(block.tagName())) {
            return parseTableRow(block, jurisdiction);
        }
        return parseBlock(block, jurisdiction);
    }

    private Optional<CandidateRecord> parseTableRow(Element row, JurisdictionDefinition jurisdiction) {
        Elements cells = row.select("td");
        if (cells.size() < 2) {
            return Optional.empty();
        }
        Pattern exactBarNumber = Pattern.compile("^\\d{" + jurisdiction.barNumberDigits() + "}$");
        CandidateRecord.Builder builder = CandidateRecord.builder();
        String name = null;
        for (Element cell : cells) {
            String text = TextUtils.clean(cell.text());
            Element link = cell.selectFirst("a[href]");
            if (link != null && name == null) {
                name = TextUtils.blankToNull(TextUtils.clean(link.text()));
                Matcher hrefMatch = HREF_BAR_NUMBER.matcher(link.attr("href"));
                if (hrefMatch.find()) {
                    builder.withIfAbsent(CandidateField.BAR_NUMBER, hrefMatch.group(1));
                }
            } else if (text != null && exactBarNumber.matcher(text).matches()) {
                builder.with(CandidateField.BAR_NUMBER, text);
            } else if (text != null && text.length() > 2 && isKnownCity(text, jurisdiction)) {
                builder.withIfAbsent(CandidateField.CITY, text);
            }
        }
        if (name == null) {
            return Optional.empty();
        }
        builder.with(CandidateField.FULL_NAME, name);
        collectLabelledFields(row, builder);
        collectContactFields(row, builder);
        collectPracticeAreas(row, builder);
        return Optional.of(builder.build());
    }

    private Optional<CandidateRecord> parseBlock(Element block, JurisdictionDefinition jurisdiction) {
        Element nameElement = block.selectFirst(NAME_SELECTOR);
        String name = nameElement == null ? null : TextUtils.blankToNull(TextUtils.clean(nameElement.text()));
        if (name == null) {
            return Optional.empty();
        }

        CandidateRecord.Builder builder = CandidateRecord.builder()
            .with(CandidateField.FULL_NAME, name);
        String text = block.text();

        builder.with(CandidateField.BAR_NUMBER, findBarNumber(text, jurisdiction.barNumberDigits()));
        if (!builder.has(CandidateField.BAR_NUMBER) && "a".equalsIgnoreCase(nameElement.tagName())) {
            Matcher hrefMatch = HREF_BAR_NUMBER.matcher(nameElement.attr("href"));
            if (hrefMatch.find()) {
                builder.with(CandidateField.BAR_NUMBER, hrefMatch.group(1));
            }
        }

        Pattern cityPattern = cityPattern(jurisdiction.knownCities());
        if (cityPattern != null) {
            Matcher cityMatch = cityPattern.matcher(text);
            if (cityMatch.find()) {
                builder.with(CandidateField.CITY, cityMatch.group(1));
            }
        }

        collectLabelledFields(block, builder);

        Element address = block.selectFirst("[class*=address], address");
        if (address != null) {
            builder.with(CandidateField.ADDRESS, TextUtils.clean(address.text()));
        }
        collectContactFields(block, builder);
        collectPracticeAreas(block, builder);
        return Optional.of(builder.build());
    }

    String findBarNumber(String text, int digits) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Pattern labelled = labelledBarPatterns.computeIfAbsent(digits, d -> Pattern.compile(
            "Bar\\s*(?:No\\.?|Number|#)?\\s*:?\\s*(\\d{" + d + "})(?!\\d)",
            Pattern.CASE_INSENSITIVE
        ));
        Matcher labelledMatch = labelled.matcher(text);
        if (labelledMatch.find()) {
            return labelledMatch.group(1);
        }
        Pattern bare = bareBarPatterns.computeIfAbsent(digits, d -> Pattern.compile("(?<!\\d)(\\d{" + d + "})(?!\\d)"));
        Matcher bareMatch = bare.matcher(text);
        return bareMatch.find() ? bareMatch.group(1) : null;
    }

    private void collectLabelledFields(Element block, CandidateRecord.Builder builder) {
        builder.withIfAbsent(CandidateField.FIRM_NAME, labelledValue(block, FIRM_LABEL));
        builder.withIfAbsent(CandidateField.STATUS, labelledValue(block, STATUS_LABEL));
        builder.withIfAbsent(CandidateField.ADMISSION_DATE, labelledValue(block, ADMISSION_LABEL));
        builder.withIfAbsent(CandidateField.LAW_SCHOOL, labelledValue(block, LAW_SCHOOL_LABEL));
        builder.withIfAbsent(CandidateField.COUNTY, labelledValue(block, COUNTY_LABEL));
    }

    private void collectContactFields(Element block, CandidateRecord.Builder builder) {
        Element mailto = block.selectFirst("a[href^=mailto:]");
        if (mailto != null) {
            String email = mailto.attr("href").substring("mailto:".length());
            int query = email.indexOf('?');
            builder.with(CandidateField.EMAIL, TextUtils.clean(query >= 0 ? email.substring(0, query) : email));
        }

        Element tel = block.selectFirst("a[href^=tel:]");
        if (tel != null) {
            String phone = TextUtils.blankToNull(TextUtils.clean(tel.text()));
            builder.with(CandidateField.PHONE, phone != null ? phone : TextUtils.clean(tel.attr("href").substring("tel:".length())));
        } else {
            Matcher phoneMatch = PHONE_TEXT.matcher(block.text());
            if (phoneMatch.find()) {
                builder.with(CandidateField.PHONE, phoneMatch.group());
            }
        }

        for (Element link : block.select("a[href]")) {
            if (WEBSITE_TEXT.matcher(link.text()).find()) {
                String href = link.absUrl("href");
                builder.with(CandidateField.WEBSITE, href.isBlank() ? TextUtils.clean(link.attr("href")) : href);
                break;
            }
        }
    }

    private void collectPracticeAreas(Element block, CandidateRecord.Builder builder) {
        Elements containers = block.select("[class*=practice]");
        for (Element container : containers) {
            Elements items = container.select("li");
            if (!items.isEmpty()) {
                for (Element item : items) {
                    builder.addPracticeArea(TextUtils.blankToNull(TextUtils.clean(item.text())));
                }
                return;
            }
            String text = stripLabel(container.text(), PRACTICE_LABEL);
            splitList(text).forEach(builder::addPracticeArea);
            return;
        }
        String labelled = labelledValue(block, PRACTICE_LABEL);
        if (labelled != null) {
            splitList(labelled).forEach(builder::addPracticeArea);
        }
    }

    /**
     * Value for a "Label: value" pair. The label has to open the element's own text and be followed
     * by a colon or nothing, so "Smith Law Firm" is a value and not a label. The value is read from
     * the remainder of that text, or failing that from the next element after the label.
     */
    private String labelledValue(Element block, Pattern label) {
        for (Element owner : block.getElementsMatchingOwnText(label)) {
            String inline = TextUtils.blankToNull(TextUtils.clean(stripLabel(owner.ownText(), label)));
            if (inline != null) {
                return inline;
            }
            String trailing = trailingText(owner);
            if (trailing != null) {
                return trailing;
            }
            Element next = nextElementWithin(owner, block);
            if (next != null) {
                return TextUtils.clean(next.text());
            }
        }
        return null;
    }

    private String trailingText(Element element) {
        Node sibling = element.nextSibling();
        while (sibling instanceof TextNode textNode) {
            String value = TextUtils.blankToNull(TextUtils.clean(textNode.text()));
            if (value != null) {
                return value;
            }
            sibling = sibling.nextSibling();
        }
        return null;
    }

    private Element nextElementWithin(Element element, Element boundary) {
        Element current = element;
        while (current != null && current != boundary) {
            Element sibling = current.nextElementSibling();
            if (sibling != null) {
                return sibling;
            }
            current = current.parent();
        }
        return null;
    }

    private String stripLabel(String text, Pattern label) {
        if (text == null) {
            return null;
        }
        Matcher matcher = label.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        return text.substring(matcher.end());
    }

    private List<String> splitList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return LIST_SEPARATOR.splitAsStream(text)
            .map(TextUtils::clean)
            .filter(value -> value != null && !value.isEmpty())
            .collect(Collectors.toList());
    }

    private boolean isKnownCity(String text, JurisdictionDefinition jurisdiction) {
        for (String city : jurisdiction.knownCities()) {
            if (city.equalsIgnoreCase(text)) {
                return true;
            }
        }
        return false;
    }

    private Pattern cityPattern(List<String> knownCities) {
        if (knownCities.isEmpty()) {
            return null;
        }
        return cityPatterns.computeIfAbsent(knownCities, cities -> Pattern.compile(
            "\\b(" + cities.stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + ")\\b",
            Pattern.CASE_INSENSITIVE
        ));
    }

    private static Pattern labelPattern(String alternatives) {
        return Pattern.compile("^\\s*(?:" + alternatives + ")\\s*(?:[:#]\\s*|$)", Pattern.CASE_INSENSITIVE);
    }

    static String describe(Element block) {
        return block.tagName().toLowerCase(Locale.ROOT) + (block.className().isBlank() ? "" : "." + block.className());
    }
}
