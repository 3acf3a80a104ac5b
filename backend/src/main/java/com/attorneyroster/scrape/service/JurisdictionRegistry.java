package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.FetchMethod;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.model.SearchContext;
import com.attorneyroster.scrape.model.SearchDimension;
import com.attorneyroster.scrape.util.TextUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds validated {@link JurisdictionDefinition}s from {@code roster.jurisdictions}. Codes are
 * matched case-insensitively.
 */
@Service
public class JurisdictionRegistry {
    private final RosterProperties properties;

    public JurisdictionRegistry(RosterProperties properties) {
        this.properties = properties;
    }

    public List<String> codes() {
        return properties.getJurisdictions().keySet().stream()
            .map(code -> code.toUpperCase(Locale.ROOT))
            .toList();
    }

    public List<JurisdictionDefinition> definitions() {
        return codes().stream().map(this::definition).toList();
    }

    public JurisdictionDefinition definition(String code) {
        String normalized = normalizeCode(code);
        if (normalized == null) {
            throw new UnknownJurisdictionException(code);
        }
        RosterProperties.Jurisdiction config = lookup(normalized);
        if (config == null) {
            throw new UnknownJurisdictionException(normalized);
        }
        String searchUrl = TextUtils.blankToNull(TextUtils.clean(config.getSearchUrl()));
        if (searchUrl == null) {
            throw new InvalidJurisdictionConfigException("Jurisdiction " + normalized + " has no search URL");
        }

        List<String> cities = cleanList(config.getCities());
        List<SearchContext> seeds = new ArrayList<>();
        for (String city : cities) {
            seeds.add(seed(normalized, config, SearchDimension.CITY, city));
        }
        for (char letter : config.getLetters().trim().toCharArray()) {
            if (Character.isLetter(letter)) {
                seeds.add(seed(normalized, config, SearchDimension.LETTER, String.valueOf(letter)));
            }
        }
        if (seeds.isEmpty()) {
            throw new InvalidJurisdictionConfigException("Jurisdiction " + normalized + " has no city or letter seeds");
        }

        List<String> knownCities = cleanList(config.getKnownCities());
        if (knownCities.isEmpty()) {
            knownCities = cities;
        }
        String name = TextUtils.blankToNull(TextUtils.clean(config.getName()));
        return new JurisdictionDefinition(
            normalized,
            name == null ? normalized : name,
            TextUtils.blankToNull(TextUtils.clean(config.getBaseUrl())),
            searchUrl,
            searchMethod(normalized, config.getSearchMethod()),
            seeds,
            knownCities,
            config.getBarNumberDigits()
        );
    }

    private SearchContext seed(
        String code,
        RosterProperties.Jurisdiction config,
        SearchDimension dimension,
        String value
    ) {
        Map<String, String> parameters = new LinkedHashMap<>();
        config.getFixedParams().forEach((key, fixed) -> parameters.put(key, fixed == null ? "" : fixed));
        parameters.put(config.getCityParam(), dimension == SearchDimension.CITY ? value : "");
        parameters.put(config.getLetterParam(), dimension == SearchDimension.LETTER ? value : "");
        return new SearchContext(code, dimension, value, parameters);
    }

    private FetchMethod searchMethod(String code, String raw) {
        try {
            return FetchMethod.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidJurisdictionConfigException("Jurisdiction " + code + " has unsupported search method " + raw);
        }
    }

    private RosterProperties.Jurisdiction lookup(String normalized) {
        for (Map.Entry<String, RosterProperties.Jurisdiction> entry : properties.getJurisdictions().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(normalized)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private List<String> cleanList(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            String cleaned = TextUtils.blankToNull(TextUtils.clean(value));
            if (cleaned != null) {
                out.add(cleaned);
            }
        }
        return out;
    }

    static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
