package com.raditha.competitors.normalization;

import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.NormalizedCompany;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans short company descriptions before embedding.
 *
 * Steps: Unicode compatibility decomposition with accents dropped, lowercase,
 * punctuation removal, legal-entity token removal, whitespace collapse.
 * The output only contains lowercase ASCII letters, digits, {@code &}, {@code +}
 * and in-word hyphens separated by single spaces, so normalizing twice yields
 * the same text.
 */
public class TextNormalizer {

    /**
     * Corporate-form tokens that say nothing about customers or products.
     */
    static final Set<String> LEGAL_SUFFIXES = Set.of(
            "inc", "llc", "ltd", "limited", "corp", "corporation", "plc", "gmbh", "llp");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]+");
    private static final Pattern NOISE = Pattern.compile("[^a-z0-9&+\\- ]+");
    private static final Pattern LOOSE_HYPHEN = Pattern.compile("(?<![a-z0-9])-|-(?![a-z0-9])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalize a single description.
     *
     * @param text Raw text, may be null
     * @return Normalized text; empty when nothing usable remains
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFKD);
        cleaned = COMBINING_MARKS.matcher(cleaned).replaceAll("");
        cleaned = NON_ASCII.matcher(cleaned).replaceAll(" ");
        cleaned = cleaned.toLowerCase(Locale.ROOT);
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = NOISE.matcher(cleaned).replaceAll(" ");
        cleaned = LOOSE_HYPHEN.matcher(cleaned).replaceAll(" ");

        List<String> kept = new ArrayList<>();
        for (String token : WHITESPACE.split(cleaned.trim())) {
            if (!token.isEmpty() && !LEGAL_SUFFIXES.contains(token)) {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }

    /**
     * Normalize both description fields of a company.
     */
    public NormalizedCompany normalize(Company company) {
        return new NormalizedCompany(
                company,
                normalize(company.customerDescription()),
                normalize(company.productDescription()));
    }

    /**
     * Normalize a batch of companies, preserving order.
     */
    public List<NormalizedCompany> normalizeAll(List<Company> companies) {
        return companies.stream()
                .map(this::normalize)
                .toList();
    }
}
