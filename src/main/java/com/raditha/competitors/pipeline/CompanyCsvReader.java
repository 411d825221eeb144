package com.raditha.competitors.pipeline;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.Exclusion;
import com.raditha.competitors.model.ExclusionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads company records from a CSV file with a header row.
 *
 * <p>
 * Required columns: {@code company_id}, {@code main_customers}, {@code main_product},
 * {@code category_list}. Optional: {@code company_name}, {@code description}. Rows
 * with a blank or repeated identifier are excluded; the first occurrence of an
 * identifier wins.
 */
public class CompanyCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(CompanyCsvReader.class);

    public static final String ID = "company_id";
    public static final String CUSTOMERS = "main_customers";
    public static final String PRODUCT = "main_product";
    public static final String CATEGORIES = "category_list";
    public static final String NAME = "company_name";
    public static final String DESCRIPTION = "description";

    static final List<String> REQUIRED_COLUMNS = List.of(ID, CUSTOMERS, PRODUCT, CATEGORIES);

    private final CsvMapper mapper = new CsvMapper();
    private final Pattern categorySplitter;

    public CompanyCsvReader(String categoryDelimiter) {
        if (categoryDelimiter == null || categoryDelimiter.isEmpty()) {
            throw new IllegalArgumentException("category delimiter cannot be empty");
        }
        this.categorySplitter = Pattern.compile(Pattern.quote(categoryDelimiter));
    }

    public CompanyInput read(Path csvFile) throws IOException {
        logger.info("Reading companies from {}", csvFile);
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public CompanyInput read(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Company> companies = new ArrayList<>();
        List<Exclusion> exclusions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int rows = 0;

        try (MappingIterator<Map<String, String>> it = mapper
                .readerFor(Map.class)
                .with(schema)
                .with(CsvParser.Feature.TRIM_SPACES)
                .readValues(reader)) {
            while (it.hasNextValue()) {
                Map<String, String> row = it.nextValue();
                rows++;
                if (rows == 1) {
                    requireColumns(row);
                }

                String id = value(row, ID);
                if (id.isEmpty()) {
                    exclusions.add(new Exclusion("", ExclusionReason.MISSING_IDENTIFIER, "row " + rows));
                    continue;
                }
                if (!seen.add(id)) {
                    exclusions.add(new Exclusion(id, ExclusionReason.DUPLICATE_IDENTIFIER, "row " + rows));
                    continue;
                }
                companies.add(new Company(
                        id,
                        value(row, NAME),
                        value(row, CUSTOMERS),
                        value(row, PRODUCT),
                        parseCategories(value(row, CATEGORIES)),
                        value(row, DESCRIPTION)));
            }
        }

        if (!exclusions.isEmpty()) {
            logger.warn("Excluded {} of {} rows with missing or repeated identifiers", exclusions.size(), rows);
        }
        logger.info("Read {} companies", companies.size());
        return new CompanyInput(companies, exclusions, rows);
    }

    /**
     * Split a category list into trimmed, non-empty tags in input order.
     */
    Set<String> parseCategories(String raw) {
        Set<String> tags = new LinkedHashSet<>();
        if (raw.isEmpty()) {
            return tags;
        }
        for (String tag : categorySplitter.split(raw)) {
            String trimmed = tag.trim();
            if (!trimmed.isEmpty()) {
                tags.add(trimmed);
            }
        }
        return tags;
    }

    private static void requireColumns(Map<String, String> row) throws IOException {
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> !row.containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new IOException("Input is missing required columns: " + String.join(", ", missing));
        }
    }

    private static String value(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }
}
