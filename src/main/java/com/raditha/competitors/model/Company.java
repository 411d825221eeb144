package com.raditha.competitors.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One input record: a company with its raw customer and product descriptions
 * and its category tags.
 *
 * @param id                  Unique company identifier
 * @param name                Display name, may be empty
 * @param customerDescription Raw description of the company's main customers
 * @param productDescription  Raw description of the company's main product
 * @param categories          Category tags in input order, without duplicates
 * @param description         Optional long-form description, may be empty
 */
public record Company(
        String id,
        String name,
        String customerDescription,
        String productDescription,
        Set<String> categories,
        String description) {

    public Company {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        name = name == null ? "" : name;
        customerDescription = customerDescription == null ? "" : customerDescription;
        productDescription = productDescription == null ? "" : productDescription;
        description = description == null ? "" : description;
        categories = categories == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(categories));
    }

    /**
     * Convenience constructor for records without name and long description.
     */
    public Company(String id, String customerDescription, String productDescription, Set<String> categories) {
        this(id, "", customerDescription, productDescription, categories, "");
    }

    /**
     * Category tags joined with the given delimiter, in input order.
     */
    public String joinedCategories(String delimiter) {
        return String.join(delimiter, categories);
    }
}
