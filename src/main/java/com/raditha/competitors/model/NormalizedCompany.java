package com.raditha.competitors.model;

/**
 * A company paired with its normalized description fields.
 * Empty normalized text means the field carries no usable description.
 *
 * @param company      Source record
 * @param customerText Normalized customer description
 * @param productText  Normalized product description
 */
public record NormalizedCompany(Company company, String customerText, String productText) {

    public NormalizedCompany {
        customerText = customerText == null ? "" : customerText;
        productText = productText == null ? "" : productText;
    }

    public String id() {
        return company.id();
    }

    public boolean hasCustomerText() {
        return !customerText.isEmpty();
    }

    public boolean hasProductText() {
        return !productText.isEmpty();
    }

    public boolean hasAnyText() {
        return hasCustomerText() || hasProductText();
    }
}
