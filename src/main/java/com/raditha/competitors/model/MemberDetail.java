package com.raditha.competitors.model;

/**
 * Full detail of one cluster member, for manual review.
 */
public record MemberDetail(
        String id,
        String name,
        String customers,
        String product,
        String categories,
        String description) {

    public static MemberDetail of(Company company) {
        return new MemberDetail(
                company.id(),
                company.name(),
                company.customerDescription(),
                company.productDescription(),
                company.joinedCategories(", "),
                company.description());
    }
}
