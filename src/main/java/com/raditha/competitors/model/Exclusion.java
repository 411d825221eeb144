package com.raditha.competitors.model;

/**
 * A company that was dropped from the pipeline together with the reason.
 *
 * @param companyId Identifier of the excluded company (empty when missing)
 * @param reason    Reason code
 * @param detail    Human readable detail, may be empty
 */
public record Exclusion(String companyId, ExclusionReason reason, String detail) {

    public Exclusion {
        companyId = companyId == null ? "" : companyId;
        detail = detail == null ? "" : detail;
    }

    public Exclusion(String companyId, ExclusionReason reason) {
        this(companyId, reason, "");
    }
}
