package com.raditha.competitors.pipeline;

import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.Exclusion;

import java.util.List;

/**
 * Companies read from the input file.
 *
 * @param companies  Valid records in file order
 * @param exclusions Rows rejected while reading
 * @param rows       Number of data rows in the file
 */
public record CompanyInput(List<Company> companies, List<Exclusion> exclusions, int rows) {

    public CompanyInput {
        companies = List.copyOf(companies);
        exclusions = List.copyOf(exclusions);
    }
}
