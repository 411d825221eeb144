package com.raditha.competitors.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fused, unit-length embeddings of the surviving companies.
 * Row {@code i} of {@link #vectors()} belongs to {@code companies().get(i)}; rows
 * follow the input order of the companies that were not excluded.
 *
 * @param companies  Surviving companies in input order
 * @param vectors    Fused embedding per company
 * @param dimension  Width of every vector
 * @param modelId    Identifier of the embedding model that produced the vectors
 * @param exclusions Companies dropped while embedding
 */
public record EmbeddingSpace(
        List<Company> companies,
        List<float[]> vectors,
        int dimension,
        String modelId,
        List<Exclusion> exclusions) {

    public EmbeddingSpace {
        if (companies.size() != vectors.size()) {
            throw new IllegalArgumentException(String.format(
                    "Row count mismatch: %d companies but %d vectors", companies.size(), vectors.size()));
        }
        companies = List.copyOf(companies);
        vectors = List.copyOf(vectors);
        exclusions = List.copyOf(exclusions);
    }

    public int size() {
        return companies.size();
    }

    public float[] vector(int index) {
        return vectors.get(index);
    }

    public String id(int index) {
        return companies.get(index).id();
    }

    public List<String> ids() {
        return companies.stream().map(Company::id).toList();
    }

    /**
     * Map from company identifier to row index.
     */
    public Map<String, Integer> indexById() {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < companies.size(); i++) {
            index.put(companies.get(i).id(), i);
        }
        return index;
    }
}
