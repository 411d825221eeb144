package com.raditha.competitors.embedding;

import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.config.EmbeddingOptions;
import com.raditha.competitors.exception.DimensionMismatchException;
import com.raditha.competitors.exception.EmbeddingException;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Exclusion;
import com.raditha.competitors.model.ExclusionReason;
import com.raditha.competitors.model.NormalizedCompany;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class EmbeddingFuserTest {

    private static final float[] PRODUCT = { 3f, 0f, 4f };
    private static final float[] CUSTOMER = { 0f, 2f, 0f };

    /**
     * Returns a fixed vector per text and records every batch it receives.
     */
    static class FixedModel implements EmbeddingModel {
        final Map<String, float[]> vectors = new HashMap<>();
        final List<List<String>> batches = new ArrayList<>();

        FixedModel with(String text, float[] vector) {
            vectors.put(text, vector);
            return this;
        }

        @Override
        public String modelId() {
            return "fixed";
        }

        @Override
        public synchronized List<float[]> embed(List<String> texts) {
            batches.add(List.copyOf(texts));
            return texts.stream().map(vectors::get).toList();
        }
    }

    private static ClusteringConfig config(double alpha) {
        return ClusteringConfig.defaults()
                .withAlpha(alpha)
                .withEmbedding(new EmbeddingOptions(2, 2, 3, 0));
    }

    private static NormalizedCompany company(String id, String customer, String product) {
        return new NormalizedCompany(new Company(id, customer, product, Set.of()), customer, product);
    }

    private static FixedModel standardModel() {
        return new FixedModel().with("product", PRODUCT).with("customer", CUSTOMER);
    }

    @Test
    void testAlphaOneGivesUnitProductVector() throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(1.0))
                .fuse(List.of(company("c1", "customer", "product")));

        assertArrayEquals(new float[] { 0.6f, 0f, 0.8f }, space.vector(0), 1e-6f);
    }

    @Test
    void testAlphaZeroGivesUnitCustomerVector() throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(0.0))
                .fuse(List.of(company("c1", "customer", "product")));

        assertArrayEquals(new float[] { 0f, 1f, 0f }, space.vector(0), 1e-6f);
    }

    @Test
    void testFusionWeightsBothFields() throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(0.5))
                .fuse(List.of(company("c1", "customer", "product")));

        // 0.5 * (0.6, 0, 0.8) + 0.5 * (0, 1, 0), normalized
        double norm = Math.sqrt(0.3 * 0.3 + 0.5 * 0.5 + 0.4 * 0.4);
        assertArrayEquals(new float[] { (float) (0.3 / norm), (float) (0.5 / norm), (float) (0.4 / norm) },
                space.vector(0), 1e-6f);
    }

    @Property(tries = 50)
    void singleCustomerFieldIgnoresAlpha(@ForAll @DoubleRange(min = 0.0, max = 1.0) double alpha)
            throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(alpha))
                .fuse(List.of(company("c1", "customer", "")));

        assertArrayEquals(new float[] { 0f, 1f, 0f }, space.vector(0), 1e-6f);
    }

    @Property(tries = 50)
    void fusedVectorsHaveUnitLength(@ForAll @DoubleRange(min = 0.0, max = 1.0) double alpha) throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(alpha))
                .fuse(List.of(company("c1", "customer", "product"), company("c2", "", "product")));

        for (float[] v : space.vectors()) {
            assertEquals(1.0, VectorMath.norm(v), 1e-5);
        }
    }

    @Test
    void testEmptyDescriptionsAreExcluded() throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(0.6)).fuse(List.of(
                company("c1", "customer", "product"),
                company("c2", "", ""),
                company("c3", "customer", "")));

        assertEquals(List.of("c1", "c3"), space.ids());
        assertEquals(List.of(new Exclusion("c2", ExclusionReason.EMPTY_DESCRIPTIONS)), space.exclusions());
    }

    @Test
    void testZeroNormEmbeddingIsExcluded() throws Exception {
        FixedModel model = standardModel().with("nothing", new float[] { 0f, 0f, 0f });
        EmbeddingSpace space = new EmbeddingFuser(model, config(0.6)).fuse(List.of(
                company("c1", "nothing", ""),
                company("c2", "customer", "product")));

        assertEquals(List.of("c2"), space.ids());
        assertEquals(ExclusionReason.ZERO_NORM_EMBEDDING, space.exclusions().get(0).reason());
    }

    @Test
    void testZeroNormFieldFallsBackToOtherField() throws Exception {
        FixedModel model = standardModel().with("nothing", new float[] { 0f, 0f, 0f });
        EmbeddingSpace space = new EmbeddingFuser(model, config(0.6))
                .fuse(List.of(company("c1", "customer", "nothing")));

        assertArrayEquals(new float[] { 0f, 1f, 0f }, space.vector(0), 1e-6f);
    }

    @Test
    void testOutputOrderMatchesInputOrder() throws Exception {
        FixedModel model = new FixedModel();
        List<NormalizedCompany> companies = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            model.with("text " + i, new float[] { i + 1f, 1f });
            companies.add(company("id" + i, "text " + i, ""));
        }

        EmbeddingSpace space = new EmbeddingFuser(model, config(0.6)).fuse(companies);

        for (int i = 0; i < 25; i++) {
            assertEquals("id" + i, space.id(i));
            float[] expected = VectorMath.normalize(new float[] { i + 1f, 1f });
            assertArrayEquals(expected, space.vector(i), 1e-6f);
        }
    }

    @Test
    void testIdenticalTextsEmbeddedOnce() throws Exception {
        FixedModel model = standardModel();
        new EmbeddingFuser(model, config(0.6)).fuse(List.of(
                company("c1", "customer", "product"),
                company("c2", "customer", "product"),
                company("c3", "customer", "product")));

        List<String> embedded = model.batches.stream().flatMap(List::stream).toList();
        assertEquals(2, embedded.size());
        assertTrue(embedded.containsAll(List.of("product", "customer")));
    }

    @Test
    void testFailedBatchIsRetried() throws Exception {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.modelId()).thenReturn("flaky");
        when(model.declaredDimension()).thenCallRealMethod();
        when(model.embed(anyList()))
                .thenThrow(new EmbeddingException("rate limited"))
                .thenReturn(List.of(new float[] { 1f, 0f }));

        EmbeddingSpace space = new EmbeddingFuser(model, config(0.6))
                .fuse(List.of(company("c1", "customer", "")));

        assertEquals(1, space.size());
        verify(model, times(2)).embed(anyList());
    }

    @Test
    void testBatchFailsAfterMaxAttempts() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.modelId()).thenReturn("broken");
        when(model.embed(anyList())).thenThrow(new EmbeddingException("service unavailable"));

        EmbeddingFuser fuser = new EmbeddingFuser(model, config(0.6));
        EmbeddingException e = assertThrows(EmbeddingException.class,
                () -> fuser.fuse(List.of(company("c1", "customer", ""))));

        assertTrue(e.getMessage().contains("after 3 attempts"));
        assertEquals("embedding", e.getStage());
        verify(model, times(3)).embed(anyList());
    }

    @Test
    void testWrongVectorCountIsRetried() throws Exception {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.modelId()).thenReturn("short");
        when(model.declaredDimension()).thenCallRealMethod();
        when(model.embed(anyList()))
                .thenReturn(List.of())
                .thenReturn(List.of(new float[] { 1f, 0f }));

        EmbeddingSpace space = new EmbeddingFuser(model, config(0.6))
                .fuse(List.of(company("c1", "customer", "")));

        assertEquals(1, space.size());
        verify(model, times(2)).embed(anyList());
    }

    @Test
    void testDimensionMismatchAborts() {
        FixedModel model = new FixedModel()
                .with("a", new float[] { 1f, 0f })
                .with("b", new float[] { 1f, 0f })
                .with("c", new float[] { 1f, 0f, 0f });
        List<NormalizedCompany> companies = List.of(
                company("c1", "a", ""), company("c2", "b", ""), company("c3", "c", ""));

        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> new EmbeddingFuser(model, config(0.6)).fuse(companies));

        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
    }

    @Test
    void testDeclaredDimensionIsEnforced() {
        FixedModel model = new FixedModel() {
            @Override
            public java.util.OptionalInt declaredDimension() {
                return java.util.OptionalInt.of(4);
            }
        }.with("a", new float[] { 1f, 0f });

        assertThrows(DimensionMismatchException.class,
                () -> new EmbeddingFuser(model, config(0.6)).fuse(List.of(company("c1", "a", ""))));
    }

    @Test
    void testSpaceRecordsModelAndDimension() throws Exception {
        EmbeddingSpace space = new EmbeddingFuser(standardModel(), config(0.6))
                .fuse(List.of(company("c1", "customer", "product")));

        assertEquals("fixed", space.modelId());
        assertEquals(3, space.dimension());
    }
}
