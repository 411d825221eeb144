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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns normalized companies into fused, unit-length embeddings.
 *
 * <p>
 * Each distinct normalized text is embedded once. Texts are split into batches
 * and dispatched on a fixed pool of worker threads; a failed batch is retried with
 * exponential backoff. The product and customer vectors of a company are then
 * combined as {@code normalize(alpha * product + (1 - alpha) * customer)}. A
 * company with a single usable field gets that field's unit vector.
 */
public class EmbeddingFuser {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingFuser.class);

    private final EmbeddingModel model;
    private final double alpha;
    private final EmbeddingOptions options;

    public EmbeddingFuser(EmbeddingModel model, ClusteringConfig config) {
        this.model = model;
        this.alpha = config.alpha();
        this.options = config.embedding();
    }

    /**
     * Embed and fuse a batch of companies.
     *
     * @param companies Normalized companies in input order
     * @return Embedding space of the surviving companies, in input order
     * @throws EmbeddingException         if a batch still fails after the last attempt
     * @throws DimensionMismatchException if the model returns vectors of differing width
     * @throws InterruptedException       if interrupted while waiting for the workers
     */
    public EmbeddingSpace fuse(List<NormalizedCompany> companies) throws InterruptedException {
        List<Exclusion> exclusions = new ArrayList<>();
        Map<String, float[]> textVectors = new LinkedHashMap<>();

        for (NormalizedCompany company : companies) {
            if (!company.hasAnyText()) {
                continue;
            }
            if (company.hasProductText()) {
                textVectors.putIfAbsent(company.productText(), null);
            }
            if (company.hasCustomerText()) {
                textVectors.putIfAbsent(company.customerText(), null);
            }
        }

        List<String> uniqueTexts = new ArrayList<>(textVectors.keySet());
        List<float[]> embedded = embedAll(uniqueTexts);
        int dimension = checkDimensions(embedded);
        for (int i = 0; i < uniqueTexts.size(); i++) {
            textVectors.put(uniqueTexts.get(i), VectorMath.normalize(embedded.get(i)));
        }

        List<Company> kept = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (NormalizedCompany company : companies) {
            if (!company.hasAnyText()) {
                exclusions.add(new Exclusion(company.id(), ExclusionReason.EMPTY_DESCRIPTIONS));
                continue;
            }
            float[] product = company.hasProductText() ? textVectors.get(company.productText()) : null;
            float[] customer = company.hasCustomerText() ? textVectors.get(company.customerText()) : null;
            float[] fused = fuse(product, customer);
            if (fused == null) {
                exclusions.add(new Exclusion(company.id(), ExclusionReason.ZERO_NORM_EMBEDDING));
                continue;
            }
            kept.add(company.company());
            vectors.add(fused);
        }

        logger.info("Embedded {} distinct texts; fused {} companies into {}-dimensional space ({} excluded)",
                uniqueTexts.size(), kept.size(), dimension, exclusions.size());
        return new EmbeddingSpace(kept, vectors, dimension, model.modelId(), exclusions);
    }

    /**
     * Combine two unit field vectors; either may be {@code null} when the field is
     * empty or embedded to zero length.
     *
     * @return Unit fused vector, or {@code null} when nothing usable remains
     */
    float[] fuse(float[] product, float[] customer) {
        if (product == null && customer == null) {
            return null;
        }
        if (product == null) {
            return customer;
        }
        if (customer == null) {
            return product;
        }
        return VectorMath.normalize(VectorMath.weightedSum(product, alpha, customer, 1.0 - alpha));
    }

    private List<float[]> embedAll(List<String> texts) throws InterruptedException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += options.batchSize()) {
            batches.add(texts.subList(start, Math.min(start + options.batchSize(), texts.size())));
        }

        int threads = Math.min(options.workers(), batches.size());
        logger.info("Embedding {} texts in {} batches on {} workers", texts.size(), batches.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<float[]>>> futures = new ArrayList<>();
            for (List<String> batch : batches) {
                futures.add(executor.submit(() -> embedWithRetry(batch)));
            }
            List<float[]> result = new ArrayList<>(texts.size());
            for (Future<List<float[]>> future : futures) {
                result.addAll(await(future));
            }
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<float[]> await(Future<List<float[]>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            throw new EmbeddingException("Embedding worker failed: " + cause.getMessage(), cause);
        }
    }

    List<float[]> embedWithRetry(List<String> batch) throws InterruptedException {
        EmbeddingException lastFailure = null;
        long backoff = options.initialBackoffMillis();
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            try {
                List<float[]> vectors = model.embed(batch);
                if (vectors == null || vectors.size() != batch.size()) {
                    throw new EmbeddingException(String.format("Model returned %d vectors for %d texts",
                            vectors == null ? 0 : vectors.size(), batch.size()));
                }
                return vectors;
            } catch (EmbeddingException e) {
                lastFailure = e;
                if (attempt < options.maxAttempts()) {
                    logger.warn("Embedding batch of {} texts failed (attempt {}/{}), retrying in {} ms: {}",
                            batch.size(), attempt, options.maxAttempts(), backoff, e.getMessage());
                    Thread.sleep(backoff);
                    backoff *= 2;
                }
            }
        }
        throw new EmbeddingException(String.format("Embedding batch of %d texts failed after %d attempts",
                batch.size(), options.maxAttempts()), lastFailure);
    }

    private int checkDimensions(List<float[]> vectors) {
        OptionalInt declared = model.declaredDimension();
        int expected;
        if (declared.isPresent()) {
            expected = declared.getAsInt();
        } else if (!vectors.isEmpty()) {
            expected = vectors.get(0).length;
        } else {
            return 0;
        }
        for (float[] v : vectors) {
            if (v.length != expected) {
                throw new DimensionMismatchException(expected, v.length);
            }
        }
        return expected;
    }
}
