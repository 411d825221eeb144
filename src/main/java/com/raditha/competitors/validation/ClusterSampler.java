package com.raditha.competitors.validation;

import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.ClusterSample;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.MemberDetail;
import com.raditha.competitors.model.Partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded selection of clusters and members for manual review.
 */
public class ClusterSampler {

    private final int sampleSize;
    private final int membersPerSample;
    private final long seed;

    public ClusterSampler(int sampleSize, int membersPerSample, long seed) {
        this.sampleSize = sampleSize;
        this.membersPerSample = membersPerSample;
        this.seed = seed;
    }

    /**
     * @param partition Clusters to draw from
     * @param companies Company by identifier, for member detail
     * @return Up to {@code sampleSize} clusters ordered by id
     */
    public List<ClusterSample> sample(Partition partition, Map<String, Company> companies) {
        Random random = new Random(seed);
        List<Cluster> chosen = new ArrayList<>(partition.clusters());
        Collections.shuffle(chosen, random);
        chosen = new ArrayList<>(chosen.subList(0, Math.min(sampleSize, chosen.size())));
        chosen.sort(Comparator.comparingInt(Cluster::id));

        List<ClusterSample> samples = new ArrayList<>(chosen.size());
        for (Cluster cluster : chosen) {
            List<MemberDetail> members = new ArrayList<>();
            for (String id : sampleMembers(cluster.memberIds(), membersPerSample, random)) {
                members.add(MemberDetail.of(companies.get(id)));
            }
            samples.add(new ClusterSample(cluster.id(), cluster.size(), members));
        }
        return samples;
    }

    /**
     * Up to {@code limit} members, drawn with {@code random} and returned in
     * their original order.
     */
    static List<String> sampleMembers(List<String> members, int limit, Random random) {
        if (members.size() <= limit) {
            return members;
        }
        List<Integer> positions = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            positions.add(i);
        }
        Collections.shuffle(positions, random);
        List<Integer> kept = new ArrayList<>(positions.subList(0, limit));
        Collections.sort(kept);
        List<String> result = new ArrayList<>(limit);
        for (int position : kept) {
            result.add(members.get(position));
        }
        return result;
    }
}
