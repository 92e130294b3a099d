package com.astrophot.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conjunto de estrellas de comparación con sus pesos, en orden de ranking (la más estable primero).
 * Los pesos son no negativos y suman 1. {@code degraded} indica que la selección no alcanzó el
 * mínimo y se usó el conjunto completo con pesos uniformes.
 */
public class ComparisonEnsemble {

    public static final double WEIGHT_TOLERANCE = 1e-9;

    public static class Member {
        public final int starId;
        public final double weight;
        public final double scatter;   // dispersión residual frente al ensemble, en magnitudes
        public final double statistic; // estadístico de clipping (menor = más estable)
        public final int rank;         // 1 = menor variabilidad cruda

        public Member(int starId, double weight, double scatter, double statistic, int rank) {
            this.starId = starId;
            this.weight = weight;
            this.scatter = scatter;
            this.statistic = statistic;
            this.rank = rank;
        }
    }

    public final List<Member> members;
    public final boolean degraded;

    public ComparisonEnsemble(List<Member> members, boolean degraded) {
        double sum = 0;
        for (Member m : members) {
            if (!(m.weight >= 0)) throw new IllegalArgumentException("Peso negativo para la estrella " + m.starId);
            sum += m.weight;
        }
        if (!members.isEmpty() && Math.abs(sum - 1.0) > WEIGHT_TOLERANCE)
            throw new IllegalArgumentException("Los pesos suman " + sum);
        for (int i = 1; i < members.size(); i++) {
            if (members.get(i).rank <= members.get(i - 1).rank)
                throw new IllegalArgumentException("Miembros fuera de orden de ranking en la estrella " + members.get(i).starId);
        }
        this.members = List.copyOf(members);
        this.degraded = degraded;
    }

    /** Pesos uniformes, rankeados por id. */
    public static ComparisonEnsemble uniform(List<Integer> starIds, boolean degraded) {
        List<Integer> sorted = new ArrayList<>(starIds);
        sorted.sort(Integer::compare);
        double w = sorted.isEmpty() ? 0 : 1.0 / sorted.size();
        List<Member> members = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) members.add(new Member(sorted.get(i), w, Double.NaN, Double.NaN, i + 1));
        return new ComparisonEnsemble(members, degraded);
    }

    public int size() { return members.size(); }

    public boolean isEmpty() { return members.isEmpty(); }

    /** Ids en orden de ranking. */
    public List<Integer> starIds() {
        List<Integer> ids = new ArrayList<>(members.size());
        for (Member m : members) ids.add(m.starId);
        return ids;
    }

    public Optional<Member> member(int starId) {
        for (Member m : members) if (m.starId == starId) return Optional.of(m);
        return Optional.empty();
    }
}
