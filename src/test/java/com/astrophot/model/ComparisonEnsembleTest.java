package com.astrophot.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ComparisonEnsembleTest {

    @Test
    void uniformWeightsSumToOne() {
        ComparisonEnsemble e = ComparisonEnsemble.uniform(List.of(7, 3, 5), true);

        assertThat(e.starIds()).containsExactly(3, 5, 7);
        assertThat(e.members).allSatisfy(m -> assertThat(m.weight).isCloseTo(1.0 / 3, within(1e-15)));
        assertThat(e.degraded).isTrue();
    }

    @Test
    void rejectsWeightsNotSummingToOne() {
        List<ComparisonEnsemble.Member> members = List.of(
                new ComparisonEnsemble.Member(1, 0.5, 0.01, 1.0, 1),
                new ComparisonEnsemble.Member(2, 0.4, 0.01, 1.0, 2));

        assertThatThrownBy(() -> new ComparisonEnsemble(members, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeWeights() {
        List<ComparisonEnsemble.Member> members = List.of(
                new ComparisonEnsemble.Member(1, 1.2, 0.01, 1.0, 1),
                new ComparisonEnsemble.Member(2, -0.2, 0.01, 1.0, 2));

        assertThatThrownBy(() -> new ComparisonEnsemble(members, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keepsRankOrderInsteadOfIdOrder() {
        ComparisonEnsemble e = new ComparisonEnsemble(List.of(
                new ComparisonEnsemble.Member(9, 0.6, 0.01, 0.8, 1),
                new ComparisonEnsemble.Member(4, 0.4, 0.02, 1.1, 2)), false);

        assertThat(e.starIds()).containsExactly(9, 4);
        assertThat(e.member(4)).hasValueSatisfying(m -> assertThat(m.rank).isEqualTo(2));
    }

    @Test
    void rejectsMembersOutOfRankOrder() {
        List<ComparisonEnsemble.Member> members = List.of(
                new ComparisonEnsemble.Member(1, 0.5, 0.01, 1.0, 2),
                new ComparisonEnsemble.Member(2, 0.5, 0.01, 1.0, 1));

        assertThatThrownBy(() -> new ComparisonEnsemble(members, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyEnsembleIsAllowed() {
        assertThat(ComparisonEnsemble.uniform(List.of(), true).isEmpty()).isTrue();
        assertThat(ComparisonEnsemble.uniform(List.of(), true).member(1)).isEmpty();
    }
}
