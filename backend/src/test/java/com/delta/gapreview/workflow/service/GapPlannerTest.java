package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.workflow.model.AlignmentAnalysis;
import com.delta.gapreview.workflow.model.Gap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class GapPlannerTest {
    private final ReviewProperties properties = new ReviewProperties();
    private final GapPlanner planner = new GapPlanner(properties);

    @Test
    void missingSkillsBecomeOrderedGaps() {
        AlignmentAnalysis analysis = new AlignmentAnalysis(
            List.of("Java"), List.of("Kubernetes", "Go", "kubernetes"), "Platform Engineer", null);

        List<Gap> gaps = planner.plan(analysis, null);

        assertThat(gaps).extracting(Gap::gapId).containsExactly("gap-01", "gap-02");
        assertThat(gaps.get(0).query()).isEqualTo("Kubernetes tutorial project for Platform Engineer");
    }

    @Test
    void fallsBackToLeadingHardSkills() {
        AlignmentAnalysis analysis = new AlignmentAnalysis(
            List.of("a", "b", "c", "d", "e", "f", "g"), List.of(), null, null);

        List<Gap> gaps = planner.plan(analysis, "Data Engineer");

        assertThat(gaps).extracting(Gap::skill).containsExactly("a", "b", "c", "d", "e");
        assertThat(gaps.get(4).query()).endsWith("for Data Engineer");
    }

    @Test
    void emptyAnalysisYieldsOneGeneralGap() {
        List<Gap> gaps = planner.plan(new AlignmentAnalysis(List.of(), List.of(), null, null), null);

        assertThat(gaps).singleElement().satisfies(gap -> {
            assertThat(gap.skill()).isEqualTo("general");
            assertThat(gap.query()).isEqualTo("general tutorial project for the role");
        });
    }

    @Test
    void gapCountIsCapped() {
        properties.getFanOut().setMaxGaps(2);

        List<Gap> gaps = planner.plan(new AlignmentAnalysis(List.of(), List.of("a", "b", "c"), null, null), null);

        assertThat(gaps).hasSize(2);
    }

    @Test
    void gapIdsSortInAnalysisOrderAtTheCeiling() {
        properties.getFanOut().setMaxGaps(150);
        List<String> skills = IntStream.rangeClosed(1, 120).mapToObj(i -> "skill " + i).toList();

        List<Gap> gaps = planner.plan(new AlignmentAnalysis(List.of(), skills, null, null), null);

        assertThat(properties.getFanOut().getMaxGaps()).isEqualTo(ReviewProperties.FanOut.MAX_GAP_IDS);
        assertThat(gaps).hasSize(99);
        assertThat(gaps).extracting(Gap::gapId).isSorted();
        assertThat(gaps.get(98).gapId()).isEqualTo("gap-99");
        assertThat(gaps.get(98).skill()).isEqualTo("skill 99");
    }
}
