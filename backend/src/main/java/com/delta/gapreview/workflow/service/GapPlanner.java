package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.workflow.model.AlignmentAnalysis;
import com.delta.gapreview.workflow.model.Gap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns an analysis into research gaps: missing skills first, else the leading required skills,
 * else one general gap.
 */
@Component
public class GapPlanner {
    static final int FALLBACK_SKILL_COUNT = 5;
    static final String GENERAL_SKILL = "general";
    static final String DEFAULT_ROLE = "the role";

    private final ReviewProperties properties;

    public GapPlanner(ReviewProperties properties) {
        this.properties = properties;
    }

    public List<Gap> plan(AlignmentAnalysis analysis, String targetTitle) {
        List<String> skills = distinct(analysis == null ? List.of() : analysis.missingSkills());
        if (skills.isEmpty() && analysis != null) {
            List<String> hard = distinct(analysis.hardSkills());
            skills = hard.subList(0, Math.min(FALLBACK_SKILL_COUNT, hard.size()));
        }
        if (skills.isEmpty()) {
            skills = List.of(GENERAL_SKILL);
        }
        int maxGaps = properties.getFanOut().getMaxGaps();
        String role = roleFor(analysis, targetTitle);
        List<Gap> gaps = new ArrayList<>();
        for (String skill : skills) {
            if (gaps.size() >= maxGaps) {
                break;
            }
            gaps.add(new Gap(String.format(Locale.ROOT, "gap-%02d", gaps.size() + 1), skill, queryFor(skill, role)));
        }
        return List.copyOf(gaps);
    }

    static String queryFor(String skill, String role) {
        return skill + " tutorial project for " + role;
    }

    private String roleFor(AlignmentAnalysis analysis, String targetTitle) {
        if (targetTitle != null && !targetTitle.isBlank()) {
            return targetTitle.trim();
        }
        if (analysis != null && analysis.jobTitle() != null && !analysis.jobTitle().isBlank()) {
            return analysis.jobTitle().trim();
        }
        return DEFAULT_ROLE;
    }

    private List<String> distinct(List<String> values) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String trimmed = value.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return out;
    }
}
