package com.delta.gapreview.workflow.model;

/**
 * One missing skill to research. {@code gapId} values sort in analysis order.
 */
public record Gap(String gapId, String skill, String query) {
}
