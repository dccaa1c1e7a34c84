package com.delta.gapreview.workflow.api;

public record DocumentRequest(String content) {
}
