package com.delta.gapreview.workflow.api;

public record CancelRequest(String reason) {
}
