package com.delta.gapreview.workflow.api;

public record ResumeRequest(String decision) {
}
