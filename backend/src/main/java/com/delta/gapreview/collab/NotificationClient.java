package com.delta.gapreview.collab;

public interface NotificationClient {

    /**
     * @return a reference to the delivered message, stored on the run
     */
    String sendApprovalRequest(String runId, String summary);

    void sendCompletion(String runId, String summary);
}
