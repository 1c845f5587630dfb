package com.ruleflow.collaborator;

public interface NotificationDispatcher {

    /**
     * Publish a notification, waiting for the broker to acknowledge it.
     *
     * @throws com.ruleflow.exception.DispatchException if the broker does not acknowledge in time
     */
    void dispatch(Notification notification);
}
