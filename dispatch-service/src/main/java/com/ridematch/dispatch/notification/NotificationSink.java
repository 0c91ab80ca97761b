package com.ridematch.dispatch.notification;

import com.ridematch.shared.messages.UserNotification;

/**
 * Delivers a message to one user. At-most-once and fire-and-forget: callers
 * never learn whether the user actually received it.
 */
public interface NotificationSink {

    void sendToUser(String userId, UserNotification notification);
}
