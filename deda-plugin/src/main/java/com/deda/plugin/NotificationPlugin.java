package com.deda.plugin;

/**
 * Operator notifications (desktop, chat, mail). Delivery is best-effort; implementations report
 * failure by throwing an unchecked exception.
 */
public interface NotificationPlugin extends Plugin {

    void notify(String title, String message);
}
