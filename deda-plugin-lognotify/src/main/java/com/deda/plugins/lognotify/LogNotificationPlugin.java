package com.deda.plugins.lognotify;

import com.deda.plugin.NotificationPlugin;
import com.deda.plugin.PluginContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Notification system that writes notifications to the log and keeps the most recent ones for
 * display. Level from setting {@value #LEVEL_KEY} ({@code info} or {@code warn}, default info).
 */
public final class LogNotificationPlugin implements NotificationPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogNotificationPlugin.class);

    public static final String LEVEL_KEY = "lognotify.level";
    static final int MAX_RECENT = 50;

    private final Deque<String> recent = new ArrayDeque<>();
    private volatile boolean warn;

    @Override
    public void load(PluginContext context) {
        String level = context.getSetting(LEVEL_KEY).asString("info").trim().toLowerCase(Locale.ROOT);
        this.warn = level.equals("warn") || level.equals("warning");
    }

    @Override
    public void notify(String title, String message) {
        if (warn) {
            log.warn("[{}] {}", title, message);
        } else {
            log.info("[{}] {}", title, message);
        }
        synchronized (recent) {
            recent.addFirst(title + ": " + message);
            while (recent.size() > MAX_RECENT) {
                recent.removeLast();
            }
        }
    }

    /** Most recent notifications, newest first. */
    public List<String> getRecent() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }
}
