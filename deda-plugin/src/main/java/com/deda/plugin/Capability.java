package com.deda.plugin;

/**
 * Plugin capabilities. Each capability is bound to the contract interface a plugin must implement
 * to be registered under it; a plugin may declare several.
 */
public enum Capability {

    /** DCC application that can be found on disk and launched (e.g. a shell, Maya, Houdini). */
    APPLICATION(ApplicationPlugin.class),

    /** Versioned file storage: checkout, submit, history. */
    FILE_MANAGER(FileManagerPlugin.class),

    /** External task tracking: create, link, status. */
    TASK_MANAGER(TaskManagerPlugin.class),

    /** Remote service reachable at an endpoint. */
    SERVICE(ServicePlugin.class),

    /** Pipeline tool launched with arguments. */
    TOOL(ToolPlugin.class),

    /** Sends notifications to operators. */
    NOTIFICATION_SYSTEM(NotificationPlugin.class);

    private final Class<? extends Plugin> contract;

    Capability(Class<? extends Plugin> contract) {
        this.contract = contract;
    }

    public Class<? extends Plugin> getContract() {
        return contract;
    }

    /** Whether {@code plugin} implements this capability's contract. */
    public boolean isImplementedBy(Plugin plugin) {
        return plugin != null && contract.isInstance(plugin);
    }
}
