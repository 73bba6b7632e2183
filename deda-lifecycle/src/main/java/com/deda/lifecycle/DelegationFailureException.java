package com.deda.lifecycle;

/**
 * A plugin step of a transition failed, or a required capability had no active plugin. The state
 * was not advanced; one FAILED entry was appended to the asset history.
 */
public class DelegationFailureException extends LifecycleException {

    private final GateState from;
    private final GateState to;
    private final String plugin;
    private final String reason;

    public DelegationFailureException(AssetId assetId, GateState from, GateState to,
                                      String plugin, String reason, Throwable cause) {
        super(assetId, "Transition " + from + " -> " + to + " of " + assetId + " failed"
                + (plugin != null ? " in " + plugin : "") + ": " + reason, cause);
        this.from = from;
        this.to = to;
        this.plugin = plugin;
        this.reason = reason;
    }

    public GateState getFrom() {
        return from;
    }

    public GateState getTo() {
        return to;
    }

    /** Id of the failing plugin, or null when no plugin was available. */
    public String getPlugin() {
        return plugin;
    }

    /** The plugin's own message, unchanged. */
    public String getReason() {
        return reason;
    }
}
