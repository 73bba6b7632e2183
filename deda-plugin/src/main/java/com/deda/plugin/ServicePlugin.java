package com.deda.plugin;

import java.net.URI;

/** Remote service the pipeline talks to (render farm, asset server, ...). */
public interface ServicePlugin extends Plugin {

    URI endpoint();

    /** Whether the service currently answers. Must not throw. */
    boolean isAvailable();
}
