package com.deda.plugin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DCC application integration: locate the executable, prepare its environment and start it.
 */
public interface ApplicationPlugin extends Plugin {

    /**
     * Locates the application's executable on this machine.
     *
     * @return executable path, or empty if the application is not installed
     */
    Optional<Path> find();

    /**
     * Starts the application with {@code args}. The returned process is not waited on.
     *
     * @throws IOException when the executable cannot be found or started
     */
    Process launch(List<String> args) throws IOException;

    /**
     * Adjusts the environment the application is started with. Default returns it unchanged.
     *
     * @param env mutable copy of the launching environment
     * @return environment to launch with
     */
    default Map<String, String> setupEnvironment(Map<String, String> env) {
        return env;
    }
}
