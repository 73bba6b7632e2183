package com.deda.plugins.shell;

import com.deda.plugin.ApplicationPlugin;
import com.deda.plugin.PluginContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Application plugin that opens the platform shell with the Dedaverse environment: {@code SHELL}
 * (default {@code /bin/bash}) on Unix, {@code COMSPEC} (default {@code %SystemRoot%\System32\cmd.exe},
 * kept open with {@code /k}) on Windows.
 */
public final class ShellApplicationPlugin implements ApplicationPlugin {

    private static final Logger log = LoggerFactory.getLogger(ShellApplicationPlugin.class);

    static final String ENV_PROJECT = "DEDAVERSE_PROJECT";
    static final String ENV_PROJECT_ROOT = "DEDAVERSE_PROJECT_ROOT";
    private static final String DEFAULT_UNIX_SHELL = "/bin/bash";

    private final Map<String, String> environment;
    private final boolean windows;
    private volatile String projectName;
    private volatile Path projectRoot;

    public ShellApplicationPlugin() {
        this(System.getenv(), System.getProperty("os.name", ""));
    }

    ShellApplicationPlugin(Map<String, String> environment, String osName) {
        this.environment = Map.copyOf(environment);
        this.windows = osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    @Override
    public void load(PluginContext context) {
        this.projectName = context.getConfig().getProjectName();
        this.projectRoot = context.getProjectRoot().orElse(null);
        log.debug("Shell plugin using {}", command());
    }

    /** Shell executable followed by the arguments that keep it interactive. */
    List<String> command() {
        List<String> cmd = new ArrayList<>();
        if (windows) {
            String comspec = environment.getOrDefault("COMSPEC", "cmd.exe");
            if (comspec.equalsIgnoreCase("cmd.exe") || !comspec.contains("\\")) {
                String systemRoot = environment.getOrDefault("SystemRoot", "C:\\Windows");
                comspec = systemRoot + "\\System32\\cmd.exe";
            }
            cmd.add(comspec);
            cmd.add("/k");
        } else {
            String shell = environment.get("SHELL");
            cmd.add(shell != null && !shell.isBlank() ? shell : DEFAULT_UNIX_SHELL);
        }
        return cmd;
    }

    @Override
    public Optional<Path> find() {
        String exe = command().get(0);
        Path path = Paths.get(exe);
        if (path.isAbsolute()) {
            return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
        }
        String searchPath = environment.getOrDefault("PATH", "");
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Paths.get(dir).resolve(exe);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public Map<String, String> setupEnvironment(Map<String, String> env) {
        if (projectName != null) env.put(ENV_PROJECT, projectName);
        if (projectRoot != null) env.put(ENV_PROJECT_ROOT, projectRoot.toString());
        return env;
    }

    @Override
    public Process launch(List<String> args) throws IOException {
        Path exe = find().orElseThrow(() -> new IOException("Shell executable not found: " + command().get(0)));
        List<String> cmd = new ArrayList<>();
        cmd.add(exe.toString());
        cmd.addAll(command().subList(1, command().size()));
        if (args != null) cmd.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        Map<String, String> env = setupEnvironment(new HashMap<>(environment));
        pb.environment().clear();
        pb.environment().putAll(env);
        if (projectRoot != null && Files.isDirectory(projectRoot)) {
            pb.directory(projectRoot.toFile());
        }
        log.info("Launching shell: {}", cmd);
        return pb.start();
    }
}
