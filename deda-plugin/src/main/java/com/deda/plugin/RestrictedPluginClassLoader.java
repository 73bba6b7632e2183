package com.deda.plugin;

import java.util.List;

/**
 * Parent of every external plugin jar's class loader. A jar can link against the plugin and
 * configuration APIs, the annotations, Jackson, slf4j and the JDK; any other host class (lifecycle,
 * bootstrap, the built-in plugins under {@code com.deda.plugins}) is reported as not found, whether
 * it is referenced directly or looked up by name at run time.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    // each prefix ends with '.' so that e.g. com.deda.plugins.* does not match com.deda.plugin.
    private static final List<String> VISIBLE_PREFIXES = List.of(
            "java.",
            "javax.",
            "com.deda.plugin.",
            "com.deda.config.",
            "com.deda.annotations.",
            "com.fasterxml.jackson.",
            "org.slf4j.");

    private final ClassLoader hostLoader;

    /** Loads visible classes through the loader of {@link PluginProvider}; has no parent of its own. */
    public RestrictedPluginClassLoader() {
        super(null);
        this.hostLoader = PluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (!isAllowed(name)) {
            throw new ClassNotFoundException(name + " is not visible to external plugins");
        }
        Class<?> c = hostLoader.loadClass(name);
        if (resolve) {
            resolveClass(c);
        }
        return c;
    }

    static boolean isAllowed(String name) {
        return VISIBLE_PREFIXES.stream().anyMatch(name::startsWith);
    }
}
