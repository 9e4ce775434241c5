package org.automatic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code automatic.compiler} configuration block.
 *
 * @param moduleName The name given to every generated IR module.
 * @param includePaths Directories searched for {@code #INCLUDE} targets after the including unit's directory.
 * @param maxIncludeDepth The maximum nesting of included units.
 * @param verbosity The {@link org.automatic.compiler.diagnostics.CompilerLogger} level.
 * @param debugDump Whether the rendered IR is written to {@code build/compiler-dumps}.
 */
public record CompilerSettings(
        String moduleName,
        List<Path> includePaths,
        int maxIncludeDepth,
        int verbosity,
        boolean debugDump
) {

    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "automatic.compiler";

    public CompilerSettings {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank.");
        }
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("Maximum include depth must be positive but is " + maxIncludeDepth + ".");
        }
        includePaths = List.copyOf(includePaths);
    }

    /**
     * Reads the settings from a loaded configuration.
     *
     * @param config The configuration containing an {@code automatic.compiler} block.
     * @return The settings.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerSettings fromConfig(final Config config) {
        final Config compiler = config.getConfig(CONFIG_PATH);
        final List<Path> includePaths = new ArrayList<>();
        for (String path : compiler.getStringList("preprocessor.include-paths")) {
            includePaths.add(Path.of(path));
        }
        try {
            return new CompilerSettings(
                    compiler.getString("module-name"),
                    includePaths,
                    compiler.getInt("preprocessor.max-include-depth"),
                    compiler.getInt("verbosity"),
                    compiler.getBoolean("debug-dump"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(compiler.origin(), CONFIG_PATH, e.getMessage(), e);
        }
    }

    /**
     * @param enabled Whether the debug dump is written.
     * @return A copy with the debug dump switched.
     */
    public CompilerSettings withDebugDump(boolean enabled) {
        return new CompilerSettings(moduleName, includePaths, maxIncludeDepth, verbosity, enabled);
    }

    /**
     * @param paths The include directories.
     * @return A copy with the given include directories.
     */
    public CompilerSettings withIncludePaths(List<Path> paths) {
        return new CompilerSettings(moduleName, paths, maxIncludeDepth, verbosity, debugDump);
    }
}
