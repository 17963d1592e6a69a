package org.syntaxscript.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The settings of a {@link org.syntaxscript.compiler.SyntaxScriptCompiler}.
 *
 * @param rootDir   The directory usage files are laid out under.
 * @param outDir    The directory compiled files are written to, mirroring their place under {@code rootDir}.
 * @param format    The target format, used to pick output templates and as output file extension.
 * @param verbosity The compiler log verbosity, 0 (errors only) to 4 (trace).
 */
public record CompilerOptions(Path rootDir, Path outDir, String format, int verbosity) {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerOptions.class);

    /** The configuration path holding the compiler settings. */
    public static final String CONFIG_PATH = "syntaxscript.compiler";
    /** The name of the optional configuration file in the working directory. */
    public static final String CONFIG_FILE_NAME = "syntaxscript.conf";

    public CompilerOptions {
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("Target format must not be blank");
        }
    }

    /**
     * Loads the options with {@code syntaxscript.conf} in the working directory as configuration file.
     * @return The options.
     * @throws ConfigException if a setting is missing or has the wrong type.
     * @see #load(Path)
     */
    public static CompilerOptions load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * Loads the options, respecting the precedence order:
     * 1. Environment Variables ({@code SYNTAXSCRIPT_ROOT}, {@code SYNTAXSCRIPT_OUT}, {@code SYNTAXSCRIPT_FORMAT})
     * 2. Java System Properties (e.g., -Dsyntaxscript.compiler.format=js)
     * 3. The configuration file
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file; skipped if it does not exist.
     * @return The options.
     * @throws ConfigException if a setting is missing or has the wrong type.
     */
    public static CompilerOptions load(Path configFile) {
        final Config fileConfig;
        if (Files.isRegularFile(configFile)) {
            LOG.info("Loading compiler options from file: {}", configFile.toAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile.toFile());
        } else {
            LOG.debug("Options file '{}' not found, using defaults for {}", configFile, CONFIG_PATH);
            fileConfig = ConfigFactory.empty();
        }

        // The one provided first wins; the SYNTAXSCRIPT_* substitutions in reference.conf resolve against the environment.
        final Config combined = ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();

        CompilerOptions options = fromConfig(combined);
        LOG.debug("Compiler options: root={}, out={}, format={}, verbosity={}",
                options.rootDir(), options.outDir(), options.format(), options.verbosity());
        return options;
    }

    /**
     * Reads the options from the {@code syntaxscript.compiler} section of a resolved configuration.
     * @param config The configuration.
     * @return The options.
     * @throws ConfigException if a setting is missing or has the wrong type.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config section = config.getConfig(CONFIG_PATH);
        String format = section.getString("format");
        if (format.isBlank()) {
            throw new ConfigException.BadValue(CONFIG_PATH + ".format", "Target format must not be blank");
        }
        return new CompilerOptions(
                Path.of(section.getString("root")),
                Path.of(section.getString("out")),
                format,
                section.getInt("verbosity"));
    }
}
