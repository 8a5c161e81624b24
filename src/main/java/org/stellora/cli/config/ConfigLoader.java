package org.stellora.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the Stellora configuration.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dstellora.simulation.maxTicks=50})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are merged, so a user override of
 * {@code stellora.events} also reaches the cosmic event plugin options that refer to it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "stellora.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates and loads the configuration file:
     * <ol>
     *   <li>the explicit file, if given;</li>
     *   <li>{@code -Dconfig.file};</li>
     *   <li>{@code config/stellora.conf} relative to the working directory;</li>
     *   <li>{@code APP_HOME/config/stellora.conf}, see {@link #installationConfigFile(File)};</li>
     *   <li>classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile Config file to use, or {@code null} for discovery.
     * @param handler            Receives resolution messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        if (protectionDomain == null) {
            return null;
        }
        final CodeSource codeSource = protectionDomain.getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        try {
            final URL location = codeSource.getLocation();
            return installationConfigFile(new File(location.toURI()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Finds the installation config for the application jar. {@code APP_HOME} is the jar's
     * directory ({@code mvn package} output, {@code APP_HOME/stellora.jar}) or, for a
     * {@code lib/} distribution layout, its parent ({@code APP_HOME/lib/stellora.jar}).
     *
     * @param jarOrClasses The code location of this class.
     * @return {@code APP_HOME/config/stellora.conf}, or {@code null} if there is none or the
     *         code runs from a classes directory.
     */
    static File installationConfigFile(final File jarOrClasses) {
        if (!jarOrClasses.isFile()) {
            // classes directory during development; the working directory lookup covers that case
            return null;
        }
        final File jarDir = jarOrClasses.getAbsoluteFile().getParentFile();
        if (jarDir == null) {
            return null;
        }
        final File besideJar = new File(new File(jarDir, CONFIG_DIR), CONFIG_FILE_NAME);
        if (besideJar.isFile()) {
            return besideJar;
        }
        final File appHome = jarDir.getParentFile();
        if (appHome == null) {
            return null;
        }
        final File aboveLib = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return aboveLib.isFile() ? aboveLib : null;
    }
}
