package org.metalineage.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import org.metalineage.pipeline.api.errors.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration for all CLI commands.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dmetalineage.limiter.max-candidates=100})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are merged, so a user override of a value
 * that {@code reference.conf} refers to reaches every reference.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "metalineage.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the user configuration file, trying in order: the {@code --config} option,
     * {@code -Dconfig.file}, {@code config/metalineage.conf} in the working directory,
     * {@code config/metalineage.conf} in the installation directory. Without any of these
     * only the classpath defaults are used.
     *
     * @param explicitConfigFile file from {@code --config}, or {@code null}
     * @param handler            receives resolution messages
     * @return the resolved configuration
     * @throws ConfigurationException if an explicitly named file is missing or any file is invalid
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new ConfigurationException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigurationException(
                        "Configuration file from -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationConfigFile);
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found; using built-in defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        try {
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(ConfigFactory.parseFile(configFile))
                    .withFallback(ConfigFactory.defaultReferenceUnresolved())
                    .resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid configuration in " + configFile + ": " + e.getMessage(), e);
        }
    }

    static Config loadDefaults() {
        try {
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(ConfigFactory.defaultReferenceUnresolved())
                    .resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid default configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Looks for {@code APP_HOME/config/metalineage.conf}, where {@code APP_HOME} is the
     * parent of the directory holding the application jar.
     *
     * @return the file, or {@code null} if it cannot be located
     */
    private static File detectInstallationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        URL location = codeSource.getLocation();
        File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            return null;
        }
        File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
