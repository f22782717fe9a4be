package com.onechance.courier.main;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;

/**
 * Foundation for runnable components.
 *
 * <p>Loads {@code server.json5} from the given configuration directory into {@link Config}.
 * <p>When the server config names a {@code log4j2} file it replaces the bundled logging setup.
 */
public abstract class Foundation {
    protected static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Server configuration filename.
     */
    public static final String SERVER_CONFIG = "server.json5";

    /**
     * Initializes configuration.
     *
     * @param path Directory path.
     * @throws ConfigurationException Unable to read or parse configuration.
     */
    public static void init(String path) throws ConfigurationException {
        if (StringUtils.isBlank(path) || !new File(path).isDirectory()) {
            throw new ConfigurationException("Configuration directory not found: " + path);
        }

        String serverPath = Paths.get(path, SERVER_CONFIG).toString();
        if (!new File(serverPath).exists()) {
            throw new ConfigurationException("Server configuration not found: " + serverPath);
        }

        try {
            Config.initServer(serverPath);
        } catch (IOException | RuntimeException e) {
            ConfigurationException ex = new ConfigurationException("Unable to load " + serverPath + ": " + e.getMessage());
            ex.setRootCause(e);
            throw ex;
        }

        String log4j2 = Config.getServer().getStringProperty("log4j2");
        if (StringUtils.isNotBlank(log4j2)) {
            File file = new File(log4j2).isAbsolute() ? new File(log4j2) : new File(path, log4j2);
            if (file.exists()) {
                Configurator.reconfigure(file.toURI());
                log.info("Logging configured from {}", file.getAbsolutePath());
            } else {
                log.warn("Logging configuration not found: {}", file.getAbsolutePath());
            }
        }
    }
}
