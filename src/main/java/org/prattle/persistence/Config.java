/*
 *  Prattle XMPP client
 *  Copyright (C) 2016 Prattle Devteam
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.prattle.persistence;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;

/**
 * Configuration options of the presence engine.
 *
 * One instance per session, handed to the components that need it.
 */
public final class Config extends PropertiesConfiguration {
    private static final Logger LOGGER = Logger.getLogger(Config.class.getName());

    public static final String FILENAME = "prattle.properties";

    // all configuration property keys
    /** The only XEP-0115 hash algorithm we can verify. */
    public static final String CAPS_HASH = "caps.hash";
    /** Stanza ID of discovery queries for hashed capabilities. */
    public static final String CAPS_DISCO_ID = "caps.disco_id";
    /** Stanza ID prefix of discovery queries for legacy capabilities. */
    public static final String CAPS_LEGACY_DISCO_PREFIX = "caps.legacy_disco_prefix";

    public static final String DEFAULT_CAPS_HASH = "sha-1";
    public static final String DEFAULT_CAPS_DISCO_ID = "disco";
    public static final String DEFAULT_CAPS_LEGACY_DISCO_PREFIX = "disco_";

    private Config(Path configFile) {
        super();

        // values are never lists
        this.setDelimiterParsingDisabled(true);

        if (configFile != null) {
            if (configFile.toFile().isFile()) {
                try {
                    this.load(configFile.toFile());
                } catch (ConfigurationException ex) {
                    LOGGER.log(Level.WARNING, "can't load configuration; using default values", ex);
                }
            } else {
                LOGGER.info("configuration file not found; using default values");
            }
        }

        // init config / set default values for new properties
        Map<String, Object> map = new HashMap<>();
        map.put(CAPS_HASH, DEFAULT_CAPS_HASH);
        map.put(CAPS_DISCO_ID, DEFAULT_CAPS_DISCO_ID);
        map.put(CAPS_LEGACY_DISCO_PREFIX, DEFAULT_CAPS_LEGACY_DISCO_PREFIX);

        map.entrySet().stream()
                .filter(e -> !this.containsKey(e.getKey()))
                .forEach(e -> this.setProperty(e.getKey(), e.getValue()));
    }

    /** Configuration with default values only, not backed by a file. */
    public static Config defaults() {
        return new Config(null);
    }

    /**
     * Load the configuration file in 'appDir'. Missing properties (or a
     * missing file) get default values.
     */
    public static Config load(Path appDir) {
        return new Config(appDir.resolve(FILENAME));
    }
}
