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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;

public class ConfigTest {
    @Rule
    public TemporaryFolder mTempFolder = new TemporaryFolder();

    private Path mAppDir;

    @Before
    public void setUp() {
        mAppDir = mTempFolder.getRoot().toPath();
    }

    /**
     * Test of defaults method, of class Config.
     */
    @Test
    public void testDefaults() {
        System.out.println("defaults");
        Config config = Config.defaults();
        assertEquals("sha-1", config.getString(Config.CAPS_HASH));
        assertEquals("disco", config.getString(Config.CAPS_DISCO_ID));
        assertEquals("disco_", config.getString(Config.CAPS_LEGACY_DISCO_PREFIX));
    }

    @Test
    public void testLoadMissingFile() {
        Config config = Config.load(mAppDir);
        assertEquals(Config.DEFAULT_CAPS_HASH, config.getString(Config.CAPS_HASH));
    }

    /**
     * Test of load method, of class Config.
     */
    @Test
    public void testLoad() throws IOException {
        System.out.println("load");
        Files.write(mAppDir.resolve(Config.FILENAME),
                Arrays.asList("caps.hash = sha-256", "caps.disco_id = caps,query"),
                StandardCharsets.UTF_8);

        Config config = Config.load(mAppDir);

        assertEquals("sha-256", config.getString(Config.CAPS_HASH));
        assertEquals("caps,query", config.getString(Config.CAPS_DISCO_ID));
        assertEquals("disco_", config.getString(Config.CAPS_LEGACY_DISCO_PREFIX));
    }
}
