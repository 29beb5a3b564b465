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
package org.prattle.client;

import java.util.Optional;
import java.util.logging.Logger;

import org.jivesoftware.smack.XMPPConnection;
import org.jivesoftware.smack.filter.StanzaTypeFilter;
import org.jxmpp.jid.EntityFullJid;
import org.prattle.misc.JID;
import org.prattle.model.CapsCache;
import org.prattle.persistence.Config;
import org.prattle.system.PresenceEngine;
import org.prattle.system.PresenceObserver;

/**
 * Connect a presence engine to a logged in Smack connection.
 */
public final class PresenceClient {
    private static final Logger LOGGER = Logger.getLogger(PresenceClient.class.getName());

    private PresenceClient() {}

    /**
     * Create an engine for the session of 'conn' and register it for all
     * inbound presence stanzas.
     *
     * @return empty if the connection is not authenticated
     */
    public static Optional<PresenceEngine> attach(XMPPConnection conn,
            PresenceObserver observer,
            CapsCache capsCache,
            Config config) {
        EntityFullJid user = conn.getUser();
        if (user == null) {
            LOGGER.warning("not logged in");
            return Optional.empty();
        }

        PresenceEngine engine = new PresenceEngine(JID.fromSmack(user),
                observer,
                new SmackTransport(conn),
                capsCache,
                config);

        // synchronous: one stanza after another, in order of arrival
        conn.addSyncStanzaListener(new PresenceListener(engine), StanzaTypeFilter.PRESENCE);

        LOGGER.info("presence engine attached for "+engine.getOwnJID());
        return Optional.of(engine);
    }
}
