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

import java.util.logging.Level;
import java.util.logging.Logger;

import org.jivesoftware.smack.SmackException;
import org.jivesoftware.smack.XMPPConnection;
import org.jivesoftware.smack.packet.IQ;
import org.jivesoftware.smack.packet.Presence;
import org.jivesoftware.smack.packet.Stanza;
import org.jivesoftware.smackx.disco.packet.DiscoverInfo;
import org.prattle.misc.JID;

/**
 * Sends the presence engine's outgoing stanzas over a Smack connection.
 */
final class SmackTransport implements Transport {
    private static final Logger LOGGER = Logger.getLogger(SmackTransport.class.getName());

    private final XMPPConnection mConn;

    SmackTransport(XMPPConnection conn) {
        mConn = conn;
    }

    @Override
    public boolean sendDiscoveryQuery(DiscoveryQuery query) {
        DiscoverInfo info = new DiscoverInfo();
        info.setType(IQ.Type.get);
        info.setTo(query.to.toSmack());
        info.setStanzaId(query.id);
        if (query.node.isPresent())
            info.setNode(query.node.get());

        // response is handled by the caps manager
        return this.sendPacket(info);
    }

    @Override
    public boolean sendPresenceSubscription(JID jid, PresenceCommand command) {
        LOGGER.info("to: "+jid+ ", command: "+command);
        Presence.Type type = null;
        switch(command) {
            case REQUEST: type = Presence.Type.subscribe; break;
            case GRANT: type = Presence.Type.subscribed; break;
            case DENY: type = Presence.Type.unsubscribed; break;
        }
        Presence presence = new Presence(type);
        presence.setTo(jid.toSmack());
        return this.sendPacket(presence);
    }

    private boolean sendPacket(Stanza p) {
        if (!mConn.isConnected()) {
            LOGGER.warning("not connected");
            return false;
        }

        try {
            mConn.sendStanza(p);
        } catch (SmackException.NotConnectedException | InterruptedException ex) {
            LOGGER.log(Level.WARNING, "can't send packet", ex);
            return false;
        }
        return true;
    }
}
