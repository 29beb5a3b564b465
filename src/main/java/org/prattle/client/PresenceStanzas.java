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

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import org.apache.commons.lang.math.NumberUtils;
import org.jivesoftware.smack.packet.ExtensionElement;
import org.jivesoftware.smack.packet.Presence;
import org.jivesoftware.smack.packet.StandardExtensionElement;
import org.jivesoftware.smack.packet.StanzaError;
import org.jivesoftware.smackx.caps.packet.CapsExtension;
import org.jivesoftware.smackx.muc.packet.MUCItem;
import org.jivesoftware.smackx.muc.packet.MUCUser;
import org.prattle.misc.JID;
import org.prattle.misc.PresenceStanza;

/**
 * Conversion of Smack presence packets.
 */
public final class PresenceStanzas {
    private static final Logger LOGGER = Logger.getLogger(PresenceStanzas.class.getName());

    /** Last activity in presence (XEP-0256). */
    static final String LAST_ELEMENT = "query";
    static final String LAST_NAMESPACE = "jabber:iq:last";

    private static final int STATUS_SELF_PRESENCE = 110;
    private static final int STATUS_NEW_NICKNAME = 303;

    private PresenceStanzas() {}

    /**
     * Convert a Smack presence.
     * @return empty if the presence has no usable sender
     */
    public static Optional<PresenceStanza> from(Presence presence) {
        if (presence.getFrom() == null) {
            LOGGER.warning("presence without sender: "+presence);
            return Optional.empty();
        }

        JID from = JID.fromSmack(presence.getFrom());
        PresenceStanza.Builder builder = PresenceStanza.builder(toType(presence.getType()), from)
                .status(presence.getStatus());

        Presence.Mode mode = presence.getMode();
        if (mode != null && mode != Presence.Mode.available)
            builder.show(mode.name());

        int priority = presence.getPriority();
        if (priority != Integer.MIN_VALUE)
            builder.priority(Integer.toString(priority));

        StanzaError error = presence.getError();
        if (error != null)
            builder.error(Objects.toString(error.getCondition(), null));

        ExtensionElement lastExt = presence.getExtension(LAST_ELEMENT, LAST_NAMESPACE);
        if (lastExt instanceof StandardExtensionElement) {
            String seconds = ((StandardExtensionElement) lastExt).getAttributeValue("seconds");
            builder.idleSeconds(NumberUtils.toInt(seconds, 0));
        }

        ExtensionElement capsExt = presence.getExtension(CapsExtension.ELEMENT, CapsExtension.NAMESPACE);
        if (capsExt instanceof CapsExtension) {
            CapsExtension caps = (CapsExtension) capsExt;
            builder.caps(caps.getNode(), caps.getVer(), caps.getHash());
        } else if (capsExt instanceof StandardExtensionElement) {
            // legacy caps without hash, see CapsProvider
            StandardExtensionElement caps = (StandardExtensionElement) capsExt;
            builder.caps(caps.getAttributeValue(CapsProvider.ATTR_NODE),
                    caps.getAttributeValue(CapsProvider.ATTR_VER),
                    caps.getAttributeValue(CapsProvider.ATTR_HASH));
        }

        MUCUser mucUser = MUCUser.from(presence);
        if (mucUser != null) {
            builder.muc();
            if (hasStatus(mucUser, STATUS_SELF_PRESENCE))
                builder.selfPresence();
            if (hasStatus(mucUser, STATUS_NEW_NICKNAME)) {
                MUCItem item = mucUser.getItem();
                builder.nickChange(item != null ? Objects.toString(item.getNick(), null) : null);
            }
        }

        return Optional.of(builder.build());
    }

    private static boolean hasStatus(MUCUser mucUser, int code) {
        return mucUser.getStatus().stream()
                .anyMatch(s -> s.getCode() == code);
    }

    static PresenceStanza.Type toType(Presence.Type type) {
        if (type == null)
            return PresenceStanza.Type.AVAILABLE;

        switch (type) {
            case unavailable: return PresenceStanza.Type.UNAVAILABLE;
            case subscribe: return PresenceStanza.Type.SUBSCRIBE;
            case subscribed: return PresenceStanza.Type.SUBSCRIBED;
            case unsubscribe: return PresenceStanza.Type.UNSUBSCRIBE;
            case unsubscribed: return PresenceStanza.Type.UNSUBSCRIBED;
            case probe: return PresenceStanza.Type.PROBE;
            case error: return PresenceStanza.Type.ERROR;
            default: return PresenceStanza.Type.AVAILABLE;
        }
    }
}
