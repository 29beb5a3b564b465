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
package org.prattle.system;

import java.util.Date;
import java.util.Optional;
import java.util.logging.Logger;

import org.apache.commons.lang.math.NumberUtils;
import org.prattle.misc.JID;
import org.prattle.misc.PresenceEvent;
import org.prattle.misc.PresenceStanza;
import org.prattle.model.CapsKey;
import org.prattle.model.Resource;
import org.prattle.model.ResourcePresence;

/**
 * Process presence of contacts (one-to-one, not from rooms).
 */
final class ContactPresenceHandler {
    private static final Logger LOGGER = Logger.getLogger(ContactPresenceHandler.class.getName());

    private final JID mOwnJID;
    private final CapsResolver mCapsResolver;
    private final PresenceObserver mObserver;

    ContactPresenceHandler(JID ownJID, CapsResolver capsResolver, PresenceObserver observer) {
        mOwnJID = ownJID;
        mCapsResolver = capsResolver;
        mObserver = observer;
    }

    void onAvailable(PresenceStanza presence) {
        // also called for everything no other handler wants
        if (presence.getType() != PresenceStanza.Type.AVAILABLE || presence.isMUC())
            return;

        JID from = presence.getFrom();
        LOGGER.config("available: "+from);

        Optional<CapsKey> capsKey = mCapsResolver.resolve(presence);

        // TODO track own resources once there is a consumer for them
        if (mOwnJID.equals(from))
            // don't wanna see myself
            return;

        int idle = presence.getIdleSeconds();
        Optional<Date> lastActivity = idle > 0 ?
                Optional.of(new Date(System.currentTimeMillis() - idle * 1000L)) :
                Optional.empty();

        Resource resource = new Resource(from.resource(),
                ResourcePresence.fromString(presence.getShow().orElse(null)),
                presence.getStatus(),
                parsePriority(presence.getPriority()),
                capsKey,
                lastActivity);

        mObserver.changed(new PresenceEvent.ContactOnline(from.toBare(), resource, lastActivity));
    }

    void onUnavailable(PresenceStanza presence) {
        JID from = presence.getFrom();
        LOGGER.config("unavailable: "+from);

        if (mOwnJID.equals(from))
            return;

        mObserver.changed(new PresenceEvent.ContactOffline(from.toBare(),
                from.resource(),
                presence.getStatus()));
    }

    private static int parsePriority(Optional<String> priority) {
        if (!priority.isPresent())
            return 0;

        String text = priority.get().trim();
        int value = NumberUtils.toInt(text, 0);
        if (value == 0 && !"0".equals(text))
            LOGGER.info("invalid priority: '"+text+"'");
        return value;
    }
}
