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

import java.util.logging.Logger;

import org.prattle.misc.PresenceEvent.SubscriptionResolved;
import org.prattle.misc.PresenceStanza;

/**
 * Route an inbound presence stanza to exactly one handler.
 *
 * Order matters: invalid senders and errors first, then everything from
 * rooms, then by type.
 */
final class PresenceDispatcher {
    private static final Logger LOGGER = Logger.getLogger(PresenceDispatcher.class.getName());

    private final ContactPresenceHandler mContactHandler;
    private final MUCPresenceHandler mMUCHandler;
    private final SubscriptionHandler mSubscriptionHandler;

    PresenceDispatcher(ContactPresenceHandler contactHandler,
            MUCPresenceHandler mucHandler,
            SubscriptionHandler subscriptionHandler) {
        mContactHandler = contactHandler;
        mMUCHandler = mucHandler;
        mSubscriptionHandler = subscriptionHandler;
    }

    void dispatch(PresenceStanza presence) {
        if (!presence.getFrom().isValid()) {
            LOGGER.warning("invalid sender JID: "+presence.getFrom());
            return;
        }

        PresenceStanza.Type type = presence.getType();

        if (type == PresenceStanza.Type.ERROR) {
            // connection level, nothing to do here
            LOGGER.warning("error presence from "+presence.getFrom()+": "
                    +presence.getErrorCondition().orElse("(no condition)"));
            return;
        }

        if (presence.isMUC()) {
            mMUCHandler.onPresence(presence);
            return;
        }

        switch (type) {
            case UNAVAILABLE:
                mContactHandler.onUnavailable(presence);
                return;
            case SUBSCRIBE:
                mSubscriptionHandler.onSubscribe(presence.getFrom());
                return;
            case SUBSCRIBED:
                mSubscriptionHandler.onResolved(presence.getFrom(), SubscriptionResolved.Kind.SUBSCRIBED);
                return;
            case UNSUBSCRIBED:
                mSubscriptionHandler.onResolved(presence.getFrom(), SubscriptionResolved.Kind.UNSUBSCRIBED);
                return;
            case UNSUBSCRIBE:
            case PROBE:
                // nothing to do(?)
                LOGGER.info("ignoring "+type+" from "+presence.getFrom());
                return;
            default:
                mContactHandler.onAvailable(presence);
        }
    }
}
