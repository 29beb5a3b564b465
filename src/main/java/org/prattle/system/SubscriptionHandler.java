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

import java.util.Set;
import java.util.logging.Logger;

import org.prattle.misc.JID;
import org.prattle.misc.PresenceEvent;
import org.prattle.model.SubscriptionRequests;

/**
 * Track inbound presence subscription requests.
 */
final class SubscriptionHandler {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionHandler.class.getName());

    private final SubscriptionRequests mRequests;
    private final PresenceObserver mObserver;

    SubscriptionHandler(SubscriptionRequests requests, PresenceObserver observer) {
        mRequests = requests;
        mObserver = observer;
    }

    void onSubscribe(JID jid) {
        jid = jid.toBare();
        LOGGER.info("subscription request from: "+jid);

        if (!mRequests.add(jid))
            LOGGER.config("request already pending: "+jid);

        mObserver.changed(new PresenceEvent.SubscriptionRequest(jid));
    }

    /** Contact decided about our request, or answered its own one elsewhere. */
    void onResolved(JID jid, PresenceEvent.SubscriptionResolved.Kind kind) {
        jid = jid.toBare();
        LOGGER.info("subscription "+kind+" from: "+jid);

        mObserver.changed(new PresenceEvent.SubscriptionResolved(jid, kind));
        mRequests.remove(jid);
    }

    /** User made a decision, or the request is obsolete. */
    boolean resolve(JID jid) {
        return mRequests.remove(jid);
    }

    Set<JID> getPending() {
        return mRequests.getAll();
    }

    void clear() {
        mRequests.clear();
    }
}
