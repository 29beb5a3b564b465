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

import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import org.prattle.client.Transport;
import org.prattle.client.Transport.PresenceCommand;
import org.prattle.misc.JID;
import org.prattle.misc.PresenceStanza;
import org.prattle.model.CapsCache;
import org.prattle.model.Room;
import org.prattle.model.RoomList;
import org.prattle.model.SubscriptionRequests;
import org.prattle.persistence.Config;

/**
 * Presence state of one session: entry point for inbound presence stanzas
 * and the user's decisions about subscriptions and rooms.
 *
 * All methods must be called from the thread that receives the stanzas.
 */
public final class PresenceEngine {
    private static final Logger LOGGER = Logger.getLogger(PresenceEngine.class.getName());

    private final JID mOwnJID;
    private final Transport mTransport;
    private final RoomList mRooms = new RoomList();
    private final SubscriptionHandler mSubscriptionHandler;
    private final PresenceDispatcher mDispatcher;

    /**
     * @param ownJID full JID of the logged in user
     * @param observer receiver of all events
     * @param transport used for outgoing discovery queries and subscriptions
     * @param capsCache already known capabilities
     * @param config engine options
     */
    public PresenceEngine(JID ownJID,
            PresenceObserver observer,
            Transport transport,
            CapsCache capsCache,
            Config config) {
        mOwnJID = ownJID;
        mTransport = transport;

        CapsResolver capsResolver = new CapsResolver(capsCache, transport, config);
        mSubscriptionHandler = new SubscriptionHandler(new SubscriptionRequests(), observer);
        mDispatcher = new PresenceDispatcher(
                new ContactPresenceHandler(ownJID, capsResolver, observer),
                new MUCPresenceHandler(mRooms, capsResolver, observer),
                mSubscriptionHandler);
    }

    public JID getOwnJID() {
        return mOwnJID;
    }

    /** Process one inbound presence stanza. */
    public void onPresence(PresenceStanza presence) {
        mDispatcher.dispatch(presence);
    }

    /** Bare JIDs of all contacts waiting for our subscription decision. */
    public Set<JID> getSubscriptionRequests() {
        return mSubscriptionHandler.getPending();
    }

    /**
     * Send a subscription request or answer one. A pending request from this
     * contact is resolved in any case.
     */
    public boolean sendPresenceSubscription(JID jid, PresenceCommand command) {
        LOGGER.info("to: "+jid+", command: "+command);
        mSubscriptionHandler.resolve(jid);
        return mTransport.sendPresenceSubscription(jid.toBare(), command);
    }

    /**
     * Start tracking a room we are joining. Occupant presence is collected
     * silently until our own presence completes the roster.
     */
    public Room joinRoom(JID room, String nick) {
        LOGGER.info("room: "+room+", nick: "+nick);
        return mRooms.join(room, nick);
    }

    /** Stop tracking a room, e.g. after "room left" was received. */
    public Optional<Room> leaveRoom(JID room) {
        LOGGER.info("room: "+room);
        return mRooms.leave(room);
    }

    public RoomList getRooms() {
        return mRooms;
    }

    /** Forget all session state (on disconnect). */
    public void reset() {
        LOGGER.config("resetting presence state");
        mSubscriptionHandler.clear();
        mRooms.clear();
    }
}
