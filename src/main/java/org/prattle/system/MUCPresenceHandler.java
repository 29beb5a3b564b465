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
import java.util.logging.Logger;

import org.prattle.misc.JID;
import org.prattle.misc.PresenceEvent;
import org.prattle.misc.PresenceStanza;
import org.prattle.model.CapsKey;
import org.prattle.model.Occupant;
import org.prattle.model.ResourcePresence;
import org.prattle.model.Room;
import org.prattle.model.RoomList;

/**
 * Process presence stanzas from multi-user chat rooms (XEP-0045).
 *
 * A nickname change arrives as two stanzas: 'unavailable' with status 303 for
 * the old nickname, then 'available' for the new one. Both are folded into a
 * single rename event and never reported as leave/join.
 */
final class MUCPresenceHandler {
    private static final Logger LOGGER = Logger.getLogger(MUCPresenceHandler.class.getName());

    private final RoomList mRooms;
    private final CapsResolver mCapsResolver;
    private final PresenceObserver mObserver;

    MUCPresenceHandler(RoomList rooms, CapsResolver capsResolver, PresenceObserver observer) {
        mRooms = rooms;
        mCapsResolver = capsResolver;
        mObserver = observer;
    }

    void onPresence(PresenceStanza presence) {
        if (presence.getType() == PresenceStanza.Type.ERROR)
            return;

        JID from = presence.getFrom();
        Room room = mRooms.get(from).orElse(null);
        if (room == null) {
            LOGGER.warning("presence from unknown room: "+from);
            return;
        }

        String nick = from.resource();
        if (nick.isEmpty()) {
            // from the room itself, not an occupant
            LOGGER.config("ignoring room presence without nick: "+from);
            return;
        }

        if (isSelf(room, presence)) {
            this.onSelfPresence(room, presence);
        } else {
            this.onMemberPresence(room, nick, presence);
        }
    }

    private static boolean isSelf(Room room, PresenceStanza presence) {
        return presence.isSelfPresence() ||
                presence.getFrom().sameFull(room.getOwnOccupantJID());
    }

    private void onSelfPresence(Room room, PresenceStanza presence) {
        JID roomJID = room.getJID();
        LOGGER.config("self presence in room "+roomJID+": "+presence.getType());

        if (presence.getType() == PresenceStanza.Type.UNAVAILABLE) {
            if (presence.isNickChange()) {
                room.setSelfNickChangePending();
            } else {
                // no need to wait for anything in this room anymore
                room.clearPendingNickChanges();
                mObserver.changed(new PresenceEvent.RoomLeft(roomJID));
            }
            return;
        }

        if (presence.getType() != PresenceStanza.Type.AVAILABLE) {
            LOGGER.info("ignoring self presence of type "+presence.getType()+" in room "+roomJID);
            return;
        }

        if (room.isSelfNickChangePending()) {
            String newNick = presence.getFrom().resource();
            room.completeSelfNickChange(newNick);
            mObserver.changed(new PresenceEvent.RoomNickChanged(roomJID, newNick));
            return;
        }

        if (room.setRosterReceived()) {
            LOGGER.info("roster complete, room: "+roomJID+", occupants: "
                    +room.getOccupants().size());
            mObserver.changed(new PresenceEvent.RoomRosterComplete(roomJID));
        }
    }

    private void onMemberPresence(Room room, String nick, PresenceStanza presence) {
        JID roomJID = room.getJID();
        LOGGER.config("member presence in room "+roomJID+", nick: "+nick
                +", type: "+presence.getType());

        Optional<CapsKey> capsKey = mCapsResolver.resolve(presence);
        Optional<String> status = presence.getStatus();

        if (presence.getType() == PresenceStanza.Type.UNAVAILABLE) {
            if (presence.isNickChange()) {
                String newNick = presence.getNewNick().orElse("");
                if (newNick.isEmpty()) {
                    LOGGER.warning("nick change without new nick, room: "+roomJID+", nick: "+nick);
                    return;
                }
                room.setPendingNickChange(nick, newNick);
                return;
            }

            // a rename to this nick won't be completed
            if (room.dropPendingNickChange(nick))
                LOGGER.info("dropped pending nick change to "+nick+" in room "+roomJID);

            mObserver.changed(new PresenceEvent.MemberOffline(roomJID, nick,
                    PresenceEvent.MemberOffline.REASON_OFFLINE, status));
            return;
        }

        if (presence.getType() != PresenceStanza.Type.AVAILABLE) {
            LOGGER.info("ignoring room presence of type "+presence.getType()+" from "
                    +presence.getFrom());
            return;
        }

        // the old nick of an unfinished rename is reused by a new occupant
        Optional<String> abandoned = room.abandonNickChangeFrom(nick);
        if (abandoned.isPresent()) {
            LOGGER.info("abandoned nick change "+nick+" -> "+abandoned.get()
                    +" in room "+roomJID);
            room.removeOccupant(nick);
        }

        ResourcePresence show = ResourcePresence.fromString(presence.getShow().orElse(null));
        Occupant occupant = new Occupant(nick, show, status, capsKey);

        if (!room.isRosterReceived()) {
            // initial roster, completion is signaled by self presence
            room.putOccupant(occupant);
            return;
        }

        Optional<String> oldNick = room.completeNickChange(occupant);
        if (oldNick.isPresent()) {
            mObserver.changed(new PresenceEvent.MemberNickChanged(roomJID, oldNick.get(), nick));
            return;
        }

        boolean known = room.containsOccupant(nick);
        room.putOccupant(occupant);
        if (known) {
            mObserver.changed(new PresenceEvent.MemberPresenceUpdated(roomJID, nick, show,
                    status, capsKey));
        } else {
            mObserver.changed(new PresenceEvent.MemberOnline(roomJID, nick, show,
                    status, capsKey));
        }
    }
}
