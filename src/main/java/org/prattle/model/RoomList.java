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
package org.prattle.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import org.prattle.misc.JID;

/**
 * All multi-user chat rooms the user is in, keyed by bare room JID.
 */
public final class RoomList {
    private static final Logger LOGGER = Logger.getLogger(RoomList.class.getName());

    private final Map<JID, Room> mRooms = new HashMap<>();

    /**
     * Create the state for a joined room. A previous record for the same room
     * is replaced, joining starts with an empty roster.
     */
    public Room join(JID room, String nick) {
        Room newRoom = new Room(room, nick);
        if (mRooms.put(newRoom.getJID(), newRoom) != null)
            LOGGER.info("rejoining room: "+room);
        return newRoom;
    }

    public Optional<Room> get(JID room) {
        return Optional.ofNullable(mRooms.get(room));
    }

    public boolean contains(JID room) {
        return mRooms.containsKey(room);
    }

    /** Remove the room, dropping all its unfinished nickname changes. */
    public Optional<Room> leave(JID room) {
        Room removed = mRooms.remove(room);
        if (removed == null) {
            LOGGER.info("not in room: "+room);
            return Optional.empty();
        }
        removed.clearPendingNickChanges();
        return Optional.of(removed);
    }

    public List<Room> getAll() {
        return new ArrayList<>(mRooms.values());
    }

    public void clear() {
        mRooms.values().forEach(Room::clearPendingNickChanges);
        mRooms.clear();
    }
}
