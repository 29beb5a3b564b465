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

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import org.prattle.misc.JID;

/**
 * State of one joined multi-user chat room (XEP-0045): own nickname, occupant
 * roster and nickname changes in progress.
 *
 * Not thread-safe, all presence stanzas of a room must be processed in arrival
 * order by one thread.
 */
public final class Room {
    private static final Logger LOGGER = Logger.getLogger(Room.class.getName());

    private final JID mJID;
    private String mNick;
    private boolean mRosterReceived = false;
    private boolean mSelfNickChangePending = false;

    private final Map<String, Occupant> mOccupants = new HashMap<>();
    // new nick -> old nick
    private final Map<String, String> mPendingNickChanges = new HashMap<>();

    Room(JID jid, String nick) {
        mJID = jid.toBare();
        mNick = nick;
    }

    public JID getJID() {
        return mJID;
    }

    public String getNick() {
        return mNick;
    }

    /** Occupant JID of the user in this room. */
    public JID getOwnOccupantJID() {
        return JID.full(mJID, mNick);
    }

    public boolean isRosterReceived() {
        return mRosterReceived;
    }

    /**
     * Mark the initial presence burst as complete.
     * @return false if it was already complete before
     */
    public boolean setRosterReceived() {
        if (mRosterReceived)
            return false;

        mRosterReceived = true;
        return true;
    }

    public boolean isSelfNickChangePending() {
        return mSelfNickChangePending;
    }

    public void setSelfNickChangePending() {
        mSelfNickChangePending = true;
    }

    /** Apply the pending change of the own nickname. */
    public void completeSelfNickChange(String newNick) {
        LOGGER.info("room: "+mJID+", own nick "+mNick+" -> "+newNick);
        mNick = newNick;
        mSelfNickChangePending = false;
    }

    public boolean containsOccupant(String nick) {
        return mOccupants.containsKey(nick);
    }

    public Optional<Occupant> getOccupant(String nick) {
        return Optional.ofNullable(mOccupants.get(nick));
    }

    public Map<String, Occupant> getOccupants() {
        return Collections.unmodifiableMap(mOccupants);
    }

    /** Insert or replace the occupant with the same nickname. */
    public void putOccupant(Occupant occupant) {
        mOccupants.put(occupant.getNick(), occupant);
    }

    /** Called by the consumer of "member offline" events. */
    public Optional<Occupant> removeOccupant(String nick) {
        return Optional.ofNullable(mOccupants.remove(nick));
    }

    /** An occupant announced leaving only to come back as 'newNick'. */
    public void setPendingNickChange(String oldNick, String newNick) {
        String previous = mPendingNickChanges.put(newNick, oldNick);
        if (previous != null && !previous.equals(oldNick))
            LOGGER.warning("overwriting pending nick change "+previous+" -> "+newNick
                    +" in room "+mJID);
    }

    public Optional<String> getPendingNickChange(String newNick) {
        return Optional.ofNullable(mPendingNickChanges.get(newNick));
    }

    /**
     * Rename an occupant whose nickname change was pending. The entry of the
     * old nickname is replaced by 'occupant'.
     *
     * @return the old nickname, empty if there was no pending change for the
     * occupant's nickname
     */
    public Optional<String> completeNickChange(Occupant occupant) {
        String oldNick = mPendingNickChanges.remove(occupant.getNick());
        if (oldNick == null)
            return Optional.empty();

        mOccupants.remove(oldNick);
        mOccupants.put(occupant.getNick(), occupant);
        return Optional.of(oldNick);
    }

    /**
     * Forget a pending change away from 'oldNick'. Used when the old nickname
     * is taken by someone else before the rename completed.
     *
     * @return the new nickname of the abandoned change, if there was one
     */
    public Optional<String> abandonNickChangeFrom(String oldNick) {
        Iterator<Map.Entry<String, String>> it = mPendingNickChanges.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> e = it.next();
            if (e.getValue().equals(oldNick)) {
                it.remove();
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Forget a pending change targeting 'newNick', the expected presence will
     * not come anymore.
     */
    public boolean dropPendingNickChange(String newNick) {
        return mPendingNickChanges.remove(newNick) != null;
    }

    public int getPendingNickChangeCount() {
        return mPendingNickChanges.size();
    }

    /** Forget all unfinished nickname changes, own and others. */
    public void clearPendingNickChanges() {
        mPendingNickChanges.clear();
        mSelfNickChangePending = false;
    }

    @Override
    public String toString() {
        return "Room:jid="+mJID+",nick="+mNick+",roster="+mRosterReceived
                +",occupants="+mOccupants.size();
    }
}
