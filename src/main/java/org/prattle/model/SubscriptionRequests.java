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
import java.util.HashSet;
import java.util.Set;

import org.prattle.misc.JID;

/**
 * Pending inbound presence subscription requests, waiting for the user to
 * grant or deny them. Only bare JIDs are stored.
 */
public final class SubscriptionRequests {

    private final Set<JID> mRequests = new HashSet<>();

    /**
     * Add a request. A pending request from the same JID is replaced.
     * @return false if a request from this JID was already pending
     */
    public boolean add(JID jid) {
        boolean known = mRequests.remove(jid);
        mRequests.add(jid.toBare());
        return !known;
    }

    /** @return false if there was no pending request */
    public boolean remove(JID jid) {
        return mRequests.remove(jid.toBare());
    }

    public boolean contains(JID jid) {
        return mRequests.contains(jid.toBare());
    }

    /** Snapshot of all pending requests, in no particular order. */
    public Set<JID> getAll() {
        return Collections.unmodifiableSet(new HashSet<>(mRequests));
    }

    public int size() {
        return mRequests.size();
    }

    public void clear() {
        mRequests.clear();
    }
}
