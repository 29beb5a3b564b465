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

import java.util.Optional;

/**
 * Last known presence of a room occupant, identified by its nickname.
 */
public final class Occupant {

    private final String mNick;
    private final ResourcePresence mPresence;
    private final String mStatus;
    private final CapsKey mCapsKey;

    public Occupant(String nick,
            ResourcePresence presence,
            Optional<String> status,
            Optional<CapsKey> capsKey) {
        mNick = nick;
        mPresence = presence;
        mStatus = status.orElse(null);
        mCapsKey = capsKey.orElse(null);
    }

    public String getNick() {
        return mNick;
    }

    public ResourcePresence getPresence() {
        return mPresence;
    }

    public Optional<String> getStatus() {
        return Optional.ofNullable(mStatus);
    }

    public Optional<CapsKey> getCapsKey() {
        return Optional.ofNullable(mCapsKey);
    }

    @Override
    public String toString() {
        return "Occupant:nick="+mNick+",presence="+mPresence+",status="+mStatus;
    }
}
