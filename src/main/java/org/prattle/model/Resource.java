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

import java.util.Date;
import java.util.Optional;

/**
 * Presence of one resource of a contact. Immutable, a new instance is created
 * for every available presence stanza.
 */
public final class Resource {

    private final String mName;
    private final ResourcePresence mPresence;
    private final String mStatus;
    private final int mPriority;
    private final CapsKey mCapsKey;
    private final Date mLastActivity;

    public Resource(String name,
            ResourcePresence presence,
            Optional<String> status,
            int priority,
            Optional<CapsKey> capsKey,
            Optional<Date> lastActivity) {
        mName = name;
        mPresence = presence;
        mStatus = status.orElse(null);
        mPriority = priority;
        mCapsKey = capsKey.orElse(null);
        mLastActivity = lastActivity.map(d -> new Date(d.getTime())).orElse(null);
    }

    public String getName() {
        return mName;
    }

    public ResourcePresence getPresence() {
        return mPresence;
    }

    public Optional<String> getStatus() {
        return Optional.ofNullable(mStatus);
    }

    public int getPriority() {
        return mPriority;
    }

    public Optional<CapsKey> getCapsKey() {
        return Optional.ofNullable(mCapsKey);
    }

    public Optional<Date> getLastActivity() {
        return mLastActivity == null ?
                Optional.empty() :
                Optional.of(new Date(mLastActivity.getTime()));
    }

    @Override
    public String toString() {
        return "Resource:name="+mName+",presence="+mPresence+",status="+mStatus
                +",priority="+mPriority+",caps="+mCapsKey;
    }
}
