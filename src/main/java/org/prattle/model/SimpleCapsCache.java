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

import java.util.HashSet;
import java.util.Set;

/**
 * In-memory capabilities cache, valid for one session.
 */
public final class SimpleCapsCache implements CapsCache {

    private final Set<CapsKey> mKeys = new HashSet<>();

    @Override
    public boolean contains(CapsKey key) {
        return mKeys.contains(key);
    }

    @Override
    public void add(CapsKey key) {
        mKeys.add(key);
    }

    public int size() {
        return mKeys.size();
    }
}
