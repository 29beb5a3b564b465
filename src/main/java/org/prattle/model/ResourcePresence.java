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

import java.util.Locale;

/**
 * Availability of a single resource or room occupant, as announced by the
 * &lt;show/&gt; element of a presence stanza.
 */
public enum ResourcePresence {
    ONLINE,
    CHAT,
    AWAY,
    XA,
    DND,
    OFFLINE;

    /** Lower-case protocol text ("online" for the plain available state). */
    public String string() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a show text. Missing or unknown values mean "online", a peer can't
     * make us think it is offline with an available stanza.
     */
    public static ResourcePresence fromString(String show) {
        if (show == null)
            return ONLINE;

        switch (show.trim().toLowerCase(Locale.ROOT)) {
            case "chat": return CHAT;
            case "away": return AWAY;
            case "xa": return XA;
            case "dnd": return DND;
            default: return ONLINE;
        }
    }
}
