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
package org.prattle.client;

import org.prattle.misc.JID;

/**
 * Outbound stanzas needed by the presence engine. Sending never blocks for
 * a response.
 */
public interface Transport {

    enum PresenceCommand {REQUEST, GRANT, DENY};

    /** @return false if the query could not be handed to the connection */
    boolean sendDiscoveryQuery(DiscoveryQuery query);

    /** @return false if the presence could not be handed to the connection */
    boolean sendPresenceSubscription(JID jid, PresenceCommand command);
}
