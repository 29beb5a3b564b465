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

import java.util.Objects;
import java.util.Optional;

import org.prattle.misc.JID;

/**
 * Service discovery info request (XEP-0030) for the capabilities of an
 * entity. The response is correlated by the stanza ID.
 */
public final class DiscoveryQuery {
    public final String id;
    public final JID to;
    public final Optional<String> node;

    public DiscoveryQuery(String id, JID to, Optional<String> node) {
        this.id = id;
        this.to = to;
        this.node = node;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this)
            return true;

        if (!(o instanceof DiscoveryQuery))
            return false;

        DiscoveryQuery oQuery = (DiscoveryQuery) o;
        return id.equals(oQuery.id) && to.sameFull(oQuery.to) && node.equals(oQuery.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, to.string(), node);
    }

    @Override
    public String toString() {
        return "DiscoveryQuery:id="+id+",to="+to+",node="+node.orElse("");
    }
}
