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

import org.prattle.client.DiscoveryQuery;
import org.prattle.client.Transport;
import org.prattle.misc.JID;
import org.prattle.misc.PresenceStanza;
import org.prattle.model.CapsCache;
import org.prattle.model.CapsKey;
import org.prattle.persistence.Config;

/**
 * Entity capabilities (XEP-0115) of presence senders.
 *
 * Computes the cache key for a capabilities announcement and requests service
 * discovery if the key is not cached yet. Keys are never added to the cache
 * here, that happens when the discovery response arrives.
 */
final class CapsResolver {
    private static final Logger LOGGER = Logger.getLogger(CapsResolver.class.getName());

    private final CapsCache mCache;
    private final Transport mTransport;
    private final String mSupportedHash;
    private final String mDiscoID;
    private final String mLegacyDiscoPrefix;

    CapsResolver(CapsCache cache, Transport transport, Config config) {
        mCache = cache;
        mTransport = transport;
        mSupportedHash = config.getString(Config.CAPS_HASH);
        mDiscoID = config.getString(Config.CAPS_DISCO_ID);
        mLegacyDiscoPrefix = config.getString(Config.CAPS_LEGACY_DISCO_PREFIX);
    }

    Optional<CapsKey> resolve(PresenceStanza presence) {
        PresenceStanza.Caps caps = presence.getCaps().orElse(null);
        if (caps == null)
            return Optional.empty();

        JID from = presence.getFrom();
        LOGGER.config("caps from "+from+": "+caps);

        if (caps.hash.isPresent() && caps.hash.get().equalsIgnoreCase(mSupportedHash))
            return this.resolveHashed(from, caps);

        if (caps.hash.isPresent())
            LOGGER.config("unsupported hash type: "+caps.hash.get());

        return Optional.of(this.resolveLegacy(from, caps));
    }

    private Optional<CapsKey> resolveHashed(JID from, PresenceStanza.Caps caps) {
        if (!caps.ver.isPresent()) {
            LOGGER.config("no verification string, not sending discovery query");
            return Optional.empty();
        }

        String ver = caps.ver.get();
        CapsKey key = CapsKey.hashed(ver);
        if (mCache.contains(key)) {
            LOGGER.config("capabilities already cached: "+key);
            return Optional.of(key);
        }

        if (!caps.node.isPresent()) {
            LOGGER.config("no node, not sending discovery query");
            return Optional.of(key);
        }

        String node = caps.node.get() + "#" + ver;
        this.send(new DiscoveryQuery(mDiscoID, from, Optional.of(node)));
        return Optional.of(key);
    }

    private CapsKey resolveLegacy(JID from, PresenceStanza.Caps caps) {
        CapsKey key = CapsKey.legacy(from);
        if (!caps.node.isPresent()) {
            LOGGER.config("no node, not sending discovery query");
            return key;
        }

        if (mCache.contains(key)) {
            LOGGER.config("capabilities already cached: "+key);
            return key;
        }

        String node = caps.ver.isPresent() ?
                caps.node.get() + "#" + caps.ver.get() :
                caps.node.get();
        this.send(new DiscoveryQuery(mLegacyDiscoPrefix + from.string(), from, Optional.of(node)));
        return key;
    }

    private void send(DiscoveryQuery query) {
        LOGGER.config("capabilities not cached, sending: "+query);
        if (!mTransport.sendDiscoveryQuery(query))
            LOGGER.warning("can't send discovery query to "+query.to);
    }
}
