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

import java.util.logging.Logger;

import org.jivesoftware.smack.StanzaListener;
import org.jivesoftware.smack.packet.Presence;
import org.jivesoftware.smack.packet.Stanza;
import org.jivesoftware.smack.provider.ProviderManager;
import org.jivesoftware.smackx.caps.packet.CapsExtension;
import org.prattle.system.PresenceEngine;

/**
 * Listen for presence packets and hand them to the presence engine.
 *
 * Must be registered as synchronous listener, room nickname changes depend
 * on the order of arrival.
 */
final class PresenceListener implements StanzaListener {
    private static final Logger LOGGER = Logger.getLogger(PresenceListener.class.getName());

    private final PresenceEngine mEngine;

    PresenceListener(PresenceEngine engine) {
        mEngine = engine;

        registerProviders();
    }

    static void registerProviders() {
        ProviderManager.addExtensionProvider(
                CapsExtension.ELEMENT,
                CapsExtension.NAMESPACE,
                new CapsProvider());
    }

    @Override
    public void processStanza(Stanza packet) {
        if (!(packet instanceof Presence)) {
            LOGGER.warning("not a presence: "+packet);
            return;
        }

        LOGGER.config("packet: "+packet);

        PresenceStanzas.from((Presence) packet).ifPresent(mEngine::onPresence);
    }
}
