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

import java.util.Date;

import org.junit.Before;
import org.junit.Test;
import org.prattle.misc.JID;
import org.prattle.misc.PresenceEvent;
import org.prattle.misc.PresenceStanza;
import org.prattle.model.Resource;
import org.prattle.model.ResourcePresence;
import org.prattle.model.SimpleCapsCache;
import org.prattle.persistence.Config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ContactPresenceHandlerTest {

    private static final JID ME = JID.full("me@example.com/desktop");

    private RecordingObserver mObserver;
    private RecordingTransport mTransport;
    private ContactPresenceHandler mHandler;

    public ContactPresenceHandlerTest() {
    }

    @Before
    public void setUp() {
        mObserver = new RecordingObserver();
        mTransport = new RecordingTransport();
        CapsResolver resolver = new CapsResolver(new SimpleCapsCache(), mTransport, Config.defaults());
        mHandler = new ContactPresenceHandler(ME, resolver, mObserver);
    }

    private static PresenceStanza.Builder available(String jid) {
        return PresenceStanza.builder(PresenceStanza.Type.AVAILABLE, JID.full(jid));
    }

    private static PresenceStanza.Builder unavailable(String jid) {
        return PresenceStanza.builder(PresenceStanza.Type.UNAVAILABLE, JID.full(jid));
    }

    /**
     * Plain available presence without any child elements.
     */
    @Test
    public void testOnAvailableDefaults() {
        mHandler.onAvailable(available("carol@example.com/phone").build());

        PresenceEvent.ContactOnline event = mObserver.single(PresenceEvent.ContactOnline.class);
        assertEquals("carol@example.com", event.jid.string());
        Resource resource = event.resource;
        assertEquals("phone", resource.getName());
        assertEquals(ResourcePresence.ONLINE, resource.getPresence());
        assertFalse(resource.getStatus().isPresent());
        assertEquals(0, resource.getPriority());
        assertFalse(resource.getCapsKey().isPresent());
        assertFalse(event.lastActivity.isPresent());
    }

    @Test
    public void testOnAvailable() {
        mHandler.onAvailable(available("carol@example.com/phone")
                .show("dnd")
                .status("in a meeting")
                .priority("5")
                .caps("http://node", "abc=", "sha-1")
                .build());

        Resource resource = mObserver.single(PresenceEvent.ContactOnline.class).resource;
        assertEquals(ResourcePresence.DND, resource.getPresence());
        assertEquals("in a meeting", resource.getStatus().get());
        assertEquals(5, resource.getPriority());
        assertEquals("abc=", resource.getCapsKey().get().string());
        assertEquals(1, mTransport.queries.size());
    }

    @Test
    public void testInvalidPriority() {
        mHandler.onAvailable(available("carol@example.com/phone").priority("high").build());
        mHandler.onAvailable(available("carol@example.com/phone").priority(" -3 ").build());

        assertEquals(0, mObserver.of(PresenceEvent.ContactOnline.class).get(0).resource.getPriority());
        assertEquals(-3, mObserver.of(PresenceEvent.ContactOnline.class).get(1).resource.getPriority());
    }

    @Test
    public void testIdleTime() {
        long before = System.currentTimeMillis();
        mHandler.onAvailable(available("carol@example.com/phone").idleSeconds(600).build());
        long after = System.currentTimeMillis();

        PresenceEvent.ContactOnline event = mObserver.single(PresenceEvent.ContactOnline.class);
        Date lastActivity = event.lastActivity.get();
        assertTrue(lastActivity.getTime() >= before - 600_000);
        assertTrue(lastActivity.getTime() <= after - 600_000);
        assertEquals(lastActivity, event.resource.getLastActivity().get());
    }

    @Test
    public void testOwnPresenceIgnored() {
        mHandler.onAvailable(available("me@example.com/phone").build());
        mHandler.onAvailable(available("ME@example.com/desktop").build());
        mHandler.onUnavailable(unavailable("me@example.com/phone").build());

        assertTrue(mObserver.events.isEmpty());
    }

    @Test
    public void testOnAvailableIgnoresOtherTypes() {
        for (PresenceStanza.Type type : PresenceStanza.Type.values()) {
            if (type == PresenceStanza.Type.AVAILABLE)
                continue;
            mHandler.onAvailable(PresenceStanza.builder(type, JID.full("carol@example.com/phone")).build());
        }
        mHandler.onAvailable(available("room@muc.example.com/carol").muc().build());

        assertTrue(mObserver.events.isEmpty());
    }

    @Test
    public void testOnUnavailable() {
        mHandler.onUnavailable(unavailable("carol@example.com/phone").status("bye").build());
        mHandler.onUnavailable(unavailable("dave@example.com/laptop").build());

        PresenceEvent.ContactOffline first = mObserver.of(PresenceEvent.ContactOffline.class).get(0);
        assertEquals("carol@example.com", first.jid.string());
        assertEquals("phone", first.resource);
        assertEquals("bye", first.status.get());

        PresenceEvent.ContactOffline second = mObserver.of(PresenceEvent.ContactOffline.class).get(1);
        assertFalse(second.status.isPresent());
    }
}
