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

import org.jivesoftware.smack.packet.Presence;
import org.jivesoftware.smack.packet.StandardExtensionElement;
import org.jivesoftware.smack.packet.StanzaError;
import org.jivesoftware.smack.util.PacketParserUtils;
import org.jivesoftware.smackx.caps.packet.CapsExtension;
import org.jivesoftware.smackx.muc.MUCRole;
import org.jivesoftware.smackx.muc.packet.MUCItem;
import org.jivesoftware.smackx.muc.packet.MUCUser;
import org.junit.BeforeClass;
import org.junit.Test;
import org.jxmpp.jid.impl.JidCreate;
import org.jxmpp.jid.parts.Resourcepart;
import org.jxmpp.stringprep.XmppStringprepException;
import org.prattle.misc.PresenceStanza;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PresenceStanzasTest {

    @BeforeClass
    public static void setUpClass() {
        PresenceListener.registerProviders();
    }

    private static Presence presence(Presence.Type type, String from) throws XmppStringprepException {
        Presence presence = new Presence(type);
        presence.setFrom(JidCreate.from(from));
        return presence;
    }

    /**
     * Test of from method, of class PresenceStanzas.
     */
    @Test
    public void testFrom() throws XmppStringprepException {
        System.out.println("from");
        Presence presence = presence(Presence.Type.available, "alice@example.com/phone");
        presence.setStatus("at work");
        presence.setMode(Presence.Mode.away);
        presence.setPriority(5);
        presence.addExtension(StandardExtensionElement.builder(
                PresenceStanzas.LAST_ELEMENT, PresenceStanzas.LAST_NAMESPACE)
                .addAttribute("seconds", "60")
                .build());

        PresenceStanza stanza = PresenceStanzas.from(presence).get();

        assertEquals(PresenceStanza.Type.AVAILABLE, stanza.getType());
        assertEquals("alice@example.com/phone", stanza.getFrom().string());
        assertEquals("at work", stanza.getStatus().get());
        assertEquals("away", stanza.getShow().get());
        assertEquals("5", stanza.getPriority().get());
        assertEquals(60, stanza.getIdleSeconds());
        assertFalse(stanza.getCaps().isPresent());
        assertFalse(stanza.isMUC());
    }

    @Test
    public void testDefaults() throws XmppStringprepException {
        PresenceStanza stanza = PresenceStanzas.from(
                presence(Presence.Type.available, "alice@example.com/phone")).get();

        assertFalse(stanza.getStatus().isPresent());
        assertFalse(stanza.getShow().isPresent());
        assertFalse(stanza.getPriority().isPresent());
        assertEquals(0, stanza.getIdleSeconds());
    }

    @Test
    public void testWithoutSender() {
        assertFalse(PresenceStanzas.from(new Presence(Presence.Type.available)).isPresent());
    }

    @Test
    public void testToType() {
        assertEquals(PresenceStanza.Type.UNAVAILABLE, PresenceStanzas.toType(Presence.Type.unavailable));
        assertEquals(PresenceStanza.Type.SUBSCRIBE, PresenceStanzas.toType(Presence.Type.subscribe));
        assertEquals(PresenceStanza.Type.UNSUBSCRIBED, PresenceStanzas.toType(Presence.Type.unsubscribed));
        assertEquals(PresenceStanza.Type.PROBE, PresenceStanzas.toType(Presence.Type.probe));
        assertEquals(PresenceStanza.Type.AVAILABLE, PresenceStanzas.toType(null));
    }

    @Test
    public void testError() throws XmppStringprepException {
        Presence presence = presence(Presence.Type.error, "lounge@muc.example.com/me");
        presence.setError(StanzaError.getBuilder(StanzaError.Condition.item_not_found));

        PresenceStanza stanza = PresenceStanzas.from(presence).get();

        assertEquals(PresenceStanza.Type.ERROR, stanza.getType());
        assertEquals("item-not-found", stanza.getErrorCondition().get());
    }

    @Test
    public void testCaps() throws XmppStringprepException {
        Presence presence = presence(Presence.Type.available, "alice@example.com/phone");
        presence.addExtension(new CapsExtension("http://psi-im.org",
                "q07IKJEyjvHSyhy//CH0CxmKi8w=", "sha-1"));

        PresenceStanza.Caps caps = PresenceStanzas.from(presence).get().getCaps().get();

        assertEquals("http://psi-im.org", caps.node.get());
        assertEquals("q07IKJEyjvHSyhy//CH0CxmKi8w=", caps.ver.get());
        assertEquals("sha-1", caps.hash.get());
    }

    /**
     * Legacy caps without hash, parsed from the wire.
     */
    @Test
    public void testLegacyCaps() throws Exception {
        Presence presence = (Presence) PacketParserUtils.parseStanza(
                "<presence from='bob@example.com/desktop'>"
                + "<c xmlns='http://jabber.org/protocol/caps'"
                + " node='http://exodus.jabberstudio.org/caps' ver='0.9.1'/>"
                + "</presence>");

        PresenceStanza stanza = PresenceStanzas.from(presence).get();
        PresenceStanza.Caps caps = stanza.getCaps().get();

        assertEquals("bob@example.com/desktop", stanza.getFrom().string());
        assertEquals("http://exodus.jabberstudio.org/caps", caps.node.get());
        assertEquals("0.9.1", caps.ver.get());
        assertFalse(caps.hash.isPresent());
    }

    @Test
    public void testParsedHashedCaps() throws Exception {
        Presence presence = (Presence) PacketParserUtils.parseStanza(
                "<presence from='alice@example.com/phone'>"
                + "<c xmlns='http://jabber.org/protocol/caps' hash='sha-1'"
                + " node='http://psi-im.org' ver='q07IKJEyjvHSyhy//CH0CxmKi8w='/>"
                + "<status>here</status>"
                + "</presence>");

        assertTrue(presence.getExtension(CapsExtension.ELEMENT, CapsExtension.NAMESPACE)
                instanceof CapsExtension);

        PresenceStanza stanza = PresenceStanzas.from(presence).get();
        PresenceStanza.Caps caps = stanza.getCaps().get();

        assertEquals("sha-1", caps.hash.get());
        assertEquals("q07IKJEyjvHSyhy//CH0CxmKi8w=", caps.ver.get());
        // parser continued after the caps element
        assertEquals("here", stanza.getStatus().get());
    }

    @Test
    public void testSelfPresence() throws XmppStringprepException {
        Presence presence = presence(Presence.Type.available, "lounge@muc.example.com/me");
        MUCUser mucUser = new MUCUser();
        mucUser.addStatusCode(MUCUser.Status.PRESENCE_TO_SELF_110);
        presence.addExtension(mucUser);

        PresenceStanza stanza = PresenceStanzas.from(presence).get();

        assertTrue(stanza.isMUC());
        assertTrue(stanza.isSelfPresence());
        assertFalse(stanza.isNickChange());
    }

    @Test
    public void testNickChange() throws XmppStringprepException {
        Presence presence = presence(Presence.Type.unavailable, "lounge@muc.example.com/bob");
        MUCUser mucUser = new MUCUser();
        mucUser.addStatusCode(MUCUser.Status.create(303));
        mucUser.setItem(new MUCItem(MUCRole.participant, Resourcepart.from("robert")));
        presence.addExtension(mucUser);

        PresenceStanza stanza = PresenceStanzas.from(presence).get();

        assertEquals(PresenceStanza.Type.UNAVAILABLE, stanza.getType());
        assertTrue(stanza.isMUC());
        assertFalse(stanza.isSelfPresence());
        assertTrue(stanza.isNickChange());
        assertEquals("robert", stanza.getNewNick().get());
    }
}
