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
package org.prattle.misc;

import java.util.Date;
import java.util.Optional;

import org.prattle.model.CapsKey;
import org.prattle.model.Resource;
import org.prattle.model.ResourcePresence;

/**
 * Events passed from the presence engine to its observer.
 */
public class PresenceEvent {

    private PresenceEvent() {}

    /** A resource of a contact became available or changed its presence. */
    public static class ContactOnline extends PresenceEvent {
        public final JID jid;
        public final Resource resource;
        public final Optional<Date> lastActivity;

        public ContactOnline(JID jid, Resource resource, Optional<Date> lastActivity) {
            this.jid = jid;
            this.resource = resource;
            this.lastActivity = lastActivity;
        }
    }

    /** A resource of a contact went offline. */
    public static class ContactOffline extends PresenceEvent {
        public final JID jid;
        public final String resource;
        public final Optional<String> status;

        public ContactOffline(JID jid, String resource, Optional<String> status) {
            this.jid = jid;
            this.resource = resource;
            this.status = status;
        }
    }

    /** Someone wants to see our presence (ask user). */
    public static class SubscriptionRequest extends PresenceEvent {
        public final JID jid;

        public SubscriptionRequest(JID jid) {
            this.jid = jid;
        }
    }

    /** A contact granted or revoked our subscription. */
    public static class SubscriptionResolved extends PresenceEvent {
        public enum Kind {SUBSCRIBED, UNSUBSCRIBED}

        public final JID jid;
        public final Kind kind;

        public SubscriptionResolved(JID jid, Kind kind) {
            this.jid = jid;
            this.kind = kind;
        }
    }

    /** We are not in the room anymore. */
    public static class RoomLeft extends PresenceEvent {
        public final JID room;

        public RoomLeft(JID room) {
            this.room = room;
        }
    }

    /** Our own nickname in a room changed. */
    public static class RoomNickChanged extends PresenceEvent {
        public final JID room;
        public final String nick;

        public RoomNickChanged(JID room, String nick) {
            this.room = room;
            this.nick = nick;
        }
    }

    /** Presence of all occupants received after joining. */
    public static class RoomRosterComplete extends PresenceEvent {
        public final JID room;

        public RoomRosterComplete(JID room) {
            this.room = room;
        }
    }

    /** Base for events about one room occupant with presence information. */
    public abstract static class MemberPresence extends PresenceEvent {
        public final JID room;
        public final String nick;
        public final ResourcePresence presence;
        public final Optional<String> status;
        public final Optional<CapsKey> capsKey;

        MemberPresence(JID room, String nick, ResourcePresence presence,
                Optional<String> status, Optional<CapsKey> capsKey) {
            this.room = room;
            this.nick = nick;
            this.presence = presence;
            this.status = status;
            this.capsKey = capsKey;
        }
    }

    /** A new occupant joined the room. */
    public static class MemberOnline extends MemberPresence {
        public MemberOnline(JID room, String nick, ResourcePresence presence,
                Optional<String> status, Optional<CapsKey> capsKey) {
            super(room, nick, presence, status, capsKey);
        }
    }

    /** Known occupant changed show or status. */
    public static class MemberPresenceUpdated extends MemberPresence {
        public MemberPresenceUpdated(JID room, String nick, ResourcePresence presence,
                Optional<String> status, Optional<CapsKey> capsKey) {
            super(room, nick, presence, status, capsKey);
        }
    }

    /** An occupant left the room. */
    public static class MemberOffline extends PresenceEvent {
        public static final String REASON_OFFLINE = "offline";

        public final JID room;
        public final String nick;
        public final String reason;
        public final Optional<String> status;

        public MemberOffline(JID room, String nick, String reason, Optional<String> status) {
            this.room = room;
            this.nick = nick;
            this.reason = reason;
            this.status = status;
        }
    }

    /** An occupant is now known under a different nickname. */
    public static class MemberNickChanged extends PresenceEvent {
        public final JID room;
        public final String oldNick;
        public final String newNick;

        public MemberNickChanged(JID room, String oldNick, String newNick) {
            this.room = room;
            this.oldNick = oldNick;
            this.newNick = newNick;
        }
    }
}
