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

import java.util.Objects;

import org.prattle.misc.JID;

/**
 * Key for the entity capabilities cache (XEP-0115).
 *
 * Two disjoint key spaces: a hashed key is the verification string and shared
 * by every entity announcing it, a legacy key is the full JID of one entity.
 * Keys of different kinds never compare equal, even with the same text.
 */
public abstract class CapsKey {

    private CapsKey() {}

    /** Text used for cache lookups. */
    public abstract String string();

    public boolean isHashed() {
        return this instanceof Hashed;
    }

    public static CapsKey hashed(String ver) {
        return new Hashed(ver);
    }

    public static CapsKey legacy(JID entity) {
        return new Legacy(entity);
    }

    /** Verification string announced with a supported hash. */
    public static final class Hashed extends CapsKey {
        public final String ver;

        private Hashed(String ver) {
            this.ver = ver;
        }

        @Override
        public String string() {
            return ver;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Hashed && ((Hashed) o).ver.equals(ver);
        }

        @Override
        public int hashCode() {
            return Objects.hash("hashed", ver);
        }

        @Override
        public String toString() {
            return "CapsKey:hashed="+ver;
        }
    }

    /** Capabilities of one entity without usable hash; not shareable. */
    public static final class Legacy extends CapsKey {
        public final JID entity;

        private Legacy(JID entity) {
            this.entity = entity;
        }

        @Override
        public String string() {
            return entity.string();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Legacy && ((Legacy) o).entity.sameFull(entity);
        }

        @Override
        public int hashCode() {
            return Objects.hash("legacy", entity.hashCode(), entity.resource());
        }

        @Override
        public String toString() {
            return "CapsKey:legacy="+entity;
        }
    }
}
