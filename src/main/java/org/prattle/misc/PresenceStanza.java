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

import java.util.Optional;

import org.apache.commons.lang.StringUtils;

/**
 * A parsed inbound presence stanza, independent of the XMPP library.
 *
 * All child element values are optional. Empty strings are treated like
 * missing elements.
 */
public final class PresenceStanza {

    public enum Type {
        /** No type attribute. */
        AVAILABLE,
        UNAVAILABLE,
        SUBSCRIBE,
        SUBSCRIBED,
        UNSUBSCRIBE,
        UNSUBSCRIBED,
        PROBE,
        ERROR
    }

    /** Entity capabilities announcement (XEP-0115). */
    public static final class Caps {
        public final Optional<String> node;
        public final Optional<String> ver;
        public final Optional<String> hash;

        public Caps(String node, String ver, String hash) {
            this.node = optional(node);
            this.ver = optional(ver);
            this.hash = optional(hash);
        }

        @Override
        public String toString() {
            return "Caps:node="+node.orElse("")+",ver="+ver.orElse("")+",hash="+hash.orElse("");
        }
    }

    private final Type mType;
    private final JID mFrom;
    private final String mStatus;
    private final String mShow;
    private final String mPriority;
    private final int mIdleSeconds;
    private final Caps mCaps;
    private final boolean mMUC;
    private final boolean mSelfPresence;
    private final boolean mNickChange;
    private final String mNewNick;
    private final String mErrorCondition;

    private PresenceStanza(Builder b) {
        mType = b.mType;
        mFrom = b.mFrom;
        mStatus = b.mStatus;
        mShow = b.mShow;
        mPriority = b.mPriority;
        mIdleSeconds = b.mIdleSeconds;
        mCaps = b.mCaps;
        mMUC = b.mMUC;
        mSelfPresence = b.mSelfPresence;
        mNickChange = b.mNickChange;
        mNewNick = b.mNewNick;
        mErrorCondition = b.mErrorCondition;
    }

    public Type getType() {
        return mType;
    }

    /** Sender, with resource (or room nickname) if there is one. */
    public JID getFrom() {
        return mFrom;
    }

    public Optional<String> getStatus() {
        return optional(mStatus);
    }

    public Optional<String> getShow() {
        return optional(mShow);
    }

    /** Raw text of the priority element, not validated. */
    public Optional<String> getPriority() {
        return optional(mPriority);
    }

    /** Seconds since last user activity, 0 if unknown. */
    public int getIdleSeconds() {
        return mIdleSeconds;
    }

    public Optional<Caps> getCaps() {
        return Optional.ofNullable(mCaps);
    }

    /** Contains a multi-user chat user extension (muc#user). */
    public boolean isMUC() {
        return mMUC;
    }

    /** MUC status code 110: presence refers to the user itself. */
    public boolean isSelfPresence() {
        return mSelfPresence;
    }

    /** MUC status code 303: occupant leaves only to change the nickname. */
    public boolean isNickChange() {
        return mNickChange;
    }

    public Optional<String> getNewNick() {
        return optional(mNewNick);
    }

    public Optional<String> getErrorCondition() {
        return optional(mErrorCondition);
    }

    @Override
    public String toString() {
        return "PresenceStanza:type="+mType+",from="+mFrom+",muc="+mMUC
                +",self="+mSelfPresence+",nickChange="+mNickChange;
    }

    public static Builder builder(Type type, JID from) {
        return new Builder(type, from);
    }

    private static Optional<String> optional(String s) {
        return StringUtils.isEmpty(s) ? Optional.empty() : Optional.of(s);
    }

    public static final class Builder {
        private final Type mType;
        private final JID mFrom;
        private String mStatus = null;
        private String mShow = null;
        private String mPriority = null;
        private int mIdleSeconds = 0;
        private Caps mCaps = null;
        private boolean mMUC = false;
        private boolean mSelfPresence = false;
        private boolean mNickChange = false;
        private String mNewNick = null;
        private String mErrorCondition = null;

        private Builder(Type type, JID from) {
            mType = type;
            mFrom = from;
        }

        public Builder status(String status) {
            mStatus = status;
            return this;
        }

        public Builder show(String show) {
            mShow = show;
            return this;
        }

        public Builder priority(String priority) {
            mPriority = priority;
            return this;
        }

        public Builder idleSeconds(int seconds) {
            mIdleSeconds = seconds;
            return this;
        }

        public Builder caps(String node, String ver, String hash) {
            mCaps = new Caps(node, ver, hash);
            return this;
        }

        public Builder muc() {
            mMUC = true;
            return this;
        }

        public Builder selfPresence() {
            mMUC = true;
            mSelfPresence = true;
            return this;
        }

        public Builder nickChange(String newNick) {
            mMUC = true;
            mNickChange = true;
            mNewNick = newNick;
            return this;
        }

        public Builder error(String condition) {
            mErrorCondition = condition;
            return this;
        }

        public PresenceStanza build() {
            return new PresenceStanza(this);
        }
    }
}
