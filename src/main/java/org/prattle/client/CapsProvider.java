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

import java.io.IOException;
import org.jivesoftware.smack.packet.ExtensionElement;
import org.jivesoftware.smack.packet.StandardExtensionElement;
import org.jivesoftware.smack.provider.ExtensionElementProvider;
import org.jivesoftware.smackx.caps.packet.CapsExtension;
import org.xmlpull.v1.XmlPullParser;
import org.xmlpull.v1.XmlPullParserException;

/**
 * Entity capabilities provider that also accepts legacy announcements
 * (pre-1.4 XEP-0115) without 'hash' attribute.
 *
 * Complete announcements are parsed to a {@link CapsExtension}, everything
 * else to a {@link StandardExtensionElement} with the attributes found.
 */
final class CapsProvider extends ExtensionElementProvider<ExtensionElement> {

    static final String ATTR_NODE = "node";
    static final String ATTR_VER = "ver";
    static final String ATTR_HASH = "hash";

    @Override
    public ExtensionElement parse(XmlPullParser parser, int initialDepth)
            throws XmlPullParserException, IOException {
        String node = parser.getAttributeValue(null, ATTR_NODE);
        String ver = parser.getAttributeValue(null, ATTR_VER);
        String hash = parser.getAttributeValue(null, ATTR_HASH);

        // skip any content
        int eventType = parser.getEventType();
        while (!(eventType == XmlPullParser.END_TAG && parser.getDepth() == initialDepth)) {
            eventType = parser.next();
        }

        if (node != null && ver != null && hash != null)
            return new CapsExtension(node, ver, hash);

        StandardExtensionElement.Builder builder =
                StandardExtensionElement.builder(CapsExtension.ELEMENT, CapsExtension.NAMESPACE);
        if (node != null)
            builder.addAttribute(ATTR_NODE, node);
        if (ver != null)
            builder.addAttribute(ATTR_VER, ver);
        if (hash != null)
            builder.addAttribute(ATTR_HASH, hash);
        return builder.build();
    }
}
