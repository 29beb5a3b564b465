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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.prattle.misc.PresenceEvent;

/** Keeps all events for inspection. */
class RecordingObserver implements PresenceObserver {

    final List<PresenceEvent> events = new ArrayList<>();

    @Override
    public void changed(PresenceEvent event) {
        events.add(event);
    }

    <T extends PresenceEvent> List<T> of(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    <T extends PresenceEvent> T single(Class<T> type) {
        List<T> list = this.of(type);
        if (list.size() != 1)
            throw new AssertionError("expected one "+type.getSimpleName()+", got "+events);
        return list.get(0);
    }
}
