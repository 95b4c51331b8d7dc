package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.TableAssignment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Lookups shared by the validator, scorer and explanation generator
final class GuestIndex {

    private GuestIndex() {
    }

    static Map<String, Guest> byId(List<Guest> guests) {
        Map<String, Guest> map = new HashMap<>();
        for (Guest guest : guests) {
            map.put(guest.getId(), guest);
        }
        return map;
    }

    /**
     * Guests seated at {@code table}, in seat order. Unknown ids are skipped.
     */
    static List<Guest> seatedAt(TableAssignment table, Map<String, Guest> guestMap) {
        List<Guest> seated = new ArrayList<>(table.size());
        for (String guestId : table.getGuestIds()) {
            Guest guest = guestMap.get(guestId);
            if (guest != null) {
                seated.add(guest);
            }
        }
        return seated;
    }

    static List<String> idsOfType(TableAssignment table, Map<String, Guest> guestMap, GuestType type) {
        List<String> ids = new ArrayList<>();
        for (String guestId : table.getGuestIds()) {
            Guest guest = guestMap.get(guestId);
            if (guest != null && guest.getGuestType() == type) {
                ids.add(guestId);
            }
        }
        return ids;
    }

    static List<Guest> ofType(List<Guest> tableGuests, GuestType type) {
        List<Guest> matching = new ArrayList<>();
        for (Guest guest : tableGuests) {
            if (guest.getGuestType() == type) {
                matching.add(guest);
            }
        }
        return matching;
    }

    /**
     * True when two or more of {@code sellers} list the same company.
     */
    static boolean hasSameCompanySellers(List<Guest> sellers) {
        List<String> seen = new ArrayList<>();
        for (Guest seller : sellers) {
            if (!seller.hasCompany()) {
                continue;
            }
            if (seen.contains(seller.getCompany())) {
                return true;
            }
            seen.add(seller.getCompany());
        }
        return false;
    }
}
