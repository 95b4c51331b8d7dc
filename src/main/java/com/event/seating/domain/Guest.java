package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Guest {
    private String id;   // unique within an event
    private String name;

    // Descriptive data (all optional)
    private String company;
    private String department;
    private String jobTitle;
    private Seniority seniority;

    @Builder.Default
    private GuestType guestType = GuestType.NEUTRAL;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    // Ids of guests this person has already met
    @Builder.Default
    private List<String> knownConnections = new ArrayList<>();

    public boolean hasCompany() {
        return company != null && !company.isBlank();
    }

    public boolean hasDepartment() {
        return department != null && !department.isBlank();
    }

    /**
     * Known-connection lookup, read in both directions: it is enough that either
     * guest lists the other.
     */
    public boolean knows(Guest other) {
        return lists(this, other.getId()) || lists(other, this.id);
    }

    private static boolean lists(Guest guest, String otherId) {
        return guest.getKnownConnections() != null && guest.getKnownConnections().contains(otherId);
    }
}
