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
public class TableAssignment {
    private String tableId; // "table_1", "table_2", ...

    @Builder.Default
    private List<String> guestIds = new ArrayList<>();

    public static TableAssignment empty(int index) {
        return new TableAssignment(labelFor(index), new ArrayList<>());
    }

    public static String labelFor(int index) {
        return "table_" + (index + 1);
    }

    public int size() {
        return guestIds.size();
    }

    public boolean hasGuests() {
        return !guestIds.isEmpty();
    }

    public boolean hasRoom(int seatsPerTable) {
        return guestIds.size() < seatsPerTable;
    }

    public int remainingSeats(int seatsPerTable) {
        return seatsPerTable - guestIds.size();
    }

    public TableAssignment copy() {
        return new TableAssignment(tableId, new ArrayList<>(guestIds));
    }
}
