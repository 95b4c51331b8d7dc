package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Table-by-table assignment for one optimization run. Search trials always work on a
 * {@link #copy()}, so a rejected trial leaves the accepted plan untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatingPlan {
    private List<TableAssignment> tables = new ArrayList<>();

    public static SeatingPlan withEmptyTables(int tableCount) {
        List<TableAssignment> tables = new ArrayList<>(tableCount);
        for (int i = 0; i < tableCount; i++) {
            tables.add(TableAssignment.empty(i));
        }
        return new SeatingPlan(tables);
    }

    public static SeatingPlan empty() {
        return new SeatingPlan(new ArrayList<>());
    }

    public SeatingPlan copy() {
        List<TableAssignment> copied = new ArrayList<>(tables.size());
        for (TableAssignment table : tables) {
            copied.add(table.copy());
        }
        return new SeatingPlan(copied);
    }

    public Set<String> seatedGuestIds() {
        Set<String> seated = new LinkedHashSet<>();
        for (TableAssignment table : tables) {
            seated.addAll(table.getGuestIds());
        }
        return seated;
    }

    public int seatedCount() {
        int count = 0;
        for (TableAssignment table : tables) {
            count += table.size();
        }
        return count;
    }

    public long occupiedTableCount() {
        return tables.stream().filter(TableAssignment::hasGuests).count();
    }

    /**
     * @return the index of the table seating {@code guestId}, or -1 when unseated
     */
    public int tableIndexOf(String guestId) {
        for (int i = 0; i < tables.size(); i++) {
            if (tables.get(i).getGuestIds().contains(guestId)) {
                return i;
            }
        }
        return -1;
    }
}
