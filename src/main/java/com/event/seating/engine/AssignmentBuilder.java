package com.event.seating.engine;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.Guest;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.TableAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Greedy initial assignment.
 * <ol>
 *   <li>MUST_SIT_TOGETHER groups, in input order, go to the first table that can hold the whole group.</li>
 *   <li>The remaining guests are shuffled with the seeded random source.</li>
 *   <li>Round-robin placement, skipping tables that hold someone the guest must not sit with.</li>
 *   <li>If every table conflicts, the guest is forced into the first table with a free seat.</li>
 * </ol>
 * Conflicts are not backtracked; {@link AssignmentRepairer} handles what is left.
 */
@Slf4j
@Component
public class AssignmentBuilder {

    public SeatingPlan build(List<Guest> guests, List<SeatingConstraint> constraints,
                             int tableCount, int seatsPerTable, Random random) {
        SeatingPlan plan = SeatingPlan.withEmptyTables(tableCount);
        List<TableAssignment> tables = plan.getTables();
        Set<String> placed = new HashSet<>();
        Set<String> knownIds = GuestIndex.byId(guests).keySet();

        // 1. Together-groups first, unknown ids are ignored
        for (SeatingConstraint constraint : constraints) {
            if (constraint.getType() != ConstraintType.MUST_SIT_TOGETHER) {
                continue;
            }
            List<String> members = new ArrayList<>();
            for (String guestId : constraint.getGuestIds()) {
                if (knownIds.contains(guestId) && !placed.contains(guestId) && !members.contains(guestId)) {
                    members.add(guestId);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            TableAssignment target = firstTableWithRoom(tables, members.size(), seatsPerTable);
            if (target == null) {
                // left to the round-robin pass; validation reports the split
                log.debug("No table can hold group {} of size {}", constraint.getId(), members.size());
                continue;
            }
            target.getGuestIds().addAll(members);
            placed.addAll(members);
        }

        // 2. Seeded shuffle of everyone else
        List<Guest> remaining = new ArrayList<>();
        for (Guest guest : guests) {
            if (!placed.contains(guest.getId())) {
                remaining.add(guest);
            }
        }
        Collections.shuffle(remaining, random);

        // 3. Round-robin with must-not checks
        int tableIndex = 0;
        for (Guest guest : remaining) {
            Set<String> avoid = mustNotSitWith(guest.getId(), constraints);

            boolean seated = false;
            for (int attempts = 0; attempts < tableCount && !seated; attempts++) {
                TableAssignment table = tables.get((tableIndex + attempts) % tableCount);
                if (table.hasRoom(seatsPerTable) && Collections.disjoint(table.getGuestIds(), avoid)) {
                    table.getGuestIds().add(guest.getId());
                    seated = true;
                }
            }

            // 4. Last resort: accept the conflict rather than leave the guest standing
            if (!seated) {
                TableAssignment fallback = firstTableWithRoom(tables, 1, seatsPerTable);
                if (fallback != null) {
                    fallback.getGuestIds().add(guest.getId());
                }
            }

            tableIndex = (tableIndex + 1) % tableCount;
        }

        return plan;
    }

    private TableAssignment firstTableWithRoom(List<TableAssignment> tables, int seatsNeeded, int seatsPerTable) {
        for (TableAssignment table : tables) {
            if (table.remainingSeats(seatsPerTable) >= seatsNeeded) {
                return table;
            }
        }
        return null;
    }

    private Set<String> mustNotSitWith(String guestId, List<SeatingConstraint> constraints) {
        Set<String> avoid = new HashSet<>();
        for (SeatingConstraint constraint : constraints) {
            if (constraint.getType() == ConstraintType.MUST_NOT_SIT_TOGETHER && constraint.involves(guestId)) {
                for (String other : constraint.getGuestIds()) {
                    if (!other.equals(guestId)) {
                        avoid.add(other);
                    }
                }
            }
        }
        return avoid;
    }
}
