package com.event.seating.engine;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.TableAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Single repair pass over MUST_NOT_SIT_TOGETHER violations. Excess members of a
 * constraint are moved, last seated first, to the first other table that has a free
 * seat and no member of the same constraint. Guests with nowhere to go stay put.
 * MUST_SIT_TOGETHER groups are not revisited.
 */
@Slf4j
@Component
public class AssignmentRepairer {

    public SeatingPlan repair(SeatingPlan plan, List<SeatingConstraint> constraints, int seatsPerTable) {
        SeatingPlan repaired = plan.copy();
        List<TableAssignment> tables = repaired.getTables();

        for (SeatingConstraint constraint : constraints) {
            if (constraint.getType() != ConstraintType.MUST_NOT_SIT_TOGETHER) {
                continue;
            }
            for (TableAssignment table : tables) {
                List<String> conflicting = new ArrayList<>();
                for (String guestId : table.getGuestIds()) {
                    if (constraint.involves(guestId)) {
                        conflicting.add(guestId);
                    }
                }

                while (conflicting.size() > 1) {
                    String guestToMove = conflicting.remove(conflicting.size() - 1);
                    TableAssignment alternative = findAlternative(tables, table, constraint, seatsPerTable);
                    if (alternative == null) {
                        log.debug("No free table to separate {} under constraint {}", guestToMove, constraint.getId());
                        continue;
                    }
                    table.getGuestIds().remove(guestToMove);
                    alternative.getGuestIds().add(guestToMove);
                }
            }
        }

        return repaired;
    }

    private TableAssignment findAlternative(List<TableAssignment> tables, TableAssignment current,
                                            SeatingConstraint constraint, int seatsPerTable) {
        for (TableAssignment candidate : tables) {
            if (candidate == current || !candidate.hasRoom(seatsPerTable)) {
                continue;
            }
            boolean holdsMember = candidate.getGuestIds().stream().anyMatch(constraint::involves);
            if (!holdsMember) {
                return candidate;
            }
        }
        return null;
    }
}
