package com.event.seating.engine;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.FeasibilityVerdict;
import com.event.seating.domain.SeatingConstraint;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Static pre-flight check, run once before any assignment is attempted. Only raw
 * capacity and together-group sizes are checked here; every other rule is enforced
 * during assignment and search.
 */
@Component
public class FeasibilityChecker {

    public FeasibilityVerdict check(int guestCount, List<SeatingConstraint> constraints,
                                    int tableCount, int seatsPerTable) {
        long totalSeats = (long) tableCount * seatsPerTable;
        if (guestCount > totalSeats) {
            return FeasibilityVerdict.infeasible(String.format(
                    "Not enough seats: %d guests but only %d seats (%d tables x %d seats)",
                    guestCount, totalSeats, tableCount, seatsPerTable));
        }

        for (SeatingConstraint constraint : constraints) {
            if (constraint.getType() == ConstraintType.MUST_SIT_TOGETHER
                    && constraint.groupSize() > seatsPerTable) {
                return FeasibilityVerdict.infeasible(String.format(
                        "MUST_SIT_TOGETHER constraint %s has %d guests but tables only have %d seats",
                        constraint.getId(), constraint.groupSize(), seatsPerTable));
            }
        }

        return FeasibilityVerdict.ok();
    }
}
