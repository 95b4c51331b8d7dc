package com.event.seating.engine;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.ConstraintViolation;
import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.TableAssignment;
import com.event.seating.domain.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a plan against every constraint. Pure: never mutates the plan.
 * <p>
 * MAX_SELLERS_PER_TABLE and MIN_BUYERS_PER_TABLE are evaluated on every table; their
 * {@code guestIds} are not consulted. Guest ids that are not seated (or unknown) are
 * ignored.
 */
@Component
public class ConstraintValidator {

    public ValidationResult validate(SeatingPlan plan, List<SeatingConstraint> constraints, List<Guest> guests) {
        return validate(plan, constraints, guests, ViolationReporting.FIRST_MATCH);
    }

    public ValidationResult validate(SeatingPlan plan, List<SeatingConstraint> constraints,
                                     List<Guest> guests, ViolationReporting reporting) {
        Map<String, String> guestToTable = new HashMap<>();
        for (TableAssignment table : plan.getTables()) {
            for (String guestId : table.getGuestIds()) {
                guestToTable.put(guestId, table.getTableId());
            }
        }
        Map<String, Guest> guestMap = GuestIndex.byId(guests);

        List<ConstraintViolation> violations = new ArrayList<>();
        for (SeatingConstraint constraint : constraints) {
            switch (constraint.getType()) {
                case MUST_SIT_TOGETHER -> checkTogether(constraint, guestToTable, violations);
                case MUST_NOT_SIT_TOGETHER -> checkApart(constraint, guestToTable, reporting, violations);
                case MAX_SELLERS_PER_TABLE -> checkMaxSellers(constraint, plan, guestMap, violations);
                case MIN_BUYERS_PER_TABLE -> checkMinBuyers(constraint, plan, guestMap, violations);
            }
        }
        return ValidationResult.of(violations);
    }

    private void checkTogether(SeatingConstraint constraint, Map<String, String> guestToTable,
                               List<ConstraintViolation> out) {
        Set<String> tables = new LinkedHashSet<>();
        for (String guestId : constraint.getGuestIds()) {
            String tableId = guestToTable.get(guestId);
            if (tableId != null) {
                tables.add(tableId);
            }
        }
        if (tables.size() > 1) {
            out.add(ConstraintViolation.builder()
                    .constraintId(constraint.getId())
                    .constraintType(ConstraintType.MUST_SIT_TOGETHER)
                    .message("Guests must sit together but are at " + tables.size() + " different tables")
                    .guestIds(new ArrayList<>(constraint.getGuestIds()))
                    .build());
        }
    }

    private void checkApart(SeatingConstraint constraint, Map<String, String> guestToTable,
                            ViolationReporting reporting, List<ConstraintViolation> out) {
        // Table id -> members of this constraint seated there, in table discovery order
        Map<String, List<String>> byTable = new LinkedHashMap<>();
        for (String guestId : constraint.getGuestIds()) {
            String tableId = guestToTable.get(guestId);
            if (tableId != null) {
                byTable.computeIfAbsent(tableId, k -> new ArrayList<>()).add(guestId);
            }
        }
        for (Map.Entry<String, List<String>> entry : byTable.entrySet()) {
            List<String> together = entry.getValue();
            if (together.size() > 1) {
                out.add(ConstraintViolation.builder()
                        .constraintId(constraint.getId())
                        .constraintType(ConstraintType.MUST_NOT_SIT_TOGETHER)
                        .message("Guests must not sit together but " + together.size() + " are at the same table")
                        .tableId(entry.getKey())
                        .guestIds(together)
                        .build());
                if (reporting == ViolationReporting.FIRST_MATCH) {
                    return;
                }
            }
        }
    }

    private void checkMaxSellers(SeatingConstraint constraint, SeatingPlan plan, Map<String, Guest> guestMap,
                                 List<ConstraintViolation> out) {
        int maxSellers = constraint.threshold();
        for (TableAssignment table : plan.getTables()) {
            List<String> sellers = GuestIndex.idsOfType(table, guestMap, GuestType.SELLER);
            if (sellers.size() > maxSellers) {
                out.add(ConstraintViolation.builder()
                        .constraintId(constraint.getId())
                        .constraintType(ConstraintType.MAX_SELLERS_PER_TABLE)
                        .message("Table has " + sellers.size() + " sellers, max allowed is " + maxSellers)
                        .tableId(table.getTableId())
                        .guestIds(sellers)
                        .build());
            }
        }
    }

    private void checkMinBuyers(SeatingConstraint constraint, SeatingPlan plan, Map<String, Guest> guestMap,
                                List<ConstraintViolation> out) {
        int minBuyers = constraint.threshold();
        for (TableAssignment table : plan.getTables()) {
            if (!table.hasGuests()) {
                continue;
            }
            List<String> buyers = GuestIndex.idsOfType(table, guestMap, GuestType.BUYER);
            if (buyers.size() < minBuyers) {
                out.add(ConstraintViolation.builder()
                        .constraintId(constraint.getId())
                        .constraintType(ConstraintType.MIN_BUYERS_PER_TABLE)
                        .message("Table has " + buyers.size() + " buyers, minimum required is " + minBuyers)
                        .tableId(table.getTableId())
                        .guestIds(buyers)
                        .build());
            }
        }
    }
}
