package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.PlanExplanations;
import com.event.seating.domain.PlanMetrics;
import com.event.seating.domain.ReasonCode;
import com.event.seating.domain.SeatingPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.event.seating.testutil.SeatingFixtures.guest;
import static com.event.seating.testutil.SeatingFixtures.plan;
import static com.event.seating.testutil.SeatingFixtures.together;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExplanationGenerator Tests")
class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    private static PlanMetrics metrics(double novelty, double diversity, double balance, double transaction,
                                       double weighted) {
        return PlanMetrics.builder()
                .novelty(novelty)
                .diversity(diversity)
                .balance(balance)
                .transaction(transaction)
                .weighted(weighted)
                .build();
    }

    private static List<String> codes(PlanExplanations explanations) {
        return explanations.getReasonCodes().stream().map(ReasonCode::getCode).collect(Collectors.toList());
    }

    @Test
    @DisplayName("A mixed deal table reads as a strong, well-balanced plan")
    void testPositiveSummary() {
        List<Guest> guests = List.of(guest("b", GuestType.BUYER, "X"), guest("s", GuestType.SELLER, "Y"));

        PlanExplanations explanations = generator.generate(plan(List.of("b", "s")), guests,
                metrics(0.9, 0.5, 0.6, 1.0, 0.75), List.of());

        assertEquals(List.of("COMPANY_DIVERSITY", "BUYER_SELLER_MIX"), codes(explanations));
        assertEquals("Overall optimization score: 75.0%. Strong performance in business opportunities (100%). "
                + "Well-balanced tables with good networking potential. 2 guests across 1 tables.",
                explanations.getOverall());
        assertEquals(List.of("Cross-company networking: 2 different companies represented",
                        "Business opportunity: 1 buyer(s) and 1 seller(s)"),
                explanations.getPerTable().get("table_1"));
    }

    @Test
    @DisplayName("Competing sellers from one company are called out as trade-offs")
    void testNegativeSummary() {
        List<Guest> guests = List.of(
                guest("a", GuestType.SELLER, "Acme"),
                guest("b", GuestType.SELLER, "Acme"),
                guest("c", GuestType.SELLER, "Acme"));

        PlanExplanations explanations = generator.generate(plan(List.of("a", "b", "c")), guests,
                metrics(0.5, 0.5, 0.5, 0.5, 0.5), List.of());

        assertEquals(List.of("SAME_COMPANY_CLUSTER", "COMPETING_SELLERS"), codes(explanations));
        assertTrue(explanations.getReasonCodes().stream().allMatch(r -> r.getImpact() == ReasonCode.Impact.NEGATIVE));
        assertEquals("Overall optimization score: 50.0%. Some trade-offs were made to satisfy hard constraints. "
                + "3 guests across 1 tables.", explanations.getOverall());
    }

    @Test
    @DisplayName("Each catalyst gets its own reason code")
    void testCatalystPerGuest() {
        List<Guest> guests = List.of(
                guest("c1", GuestType.CATALYST, "Host"),
                guest("c2", GuestType.CATALYST, "Host"),
                guest("b", GuestType.BUYER, "Host"));

        PlanExplanations explanations = generator.generate(plan(List.of("c1", "c2", "b")), guests,
                metrics(0.5, 0.5, 0.5, 0.5, 0.5), List.of());

        List<ReasonCode> catalysts = explanations.getReasonCodes().stream()
                .filter(r -> r.getCode().equals("CATALYST_PRESENT"))
                .collect(Collectors.toList());
        assertEquals(2, catalysts.size());
        assertEquals("Conversation catalyst: Guest c1", catalysts.get(0).getDescription());
        assertEquals(List.of("c2"), catalysts.get(1).getGuestIds());
    }

    @Test
    @DisplayName("Satisfied together-groups are noted as neutral and empty tables are skipped")
    void testGroupsAndEmptyTables() {
        List<Guest> guests = List.of(guest("a", GuestType.NEUTRAL), guest("b", GuestType.NEUTRAL));

        PlanExplanations explanations = generator.generate(plan(List.of("a", "b"), List.of()), guests,
                metrics(0.5, 0.5, 0.5, 0.5, 0.5), List.of(together("pair", "a", "b")));

        ReasonCode grouped = explanations.getReasonCodes().get(0);
        assertEquals("MUST_SIT_TOGETHER_SATISFIED", grouped.getCode());
        assertEquals(ReasonCode.Impact.NEUTRAL, grouped.getImpact());
        assertNull(grouped.getObjective());
        assertEquals("Grouped by request: Guest a, Guest b", grouped.getDescription());
        assertFalse(explanations.getPerTable().containsKey("table_2"));
        assertTrue(explanations.getOverall().endsWith("2 guests across 1 tables."));
    }
}
