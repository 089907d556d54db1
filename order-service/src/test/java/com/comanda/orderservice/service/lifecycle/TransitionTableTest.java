package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.common.exception.ErrorCategory;
import com.comanda.orderservice.exception.InvalidTransitionException;
import com.comanda.orderservice.exception.OrderClosedException;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransitionTable Unit Tests")
class TransitionTableTest {

    // Written out by hand so the sweep below does not read the table it checks
    private static final Set<String> ALLOWED = Set.of(
            "PENDING RESTAURANT CONFIRMED",
            "PENDING RESTAURANT CANCELLED",
            "PENDING CUSTOMER CANCELLED",
            "PENDING ADMIN CANCELLED",
            "CONFIRMED RESTAURANT PREPARING",
            "CONFIRMED RESTAURANT CANCELLED",
            "CONFIRMED ADMIN CANCELLED",
            "PREPARING RESTAURANT READY_FOR_PICKUP",
            "PREPARING ADMIN CANCELLED",
            "READY_FOR_PICKUP DISPATCH OUT_FOR_DELIVERY",
            "READY_FOR_PICKUP ADMIN CANCELLED",
            "OUT_FOR_DELIVERY COURIER DELIVERED",
            "OUT_FOR_DELIVERY ADMIN CANCELLED");

    private static boolean allowed(OrderStatus from, ActorRole role, OrderStatus to) {
        return ALLOWED.contains(from + " " + role + " " + to);
    }

    private static boolean anyRoleAllowed(OrderStatus from, OrderStatus to) {
        return Arrays.stream(ActorRole.values()).anyMatch(role -> allowed(from, role, to));
    }

    static Stream<Arguments> everyMove() {
        return Arrays.stream(OrderStatus.values()).flatMap(from ->
                Arrays.stream(ActorRole.values()).flatMap(role ->
                        Arrays.stream(OrderStatus.values()).map(to -> Arguments.of(from, role, to))));
    }

    @ParameterizedTest(name = "{0} --{1}--> {2}")
    @MethodSource("everyMove")
    @DisplayName("every state, role and target gets exactly the expected outcome")
    void check_EveryMove_MatchesExpectedOutcome(OrderStatus from, ActorRole role, OrderStatus to) {
        if (from.isTerminal()) {
            // closed wins over every other reason
            assertThatThrownBy(() -> TransitionTable.check(from, to, role))
                    .isInstanceOf(OrderClosedException.class);
        } else if (allowed(from, role, to)) {
            assertThatCode(() -> TransitionTable.check(from, to, role)).doesNotThrowAnyException();
        } else if (!anyRoleAllowed(from, to)) {
            assertThatThrownBy(() -> TransitionTable.check(from, to, role))
                    .isInstanceOf(InvalidTransitionException.class);
        } else {
            assertThatThrownBy(() -> TransitionTable.check(from, to, role))
                    .isInstanceOf(AccessDeniedException.class)
                    .satisfies(e -> assertThat(((AccessDeniedException) e).getErrorCode()).isEqualTo("ROLE_NOT_PERMITTED"));
        }
    }

    @ParameterizedTest(name = "{0} as {1}")
    @MethodSource("everyStateAndRole")
    void allowedTargets_MatchExpectedMoves(OrderStatus from, ActorRole role) {
        Set<OrderStatus> expected = Arrays.stream(OrderStatus.values())
                .filter(to -> allowed(from, role, to))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(OrderStatus.class)));

        assertThat(TransitionTable.allowedTargets(from, role)).containsExactlyInAnyOrderElementsOf(expected);
    }

    static Stream<Arguments> everyStateAndRole() {
        return Arrays.stream(OrderStatus.values()).flatMap(from ->
                Arrays.stream(ActorRole.values()).map(role -> Arguments.of(from, role)));
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    void terminalOrders_AreClosedForEveryone(OrderStatus terminal) {
        assertThatThrownBy(() -> TransitionTable.check(terminal, OrderStatus.CANCELLED, ActorRole.ADMIN))
                .isInstanceOf(OrderClosedException.class)
                .satisfies(e -> assertThat(((OrderClosedException) e).getCategory()).isEqualTo(ErrorCategory.STATE_CONFLICT));
    }

    @Test
    void skippingStates_IsInvalidTransitionEvenForAdmin() {
        assertThatThrownBy(() -> TransitionTable.check(OrderStatus.PENDING, OrderStatus.DELIVERED, ActorRole.ADMIN))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("PENDING")
                .hasMessageContaining("DELIVERED");
    }

    @Test
    void goingBackwards_IsInvalidTransition() {
        assertThatThrownBy(() -> TransitionTable.check(OrderStatus.PREPARING, OrderStatus.CONFIRMED, ActorRole.RESTAURANT))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void existingEdgeWrongRole_IsAccessDenied() {
        assertThatThrownBy(() -> TransitionTable.check(OrderStatus.PENDING, OrderStatus.CONFIRMED, ActorRole.CUSTOMER))
                .isInstanceOf(AccessDeniedException.class)
                .satisfies(e -> assertThat(((AccessDeniedException) e).getErrorCode()).isEqualTo("ROLE_NOT_PERMITTED"));
    }

    @Test
    void customerCannotCancelOnceConfirmed() {
        assertThatThrownBy(() -> TransitionTable.check(OrderStatus.CONFIRMED, OrderStatus.CANCELLED, ActorRole.CUSTOMER))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void restaurantCannotDispatch() {
        assertThatThrownBy(() -> TransitionTable.check(OrderStatus.READY_FOR_PICKUP, OrderStatus.OUT_FOR_DELIVERY,
                ActorRole.RESTAURANT))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void allowedTargets_ListsRoleSpecificMoves() {
        assertThat(TransitionTable.allowedTargets(OrderStatus.PENDING, ActorRole.RESTAURANT))
                .containsExactlyInAnyOrder(OrderStatus.CONFIRMED, OrderStatus.CANCELLED);
        assertThat(TransitionTable.allowedTargets(OrderStatus.DELIVERED, ActorRole.ADMIN)).isEmpty();
    }
}
