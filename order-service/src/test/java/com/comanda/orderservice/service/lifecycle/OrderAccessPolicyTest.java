package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.service.catalog.CatalogClient;
import com.comanda.orderservice.service.catalog.RestaurantInfo;
import com.comanda.orderservice.service.identity.CallerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderAccessPolicyTest {

    @Mock
    private CatalogClient catalogClient;

    @InjectMocks
    private OrderAccessPolicy accessPolicy;

    private Order order;

    @BeforeEach
    void setUp() {
        order = new Order();
        order.setId(UUID.randomUUID());
        order.setCustomerId(UUID.randomUUID());
        order.setRestaurantId(UUID.randomUUID());
    }

    @Test
    void customer_OnlyOwnOrders() {
        assertThat(accessPolicy.isParty(order, CallerIdentity.of(order.getCustomerId(), ActorRole.CUSTOMER))).isTrue();
        assertThatThrownBy(() -> accessPolicy.checkCanAct(order, CallerIdentity.of(UUID.randomUUID(), ActorRole.CUSTOMER)))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void restaurant_ClaimMustMatchOrderRestaurant() {
        CallerIdentity staff = CallerIdentity.builder()
                .userId(UUID.randomUUID()).role(ActorRole.RESTAURANT).restaurantId(order.getRestaurantId()).build();
        CallerIdentity otherStaff = CallerIdentity.builder()
                .userId(UUID.randomUUID()).role(ActorRole.RESTAURANT).restaurantId(UUID.randomUUID()).build();

        assertThat(accessPolicy.isParty(order, staff)).isTrue();
        assertThat(accessPolicy.isParty(order, otherStaff)).isFalse();
        verifyNoInteractions(catalogClient);
    }

    @Test
    void restaurant_WithoutClaim_FallsBackToCatalogOwner() {
        UUID ownerId = UUID.randomUUID();
        when(catalogClient.getRestaurant(order.getRestaurantId()))
                .thenReturn(new RestaurantInfo(order.getRestaurantId(), ownerId, "Pide Salonu", null, null, true));

        assertThatCode(() -> accessPolicy.checkCanView(order, CallerIdentity.of(ownerId, ActorRole.RESTAURANT)))
                .doesNotThrowAnyException();
    }

    @Test
    void restaurant_MissingFromCatalog_IsDenied() {
        when(catalogClient.getRestaurant(order.getRestaurantId())).thenThrow(new ResourceNotFoundException("gone"));

        assertThatThrownBy(() -> accessPolicy.checkCanView(order, CallerIdentity.of(UUID.randomUUID(), ActorRole.RESTAURANT)))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void courier_OnlyAssignedOrders() {
        UUID courierId = UUID.randomUUID();
        assertThat(accessPolicy.isParty(order, CallerIdentity.of(courierId, ActorRole.COURIER))).isFalse();

        order.assignCourier(courierId);

        assertThat(accessPolicy.isParty(order, CallerIdentity.of(courierId, ActorRole.COURIER))).isTrue();
    }

    @Test
    void adminAndDispatch_SeeEverything() {
        assertThat(accessPolicy.isParty(order, CallerIdentity.of(UUID.randomUUID(), ActorRole.ADMIN))).isTrue();
        assertThat(accessPolicy.isParty(order, CallerIdentity.dispatch())).isTrue();
    }

    @Test
    void track_CustomerCourierAndAdminOnly() {
        UUID courierId = UUID.randomUUID();
        order.assignCourier(courierId);
        CallerIdentity staff = CallerIdentity.builder()
                .userId(UUID.randomUUID()).role(ActorRole.RESTAURANT).restaurantId(order.getRestaurantId()).build();

        assertThatCode(() -> accessPolicy.checkCanTrack(order, CallerIdentity.of(order.getCustomerId(), ActorRole.CUSTOMER)))
                .doesNotThrowAnyException();
        assertThatCode(() -> accessPolicy.checkCanTrack(order, CallerIdentity.of(courierId, ActorRole.COURIER)))
                .doesNotThrowAnyException();
        assertThatCode(() -> accessPolicy.checkCanTrack(order, CallerIdentity.of(UUID.randomUUID(), ActorRole.ADMIN)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> accessPolicy.checkCanTrack(order, staff))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> accessPolicy.checkCanTrack(order, CallerIdentity.of(UUID.randomUUID(), ActorRole.COURIER)))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> accessPolicy.checkCanTrack(order, CallerIdentity.dispatch()))
                .isInstanceOf(AccessDeniedException.class);
        verifyNoInteractions(catalogClient);
    }
}
