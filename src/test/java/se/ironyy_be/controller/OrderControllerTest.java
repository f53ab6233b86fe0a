package se.ironyy_be.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import se.ironyy_be.IntegrationTestSupport;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.Role;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class OrderControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private User customer;
    private User press;
    private User admin;

    @BeforeEach
    void setUpUsers() {
        customer = user("customer@test.local", Role.CUSTOMER);
        press = user("press@test.local", Role.PRESS);
        admin = user("admin@test.local", Role.ADMIN);
    }

    private static RequestPostProcessor authenticatedAs(User user) {
        return SecurityMockMvcRequestPostProcessors.user(user.getEmail()).roles(user.getRole().name());
    }

    private static String statusBody(String status) {
        return "{\"status\":\"" + status + "\"}";
    }

    @Test
    void anonymousCallsAreRejected() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", 1L))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void customerCreatesDraft() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deliveryType\":\"PICKUP\",\"pickupAddress\":\"12 Linen Lane\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("DRAFT"))
                .andExpect(jsonPath("$.data.customer.email").value("customer@test.local"))
                .andExpect(jsonPath("$.data.totalAmount").value(0));

        assertThat(orderRepository.count()).isEqualTo(1);
    }

    @Test
    void staffCannotCreateOrders() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .with(authenticatedAs(press))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deliveryType\":\"PICKUP\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void statusChangeReturnsOrderAndAuditRecord() throws Exception {
        Order order = order(customer, OrderStatus.PENDING);

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"confirmed\",\"notes\":\"ring the bell\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.order.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.data.statusUpdate.fromStatus").value("PENDING"))
                .andExpect(jsonPath("$.data.statusUpdate.toStatus").value("CONFIRMED"))
                .andExpect(jsonPath("$.data.statusUpdate.notes").value("ring the bell"));

        mockMvc.perform(get("/api/orders/{id}/history", order.getOrderId()).with(authenticatedAs(customer)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    void impossibleTransitionIsConflict() throws Exception {
        Order order = order(customer, OrderStatus.DRAFT);

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("COMPLETED")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.data.fromStatus").value("DRAFT"))
                .andExpect(jsonPath("$.data.toStatus").value("COMPLETED"));
    }

    @Test
    void forbiddenTransitionIsForbidden() throws Exception {
        Order order = order(customer, OrderStatus.PICKED_UP);

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("PROCESSING")))
                .andExpect(status().isForbidden());

        assertThat(reload(order.getOrderId()).getStatus()).isEqualTo(OrderStatus.PICKED_UP);
    }

    @Test
    void staleVersionIsRetryableConflict() throws Exception {
        Order order = order(customer, OrderStatus.PENDING);

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"CONFIRMED\",\"expectedVersion\":" + (order.getVersion() + 7) + "}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.data.orderId").value(order.getOrderId().intValue()))
                .andExpect(jsonPath("$.data.retryable").value(true));
    }

    @Test
    void badInputIsBadRequest() throws Exception {
        Order order = order(customer, OrderStatus.PENDING);

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("WASHING")))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/orders/{id}/status", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("")))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/dashboard/customer").param("bucket", "someday").with(authenticatedAs(customer)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        mockMvc.perform(post("/api/orders/{id}/status", 987654L)
                        .with(authenticatedAs(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody("CONFIRMED")))
                .andExpect(status().isNotFound());
    }

    @Test
    void adminEndpointsNeedAdminRole() throws Exception {
        Order order = order(customer, OrderStatus.PENDING);

        mockMvc.perform(put("/api/admin/orders/{id}/discount", order.getOrderId())
                        .with(authenticatedAs(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":5.00}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/admin/orders/{id}/discount", order.getOrderId())
                        .with(authenticatedAs(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":5.00,\"reason\":\"late pickup\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.discountAmount").value(5.0));
    }

    @Test
    void queuesFollowRoles() throws Exception {
        order(customer, OrderStatus.CONFIRMED);

        mockMvc.perform(get("/api/dashboard/press").with(authenticatedAs(press)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.content.length()").value(1));

        mockMvc.perform(get("/api/dashboard/press").with(authenticatedAs(customer)))
                .andExpect(status().isForbidden());
    }
}
