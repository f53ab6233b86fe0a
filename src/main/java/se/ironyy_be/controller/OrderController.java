package se.ironyy_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.ironyy_be.dto.request.DeliveryUpdateRequest;
import se.ironyy_be.dto.request.OrderCreateRequest;
import se.ironyy_be.dto.request.OrderItemRequest;
import se.ironyy_be.dto.request.OrderItemUpdateRequest;
import se.ironyy_be.dto.request.OrderStatusUpdateRequest;
import se.ironyy_be.dto.response.ApiResponse;
import se.ironyy_be.dto.response.OrderDetailResponse;
import se.ironyy_be.dto.response.StatusUpdateResponse;
import se.ironyy_be.dto.response.TransitionResponse;
import se.ironyy_be.exception.BusinessLogicException;
import se.ironyy_be.mapper.OrderMapper;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.service.OrderService;
import se.ironyy_be.service.OrderWorkflowService;
import se.ironyy_be.service.TransitionResult;
import se.ironyy_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Order Management",
     description = "Order lifecycle API. Customers create and edit their orders, press and delivery staff " +
                   "move them through the workflow, every status change is audited.")
@SecurityRequirement(name = "basicAuth")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderService orderService;
    private final OrderWorkflowService workflowService;
    private final UserService userService;
    private final OrderMapper orderMapper;

    @Operation(
            summary = "Create a new order",
            description = "Creates an order as DRAFT, or as PENDING when submit is true. Initial items are priced from the catalog."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Order created successfully",
                    content = @Content(schema = @Schema(implementation = OrderDetailResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "Invalid order data or business rule violation"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "403",
                    description = "Access denied - Customer role required"
            )
    })
    @PostMapping
    @PreAuthorize("hasRole('CUSTOMER')")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> createOrder(
            @Valid @RequestBody OrderCreateRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        OrderDetailResponse order = orderService.createOrder(request, user);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Order created successfully", order));
    }

    @Operation(summary = "Get order details", description = "Customers can only read their own orders.")
    @GetMapping("/{orderId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> getOrder(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(orderService.getOrder(orderId, user)));
    }

    @Operation(summary = "Delete a draft order", description = "Hard delete, DRAFT orders only. Owner or admin.")
    @DeleteMapping("/{orderId}")
    @PreAuthorize("hasAnyRole('CUSTOMER', 'ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteDraft(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        orderService.deleteDraft(orderId, user);
        return ResponseEntity.ok(ApiResponse.success("Draft order deleted", null));
    }

    @Operation(
            summary = "Change order status",
            description = "Applies one workflow transition. 409 with fromStatus/toStatus when the transition is not possible, " +
                          "403 when the caller may not perform it, 409 with retryable=true when the order changed concurrently."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Status changed",
                    content = @Content(schema = @Schema(implementation = TransitionResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Transition not allowed for this user"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Order not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Transition not possible or concurrent update"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Store unavailable, nothing was applied")
    })
    @PostMapping("/{orderId}/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<TransitionResponse>> updateStatus(
            @PathVariable Long orderId,
            @Valid @RequestBody OrderStatusUpdateRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        OrderStatus requested = parseStatus(request.getStatus());

        TransitionResult result = workflowService.applyTransition(
                orderId, requested, user, request.getNotes(), request.getExpectedVersion());

        TransitionResponse response = TransitionResponse.builder()
                .order(orderMapper.convertToDetailResponse(result.getOrder(),
                        workflowService.allowedTransitionsFor(user, result.getOrder())))
                .statusUpdate(orderMapper.convertToStatusUpdateResponse(result.getUpdate()))
                .build();
        return ResponseEntity.ok(ApiResponse.success("Order status updated to " + requested, response));
    }

    @Operation(summary = "Get status history", description = "Audit trail of the order, newest first.")
    @GetMapping("/{orderId}/history")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<List<StatusUpdateResponse>>> getHistory(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(orderService.getStatusHistory(orderId, user)));
    }

    @Operation(summary = "Add an item", description = "Only while the order is DRAFT, PENDING or CONFIRMED.")
    @PostMapping("/{orderId}/items")
    @PreAuthorize("hasAnyRole('CUSTOMER', 'ADMIN')")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> addItem(
            @PathVariable Long orderId,
            @Valid @RequestBody OrderItemRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Item added", orderService.addItem(orderId, request, user)));
    }

    @PutMapping("/{orderId}/items/{itemId}")
    @PreAuthorize("hasAnyRole('CUSTOMER', 'ADMIN')")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> updateItem(
            @PathVariable Long orderId,
            @PathVariable Long itemId,
            @Valid @RequestBody OrderItemUpdateRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Item updated", orderService.updateItem(orderId, itemId, request, user)));
    }

    @DeleteMapping("/{orderId}/items/{itemId}")
    @PreAuthorize("hasAnyRole('CUSTOMER', 'ADMIN')")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> removeItem(
            @PathVariable Long orderId,
            @PathVariable Long itemId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Item removed", orderService.removeItem(orderId, itemId, user)));
    }

    @PutMapping("/{orderId}/delivery")
    @PreAuthorize("hasAnyRole('CUSTOMER', 'ADMIN')")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> updateDelivery(
            @PathVariable Long orderId,
            @Valid @RequestBody DeliveryUpdateRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Delivery details updated", orderService.updateDelivery(orderId, request, user)));
    }

    private OrderStatus parseStatus(String value) {
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BusinessLogicException("Unknown order status: " + value);
        }
    }
}
