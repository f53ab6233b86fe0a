package se.ironyy_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.ironyy_be.dto.request.AssignUserRequest;
import se.ironyy_be.dto.request.DiscountRequest;
import se.ironyy_be.dto.response.ApiResponse;
import se.ironyy_be.dto.response.OrderDetailResponse;
import se.ironyy_be.pojo.User;
import se.ironyy_be.service.OrderService;
import se.ironyy_be.service.UserService;

@RestController
@RequestMapping("/api/admin/orders")
@Tag(name = "Admin Order Management", description = "Pricing adjustments and manual staff assignment")
@SecurityRequirement(name = "basicAuth")
@PreAuthorize("hasRole('ADMIN')")
@RequiredArgsConstructor
public class AdminOrderController {

    private final OrderService orderService;
    private final UserService userService;

    @Operation(summary = "Set the order-level discount")
    @PutMapping("/{orderId}/discount")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> applyDiscount(
            @PathVariable Long orderId,
            @Valid @RequestBody DiscountRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Discount applied", orderService.applyDiscount(orderId, request, admin)));
    }

    @Operation(summary = "Reprice items from the current catalog")
    @PostMapping("/{orderId}/reprice")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> repriceItems(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Order repriced", orderService.repriceItems(orderId, admin)));
    }

    @Operation(summary = "Assign press staff", description = "Order must be CONFIRMED or later and not finished.")
    @PutMapping("/{orderId}/assign-staff")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> assignStaff(
            @PathVariable Long orderId,
            @Valid @RequestBody AssignUserRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Staff assigned",
                orderService.assignStaff(orderId, request.getUserId(), admin)));
    }

    @Operation(summary = "Assign delivery person", description = "Order must be SCHEDULED_FOR_PICKUP or later and not finished.")
    @PutMapping("/{orderId}/assign-delivery")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> assignDeliveryPerson(
            @PathVariable Long orderId,
            @Valid @RequestBody AssignUserRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Delivery person assigned",
                orderService.assignDeliveryPerson(orderId, request.getUserId(), admin)));
    }
}
