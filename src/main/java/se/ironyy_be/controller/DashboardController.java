package se.ironyy_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import se.ironyy_be.dto.response.AdminDashboardResponse;
import se.ironyy_be.dto.response.ApiResponse;
import se.ironyy_be.dto.response.OrderListResponse;
import se.ironyy_be.dto.response.PagedResponse;
import se.ironyy_be.exception.BusinessLogicException;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatusBucket;
import se.ironyy_be.service.OrderDashboardService;
import se.ironyy_be.service.UserService;
import se.ironyy_be.util.PaginationUtils;

@RestController
@RequestMapping("/api/dashboard")
@Tag(name = "Dashboards", description = "Per-role work queues")
@SecurityRequirement(name = "basicAuth")
@RequiredArgsConstructor
public class DashboardController {

    private final OrderDashboardService dashboardService;
    private final UserService userService;

    @Operation(summary = "Customer's own orders",
            description = "Optional bucket filter: pending, in_progress, ready, done.")
    @GetMapping("/customer")
    @PreAuthorize("hasRole('CUSTOMER')")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> customerOrders(
            @RequestParam(required = false) String bucket,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        OrderStatusBucket statusBucket = null;
        if (bucket != null && !bucket.isBlank()) {
            statusBucket = OrderStatusBucket.fromParam(bucket)
                    .orElseThrow(() -> new BusinessLogicException("Unknown status bucket: " + bucket));
        }
        Pageable pageable = PaginationUtils.createPageable(page, size);

        PagedResponse<OrderListResponse> orders = dashboardService.getCustomerOrders(user, statusBucket, pageable);
        orders.setFilters(PaginationUtils.createFilters(statusBucket != null ? statusBucket.getParam() : null));
        return ResponseEntity.ok(ApiResponse.success(orders));
    }

    @Operation(summary = "Press work queue")
    @GetMapping("/press")
    @PreAuthorize("hasAnyRole('PRESS', 'ADMIN')")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> pressQueue(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(
                dashboardService.getPressQueue(user, PaginationUtils.createPageable(page, size))));
    }

    @Operation(summary = "Delivery work queue")
    @GetMapping("/delivery")
    @PreAuthorize("hasAnyRole('DELIVERY', 'ADMIN')")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> deliveryQueue(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(
                dashboardService.getDeliveryQueue(user, PaginationUtils.createPageable(page, size))));
    }

    @Operation(summary = "Admin overview", description = "All orders with bucket and status counts and the top press staff.")
    @GetMapping("/admin")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<AdminDashboardResponse>> adminDashboard(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByEmail(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(
                dashboardService.getAdminDashboard(user, PaginationUtils.createPageable(page, size))));
    }
}
