package se.ironyy_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminDashboardResponse {
    private long totalOrders;
    private Map<String, Long> bucketCounts;
    private Map<String, Long> statusCounts;
    private List<StaffPerformance> topStaff;
    private PagedResponse<OrderListResponse> orders;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StaffPerformance {
        private Long staffId;
        private String staffName;
        private long completedOrders;
        // Mean of completedAt - createdAt, in minutes.
        private double averageCompletionMinutes;
    }
}
