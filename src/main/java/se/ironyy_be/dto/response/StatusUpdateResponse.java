package se.ironyy_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateResponse {
    private Long id;
    private String fromStatus;
    private String toStatus;
    private Long changedById;
    private String changedByName;
    private LocalDateTime timestamp;
    private String notes;
}
