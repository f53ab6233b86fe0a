package se.ironyy_be.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Error body written by the exception handler.
 */
@Data
@NoArgsConstructor(force = true)
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ObjectResponse {
    String status;
    String message;
    Object data;
}
