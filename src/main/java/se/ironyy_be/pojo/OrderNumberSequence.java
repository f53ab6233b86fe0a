package se.ironyy_be.pojo;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per-day counter behind order numbers ({@code yyMMdd-NNNNN}).
 */
@Entity
@Table(name = "order_number_sequences")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderNumberSequence {

    @Id
    @Column(length = 6)
    private String dayKey;

    @Column(nullable = false)
    private Integer lastValue;
}
