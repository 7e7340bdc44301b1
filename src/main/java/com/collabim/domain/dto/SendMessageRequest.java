package com.collabim.domain.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class SendMessageRequest {

    private String content;

    /** text / offer，缺省 text */
    private String kind;

    /** kind=offer 时必填 */
    private Offer offerDetails;

    @Data
    public static class Offer {
        private BigDecimal amount;
        private String currency;
        private String description;
        private LocalDateTime deadline;
    }
}
