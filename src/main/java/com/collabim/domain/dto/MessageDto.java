package com.collabim.domain.dto;

import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.enums.SystemKind;
import com.collabim.domain.model.OfferDetails;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {

    private Long id;

    private Long conversationId;

    private Long msgSeq;

    private Long senderId;

    private MessageKind kind;

    private String content;

    /** 仅 kind=offer */
    private OfferDetails offerDetails;

    /** 仅 kind=system */
    private SystemKind systemKind;

    private DeliveryStatus deliveryStatus;

    private List<ReadReceiptDto> readReceipts;

    private LocalDateTime createdAt;
}
