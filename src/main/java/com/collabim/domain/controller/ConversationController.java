package com.collabim.domain.controller;

import com.collabim.auth.web.AuthContext;
import com.collabim.common.api.Result;
import com.collabim.common.error.ChatException;
import com.collabim.domain.dto.ChatStatsDto;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.dto.InitiateConversationRequest;
import com.collabim.domain.dto.MessageDto;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.dto.ReadReceiptDto;
import com.collabim.domain.dto.SendMessageRequest;
import com.collabim.domain.dto.UpdateStatusRequest;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import com.collabim.domain.model.OfferDetails;
import com.collabim.domain.service.ChatLifecycleService;
import com.collabim.domain.service.ConversationQueryService;
import com.collabim.domain.service.MessagePipelineService;
import com.collabim.domain.service.RecruitmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RequiredArgsConstructor
@RestController
@RequestMapping("/conversations")
public class ConversationController {

    private final ChatLifecycleService chatLifecycleService;
    private final MessagePipelineService messagePipelineService;
    private final RecruitmentService recruitmentService;
    private final ConversationQueryService conversationQueryService;

    @PostMapping
    public Result<ConversationDto> initiate(@Valid @RequestBody InitiateConversationRequest req) {
        long me = requireIdentity();
        return Result.ok(chatLifecycleService.initiateConversation(me, req.getCampaignId(), req.getCreatorId(), req.getMessage()));
    }

    @GetMapping
    public Result<PageResult<ConversationDto>> inbox(
            @RequestParam(defaultValue = "1") Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String status
    ) {
        long me = requireIdentity();
        ConnectionStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = ConnectionStatus.fromString(status);
            if (filter == null) {
                throw ChatException.validation("bad_status");
            }
        }
        return Result.ok(conversationQueryService.inbox(me, page, limit, filter));
    }

    @GetMapping("/stats/overview")
    public Result<ChatStatsDto> stats() {
        return Result.ok(conversationQueryService.stats(requireIdentity()));
    }

    @GetMapping("/{id}")
    public Result<ConversationDto> detail(@PathVariable("id") Long id) {
        return Result.ok(conversationQueryService.getConversation(requireIdentity(), id));
    }

    @GetMapping("/{id}/messages")
    public Result<PageResult<MessageDto>> messages(
            @PathVariable("id") Long id,
            @RequestParam(defaultValue = "1") Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(messagePipelineService.listMessages(requireIdentity(), id, page, limit));
    }

    @PostMapping("/{id}/messages")
    public Result<MessageDto> send(@PathVariable("id") Long id, @RequestBody SendMessageRequest req) {
        long me = requireIdentity();
        OfferDetails offer = null;
        SendMessageRequest.Offer o = req.getOfferDetails();
        if (o != null) {
            offer = new OfferDetails(o.getAmount(), o.getCurrency(), o.getDescription(), o.getDeadline());
        }
        return Result.ok(messagePipelineService.sendMessage(me, id, req.getContent(), req.getKind(), offer));
    }

    @PatchMapping("/{id}/messages/{messageId}/read")
    public Result<ReadReceiptDto> markRead(@PathVariable("id") Long id, @PathVariable("messageId") Long messageId) {
        return Result.ok(messagePipelineService.markRead(requireIdentity(), id, messageId));
    }

    @PatchMapping("/{id}/read-all")
    public Result<Map<String, Integer>> markAllRead(@PathVariable("id") Long id) {
        int count = messagePipelineService.markAllRead(requireIdentity(), id);
        return Result.ok(Map.of("count", count));
    }

    @GetMapping("/{id}/unread-count")
    public Result<Map<String, Long>> unreadCount(@PathVariable("id") Long id) {
        long count = messagePipelineService.unreadCount(requireIdentity(), id);
        return Result.ok(Map.of("unreadCount", count));
    }

    @PatchMapping("/{id}/status")
    public Result<ConversationDto> updateStatus(@PathVariable("id") Long id, @RequestBody UpdateStatusRequest req) {
        long me = requireIdentity();
        ConnectionStatus cs = null;
        if (req.getStatus() != null) {
            cs = ConnectionStatus.fromString(req.getStatus());
            if (cs == null) {
                throw ChatException.validation("bad_status");
            }
        }
        RecruitmentStatus rs = null;
        if (req.getRecruitmentStatus() != null) {
            rs = RecruitmentStatus.fromString(req.getRecruitmentStatus());
            if (rs == null) {
                throw ChatException.validation("bad_recruitment_status");
            }
        }
        return Result.ok(recruitmentService.updateStatus(me, id, cs, rs));
    }

    private static long requireIdentity() {
        Long me = AuthContext.getIdentityId();
        if (me == null) {
            throw ChatException.unauthenticated();
        }
        return me;
    }
}
