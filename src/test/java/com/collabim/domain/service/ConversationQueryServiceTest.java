package com.collabim.domain.service;

import com.collabim.common.error.ChatException;
import com.collabim.common.error.ErrorKind;
import com.collabim.domain.config.ChatProperties;
import com.collabim.domain.directory.InMemoryDirectories;
import com.collabim.domain.dto.ChatStatsDto;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.enums.RecruitmentStatus;
import com.collabim.domain.enums.UserStanding;
import com.collabim.domain.store.ConversationStore;
import com.collabim.domain.store.InMemoryChatStore;
import com.collabim.domain.store.MessageStore;
import com.collabim.gateway.session.PresenceRegistry;
import com.collabim.gateway.session.RecordingConnectionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationQueryServiceTest {

    private static final long BRAND = 1L;
    private static final long OTHER_BRAND = 5L;

    private final InMemoryChatStore data = new InMemoryChatStore();
    private final ConversationStore conversations = data.conversationStore();
    private final MessageStore messages = data.messageStore();
    private final InMemoryDirectories directories = new InMemoryDirectories().brand(BRAND, "Acme");
    private final PresenceRegistry presence = new PresenceRegistry();

    private ConversationQueryService svc;
    private final LocalDateTime base = LocalDateTime.of(2026, 1, 1, 12, 0);

    @BeforeEach
    void setUp() {
        directories.campaign(10L, BRAND, "Summer Launch");
        for (long creator = 100; creator < 104; creator++) {
            directories.creator(creator, "@c" + creator, UserStanding.APPROVED);
        }
        ChatViewAssembler assembler = new ChatViewAssembler(messages, directories, directories, presence);
        svc = new ConversationQueryService(conversations, messages, assembler, new ChatProperties(null, null, null, null, null));
    }

    @Test
    void inbox_ShouldOrderByLastActivityAndDefaultToActive() {
        long a = seed(100L, base.plusMinutes(1), ConnectionStatus.ACTIVE);
        long b = seed(101L, base.plusMinutes(3), ConnectionStatus.ACTIVE);
        long c = seed(102L, base.plusMinutes(2), ConnectionStatus.ACTIVE);
        seed(103L, base.plusMinutes(9), ConnectionStatus.ARCHIVED);

        PageResult<ConversationDto> page = svc.inbox(BRAND, null, null, null);

        assertThat(page.records()).extracting(ConversationDto::getId).containsExactly(b, c, a);
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.pageSize()).isEqualTo(20);

        PageResult<ConversationDto> archived = svc.inbox(BRAND, 1, 10, ConnectionStatus.ARCHIVED);
        assertThat(archived.records()).hasSize(1);
        assertThat(archived.records().get(0).getCreator().id()).isEqualTo(103L);
    }

    @Test
    void inbox_ShouldCarryUnreadCountAndOnlineFlag() {
        long id = seed(100L, base, ConnectionStatus.ACTIVE);
        presence.register(100L, new RecordingConnectionHandle(100L), "c100");

        ConversationDto forBrand = svc.inbox(BRAND, 1, 10, null).records().get(0);
        assertThat(forBrand.getUnreadCount()).isZero();
        assertThat(forBrand.getCreator().online()).isTrue();
        assertThat(forBrand.getBrand().online()).isFalse();
        assertThat(forBrand.getCampaign().name()).isEqualTo("Summer Launch");

        ConversationDto forCreator = svc.inbox(100L, 1, 10, null).records().get(0);
        assertThat(forCreator.getId()).isEqualTo(id);
        assertThat(forCreator.getUnreadCount()).isEqualTo(1L);
        assertThat(forCreator.getLastMessage().getKind()).isEqualTo(MessageKind.TEXT);
    }

    @Test
    void inbox_LimitShouldBeClamped() {
        for (long creator = 100; creator < 104; creator++) {
            seed(creator, base.plusMinutes(creator), ConnectionStatus.ACTIVE);
        }
        PageResult<ConversationDto> page = svc.inbox(BRAND, 2, 3, null);
        assertThat(page.records()).hasSize(1);
        assertThat(page.hasPrevious()).isTrue();
        assertThat(svc.inbox(BRAND, 1, 1000, null).pageSize()).isEqualTo(50);
    }

    @Test
    void getConversation_NonParticipantShouldLookMissing() {
        long id = seed(100L, base, ConnectionStatus.ACTIVE);

        assertThat(svc.getConversation(BRAND, id).getId()).isEqualTo(id);
        assertThatThrownBy(() -> svc.getConversation(OTHER_BRAND, id))
                .isInstanceOfSatisfying(ChatException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
                    assertThat(e.getReason()).isEqualTo("conversation_not_found");
                });
    }

    @Test
    void stats_ShouldCountByStatusAndUnread() {
        seed(100L, base, ConnectionStatus.ACTIVE);
        seed(101L, base, ConnectionStatus.ACTIVE);
        seed(102L, base, ConnectionStatus.ARCHIVED);
        seed(103L, base, ConnectionStatus.BLOCKED);

        ChatStatsDto brand = svc.stats(BRAND);
        assertThat(brand.active()).isEqualTo(2);
        assertThat(brand.archived()).isEqualTo(1);
        assertThat(brand.blocked()).isEqualTo(1);
        assertThat(brand.total()).isEqualTo(4);
        assertThat(brand.unreadMessages()).isZero();

        ChatStatsDto creator = svc.stats(100L);
        assertThat(creator.total()).isEqualTo(1);
        assertThat(creator.unreadMessages()).isEqualTo(1);
    }

    /**
     * 写入一个会话和一条品牌方发出的文本消息。
     */
    private long seed(long creatorId, LocalDateTime activityAt, ConnectionStatus status) {
        ConversationEntity conv = new ConversationEntity();
        conv.setCampaignId(10L);
        conv.setBrandId(BRAND);
        conv.setCreatorId(creatorId);
        conv.setInitiatorId(BRAND);
        conv.setConnectionStatus(status);
        conv.setRecruitmentStatus(RecruitmentStatus.DISCUSSING);
        conv.setLastActivityAt(activityAt);
        conv.setCreatedAt(activityAt);

        MessageEntity m = new MessageEntity();
        m.setSenderId(BRAND);
        m.setKind(MessageKind.TEXT);
        m.setContent("hello " + creatorId);
        m.setDeliveryStatus(DeliveryStatus.SENT);
        m.setCreatedAt(activityAt);

        List<MessageEntity> initial = new ArrayList<>();
        initial.add(m);
        conversations.create(conv, initial);
        return conv.getId();
    }
}
