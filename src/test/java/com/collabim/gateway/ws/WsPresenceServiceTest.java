package com.collabim.gateway.ws;

import com.collabim.common.error.ChatException;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.store.ConversationStore;
import com.collabim.gateway.session.ChannelKey;
import com.collabim.gateway.session.PresenceRegistry;
import com.collabim.gateway.session.RecordingConnectionHandle;
import com.collabim.gateway.session.RoomRouter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WsPresenceServiceTest {

    private static final long BRAND = 1L;
    private static final long CREATOR = 2L;
    private static final long CID = 50L;

    private final PresenceRegistry registry = new PresenceRegistry();
    private final RoomRouter router = new RoomRouter();
    private final ConversationStore store = mock(ConversationStore.class);
    private final WsPresenceService svc = new WsPresenceService(registry, router, store);

    @Test
    void onConnected_ShouldRegisterSubscribePersonalAndAck() {
        RecordingConnectionHandle h = new RecordingConnectionHandle(BRAND);

        svc.onConnected(h, "Acme");

        assertThat(registry.lookup(BRAND)).isSameAs(h);
        assertThat(router.isSubscribed(h, ChannelKey.personal(BRAND))).isTrue();
        assertThat(h.names()).containsExactly(WsEvents.CONNECTED);
        assertThat(((WsEvents.Connected) h.events().get(0).payload()).identityId()).isEqualTo(BRAND);
    }

    @Test
    void reconnect_ShouldMovePersonalChannelToNewConnection() {
        RecordingConnectionHandle first = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle second = new RecordingConnectionHandle(BRAND);
        svc.onConnected(first, "Acme");
        svc.onConnected(second, "Acme");
        first.clear();
        second.clear();

        router.publish(ChannelKey.personal(BRAND), WsEvents.NEW_CHAT, "x");

        assertThat(first.events()).isEmpty();
        assertThat(second.names()).containsExactly(WsEvents.NEW_CHAT);

        // 旧连接晚到的断开不影响新连接的在线状态
        svc.onDisconnected(first);
        assertThat(registry.lookup(BRAND)).isSameAs(second);
    }

    @Test
    void join_ShouldAckAndAnnounceToOthers() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle creator = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(creator, "@jane");
        svc.joinConversation(brand, CID);
        brand.clear();

        svc.joinConversation(creator, CID);

        assertThat(creator.names()).contains(WsEvents.JOINED).doesNotContain(WsEvents.USER_ONLINE);
        assertThat(brand.names()).containsExactly(WsEvents.USER_ONLINE);
        WsEvents.Presence p = (WsEvents.Presence) brand.events().get(0).payload();
        assertThat(p.identityId()).isEqualTo(CREATOR);
        assertThat(p.displayInfo()).isEqualTo("@jane");
        assertThat(p.conversationId()).isEqualTo(CID);
    }

    @Test
    void leave_ShouldAnnounceOfflineAndStopDelivery() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle creator = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(creator, "@jane");
        svc.joinConversation(brand, CID);
        svc.joinConversation(creator, CID);
        brand.clear();

        svc.leaveConversation(creator, CID);
        svc.leaveConversation(creator, CID);

        assertThat(brand.names()).containsExactly(WsEvents.USER_OFFLINE);
        assertThat(router.isSubscribed(creator, ChannelKey.conversation(CID))).isFalse();
    }

    @Test
    void disconnect_ShouldAnnounceOfflineInJoinedRooms() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle creator = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(creator, "@jane");
        svc.joinConversation(brand, CID);
        svc.joinConversation(creator, CID);
        brand.clear();

        svc.onDisconnected(creator);

        assertThat(registry.lookup(CREATOR)).isNull();
        assertThat(router.subscriptions(creator)).isEmpty();
        assertThat(brand.names()).containsExactly(WsEvents.USER_OFFLINE);
        assertThat(((WsEvents.Presence) brand.events().get(0).payload()).displayInfo()).isEqualTo("@jane");
    }

    @Test
    void staleDisconnectAfterReconnect_ShouldNotAnnounceOfflineWhereStillPresent() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle oldConn = new RecordingConnectionHandle(CREATOR);
        RecordingConnectionHandle newConn = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(oldConn, "@jane");
        svc.joinConversation(brand, CID);
        svc.joinConversation(oldConn, CID);
        svc.joinConversation(oldConn, 51L);
        svc.onConnected(newConn, "@jane");
        svc.joinConversation(newConn, CID);
        svc.joinConversation(brand, 51L);
        brand.clear();

        svc.onDisconnected(oldConn);

        assertThat(registry.lookup(CREATOR)).isSameAs(newConn);
        assertThat(brand.names()).containsExactly(WsEvents.USER_OFFLINE);
        assertThat(((WsEvents.Presence) brand.events().get(0).payload()).conversationId()).isEqualTo(51L);
    }

    @Test
    void typing_ShouldRequireJoinAndSkipSender() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle creator = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(creator, "@jane");

        assertThatThrownBy(() -> svc.typing(creator, CID, true))
                .isInstanceOfSatisfying(ChatException.class, e -> assertThat(e.getReason()).isEqualTo("not_joined"));

        svc.joinConversation(brand, CID);
        svc.joinConversation(creator, CID);
        brand.clear();
        creator.clear();

        svc.typing(creator, CID, true);
        svc.typing(creator, CID, false);

        assertThat(brand.names()).containsExactly(WsEvents.USER_TYPING, WsEvents.USER_STOPPED_TYPING);
        assertThat(creator.events()).isEmpty();
    }

    @Test
    void updateStatus_ShouldNotifyOtherOnlineIdentities() {
        RecordingConnectionHandle brand = new RecordingConnectionHandle(BRAND);
        RecordingConnectionHandle creator = new RecordingConnectionHandle(CREATOR);
        svc.onConnected(brand, "Acme");
        svc.onConnected(creator, "@jane");
        brand.clear();
        creator.clear();

        svc.updateStatus(creator, "on a shoot");

        assertThat(registry.entry(CREATOR).statusLabel()).isEqualTo("on a shoot");
        assertThat(brand.names()).containsExactly(WsEvents.USER_STATUS_UPDATE);
        assertThat(((WsEvents.StatusUpdate) brand.events().get(0).payload()).status()).isEqualTo("on a shoot");
        assertThat(creator.events()).isEmpty();
    }

    @Test
    void canJoin_ShouldCheckParticipants() {
        ConversationEntity conv = new ConversationEntity();
        conv.setId(CID);
        conv.setBrandId(BRAND);
        conv.setCreatorId(CREATOR);
        when(store.findById(CID)).thenReturn(conv);

        assertThat(svc.canJoin(BRAND, CID)).isTrue();
        assertThat(svc.canJoin(CREATOR, CID)).isTrue();
        assertThat(svc.canJoin(3L, CID)).isFalse();
        assertThat(svc.canJoin(BRAND, 999L)).isFalse();
    }
}
