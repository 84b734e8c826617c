package me.golemcore.spoiler.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import me.golemcore.spoiler.support.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdminSyncServiceTest {

    private static final long CHAT_ID = -100L;

    private ChatPlatformPort chatPlatform;
    private ConfigStore configStore;
    private AdminSyncService service;

    @BeforeEach
    void setUp() {
        chatPlatform = mock(ChatPlatformPort.class);
        configStore = new ConfigStore(new InMemoryStoragePort(), new ObjectMapper(), new BotProperties());
        configStore.load();
        service = new AdminSyncService(chatPlatform, configStore);
    }

    private static ChatUser user(long id, String username, boolean bot) {
        return ChatUser.builder().id(id).username(username).firstName("User" + id).bot(bot).build();
    }

    @Test
    void shouldAddHumanAdminsAndSkipBotsAndKnownAdmins() {
        configStore.addAdmin(1L);
        when(chatPlatform.getChatAdministrators(CHAT_ID)).thenReturn(CompletableFuture.completedFuture(List.of(
                user(1L, "owner", false),
                user(2L, "mod", false),
                user(3L, "helper_bot", true),
                user(4L, null, false))));

        List<ChatUser> added = service.syncFromPlatform(CHAT_ID);

        assertEquals(List.of(2L, 4L), added.stream().map(ChatUser::getId).toList());
        assertEquals(Set.of(1L, 2L, 4L), configStore.getAdministrators());
    }

    @Test
    void shouldReturnEmptyWhenNothingNew() {
        configStore.addAdmin(2L);
        when(chatPlatform.getChatAdministrators(CHAT_ID)).thenReturn(CompletableFuture.completedFuture(List.of(
                user(2L, "mod", false),
                user(3L, "helper_bot", true))));

        assertTrue(service.syncFromPlatform(CHAT_ID).isEmpty());
        assertEquals(Set.of(2L), configStore.getAdministrators());
    }

    @Test
    void shouldNeverRemoveAdmins() {
        configStore.addAdmin(9L);
        when(chatPlatform.getChatAdministrators(CHAT_ID)).thenReturn(CompletableFuture.completedFuture(List.of(
                user(2L, "mod", false))));

        service.syncFromPlatform(CHAT_ID);

        assertEquals(Set.of(9L, 2L), configStore.getAdministrators());
    }

    @Test
    void shouldPropagateFetchFailure() {
        when(chatPlatform.getChatAdministrators(CHAT_ID))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("not a member")));

        assertThrows(CompletionException.class, () -> service.syncFromPlatform(CHAT_ID));
        assertTrue(configStore.getAdministrators().isEmpty());
    }
}
