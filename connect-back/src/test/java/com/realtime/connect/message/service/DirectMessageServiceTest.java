package com.realtime.connect.message.service;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.common.ErrorCode;
import com.realtime.connect.connection.model.ConnectionStatus;
import com.realtime.connect.connection.repository.ConnectionRepository;
import com.realtime.connect.connection.service.ConnectionService;
import com.realtime.connect.directory.entity.User;
import com.realtime.connect.directory.repository.UserRepository;
import com.realtime.connect.message.dto.DirectMessageDto;
import com.realtime.connect.message.model.MessageType;
import com.realtime.connect.message.repository.DirectMessageRepository;
import com.realtime.connect.notify.ConnectionEventPublisher;
import com.realtime.connect.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class DirectMessageServiceTest {

    @Autowired
    private DirectMessageService messageService;
    @Autowired
    private ConnectionService connectionService;
    @Autowired
    private ConnectionRepository connectionRepo;
    @Autowired
    private DirectMessageRepository messageRepo;
    @Autowired
    private UserRepository userRepo;

    @MockBean
    private ConnectionEventPublisher events;

    private User u1;
    private User u2;
    private User u3;
    private Long connectionId;

    @BeforeEach
    void setUp() {
        messageRepo.deleteAll();
        connectionRepo.deleteAll();
        userRepo.deleteAll();

        TestUsers users = new TestUsers(userRepo);
        u1 = users.create("alice", "anxious");
        u2 = users.create("bob", "anxious");
        u3 = users.create("carol", null);
        connectionId = connectionService.request(u1.getId(), u2.getId(), "anxious").connection().id();
    }

    @Test
    void sendIsForbiddenUntilAccepted() {
        assertThatThrownBy(() -> messageService.send(u1.getId(), u2.getId(), "hello", MessageType.TEXT))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> messageService.history(u1.getId(), u2.getId(), 50, 0))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);

        connectionService.accept(u2.getId(), connectionId);

        DirectMessageDto sent = messageService.send(u1.getId(), u2.getId(), "hello", MessageType.TEXT);
        assertThat(sent.id()).isNotNull();
        assertThat(sent.createdAt()).isNotNull();
        assertThat(sent.senderId()).isEqualTo(u1.getId());
        assertThat(sent.receiverId()).isEqualTo(u2.getId());
    }

    @Test
    void scenarioSendThenClear() {
        connectionService.accept(u2.getId(), connectionId);
        messageService.send(u1.getId(), u2.getId(), "hello", MessageType.TEXT);

        List<DirectMessageDto> thread = messageService.history(u1.getId(), u2.getId(), 50, 0);
        assertThat(thread).singleElement().extracting(DirectMessageDto::content).isEqualTo("hello");

        messageService.clear(u2.getId(), u1.getId());

        assertThat(messageService.history(u1.getId(), u2.getId(), 50, 0)).isEmpty();
        assertThat(connectionRepo.findById(connectionId).orElseThrow().getStatus())
                .isEqualTo(ConnectionStatus.ACCEPTED);

        messageService.send(u2.getId(), u1.getId(), "after", MessageType.TEXT);
        assertThat(messageService.history(u2.getId(), u1.getId(), 50, 0))
                .extracting(DirectMessageDto::content)
                .containsExactly("after");
    }

    @Test
    void historyIsOldestFirstAndStable() {
        connectionService.accept(u2.getId(), connectionId);
        messageService.send(u1.getId(), u2.getId(), "one", MessageType.TEXT);
        messageService.send(u2.getId(), u1.getId(), "two", MessageType.TEXT);
        messageService.send(u1.getId(), u2.getId(), "https://cdn.example/p.png", MessageType.IMAGE);

        List<DirectMessageDto> first = messageService.history(u1.getId(), u2.getId(), 50, 0);
        List<DirectMessageDto> second = messageService.history(u2.getId(), u1.getId(), 50, 0);

        assertThat(first).extracting(DirectMessageDto::content)
                .containsExactly("one", "two", "https://cdn.example/p.png");
        assertThat(first.get(2).messageType()).isEqualTo(MessageType.IMAGE);
        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    void limitAndOffsetPageBackFromNewest() {
        connectionService.accept(u2.getId(), connectionId);
        for (int i = 1; i <= 5; i++) {
            messageService.send(u1.getId(), u2.getId(), "m" + i, MessageType.TEXT);
        }

        assertThat(messageService.history(u1.getId(), u2.getId(), 2, 0))
                .extracting(DirectMessageDto::content).containsExactly("m4", "m5");
        assertThat(messageService.history(u1.getId(), u2.getId(), 2, 2))
                .extracting(DirectMessageDto::content).containsExactly("m2", "m3");
        assertThat(messageService.history(u1.getId(), u2.getId(), 2, 4))
                .extracting(DirectMessageDto::content).containsExactly("m1");
        assertThat(messageService.history(u1.getId(), u2.getId(), 0, -3))
                .extracting(DirectMessageDto::content).containsExactly("m5");
    }

    @Test
    void clearIsIdempotentAndScopedToPair() {
        connectionService.accept(u2.getId(), connectionId);
        Long other = connectionService.request(u1.getId(), u3.getId(), null).connection().id();
        connectionService.accept(u3.getId(), other);
        messageService.send(u1.getId(), u2.getId(), "to bob", MessageType.TEXT);
        messageService.send(u1.getId(), u3.getId(), "to carol", MessageType.VOICE);

        assertThat(messageService.clear(u1.getId(), u2.getId())).isEqualTo(1);
        assertThat(messageService.clear(u1.getId(), u2.getId())).isZero();

        assertThat(messageService.history(u1.getId(), u3.getId(), 50, 0))
                .extracting(DirectMessageDto::content).containsExactly("to carol");
    }

    @Test
    void rejectsBadInput() {
        connectionService.accept(u2.getId(), connectionId);

        assertThatThrownBy(() -> messageService.send(u1.getId(), u1.getId(), "me", MessageType.TEXT))
                .hasFieldOrPropertyWithValue("code", ErrorCode.BAD_REQUEST);
        assertThatThrownBy(() -> messageService.send(u1.getId(), u2.getId(), "  ", MessageType.TEXT))
                .hasFieldOrPropertyWithValue("code", ErrorCode.BAD_REQUEST);
        assertThatThrownBy(() -> messageService.send(u1.getId(), u2.getId(), "x".repeat(2001), MessageType.TEXT))
                .hasFieldOrPropertyWithValue("code", ErrorCode.BAD_REQUEST);
        assertThatThrownBy(() -> messageService.send(u1.getId(), u2.getId(), "hi", null))
                .hasFieldOrPropertyWithValue("code", ErrorCode.BAD_REQUEST);
        assertThat(messageService.history(u1.getId(), u2.getId(), 50, 0)).isEmpty();
    }

    @Test
    void strangersCannotReadOrWrite() {
        assertThatThrownBy(() -> messageService.send(u3.getId(), u1.getId(), "hey", MessageType.FILE))
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> messageService.history(u3.getId(), u2.getId(), 10, 0))
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
    }
}
