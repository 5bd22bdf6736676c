package com.realtime.connect.connection.service;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.common.ErrorCode;
import com.realtime.connect.common.Normalizer;
import com.realtime.connect.common.PairLockRegistry;
import com.realtime.connect.config.LockProps;
import com.realtime.connect.connection.dto.ConnectedUserDto;
import com.realtime.connect.connection.dto.ConnectionDto;
import com.realtime.connect.connection.dto.ConnectionRequestResult;
import com.realtime.connect.connection.dto.PendingConnectionDto;
import com.realtime.connect.connection.entity.Connection;
import com.realtime.connect.connection.model.ConnectionStatus;
import com.realtime.connect.connection.model.RequestOutcome;
import com.realtime.connect.connection.repository.ConnectionRepository;
import com.realtime.connect.directory.entity.User;
import com.realtime.connect.directory.repository.UserRepository;
import com.realtime.connect.directory.service.DirectoryService;
import com.realtime.connect.message.repository.DirectMessageRepository;
import com.realtime.connect.notify.ConnectionEventPublisher;
import com.realtime.connect.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
class ConnectionServiceTest {

    @Autowired
    private ConnectionService connectionService;
    @Autowired
    private ConnectionRepository connectionRepo;
    @Autowired
    private DirectMessageRepository messageRepo;
    @Autowired
    private UserRepository userRepo;
    @Autowired
    private DirectoryService directory;
    @Autowired
    private TransactionTemplate tx;
    @Autowired
    private Normalizer normalizer;

    @MockBean
    private ConnectionEventPublisher events;

    private User u1;
    private User u2;
    private User u3;

    @BeforeEach
    void setUp() {
        messageRepo.deleteAll();
        connectionRepo.deleteAll();
        userRepo.deleteAll();

        TestUsers users = new TestUsers(userRepo);
        u1 = users.create("alice", "anxious");
        u2 = users.create("bob", "anxious", true);
        u3 = users.create("carol", "happy");
    }

    @Test
    void requestCreatesPendingConnectionWithCanonicalPair() {
        ConnectionRequestResult result = connectionService.request(u1.getId(), u2.getId(), "anxious");

        assertThat(result.outcome()).isEqualTo(RequestOutcome.CREATED);
        ConnectionDto c = result.connection();
        assertThat(c.status()).isEqualTo(ConnectionStatus.PENDING);
        assertThat(c.requestedBy()).isEqualTo(u1.getId());
        assertThat(c.receiver()).isEqualTo(u2.getId());
        assertThat(c.matchedOn()).isEqualTo("anxious");
        assertThat(c.acceptedAt()).isNull();

        Connection stored = connectionRepo.findById(c.id()).orElseThrow();
        assertThat(stored.getUserLow().compareTo(stored.getUserHigh())).isNegative();
        verify(events).requested(any());
    }

    @Test
    void matchedOnFallsBackToSharedDirectoryMood() {
        assertThat(connectionService.request(u1.getId(), u2.getId(), null).connection().matchedOn())
                .isEqualTo("anxious");
        assertThat(connectionService.request(u1.getId(), u3.getId(), "  ").connection().matchedOn())
                .isNull();
    }

    @Test
    void repeatedRequestIsIdempotent() {
        ConnectionRequestResult first = connectionService.request(u1.getId(), u2.getId(), null);
        ConnectionRequestResult second = connectionService.request(u1.getId(), u2.getId(), null);

        assertThat(second.outcome()).isEqualTo(RequestOutcome.ALREADY_REQUESTED);
        assertThat(second.connection().id()).isEqualTo(first.connection().id());
        assertThat(second.connection().status()).isEqualTo(ConnectionStatus.PENDING);
        assertThat(connectionRepo.count()).isEqualTo(1);
    }

    @Test
    void requestBackFromTargetAcceptsExistingRequest() {
        ConnectionRequestResult first = connectionService.request(u1.getId(), u2.getId(), null);
        ConnectionRequestResult back = connectionService.request(u2.getId(), u1.getId(), null);

        assertThat(back.outcome()).isEqualTo(RequestOutcome.MUTUAL_ACCEPTED);
        assertThat(back.connection().id()).isEqualTo(first.connection().id());
        assertThat(back.connection().status()).isEqualTo(ConnectionStatus.ACCEPTED);
        assertThat(back.connection().requestedBy()).isEqualTo(u1.getId());
        assertThat(back.connection().acceptedAt()).isNotNull();
        assertThat(connectionRepo.count()).isEqualTo(1);
        verify(events).accepted(any(), eq(u2.getId()));
    }

    @Test
    void requestOnAcceptedPairReturnsExistingState() {
        Long id = connectionService.request(u1.getId(), u2.getId(), null).connection().id();
        connectionService.accept(u2.getId(), id);

        ConnectionRequestResult again = connectionService.request(u2.getId(), u1.getId(), null);

        assertThat(again.outcome()).isEqualTo(RequestOutcome.ALREADY_CONNECTED);
        assertThat(again.connection().status()).isEqualTo(ConnectionStatus.ACCEPTED);
        assertThat(connectionRepo.count()).isEqualTo(1);
    }

    @Test
    void requestValidatesParticipants() {
        assertThatThrownBy(() -> connectionService.request(u1.getId(), u1.getId(), null))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.BAD_REQUEST);
        assertThatThrownBy(() -> connectionService.request(u1.getId(), UUID.randomUUID(), null))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
        assertThat(connectionRepo.count()).isZero();
    }

    @Test
    void acceptScenario() {
        Long id = connectionService.request(u1.getId(), u2.getId(), "anxious").connection().id();

        ConnectionDto accepted = connectionService.accept(u2.getId(), id);
        assertThat(accepted.status()).isEqualTo(ConnectionStatus.ACCEPTED);
        assertThat(accepted.acceptedAt()).isNotNull();

        assertThatThrownBy(() -> connectionService.accept(u1.getId(), id))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_STATE);
    }

    @Test
    void requesterCannotAcceptOwnRequest() {
        Long id = connectionService.request(u1.getId(), u2.getId(), null).connection().id();

        assertThatThrownBy(() -> connectionService.accept(u1.getId(), id))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_STATE);
        assertThat(connectionRepo.findById(id).orElseThrow().getStatus()).isEqualTo(ConnectionStatus.PENDING);
        verify(events, never()).accepted(any(), any());
    }

    @Test
    void acceptByOutsiderOrUnknownIdIsNotFound() {
        Long id = connectionService.request(u1.getId(), u2.getId(), null).connection().id();

        assertThatThrownBy(() -> connectionService.accept(u3.getId(), id))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> connectionService.accept(u2.getId(), id + 1000))
                .isInstanceOf(ConnectException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
    }

    @Test
    void pendingListsAreSplitByDirection() {
        connectionService.request(u1.getId(), u2.getId(), "anxious");
        connectionService.request(u3.getId(), u2.getId(), null);

        List<PendingConnectionDto> incoming = connectionService.listPending(u2.getId());
        assertThat(incoming).extracting(p -> p.user().getUsername()).containsExactlyInAnyOrder("alice", "carol");
        assertThat(incoming).filteredOn(p -> p.user().getId().equals(u1.getId()))
                .singleElement()
                .extracting(PendingConnectionDto::matchedOn)
                .isEqualTo("anxious");

        assertThat(connectionService.listPending(u1.getId())).isEmpty();
        assertThat(connectionService.listOutgoing(u1.getId()))
                .extracting(p -> p.user().getId())
                .containsExactly(u2.getId());
    }

    @Test
    void acceptedListCarriesCounterpartPresence() {
        Long id = connectionService.request(u1.getId(), u2.getId(), null).connection().id();
        assertThat(connectionService.listAccepted(u1.getId())).isEmpty();

        connectionService.accept(u2.getId(), id);

        List<ConnectedUserDto> mine = connectionService.listAccepted(u1.getId());
        assertThat(mine).singleElement().satisfies(c -> {
            assertThat(c.connectionId()).isEqualTo(id);
            assertThat(c.user().getId()).isEqualTo(u2.getId());
            assertThat(c.user().isOnline()).isTrue();
            assertThat(c.acceptedAt()).isNotNull();
        });
        assertThat(connectionService.listAccepted(u2.getId()))
                .extracting(c -> c.user().getId())
                .containsExactly(u1.getId());
        assertThat(connectionService.listPending(u2.getId())).isEmpty();
    }

    @Test
    void countPendingTracksRequestsAndAccepts() {
        long before = connectionService.countPending(u2.getId());

        Long id = connectionService.request(u3.getId(), u2.getId(), null).connection().id();
        assertThat(connectionService.countPending(u2.getId())).isEqualTo(before + 1);
        assertThat(connectionService.countPending(u3.getId())).isZero();

        connectionService.accept(u2.getId(), id);
        assertThat(connectionService.countPending(u2.getId())).isEqualTo(before);
    }

    @Test
    void concurrentOppositeRequestsLeaveOneAcceptedRecord() throws Exception {
        List<ConnectionRequestResult> results = race(List.of(
                () -> connectionService.request(u1.getId(), u2.getId(), null),
                () -> connectionService.request(u2.getId(), u1.getId(), null)));

        assertThat(connectionRepo.count()).isEqualTo(1);
        assertThat(results).extracting(ConnectionRequestResult::outcome)
                .containsExactlyInAnyOrder(RequestOutcome.CREATED, RequestOutcome.MUTUAL_ACCEPTED);
        assertThat(connectionRepo.findAll().get(0).getStatus()).isEqualTo(ConnectionStatus.ACCEPTED);
    }

    @Test
    void concurrentRepeatedRequestsCreateOnce() throws Exception {
        List<Callable<ConnectionRequestResult>> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            calls.add(() -> connectionService.request(u1.getId(), u2.getId(), null));
        }
        List<ConnectionRequestResult> results = race(calls);

        assertThat(connectionRepo.count()).isEqualTo(1);
        assertThat(results).filteredOn(r -> r.outcome() == RequestOutcome.CREATED).hasSize(1);
        assertThat(results).filteredOn(r -> r.outcome() == RequestOutcome.ALREADY_REQUESTED).hasSize(5);
    }

    @Test
    void requestsFromTwoNodesSettleOnOneRecord() throws Exception {
        // 두 번째 인스턴스: 락 레지스트리를 공유하지 않는 다른 노드
        ConnectionService otherNode = new ConnectionService(
                connectionRepo, directory, new PairLockRegistry(new LockProps()), tx, events, normalizer);

        for (int round = 0; round < 15; round++) {
            connectionRepo.deleteAll();

            List<ConnectionRequestResult> results = race(List.of(
                    () -> connectionService.request(u1.getId(), u2.getId(), null),
                    () -> otherNode.request(u1.getId(), u2.getId(), null)));

            assertThat(connectionRepo.count()).isEqualTo(1);
            assertThat(results).extracting(ConnectionRequestResult::outcome)
                    .containsExactlyInAnyOrder(RequestOutcome.CREATED, RequestOutcome.ALREADY_REQUESTED);
            assertThat(results).extracting(r -> r.connection().id()).containsOnly(results.get(0).connection().id());
        }
    }

    @Test
    void oppositeRequestsFromTwoNodesEndAccepted() throws Exception {
        ConnectionService otherNode = new ConnectionService(
                connectionRepo, directory, new PairLockRegistry(new LockProps()), tx, events, normalizer);

        for (int round = 0; round < 15; round++) {
            connectionRepo.deleteAll();

            List<ConnectionRequestResult> results = race(List.of(
                    () -> connectionService.request(u1.getId(), u2.getId(), null),
                    () -> otherNode.request(u2.getId(), u1.getId(), null)));

            assertThat(connectionRepo.count()).isEqualTo(1);
            assertThat(results).extracting(ConnectionRequestResult::outcome)
                    .containsExactlyInAnyOrder(RequestOutcome.CREATED, RequestOutcome.MUTUAL_ACCEPTED);
            assertThat(connectionRepo.findAll().get(0).getStatus()).isEqualTo(ConnectionStatus.ACCEPTED);
        }
    }

    private static <T> List<T> race(List<Callable<T>> calls) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(calls.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> call : calls) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            List<T> out = new ArrayList<>();
            for (Future<T> f : futures) out.add(f.get(10, TimeUnit.SECONDS));
            return out;
        } finally {
            pool.shutdownNow();
        }
    }
}
