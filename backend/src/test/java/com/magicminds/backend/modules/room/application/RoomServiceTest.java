package com.magicminds.backend.modules.room.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.room.domain.AiPlayerRoster;
import com.magicminds.backend.modules.room.domain.GameRoom;
import com.magicminds.backend.modules.room.domain.RoomCodeGenerator;
import com.magicminds.backend.modules.room.domain.RoomParticipant;
import com.magicminds.backend.modules.room.infrastructure.persistence.GameRoomRepository;
import com.magicminds.backend.modules.room.infrastructure.persistence.RoomParticipantRepository;
import com.magicminds.backend.modules.room.presentation.dto.CreateRoomRequest;
import com.magicminds.backend.support.UnitOfWorkStubs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RoomServiceTest {

    private static final AuthenticatedSubject SUBJECT = new AuthenticatedSubject("auth0|host", "host@example.com");
    private static final AiPlayerRoster.AiPlayer COMPANION = new AiPlayerRoster.AiPlayer("Robo Buddy", "🤖");

    @Mock
    private SubjectUnitOfWork unitOfWork;

    @Mock
    private GameRoomRepository gameRoomRepository;

    @Mock
    private RoomParticipantRepository roomParticipantRepository;

    @Mock
    private ChildProfileRepository childProfileRepository;

    @Mock
    private ProfileLookup profileLookup;

    @Mock
    private RoomMembershipSupport membership;

    @Mock
    private RoomInvitationService invitationService;

    @Mock
    private RoomCodeGenerator roomCodeGenerator;

    @Mock
    private AiPlayerRoster aiPlayerRoster;

    private RoomService roomService;
    private ChildProfile host;

    @BeforeEach
    void setUp() {
        UnitOfWorkStubs.runInline(unitOfWork);
        roomService = new RoomService(unitOfWork, gameRoomRepository, roomParticipantRepository, childProfileRepository,
                profileLookup, membership, invitationService, roomCodeGenerator, aiPlayerRoster);
        host = child("Hana");
    }

    @Test
    void roomWithoutFriendsSeatsAnAiCompanion() {
        givenHostCanOpenARoom();
        when(aiPlayerRoster.pick()).thenReturn(COMPANION);

        roomService.createRoom(SUBJECT, request(List.of()));

        ArgumentCaptor<GameRoom> saved = ArgumentCaptor.forClass(GameRoom.class);
        verify(gameRoomRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().isHasAiPlayer()).isTrue();
        assertThat(saved.getValue().getAiPlayerName()).isEqualTo("Robo Buddy");
        assertThat(saved.getValue().getCurrentPlayers()).isEqualTo(2);

        ArgumentCaptor<RoomParticipant> participants = ArgumentCaptor.forClass(RoomParticipant.class);
        verify(roomParticipantRepository, times(2)).save(participants.capture());
        assertThat(participants.getAllValues()).extracting(RoomParticipant::isAi).containsExactly(false, true);
        verifyNoInteractions(invitationService);
    }

    @Test
    void roomWithFriendsInvitesThemInsteadOfAnAi() {
        givenHostCanOpenARoom();
        UUID friendId = UUID.randomUUID();
        GameRoom persisted = new GameRoom("AB12CD", host.getId(), "memory-match", "easy", 4, null);
        when(membership.requireRoom(any())).thenReturn(persisted);

        roomService.createRoom(SUBJECT, request(List.of(friendId)));

        ArgumentCaptor<GameRoom> saved = ArgumentCaptor.forClass(GameRoom.class);
        verify(gameRoomRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().isHasAiPlayer()).isFalse();
        assertThat(saved.getValue().getCurrentPlayers()).isEqualTo(1);
        verify(roomParticipantRepository, times(1)).save(any());
        verify(invitationService).issueInvitations(persisted, List.of(friendId));
        verifyNoInteractions(aiPlayerRoster);
    }

    @Test
    void hostAlreadyInARoomCannotOpenAnother() {
        ReflectionTestUtils.setField(host, "currentRoomId", UUID.randomUUID());
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);

        assertCode(() -> roomService.createRoom(SUBJECT, request(List.of())), "room.already_in_room");
        verify(gameRoomRepository, never()).saveAndFlush(any());
    }

    @Test
    void codeAllocationGivesUpAfterRepeatedCollisions() {
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);
        when(roomCodeGenerator.next()).thenReturn("AB12CD");
        when(gameRoomRepository.existsByRoomCode(anyString())).thenReturn(true);

        assertThatThrownBy(() -> roomService.createRoom(SUBJECT, request(List.of())))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("room.code_exhausted");
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                });
        verify(roomCodeGenerator, times(RoomService.MAX_CODE_ATTEMPTS)).next();
        verify(gameRoomRepository, never()).saveAndFlush(any());
    }

    @Test
    void leavingWithoutARoomIsNotFound() {
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);

        assertCode(() -> roomService.leaveRoom(SUBJECT, host.getId()), "room.not_in_room");
        verifyNoInteractions(membership);
    }

    @Test
    void leavingHostTearsTheRoomDown() {
        GameRoom room = roomHostedBy(host.getId());
        ReflectionTestUtils.setField(host, "currentRoomId", room.getId());
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);
        when(gameRoomRepository.findById(room.getId())).thenReturn(Optional.of(room));

        roomService.leaveRoom(SUBJECT, host.getId());

        verify(membership).teardown(room);
        verify(membership, never()).vacate(any(), any());
    }

    @Test
    void leavingMemberOnlyGivesUpItsSeat() {
        ChildProfile member = child("Gus");
        GameRoom room = roomHostedBy(host.getId());
        ReflectionTestUtils.setField(member, "currentRoomId", room.getId());
        when(profileLookup.requireOwnedChild(SUBJECT, member.getId())).thenReturn(member);
        when(gameRoomRepository.findById(room.getId())).thenReturn(Optional.of(room));

        roomService.leaveRoom(SUBJECT, member.getId());

        verify(membership).vacate(member, room);
        verify(membership, never()).teardown(any());
    }

    @Test
    void pointerToAVanishedRoomIsClearedOnLeave() {
        UUID vanished = UUID.randomUUID();
        ReflectionTestUtils.setField(host, "currentRoomId", vanished);
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);
        when(gameRoomRepository.findById(vanished)).thenReturn(Optional.empty());

        roomService.leaveRoom(SUBJECT, host.getId());

        verify(childProfileRepository).clearRoom(host.getId());
        verifyNoInteractions(membership);
    }

    private void givenHostCanOpenARoom() {
        when(profileLookup.requireOwnedChild(SUBJECT, host.getId())).thenReturn(host);
        when(roomCodeGenerator.next()).thenReturn("AB12CD");
        when(gameRoomRepository.existsByRoomCode("AB12CD")).thenReturn(false);
        when(gameRoomRepository.saveAndFlush(any(GameRoom.class))).thenAnswer(invocation -> {
            GameRoom room = invocation.getArgument(0);
            ReflectionTestUtils.setField(room, "id", UUID.randomUUID());
            return room;
        });
        when(childProfileRepository.claimRoomSlot(any(), any())).thenReturn(1);
    }

    private CreateRoomRequest request(List<UUID> friendIds) {
        return new CreateRoomRequest(host.getId(), "memory-match", "easy", 4, null, friendIds);
    }

    private static GameRoom roomHostedBy(UUID hostId) {
        GameRoom room = new GameRoom("AB12CD", hostId, "memory-match", "easy", 4, null);
        ReflectionTestUtils.setField(room, "id", UUID.randomUUID());
        return room;
    }

    private static void assertCode(Runnable call, String code) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo(code));
    }

    private static ChildProfile child(String name) {
        ParentAccount parent = new ParentAccount("auth0|host", "host@example.com", "Parent");
        ChildProfile child = new ChildProfile(parent, name, "7-9", null);
        ReflectionTestUtils.setField(child, "id", UUID.randomUUID());
        return child;
    }
}
