package com.magicminds.backend.modules.room.presentation;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.room.application.RoomInvitationService;
import com.magicminds.backend.modules.room.application.RoomService;
import com.magicminds.backend.modules.room.presentation.dto.CloseRoomRequest;
import com.magicminds.backend.modules.room.presentation.dto.CreateRoomRequest;
import com.magicminds.backend.modules.room.presentation.dto.HandleJoinRequestRequest;
import com.magicminds.backend.modules.room.presentation.dto.InvitationActionRequest;
import com.magicminds.backend.modules.room.presentation.dto.InviteFriendsRequest;
import com.magicminds.backend.modules.room.presentation.dto.InviteFriendsResponse;
import com.magicminds.backend.modules.room.presentation.dto.JoinDecisionResponse;
import com.magicminds.backend.modules.room.presentation.dto.JoinRequestResponse;
import com.magicminds.backend.modules.room.presentation.dto.JoinRoomRequest;
import com.magicminds.backend.modules.room.presentation.dto.LeaveRoomRequest;
import com.magicminds.backend.modules.room.presentation.dto.RequestToJoinRequest;
import com.magicminds.backend.modules.room.presentation.dto.RoomParticipantResponse;
import com.magicminds.backend.modules.room.presentation.dto.RoomResponse;
import com.magicminds.backend.modules.room.presentation.dto.UpdateRoomStatusRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rooms")
public class RoomController {

    private final RoomService roomService;
    private final RoomInvitationService invitationService;

    public RoomController(RoomService roomService, RoomInvitationService invitationService) {
        this.roomService = roomService;
        this.invitationService = invitationService;
    }

    @Operation(
            summary = "Create a room",
            description = """
                    Opens a waiting room hosted by one of the caller's children. \
                    Without `friendIds` an AI companion takes the second seat; \
                    with `friendIds` each friend receives a pending invitation.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Room created with its participants"),
            @ApiResponse(responseCode = "400", description = "`room.already_in_room`"),
            @ApiResponse(responseCode = "404", description = "Host child not owned by the caller"),
            @ApiResponse(responseCode = "503", description = "`room.code_exhausted`")
    })
    @PostMapping
    public ResponseEntity<RoomResponse> createRoom(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateRoomRequest request
    ) {
        return ResponseEntity.status(201).body(roomService.createRoom(subject, request));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Seat taken"),
            @ApiResponse(responseCode = "400", description = "`room.already_in_room`, `room.not_accepting` or `room.full`"),
            @ApiResponse(responseCode = "404", description = "`room.not_found` or child not owned by the caller")
    })
    @PostMapping("/join")
    public ResponseEntity<RoomResponse> joinRoom(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody JoinRoomRequest request
    ) {
        return ResponseEntity.ok(roomService.joinRoom(subject, request.roomCode(), request.childId()));
    }

    @Operation(summary = "Leave the current room", description = "When the host leaves, the room is closed for everyone.")
    @PostMapping("/leave")
    public ResponseEntity<Void> leaveRoom(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody LeaveRoomRequest request
    ) {
        roomService.leaveRoom(subject, request.childId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/close")
    public ResponseEntity<Void> closeRoom(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CloseRoomRequest request
    ) {
        roomService.closeRoom(subject, request.roomId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{roomId}/status")
    public ResponseEntity<RoomResponse> updateStatus(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("roomId") UUID roomId,
            @Valid @RequestBody UpdateRoomStatusRequest request
    ) {
        return ResponseEntity.ok(roomService.updateStatus(subject, roomId, request.status()));
    }

    @Operation(summary = "Current room of a child", description = "Answers 204 when the child is not in a room.")
    @GetMapping("/current")
    public ResponseEntity<RoomResponse> currentRoom(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("childId") UUID childId
    ) {
        return roomService.currentRoom(subject, childId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{roomId}/participants")
    public ResponseEntity<List<RoomParticipantResponse>> participants(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("roomId") UUID roomId
    ) {
        return ResponseEntity.ok(roomService.participants(subject, roomId));
    }

    @PostMapping("/invite")
    public ResponseEntity<InviteFriendsResponse> invite(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody InviteFriendsRequest request
    ) {
        return ResponseEntity.ok(invitationService.invite(subject, request.roomCode(), request.friendIds()));
    }

    @PostMapping("/request-to-join")
    public ResponseEntity<JoinRequestResponse> requestToJoin(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody RequestToJoinRequest request
    ) {
        return ResponseEntity.status(201).body(invitationService.requestToJoin(subject, request.roomCode(), request.childId()));
    }

    @GetMapping("/{roomId}/join-requests")
    public ResponseEntity<List<JoinRequestResponse>> pendingJoinRequests(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("roomId") UUID roomId
    ) {
        return ResponseEntity.ok(invitationService.pendingJoinRequests(subject, roomId));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request approved or denied"),
            @ApiResponse(responseCode = "400", description = "`room.request_not_pending`, `room.request_kind_mismatch` or `room.full`"),
            @ApiResponse(responseCode = "403", description = "`room.not_host`")
    })
    @PostMapping("/handle-join-request")
    public ResponseEntity<JoinDecisionResponse> handleJoinRequest(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody HandleJoinRequestRequest request
    ) {
        return ResponseEntity.ok(invitationService.handleJoinRequest(subject, request.requestId(), request.approve()));
    }

    @GetMapping("/pending-invitations")
    public ResponseEntity<List<JoinRequestResponse>> pendingInvitations(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("childId") UUID childId
    ) {
        return ResponseEntity.ok(invitationService.pendingInvitations(subject, childId));
    }

    @PostMapping("/accept-invitation")
    public ResponseEntity<JoinDecisionResponse> acceptInvitation(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody InvitationActionRequest request
    ) {
        return ResponseEntity.ok(invitationService.acceptInvitation(subject, request.invitationId(), request.childId()));
    }

    @PostMapping("/decline-invitation")
    public ResponseEntity<JoinRequestResponse> declineInvitation(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody InvitationActionRequest request
    ) {
        return ResponseEntity.ok(invitationService.declineInvitation(subject, request.invitationId(), request.childId()));
    }
}
