package com.magicminds.backend.modules.friend.presentation;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.friend.application.FriendService;
import com.magicminds.backend.modules.friend.presentation.dto.FriendRequestResponse;
import com.magicminds.backend.modules.friend.presentation.dto.FriendResponse;
import com.magicminds.backend.modules.friend.presentation.dto.SendFriendRequestRequest;
import com.magicminds.backend.modules.profile.presentation.dto.ChildProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/friends")
public class FriendController {

    private final FriendService friendService;

    public FriendController(FriendService friendService) {
        this.friendService = friendService;
    }

    @Operation(summary = "Send a friend request", description = "Creates a pending request from one of the caller's children.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Request created"),
            @ApiResponse(responseCode = "400", description = "`friend.self_request`, `friend.request_exists` or `friend.blocked`"),
            @ApiResponse(responseCode = "404", description = "Requester not owned by the caller or addressee missing")
    })
    @PostMapping("/requests")
    public ResponseEntity<FriendRequestResponse> sendRequest(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody SendFriendRequestRequest request
    ) {
        return ResponseEntity.status(201).body(friendService.sendRequest(subject, request));
    }

    @GetMapping("/requests")
    public ResponseEntity<List<FriendRequestResponse>> listIncomingRequests(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("childId") UUID childId
    ) {
        return ResponseEntity.ok(friendService.listIncomingRequests(subject, childId));
    }

    @PostMapping("/requests/{requestId}/accept")
    public ResponseEntity<FriendRequestResponse> accept(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("requestId") UUID requestId
    ) {
        return ResponseEntity.ok(friendService.accept(subject, requestId));
    }

    @PostMapping("/requests/{requestId}/decline")
    public ResponseEntity<Void> decline(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("requestId") UUID requestId
    ) {
        friendService.decline(subject, requestId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List friends", description = "Accepted friends with presence: offline, online or in-game.")
    @GetMapping
    public ResponseEntity<List<FriendResponse>> listFriends(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("childId") UUID childId
    ) {
        return ResponseEntity.ok(friendService.listFriends(subject, childId));
    }

    @DeleteMapping("/{childId}")
    public ResponseEntity<Void> unfriend(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("childId") UUID childId,
            @RequestParam("friendChildId") UUID friendChildId
    ) {
        friendService.unfriend(subject, childId, friendChildId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/children/search")
    public ResponseEntity<List<ChildProfileResponse>> search(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("q") String query,
            @RequestParam(name = "childId", required = false) UUID childId
    ) {
        return ResponseEntity.ok(friendService.search(subject, query, childId));
    }
}
