package com.magicminds.backend.modules.profile.presentation;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileService;
import com.magicminds.backend.modules.profile.presentation.dto.ChildProfileResponse;
import com.magicminds.backend.modules.profile.presentation.dto.CreateChildProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.CreateParentProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.ParentProfileResponse;
import com.magicminds.backend.modules.profile.presentation.dto.UpdateChildProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.UpdateChildStatusRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profiles")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @Operation(
            summary = "Create or fetch the parent profile",
            description = """
                    Creates the caller's parent profile from the token subject and email. \
                    Calling it again returns the existing profile unchanged.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Profile created or already present"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token")
    })
    @PostMapping("/parent")
    public ResponseEntity<ParentProfileResponse> createParent(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateParentProfileRequest request
    ) {
        return ResponseEntity.status(201).body(profileService.createOrFetchParent(subject, request));
    }

    @GetMapping("/parent")
    public ResponseEntity<ParentProfileResponse> getParent(@AuthenticationPrincipal AuthenticatedSubject subject) {
        return ResponseEntity.ok(profileService.getParent(subject));
    }

    @PostMapping("/children")
    public ResponseEntity<ChildProfileResponse> createChild(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateChildProfileRequest request
    ) {
        return ResponseEntity.status(201).body(profileService.createChild(subject, request));
    }

    @GetMapping("/children")
    public ResponseEntity<List<ChildProfileResponse>> listChildren(@AuthenticationPrincipal AuthenticatedSubject subject) {
        return ResponseEntity.ok(profileService.listChildren(subject));
    }

    @GetMapping("/children/{childId}")
    public ResponseEntity<ChildProfileResponse> getChild(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("childId") UUID childId
    ) {
        return ResponseEntity.ok(profileService.getChild(subject, childId));
    }

    @PatchMapping("/children/{childId}")
    public ResponseEntity<ChildProfileResponse> updateChild(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("childId") UUID childId,
            @Valid @RequestBody UpdateChildProfileRequest request
    ) {
        return ResponseEntity.ok(profileService.updateChild(subject, childId, request));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Child deleted with its stories and friendships"),
            @ApiResponse(responseCode = "400", description = "`profile.child_in_room` while the child holds a room seat"),
            @ApiResponse(responseCode = "404", description = "`profile.child_not_found`")
    })
    @DeleteMapping("/children/{childId}")
    public ResponseEntity<Void> deleteChild(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("childId") UUID childId
    ) {
        profileService.deleteChild(subject, childId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Update presence", description = "Applies the supplied presence flag and stamps lastSeenAt.")
    @PostMapping("/children/{childId}/status")
    public ResponseEntity<ChildProfileResponse> updateStatus(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("childId") UUID childId,
            @RequestBody UpdateChildStatusRequest request
    ) {
        return ResponseEntity.ok(profileService.updateStatus(subject, childId, request));
    }
}
