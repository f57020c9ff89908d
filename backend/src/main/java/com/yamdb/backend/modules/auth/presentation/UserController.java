package com.yamdb.backend.modules.auth.presentation;

import com.yamdb.backend.global.security.SecurityUtils;
import com.yamdb.backend.global.web.PageRequests;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.auth.application.AccountService;
import com.yamdb.backend.modules.auth.presentation.dto.CreateUserRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final AccountService accountService;

    public UserController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> listUsers(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(accountService.listUsers(
                SecurityUtils.currentActor(), search, PageRequests.of(page, size, Sort.by("username"))));
    }

    @Operation(summary = "Create user", description = "Admin creates an account with an explicit role.")
    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(201).body(accountService.createUser(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(accountService.loadProfile(SecurityUtils.currentActor()));
    }

    @Operation(summary = "Update own profile", description = "The role cannot be changed here.")
    @PatchMapping("/me")
    public ResponseEntity<UserResponse> updateMe(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(accountService.updateProfile(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{username}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("username") String username) {
        return ResponseEntity.ok(accountService.getUser(SecurityUtils.currentActor(), username));
    }

    @Operation(summary = "Update user", description = "Admin partial update; a role change is audited.")
    @PatchMapping("/{username}")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable("username") String username,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(accountService.updateUser(SecurityUtils.currentActor(), username, request));
    }

    @DeleteMapping("/{username}")
    public ResponseEntity<Void> deleteUser(@PathVariable("username") String username) {
        accountService.deleteUser(SecurityUtils.currentActor(), username);
        return ResponseEntity.noContent().build();
    }
}
