package com.chirpy.api.users;

import com.chirpy.api.security.ChirpyUserDetails;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
class UserController {

    private final UserService userService;

    UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    ResponseEntity<UserResponse> create(@Valid @RequestBody CredentialsRequest req) {
        var user = userService.register(req.email(), req.password());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.of(user));
    }

    @PutMapping
    ResponseEntity<UserResponse> update(@AuthenticationPrincipal ChirpyUserDetails principal,
            @Valid @RequestBody CredentialsRequest req) {
        var user = userService.updateCredentials(principal.id(), req.email(), req.password());
        return ResponseEntity.ok(UserResponse.of(user));
    }
}
