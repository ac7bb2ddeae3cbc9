package com.chirpy.api.auth;

import com.chirpy.api.security.CredentialExtractor;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class AuthController {

    private final AuthService auth;

    AuthController(AuthService auth) {
        this.auth = auth;
    }

    @PostMapping("/login")
    ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest req) {
        return ResponseEntity.ok(auth.login(req));
    }

    @PostMapping("/refresh")
    ResponseEntity<TokenResponse> refresh(@RequestHeader HttpHeaders headers) {
        return ResponseEntity.ok(auth.refresh(CredentialExtractor.extractBearer(headers)));
    }

    @PostMapping("/revoke")
    ResponseEntity<Void> revoke(@RequestHeader HttpHeaders headers) {
        auth.revoke(CredentialExtractor.extractBearer(headers));
        return ResponseEntity.noContent().build();
    }
}
