package com.chirpy.api.chirps;

import com.chirpy.api.security.ChirpyUserDetails;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/chirps")
class ChirpController {

    private final ChirpService chirpService;

    ChirpController(ChirpService chirpService) {
        this.chirpService = chirpService;
    }

    @PostMapping
    ResponseEntity<ChirpResponse> create(@AuthenticationPrincipal ChirpyUserDetails principal,
            @Valid @RequestBody CreateChirpRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(chirpService.create(principal.id(), req.body()));
    }

    @GetMapping
    List<ChirpResponse> list(
            @RequestParam(name = "author_id", required = false) UUID authorId,
            @RequestParam(name = "sort", defaultValue = "asc") String sort) {
        return chirpService.list(authorId, "desc".equalsIgnoreCase(sort));
    }

    @GetMapping("/{chirpID}")
    ChirpResponse get(@PathVariable("chirpID") UUID chirpId) {
        return chirpService.get(chirpId);
    }

    @DeleteMapping("/{chirpID}")
    ResponseEntity<Void> delete(@AuthenticationPrincipal ChirpyUserDetails principal,
            @PathVariable("chirpID") UUID chirpId) {
        chirpService.delete(principal.id(), chirpId);
        return ResponseEntity.noContent().build();
    }
}
