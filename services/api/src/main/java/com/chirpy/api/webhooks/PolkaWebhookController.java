package com.chirpy.api.webhooks;

import com.chirpy.api.error.BadRequestException;
import com.chirpy.api.error.InvalidTokenException;
import com.chirpy.api.security.CredentialExtractor;
import com.chirpy.api.users.UserService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.UUID;

/** Payment provider callbacks, authenticated with a shared API key. */
@RestController
@RequestMapping("/api/polka")
class PolkaWebhookController {

    static final String USER_UPGRADED = "user.upgraded";

    private static final Logger log = LoggerFactory.getLogger(PolkaWebhookController.class);

    private final UserService userService;
    private final ObjectMapper objectMapper;
    private final byte[] polkaKey;

    PolkaWebhookController(UserService userService, ObjectMapper objectMapper,
            @Value("${app.polkaKey}") String polkaKey) {
        this.userService = userService;
        this.objectMapper = objectMapper;
        this.polkaKey = polkaKey.getBytes(StandardCharsets.UTF_8);
    }

    /** The body is decoded only once the API key has been accepted. */
    @PostMapping("/webhooks")
    ResponseEntity<Void> receive(@RequestHeader HttpHeaders headers, @RequestBody(required = false) String body) {
        var apiKey = CredentialExtractor.extractApiKey(headers);
        if (!MessageDigest.isEqual(polkaKey, apiKey.getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidTokenException("API key does not match");
        }

        var event = decode(body);

        if (!USER_UPGRADED.equals(event.event())) {
            log.debug("Ignoring webhook event {}", event.event());
            return ResponseEntity.noContent().build();
        }

        if (event.data() == null || event.data().userId() == null) {
            throw new BadRequestException("Invalid user ID");
        }
        UUID userId;
        try {
            userId = UUID.fromString(event.data().userId());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid user ID");
        }

        userService.upgradeToChirpyRed(userId);
        return ResponseEntity.noContent().build();
    }

    private PolkaEvent decode(String body) {
        if (body == null || body.isBlank()) {
            throw new BadRequestException("Invalid request body");
        }
        PolkaEvent event;
        try {
            event = objectMapper.readValue(body, PolkaEvent.class);
        } catch (JsonProcessingException e) {
            log.debug("Could not decode webhook body: {}", e.getOriginalMessage());
            throw new BadRequestException("Invalid request body");
        }
        if (event == null) {
            throw new BadRequestException("Invalid request body");
        }
        return event;
    }
}
