package com.chirpy.api.chirps;

import com.chirpy.api.error.BadRequestException;
import com.chirpy.api.error.ForbiddenException;
import com.chirpy.api.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class ChirpService {

    static final int MAX_LENGTH = 140;

    private static final Logger log = LoggerFactory.getLogger(ChirpService.class);

    private final ChirpRepository chirps;
    private final Clock clock;

    ChirpService(ChirpRepository chirps, Clock clock) {
        this.chirps = chirps;
        this.clock = clock;
    }

    @Transactional
    public ChirpResponse create(UUID userId, String body) {
        if (body.length() > MAX_LENGTH) {
            throw new BadRequestException("Chirp is too long");
        }
        var chirp = chirps.save(new Chirp(ProfanityFilter.clean(body), userId, clock.instant()));
        return ChirpResponse.of(chirp);
    }

    /** Chirps ordered by creation time, optionally restricted to one author. */
    @Transactional(readOnly = true)
    public List<ChirpResponse> list(UUID authorId, boolean descending) {
        var sort = Sort.by(descending ? Sort.Direction.DESC : Sort.Direction.ASC, "createdAt");
        var found = authorId == null ? chirps.findAll(sort) : chirps.findAllByUserId(authorId, sort);
        return found.stream().map(ChirpResponse::of).toList();
    }

    @Transactional(readOnly = true)
    public ChirpResponse get(UUID chirpId) {
        return chirps.findById(chirpId)
                .map(ChirpResponse::of)
                .orElseThrow(() -> new NotFoundException("Chirp not found"));
    }

    @Transactional
    public void delete(UUID userId, UUID chirpId) {
        var chirp = chirps.findById(chirpId).orElseThrow(() -> new NotFoundException("Chirp not found"));
        if (!chirp.userId.equals(userId)) {
            log.info("User {} tried to delete chirp {} owned by {}", userId, chirpId, chirp.userId);
            throw new ForbiddenException("You are not authorized to delete this chirp");
        }
        chirps.delete(chirp);
    }
}
