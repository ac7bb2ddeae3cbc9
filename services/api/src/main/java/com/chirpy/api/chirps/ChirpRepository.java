package com.chirpy.api.chirps;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

interface ChirpRepository extends JpaRepository<Chirp, UUID> {
    List<Chirp> findAllByUserId(UUID userId, Sort sort);
}
