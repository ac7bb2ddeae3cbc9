package com.chirpy.api.security;

import com.chirpy.api.users.AppUserRepository;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
class UserIdDetailsService implements UserDetailsService {

    private final AppUserRepository users;

    UserIdDetailsService(AppUserRepository users) {
        this.users = users;
    }

    @Override
    public ChirpyUserDetails loadUserByUsername(String userId) {
        if (userId == null) {
            throw new UsernameNotFoundException("User id is null");
        }
        UUID id;
        try {
            id = UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new UsernameNotFoundException("Not a user id: " + userId, e);
        }
        var u = users.findById(id).orElseThrow(() -> new UsernameNotFoundException("User not found"));
        return new ChirpyUserDetails(u.getId(), u.getEmail(), u.getHashedPassword());
    }
}
