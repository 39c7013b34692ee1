package com.example.coldchain.service;

import com.example.coldchain.config.ColdChainProperties;
import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Provisions notification recipients. A user's role is set here and nowhere
 * else; the resolver only reads it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private final UserAccountRepository userAccountRepository;
    private final ColdChainProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void seedFromConfiguration() {
        List<ColdChainProperties.UserSeed> seeds = properties.getUsers();
        if (seeds.isEmpty()) return;
        for (ColdChainProperties.UserSeed seed : seeds) {
            try {
                provision(seed.getUsername(), seed.getEmail(), seed.getPhone(), seed.getRole());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping configured user: {}", e.getMessage());
            }
        }
        log.info("Provisioned {} configured user(s)", seeds.size());
    }

    /**
     * Create the user, or update contact details and role of an existing one.
     * Provisioning always (re)activates the account.
     */
    @Transactional
    public UserAccount provision(String username, String email, String phone, UserAccount.Role role) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        UserAccount user = userAccountRepository.findByUsername(username.trim())
                .orElseGet(() -> UserAccount.builder().username(username.trim()).build());
        user.setEmail(email);
        user.setPhone(phone);
        user.setRole(role != null ? role : UserAccount.Role.OPERATOR);
        user.setActive(true);
        user.setStatus(UserAccount.UserStatus.ACTIVE);
        user = userAccountRepository.save(user);
        log.debug("Provisioned user {} as {}", user.getUsername(), user.getRole());
        return user;
    }

    @Transactional
    public UserAccount deactivate(String username) {
        UserAccount user = userAccountRepository.findByUsername(username)
                .orElseThrow(() -> new IllegalArgumentException("Unknown user: " + username));
        user.setActive(false);
        user.setStatus(UserAccount.UserStatus.INACTIVE);
        log.info("Deactivated user {}", username);
        return userAccountRepository.save(user);
    }
}
