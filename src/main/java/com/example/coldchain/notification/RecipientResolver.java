package com.example.coldchain.notification;

import com.example.coldchain.config.MonitoringConfig;
import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.domain.UserAccount.Role;
import com.example.coldchain.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps an escalation level to the users who should hear about it.
 *
 * Cumulative mode is what escalation uses: level 2 still reaches operators,
 * level 3 reaches everyone. Exact mode addresses a single tier.
 * Results are deduplicated and sorted by user id and include users who can
 * only be called; each channel picks the addresses it can use. Read-only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientResolver {

    private final UserAccountRepository userAccountRepository;

    public static Role roleForLevel(int level) {
        if (level <= 1) return Role.OPERATOR;
        if (level == 2) return Role.MANAGER;
        return Role.ADMIN;
    }

    public static List<Role> rolesUpToLevel(int level) {
        int top = Math.min(Math.max(level, 1), MonitoringConfig.MAX_LEVEL);
        List<Role> roles = new ArrayList<>(top);
        for (int l = 1; l <= top; l++) {
            roles.add(roleForLevel(l));
        }
        return roles;
    }

    /** Cumulative recipients: every tier from OPERATOR up to the level's role. */
    public List<UserAccount> recipientsForLevel(int level) {
        return eligible(rolesUpToLevel(level));
    }

    /** Exact recipients: only users holding {@code role}. */
    public List<UserAccount> recipientsForRole(Role role) {
        return eligible(List.of(role));
    }

    /**
     * Phone numbers of the eligible users, without a leading '+'.
     */
    public List<String> phoneNumbers(List<UserAccount> recipients) {
        List<String> phones = new ArrayList<>();
        for (UserAccount user : recipients) {
            String phone = user.getPhone();
            if (!hasText(phone)) continue;
            String normalized = phone.trim().replaceFirst("^\\+", "");
            if (!phones.contains(normalized)) phones.add(normalized);
        }
        return phones;
    }

    private List<UserAccount> eligible(Collection<Role> roles) {
        List<UserAccount> candidates = userAccountRepository
                .findByActiveTrueAndStatusAndRoleInOrderByIdAsc(UserAccount.UserStatus.ACTIVE, roles);

        Map<Long, UserAccount> byId = new TreeMap<>();
        for (UserAccount user : candidates) {
            if (!isEligible(user)) continue;
            byId.putIfAbsent(user.getId(), user);
        }
        log.debug("Resolved {} recipient(s) for roles {}", byId.size(), roles);
        return new ArrayList<>(byId.values());
    }

    /** Active users reachable by email, by phone, or both. */
    static boolean isEligible(UserAccount user) {
        return user.isActive()
                && user.getStatus() == UserAccount.UserStatus.ACTIVE
                && (hasText(user.getEmail()) || hasText(user.getPhone()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
