package com.example.coldchain.notification;

import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.domain.UserAccount.Role;
import com.example.coldchain.repository.UserAccountRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecipientResolverTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @InjectMocks
    private RecipientResolver resolver;

    private static UserAccount user(long id, Role role, String email, String phone) {
        return UserAccount.builder().id(id).username("u" + id).role(role).email(email).phone(phone).build();
    }

    @Test
    void levelMapsToRole() {
        assertEquals(Role.OPERATOR, RecipientResolver.roleForLevel(1));
        assertEquals(Role.MANAGER, RecipientResolver.roleForLevel(2));
        assertEquals(Role.ADMIN, RecipientResolver.roleForLevel(3));
        assertEquals(Role.ADMIN, RecipientResolver.roleForLevel(7));
        assertEquals(Role.OPERATOR, RecipientResolver.roleForLevel(0));
    }

    @Test
    void cumulativeRolesGrowWithLevel() {
        assertEquals(List.of(Role.OPERATOR), RecipientResolver.rolesUpToLevel(1));
        assertEquals(List.of(Role.OPERATOR, Role.MANAGER), RecipientResolver.rolesUpToLevel(2));
        assertEquals(List.of(Role.OPERATOR, Role.MANAGER, Role.ADMIN), RecipientResolver.rolesUpToLevel(3));
    }

    @Test
    void levelTwoSkipsUnreachableUsersAndDedupes() {
        UserAccount op = user(1, Role.OPERATOR, "op@x.test", "+33600000001");
        UserAccount mgrNoEmail = user(2, Role.MANAGER, "", null);
        UserAccount mgr = user(3, Role.MANAGER, "mgr@x.test", null);
        when(userAccountRepository.findByActiveTrueAndStatusAndRoleInOrderByIdAsc(
                eq(UserAccount.UserStatus.ACTIVE), eq(List.of(Role.OPERATOR, Role.MANAGER))))
                .thenReturn(List.of(op, mgrNoEmail, mgr, op));

        List<UserAccount> recipients = resolver.recipientsForLevel(2);

        assertEquals(List.of(1L, 3L), recipients.stream().map(UserAccount::getId).toList());
    }

    @Test
    void phoneOnlyUserIsARecipient() {
        UserAccount emailOnly = user(1, Role.OPERATOR, "op@x.test", null);
        UserAccount phoneOnly = user(2, Role.OPERATOR, null, "+33600000002");
        when(userAccountRepository.findByActiveTrueAndStatusAndRoleInOrderByIdAsc(
                UserAccount.UserStatus.ACTIVE, List.of(Role.OPERATOR)))
                .thenReturn(List.of(emailOnly, phoneOnly));

        List<UserAccount> recipients = resolver.recipientsForLevel(1);

        assertEquals(List.of(1L, 2L), recipients.stream().map(UserAccount::getId).toList());
        assertEquals(List.of("33600000002"), resolver.phoneNumbers(recipients));
    }

    @Test
    void exactRoleQueriesSingleTier() {
        UserAccount admin = user(9, Role.ADMIN, "admin@x.test", null);
        when(userAccountRepository.findByActiveTrueAndStatusAndRoleInOrderByIdAsc(
                UserAccount.UserStatus.ACTIVE, List.of(Role.ADMIN)))
                .thenReturn(List.of(admin));

        assertEquals(List.of(admin), resolver.recipientsForRole(Role.ADMIN));
    }

    @Test
    void noMatchingUsersGivesEmptyList() {
        when(userAccountRepository.findByActiveTrueAndStatusAndRoleInOrderByIdAsc(
                UserAccount.UserStatus.ACTIVE, List.of(Role.OPERATOR)))
                .thenReturn(List.of());

        assertTrue(resolver.recipientsForLevel(1).isEmpty());
    }

    @Test
    void inactiveUsersAreNotEligible() {
        UserAccount inactive = user(4, Role.OPERATOR, "x@x.test", null);
        inactive.setActive(false);
        UserAccount suspended = user(5, Role.OPERATOR, "y@x.test", null);
        suspended.setStatus(UserAccount.UserStatus.SUSPENDED);

        assertFalse(RecipientResolver.isEligible(inactive));
        assertFalse(RecipientResolver.isEligible(suspended));
        assertTrue(RecipientResolver.isEligible(user(6, Role.OPERATOR, "z@x.test", null)));
    }

    @Test
    void phoneNumbersStripPlusAndSkipBlanks() {
        List<String> phones = resolver.phoneNumbers(List.of(
                user(1, Role.OPERATOR, "a@x.test", "+33600000001"),
                user(2, Role.MANAGER, "b@x.test", " "),
                user(3, Role.ADMIN, "c@x.test", "33600000001"),
                user(4, Role.ADMIN, "d@x.test", "15550000002")));

        assertEquals(List.of("33600000001", "15550000002"), phones);
    }
}
