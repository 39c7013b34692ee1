package com.example.coldchain.repository;

import com.example.coldchain.domain.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByUsername(String username);

    List<UserAccount> findByActiveTrueAndStatusAndRoleInOrderByIdAsc(UserAccount.UserStatus status,
                                                                      Collection<UserAccount.Role> roles);
}
