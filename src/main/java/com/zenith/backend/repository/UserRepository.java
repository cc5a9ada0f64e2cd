package com.zenith.backend.repository;

import com.zenith.backend.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    Optional<User> findBySessionToken(String sessionToken);

    boolean existsByUsername(String username);

    /**
     * Debits the balance only when it covers the amount. Returns the number of rows touched,
     * so 0 means the funds were not there at the time of the update.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.balance = u.balance - :amount WHERE u.id = :userId AND u.balance >= :amount")
    int debitIfSufficient(@Param("userId") Long userId, @Param("amount") BigDecimal amount);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.balance = u.balance + :amount WHERE u.id = :userId")
    int credit(@Param("userId") Long userId, @Param("amount") BigDecimal amount);

    /**
     * Sets the starting balance and marks the user onboarded, but only the first time.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.balance = :balance, u.onboarded = true WHERE u.id = :userId AND u.onboarded = false")
    int setStartingBalance(@Param("userId") Long userId, @Param("balance") BigDecimal balance);

    @Query("SELECT u.balance FROM User u WHERE u.id = :userId")
    Optional<BigDecimal> findBalanceById(@Param("userId") Long userId);
}
