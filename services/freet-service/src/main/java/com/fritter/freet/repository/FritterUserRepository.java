package com.fritter.freet.repository;

import com.fritter.freet.domain.FritterUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FritterUserRepository extends JpaRepository<FritterUser, UUID> {

    Optional<FritterUser> findByUsername(String username);
}
