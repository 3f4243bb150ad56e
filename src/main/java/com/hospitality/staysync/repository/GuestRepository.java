package com.hospitality.staysync.repository;

import com.hospitality.staysync.entity.Guest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GuestRepository extends JpaRepository<Guest, Long> {

    /**
     * Exact phone match. Phone is unique, so at most one guest comes back.
     */
    Optional<Guest> findByPhone(String phone);
}
