package com.hospitality.staysync.repository;

import com.hospitality.staysync.entity.Stay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Stay entities, keyed for reconciliation on the vendor reservation id.
 */
@Repository
public interface StayRepository extends JpaRepository<Stay, Long> {

    Optional<Stay> findByPmsReservationId(String pmsReservationId);
}
