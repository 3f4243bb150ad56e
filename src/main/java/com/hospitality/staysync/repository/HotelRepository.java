package com.hospitality.staysync.repository;

import com.hospitality.staysync.entity.Hotel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface HotelRepository extends JpaRepository<Hotel, Long> {

    Optional<Hotel> findByPmsHotelId(String pmsHotelId);
}
