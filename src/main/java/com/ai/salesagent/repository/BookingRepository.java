package com.ai.salesagent.repository;

import com.ai.salesagent.entity.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BookingRepository extends JpaRepository<Booking, UUID> {

    Optional<Booking> findFirstByLeadIdAndProjectIdAndStatusNot(UUID leadId, UUID projectId, Booking.Status status);

    List<Booking> findByLeadIdOrderByCreatedAtDesc(UUID leadId);
}
