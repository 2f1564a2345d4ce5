package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Redemption;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RedemptionRepository extends JpaRepository<Redemption, String> {

    List<Redemption> findAllByOrderByRedeemedAtDesc();

    Optional<Redemption> findFirstByOrderByRedeemedAtDesc();

    boolean existsByRedeemedAtAfter(Instant after);
}
