package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Reward;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RewardRepository extends JpaRepository<Reward, String> {

    List<Reward> findByArchivedFalseOrderByPriceCoinsAsc();

    List<Reward> findAllByOrderByCreatedAtAsc();
}
