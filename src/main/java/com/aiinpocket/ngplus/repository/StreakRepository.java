package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Streak;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StreakRepository extends JpaRepository<Streak, String> {

    Optional<Streak> findFirstBySkillIdIsNull();

    Optional<Streak> findFirstBySkillId(String skillId);

    List<Streak> findBySkillIdIsNotNullOrderByCreatedAtAsc();

    List<Streak> findAllByOrderByCreatedAtAsc();
}
