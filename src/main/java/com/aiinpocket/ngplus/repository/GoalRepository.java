package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Goal;
import com.aiinpocket.ngplus.model.enums.GoalStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GoalRepository extends JpaRepository<Goal, String> {

    List<Goal> findByStatusOrderByCreatedAtAsc(GoalStatus status);

    List<Goal> findAllByOrderByCreatedAtAsc();
}
