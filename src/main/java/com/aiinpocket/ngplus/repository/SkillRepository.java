package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Skill;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SkillRepository extends JpaRepository<Skill, String> {

    List<Skill> findByArchivedFalseOrderByCreatedAtAsc();

    List<Skill> findAllByOrderByCreatedAtAsc();
}
