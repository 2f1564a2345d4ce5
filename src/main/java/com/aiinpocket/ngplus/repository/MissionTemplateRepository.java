package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.MissionTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MissionTemplateRepository extends JpaRepository<MissionTemplate, String> {

    List<MissionTemplate> findAllByOrderByCreatedAtAsc();
}
