package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Mission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MissionRepository extends JpaRepository<Mission, String> {

    /** 指派給該技能且未封存的任務，依 id 排序（目標抽選依賴此順序） */
    @Query("SELECT m FROM Mission m JOIN m.skillIds s " +
            "WHERE s = :skillId AND m.archived = false ORDER BY m.id")
    List<Mission> findAssignedToSkill(@Param("skillId") String skillId);

    @Query("SELECT COUNT(m) FROM Mission m JOIN m.skillIds s " +
            "WHERE s = :skillId AND m.archived = false")
    long countAssignedToSkill(@Param("skillId") String skillId);

    List<Mission> findByArchivedFalseOrderByCreatedAtAsc();

    List<Mission> findAllByOrderByCreatedAtAsc();
}
