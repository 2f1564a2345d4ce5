package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.JournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface JournalEntryRepository extends JpaRepository<JournalEntry, String> {

    List<JournalEntry> findAllByOrderByCreatedAtDesc();

    List<JournalEntry> findBySkillIdOrderByCreatedAtDesc(String skillId);

    /** [skillId 或 null, 最近一次活動時間] */
    @Query("SELECT j.skillId, MAX(COALESCE(j.editedAt, j.createdAt)) FROM JournalEntry j GROUP BY j.skillId")
    List<Object[]> findLastActivityPerSkill();
}
