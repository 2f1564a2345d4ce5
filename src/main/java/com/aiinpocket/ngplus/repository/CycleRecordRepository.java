package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.CycleRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CycleRecordRepository extends JpaRepository<CycleRecord, String> {

    boolean existsByCycleId(String cycleId);

    List<CycleRecord> findBySkillIdOrderByCycleStartDesc(String skillId);

    List<CycleRecord> findAllByOrderByCycleStartAsc();
}
