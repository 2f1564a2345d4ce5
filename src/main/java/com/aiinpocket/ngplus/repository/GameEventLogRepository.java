package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.GameEventLog;
import com.aiinpocket.ngplus.model.enums.GameEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface GameEventLogRepository extends JpaRepository<GameEventLog, Long> {

    List<GameEventLog> findBySeenFalseOrderByCreatedAtDesc();

    List<GameEventLog> findTop100ByOrderByCreatedAtDesc();

    long countBySeenFalse();

    @Modifying
    @Transactional
    @Query("UPDATE GameEventLog e SET e.seen = true WHERE e.seen = false")
    int markAllSeen();

    long countByEventType(GameEventType eventType);
}
