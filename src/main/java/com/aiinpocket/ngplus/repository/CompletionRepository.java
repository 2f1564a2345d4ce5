package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Completion;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface CompletionRepository extends JpaRepository<Completion, String> {

    /** (任務, 技能, 週期) 是否已有週期獎勵 */
    @Query("SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END FROM Completion c JOIN c.awards a " +
            "WHERE c.missionId = :missionId AND a.skillId = :skillId " +
            "AND a.cycleId = :cycleId AND a.cycleAward = true")
    boolean existsCycleAward(@Param("missionId") String missionId,
                             @Param("skillId") String skillId,
                             @Param("cycleId") String cycleId);

    long countByReflectionTokenTrueAndCompletedAtGreaterThanEqualAndCompletedAtLessThan(Instant from, Instant to);

    @Query("SELECT COUNT(DISTINCT c.id) FROM Completion c JOIN c.awards a " +
            "WHERE c.reflectionToken = true AND a.skillId = :skillId AND a.cycleId = :cycleId")
    long countReflectionTokensInCycle(@Param("skillId") String skillId, @Param("cycleId") String cycleId);

    boolean existsByMissionId(String missionId);

    boolean existsByMissionIdAndCompletedAtAfter(String missionId, Instant after);

    List<Completion> findByCompletedAtGreaterThanEqualOrderByCompletedAtDesc(Instant from, Pageable page);

    List<Completion> findAllByOrderByCompletedAtAsc();

    List<Completion> findTop50ByOrderByCompletedAtDesc();

    long countByCompletedAtGreaterThanEqual(Instant from);

    @Query("SELECT COUNT(DISTINCT c.id) FROM Completion c JOIN c.awards a " +
            "WHERE a.skillId = :skillId AND c.completedAt >= :from")
    long countForSkillSince(@Param("skillId") String skillId, @Param("from") Instant from);

    /** 單一技能週期內的 [missionId, 完成次數] */
    @Query("SELECT c.missionId, COUNT(DISTINCT c.id) FROM Completion c JOIN c.awards a " +
            "WHERE a.skillId = :skillId AND a.cycleId = :cycleId GROUP BY c.missionId")
    List<Object[]> countPerMissionInCycle(@Param("skillId") String skillId, @Param("cycleId") String cycleId);

    /** [skillId, 最近一次 completedAt] */
    @Query("SELECT a.skillId, MAX(c.completedAt) FROM Completion c JOIN c.awards a GROUP BY a.skillId")
    List<Object[]> findLastCompletionPerSkill();
}
