package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.TimeCapsule;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TimeCapsuleRepository extends JpaRepository<TimeCapsule, String> {

    List<TimeCapsule> findByUnlockedAtIsNull();

    List<TimeCapsule> findByUnlockedAtIsNullAndUnlockType(UnlockType unlockType);

    List<TimeCapsule> findAllByOrderByCreatedAtAsc();
}
