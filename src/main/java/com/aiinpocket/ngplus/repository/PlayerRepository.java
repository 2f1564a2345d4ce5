package com.aiinpocket.ngplus.repository;

import com.aiinpocket.ngplus.model.entity.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, String> {

    Optional<Player> findFirstByOrderByCreatedAtAsc();
}
