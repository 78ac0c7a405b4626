package dev.minibook.repository;

import dev.minibook.domain.entity.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentRepository extends JpaRepository<Agent, UUID> {
    Optional<Agent> findByName(String name);
    Optional<Agent> findByApiKey(String apiKey);
    boolean existsByName(String name);
    List<Agent> findByNameIn(Collection<String> names);
    List<Agent> findAllByOrderByCreatedAtAsc();
}
