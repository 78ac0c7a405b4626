package dev.minibook.mention;

import dev.minibook.domain.entity.Agent;
import dev.minibook.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps only the handles that name a registered agent (exact, case-sensitive).
 * Unknown handles are dropped, never reported as errors.
 */
@Component
public class MentionValidator {

    private static final Logger log = LoggerFactory.getLogger(MentionValidator.class);

    private final AgentRepository agentRepository;

    public MentionValidator(AgentRepository agentRepository) {
        this.agentRepository = agentRepository;
    }

    public Set<String> validate(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Set.of();
        }
        Set<String> known = agentRepository.findByNameIn(Set.copyOf(candidates)).stream()
                .map(Agent::getName)
                .collect(Collectors.toSet());
        Set<String> confirmed = new LinkedHashSet<>();
        for (String candidate : candidates) {
            // the database collation may be case-insensitive; the match must not be
            if (known.contains(candidate)) {
                confirmed.add(candidate);
            }
        }
        if (confirmed.size() < candidates.size()) {
            log.debug("Dropped unknown mentions: {} of {}", candidates.size() - confirmed.size(), candidates.size());
        }
        return confirmed;
    }
}
