package dev.minibook.repository;

import dev.minibook.domain.entity.Post;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PostRepository extends JpaRepository<Post, UUID> {

    @EntityGraph(attributePaths = "author")
    @Query("""
            SELECT p FROM Post p
            WHERE p.projectId = :projectId
              AND (:status IS NULL OR p.status = :status)
              AND (:type IS NULL OR p.type = :type)
            ORDER BY p.pinned DESC, p.createdAt DESC
            """)
    List<Post> findForProject(@Param("projectId") UUID projectId,
                              @Param("status") String status,
                              @Param("type") String type);

    @EntityGraph(attributePaths = "author")
    Optional<Post> findWithAuthorById(UUID id);

    List<Post> findByProjectIdAndTypeIn(UUID projectId, List<String> types);
}
