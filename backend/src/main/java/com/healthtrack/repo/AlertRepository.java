package com.healthtrack.repo;

import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Every query here is scoped to one owner.
 */
public interface AlertRepository extends JpaRepository<Alert, Long>, JpaSpecificationExecutor<Alert> {

    @EntityGraph(attributePaths = "user")
    @Query("""
           SELECT a FROM Alert a
           WHERE a.id = :id AND a.user.id = :userId
           """)
    Optional<Alert> findOwned(@Param("id") Long id, @Param("userId") Long userId);

    @Override
    @EntityGraph(attributePaths = "user")
    Page<Alert> findAll(Specification<Alert> spec, Pageable pageable);

    @EntityGraph(attributePaths = "user")
    @Query("""
           SELECT a FROM Alert a
           WHERE a.user.id = :userId AND a.status = :status
           """)
    List<Alert> findByOwnerAndStatus(@Param("userId") Long userId,
                                     @Param("status") AlertStatus status,
                                     Sort sort);

    @Query("""
           SELECT a.status, COUNT(a) FROM Alert a
           WHERE a.user.id = :userId
           GROUP BY a.status
           """)
    List<Object[]> countByStatus(@Param("userId") Long userId);

    @Query("""
           SELECT a.priority, COUNT(a) FROM Alert a
           WHERE a.user.id = :userId
           GROUP BY a.priority
           """)
    List<Object[]> countByPriority(@Param("userId") Long userId);

    @Query("SELECT COUNT(a) FROM Alert a WHERE a.user.id = :userId")
    long countOwned(@Param("userId") Long userId);

    @Query("SELECT COUNT(a) FROM Alert a WHERE a.user.id = :userId AND a.status = :status")
    long countOwnedWithStatus(@Param("userId") Long userId, @Param("status") AlertStatus status);
}
