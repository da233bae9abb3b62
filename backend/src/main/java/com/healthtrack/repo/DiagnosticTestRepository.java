package com.healthtrack.repo;

import com.healthtrack.model.DiagnosticTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DiagnosticTestRepository extends JpaRepository<DiagnosticTest, Long>,
        JpaSpecificationExecutor<DiagnosticTest> {

    @EntityGraph(attributePaths = "user")
    @Query("""
           SELECT t FROM DiagnosticTest t
           WHERE t.id = :id AND t.user.id = :userId
           """)
    Optional<DiagnosticTest> findOwned(@Param("id") Long id, @Param("userId") Long userId);

    @Override
    @EntityGraph(attributePaths = "user")
    Page<DiagnosticTest> findAll(Specification<DiagnosticTest> spec, Pageable pageable);

    @EntityGraph(attributePaths = "user")
    @Query("""
           SELECT t FROM DiagnosticTest t
           WHERE t.user.id = :userId AND t.date >= :since
           """)
    List<DiagnosticTest> findOwnedSince(@Param("userId") Long userId,
                                        @Param("since") LocalDate since,
                                        Sort sort);

    @EntityGraph(attributePaths = "user")
    @Query("""
           SELECT t FROM DiagnosticTest t
           WHERE t.user.id = :userId AND t.abnormal = true
           """)
    List<DiagnosticTest> findOwnedAbnormal(@Param("userId") Long userId, Sort sort);

    @Query("""
           SELECT t.status, COUNT(t) FROM DiagnosticTest t
           WHERE t.user.id = :userId
           GROUP BY t.status
           """)
    List<Object[]> countByStatus(@Param("userId") Long userId);

    @Query("""
           SELECT t.testType, COUNT(t) FROM DiagnosticTest t
           WHERE t.user.id = :userId
           GROUP BY t.testType
           """)
    List<Object[]> countByTestType(@Param("userId") Long userId);

    @Query("SELECT COUNT(t) FROM DiagnosticTest t WHERE t.user.id = :userId AND t.abnormal = true")
    long countOwnedAbnormal(@Param("userId") Long userId);

    @Query("SELECT COUNT(t) FROM DiagnosticTest t WHERE t.user.id = :userId AND t.date >= :since")
    long countOwnedSince(@Param("userId") Long userId, @Param("since") LocalDate since);

    @Query("SELECT COUNT(t) FROM DiagnosticTest t WHERE t.user.id = :userId")
    long countOwned(@Param("userId") Long userId);
}
