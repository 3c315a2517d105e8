package org.rostilos.prwizard.core.persistence.repository.annotation;

import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PendingAnnotationRepository extends JpaRepository<PendingAnnotation, String> {

    Optional<PendingAnnotation> findByCode(String code);

    @Query("SELECT a FROM PendingAnnotation a WHERE a.expiresAt <= :now ORDER BY a.expiresAt ASC")
    List<PendingAnnotation> findExpired(@Param("now") long nowEpochSeconds);

    @Modifying
    @Query("DELETE FROM PendingAnnotation a WHERE a.code = :code")
    int deleteByCode(@Param("code") String code);
}
