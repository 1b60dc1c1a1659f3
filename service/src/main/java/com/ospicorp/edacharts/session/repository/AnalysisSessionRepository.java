package com.ospicorp.edacharts.session.repository;

import com.ospicorp.edacharts.session.model.AnalysisSession;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AnalysisSessionRepository extends JpaRepository<AnalysisSession, UUID> {

  List<AnalysisSession> findAllByOrderByUploadedAtDesc();

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM AnalysisSession s WHERE s.sessionId = :id")
  Optional<AnalysisSession> findByIdForUpdate(@Param("id") UUID id);
}
