package com.ospicorp.edacharts.chart.repository;

import com.ospicorp.edacharts.chart.model.ChartRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChartRecordRepository extends JpaRepository<ChartRecord, Long> {

  List<ChartRecord> findBySessionIdOrderByIdAsc(UUID sessionId);

  Optional<ChartRecord> findByIdAndSessionId(Long id, UUID sessionId);

  boolean existsBySessionIdAndDedupKey(UUID sessionId, String dedupKey);
}
