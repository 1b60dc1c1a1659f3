package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartRecord;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class GenerationDeduplicator {

  public Partition partition(Collection<ChartSpec> requested, List<ChartRecord> existing) {
    Set<ChartSpec> distinct = new LinkedHashSet<>(requested);

    Set<ChartSpec> existingSpecs = new HashSet<>(existing.size() * 2);
    for (ChartRecord record : existing) {
      existingSpecs.add(record.spec());
    }

    Set<ChartSpec> alreadyPresent = new LinkedHashSet<>();
    Set<ChartSpec> toGenerate = new LinkedHashSet<>();
    for (ChartSpec spec : distinct) {
      if (existingSpecs.contains(spec)) {
        alreadyPresent.add(spec);
      } else {
        toGenerate.add(spec);
      }
    }
    return new Partition(Collections.unmodifiableSet(alreadyPresent),
        Collections.unmodifiableSet(toGenerate));
  }

  public record Partition(Set<ChartSpec> alreadyPresent, Set<ChartSpec> toGenerate) {

    public boolean nothingToGenerate() {
      return toGenerate.isEmpty();
    }
  }
}
