package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProgressDefinitionRepository extends JpaRepository<ProgressDefinition, String> {
    List<ProgressDefinition> findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory category);

    List<ProgressDefinition> findByDefinitionIdIn(Collection<String> definitionIds);
}
