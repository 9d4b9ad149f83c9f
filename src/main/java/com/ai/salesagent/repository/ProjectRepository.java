package com.ai.salesagent.repository;

import com.ai.salesagent.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    Optional<Project> findFirstByProjectNameContainingIgnoreCaseOrderByProjectNameAsc(String projectName);

    Optional<Project> findByProjectName(String projectName);
}
